/*
 * CUP-Compact - Accessibility Tree Normalization for Computer Use
 * Copyright (C) 2025 Richard Boyechko
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published
 * by the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package net.boyechko.cup.tree;

import java.util.Locale;

/**
 * Search criteria for {@link TreeSearch}. Null criteria are ignored; the rest must all match.
 *
 * @param role exact canonical role
 * @param name case-insensitive substring of the node name
 * @param state state flag the node must carry
 */
public record NodeQuery(String role, String name, String state) {

    public static NodeQuery any() {
        return new NodeQuery(null, null, null);
    }

    public NodeQuery withRole(String newRole) {
        return new NodeQuery(newRole, name, state);
    }

    public NodeQuery withName(String newName) {
        return new NodeQuery(role, newName, state);
    }

    public NodeQuery withState(String newState) {
        return new NodeQuery(role, name, newState);
    }

    public boolean matches(Node node) {
        if (role != null && !node.hasRole(role)) {
            return false;
        }
        if (name != null
                && !node.name().toLowerCase(Locale.ROOT).contains(name.toLowerCase(Locale.ROOT))) {
            return false;
        }
        return state == null || node.hasState(state);
    }
}
