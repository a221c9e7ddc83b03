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
package net.boyechko.cup.pruning;

import java.util.List;
import java.util.Set;
import net.boyechko.cup.tree.Node;

/**
 * Immutable context passed to rules while pruning. Holds the node as captured together with its
 * children as they stand after pruning, since several rules look at the surviving children rather
 * than the captured ones.
 */
public record PruneContext(
        Node node,
        /** Children after pruning and hoisting, in document order. */
        List<Node> children,
        /** Index path from the top of the tree. */
        List<Integer> path,
        /** Depth in the tree (0 = root). */
        int depth) {

    public boolean isRoot() {
        return depth == 0;
    }

    public String role() {
        return node.role();
    }

    public boolean hasRole(String roleName) {
        return node.hasRole(roleName);
    }

    public boolean hasAnyRole(Set<String> roleNames) {
        return roleNames.contains(node.role());
    }

    public boolean hasName() {
        return node.hasName();
    }

    /** Meaningful actions are judged on the captured action set, before focus is stripped. */
    public boolean hasMeaningfulAction() {
        return node.hasMeaningfulAction();
    }

    public int survivingChildCount() {
        return children.size();
    }
}
