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

import java.util.List;

/**
 * Thrown when a captured tree cannot be processed: a node lacks its {@code id} or {@code role}, a
 * field holds a value that cannot be coerced, two nodes share an ID, or the tree is deeper than
 * the configured limit.
 *
 * <p>The {@link #path()} locates the offending node as child indices from the top of the tree,
 * e.g. {@code [0, 2]} for the third child of the first root; it renders as {@code /0/2}.
 */
public class MalformedTreeException extends RuntimeException {
    private final List<Integer> path;

    public MalformedTreeException(List<Integer> path, String problem) {
        super("Malformed node at " + format(path) + ": " + problem);
        this.path = List.copyOf(path);
    }

    public List<Integer> path() {
        return path;
    }

    public String pathString() {
        return format(path);
    }

    /** Formats an index path as {@code /0/2}; the envelope itself is {@code /}. */
    public static String format(List<Integer> path) {
        if (path.isEmpty()) {
            return "/";
        }
        StringBuilder sb = new StringBuilder();
        for (Integer index : path) {
            sb.append('/').append(index);
        }
        return sb.toString();
    }
}
