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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/** Finds nodes matching a {@link NodeQuery}, usually in a pruned tree. */
public final class TreeSearch {
    private TreeSearch() {}

    /**
     * Returns matching nodes in pre-order. Each result is detached from its children so that a
     * match on a container does not drag its whole subtree along.
     */
    public static List<Node> find(List<Node> roots, NodeQuery query) {
        List<Node> matches = new ArrayList<>();
        Deque<Node> stack = new ArrayDeque<>();
        for (int i = roots.size() - 1; i >= 0; i--) {
            stack.push(roots.get(i));
        }
        while (!stack.isEmpty()) {
            Node node = stack.pop();
            if (query.matches(node)) {
                matches.add(node.detached());
            }
            List<Node> children = node.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
        return matches;
    }

    /** Returns the first match in pre-order, or null if nothing matches. */
    public static Node findFirst(List<Node> roots, NodeQuery query) {
        List<Node> matches = find(roots, query);
        return matches.isEmpty() ? null : matches.get(0);
    }
}
