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
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Maps every ID of a captured tree to its node and position.
 *
 * <p>Compact text and pruned trees refer to nodes by their original IDs; the index lets a consumer
 * go back from such an ID to the full, unpruned node. Building the index also enforces that IDs
 * are unique within the capture.
 */
public final class NodeIndex {

    /** A node and its index path from the top of the tree. */
    public record Entry(Node node, List<Integer> path) {}

    private record Pending(Node node, List<Integer> path) {}

    private final Map<String, Entry> entries;

    private NodeIndex(Map<String, Entry> entries) {
        this.entries = Collections.unmodifiableMap(entries);
    }

    /**
     * Indexes every node reachable from {@code roots}, in pre-order.
     *
     * @throws MalformedTreeException if two nodes share an ID
     */
    public static NodeIndex of(List<Node> roots) {
        Map<String, Entry> entries = new LinkedHashMap<>();
        Deque<Pending> stack = new ArrayDeque<>();
        for (int i = roots.size() - 1; i >= 0; i--) {
            stack.push(new Pending(roots.get(i), List.of(i)));
        }

        while (!stack.isEmpty()) {
            Pending current = stack.pop();
            Node node = current.node();
            Entry previous = entries.putIfAbsent(node.id(), new Entry(node, current.path()));
            if (previous != null) {
                throw new MalformedTreeException(
                        current.path(),
                        "duplicate id '"
                                + node.id()
                                + "' (first seen at "
                                + MalformedTreeException.format(previous.path())
                                + ")");
            }
            List<Node> children = node.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(new Pending(children.get(i), TreeDepth.child(current.path(), i)));
            }
        }
        return new NodeIndex(entries);
    }

    public Optional<Node> find(String id) {
        Entry entry = entries.get(id);
        return entry != null ? Optional.of(entry.node()) : Optional.empty();
    }

    public Optional<Entry> entry(String id) {
        return Optional.ofNullable(entries.get(id));
    }

    public boolean contains(String id) {
        return entries.containsKey(id);
    }

    /** Number of nodes in the indexed tree. */
    public int size() {
        return entries.size();
    }

    /** All IDs in pre-order. */
    public List<String> ids() {
        return List.copyOf(entries.keySet());
    }
}
