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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * One captured UI element and its subtree.
 *
 * <p>Nodes are immutable: every collection is copied on construction and exposed read-only, so a
 * rewrite always produces new structure and the captured tree stays intact. The {@code id} is
 * assigned by the capture layer and carried through every transformation verbatim.
 *
 * @param id opaque identifier, unique within one capture
 * @param role canonical role name, or an unrecognized role passed through as captured
 * @param name accessible label; empty when the element has none
 * @param bounds screen rectangle in physical pixels, or null when not reported
 * @param states active state flags, in capture order
 * @param actions supported action verbs, in capture order
 * @param value current value, or null
 * @param attributes sparse raw attributes ({@code level}, {@code placeholder}, {@code
 *     orientation}, {@code valueMin}, {@code valueMax})
 * @param children child nodes in document order
 * @param platform native properties, carried through without interpretation
 */
public record Node(
        String id,
        String role,
        String name,
        Bounds bounds,
        Set<String> states,
        Set<String> actions,
        String value,
        Map<String, Object> attributes,
        List<Node> children,
        Map<String, Object> platform) {

    /** The focus verb. Every focusable element supports it, so it carries no information. */
    public static final String FOCUS_ACTION = "focus";

    public static final String OFFSCREEN_STATE = "offscreen";

    public Node {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(role, "role");
        name = name != null ? name : "";
        states = copyOf(states);
        actions = copyOf(actions);
        attributes = copyOf(attributes);
        children = children != null ? List.copyOf(children) : List.of();
        platform = copyOf(platform);
    }

    public static Builder builder(String id, String role) {
        return new Builder(id, role);
    }

    public boolean hasName() {
        return !name.isEmpty();
    }

    public boolean hasRole(String roleName) {
        return role.equals(roleName);
    }

    public boolean hasState(String state) {
        return states.contains(state);
    }

    public boolean hasAction(String action) {
        return actions.contains(action);
    }

    /** Returns true if the node supports any action other than focus. */
    public boolean hasMeaningfulAction() {
        for (String action : actions) {
            if (!FOCUS_ACTION.equals(action)) {
                return true;
            }
        }
        return false;
    }

    public boolean isLeaf() {
        return children.isEmpty();
    }

    /** Returns a copy of this node with the given children, all other fields unchanged. */
    public Node withChildren(List<Node> newChildren) {
        return new Node(
                id, role, name, bounds, states, actions, value, attributes, newChildren, platform);
    }

    /** Returns a copy of this node without the given action; returns this node if absent. */
    public Node withoutAction(String action) {
        if (!actions.contains(action)) {
            return this;
        }
        Set<String> remaining = new LinkedHashSet<>(actions);
        remaining.remove(action);
        return new Node(
                id, role, name, bounds, states, remaining, value, attributes, children, platform);
    }

    /** Returns a copy of this node with no children, as used for search results. */
    public Node detached() {
        return isLeaf() ? this : withChildren(List.of());
    }

    private static Set<String> copyOf(Collection<String> source) {
        if (source == null || source.isEmpty()) {
            return Set.of();
        }
        return Collections.unmodifiableSet(new LinkedHashSet<>(source));
    }

    private static Map<String, Object> copyOf(Map<String, Object> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }

    /** Mutable builder, mostly for capture adapters and tests. */
    public static final class Builder {
        private final String id;
        private final String role;
        private String name = "";
        private Bounds bounds;
        private final Set<String> states = new LinkedHashSet<>();
        private final Set<String> actions = new LinkedHashSet<>();
        private String value;
        private final Map<String, Object> attributes = new LinkedHashMap<>();
        private final List<Node> children = new ArrayList<>();
        private final Map<String, Object> platform = new LinkedHashMap<>();

        private Builder(String id, String role) {
            this.id = id;
            this.role = role;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder bounds(int x, int y, int width, int height) {
            this.bounds = new Bounds(x, y, width, height);
            return this;
        }

        public Builder bounds(Bounds bounds) {
            this.bounds = bounds;
            return this;
        }

        public Builder states(String... states) {
            Collections.addAll(this.states, states);
            return this;
        }

        public Builder actions(String... actions) {
            Collections.addAll(this.actions, actions);
            return this;
        }

        public Builder value(String value) {
            this.value = value;
            return this;
        }

        public Builder attribute(String key, Object attributeValue) {
            attributes.put(key, attributeValue);
            return this;
        }

        public Builder child(Node child) {
            children.add(child);
            return this;
        }

        public Builder children(Node... children) {
            Collections.addAll(this.children, children);
            return this;
        }

        public Builder children(List<Node> children) {
            this.children.addAll(children);
            return this;
        }

        public Builder platform(String key, Object platformValue) {
            platform.put(key, platformValue);
            return this;
        }

        public Node build() {
            return new Node(
                    id, role, name, bounds, states, actions, value, attributes, children, platform);
        }
    }
}
