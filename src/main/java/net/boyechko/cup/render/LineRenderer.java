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
package net.boyechko.cup.render;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import net.boyechko.cup.tree.Node;
import net.boyechko.cup.vocabulary.Vocabulary;

/**
 * Renders nodes as compact lines.
 *
 * <p>A line has the fields {@code [id] role "name" x,y wxh {states} [actions] val="value"
 * (attrs)}, each emitted only when it carries something. Bounds are shown only for nodes an agent
 * can act on, and the focus verb is never shown.
 */
public class LineRenderer {
    public static final int MAX_NAME_LENGTH = 80;
    public static final int MAX_VALUE_LENGTH = 120;
    public static final String INDENT = "  ";

    static final Set<String> VALUE_ROLES =
            Set.of("textbox", "searchbox", "combobox", "spinbutton", "slider");

    private final Vocabulary vocabulary;

    public LineRenderer() {
        this(Vocabulary.standard());
    }

    public LineRenderer(Vocabulary vocabulary) {
        this.vocabulary = vocabulary;
    }

    /** Formats one node without indentation and without its children. */
    public String formatNode(Node node) {
        StringBuilder line = new StringBuilder();
        line.append('[').append(node.id()).append(']');
        line.append(' ').append(vocabulary.shortRole(node.role()));

        if (node.hasName()) {
            line.append(' ').append(Format.quoted(node.name(), MAX_NAME_LENGTH));
        }

        if (node.bounds() != null && node.hasMeaningfulAction()) {
            var b = node.bounds();
            line.append(' ').append(Format.bounds(b.x(), b.y(), b.width(), b.height()));
        }

        Set<String> states = new LinkedHashSet<>();
        for (String state : node.states()) {
            states.add(vocabulary.shortState(state));
        }
        if (!states.isEmpty()) {
            line.append(" {").append(String.join(",", states)).append('}');
        }

        Set<String> actions = new LinkedHashSet<>();
        for (String action : node.actions()) {
            if (!Node.FOCUS_ACTION.equals(action)) {
                actions.add(vocabulary.shortAction(action));
            }
        }
        if (!actions.isEmpty()) {
            line.append(" [").append(String.join(",", actions)).append(']');
        }

        String value = node.value();
        if (value != null && !value.isEmpty() && VALUE_ROLES.contains(node.role())) {
            line.append(" val=").append(Format.quoted(value, MAX_VALUE_LENGTH));
        }

        CompactAttributes attributes = AttributeExtractor.extract(node);
        if (!attributes.isEmpty()) {
            line.append(' ').append(attributes.render());
        }
        return line.toString();
    }

    /** Formats one node indented for the given depth. */
    public String renderLine(Node node, int depth) {
        return INDENT.repeat(depth) + formatNode(node);
    }

    /** Renders a forest in pre-order, one line per node. */
    public List<String> renderBody(List<Node> roots) {
        record Pending(Node node, int depth) {}

        List<String> lines = new ArrayList<>();
        Deque<Pending> stack = new ArrayDeque<>();
        for (int i = roots.size() - 1; i >= 0; i--) {
            stack.push(new Pending(roots.get(i), 0));
        }
        while (!stack.isEmpty()) {
            Pending next = stack.pop();
            lines.add(renderLine(next.node(), next.depth()));
            List<Node> children = next.node().children();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(new Pending(children.get(i), next.depth() + 1));
            }
        }
        return lines;
    }
}
