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
package net.boyechko.cup.pruning.rules;

import java.util.List;
import net.boyechko.cup.pruning.PruneRule;
import net.boyechko.cup.tree.Node;

/**
 * Drops a text node that is the only surviving child of a named parent. Such text is the label
 * the parent's name was computed from, e.g. the caption inside a button.
 */
public class RedundantTextLabelRule implements PruneRule {

    @Override
    public String name() {
        return "Redundant Text Label";
    }

    @Override
    public String description() {
        return "Sole text child repeats the parent's name";
    }

    @Override
    public boolean isRedundantChild(Node parent, List<Node> survivingChildren, Node child) {
        return child.hasRole("text") && survivingChildren.size() == 1 && parent.hasName();
    }
}
