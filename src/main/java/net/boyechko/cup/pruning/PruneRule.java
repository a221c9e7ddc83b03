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
import net.boyechko.cup.tree.Node;

/**
 * A single pruning rule. Rules are consulted in order for each node once its children have been
 * resolved; the first rule that returns something other than {@link Disposition#KEEP} decides the
 * node's fate.
 */
public interface PruneRule {

    String name();

    String description();

    default Disposition evaluate(PruneContext ctx) {
        return Disposition.KEEP;
    }

    /**
     * Decides whether a surviving child is redundant given its parent and all of its surviving
     * siblings. Called after the parent's child list has been assembled.
     */
    default boolean isRedundantChild(Node parent, List<Node> survivingChildren, Node child) {
        return false;
    }
}
