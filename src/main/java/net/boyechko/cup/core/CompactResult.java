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
package net.boyechko.cup.core;

import java.util.List;
import net.boyechko.cup.pruning.PruneResult;
import net.boyechko.cup.pruning.PruneStats;
import net.boyechko.cup.tree.Node;

/**
 * Output of one serialization: the compact text and the pruned tree it was rendered from.
 *
 * @param text header, blank line and body, ending with a newline
 * @param pruning pruned tree, counts and the index of the captured tree
 */
public record CompactResult(String text, PruneResult pruning) {

    public List<Node> tree() {
        return pruning.tree();
    }

    public PruneStats stats() {
        return pruning.stats();
    }
}
