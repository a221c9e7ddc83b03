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
import java.util.Optional;
import net.boyechko.cup.tree.Node;
import net.boyechko.cup.tree.NodeIndex;

/**
 * Output of {@link PruningEngine#prune}: the pruned roots, their counts, and an index over the
 * captured tree so pruned IDs can be resolved back to full node detail.
 */
public record PruneResult(
        List<Node> tree, PruneStats stats, DetailLevel detailLevel, NodeIndex source) {

    public PruneResult {
        tree = List.copyOf(tree);
    }

    /** Returns the captured (unpruned) node with the given ID. */
    public Optional<Node> original(String id) {
        return source.find(id);
    }
}
