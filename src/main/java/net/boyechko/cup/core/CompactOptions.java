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

import java.util.Objects;
import net.boyechko.cup.pruning.DetailLevel;
import net.boyechko.cup.tree.TreeDepth;

/**
 * Options for one serialization.
 *
 * @param detailLevel how aggressively to prune
 * @param maxDepth deepest node level accepted before the tree is rejected as malformed
 */
public record CompactOptions(DetailLevel detailLevel, int maxDepth) {

    public CompactOptions {
        Objects.requireNonNull(detailLevel, "detailLevel");
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be positive, got " + maxDepth);
        }
    }

    public static CompactOptions defaults() {
        return new CompactOptions(DetailLevel.COMPACT, TreeDepth.DEFAULT_LIMIT);
    }

    public static CompactOptions of(DetailLevel detailLevel) {
        return defaults().withDetailLevel(detailLevel);
    }

    public CompactOptions withDetailLevel(DetailLevel newDetailLevel) {
        return new CompactOptions(newDetailLevel, maxDepth);
    }

    public CompactOptions withMaxDepth(int newMaxDepth) {
        return new CompactOptions(detailLevel, newMaxDepth);
    }
}
