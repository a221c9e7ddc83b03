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
import java.util.List;

/** Depth bookkeeping shared by the recursive tree passes. */
public final class TreeDepth {
    /** Deeper than any real UI hierarchy, shallow enough to keep recursion off the stack limit. */
    public static final int DEFAULT_LIMIT = 512;

    private TreeDepth() {}

    /** Fails with a {@link MalformedTreeException} if {@code depth} exceeds {@code limit}. */
    public static void check(int depth, int limit, List<Integer> path) {
        if (depth > limit) {
            throw new MalformedTreeException(
                    path, "tree is deeper than the limit of " + limit + " levels");
        }
    }

    /** Returns a new path with {@code index} appended. */
    public static List<Integer> child(List<Integer> path, int index) {
        List<Integer> childPath = new ArrayList<>(path.size() + 1);
        childPath.addAll(path);
        childPath.add(index);
        return childPath;
    }
}
