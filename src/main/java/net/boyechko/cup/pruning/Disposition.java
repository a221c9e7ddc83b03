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

/** What a {@link PruneRule} decides for a node whose children are already resolved. */
public enum Disposition {
    /** The rule does not apply; later rules are consulted. */
    KEEP,

    /** Remove the node together with its subtree. */
    DROP,

    /** Remove the node and splice its resolved children into the parent in its place. */
    HOIST,

    /** Replace the node with its only resolved child. */
    COLLAPSE
}
