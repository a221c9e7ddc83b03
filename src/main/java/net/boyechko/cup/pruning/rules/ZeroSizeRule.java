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

import net.boyechko.cup.pruning.Disposition;
import net.boyechko.cup.pruning.PruneContext;
import net.boyechko.cup.pruning.PruneRule;
import net.boyechko.cup.tree.Bounds;

/** Drops elements with zero width or height; they are not rendered on screen. */
public class ZeroSizeRule implements PruneRule {

    @Override
    public String name() {
        return "Zero Size";
    }

    @Override
    public String description() {
        return "Elements without area are not rendered";
    }

    @Override
    public Disposition evaluate(PruneContext ctx) {
        Bounds bounds = ctx.node().bounds();
        return bounds != null && bounds.isZeroSize() ? Disposition.DROP : Disposition.KEEP;
    }
}
