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

/** Drops images without a name; they are decorative. */
public class UnnamedImageRule implements PruneRule {

    @Override
    public String name() {
        return "Unnamed Image";
    }

    @Override
    public String description() {
        return "Images without a label are decorative";
    }

    @Override
    public Disposition evaluate(PruneContext ctx) {
        return ctx.hasRole("img") && !ctx.hasName() ? Disposition.DROP : Disposition.KEEP;
    }
}
