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

public class EmptyTextRule implements PruneRule {

    @Override
    public String name() {
        return "Empty Text";
    }

    @Override
    public String description() {
        return "Text nodes without content";
    }

    @Override
    public Disposition evaluate(PruneContext ctx) {
        return ctx.hasRole("text") && !ctx.hasName() ? Disposition.DROP : Disposition.KEEP;
    }
}
