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
import net.boyechko.cup.tree.Node;

/**
 * Drops offscreen elements that cannot be acted on. Offscreen elements with an action stay, so an
 * agent can still find controls it has to scroll to.
 */
public class OffscreenRule implements PruneRule {

    @Override
    public String name() {
        return "Offscreen";
    }

    @Override
    public String description() {
        return "Offscreen content without actions";
    }

    @Override
    public Disposition evaluate(PruneContext ctx) {
        if (ctx.node().hasState(Node.OFFSCREEN_STATE) && !ctx.hasMeaningfulAction()) {
            return Disposition.DROP;
        }
        return Disposition.KEEP;
    }
}
