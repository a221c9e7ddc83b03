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

import java.util.Set;
import net.boyechko.cup.pruning.Disposition;
import net.boyechko.cup.pruning.PruneContext;
import net.boyechko.cup.pruning.PruneRule;

/**
 * Replaces an unnamed, inert landmark with its only surviving child.
 *
 * <p>Collapses one level per node. A chain of such landmarks still collapses completely, because
 * each level is resolved before its parent is evaluated.
 */
public class SingleChildCollapseRule implements PruneRule {

    static final Set<String> LANDMARK_ROLES =
            Set.of(
                    "region",
                    "document",
                    "main",
                    "complementary",
                    "navigation",
                    "search",
                    "banner",
                    "contentinfo",
                    "form");

    @Override
    public String name() {
        return "Single Child Collapse";
    }

    @Override
    public String description() {
        return "Unnamed landmarks around a single element";
    }

    @Override
    public Disposition evaluate(PruneContext ctx) {
        if (ctx.hasAnyRole(LANDMARK_ROLES)
                && !ctx.hasName()
                && !ctx.hasMeaningfulAction()
                && ctx.survivingChildCount() == 1) {
            return Disposition.COLLAPSE;
        }
        return Disposition.KEEP;
    }
}
