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
 * Hoists the children of unnamed generic, region and group wrappers into the parent.
 *
 * <p>Some platforms use group for both semantic and purely structural containers, so a group is
 * only treated as a wrapper when it offers no action besides focus.
 */
public class StructuralWrapperRule implements PruneRule {

    static final Set<String> WRAPPER_ROLES = Set.of("generic", "region", "group");

    @Override
    public String name() {
        return "Structural Wrapper";
    }

    @Override
    public String description() {
        return "Unnamed wrappers add nesting without meaning";
    }

    @Override
    public Disposition evaluate(PruneContext ctx) {
        if (!ctx.hasAnyRole(WRAPPER_ROLES) || ctx.hasName()) {
            return Disposition.KEEP;
        }
        if (ctx.hasRole("group") && ctx.hasMeaningfulAction()) {
            return Disposition.KEEP;
        }
        return Disposition.HOIST;
    }
}
