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
import net.boyechko.cup.pruning.rules.ChromeRoleRule;
import net.boyechko.cup.pruning.rules.EmptyTextRule;
import net.boyechko.cup.pruning.rules.OffscreenRule;
import net.boyechko.cup.pruning.rules.RedundantTextLabelRule;
import net.boyechko.cup.pruning.rules.SingleChildCollapseRule;
import net.boyechko.cup.pruning.rules.StructuralWrapperRule;
import net.boyechko.cup.pruning.rules.UnnamedImageRule;
import net.boyechko.cup.pruning.rules.ZeroSizeRule;

public final class PruningDefaults {
    private PruningDefaults() {}

    /** The compact rule set, in evaluation order. */
    public static List<PruneRule> rules() {
        return List.of(
                new ChromeRoleRule(),
                new ZeroSizeRule(),
                new StructuralWrapperRule(),
                new UnnamedImageRule(),
                new EmptyTextRule(),
                new RedundantTextLabelRule(),
                new OffscreenRule(),
                new SingleChildCollapseRule());
    }
}
