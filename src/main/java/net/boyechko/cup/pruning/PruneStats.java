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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Node counts around one pruning pass.
 *
 * @param before every node in the captured tree, including nodes that were dropped
 * @param after every node in the pruned tree
 * @param ruleHits how many times each rule fired, keyed by rule name, in rule order
 */
public record PruneStats(int before, int after, Map<String, Integer> ruleHits) {

    public PruneStats {
        ruleHits = Collections.unmodifiableMap(new LinkedHashMap<>(ruleHits));
    }

    public static PruneStats unchanged(int count) {
        return new PruneStats(count, count, Map.of());
    }

    public int removed() {
        return before - after;
    }

    public boolean prunedAnything() {
        return after < before;
    }

    public int hits(String ruleName) {
        return ruleHits.getOrDefault(ruleName, 0);
    }
}
