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

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * How much of a captured tree survives into the compact output.
 *
 * <p>Levels (from least to most detail):
 *
 * <ul>
 *   <li>MINIMAL - compact pruning, then only actionable nodes and their ancestors
 *   <li>COMPACT - structural noise pruned (default)
 *   <li>FULL - every captured node, no pruning
 * </ul>
 */
public enum DetailLevel {
    /** Compact pruning, keeping only nodes with a meaningful action and their ancestors */
    MINIMAL("minimal"),

    /** Apply every pruning rule */
    COMPACT("compact"),

    /** Render the tree as captured */
    FULL("full");

    private final String id;

    DetailLevel(String id) {
        this.id = id;
    }

    /** The identifier used in headers and configuration, e.g. {@code compact}. */
    public String id() {
        return id;
    }

    /** Parses a level identifier, ignoring case. */
    public static DetailLevel fromId(String id) {
        if (id != null) {
            String wanted = id.trim().toLowerCase(Locale.ROOT);
            for (DetailLevel detail : values()) {
                if (detail.id.equals(wanted)) {
                    return detail;
                }
            }
        }
        throw new IllegalArgumentException(
                "Unknown detail level '"
                        + id
                        + "'; expected one of "
                        + Arrays.stream(values())
                                .map(DetailLevel::id)
                                .collect(Collectors.joining(", ")));
    }
}
