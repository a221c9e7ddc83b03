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
package net.boyechko.cup.render;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Set;
import net.boyechko.cup.tree.Node;

/**
 * Derives {@link CompactAttributes} from a node's raw attribute map.
 *
 * <p>Each attribute is gated by role: a heading level on a button, for instance, is ignored. A
 * missing or unusable raw field leaves the attribute absent; nothing is defaulted.
 */
public final class AttributeExtractor {
    public static final int MAX_PLACEHOLDER_LENGTH = 30;

    static final Set<String> PLACEHOLDER_ROLES = Set.of("textbox", "searchbox", "combobox");
    static final Set<String> ORIENTATION_ROLES =
            Set.of("slider", "scrollbar", "separator", "toolbar", "tablist", "menubar");
    static final Set<String> RANGE_ROLES =
            Set.of("slider", "spinbutton", "progressbar", "scrollbar");

    private AttributeExtractor() {}

    public static CompactAttributes extract(Node node) {
        Map<String, Object> raw = node.attributes();
        if (raw.isEmpty()) return CompactAttributes.NONE;

        String role = node.role();
        Integer level = "heading".equals(role) ? level(raw.get("level")) : null;
        String placeholder =
                PLACEHOLDER_ROLES.contains(role) ? placeholder(raw.get("placeholder")) : null;
        String orientation =
                ORIENTATION_ROLES.contains(role) ? orientation(raw.get("orientation")) : null;
        CompactAttributes.Range range = RANGE_ROLES.contains(role) ? range(raw) : null;

        return new CompactAttributes(level, placeholder, orientation, range);
    }

    // Fractional or out-of-range levels are unusable, not rounded.
    private static Integer level(Object raw) {
        if (!(raw instanceof Number) && !(raw instanceof String)) return null;
        try {
            return new BigDecimal(raw.toString().trim()).intValueExact();
        } catch (ArithmeticException | NumberFormatException e) {
            return null;
        }
    }

    private static String placeholder(Object raw) {
        if (raw == null) return null;
        return Format.truncate(raw.toString(), MAX_PLACEHOLDER_LENGTH);
    }

    private static String orientation(Object raw) {
        if (!(raw instanceof String s)) return null;
        return switch (s) {
            case "horizontal", "h" -> "h";
            case "vertical", "v" -> "v";
            default -> null;
        };
    }

    private static CompactAttributes.Range range(Map<String, Object> raw) {
        Object min = raw.get("valueMin");
        Object max = raw.get("valueMax");
        if (min == null && max == null) return null;
        return new CompactAttributes.Range(Format.number(min), Format.number(max));
    }
}
