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

import java.util.ArrayList;
import java.util.List;

/**
 * The sparse attribute suffix of a compact line. Every component is null when absent.
 *
 * @param level heading level
 * @param placeholder placeholder text, already truncated
 * @param orientation {@code h} or {@code v}
 * @param range value range; either side may be empty
 */
public record CompactAttributes(
        Integer level, String placeholder, String orientation, Range range) {

    public static final CompactAttributes NONE = new CompactAttributes(null, null, null, null);

    /** A value range as rendered, e.g. {@code 0..100} or {@code ..10}. */
    public record Range(String min, String max) {
        @Override
        public String toString() {
            return min + ".." + max;
        }
    }

    public boolean isEmpty() {
        return level == null && placeholder == null && orientation == null && range == null;
    }

    /** Returns the parenthesized suffix, e.g. {@code (L2)}, or an empty string. */
    public String render() {
        if (isEmpty()) return "";
        List<String> parts = new ArrayList<>(4);
        if (level != null) parts.add("L" + level);
        if (placeholder != null) parts.add("ph=\"" + Format.escape(placeholder) + "\"");
        if (orientation != null) parts.add(orientation);
        if (range != null) parts.add("range=" + range);
        return "(" + String.join(" ", parts) + ")";
    }
}
