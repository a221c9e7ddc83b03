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

/**
 * String helpers for the compact format.
 *
 * <p>Truncation always happens before escaping, so a truncated field is a prefix of the original
 * text and escaping may only lengthen it by its escape characters.
 */
public final class Format {
    private Format() {}

    /** Returns the first {@code max} characters of {@code s}, never splitting a surrogate pair. */
    public static String truncate(String s, int max) {
        if (s == null || s.length() <= max) return s;
        int end = max;
        if (end > 0 && Character.isHighSurrogate(s.charAt(end - 1))) end--;
        return s.substring(0, end);
    }

    /** Escapes backslash, double quote, newline and carriage return. */
    public static String escape(String s) {
        StringBuilder sb = new StringBuilder(s.length() + 8);
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '"' -> sb.append("\\\"");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }

    /** Truncates, escapes and wraps in double quotes, e.g. {@code "Save \"draft\""}. */
    public static String quoted(String s, int max) {
        return "\"" + escape(truncate(s, max)) + "\"";
    }

    /**
     * Renders a raw attribute number. Integral values lose their decimal point ({@code 100.0}
     * becomes {@code 100}); strings are returned unchanged.
     */
    public static String number(Object raw) {
        if (raw == null) return "";
        if (raw instanceof Double || raw instanceof Float) {
            double d = ((Number) raw).doubleValue();
            if (d == Math.rint(d) && !Double.isInfinite(d) && Math.abs(d) < 1e15) {
                return Long.toString((long) d);
            }
            return Double.toString(d);
        }
        return raw.toString();
    }

    public static String bounds(int x, int y, int width, int height) {
        return x + "," + y + " " + width + "x" + height;
    }
}
