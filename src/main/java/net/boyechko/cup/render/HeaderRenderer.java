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
import net.boyechko.cup.pruning.DetailLevel;
import net.boyechko.cup.pruning.PruneStats;
import net.boyechko.cup.tree.Envelope;

/** Builds the {@code #}-prefixed metadata lines that open a compact document. */
public final class HeaderRenderer {
    public static final String MARKER = "# ";

    private HeaderRenderer() {}

    /**
     * Returns the header lines, without the blank separator line. For example:
     *
     * <pre>
     * # CUP 0.1.0 | compact | windows | 1920x1080
     * # app: Firefox
     * # 2 nodes (3 before pruning)
     * </pre>
     */
    public static List<String> render(
            Envelope envelope, DetailLevel detailLevel, PruneStats stats) {
        List<String> lines = new ArrayList<>(4);
        lines.add(
                MARKER
                        + "CUP "
                        + envelope.version()
                        + " | "
                        + detailLevel.id()
                        + " | "
                        + envelope.platform()
                        + " | "
                        + envelope.screen().width()
                        + "x"
                        + envelope.screen().height());

        String appName = envelope.hasApp() ? envelope.app().name() : null;
        if (appName != null && !appName.isEmpty()) {
            lines.add(MARKER + "app: " + appName);
        }

        lines.add(MARKER + stats.after() + " nodes (" + stats.before() + " before pruning)");

        int tools = envelope.tools().size();
        if (tools > 0) {
            lines.add(MARKER + tools + " WebMCP tool" + (tools == 1 ? "" : "s") + " available");
        }
        return lines;
    }
}
