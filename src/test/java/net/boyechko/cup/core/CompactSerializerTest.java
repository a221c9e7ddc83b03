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
package net.boyechko.cup.core;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import net.boyechko.cup.pruning.DetailLevel;
import net.boyechko.cup.tree.Envelope;
import net.boyechko.cup.tree.MalformedTreeException;
import net.boyechko.cup.tree.Node;
import org.junit.jupiter.api.Test;

class CompactSerializerTest {

    private static Envelope firefox() {
        Node window =
                Node.builder("e0", "window")
                        .name("Mozilla Firefox")
                        .bounds(0, 0, 1920, 1080)
                        .actions("focus")
                        .children(
                                Node.builder("e1", "generic")
                                        .child(
                                                Node.builder("e2", "button")
                                                        .name("Back")
                                                        .bounds(8, 40, 32, 32)
                                                        .actions("click", "focus")
                                                        .build())
                                        .build(),
                                Node.builder("e3", "scrollbar")
                                        .attribute("orientation", "vertical")
                                        .build())
                        .build();
        return Envelope.builder("windows", 1920, 1080)
                .timestamp(1740067200000L)
                .app("Firefox", 1234)
                .root(window)
                .build();
    }

    @Test
    void rendersHeaderBlankLineAndBody() {
        String text = new CompactSerializer().serialize(firefox());

        assertEquals(
                """
                # CUP 0.1.0 | compact | windows | 1920x1080
                # app: Firefox
                # 2 nodes (4 before pruning)

                [e0] win "Mozilla Firefox"
                  [e2] btn "Back" 8,40 32x32 [clk]
                """,
                text);
    }

    @Test
    void fullDetailRendersEveryNode() {
        CompactSerializer serializer =
                new CompactSerializer(CompactOptions.of(DetailLevel.FULL));

        CompactResult result = serializer.render(firefox());

        assertEquals(
                """
                # CUP 0.1.0 | full | windows | 1920x1080
                # app: Firefox
                # 4 nodes (4 before pruning)

                [e0] win "Mozilla Firefox"
                  [e1] gen
                    [e2] btn "Back" 8,40 32x32 [clk]
                  [e3] sb (v)
                """,
                result.text());
        assertEquals(result.stats().before(), result.stats().after());
    }

    @Test
    void fullDetailIsRepeatable() {
        CompactSerializer serializer =
                new CompactSerializer(CompactOptions.of(DetailLevel.FULL));
        Envelope envelope = firefox();

        assertEquals(serializer.serialize(envelope), serializer.serialize(envelope));
    }

    @Test
    void bodyLineCountMatchesHeader() {
        CompactResult result = new CompactSerializer().render(firefox());

        List<String> body =
                result.text().lines().dropWhile(line -> !line.isEmpty()).skip(1).toList();
        assertEquals(result.stats().after(), body.size());
    }

    @Test
    void renderedIdsResolveToCapturedNodes() {
        CompactResult result = new CompactSerializer().render(firefox());

        Node back = result.pruning().original("e2").orElseThrow();
        assertTrue(back.hasAction("focus"), "The capture keeps the focus verb");
        assertEquals("generic", result.pruning().original("e1").orElseThrow().role());
    }

    @Test
    void emptyTreeStillHasHeader() {
        Envelope envelope = Envelope.builder("macos", 2560, 1600).build();

        assertEquals(
                "# CUP 0.1.0 | compact | macos | 2560x1600\n# 0 nodes (0 before pruning)\n\n",
                new CompactSerializer().serialize(envelope));
    }

    @Test
    void malformedTreeProducesNoOutput() {
        Envelope envelope =
                Envelope.builder("web", 800, 600)
                        .root(Node.builder("a", "button").build())
                        .root(Node.builder("a", "link").build())
                        .build();

        assertThrows(MalformedTreeException.class, () -> new CompactSerializer().render(envelope));
    }

    @Test
    void optionsAreValidated() {
        assertThrows(NullPointerException.class, () -> new CompactOptions(null, 10));
        assertThrows(
                IllegalArgumentException.class,
                () -> CompactOptions.defaults().withMaxDepth(0));
        assertEquals(DetailLevel.COMPACT, CompactOptions.defaults().detailLevel());
        assertEquals(
                DetailLevel.MINIMAL,
                new CompactSerializer(CompactOptions.of(DetailLevel.MINIMAL))
                        .options()
                        .detailLevel());
    }
}
