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

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import net.boyechko.cup.tree.Node;
import org.junit.jupiter.api.Test;

class LineRendererTest {

    private final LineRenderer renderer = new LineRenderer();

    @Test
    void rendersInteractiveNode() {
        Node node =
                Node.builder("e1", "button")
                        .name("OK")
                        .bounds(10, 20, 80, 24)
                        .states("focused")
                        .actions("focus", "click")
                        .build();

        assertEquals("[e1] btn \"OK\" 10,20 80x24 {foc} [clk]", renderer.formatNode(node));
    }

    @Test
    void omitsBoundsWithoutMeaningfulAction() {
        Node heading =
                Node.builder("e2", "heading")
                        .name("Title")
                        .bounds(0, 0, 400, 40)
                        .actions("focus")
                        .attribute("level", 2)
                        .build();

        assertEquals("[e2] hdg \"Title\" (L2)", renderer.formatNode(heading));
    }

    @Test
    void rendersBareNode() {
        assertEquals("[e3] lst", renderer.formatNode(Node.builder("e3", "list").build()));
    }

    @Test
    void offscreenButtonKeepsStateAndBounds() {
        Node node =
                Node.builder("e4", "button")
                        .name("Load more")
                        .bounds(0, 2000, 120, 30)
                        .states("offscreen")
                        .actions("click")
                        .build();

        assertEquals(
                "[e4] btn \"Load more\" 0,2000 120x30 {off} [clk]", renderer.formatNode(node));
    }

    @Test
    void unknownNamesPassThrough() {
        Node node =
                Node.builder("e5", "hologram")
                        .states("levitating")
                        .actions("teleport", "click")
                        .bounds(1, 2, 3, 4)
                        .build();

        assertEquals(
                "[e5] hologram 1,2 3x4 {levitating} [teleport,clk]", renderer.formatNode(node));
    }

    @Test
    void focusIsNeverRendered() {
        Node onlyFocus = Node.builder("e6", "link").name("Home").actions("focus").build();
        Node mixed = Node.builder("e7", "link").name("Home").actions("focus", "click").build();

        assertEquals("[e6] lnk \"Home\"", renderer.formatNode(onlyFocus));
        assertFalse(renderer.formatNode(mixed).contains("foc"));
    }

    @Test
    void codesAreNotRepeated() {
        Node node = Node.builder("e8", "checkbox").states("focused", "foc").build();

        assertEquals("[e8] chk {foc}", renderer.formatNode(node));
    }

    @Test
    void nameIsTruncatedThenEscaped() {
        String longName = "a".repeat(100);
        String quoteAtLimit = "b".repeat(79) + "\"tail";

        assertEquals(
                "[e9] btn \"" + "a".repeat(80) + "\"",
                renderer.formatNode(Node.builder("e9", "button").name(longName).build()));
        assertEquals(
                "[e9] btn \"" + "b".repeat(79) + "\\\"\"",
                renderer.formatNode(Node.builder("e9", "button").name(quoteAtLimit).build()));
    }

    @Test
    void nameEscapesQuotesBackslashesAndLineBreaks() {
        Node node = Node.builder("e10", "text").name("Say \"hi\"\r\nto C:\\temp").build();

        assertEquals("[e10] txt \"Say \\\"hi\\\"\\r\\nto C:\\\\temp\"", renderer.formatNode(node));
        assertFalse(renderer.formatNode(node).contains("\n"));
    }

    @Test
    void valueIsGatedByRole() {
        Node heading = Node.builder("e11", "heading").name("Total").value("42").build();
        Node textbox = Node.builder("e12", "textbox").name("Total").value("42").build();
        Node emptyValue = Node.builder("e13", "textbox").name("Total").value("").build();

        assertEquals("[e11] hdg \"Total\"", renderer.formatNode(heading));
        assertEquals("[e12] tbx \"Total\" val=\"42\"", renderer.formatNode(textbox));
        assertEquals("[e13] tbx \"Total\"", renderer.formatNode(emptyValue));
    }

    @Test
    void valueIsTruncatedAndEscaped() {
        Node node =
                Node.builder("e14", "combobox")
                        .value("x".repeat(119) + "\"" + "y".repeat(20))
                        .build();

        assertEquals(
                "[e14] cmb val=\"" + "x".repeat(119) + "\\\"\"", renderer.formatNode(node));
    }

    @Test
    void fullLineFieldOrder() {
        Node node =
                Node.builder("e15", "searchbox")
                        .name("Search")
                        .bounds(100, 10, 300, 28)
                        .states("focused", "required")
                        .actions("type", "setvalue", "focus")
                        .value("cats")
                        .attribute("placeholder", "Search the web")
                        .build();

        assertEquals(
                "[e15] sbx \"Search\" 100,10 300x28 {foc,req} [typ,sv] val=\"cats\""
                        + " (ph=\"Search the web\")",
                renderer.formatNode(node));
    }

    @Test
    void bodyIsIndentedInPreOrder() {
        Node tree =
                Node.builder("e0", "window")
                        .name("App")
                        .children(
                                Node.builder("e1", "list")
                                        .child(Node.builder("e2", "listitem").name("One").build())
                                        .build(),
                                Node.builder("e3", "link").name("Next").build())
                        .build();

        assertEquals(
                List.of(
                        "[e0] win \"App\"",
                        "  [e1] lst",
                        "    [e2] li \"One\"",
                        "  [e3] lnk \"Next\""),
                renderer.renderBody(List.of(tree)));
    }

    @Test
    void renderLineIndentsTwoSpacesPerLevel() {
        assertEquals(
                "      [e1] lst", renderer.renderLine(Node.builder("e1", "list").build(), 3));
    }

    @Test
    void emptyForestRendersNothing() {
        assertTrue(renderer.renderBody(List.of()).isEmpty());
    }
}
