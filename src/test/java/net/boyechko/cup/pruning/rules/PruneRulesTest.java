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

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import net.boyechko.cup.pruning.Disposition;
import net.boyechko.cup.pruning.PruneContext;
import net.boyechko.cup.pruning.PruneRule;
import net.boyechko.cup.pruning.PruningDefaults;
import net.boyechko.cup.tree.Node;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class PruneRulesTest {

    private static PruneContext ctx(Node node, Node... survivingChildren) {
        return new PruneContext(node, List.of(survivingChildren), List.of(0, 1), 1);
    }

    private static Node leaf(String role) {
        return Node.builder("c", role).name("child").build();
    }

    @Test
    void defaultsAreInEvaluationOrder() {
        assertEquals(
                List.of(
                        "Chrome Role",
                        "Zero Size",
                        "Structural Wrapper",
                        "Unnamed Image",
                        "Empty Text",
                        "Redundant Text Label",
                        "Offscreen",
                        "Single Child Collapse"),
                PruningDefaults.rules().stream().map(PruneRule::name).toList());
    }

    @Test
    void everyRuleDescribesItself() {
        for (PruneRule rule : PruningDefaults.rules()) {
            assertFalse(rule.description().isBlank(), rule.name());
        }
    }

    @ParameterizedTest
    @ValueSource(strings = {"scrollbar", "separator", "titlebar", "tooltip", "status"})
    void chromeRolesAreDropped(String role) {
        Node node = Node.builder("n", role).name("Named").actions("click").build();
        assertEquals(Disposition.DROP, new ChromeRoleRule().evaluate(ctx(node)));
    }

    @Test
    void contentRolesAreNotChrome() {
        assertEquals(
                Disposition.KEEP,
                new ChromeRoleRule().evaluate(ctx(Node.builder("n", "toolbar").build())));
    }

    @Test
    void zeroSizeNeedsBounds() {
        ZeroSizeRule rule = new ZeroSizeRule();
        assertEquals(Disposition.KEEP, rule.evaluate(ctx(Node.builder("n", "button").build())));
        assertEquals(
                Disposition.DROP,
                rule.evaluate(ctx(Node.builder("n", "button").bounds(5, 5, 0, 10).build())));
        assertEquals(
                Disposition.KEEP,
                rule.evaluate(ctx(Node.builder("n", "button").bounds(5, 5, 1, 1).build())));
    }

    @ParameterizedTest
    @ValueSource(strings = {"generic", "region", "group"})
    void unnamedWrappersAreHoisted(String role) {
        Node node = Node.builder("n", role).build();
        assertEquals(Disposition.HOIST, new StructuralWrapperRule().evaluate(ctx(node)));
    }

    @Test
    void wrapperExceptions() {
        StructuralWrapperRule rule = new StructuralWrapperRule();
        assertEquals(
                Disposition.KEEP,
                rule.evaluate(ctx(Node.builder("n", "generic").name("Card").build())));
        assertEquals(
                Disposition.KEEP,
                rule.evaluate(ctx(Node.builder("n", "group").actions("toggle").build())));
        // only group is exempted by its actions
        assertEquals(
                Disposition.HOIST,
                rule.evaluate(ctx(Node.builder("n", "generic").actions("click").build())));
    }

    @Test
    void imagesAndTextNeedNames() {
        UnnamedImageRule images = new UnnamedImageRule();
        EmptyTextRule text = new EmptyTextRule();

        assertEquals(Disposition.DROP, images.evaluate(ctx(Node.builder("n", "img").build())));
        assertEquals(
                Disposition.KEEP,
                images.evaluate(ctx(Node.builder("n", "img").name("Logo").build())));
        assertEquals(Disposition.DROP, text.evaluate(ctx(Node.builder("n", "text").build())));
        assertEquals(
                Disposition.KEEP, text.evaluate(ctx(Node.builder("n", "text").name("Hi").build())));
    }

    @Test
    void redundantTextNeedsNamedParentAndNoSiblings() {
        RedundantTextLabelRule rule = new RedundantTextLabelRule();
        Node named = Node.builder("p", "button").name("OK").build();
        Node unnamed = Node.builder("p", "listitem").build();
        Node text = leaf("text");

        assertTrue(rule.isRedundantChild(named, List.of(text), text));
        assertFalse(rule.isRedundantChild(unnamed, List.of(text), text));
        assertFalse(rule.isRedundantChild(named, List.of(text, leaf("link")), text));
        assertFalse(rule.isRedundantChild(named, List.of(leaf("link")), leaf("link")));
        assertEquals(Disposition.KEEP, rule.evaluate(ctx(text)));
    }

    @Test
    void offscreenKeepsActionableNodes() {
        OffscreenRule rule = new OffscreenRule();
        Node inert = Node.builder("n", "link").states("offscreen").build();
        Node focusable = Node.builder("n", "link").states("offscreen").actions("focus").build();
        Node clickable = Node.builder("n", "link").states("offscreen").actions("click").build();

        assertEquals(Disposition.DROP, rule.evaluate(ctx(inert)));
        assertEquals(Disposition.DROP, rule.evaluate(ctx(focusable)));
        assertEquals(Disposition.KEEP, rule.evaluate(ctx(clickable)));
    }

    @Test
    void collapseNeedsExactlyOneSurvivingChild() {
        SingleChildCollapseRule rule = new SingleChildCollapseRule();
        Node main = Node.builder("n", "main").build();

        assertEquals(Disposition.COLLAPSE, rule.evaluate(ctx(main, leaf("link"))));
        assertEquals(Disposition.KEEP, rule.evaluate(ctx(main)));
        assertEquals(Disposition.KEEP, rule.evaluate(ctx(main, leaf("link"), leaf("button"))));
        Node namedMain = Node.builder("n", "main").name("Content").build();
        Node list = Node.builder("n", "list").build();

        assertEquals(Disposition.KEEP, rule.evaluate(ctx(namedMain, leaf("link"))));
        assertEquals(Disposition.KEEP, rule.evaluate(ctx(list, leaf("listitem"))));
    }

    @Test
    void collapseLooksAtSurvivingChildrenNotCaptured() {
        Node main =
                Node.builder("n", "main")
                        .children(leaf("img"), leaf("link"), leaf("separator"))
                        .build();
        assertEquals(
                Disposition.COLLAPSE,
                new SingleChildCollapseRule().evaluate(ctx(main, leaf("link"))));
    }
}
