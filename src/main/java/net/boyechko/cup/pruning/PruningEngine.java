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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.boyechko.cup.tree.Node;
import net.boyechko.cup.tree.NodeIndex;
import net.boyechko.cup.tree.TreeDepth;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rewrites a captured tree into a smaller one with the same meaning for an agent.
 *
 * <p>The pass is post-order: a node's children are resolved first (dropped, hoisted into the
 * node, or collapsed) and only then are the rules consulted for the node itself, so rules see the
 * surviving children rather than the captured ones. Root nodes can be dropped but never hoisted or
 * collapsed. Finally the focus verb is stripped from every surviving node.
 *
 * <p>The engine holds no per-call state and never modifies its input; one instance can serve
 * several threads.
 */
public class PruningEngine {
    private static final Logger logger = LoggerFactory.getLogger(PruningEngine.class);

    /** Key in {@link PruneStats#ruleHits()} for nodes removed by the minimal detail level. */
    public static final String ACTIONABLE_ONLY = "Actionable Only";

    private final List<PruneRule> rules;
    private final int maxDepth;

    public PruningEngine() {
        this(PruningDefaults.rules(), TreeDepth.DEFAULT_LIMIT);
    }

    public PruningEngine(List<PruneRule> rules, int maxDepth) {
        this.rules = List.copyOf(rules);
        this.maxDepth = maxDepth;
    }

    public List<PruneRule> rules() {
        return rules;
    }

    /**
     * Prunes the given roots at the given detail level.
     *
     * @throws net.boyechko.cup.tree.MalformedTreeException if IDs repeat or the tree is deeper
     *     than the configured limit
     */
    public PruneResult prune(List<Node> roots, DetailLevel detailLevel) {
        NodeIndex source = NodeIndex.of(roots);
        int before = source.size();

        if (detailLevel == DetailLevel.FULL) {
            logger.debug("Detail level full: {} nodes kept as captured", before);
            return new PruneResult(roots, PruneStats.unchanged(before), detailLevel, source);
        }

        Map<String, Integer> hits = new LinkedHashMap<>();
        List<Node> pruned = new ArrayList<>();
        for (int i = 0; i < roots.size(); i++) {
            pruned.addAll(resolve(roots.get(i), List.of(i), 0, hits));
        }
        if (detailLevel == DetailLevel.MINIMAL) {
            int compactCount = countNodes(pruned);
            pruned = keepActionable(pruned);
            int removed = compactCount - countNodes(pruned);
            if (removed > 0) {
                hits.put(ACTIONABLE_ONLY, removed);
            }
        }

        PruneStats stats = new PruneStats(before, countNodes(pruned), hits);
        logger.debug(
                "Pruned at detail level {}: {} nodes ({} before pruning), rules fired: {}",
                detailLevel.id(),
                stats.after(),
                stats.before(),
                stats.ruleHits());
        return new PruneResult(pruned, stats, detailLevel, source);
    }

    /** Returns the nodes that replace {@code node} in its parent's child list. */
    private List<Node> resolve(
            Node node, List<Integer> path, int depth, Map<String, Integer> hits) {
        TreeDepth.check(depth, maxDepth, path);

        List<Node> children = resolveChildren(node, path, depth, hits);
        PruneContext ctx = new PruneContext(node, children, path, depth);

        for (PruneRule rule : rules) {
            Disposition disposition = rule.evaluate(ctx);
            switch (disposition) {
                case KEEP -> {}
                case DROP -> {
                    tally(hits, rule);
                    return List.of();
                }
                case HOIST -> {
                    if (!ctx.isRoot()) {
                        tally(hits, rule);
                        return children;
                    }
                }
                case COLLAPSE -> {
                    if (!ctx.isRoot() && children.size() == 1) {
                        tally(hits, rule);
                        return children;
                    }
                }
            }
        }

        return List.of(node.withChildren(children).withoutAction(Node.FOCUS_ACTION));
    }

    private List<Node> resolveChildren(
            Node node, List<Integer> path, int depth, Map<String, Integer> hits) {
        List<Node> resolved = new ArrayList<>();
        List<Node> captured = node.children();
        for (int i = 0; i < captured.size(); i++) {
            resolved.addAll(resolve(captured.get(i), TreeDepth.child(path, i), depth + 1, hits));
        }

        List<Node> surviving = new ArrayList<>(resolved.size());
        for (Node child : resolved) {
            PruneRule redundantBy = redundantBy(node, resolved, child);
            if (redundantBy != null) {
                tally(hits, redundantBy);
            } else {
                surviving.add(child);
            }
        }
        return surviving;
    }

    private PruneRule redundantBy(Node parent, List<Node> siblings, Node child) {
        for (PruneRule rule : rules) {
            if (rule.isRedundantChild(parent, siblings, child)) {
                return rule;
            }
        }
        return null;
    }

    /** Keeps nodes that offer a meaningful action, plus every ancestor of such a node. */
    private List<Node> keepActionable(List<Node> nodes) {
        List<Node> kept = new ArrayList<>();
        for (Node node : nodes) {
            List<Node> children = keepActionable(node.children());
            if (node.hasMeaningfulAction() || !children.isEmpty()) {
                kept.add(node.withChildren(children));
            }
        }
        return kept;
    }

    private static void tally(Map<String, Integer> hits, PruneRule rule) {
        hits.merge(rule.name(), 1, Integer::sum);
    }

    static int countNodes(List<Node> roots) {
        int count = 0;
        Deque<Node> stack = new ArrayDeque<>(roots);
        while (!stack.isEmpty()) {
            Node node = stack.pop();
            count++;
            stack.addAll(node.children());
        }
        return count;
    }
}
