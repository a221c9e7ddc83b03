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

import java.util.ArrayList;
import java.util.List;
import net.boyechko.cup.pruning.PruneResult;
import net.boyechko.cup.pruning.PruningDefaults;
import net.boyechko.cup.pruning.PruningEngine;
import net.boyechko.cup.render.HeaderRenderer;
import net.boyechko.cup.render.LineRenderer;
import net.boyechko.cup.tree.Envelope;
import net.boyechko.cup.vocabulary.Vocabulary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns an envelope into compact text.
 *
 * <p>The captured tree is pruned at the configured detail level, rendered one line per node, and
 * prefixed with the header. The envelope is not modified; the pruned tree is returned alongside
 * the text so that callers can map rendered IDs back to captured nodes.
 */
public class CompactSerializer {
    private static final Logger logger = LoggerFactory.getLogger(CompactSerializer.class);

    private final CompactOptions options;
    private final PruningEngine engine;
    private final LineRenderer lineRenderer;

    public CompactSerializer() {
        this(CompactOptions.defaults());
    }

    public CompactSerializer(CompactOptions options) {
        this(options, Vocabulary.standard());
    }

    public CompactSerializer(CompactOptions options, Vocabulary vocabulary) {
        this.options = options;
        this.engine = new PruningEngine(PruningDefaults.rules(), options.maxDepth());
        this.lineRenderer = new LineRenderer(vocabulary);
    }

    public CompactOptions options() {
        return options;
    }

    /** Prunes and renders the envelope's tree. */
    public CompactResult render(Envelope envelope) {
        PruneResult pruned = engine.prune(envelope.tree(), options.detailLevel());

        List<String> lines =
                new ArrayList<>(
                        HeaderRenderer.render(envelope, options.detailLevel(), pruned.stats()));
        lines.add("");
        lines.addAll(lineRenderer.renderBody(pruned.tree()));
        String text = String.join("\n", lines) + "\n";

        logger.debug(
                "Serialized {} envelope: {} lines, {} characters",
                envelope.platform(),
                lines.size(),
                text.length());
        return new CompactResult(text, pruned);
    }

    /** Returns only the compact text. */
    public String serialize(Envelope envelope) {
        return render(envelope).text();
    }
}
