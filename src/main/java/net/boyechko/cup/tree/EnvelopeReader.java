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
package net.boyechko.cup.tree;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.StreamReadConstraints;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.Reader;
import java.io.StringWriter;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Reads a CUP envelope from JSON or YAML text.
 *
 * <p>Text that opens with <code>{</code> or <code>[</code> is parsed as JSON by Jackson. If Jackson
 * rejects it, the text is retried as YAML flow syntax through SnakeYAML's safe loader, so short
 * hand-written trees like {@code [{id: e0, role: button}]} still load. Everything else is YAML.
 * Files named {@code *.json} are parsed as JSON only.
 *
 * <p>Validation is limited to what the engine needs: every node must have an {@code id} and a
 * {@code role}, states and actions must be strings, and bounds must be whole numbers that fit an
 * {@code int}. Problems fail fast with a {@link MalformedTreeException} naming the node's index
 * path; nothing is silently dropped.
 */
public class EnvelopeReader {
    private static final Logger logger = LoggerFactory.getLogger(EnvelopeReader.class);

    // Each tree level is a mapping inside a sequence.
    private static final int NESTING_PER_NODE = 2;
    private static final int NESTING_ENVELOPE = 8;

    // Full desktop captures run to tens of megabytes.
    private static final int YAML_CODE_POINT_LIMIT = 256 * 1024 * 1024;

    private final int maxDepth;
    private final ObjectMapper jsonMapper;

    public EnvelopeReader() {
        this(TreeDepth.DEFAULT_LIMIT);
    }

    public EnvelopeReader(int maxDepth) {
        this.maxDepth = maxDepth;
        this.jsonMapper = newJsonMapper(maxDepth * NESTING_PER_NODE + NESTING_ENVELOPE);
    }

    public Envelope read(Path file) throws IOException {
        String text = Files.readString(file, StandardCharsets.UTF_8);
        String fileName = String.valueOf(file.getFileName()).toLowerCase(Locale.ROOT);
        if (fileName.endsWith(".json")) {
            try {
                return fromObject(loadJson(text));
            } catch (JsonProcessingException e) {
                throw unparseable(e.getOriginalMessage());
            }
        }
        return read(text);
    }

    public Envelope read(Reader reader) throws IOException {
        StringWriter text = new StringWriter();
        reader.transferTo(text);
        return read(text.toString());
    }

    public Envelope read(String text) {
        return fromObject(loadDocument(text));
    }

    /** Reads a bare list of root nodes, without envelope. */
    public List<Node> readTree(String text) {
        return readRoots(loadDocument(text), List.of());
    }

    private Object loadDocument(String text) {
        if (looksLikeJson(text)) {
            try {
                return loadJson(text);
            } catch (JsonProcessingException e) {
                logger.debug("Not strict JSON, retrying as YAML: {}", e.getOriginalMessage());
            }
        }
        try {
            return newYaml().load(text);
        } catch (YAMLException e) {
            throw unparseable(e.getMessage());
        }
    }

    private Object loadJson(String text) throws JsonProcessingException {
        return jsonMapper.readValue(text, Object.class);
    }

    private static boolean looksLikeJson(String text) {
        String trimmed = text.stripLeading();
        return trimmed.startsWith("{") || trimmed.startsWith("[");
    }

    private static MalformedTreeException unparseable(String reason) {
        return new MalformedTreeException(List.of(), "unparseable document: " + reason);
    }

    private static ObjectMapper newJsonMapper(int nestingLimit) {
        JsonFactory factory =
                JsonFactory.builder()
                        .streamReadConstraints(
                                StreamReadConstraints.builder()
                                        .maxNestingDepth(nestingLimit)
                                        .build())
                        .build();
        return new ObjectMapper(factory).enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    private Yaml newYaml() {
        LoaderOptions options = new LoaderOptions();
        options.setNestingDepthLimit(maxDepth * NESTING_PER_NODE + NESTING_ENVELOPE);
        options.setCodePointLimit(YAML_CODE_POINT_LIMIT);
        return new Yaml(new SafeConstructor(options));
    }

    private Envelope fromObject(Object document) {
        if (!(document instanceof Map<?, ?> map)) {
            throw new MalformedTreeException(List.of(), "envelope must be a mapping");
        }

        String version = stringOr(map.get("version"), Envelope.FORMAT_VERSION);
        String platform = stringOr(map.get("platform"), "unknown");
        long timestamp = map.get("timestamp") instanceof Number n ? n.longValue() : 0L;

        Envelope.Screen screen = readScreen(map.get("screen"));
        Envelope.App app = readApp(map.get("app"));
        List<Node> tree = readRoots(map.get("tree"), List.of());
        List<Map<String, Object>> tools = readTools(map.get("tools"));

        logger.debug(
                "Read {} envelope version {} with {} root node(s)", platform, version, tree.size());
        return new Envelope(version, platform, timestamp, screen, app, tree, tools);
    }

    private Envelope.Screen readScreen(Object raw) {
        if (!(raw instanceof Map<?, ?> screen)) {
            return new Envelope.Screen(0, 0);
        }
        int width = intOr(screen.get("w"), 0);
        int height = intOr(screen.get("h"), 0);
        Double scale = screen.get("scale") instanceof Number n ? n.doubleValue() : null;
        return new Envelope.Screen(width, height, scale);
    }

    private Envelope.App readApp(Object raw) {
        if (!(raw instanceof Map<?, ?> app)) {
            return null;
        }
        Integer pid = app.get("pid") instanceof Number n ? exactInt(n) : null;
        Envelope.App result =
                new Envelope.App(
                        stringOr(app.get("name"), null), pid, stringOr(app.get("bundleId"), null));
        return result.isEmpty() ? null : result;
    }

    private List<Map<String, Object>> readTools(Object raw) {
        if (!(raw instanceof List<?> list)) {
            return List.of();
        }
        List<Map<String, Object>> tools = new ArrayList<>();
        for (Object item : list) {
            if (item instanceof Map<?, ?> tool) {
                tools.add(stringKeys(tool));
            }
        }
        return tools;
    }

    private List<Node> readRoots(Object raw, List<Integer> path) {
        if (raw == null) {
            return List.of();
        }
        if (!(raw instanceof List<?> list)) {
            throw new MalformedTreeException(path, "tree must be a list of nodes");
        }
        List<Node> roots = new ArrayList<>(list.size());
        for (int i = 0; i < list.size(); i++) {
            roots.add(readNode(list.get(i), TreeDepth.child(path, i), 0));
        }
        return roots;
    }

    private Node readNode(Object raw, List<Integer> path, int depth) {
        TreeDepth.check(depth, maxDepth, path);
        if (!(raw instanceof Map<?, ?> map)) {
            throw new MalformedTreeException(path, "node must be a mapping");
        }

        String id = requiredScalar(map, "id", path);
        String role = requiredScalar(map, "role", path);
        String name = optionalScalar(map, "name", path);
        String value = optionalScalar(map, "value", path);

        Node.Builder builder =
                Node.builder(id, role)
                        .name(name)
                        .value(value)
                        .bounds(readBounds(map.get("bounds"), path))
                        .states(readVerbs(map.get("states"), "states", path))
                        .actions(readVerbs(map.get("actions"), "actions", path));

        if (map.get("attributes") instanceof Map<?, ?> attributes) {
            stringKeys(attributes).forEach(builder::attribute);
        } else if (map.get("attributes") != null) {
            throw new MalformedTreeException(path, "attributes must be a mapping");
        }
        if (map.get("platform") instanceof Map<?, ?> platform) {
            stringKeys(platform).forEach(builder::platform);
        }

        Object children = map.get("children");
        if (children != null) {
            if (!(children instanceof List<?> list)) {
                throw new MalformedTreeException(path, "children must be a list of nodes");
            }
            for (int i = 0; i < list.size(); i++) {
                builder.child(readNode(list.get(i), TreeDepth.child(path, i), depth + 1));
            }
        }
        return builder.build();
    }

    private Bounds readBounds(Object raw, List<Integer> path) {
        if (raw == null) {
            return null;
        }
        if (!(raw instanceof Map<?, ?> map)) {
            throw new MalformedTreeException(path, "bounds must be a mapping");
        }
        return new Bounds(
                boundsField(map, "x", path),
                boundsField(map, "y", path),
                boundsField(map, "w", path),
                boundsField(map, "h", path));
    }

    private int boundsField(Map<?, ?> bounds, String key, List<Integer> path) {
        if (!(bounds.get(key) instanceof Number n)) {
            throw new MalformedTreeException(path, "bounds." + key + " must be a number");
        }
        Integer exact = exactInt(n);
        if (exact == null) {
            throw new MalformedTreeException(
                    path, "bounds." + key + " must be a whole number of pixels, got " + n);
        }
        return exact;
    }

    private String[] readVerbs(Object raw, String field, List<Integer> path) {
        if (raw == null) {
            return new String[0];
        }
        if (!(raw instanceof List<?> list)) {
            throw new MalformedTreeException(path, field + " must be a list of strings");
        }
        Set<String> verbs = new LinkedHashSet<>();
        for (Object item : list) {
            if (!(item instanceof String s)) {
                throw new MalformedTreeException(
                        path, field + " contains a non-string entry: " + item);
            }
            verbs.add(s);
        }
        return verbs.toArray(new String[0]);
    }

    private String requiredScalar(Map<?, ?> map, String key, List<Integer> path) {
        String s = optionalScalar(map, key, path);
        if (s == null || s.isEmpty()) {
            throw new MalformedTreeException(path, "missing required field '" + key + "'");
        }
        return s;
    }

    private String optionalScalar(Map<?, ?> map, String key, List<Integer> path) {
        Object raw = map.get(key);
        if (raw == null) {
            return null;
        }
        if (raw instanceof String || raw instanceof Number || raw instanceof Boolean) {
            return raw.toString();
        }
        throw new MalformedTreeException(path, key + " must be a scalar value");
    }

    private static String stringOr(Object raw, String fallback) {
        return raw != null ? raw.toString() : fallback;
    }

    private static int intOr(Object raw, int fallback) {
        Integer exact = raw instanceof Number n ? exactInt(n) : null;
        return exact != null ? exact : fallback;
    }

    /** The number as an {@code int}, or null when it has a fraction or does not fit. */
    private static Integer exactInt(Number n) {
        try {
            return new BigDecimal(n.toString()).intValueExact();
        } catch (ArithmeticException | NumberFormatException e) {
            return null;
        }
    }

    private static Map<String, Object> stringKeys(Map<?, ?> source) {
        Map<String, Object> result = new LinkedHashMap<>();
        source.forEach((k, v) -> result.put(String.valueOf(k), v));
        return result;
    }
}
