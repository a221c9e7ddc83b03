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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Top-level wrapper around a captured tree: format version, platform, capture time, screen
 * metrics, the captured application (if a single one was targeted), the root nodes, and any
 * WebMCP tools the page advertised.
 */
public record Envelope(
        String version,
        String platform,
        long timestamp,
        Screen screen,
        App app,
        List<Node> tree,
        List<Map<String, Object>> tools) {

    public static final String FORMAT_VERSION = "0.1.0";

    public Envelope {
        Objects.requireNonNull(version, "version");
        Objects.requireNonNull(platform, "platform");
        Objects.requireNonNull(screen, "screen");
        tree = tree != null ? List.copyOf(tree) : List.of();
        tools = tools != null ? copyTools(tools) : List.of();
    }

    /** Screen dimensions in physical pixels; {@code scale} is null when it is 1.0. */
    public record Screen(int width, int height, Double scale) {
        public Screen {
            if (scale != null && scale == 1.0) {
                scale = null;
            }
        }

        public Screen(int width, int height) {
            this(width, height, null);
        }
    }

    /** The captured application. Any field may be null. */
    public record App(String name, Integer pid, String bundleId) {
        public boolean isEmpty() {
            return (name == null || name.isEmpty()) && pid == null && bundleId == null;
        }
    }

    public boolean hasApp() {
        return app != null && !app.isEmpty();
    }

    public static Builder builder(String platform, int screenWidth, int screenHeight) {
        return new Builder(platform, screenWidth, screenHeight);
    }

    private static List<Map<String, Object>> copyTools(List<Map<String, Object>> tools) {
        List<Map<String, Object>> copy = new ArrayList<>(tools.size());
        for (Map<String, Object> tool : tools) {
            copy.add(Collections.unmodifiableMap(new LinkedHashMap<>(tool)));
        }
        return Collections.unmodifiableList(copy);
    }

    /** Assembles an envelope the way capture adapters do, stamping the current time. */
    public static final class Builder {
        private final String platform;
        private final int screenWidth;
        private final int screenHeight;
        private Double screenScale;
        private String version = FORMAT_VERSION;
        private Long timestamp;
        private String appName;
        private Integer appPid;
        private String appBundleId;
        private final List<Node> tree = new ArrayList<>();
        private final List<Map<String, Object>> tools = new ArrayList<>();

        private Builder(String platform, int screenWidth, int screenHeight) {
            this.platform = platform;
            this.screenWidth = screenWidth;
            this.screenHeight = screenHeight;
        }

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        public Builder timestamp(long timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder screenScale(double scale) {
            this.screenScale = scale;
            return this;
        }

        public Builder app(String name, Integer pid) {
            this.appName = name;
            this.appPid = pid;
            return this;
        }

        public Builder appName(String name) {
            this.appName = name;
            return this;
        }

        public Builder appBundleId(String bundleId) {
            this.appBundleId = bundleId;
            return this;
        }

        public Builder root(Node root) {
            tree.add(root);
            return this;
        }

        public Builder tree(List<Node> roots) {
            tree.addAll(roots);
            return this;
        }

        public Builder tool(Map<String, Object> tool) {
            tools.add(tool);
            return this;
        }

        public Envelope build() {
            App app = new App(emptyToNull(appName), appPid, emptyToNull(appBundleId));
            return new Envelope(
                    version,
                    platform,
                    timestamp != null ? timestamp : System.currentTimeMillis(),
                    new Screen(screenWidth, screenHeight, screenScale),
                    app.isEmpty() ? null : app,
                    tree,
                    tools);
        }

        private static String emptyToNull(String s) {
            return s == null || s.isEmpty() ? null : s;
        }
    }
}
