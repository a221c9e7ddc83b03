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
package net.boyechko.cup.vocabulary;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Short codes for roles, states and actions in the compact format.
 *
 * <p>The tables map canonical names to short codes and back. A name that is not in a table is
 * rendered as-is, so captures that use roles or verbs newer than the table still render. The
 * standard tables are loaded once from {@value #DEFAULT_VOCABULARY_RESOURCE} and never change.
 */
public final class Vocabulary {
    private static final String DEFAULT_VOCABULARY_RESOURCE = "/cup-vocabulary.yaml";
    private static final Logger logger = LoggerFactory.getLogger(Vocabulary.class);

    /** YAML binding for the vocabulary resource. */
    public static final class Tables {
        public Map<String, String> roles;
        public Map<String, String> states;
        public Map<String, String> actions;
    }

    private final Table roles;
    private final Table states;
    private final Table actions;

    private Vocabulary(Tables tables) {
        this.roles = new Table("roles", tables.roles);
        this.states = new Table("states", tables.states);
        this.actions = new Table("actions", tables.actions);
    }

    /** Returns the standard vocabulary, loading it on first use. */
    public static Vocabulary standard() {
        return StandardHolder.INSTANCE;
    }

    private static final class StandardHolder {
        static final Vocabulary INSTANCE = fromResource(DEFAULT_VOCABULARY_RESOURCE);
    }

    /** Reads the code tables from a classpath resource such as {@code /cup-vocabulary.yaml}. */
    public static Vocabulary fromResource(String resourcePath) {
        InputStream in = Vocabulary.class.getResourceAsStream(resourcePath);
        if (in == null) {
            throw new IllegalArgumentException("No vocabulary resource at " + resourcePath);
        }

        Tables tables;
        try (in) {
            tables = new Yaml(new Constructor(Tables.class, new LoaderOptions())).load(in);
        } catch (IOException | YAMLException e) {
            logger.error("Vocabulary tables in {} could not be parsed", resourcePath, e);
            throw new IllegalStateException("Unreadable vocabulary tables in " + resourcePath, e);
        }
        if (tables == null) {
            throw new IllegalArgumentException("Vocabulary resource " + resourcePath + " is empty");
        }

        Vocabulary vocabulary = new Vocabulary(tables);
        List<String> ambiguities = vocabulary.validateConsistency();
        for (String ambiguity : ambiguities) {
            logger.warn("{} ({})", ambiguity, resourcePath);
        }
        logger.debug(
                "{}: {} role, {} state and {} action codes, {} ambiguous",
                resourcePath,
                vocabulary.roles.size(),
                vocabulary.states.size(),
                vocabulary.actions.size(),
                ambiguities.size());
        return vocabulary;
    }

    public String shortRole(String role) {
        return roles.toShort(role);
    }

    public String shortState(String state) {
        return states.toShort(state);
    }

    public String shortAction(String action) {
        return actions.toShort(action);
    }

    public String canonicalRole(String code) {
        return roles.toCanonical(code);
    }

    public String canonicalState(String code) {
        return states.toCanonical(code);
    }

    public String canonicalAction(String code) {
        return actions.toCanonical(code);
    }

    public boolean isKnownRole(String role) {
        return roles.contains(role);
    }

    public boolean isKnownState(String state) {
        return states.contains(state);
    }

    public boolean isKnownAction(String action) {
        return actions.contains(action);
    }

    public Map<String, String> roles() {
        return roles.byName;
    }

    public Map<String, String> states() {
        return states.byName;
    }

    public Map<String, String> actions() {
        return actions.byName;
    }

    /**
     * Checks that every table can be read in both directions and returns a warning for each short
     * code that is claimed by more than one name (empty if the vocabulary is consistent).
     */
    public List<String> validateConsistency() {
        List<String> warnings = new ArrayList<>();
        roles.collectDuplicates(warnings);
        states.collectDuplicates(warnings);
        actions.collectDuplicates(warnings);
        return warnings;
    }

    /** One direction-aware table; the reverse map keeps the first name claiming a code. */
    private static final class Table {
        private final String label;
        private final Map<String, String> byName;
        private final Map<String, String> byCode;
        private final Map<String, List<String>> claims = new LinkedHashMap<>();

        Table(String label, Map<String, String> entries) {
            this.label = label;
            Map<String, String> names = new LinkedHashMap<>();
            Map<String, String> codes = new HashMap<>();
            if (entries != null) {
                for (Map.Entry<String, String> e : entries.entrySet()) {
                    String name = e.getKey();
                    String code = e.getValue();
                    names.put(name, code);
                    codes.putIfAbsent(code, name);
                    claims.computeIfAbsent(code, c -> new ArrayList<>()).add(name);
                }
            }
            this.byName = Collections.unmodifiableMap(names);
            this.byCode = Collections.unmodifiableMap(codes);
        }

        String toShort(String name) {
            return byName.getOrDefault(name, name);
        }

        String toCanonical(String code) {
            return byCode.getOrDefault(code, code);
        }

        boolean contains(String name) {
            return byName.containsKey(name);
        }

        int size() {
            return byName.size();
        }

        void collectDuplicates(List<String> warnings) {
            for (Map.Entry<String, List<String>> e : claims.entrySet()) {
                if (e.getValue().size() > 1) {
                    warnings.add(
                            String.format(
                                    "Ambiguous %s code '%s' is used by %s",
                                    label, e.getKey(), String.join(", ", e.getValue())));
                }
            }
        }
    }
}
