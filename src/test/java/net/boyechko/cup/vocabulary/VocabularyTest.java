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

import static org.junit.jupiter.api.Assertions.*;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.slf4j.LoggerFactory;

class VocabularyTest {

    @Test
    void standardTablesAreComplete() {
        Vocabulary vocabulary = Vocabulary.standard();
        assertEquals(59, vocabulary.roles().size());
        assertEquals(16, vocabulary.states().size());
        assertEquals(15, vocabulary.actions().size());
    }

    @Test
    void standardTablesAreUnambiguous() {
        assertEquals(List.of(), Vocabulary.standard().validateConsistency());
    }

    @Test
    void standardIsLoadedOnce() {
        assertSame(Vocabulary.standard(), Vocabulary.standard());
    }

    @ParameterizedTest
    @CsvSource({
        "button, btn",
        "link, lnk",
        "textbox, tbx",
        "heading, hdg",
        "navigation, nav",
        "generic, gen",
        "listitem, li",
        "window, win",
    })
    void shortensRoles(String role, String code) {
        assertEquals(code, Vocabulary.standard().shortRole(role));
        assertEquals(role, Vocabulary.standard().canonicalRole(code));
    }

    @Test
    void shortensStatesAndActions() {
        Vocabulary vocabulary = Vocabulary.standard();
        assertEquals("off", vocabulary.shortState("offscreen"));
        assertEquals("foc", vocabulary.shortState("focused"));
        assertEquals("clk", vocabulary.shortAction("click"));
        assertEquals("sv", vocabulary.shortAction("setvalue"));
        assertEquals("setvalue", vocabulary.canonicalAction("sv"));
        assertEquals("offscreen", vocabulary.canonicalState("off"));
    }

    @Test
    void unknownNamesPassThrough() {
        Vocabulary vocabulary = Vocabulary.standard();
        assertEquals("hologram", vocabulary.shortRole("hologram"));
        assertEquals("levitating", vocabulary.shortState("levitating"));
        assertEquals("teleport", vocabulary.shortAction("teleport"));
        assertEquals("zzz", vocabulary.canonicalRole("zzz"));
        assertFalse(vocabulary.isKnownRole("hologram"));
        assertTrue(vocabulary.isKnownRole("button"));
        assertTrue(vocabulary.isKnownState("offscreen"));
        assertTrue(vocabulary.isKnownAction("focus"));
    }

    @Test
    void tablesAreReadOnly() {
        assertThrows(
                UnsupportedOperationException.class,
                () -> Vocabulary.standard().roles().put("x", "y"));
    }

    @Test
    void ambiguousCodesAreReportedOnLoad() {
        Logger logger = (Logger) LoggerFactory.getLogger(Vocabulary.class);
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
        try {
            Vocabulary vocabulary = Vocabulary.fromResource("/cup-vocabulary-ambiguous.yaml");

            assertEquals(
                    List.of("Ambiguous roles code 'btn' is used by button, pushbutton"),
                    vocabulary.validateConsistency());
            assertEquals("button", vocabulary.canonicalRole("btn"), "First name keeps the code");
            assertTrue(
                    appender.list.stream()
                            .anyMatch(
                                    e ->
                                            e.getLevel() == Level.WARN
                                                    && e.getFormattedMessage()
                                                            .contains("Ambiguous roles code")));
        } finally {
            logger.detachAppender(appender);
        }
    }

    @Test
    void missingResourceFails() {
        RuntimeException e =
                assertThrows(
                        RuntimeException.class,
                        () -> Vocabulary.fromResource("/no-such-vocabulary.yaml"));
        assertEquals("No vocabulary resource at /no-such-vocabulary.yaml", e.getMessage());
    }
}
