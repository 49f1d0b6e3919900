package com.heimdall.events;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TopicPatternTest {

    @Test
    void matches_trailingWildcardMatchesDescendantsOnly() {
        TopicPattern pattern = TopicPattern.of("export.*");

        assertTrue(pattern.matches("export.csv.completed"));
        assertTrue(pattern.matches("export.started"));
        assertFalse(pattern.matches("export"));
        assertFalse(pattern.matches("export."));
        assertFalse(pattern.matches("exports.csv"));
    }

    @Test
    void matches_exactAndGlobal() {
        assertTrue(TopicPattern.of("a.b").matches("a.b"));
        assertFalse(TopicPattern.of("a.b").matches("a.b.c"));
        assertTrue(TopicPattern.of("*").matches("anything.at.all"));
    }

    @Test
    void of_rejectsInnerWildcards() {
        assertThrows(IllegalArgumentException.class, () -> TopicPattern.of("a.*.c"));
        assertThrows(IllegalArgumentException.class, () -> TopicPattern.of("a*"));
        assertThrows(IllegalArgumentException.class, () -> TopicPattern.of(" "));
    }
}
