package com.heimdall.config;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConfigValuesTest {

    enum Mode { BLOCK, FAIL_FAST }

    @Test
    void parseRaw_detectsScalarTypes() {
        assertEquals(Boolean.TRUE, ConfigValues.parseRaw("true"));
        assertEquals(Boolean.FALSE, ConfigValues.parseRaw("No"));
        assertEquals(42, ConfigValues.parseRaw("42"));
        assertEquals(10_000_000_000L, ConfigValues.parseRaw("10000000000"));
        assertEquals(1.5, ConfigValues.parseRaw("1.5"));
        assertEquals("csv", ConfigValues.parseRaw("csv"));
    }

    @Test
    void coerce_convertsBetweenCompatibleTypes() {
        assertEquals(30L, ConfigValues.coerce(30, Long.class));
        assertEquals(30, ConfigValues.coerce("30", Integer.class));
        assertEquals("30", ConfigValues.coerce(30, String.class));
        assertEquals(2.0, ConfigValues.coerce(2, Double.class));
        assertEquals(Boolean.TRUE, ConfigValues.coerce("yes", Boolean.class));
        assertEquals(List.of("a", "b"), ConfigValues.coerce("a, b", List.class));
        assertEquals(Mode.FAIL_FAST, ConfigValues.coerce("fail_fast", Mode.class));
    }

    @Test
    void coerce_rejectsIncompatibleValues() {
        assertThrows(IllegalArgumentException.class, () -> ConfigValues.coerce("abc", Integer.class));
        assertThrows(IllegalArgumentException.class, () -> ConfigValues.coerce(1.5, Integer.class));
        assertThrows(IllegalArgumentException.class, () -> ConfigValues.coerce("maybe", Boolean.class));
        assertFalse(ConfigValues.isCoercible(null, String.class));
        assertTrue(ConfigValues.isCoercible(8, Integer.class));
    }
}
