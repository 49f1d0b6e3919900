package com.heimdall.config;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;

class EnvironmentConfigSourceTest {

    @Test
    void read_mapsSectionAndKeyAndParsesValues() {
        EnvironmentConfigSource source = new EnvironmentConfigSource("APP_", () -> Map.of(
                "APP_EXECUTOR_POOL_SIZE", "4",
                "APP_R_INTEGRATION", "x",
                "APP_UI_THEME", "dark",
                "APP_CONFIG_WATCH_FILES", "yes",
                "APP_HOME", "/ignored",
                "PATH", "/usr/bin"));

        Map<String, Object> values = source.read().values();

        assertEquals(4, values.get("executor.pool_size"));
        assertEquals("dark", values.get("ui.theme"));
        assertEquals(Boolean.TRUE, values.get("config.watch_files"));
        assertEquals("x", values.get("r.integration"));
        assertFalse(values.containsKey("home"));
        assertEquals(4, values.size());
    }

    @Test
    void toConfigKey_rejectsNamesWithoutKeySegment() {
        EnvironmentConfigSource source = new EnvironmentConfigSource("APP_", Map::of);

        assertNull(source.toConfigKey("APP_"));
        assertNull(source.toConfigKey("APP_SECTION"));
        assertNull(source.toConfigKey("APP_SECTION_"));
        assertNull(source.toConfigKey("OTHER_SECTION_KEY"));
        assertEquals("section.key_part", source.toConfigKey("APP_SECTION_KEY_PART"));
    }
}
