package com.heimdall.config;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Compiled-in defaults. The map is copied at construction.
 */
public final class DefaultsConfigSource implements ConfigSource {

    private final String tag;
    private final Map<String, Object> values;

    public DefaultsConfigSource(Map<String, Object> values) {
        this("defaults", values);
    }

    public DefaultsConfigSource(String tag, Map<String, Object> values) {
        this.tag = tag;
        this.values = new LinkedHashMap<>(values != null ? values : Map.of());
    }

    @Override
    public String tag() {
        return tag;
    }

    @Override
    public ConfigLayer layer() {
        return ConfigLayer.DEFAULTS;
    }

    @Override
    public ConfigNode read() {
        return new ConfigNode(tag, ConfigLayer.DEFAULTS, values);
    }
}
