package com.heimdall.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Explicit overrides (CLI {@code --set key=value}, runtime {@link ConfigurationManager#set(String, Object)}).
 * Highest precedence. Mutations take effect on the next reload.
 */
public final class OverrideConfigSource implements ConfigSource {

    private final String tag;
    private final Map<String, Object> values = new LinkedHashMap<>();

    public OverrideConfigSource(String tag) {
        this.tag = "override:" + Objects.requireNonNull(tag, "tag");
    }

    public synchronized void put(String key, Object value) {
        Objects.requireNonNull(key, "key");
        values.put(key.trim(), value);
    }

    /**
     * Parses {@code key=value} (value via {@link ConfigValues#parseRaw(String)}).
     *
     * @throws IllegalArgumentException when there is no '=' or the key is blank
     */
    public void putAssignment(String assignment) {
        int eq = assignment != null ? assignment.indexOf('=') : -1;
        if (eq <= 0) {
            throw new IllegalArgumentException("Expected key=value but got: " + assignment);
        }
        put(assignment.substring(0, eq), ConfigValues.parseRaw(assignment.substring(eq + 1)));
    }

    public synchronized boolean remove(String key) {
        return values.remove(key) != null;
    }

    @Override
    public String tag() {
        return tag;
    }

    @Override
    public ConfigLayer layer() {
        return ConfigLayer.OVERRIDE;
    }

    @Override
    public synchronized ConfigNode read() {
        return new ConfigNode(tag, ConfigLayer.OVERRIDE, values);
    }
}
