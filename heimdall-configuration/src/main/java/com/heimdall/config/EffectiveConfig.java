package com.heimdall.config;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Merged, read-only configuration snapshot. A snapshot never changes after construction; reload
 * produces a new snapshot with a higher version, so a reader holding an old reference keeps a
 * consistent view and can detect staleness by comparing {@link #version()}.
 */
public final class EffectiveConfig implements ConfigReader {

    private static final EffectiveConfig EMPTY = new EffectiveConfig(0L, Map.of(), Map.of(), List.of(), Instant.EPOCH);

    private final long version;
    private final Map<String, Object> values;
    private final Map<String, String> origins;
    private final List<ConfigIssue> issues;
    private final Instant loadedAt;

    EffectiveConfig(long version, Map<String, Object> values, Map<String, String> origins,
                    List<ConfigIssue> issues, Instant loadedAt) {
        this.version = version;
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
        this.origins = Collections.unmodifiableMap(new LinkedHashMap<>(origins));
        this.issues = List.copyOf(issues);
        this.loadedAt = Objects.requireNonNull(loadedAt, "loadedAt");
    }

    /** Snapshot with version 0 and no keys; what a manager answers with before the first load. */
    public static EffectiveConfig empty() {
        return EMPTY;
    }

    @Override
    public <T> T get(String key, Class<T> type) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(type, "type");
        if (!values.containsKey(key)) {
            throw new ConfigException(ConfigException.Kind.MISSING_KEY, key, "Missing configuration key: " + key);
        }
        Object raw = values.get(key);
        try {
            return ConfigValues.coerce(raw, type);
        } catch (IllegalArgumentException e) {
            throw new ConfigException(ConfigException.Kind.TYPE_MISMATCH, key,
                    "Configuration key " + key + " (value " + raw + ") is not a " + type.getSimpleName(), e);
        }
    }

    @Override
    public boolean contains(String key) {
        return key != null && values.containsKey(key);
    }

    @Override
    public long version() {
        return version;
    }

    @Override
    public Set<String> keys() {
        return values.keySet();
    }

    /** True if {@code other} is a later snapshot than this one. */
    public boolean isStaleComparedTo(EffectiveConfig other) {
        return other != null && other.version > version;
    }

    /** Raw merged values (flat dotted keys), unmodifiable. */
    public Map<String, Object> asMap() {
        return values;
    }

    /** Tag of the source that supplied the effective value of {@code key}, or null. */
    public String originOf(String key) {
        return origins.get(key);
    }

    /** Non-fatal problems encountered while building this snapshot (e.g. unreadable optional file). */
    public List<ConfigIssue> getIssues() {
        return issues;
    }

    public Instant getLoadedAt() {
        return loadedAt;
    }

    /** Key-level difference from this snapshot to {@code next}. */
    public ConfigDiff diff(EffectiveConfig next) {
        return ConfigDiff.between(version, values, next.version, next.values);
    }

    @Override
    public String toString() {
        return "EffectiveConfig{version=" + version + ", keys=" + values.size() + ", issues=" + issues.size() + "}";
    }
}
