package com.heimdall.config;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Read-only access to configuration. Plugins receive configuration through this interface only;
 * reload and overrides stay with the owner of the {@link ConfigurationManager}.
 */
public interface ConfigReader {

    /**
     * Returns the value for {@code key} coerced to {@code type}.
     *
     * @throws ConfigException {@link ConfigException.Kind#MISSING_KEY} when absent,
     *                         {@link ConfigException.Kind#TYPE_MISMATCH} when not coercible
     */
    <T> T get(String key, Class<T> type);

    boolean contains(String key);

    /** Version of the snapshot this reader currently answers from. */
    long version();

    /** All keys present in the snapshot. */
    Set<String> keys();

    /** Value for {@code key}, or {@code defaultValue} when the key is absent. */
    default <T> T getOrDefault(String key, Class<T> type, T defaultValue) {
        return contains(key) ? get(key, type) : defaultValue;
    }

    default String getString(String key) {
        return get(key, String.class);
    }

    default int getInt(String key, int defaultValue) {
        return getOrDefault(key, Integer.class, defaultValue);
    }

    default long getLong(String key, long defaultValue) {
        return getOrDefault(key, Long.class, defaultValue);
    }

    default double getDouble(String key, double defaultValue) {
        return getOrDefault(key, Double.class, defaultValue);
    }

    default boolean getBoolean(String key, boolean defaultValue) {
        return getOrDefault(key, Boolean.class, defaultValue);
    }

    /** List value as strings; a comma-separated string is split. Absent key → empty list. */
    default List<String> getStringList(String key) {
        if (!contains(key)) return List.of();
        List<?> raw = get(key, List.class);
        return raw.stream().map(String::valueOf).collect(Collectors.toUnmodifiableList());
    }
}
