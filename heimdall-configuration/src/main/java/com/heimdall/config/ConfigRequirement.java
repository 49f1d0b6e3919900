package com.heimdall.config;

import java.util.Objects;

/**
 * Declares a key the application relies on: its expected type, whether it must be present and, for numeric
 * keys, the smallest accepted value. Declared keys are validated on every load and reload; undeclared keys
 * are retained unchecked.
 *
 * @param minimum inclusive lower bound for numeric types, or null for none
 */
public record ConfigRequirement(String key, Class<?> type, boolean required, Long minimum) {

    public ConfigRequirement {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(type, "type");
        if (key.isBlank()) {
            throw new IllegalArgumentException("key must be non-blank");
        }
        if (minimum != null && !Number.class.isAssignableFrom(type)) {
            throw new IllegalArgumentException("minimum only applies to numeric keys: " + key);
        }
    }

    public static ConfigRequirement required(String key, Class<?> type) {
        return new ConfigRequirement(key, type, true, null);
    }

    public static ConfigRequirement optional(String key, Class<?> type) {
        return new ConfigRequirement(key, type, false, null);
    }

    /** Optional numeric key that must be at least {@code minimum} when set. */
    public static ConfigRequirement atLeast(String key, Class<? extends Number> type, long minimum) {
        return new ConfigRequirement(key, type, false, minimum);
    }

    /** True when {@code value}, already coercible to {@link #type()}, is below {@link #minimum()}. */
    boolean isBelowMinimum(Object value) {
        if (minimum == null) return false;
        Number n = (Number) ConfigValues.coerce(value, type);
        return n.doubleValue() < minimum;
    }
}
