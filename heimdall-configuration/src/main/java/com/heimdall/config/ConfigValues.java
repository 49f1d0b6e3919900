package com.heimdall.config;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Value conversion shared by all configuration layers: parsing raw strings from the environment and
 * coercing stored values to the type a caller asks for.
 */
public final class ConfigValues {

    private ConfigValues() {
    }

    /**
     * Converts a raw string (environment variable, CLI override) to the most specific value:
     * {@code true/false/yes/no} to Boolean, integer literals to Integer (or Long when out of int range),
     * decimal literals to Double, anything else stays a String.
     */
    public static Object parseRaw(String raw) {
        if (raw == null) return null;
        String v = raw.trim();
        String lower = v.toLowerCase(Locale.ROOT);
        if ("true".equals(lower) || "yes".equals(lower)) return Boolean.TRUE;
        if ("false".equals(lower) || "no".equals(lower)) return Boolean.FALSE;
        try {
            long l = Long.parseLong(v);
            if (l >= Integer.MIN_VALUE && l <= Integer.MAX_VALUE) return (int) l;
            return l;
        } catch (NumberFormatException ignored) {
            // not an integer literal
        }
        if (looksDecimal(v)) {
            try {
                return Double.parseDouble(v);
            } catch (NumberFormatException ignored) {
                // not a decimal literal
            }
        }
        return raw;
    }

    private static boolean looksDecimal(String v) {
        return !v.isEmpty() && (Character.isDigit(v.charAt(0)) || v.charAt(0) == '-' || v.charAt(0) == '.')
                && !v.endsWith("d") && !v.endsWith("f") && !v.endsWith("D") && !v.endsWith("F");
    }

    /**
     * Coerces a stored value to the requested type.
     *
     * @throws IllegalArgumentException when the value cannot be represented as {@code type}
     */
    @SuppressWarnings({"unchecked", "rawtypes"})
    public static <T> T coerce(Object value, Class<T> type) {
        if (value == null) {
            throw new IllegalArgumentException("value is null");
        }
        if (type.isInstance(value)) {
            return type.cast(value);
        }
        if (type == String.class) {
            if (value instanceof Collection<?> c) {
                return type.cast(c.stream().map(String::valueOf).collect(Collectors.joining(",")));
            }
            return type.cast(String.valueOf(value));
        }
        if (type == Integer.class || type == int.class) {
            long l = toLong(value);
            if (l < Integer.MIN_VALUE || l > Integer.MAX_VALUE) {
                throw new IllegalArgumentException("out of int range: " + value);
            }
            return (T) Integer.valueOf((int) l);
        }
        if (type == Long.class || type == long.class) {
            return (T) Long.valueOf(toLong(value));
        }
        if (type == Double.class || type == double.class) {
            return (T) Double.valueOf(toDouble(value));
        }
        if (type == Boolean.class || type == boolean.class) {
            return (T) toBoolean(value);
        }
        if (type == List.class) {
            return (T) toList(value);
        }
        if (type.isEnum() && value instanceof String s) {
            return (T) Enum.valueOf((Class<? extends Enum>) type, s.trim().toUpperCase(Locale.ROOT));
        }
        throw new IllegalArgumentException("cannot convert " + value.getClass().getSimpleName() + " to " + type.getSimpleName());
    }

    /** Whether {@code value} can be coerced to {@code type}. */
    public static boolean isCoercible(Object value, Class<?> type) {
        try {
            coerce(value, type);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    private static long toLong(Object value) {
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof Number n) {
            double d = n.doubleValue();
            if (d != Math.rint(d)) {
                throw new IllegalArgumentException("not an integral number: " + value);
            }
            return (long) d;
        }
        if (value instanceof String s) {
            return Long.parseLong(s.trim());
        }
        throw new IllegalArgumentException("not a number: " + value);
    }

    private static double toDouble(Object value) {
        if (value instanceof Number n) return n.doubleValue();
        if (value instanceof String s) return Double.parseDouble(s.trim());
        throw new IllegalArgumentException("not a number: " + value);
    }

    private static Boolean toBoolean(Object value) {
        if (value instanceof String s) {
            Object parsed = parseRaw(s);
            if (parsed instanceof Boolean b) return b;
        }
        throw new IllegalArgumentException("not a boolean: " + value);
    }

    private static List<Object> toList(Object value) {
        if (value instanceof Collection<?> c) {
            return Collections.unmodifiableList(new ArrayList<>(c));
        }
        if (value instanceof String s) {
            if (s.isBlank()) return List.of();
            return Stream.of(s.split(","))
                    .map(String::trim)
                    .filter(x -> !x.isEmpty())
                    .collect(Collectors.toUnmodifiableList());
        }
        return List.of(value);
    }
}
