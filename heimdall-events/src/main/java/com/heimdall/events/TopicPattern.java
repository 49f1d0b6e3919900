package com.heimdall.events;

import java.util.Objects;

/**
 * Topic filter of a subscription: {@code *} (every topic), a trailing wildcard {@code export.*}
 * (every topic below {@code export.}) or an exact topic.
 */
public record TopicPattern(String value) {

    public static final String WILDCARD = "*";

    public TopicPattern {
        Objects.requireNonNull(value, "value");
        value = value.trim();
        if (value.isEmpty()) {
            throw new IllegalArgumentException("topic pattern must be non-blank");
        }
        int star = value.indexOf('*');
        if (star >= 0 && !(value.equals(WILDCARD) || (value.endsWith(".*") && star == value.length() - 1))) {
            throw new IllegalArgumentException("Wildcard only allowed as '*' or trailing '.*': " + value);
        }
    }

    public static TopicPattern of(String value) {
        return new TopicPattern(value);
    }

    public boolean matches(String topic) {
        if (topic == null) return false;
        if (WILDCARD.equals(value)) return true;
        if (value.endsWith(".*")) {
            String prefix = value.substring(0, value.length() - 1);
            return topic.startsWith(prefix) && topic.length() > prefix.length();
        }
        return value.equals(topic);
    }

    @Override
    public String toString() {
        return value;
    }
}
