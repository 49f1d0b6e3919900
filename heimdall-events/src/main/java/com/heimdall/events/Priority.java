package com.heimdall.events;

/**
 * Priority of an event envelope or a submitted task. Declared from lowest to highest.
 */
public enum Priority {
    LOW,
    NORMAL,
    HIGH;

    public boolean isAtLeast(Priority other) {
        return compareTo(other) >= 0;
    }
}
