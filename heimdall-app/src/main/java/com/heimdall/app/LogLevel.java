package com.heimdall.app;

import ch.qos.logback.classic.Level;

import java.util.Locale;

/**
 * Levels accepted by {@code --log-level} and {@code app.logging_level}. WARNING and CRITICAL map onto
 * Logback's WARN and ERROR.
 */
public enum LogLevel {
    DEBUG(Level.DEBUG),
    INFO(Level.INFO),
    WARNING(Level.WARN),
    ERROR(Level.ERROR),
    CRITICAL(Level.ERROR);

    private final Level logbackLevel;

    LogLevel(Level logbackLevel) {
        this.logbackLevel = logbackLevel;
    }

    public Level toLogback() {
        return logbackLevel;
    }

    /**
     * Case-insensitive; {@code WARN} is accepted for WARNING.
     *
     * @throws IllegalArgumentException for anything else
     */
    public static LogLevel parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("log level must be non-blank");
        }
        String upper = text.trim().toUpperCase(Locale.ROOT);
        if ("WARN".equals(upper)) return WARNING;
        try {
            return valueOf(upper);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown log level: " + text
                    + " (expected DEBUG, INFO, WARNING, ERROR or CRITICAL)", e);
        }
    }
}
