package com.heimdall.config;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown when configuration cannot be loaded or a value cannot be read as requested.
 * When a load finds several problems at once, all of them are available from {@link #getIssues()}.
 */
public final class ConfigException extends RuntimeException {

    public enum Kind {
        /** A required key is absent, or a requested key does not exist. */
        MISSING_KEY,
        /** A value cannot be coerced to the declared or requested type. */
        TYPE_MISMATCH,
        /** A source (file) could not be read or parsed. */
        SOURCE_UNREADABLE
    }

    private final Kind kind;
    private final String key;
    private final List<ConfigIssue> issues;

    public ConfigException(Kind kind, String key, String message) {
        this(kind, key, message, null);
    }

    public ConfigException(Kind kind, String key, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.key = key;
        this.issues = List.of(new ConfigIssue(key, kind, null, message));
    }

    /**
     * Aggregates several issues into one failure. The kind and key of the first issue are reported
     * by {@link #getKind()} and {@link #getKey()}.
     */
    public ConfigException(List<ConfigIssue> issues) {
        super(issues == null || issues.isEmpty()
                ? "Configuration invalid"
                : issues.stream().map(ConfigIssue::toString).collect(Collectors.joining("; ")));
        if (issues == null || issues.isEmpty()) {
            throw new IllegalArgumentException("issues must be non-empty");
        }
        this.kind = issues.get(0).kind();
        this.key = issues.get(0).key();
        this.issues = List.copyOf(issues);
    }

    public Kind getKind() {
        return kind;
    }

    public String getKey() {
        return key;
    }

    public List<ConfigIssue> getIssues() {
        return issues;
    }
}
