package com.heimdall.config;

/**
 * One problem found while loading configuration, reported per key (or per source when the whole
 * source could not be read).
 *
 * @param key     affected key; for unreadable sources the source tag
 * @param kind    issue kind
 * @param source  tag of the source involved, or null when the issue is not tied to one source
 * @param message human-readable description
 */
public record ConfigIssue(String key, ConfigException.Kind kind, String source, String message) {

    @Override
    public String toString() {
        return kind + " " + key + (source != null ? " (" + source + ")" : "") + ": " + message;
    }
}
