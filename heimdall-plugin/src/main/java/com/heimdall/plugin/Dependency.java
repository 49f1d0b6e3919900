package com.heimdall.plugin;

import java.util.Objects;

/**
 * A declared dependency: another plugin's id and the versions of it this plugin accepts.
 */
public record Dependency(String pluginId, VersionRange range) {

    public Dependency {
        Objects.requireNonNull(pluginId, "pluginId");
        if (pluginId.isBlank()) {
            throw new IllegalArgumentException("dependency id must be non-blank");
        }
        range = range != null ? range : VersionRange.ANY;
    }

    public static Dependency on(String pluginId) {
        return new Dependency(pluginId, VersionRange.ANY);
    }

    public static Dependency on(String pluginId, String range) {
        return new Dependency(pluginId, VersionRange.parse(range));
    }

    @Override
    public String toString() {
        return pluginId + (range.isAny() ? "" : "@" + range);
    }
}
