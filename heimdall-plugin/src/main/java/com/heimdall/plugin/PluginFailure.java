package com.heimdall.plugin;

import java.util.List;

/**
 * Payload of {@code plugin.failed}.
 */
public record PluginFailure(String pluginId, PluginLoadException.Kind kind, String message, List<String> chain) {

    public PluginFailure {
        chain = chain != null ? List.copyOf(chain) : List.of();
    }

    static PluginFailure of(PluginLoadException e) {
        return new PluginFailure(e.getPluginId(), e.getKind(), e.getMessage(), e.getChain());
    }
}
