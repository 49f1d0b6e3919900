package com.heimdall.plugin;

import java.util.List;

/**
 * Per-plugin line of the startup report.
 *
 * @param pluginId    plugin id
 * @param version     plugin version
 * @param source      name of the source it was discovered from
 * @param state       state after startup
 * @param failureKind set when FAILED
 * @param message     failure message when FAILED
 * @param chain       offending chain when FAILED
 */
public record PluginOutcome(String pluginId, String version, String source, PluginState state,
                            PluginLoadException.Kind failureKind, String message, List<String> chain) {

    public PluginOutcome {
        chain = chain != null ? List.copyOf(chain) : List.of();
    }

    public boolean isActive() {
        return state == PluginState.ACTIVE;
    }
}
