package com.heimdall.plugin;

import java.util.List;

/**
 * Why a plugin did not become active. The chain lists the plugin ids involved, starting with the affected
 * plugin (e.g. {@code [report, finance, market-data]} when report needs finance, which needs a missing
 * market-data; {@code [a, b, a]} for a cycle).
 */
public class PluginLoadException extends RuntimeException {

    public enum Kind {
        CYCLIC_DEPENDENCY,
        MISSING_DEPENDENCY,
        VERSION_MISMATCH,
        INITIALIZATION_FAILED,
        /** An active plugin was declared failed by the embedding application. */
        RUNTIME_FAILURE
    }

    private final Kind kind;
    private final String pluginId;
    private final List<String> chain;

    public PluginLoadException(Kind kind, String pluginId, List<String> chain, String message) {
        this(kind, pluginId, chain, message, null);
    }

    public PluginLoadException(Kind kind, String pluginId, List<String> chain, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.pluginId = pluginId;
        this.chain = chain != null ? List.copyOf(chain) : List.of(pluginId);
    }

    public Kind getKind() {
        return kind;
    }

    public String getPluginId() {
        return pluginId;
    }

    public List<String> getChain() {
        return chain;
    }
}
