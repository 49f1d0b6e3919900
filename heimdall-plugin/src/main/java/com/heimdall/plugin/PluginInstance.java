package com.heimdall.plugin;

import java.util.Objects;

/**
 * Runtime record of one discovered plugin: candidate, lifecycle state and, once initialized, the plugin
 * object and its context. Mutated only by {@link PluginManager} under its lock.
 */
public final class PluginInstance {

    private final PluginCandidate candidate;
    private volatile PluginState state = PluginState.DISCOVERED;
    private Plugin plugin;
    private DefaultPluginContext context;
    private PluginLoadException failure;

    PluginInstance(PluginCandidate candidate) {
        this.candidate = Objects.requireNonNull(candidate, "candidate");
    }

    public String id() {
        return candidate.id();
    }

    public PluginDescriptor descriptor() {
        return candidate.descriptor();
    }

    public String sourceName() {
        return candidate.sourceName();
    }

    public PluginState state() {
        return state;
    }

    /** Why the plugin failed, or null. */
    public PluginLoadException failure() {
        return failure;
    }

    PluginCandidate candidate() {
        return candidate;
    }

    Plugin plugin() {
        return plugin;
    }

    DefaultPluginContext context() {
        return context;
    }

    void attach(Plugin plugin, DefaultPluginContext context) {
        this.plugin = plugin;
        this.context = context;
    }

    void transitionTo(PluginState next) {
        if (!state.canTransitionTo(next)) {
            throw new IllegalStateException("Plugin " + id() + " cannot move from " + state + " to " + next);
        }
        state = next;
    }

    void fail(PluginLoadException cause) {
        transitionTo(PluginState.FAILED);
        this.failure = cause;
    }

    PluginOutcome outcome() {
        PluginLoadException f = failure;
        return new PluginOutcome(id(), descriptor().version().toString(), sourceName(), state,
                f != null ? f.getKind() : null, f != null ? f.getMessage() : null, f != null ? f.getChain() : null);
    }

    @Override
    public String toString() {
        return "PluginInstance{" + descriptor() + ", state=" + state + "}";
    }
}
