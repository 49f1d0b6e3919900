package com.heimdall.plugin;

import java.util.EnumSet;
import java.util.Set;

/**
 * Plugin lifecycle: DISCOVERED → RESOLVED → INITIALIZING → ACTIVE → SHUTTING_DOWN → STOPPED.
 * FAILED is reachable from DISCOVERED (resolution failure), RESOLVED, INITIALIZING and ACTIVE.
 */
public enum PluginState {
    DISCOVERED,
    RESOLVED,
    INITIALIZING,
    ACTIVE,
    SHUTTING_DOWN,
    STOPPED,
    FAILED;

    public boolean canTransitionTo(PluginState next) {
        return allowedNext().contains(next);
    }

    private Set<PluginState> allowedNext() {
        switch (this) {
            case DISCOVERED: return EnumSet.of(RESOLVED, FAILED);
            case RESOLVED: return EnumSet.of(INITIALIZING, FAILED);
            case INITIALIZING: return EnumSet.of(ACTIVE, FAILED);
            case ACTIVE: return EnumSet.of(SHUTTING_DOWN, FAILED);
            case SHUTTING_DOWN: return EnumSet.of(STOPPED);
            default: return EnumSet.noneOf(PluginState.class);
        }
    }

    public boolean isTerminal() {
        return this == STOPPED || this == FAILED;
    }
}
