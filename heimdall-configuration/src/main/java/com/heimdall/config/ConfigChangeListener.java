package com.heimdall.config;

/**
 * Notified after a reload produced a new effective configuration version.
 */
@FunctionalInterface
public interface ConfigChangeListener {

    /**
     * @param config the new snapshot
     * @param diff   keys added, removed or changed since the previous snapshot (never empty)
     */
    void onChange(EffectiveConfig config, ConfigDiff diff);
}
