/**
 * Layered configuration: defaults, JSON files, {@code APP_*} environment variables and explicit
 * overrides merged key-by-key into versioned immutable {@link com.heimdall.config.EffectiveConfig}
 * snapshots by the {@link com.heimdall.config.ConfigurationManager}.
 */
package com.heimdall.config;
