package com.heimdall.config;

/**
 * Precedence rank of a configuration source. Higher ranks override lower ones key by key;
 * within one rank, sources listed later override earlier ones.
 */
public enum ConfigLayer {

    /** Compiled-in defaults. */
    DEFAULTS,

    /** JSON configuration file supplied by the caller. */
    FILE,

    /** Prefixed environment variables; always win over file values. */
    ENVIRONMENT,

    /** Explicit overrides (CLI {@code --set}, runtime {@code set}); win over everything. */
    OVERRIDE
}
