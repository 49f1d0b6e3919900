package com.heimdall.config;

/**
 * A source of one configuration layer. Sources are re-read on every {@link ConfigurationManager#reload()},
 * so a file edited on disk or a changed environment is picked up.
 */
public interface ConfigSource {

    /** Short tag identifying the source in reports and logs (e.g. {@code file:/etc/heimdall.json}). */
    String tag();

    /** Precedence rank of this source. */
    ConfigLayer layer();

    /**
     * Reads the current contents of this source.
     *
     * @return the layer (never null)
     * @throws ConfigException with kind {@link ConfigException.Kind#SOURCE_UNREADABLE} when the source cannot be read
     */
    ConfigNode read();

    /**
     * Whether a read failure of this source is fatal. Optional sources that fail are skipped and reported
     * as issues on the effective snapshot.
     */
    default boolean isRequired() {
        return false;
    }
}
