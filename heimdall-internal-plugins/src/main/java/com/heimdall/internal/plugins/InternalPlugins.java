package com.heimdall.internal.plugins;

import com.heimdall.plugin.Plugin;
import com.heimdall.plugin.StaticPluginSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Plugins that ship with the runtime. The application adds {@link #createSource()} to the orchestrator's
 * plugin sources alongside the classpath and plugin-directory sources.
 */
public final class InternalPlugins {

    private static final Logger log = LoggerFactory.getLogger(InternalPlugins.class);

    public static final String SOURCE_NAME = "internal";

    private InternalPlugins() {
    }

    public static StaticPluginSource createSource() {
        List<Plugin> plugins = List.of(new EventJournalPlugin());
        log.debug("Internal plugins: {}", plugins.stream().map(p -> p.descriptor().id()).toList());
        return new StaticPluginSource(SOURCE_NAME, plugins);
    }
}
