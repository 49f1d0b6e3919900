package com.heimdall.plugin;

import java.util.Objects;

/**
 * A discovered plugin: its descriptor plus the means to create it once resolution succeeded.
 *
 * @param descriptor static metadata
 * @param sourceName name of the {@link PluginSource} that found it
 * @param factory    creates the instance; not called before resolution
 */
public record PluginCandidate(PluginDescriptor descriptor, String sourceName, Factory factory) {

    /** Creates the plugin instance. */
    @FunctionalInterface
    public interface Factory {
        Plugin create() throws Exception;
    }

    public PluginCandidate {
        Objects.requireNonNull(descriptor, "descriptor");
        Objects.requireNonNull(sourceName, "sourceName");
        Objects.requireNonNull(factory, "factory");
    }

    public String id() {
        return descriptor.id();
    }
}
