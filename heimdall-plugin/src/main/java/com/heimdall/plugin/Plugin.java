package com.heimdall.plugin;

import java.util.List;

/**
 * Contract implemented by every plugin. A plugin sees the runtime only through the {@link PluginContext}
 * passed to {@link #initialize(PluginContext)}; it never holds a reference to another plugin.
 * <p>
 * Classpath and directory plugins are listed in {@code META-INF/services/com.heimdall.plugin.Plugin} and
 * annotated with {@link com.heimdall.annotations.HeimdallPlugin}, so their descriptor is known before the
 * class is instantiated.
 */
public interface Plugin {

    /** Static metadata; must match the {@code @HeimdallPlugin} annotation when present. */
    PluginDescriptor descriptor();

    /**
     * Subscribes to events, registers services and prepares state. A thrown exception fails the plugin and
     * rolls back everything it registered.
     */
    void initialize(PluginContext context) throws Exception;

    /**
     * Releases resources. Subscriptions, services and pending tasks of the plugin are removed by the
     * runtime afterwards whether or not this throws.
     */
    void shutdown() throws Exception;

    /** UI contributions; not registered in headless mode. */
    default List<UiComponent> uiComponents() {
        return List.of();
    }

    /** Data sets the export collaborator can write out. */
    default List<ExportSource> exportSources() {
        return List.of();
    }
}
