package com.heimdall.plugin;

import com.heimdall.annotations.HeimdallPlugin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;

/**
 * Plugins listed in {@code META-INF/services/com.heimdall.plugin.Plugin} of a class loader. The descriptor is
 * read from {@link HeimdallPlugin} on the provider type; the class is instantiated only when the manager
 * initializes it. Providers without the annotation are skipped with a warning.
 */
public final class ServiceLoaderPluginSource implements PluginSource {

    private static final Logger log = LoggerFactory.getLogger(ServiceLoaderPluginSource.class);

    private final String name;
    private final ClassLoader classLoader;

    public ServiceLoaderPluginSource() {
        this("classpath", ServiceLoaderPluginSource.class.getClassLoader());
    }

    public ServiceLoaderPluginSource(String name, ClassLoader classLoader) {
        this.name = name;
        this.classLoader = classLoader;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public List<PluginCandidate> discover() {
        List<PluginCandidate> out = new ArrayList<>();
        try {
            ServiceLoader.load(Plugin.class, classLoader).stream().forEach(provider -> {
                Class<? extends Plugin> type;
                try {
                    type = provider.type();
                } catch (ServiceConfigurationError e) {
                    log.error("Plugin provider in {} could not be loaded (skipping): {}", name, e.getMessage());
                    return;
                }
                HeimdallPlugin annotation = type.getAnnotation(HeimdallPlugin.class);
                if (annotation == null) {
                    log.warn("Plugin class {} in {} has no @HeimdallPlugin annotation (skipping)", type.getName(), name);
                    return;
                }
                try {
                    out.add(new PluginCandidate(PluginDescriptor.fromAnnotation(annotation), name, provider::get));
                } catch (IllegalArgumentException e) {
                    log.error("Plugin class {} in {} has an invalid descriptor (skipping): {}",
                            type.getName(), name, e.getMessage());
                }
            });
        } catch (ServiceConfigurationError e) {
            log.error("Failed to list plugin providers in {}: {}", name, e.getMessage(), e);
        }
        return out;
    }
}
