package com.heimdall.plugin;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Plugins constructed in process (embedding applications, tests). Their descriptor comes from
 * {@link Plugin#descriptor()}.
 */
public final class StaticPluginSource implements PluginSource {

    private final String name;
    private final List<Plugin> plugins;

    public StaticPluginSource(String name, List<? extends Plugin> plugins) {
        this.name = name;
        this.plugins = List.copyOf(plugins);
    }

    public static StaticPluginSource of(Plugin... plugins) {
        return new StaticPluginSource("static", Arrays.asList(plugins));
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public List<PluginCandidate> discover() {
        List<PluginCandidate> out = new ArrayList<>();
        for (Plugin plugin : plugins) {
            out.add(new PluginCandidate(plugin.descriptor(), name, () -> plugin));
        }
        return out;
    }
}
