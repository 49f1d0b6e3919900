package com.heimdall.plugin.fixtures;

import com.heimdall.plugin.Plugin;
import com.heimdall.plugin.PluginContext;
import com.heimdall.plugin.PluginDescriptor;

public class UnannotatedFixturePlugin implements Plugin {

    @Override
    public PluginDescriptor descriptor() {
        return PluginDescriptor.of("fixture.unannotated", "1.0.0");
    }

    @Override
    public void initialize(PluginContext context) {
    }

    @Override
    public void shutdown() {
    }
}
