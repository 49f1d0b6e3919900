package com.heimdall.plugin;

import java.util.ArrayList;
import java.util.List;

/** Configurable in-process plugin that records lifecycle calls into a shared journal. */
class TestPlugin implements Plugin {

    interface InitAction {
        void run(PluginContext context) throws Exception;
    }

    private final PluginDescriptor descriptor;
    private final List<String> journal;
    private InitAction onInit = context -> { };
    private boolean failShutdown;
    private final List<UiComponent> ui = new ArrayList<>();
    private final List<ExportSource> exports = new ArrayList<>();
    PluginContext context;

    TestPlugin(PluginDescriptor descriptor, List<String> journal) {
        this.descriptor = descriptor;
        this.journal = journal;
    }

    TestPlugin onInit(InitAction action) {
        this.onInit = action;
        return this;
    }

    TestPlugin failingShutdown() {
        this.failShutdown = true;
        return this;
    }

    TestPlugin withUi(String id) {
        ui.add(new UiComponent() {
            @Override
            public String id() {
                return id;
            }

            @Override
            public String title() {
                return id.toUpperCase();
            }
        });
        return this;
    }

    TestPlugin withExport(String fileName) {
        exports.add(new ExportSource() {
            @Override
            public Iterable<java.util.Map<String, Object>> rows() {
                return List.of();
            }

            @Override
            public List<String> fieldNames() {
                return List.of("symbol", "value");
            }

            @Override
            public String suggestedFileName() {
                return fileName;
            }
        });
        return this;
    }

    @Override
    public PluginDescriptor descriptor() {
        return descriptor;
    }

    @Override
    public void initialize(PluginContext context) throws Exception {
        this.context = context;
        journal.add("init:" + descriptor.id());
        onInit.run(context);
    }

    @Override
    public void shutdown() {
        journal.add("shutdown:" + descriptor.id());
        if (failShutdown) {
            throw new IllegalStateException("shutdown failed for " + descriptor.id());
        }
    }

    @Override
    public List<UiComponent> uiComponents() {
        return ui;
    }

    @Override
    public List<ExportSource> exportSources() {
        return exports;
    }
}
