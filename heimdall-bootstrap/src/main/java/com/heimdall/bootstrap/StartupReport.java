package com.heimdall.bootstrap;

import com.heimdall.config.ConfigIssue;
import com.heimdall.plugin.PluginOutcome;
import com.heimdall.plugin.PluginState;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregate result of {@link HeimdallOrchestrator#start}. A fatal report means the runtime did not start
 * (e.g. a required configuration key is missing); otherwise it lists what happened per plugin and per
 * configuration key, and startup went ahead with everything that resolved.
 */
public final class StartupReport {

    private final boolean fatal;
    private final String message;
    private final long configVersion;
    private final List<ConfigIssue> configIssues;
    private final List<PluginOutcome> plugins;
    private final List<String> services;

    private StartupReport(boolean fatal, String message, long configVersion, List<ConfigIssue> configIssues,
                          List<PluginOutcome> plugins, List<String> services) {
        this.fatal = fatal;
        this.message = message;
        this.configVersion = configVersion;
        this.configIssues = configIssues != null ? Collections.unmodifiableList(new ArrayList<>(configIssues)) : List.of();
        this.plugins = plugins != null ? Collections.unmodifiableList(new ArrayList<>(plugins)) : List.of();
        this.services = services != null ? Collections.unmodifiableList(new ArrayList<>(services)) : List.of();
    }

    public static StartupReport fatal(String message, List<ConfigIssue> configIssues) {
        return new StartupReport(true, message, 0L, configIssues, List.of(), List.of());
    }

    public static StartupReport started(long configVersion, List<ConfigIssue> configIssues,
                                        List<PluginOutcome> plugins, List<String> services) {
        long failed = plugins.stream().filter(p -> p.state() == PluginState.FAILED).count();
        String message = failed == 0
                ? "Started with " + plugins.size() + " plugin(s)"
                : "Started with " + failed + " of " + plugins.size() + " plugin(s) failed";
        return new StartupReport(false, message, configVersion, configIssues, plugins, services);
    }

    public boolean isFatal() {
        return fatal;
    }

    public String getMessage() {
        return message;
    }

    public long getConfigVersion() {
        return configVersion;
    }

    public List<ConfigIssue> getConfigIssues() {
        return configIssues;
    }

    public List<PluginOutcome> getPlugins() {
        return plugins;
    }

    public List<String> getServices() {
        return services;
    }

    public List<PluginOutcome> failedPlugins() {
        return plugins.stream().filter(p -> p.state() == PluginState.FAILED).toList();
    }

    public String toText() {
        StringBuilder sb = new StringBuilder();
        sb.append(fatal ? "STARTUP FAILED: " : "").append(message).append('\n');
        if (!fatal) {
            sb.append("Configuration version ").append(configVersion).append('\n');
        }
        for (ConfigIssue issue : configIssues) {
            sb.append("  config ").append(issue).append('\n');
        }
        for (PluginOutcome p : plugins) {
            sb.append("  plugin ").append(p.pluginId()).append('@').append(p.version())
                    .append(" [").append(p.state()).append("] from ").append(p.source());
            if (p.failureKind() != null) {
                sb.append(": ").append(p.failureKind()).append(' ').append(String.join(" -> ", p.chain()))
                        .append(" (").append(p.message()).append(')');
            }
            sb.append('\n');
        }
        if (!services.isEmpty()) {
            sb.append("  services ").append(String.join(", ", services)).append('\n');
        }
        return sb.toString();
    }

    public String toJson() {
        Map<String, Object> root = new LinkedHashMap<>();
        root.put("fatal", fatal);
        root.put("message", message);
        root.put("configVersion", configVersion);
        List<Map<String, Object>> issues = new ArrayList<>();
        for (ConfigIssue issue : configIssues) {
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("key", issue.key());
            m.put("kind", issue.kind() != null ? issue.kind().name() : null);
            m.put("source", issue.source());
            m.put("message", issue.message());
            issues.add(m);
        }
        root.put("configIssues", issues);
        List<Map<String, Object>> pluginList = new ArrayList<>();
        for (PluginOutcome p : plugins) {
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("id", p.pluginId());
            m.put("version", p.version());
            m.put("source", p.source());
            m.put("state", p.state().name());
            if (p.failureKind() != null) {
                m.put("failure", p.failureKind().name());
                m.put("message", p.message());
                m.put("chain", p.chain());
            }
            pluginList.add(m);
        }
        root.put("plugins", pluginList);
        root.put("services", services);
        return ReportJson.write(root);
    }

    @Override
    public String toString() {
        return "StartupReport{fatal=" + fatal + ", message=" + message + ", plugins=" + plugins.size() + "}";
    }
}
