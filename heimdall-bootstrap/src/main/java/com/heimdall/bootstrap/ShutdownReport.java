package com.heimdall.bootstrap;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of {@link HeimdallOrchestrator#shutdown()}.
 *
 * @param stoppedPlugins      plugin ids in the order they were stopped
 * @param forceCancelledTasks tasks cancelled because they outlived the shutdown grace period
 * @param alreadyStopped      true when the runtime was not running; nothing was done
 */
public record ShutdownReport(List<String> stoppedPlugins, int forceCancelledTasks, boolean alreadyStopped) {

    public ShutdownReport {
        stoppedPlugins = stoppedPlugins != null ? List.copyOf(stoppedPlugins) : List.of();
    }

    static ShutdownReport notRunning() {
        return new ShutdownReport(List.of(), 0, true);
    }

    public String toText() {
        if (alreadyStopped) {
            return "Not running; nothing to shut down\n";
        }
        return "Stopped " + stoppedPlugins.size() + " plugin(s) " + stoppedPlugins
                + "; force-cancelled " + forceCancelledTasks + " task(s)\n";
    }

    public String toJson() {
        Map<String, Object> root = new LinkedHashMap<>();
        root.put("alreadyStopped", alreadyStopped);
        root.put("stoppedPlugins", stoppedPlugins);
        root.put("forceCancelledTasks", forceCancelledTasks);
        return ReportJson.write(root);
    }
}
