package com.heimdall.bootstrap;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.heimdall.config.ConfigDiff;
import com.heimdall.config.ConfigException;
import com.heimdall.config.ConfigIssue;
import com.heimdall.config.ConfigSource;
import com.heimdall.config.DefaultsConfigSource;
import com.heimdall.config.FileConfigSource;
import com.heimdall.config.HeimdallConfig;
import com.heimdall.events.BusClosedException;
import com.heimdall.events.EventEnvelope;
import com.heimdall.events.Topics;
import com.heimdall.plugin.Dependency;
import com.heimdall.plugin.PluginDescriptor;
import com.heimdall.plugin.PluginLoadException;
import com.heimdall.plugin.PluginOutcome;
import com.heimdall.plugin.PluginState;
import com.heimdall.plugin.ServiceNotFoundException;
import com.heimdall.plugin.StaticPluginSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HeimdallOrchestratorTest {

    @TempDir
    Path tempDir;

    private final List<String> journal = Collections.synchronizedList(new ArrayList<>());
    private HeimdallOrchestrator orchestrator;

    @AfterEach
    void tearDown() {
        if (orchestrator != null) {
            orchestrator.shutdown();
        }
    }

    private static List<ConfigSource> sources(ConfigSource... extra) {
        List<ConfigSource> list = new ArrayList<>();
        list.add(HeimdallConfig.defaultsSource());
        list.add(new DefaultsConfigSource("test", Map.of(HeimdallConfig.PLUGINS_PATHS, List.of(),
                HeimdallConfig.EXECUTOR_SHUTDOWN_GRACE_SECONDS, 1)));
        list.addAll(List.of(extra));
        return list;
    }

    private RecordingPlugin plugin(String id, RecordingPlugin.Init init, Dependency... deps) {
        return new RecordingPlugin(PluginDescriptor.of(id, "1.0.0", deps), journal, init);
    }

    @Test
    void start_missingRequiredKeyIsFatal() {
        orchestrator = HeimdallOrchestrator.builder().headless(true).build();

        StartupReport report = orchestrator.start(List.of(new DefaultsConfigSource(Map.of("ui.theme", "dark"))));

        assertTrue(report.isFatal());
        assertEquals(ConfigException.Kind.MISSING_KEY, report.getConfigIssues().get(0).kind());
        assertEquals(HeimdallConfig.APP_NAME, report.getConfigIssues().get(0).key());
        assertFalse(orchestrator.isRunning());
        assertTrue(orchestrator.shutdown().alreadyStopped());
    }

    @Test
    void start_poolSizeBelowMinimumIsFatal() {
        orchestrator = HeimdallOrchestrator.builder().headless(true).build();

        StartupReport report = orchestrator.start(sources(new DefaultsConfigSource("bad",
                Map.of(HeimdallConfig.EXECUTOR_POOL_SIZE, 0, HeimdallConfig.EVENTS_MAX_PENDING_ASYNC, 0))));

        assertTrue(report.isFatal());
        assertEquals(Set.of(HeimdallConfig.EXECUTOR_POOL_SIZE, HeimdallConfig.EVENTS_MAX_PENDING_ASYNC),
                report.getConfigIssues().stream().map(ConfigIssue::key).collect(Collectors.toSet()));
        assertTrue(report.getConfigIssues().stream()
                .allMatch(i -> i.kind() == ConfigException.Kind.TYPE_MISMATCH));
        assertFalse(orchestrator.isRunning());
    }

    @Test
    void start_unknownBackpressurePolicyIsFatal() {
        orchestrator = HeimdallOrchestrator.builder().headless(true).build();

        StartupReport report = orchestrator.start(sources(new DefaultsConfigSource("bad",
                Map.of(HeimdallConfig.EXECUTOR_BACKPRESSURE, "DROP"))));

        assertTrue(report.isFatal());
        assertEquals(1, report.getConfigIssues().size());
        assertEquals(HeimdallConfig.EXECUTOR_BACKPRESSURE, report.getConfigIssues().get(0).key());
        assertEquals(ConfigException.Kind.TYPE_MISMATCH, report.getConfigIssues().get(0).kind());
        assertFalse(orchestrator.isRunning());
        assertTrue(orchestrator.shutdown().alreadyStopped());
    }

    @Test
    void start_proceedsWithResolvedPluginsAndReportsFailures() throws Exception {
        orchestrator = HeimdallOrchestrator.builder()
                .headless(true)
                .pluginSource(StaticPluginSource.of(
                        plugin("greeter", ctx -> ctx.registerService("greeter.text", CharSequence.class, "hello")),
                        plugin("a", ctx -> { }, Dependency.on("b")),
                        plugin("b", ctx -> { }, Dependency.on("a"))))
                .build();

        StartupReport report = orchestrator.start(sources());

        assertFalse(report.isFatal());
        assertEquals(3, report.getPlugins().size());
        assertEquals(List.of("a", "b"), report.failedPlugins().stream().map(PluginOutcome::pluginId).toList());
        assertEquals(PluginLoadException.Kind.CYCLIC_DEPENDENCY, report.failedPlugins().get(0).failureKind());
        assertEquals(List.of("greeter.text"), report.getServices());
        assertEquals("hello", orchestrator.resolveService("greeter.text", String.class));
        assertEquals("hello", orchestrator.resolveService("greeter.text"));
        assertThrows(ServiceNotFoundException.class, () -> orchestrator.resolveService("missing"));

        JsonNode json = new ObjectMapper().readTree(report.toJson());
        assertFalse(json.get("fatal").asBoolean());
        assertEquals("FAILED", json.get("plugins").get(1).get("state").asText());
        assertTrue(report.toText().contains("CYCLIC_DEPENDENCY a -> b -> a"));
    }

    @Test
    void start_publishesAppStartedToPlugins() {
        List<EventEnvelope> seen = Collections.synchronizedList(new ArrayList<>());
        orchestrator = HeimdallOrchestrator.builder()
                .pluginSource(StaticPluginSource.of(plugin("watcher", ctx -> ctx.subscribe("app.*", seen::add))))
                .build();

        orchestrator.start(sources());

        assertEquals(List.of(Topics.APP_STARTED), seen.stream().map(EventEnvelope::topic).toList());
        assertTrue(seen.get(0).payload() instanceof StartupReport);
    }

    @Test
    void reload_changedKeyPublishesExactlyOneConfigChanged() throws Exception {
        Path file = tempDir.resolve("config.json");
        Files.writeString(file, "{\"ui\": {\"theme\": \"dark\"}}");
        orchestrator = HeimdallOrchestrator.builder().headless(true).build();
        orchestrator.start(sources(new FileConfigSource(file)));
        List<EventEnvelope> changes = Collections.synchronizedList(new ArrayList<>());
        orchestrator.bus().subscribe(Topics.CONFIG_CHANGED, changes::add);

        Files.writeString(file, "{\"ui\": {\"theme\": \"light\"}}");
        orchestrator.config().reload();
        orchestrator.config().reload();

        assertEquals(1, changes.size());
        ConfigDiff diff = changes.get(0).payloadAs(ConfigDiff.class);
        assertTrue(diff.touches(HeimdallConfig.UI_THEME));
        assertEquals("light", orchestrator.config().getString(HeimdallConfig.UI_THEME));
    }

    @Test
    void sendCommand_deliversWithReturnedCorrelationId() {
        List<EventEnvelope> commands = Collections.synchronizedList(new ArrayList<>());
        orchestrator = HeimdallOrchestrator.builder()
                .pluginSource(StaticPluginSource.of(plugin("exporter", ctx -> ctx.subscribe("command.*", commands::add))))
                .build();
        orchestrator.start(sources());

        String correlationId = orchestrator.sendCommand("export", Map.of("format", "csv"));

        assertEquals(1, commands.size());
        assertEquals("command.export", commands.get(0).topic());
        assertEquals(correlationId, commands.get(0).correlationId());
    }

    @Test
    void shutdown_stopsPluginsInReverseOrderAndClosesBus() {
        orchestrator = HeimdallOrchestrator.builder()
                .pluginSource(StaticPluginSource.of(
                        plugin("report", ctx -> { }, Dependency.on("finance")),
                        plugin("finance", ctx -> ctx.registerService("finance.quotes", CharSequence.class, "q"))))
                .build();
        orchestrator.start(sources());

        ShutdownReport report = orchestrator.shutdown();

        assertEquals(List.of("report", "finance"), report.stoppedPlugins());
        assertEquals(List.of("init:finance", "init:report", "shutdown:report", "shutdown:finance"), journal);
        assertEquals(PluginState.STOPPED, orchestrator.plugins().state("finance").orElseThrow());
        assertEquals(0, orchestrator.services().size());
        assertThrows(BusClosedException.class, () -> orchestrator.bus().publish("x.y", 1));
        assertThrows(IllegalStateException.class, () -> orchestrator.sendCommand("export", null));
        assertTrue(orchestrator.shutdown().alreadyStopped());
    }
}
