package com.heimdall.bootstrap;

import com.heimdall.config.ConfigChangeListener;
import com.heimdall.config.ConfigException;
import com.heimdall.config.ConfigFileWatcher;
import com.heimdall.config.ConfigRequirement;
import com.heimdall.config.ConfigSource;
import com.heimdall.config.ConfigurationManager;
import com.heimdall.config.EffectiveConfig;
import com.heimdall.config.HeimdallConfig;
import com.heimdall.events.BusClosedException;
import com.heimdall.events.EventBus;
import com.heimdall.events.EventBusSettings;
import com.heimdall.events.Priority;
import com.heimdall.events.Topics;
import com.heimdall.executor.AsyncExecutor;
import com.heimdall.executor.BackpressurePolicy;
import com.heimdall.executor.ExecutorSettings;
import com.heimdall.plugin.DirectoryPluginSource;
import com.heimdall.plugin.PluginManager;
import com.heimdall.plugin.PluginOutcome;
import com.heimdall.plugin.PluginSource;
import com.heimdall.plugin.ServiceNotFoundException;
import com.heimdall.plugin.ServiceRegistry;
import com.heimdall.plugin.ServiceRegistryEntry;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Composition root of the runtime. {@link #start} loads configuration, builds the event bus and the async
 * executor, and has the plugin manager discover, resolve and initialize plugins; {@link #shutdown()} stops
 * plugins in reverse order, drains the executor and closes the bus. Between the two it is the single facade
 * UI and CLI callers use: service lookup and command dispatch.
 * <p>
 * Components are explicit instances owned here and handed to plugins through their context; nothing is
 * looked up globally.
 */
public final class HeimdallOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(HeimdallOrchestrator.class);

    private enum Phase { NEW, RUNNING, STOPPED }

    private final List<PluginSource> pluginSources;
    private final boolean headless;
    private final MeterRegistry meterRegistry;
    private final ConfigurationManager config;
    private final ServiceRegistry services = new ServiceRegistry();
    private final ConfigChangeListener configPublisher = (snapshot, diff) ->
            publishQuietly(Topics.CONFIG_CHANGED, diff, Priority.NORMAL);

    private volatile Phase phase = Phase.NEW;
    private EventBus bus;
    private AsyncExecutor executor;
    private PluginManager plugins;
    private ConfigFileWatcher watcher;
    private DirectoryPluginSource directorySource;

    private HeimdallOrchestrator(Builder builder) {
        this.pluginSources = List.copyOf(builder.pluginSources);
        this.headless = builder.headless;
        this.meterRegistry = builder.meterRegistry != null ? builder.meterRegistry : new SimpleMeterRegistry();
        this.config = new ConfigurationManager(builder.requirements);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Starts the runtime. Configuration errors are fatal and reported, not thrown; plugin failures are
     * reported per plugin while the rest of the runtime starts.
     *
     * @param sources configuration sources; ranked by layer, later sources of a layer win
     * @throws IllegalStateException when called twice
     */
    public synchronized StartupReport start(List<? extends ConfigSource> sources) {
        if (phase != Phase.NEW) {
            throw new IllegalStateException("Orchestrator already started");
        }
        EffectiveConfig snapshot;
        try {
            snapshot = config.load(sources);
        } catch (ConfigException e) {
            log.error("Startup aborted: configuration invalid | {}", e.getMessage());
            phase = Phase.STOPPED;
            return StartupReport.fatal(e.getMessage(), e.getIssues());
        }
        log.info("Configuration loaded | version={} | keys={} | issues={}", snapshot.version(),
                snapshot.keys().size(), snapshot.getIssues().size());

        EventBusSettings busSettings;
        ExecutorSettings executorSettings;
        try {
            busSettings = EventBusSettings.fromConfig(config);
            executorSettings = ExecutorSettings.fromConfig(config);
        } catch (ConfigException | IllegalArgumentException e) {
            log.error("Startup aborted: runtime settings invalid | {}", e.getMessage());
            phase = Phase.STOPPED;
            return StartupReport.fatal(e.getMessage(), snapshot.getIssues());
        }
        bus = new EventBus(busSettings, meterRegistry);
        executor = new AsyncExecutor(executorSettings, bus, meterRegistry);
        bus.bindDispatcher(executor);
        executor.start();
        config.watch(configPublisher);
        if (config.getBoolean(HeimdallConfig.CONFIG_WATCH_FILES, false)) {
            try {
                watcher = ConfigFileWatcher.start(config);
            } catch (IOException e) {
                log.warn("Config file watching disabled: {}", e.getMessage());
            }
        }

        List<PluginSource> allSources = new ArrayList<>(pluginSources);
        List<Path> directories = config.getStringList(HeimdallConfig.PLUGINS_PATHS).stream()
                .filter(p -> !p.isBlank())
                .map(Path::of)
                .toList();
        if (!directories.isEmpty()) {
            directorySource = new DirectoryPluginSource(directories);
            allSources.add(directorySource);
        }
        plugins = new PluginManager(config, bus, executor, services, headless);
        List<PluginOutcome> outcomes = plugins.start(allSources);

        phase = Phase.RUNNING;
        StartupReport report = StartupReport.started(snapshot.version(), snapshot.getIssues(), outcomes,
                serviceNames());
        log.info("{} started | headless={} | {}", config.getOrDefault(HeimdallConfig.APP_NAME, String.class, "Heimdall"),
                headless, report.getMessage());
        publishQuietly(Topics.APP_STARTED, report, Priority.NORMAL);
        return report;
    }

    /**
     * Stops plugins in reverse initialization order, drains the executor for the configured grace period,
     * then closes the bus. A second call is a no-op.
     */
    public synchronized ShutdownReport shutdown() {
        if (phase != Phase.RUNNING) {
            phase = Phase.STOPPED;
            return ShutdownReport.notRunning();
        }
        log.info("Shutting down");
        publishQuietly(Topics.APP_STOPPING, null, Priority.HIGH);
        config.unwatch(configPublisher);
        if (watcher != null) {
            watcher.close();
            watcher = null;
        }
        List<String> stopped = plugins.shutdownAll();
        int forced = executor.shutdown();
        bus.close();
        if (directorySource != null) {
            directorySource.close();
            directorySource = null;
        }
        phase = Phase.STOPPED;
        ShutdownReport report = new ShutdownReport(stopped, forced, false);
        log.info("Shutdown complete | stopped={} | forceCancelled={}", stopped.size(), forced);
        return report;
    }

    /**
     * @throws ServiceNotFoundException when no active plugin offers {@code name}
     */
    public Object resolveService(String name) {
        return resolveService(name, Object.class);
    }

    /**
     * @throws ServiceNotFoundException when absent or not a {@code type}
     */
    public <T> T resolveService(String name, Class<T> type) {
        return services.resolve(name, type);
    }

    public <T> Optional<T> findService(String name, Class<T> type) {
        return services.find(name, type);
    }

    public <T> List<T> servicesOf(Class<T> capability) {
        return services.findByCapability(capability).stream()
                .map(ServiceRegistryEntry::instance)
                .map(capability::cast)
                .toList();
    }

    /**
     * Publishes {@code command.<name>} with a fresh correlation id.
     *
     * @return the correlation id
     * @throws IllegalStateException when the runtime is not running
     */
    public String sendCommand(String name, Object payload) {
        ensureRunning();
        String correlationId = UUID.randomUUID().toString();
        int delivered = bus.publish(Topics.command(name), payload, Priority.NORMAL, correlationId);
        log.debug("Command sent | name={} | correlationId={} | handlers={}", name, correlationId, delivered);
        return correlationId;
    }

    public boolean isRunning() {
        return phase == Phase.RUNNING;
    }

    public boolean isHeadless() {
        return headless;
    }

    public ConfigurationManager config() {
        return config;
    }

    public EventBus bus() {
        ensureStarted();
        return bus;
    }

    public AsyncExecutor executor() {
        ensureStarted();
        return executor;
    }

    public PluginManager plugins() {
        ensureStarted();
        return plugins;
    }

    public ServiceRegistry services() {
        return services;
    }

    public MeterRegistry meterRegistry() {
        return meterRegistry;
    }

    private List<String> serviceNames() {
        return services.entries().stream().map(ServiceRegistryEntry::name).toList();
    }

    private void ensureRunning() {
        if (phase != Phase.RUNNING) {
            throw new IllegalStateException("Orchestrator is not running");
        }
    }

    private void ensureStarted() {
        if (bus == null) {
            throw new IllegalStateException("Orchestrator has not been started");
        }
    }

    private void publishQuietly(String topic, Object payload, Priority priority) {
        try {
            bus.publish(topic, payload, priority);
        } catch (BusClosedException e) {
            log.debug("{} not published; bus closed", topic);
        }
    }

    public static final class Builder {

        private final List<PluginSource> pluginSources = new ArrayList<>();
        private final List<ConfigRequirement> requirements = new ArrayList<>(HeimdallConfig.coreRequirements());
        private boolean headless;
        private MeterRegistry meterRegistry;

        private Builder() {
            requirements.add(ConfigRequirement.optional(HeimdallConfig.EXECUTOR_BACKPRESSURE, BackpressurePolicy.class));
        }

        public Builder pluginSource(PluginSource source) {
            pluginSources.add(Objects.requireNonNull(source, "source"));
            return this;
        }

        public Builder pluginSources(Collection<? extends PluginSource> sources) {
            sources.forEach(this::pluginSource);
            return this;
        }

        /** Skips UI component registration; everything else starts normally. */
        public Builder headless(boolean headless) {
            this.headless = headless;
            return this;
        }

        public Builder meterRegistry(MeterRegistry meterRegistry) {
            this.meterRegistry = meterRegistry;
            return this;
        }

        public Builder require(ConfigRequirement requirement) {
            requirements.add(Objects.requireNonNull(requirement, "requirement"));
            return this;
        }

        public HeimdallOrchestrator build() {
            return new HeimdallOrchestrator(this);
        }
    }
}
