package com.heimdall.plugin;

import com.heimdall.config.ConfigReader;
import com.heimdall.config.HeimdallConfig;
import com.heimdall.events.BusClosedException;
import com.heimdall.events.EventBus;
import com.heimdall.events.Priority;
import com.heimdall.events.Topics;
import com.heimdall.executor.AsyncExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Discovers, resolves, initializes and stops plugins.
 * <p>
 * Discovery reads descriptors from the configured {@link PluginSource}s (filtered by {@code plugins.enabled}
 * and {@code plugins.disabled}; the first plugin seen with an id wins). Resolution orders plugins by their
 * dependencies and fails only the plugins affected by a missing dependency, a version mismatch or a cycle.
 * Initialization runs in that order; a plugin that throws is rolled back and marked FAILED, and plugins
 * depending on it fail as well. Independent plugins always proceed.
 * <p>
 * Stopping reverses initialization order and removes every subscription, service and pending task owned by
 * the plugin, whether or not its shutdown hook succeeds.
 */
public final class PluginManager {

    private static final Logger log = LoggerFactory.getLogger(PluginManager.class);

    private final ConfigReader config;
    private final EventBus bus;
    private final AsyncExecutor executor;
    private final ServiceRegistry registry;
    private final boolean headless;
    private final PluginResolver resolver = new PluginResolver();
    private final Object lifecycleLock = new Object();
    private final Map<String, PluginInstance> instances = new LinkedHashMap<>();
    private final List<String> initializationOrder = new ArrayList<>();
    private List<String> pendingOrder = List.of();

    public PluginManager(ConfigReader config, EventBus bus, AsyncExecutor executor, ServiceRegistry registry,
                         boolean headless) {
        this.config = Objects.requireNonNull(config, "config");
        this.bus = Objects.requireNonNull(bus, "bus");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.headless = headless;
    }

    /**
     * Runs discovery, resolution and initialization.
     *
     * @return per-plugin outcomes in discovery order
     */
    public List<PluginOutcome> start(List<? extends PluginSource> sources) {
        discover(sources);
        resolve();
        initializeAll();
        List<PluginOutcome> outcomes = outcomes();
        long active = outcomes.stream().filter(PluginOutcome::isActive).count();
        log.info("Plugins started | active={} | failed={} | order={}", active,
                outcomes.stream().filter(o -> o.state() == PluginState.FAILED).count(), initializationOrder());
        return outcomes;
    }

    /**
     * Reads every source. Source failures are logged and skipped.
     *
     * @return number of plugins newly discovered
     */
    public int discover(List<? extends PluginSource> sources) {
        List<String> enabled = config.getStringList(HeimdallConfig.PLUGINS_ENABLED);
        List<String> disabled = config.getStringList(HeimdallConfig.PLUGINS_DISABLED);
        boolean allEnabled = enabled.isEmpty() || enabled.contains("*");
        int added = 0;
        synchronized (lifecycleLock) {
            for (PluginSource source : sources) {
                List<PluginCandidate> candidates;
                try {
                    candidates = source.discover();
                } catch (RuntimeException e) {
                    log.error("Plugin source {} failed (skipping): {}", source.name(), e.getMessage(), e);
                    continue;
                }
                for (PluginCandidate candidate : candidates) {
                    String id = candidate.id();
                    if (disabled.contains(id) || (!allEnabled && !enabled.contains(id))) {
                        log.info("Plugin {} is disabled by configuration", id);
                        continue;
                    }
                    PluginInstance existing = instances.get(id);
                    if (existing != null) {
                        log.warn("Duplicate plugin id {} from {} ignored; keeping the one from {}",
                                id, candidate.sourceName(), existing.sourceName());
                        continue;
                    }
                    instances.put(id, new PluginInstance(candidate));
                    added++;
                    log.debug("Discovered plugin {} from {}", candidate.descriptor(), candidate.sourceName());
                }
            }
        }
        return added;
    }

    /**
     * Resolves all DISCOVERED plugins against every known plugin.
     *
     * @return ids in initialization order
     */
    public List<String> resolve() {
        synchronized (lifecycleLock) {
            List<PluginDescriptor> descriptors = new ArrayList<>();
            for (PluginInstance instance : instances.values()) {
                descriptors.add(instance.descriptor());
            }
            PluginResolver.Resolution resolution = resolver.resolve(descriptors);
            for (Map.Entry<String, PluginLoadException> e : resolution.failures().entrySet()) {
                PluginInstance instance = instances.get(e.getKey());
                if (instance.state() == PluginState.DISCOVERED) {
                    markFailed(instance, e.getValue());
                }
            }
            List<String> order = new ArrayList<>();
            for (PluginDescriptor d : resolution.order()) {
                PluginInstance instance = instances.get(d.id());
                if (instance.state() == PluginState.DISCOVERED) {
                    instance.transitionTo(PluginState.RESOLVED);
                }
                order.add(d.id());
            }
            pendingOrder = order;
            return order;
        }
    }

    /**
     * Initializes RESOLVED plugins in resolution order.
     */
    public void initializeAll() {
        synchronized (lifecycleLock) {
            for (String id : pendingOrder) {
                PluginInstance instance = instances.get(id);
                if (instance.state() != PluginState.RESOLVED) continue;
                Optional<String> inactiveDependency = instance.descriptor().dependencies().stream()
                        .map(Dependency::pluginId)
                        .filter(dep -> instances.get(dep).state() != PluginState.ACTIVE)
                        .findFirst();
                if (inactiveDependency.isPresent()) {
                    String dep = inactiveDependency.get();
                    PluginLoadException cause = instances.get(dep).failure();
                    List<String> chain = new ArrayList<>();
                    chain.add(id);
                    if (cause != null) chain.addAll(cause.getChain());
                    else chain.add(dep);
                    markFailed(instance, new PluginLoadException(PluginLoadException.Kind.MISSING_DEPENDENCY, id, chain,
                            "Plugin " + id + " requires " + dep + " which is not active"));
                    continue;
                }
                initialize(instance);
            }
            pendingOrder = List.of();
        }
    }

    /**
     * Stops one active plugin, stopping its active dependents first.
     *
     * @return false when the plugin is unknown or not active
     */
    public boolean stop(String pluginId) {
        synchronized (lifecycleLock) {
            PluginInstance instance = instances.get(pluginId);
            if (instance == null || instance.state() != PluginState.ACTIVE) {
                return false;
            }
            stopDependents(pluginId);
            shutdownInstance(instance);
            return true;
        }
    }

    /**
     * Marks an active plugin FAILED after an unrecoverable runtime error: its dependents are stopped, its shutdown
     * hook is called and everything it owns is removed.
     *
     * @return false when the plugin is unknown or not active
     */
    public boolean fail(String pluginId, Throwable cause) {
        synchronized (lifecycleLock) {
            PluginInstance instance = instances.get(pluginId);
            if (instance == null || instance.state() != PluginState.ACTIVE) {
                return false;
            }
            stopDependents(pluginId);
            invokeShutdownHook(instance);
            releaseOwned(instance);
            initializationOrder.remove(pluginId);
            markFailed(instance, new PluginLoadException(PluginLoadException.Kind.RUNTIME_FAILURE, pluginId,
                    List.of(pluginId), "Plugin " + pluginId + " failed: " + (cause != null ? cause.getMessage() : "unknown"),
                    cause));
            return true;
        }
    }

    /**
     * Stops all active plugins in reverse initialization order.
     *
     * @return ids of the plugins stopped, in stop order
     */
    public List<String> shutdownAll() {
        synchronized (lifecycleLock) {
            List<String> stopped = new ArrayList<>();
            List<String> reverse = new ArrayList<>(initializationOrder);
            Collections.reverse(reverse);
            for (String id : reverse) {
                PluginInstance instance = instances.get(id);
                if (instance != null && instance.state() == PluginState.ACTIVE) {
                    shutdownInstance(instance);
                    stopped.add(id);
                }
            }
            log.info("Plugins shut down | stopped={}", stopped);
            return stopped;
        }
    }

    public Optional<PluginInstance> find(String pluginId) {
        synchronized (lifecycleLock) {
            return Optional.ofNullable(instances.get(pluginId));
        }
    }

    public Optional<PluginState> state(String pluginId) {
        return find(pluginId).map(PluginInstance::state);
    }

    /** Ids of ACTIVE plugins in initialization order. */
    public List<String> initializationOrder() {
        synchronized (lifecycleLock) {
            return List.copyOf(initializationOrder);
        }
    }

    public List<PluginOutcome> outcomes() {
        synchronized (lifecycleLock) {
            List<PluginOutcome> out = new ArrayList<>();
            for (PluginInstance instance : instances.values()) {
                out.add(instance.outcome());
            }
            return out;
        }
    }

    public boolean isHeadless() {
        return headless;
    }

    private void initialize(PluginInstance instance) {
        String id = instance.id();
        instance.transitionTo(PluginState.INITIALIZING);
        Plugin plugin;
        try {
            plugin = instance.candidate().factory().create();
        } catch (Throwable e) {
            markFailed(instance, initFailure(id, "could not be instantiated", e));
            return;
        }
        PluginDescriptor declared;
        try {
            declared = plugin.descriptor();
        } catch (Throwable e) {
            markFailed(instance, initFailure(id, "could not report its descriptor", e));
            return;
        }
        if (declared == null || !id.equals(declared.id())) {
            markFailed(instance, initFailure(id, "reports descriptor " + declared + " instead of " + id, null));
            return;
        }
        DefaultPluginContext context = new DefaultPluginContext(id, config, bus, executor, registry);
        instance.attach(plugin, context);
        try {
            plugin.initialize(context);
        } catch (Throwable e) {
            releaseOwned(instance);
            markFailed(instance, initFailure(id, "threw during initialization", e));
            return;
        }
        try {
            List<ServiceRegistryEntry> services = context.pendingServices();
            services.addAll(contributions(id, plugin));
            registry.registerAll(services);
        } catch (Throwable e) {
            releaseOwned(instance);
            invokeShutdownHook(instance);
            markFailed(instance, initFailure(id, "could not register its services", e));
            return;
        }
        context.activate();
        instance.transitionTo(PluginState.ACTIVE);
        initializationOrder.add(id);
        log.info("Plugin active | id={} | version={} | services={} | subscriptions={}", id,
                instance.descriptor().version(), registry.entriesOwnedBy(id).size(), bus.subscriptionsOwnedBy(id).size());
        publish(Topics.PLUGIN_ACTIVE, instance.descriptor(), Priority.NORMAL);
    }

    private List<ServiceRegistryEntry> contributions(String id, Plugin plugin) {
        List<ServiceRegistryEntry> out = new ArrayList<>();
        List<ExportSource> exports = plugin.exportSources();
        for (int i = 0; i < exports.size(); i++) {
            out.add(new ServiceRegistryEntry(id + ".export." + i, id, ExportSource.class, exports.get(i)));
        }
        if (!headless) {
            for (UiComponent component : plugin.uiComponents()) {
                out.add(new ServiceRegistryEntry(id + ".ui." + component.id(), id, UiComponent.class, component));
            }
        }
        return out;
    }

    private static PluginLoadException initFailure(String id, String what, Throwable cause) {
        String detail = cause != null && cause.getMessage() != null ? ": " + cause.getMessage() : "";
        return new PluginLoadException(PluginLoadException.Kind.INITIALIZATION_FAILED, id, List.of(id),
                "Plugin " + id + " " + what + detail, cause);
    }

    private void stopDependents(String pluginId) {
        List<String> reverse = new ArrayList<>(initializationOrder);
        Collections.reverse(reverse);
        for (String other : reverse) {
            PluginInstance dependent = instances.get(other);
            if (dependent.state() == PluginState.ACTIVE && dependent.descriptor().dependencies().stream()
                    .anyMatch(d -> d.pluginId().equals(pluginId))) {
                log.info("Stopping {} because it depends on {}", other, pluginId);
                stopDependents(other);
                if (dependent.state() == PluginState.ACTIVE) {
                    shutdownInstance(dependent);
                }
            }
        }
    }

    private void shutdownInstance(PluginInstance instance) {
        instance.transitionTo(PluginState.SHUTTING_DOWN);
        invokeShutdownHook(instance);
        releaseOwned(instance);
        instance.transitionTo(PluginState.STOPPED);
        initializationOrder.remove(instance.id());
        log.info("Plugin stopped | id={}", instance.id());
        publish(Topics.PLUGIN_STOPPED, instance.descriptor(), Priority.NORMAL);
    }

    private void invokeShutdownHook(PluginInstance instance) {
        Plugin plugin = instance.plugin();
        if (plugin == null) return;
        try {
            plugin.shutdown();
        } catch (Throwable e) {
            log.warn("Plugin {} shutdown hook failed: {}", instance.id(), e.getMessage(), e);
        }
    }

    /** Removes subscriptions, services and pending tasks owned by the plugin and revokes its context. */
    private void releaseOwned(PluginInstance instance) {
        String id = instance.id();
        DefaultPluginContext context = instance.context();
        if (context != null) {
            context.discardPending();
            context.revoke();
        }
        int subscriptions = bus.isClosed() ? 0 : bus.unsubscribeAll(id);
        int services = registry.unregisterOwner(id);
        int tasks = executor.cancelAllOwnedBy(id);
        log.debug("Released plugin resources | id={} | subscriptions={} | services={} | tasks={}",
                id, subscriptions, services, tasks);
    }

    private void markFailed(PluginInstance instance, PluginLoadException cause) {
        instance.fail(cause);
        log.error("Plugin failed | id={} | kind={} | chain={} | reason={}", instance.id(), cause.getKind(),
                cause.getChain(), cause.getMessage());
        publish(Topics.PLUGIN_FAILED, PluginFailure.of(cause), Priority.HIGH);
    }

    private void publish(String topic, Object payload, Priority priority) {
        try {
            bus.publish(topic, payload, priority);
        } catch (BusClosedException e) {
            log.debug("Plugin event {} not published; bus closed", topic);
        }
    }
}
