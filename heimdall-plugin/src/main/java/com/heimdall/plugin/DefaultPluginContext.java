package com.heimdall.plugin;

import com.heimdall.config.ConfigReader;
import com.heimdall.events.DispatchMode;
import com.heimdall.events.EventBus;
import com.heimdall.events.EventEnvelope;
import com.heimdall.events.EventHandler;
import com.heimdall.events.Priority;
import com.heimdall.events.Subscription;
import com.heimdall.executor.AsyncExecutor;
import com.heimdall.executor.TaskHandle;
import com.heimdall.executor.Work;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * {@link PluginContext} bound to one plugin id. Subscriptions and tasks are tagged with the plugin id so
 * they can be removed in bulk; services registered before activation are buffered.
 */
final class DefaultPluginContext implements PluginContext {

    private final String pluginId;
    private final ConfigReader config;
    private final EventBus bus;
    private final AsyncExecutor executor;
    private final ServiceRegistry registry;
    private final List<ServiceRegistryEntry> pending = new ArrayList<>();
    private final ConfigReader readOnlyConfig = new ReadOnlyConfig();
    private boolean active;
    private volatile boolean revoked;

    DefaultPluginContext(String pluginId, ConfigReader config, EventBus bus, AsyncExecutor executor,
                         ServiceRegistry registry) {
        this.pluginId = pluginId;
        this.config = config;
        this.bus = bus;
        this.executor = executor;
        this.registry = registry;
    }

    @Override
    public String pluginId() {
        return pluginId;
    }

    @Override
    public ConfigReader config() {
        ensureUsable();
        return readOnlyConfig;
    }

    @Override
    public int publish(EventEnvelope envelope) {
        ensureUsable();
        return bus.publish(envelope);
    }

    @Override
    public Subscription subscribe(String pattern, EventHandler handler, DispatchMode mode, int priority) {
        ensureUsable();
        return bus.subscribe(pluginId, pattern, handler, mode, priority, Priority.LOW);
    }

    @Override
    public boolean unsubscribe(Subscription subscription) {
        ensureUsable();
        if (subscription == null || !pluginId.equals(subscription.ownerId())) {
            return false;
        }
        return bus.unsubscribe(subscription);
    }

    @Override
    public <T> TaskHandle<T> submit(String name, Priority priority, Work<T> work) {
        ensureUsable();
        return executor.submit(name, pluginId, priority, work);
    }

    @Override
    public boolean cancel(TaskHandle<?> handle) {
        ensureUsable();
        if (handle == null || !pluginId.equals(handle.ownerId())) {
            return false;
        }
        return executor.cancel(handle);
    }

    @Override
    public <T> void registerService(String name, Class<T> capability, T instance) {
        ensureUsable();
        ServiceRegistryEntry entry = new ServiceRegistryEntry(Objects.requireNonNull(name, "name").trim(), pluginId,
                capability, instance);
        synchronized (this) {
            if (!active) {
                pending.add(entry);
                return;
            }
        }
        registry.register(entry);
    }

    /** Services registered during initialization, in registration order. */
    synchronized List<ServiceRegistryEntry> pendingServices() {
        return new ArrayList<>(pending);
    }

    synchronized void activate() {
        pending.clear();
        active = true;
    }

    synchronized void discardPending() {
        pending.clear();
    }

    void revoke() {
        revoked = true;
    }

    boolean isRevoked() {
        return revoked;
    }

    private void ensureUsable() {
        if (revoked) {
            throw new IllegalStateException("Plugin context of " + pluginId + " has been revoked");
        }
    }

    /** Read-only view that stops answering once the context is revoked. */
    private final class ReadOnlyConfig implements ConfigReader {

        @Override
        public <T> T get(String key, Class<T> type) {
            ensureUsable();
            return config.get(key, type);
        }

        @Override
        public boolean contains(String key) {
            ensureUsable();
            return config.contains(key);
        }

        @Override
        public long version() {
            ensureUsable();
            return config.version();
        }

        @Override
        public Set<String> keys() {
            ensureUsable();
            return config.keys();
        }
    }
}
