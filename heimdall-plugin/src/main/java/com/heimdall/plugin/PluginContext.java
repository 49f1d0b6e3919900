package com.heimdall.plugin;

import com.heimdall.config.ConfigReader;
import com.heimdall.events.DispatchMode;
import com.heimdall.events.EventEnvelope;
import com.heimdall.events.EventHandler;
import com.heimdall.events.Priority;
import com.heimdall.events.Subscription;
import com.heimdall.executor.TaskHandle;
import com.heimdall.executor.Work;

/**
 * Capability handle given to a plugin: configuration read access, event publish/subscribe, task submission
 * and service registration. Everything registered through it is owned by the plugin and removed when the
 * plugin stops. After stop the handle is revoked and every method throws {@link IllegalStateException}.
 */
public interface PluginContext {

    String pluginId();

    ConfigReader config();

    int publish(EventEnvelope envelope);

    default int publish(String topic, Object payload) {
        return publish(EventEnvelope.of(topic, payload));
    }

    default int publish(String topic, Object payload, Priority priority) {
        return publish(EventEnvelope.of(topic, payload, priority));
    }

    Subscription subscribe(String pattern, EventHandler handler, DispatchMode mode, int priority);

    default Subscription subscribe(String pattern, EventHandler handler) {
        return subscribe(pattern, handler, DispatchMode.SYNC, 0);
    }

    boolean unsubscribe(Subscription subscription);

    <T> TaskHandle<T> submit(String name, Priority priority, Work<T> work);

    boolean cancel(TaskHandle<?> handle);

    /**
     * Offers {@code instance} under {@code name}. Registrations made during initialization become visible
     * together when the plugin turns active; later ones are visible at once.
     *
     * @throws IllegalArgumentException when the name is taken (after activation; during initialization the
     *                                  conflict fails the plugin)
     */
    <T> void registerService(String name, Class<T> capability, T instance);
}
