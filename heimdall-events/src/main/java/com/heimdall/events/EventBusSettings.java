package com.heimdall.events;

import com.heimdall.config.ConfigReader;
import com.heimdall.config.HeimdallConfig;

/**
 * Bus limits, read once at construction. A reload of these keys takes effect on next process start.
 *
 * @param maxPendingAsync async invocations allowed in flight before new ones are dropped
 * @param slowHandlerWarnMs synchronous handlers running longer than this are logged at WARN; 0 disables
 */
public record EventBusSettings(int maxPendingAsync, long slowHandlerWarnMs) {

    public EventBusSettings {
        if (maxPendingAsync < 1) {
            throw new IllegalArgumentException("maxPendingAsync must be >= 1");
        }
        if (slowHandlerWarnMs < 0) {
            throw new IllegalArgumentException("slowHandlerWarnMs must be >= 0");
        }
    }

    public static EventBusSettings defaults() {
        return new EventBusSettings(1024, 500);
    }

    public static EventBusSettings fromConfig(ConfigReader config) {
        EventBusSettings d = defaults();
        return new EventBusSettings(
                config.getInt(HeimdallConfig.EVENTS_MAX_PENDING_ASYNC, d.maxPendingAsync()),
                config.getLong(HeimdallConfig.EVENTS_SLOW_HANDLER_WARN_MS, d.slowHandlerWarnMs()));
    }
}
