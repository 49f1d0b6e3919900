package com.heimdall.executor;

import com.heimdall.config.ConfigReader;
import com.heimdall.config.HeimdallConfig;

import java.time.Duration;
import java.util.Objects;

/**
 * Pool and queue limits of an {@link AsyncExecutor}.
 */
public record ExecutorSettings(int poolSize, int queueDepth, BackpressurePolicy backpressure,
                               Duration retention, Duration shutdownGrace) {

    public ExecutorSettings {
        if (poolSize < 1) throw new IllegalArgumentException("poolSize must be >= 1");
        if (queueDepth < 1) throw new IllegalArgumentException("queueDepth must be >= 1");
        Objects.requireNonNull(backpressure, "backpressure");
        Objects.requireNonNull(retention, "retention");
        Objects.requireNonNull(shutdownGrace, "shutdownGrace");
    }

    public static ExecutorSettings defaults() {
        return new ExecutorSettings(4, 256, BackpressurePolicy.BLOCK, Duration.ofSeconds(300), Duration.ofSeconds(10));
    }

    public ExecutorSettings withPool(int poolSize, int queueDepth) {
        return new ExecutorSettings(poolSize, queueDepth, backpressure, retention, shutdownGrace);
    }

    public ExecutorSettings withBackpressure(BackpressurePolicy policy) {
        return new ExecutorSettings(poolSize, queueDepth, policy, retention, shutdownGrace);
    }

    public static ExecutorSettings fromConfig(ConfigReader config) {
        ExecutorSettings d = defaults();
        return new ExecutorSettings(
                config.getInt(HeimdallConfig.EXECUTOR_POOL_SIZE, d.poolSize()),
                config.getInt(HeimdallConfig.EXECUTOR_QUEUE_DEPTH, d.queueDepth()),
                config.getOrDefault(HeimdallConfig.EXECUTOR_BACKPRESSURE, BackpressurePolicy.class, d.backpressure()),
                Duration.ofSeconds(config.getLong(HeimdallConfig.EXECUTOR_RETENTION_SECONDS, d.retention().toSeconds())),
                Duration.ofSeconds(config.getLong(HeimdallConfig.EXECUTOR_SHUTDOWN_GRACE_SECONDS,
                        d.shutdownGrace().toSeconds())));
    }
}
