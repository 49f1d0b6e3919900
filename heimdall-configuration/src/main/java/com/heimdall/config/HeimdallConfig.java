package com.heimdall.config;

import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Well-known configuration keys, their compiled-in defaults and the requirements checked on every load.
 * <p>
 * Keys are flat and dotted ({@code section.key}); environment variable {@code APP_EXECUTOR_POOL_SIZE}
 * maps to {@link #EXECUTOR_POOL_SIZE}.
 */
public final class HeimdallConfig {

    public static final String APP_NAME = "app.name";
    public static final String APP_VERSION = "app.version";
    public static final String APP_LOGGING_LEVEL = "app.logging_level";

    public static final String PLUGINS_ENABLED = "plugins.enabled";
    public static final String PLUGINS_DISABLED = "plugins.disabled";
    public static final String PLUGINS_PATHS = "plugins.paths";

    public static final String UI_THEME = "ui.theme";
    public static final String UI_WINDOW_WIDTH = "ui.window_width";
    public static final String UI_WINDOW_HEIGHT = "ui.window_height";

    public static final String EXPORT_DEFAULT_FORMAT = "export.default_format";
    public static final String EXPORT_DEFAULT_PATH = "export.default_path";

    public static final String R_INTEGRATION_ENABLED = "r_integration.enabled";
    public static final String R_INTEGRATION_TIMEOUT = "r_integration.timeout";

    public static final String LOGGING_DIRECTORY = "logging.directory";

    public static final String EXECUTOR_POOL_SIZE = "executor.pool_size";
    public static final String EXECUTOR_QUEUE_DEPTH = "executor.queue_depth";
    public static final String EXECUTOR_BACKPRESSURE = "executor.backpressure";
    public static final String EXECUTOR_RETENTION_SECONDS = "executor.retention_seconds";
    public static final String EXECUTOR_SHUTDOWN_GRACE_SECONDS = "executor.shutdown_grace_seconds";

    public static final String EVENTS_MAX_PENDING_ASYNC = "events.max_pending_async";
    public static final String EVENTS_SLOW_HANDLER_WARN_MS = "events.slow_handler_warn_ms";

    public static final String CONFIG_WATCH_FILES = "config.watch_files";

    /** Environment variable prefix. */
    public static final String ENV_PREFIX = EnvironmentConfigSource.DEFAULT_PREFIX;

    private HeimdallConfig() {
    }

    /**
     * Compiled-in defaults, in declaration order.
     */
    public static Map<String, Object> defaults() {
        String home = System.getProperty("user.home", ".");
        Map<String, Object> d = new LinkedHashMap<>();
        d.put(APP_NAME, "Heimdall");
        d.put(APP_VERSION, "0.1.0");
        d.put(APP_LOGGING_LEVEL, "INFO");
        d.put(PLUGINS_ENABLED, List.of("*"));
        d.put(PLUGINS_DISABLED, List.of());
        d.put(PLUGINS_PATHS, List.of("plugins"));
        d.put(UI_THEME, "light");
        d.put(UI_WINDOW_WIDTH, 1200);
        d.put(UI_WINDOW_HEIGHT, 800);
        d.put(EXPORT_DEFAULT_FORMAT, "csv");
        d.put(EXPORT_DEFAULT_PATH, Paths.get(home, "Documents", "Heimdall", "exports").toString());
        d.put(R_INTEGRATION_ENABLED, true);
        d.put(R_INTEGRATION_TIMEOUT, 30);
        d.put(LOGGING_DIRECTORY, Paths.get(home, ".heimdall", "logs").toString());
        d.put(EXECUTOR_POOL_SIZE, 4);
        d.put(EXECUTOR_QUEUE_DEPTH, 256);
        d.put(EXECUTOR_BACKPRESSURE, "BLOCK");
        d.put(EXECUTOR_RETENTION_SECONDS, 300);
        d.put(EXECUTOR_SHUTDOWN_GRACE_SECONDS, 10);
        d.put(EVENTS_MAX_PENDING_ASYNC, 1024);
        d.put(EVENTS_SLOW_HANDLER_WARN_MS, 500);
        d.put(CONFIG_WATCH_FILES, false);
        return d;
    }

    public static DefaultsConfigSource defaultsSource() {
        return new DefaultsConfigSource(defaults());
    }

    /**
     * Keys the runtime itself reads. {@code app.name} must be present; the rest are type-checked when set,
     * and sizes, depths and durations must not go below what the bus and executor accept.
     * {@code executor.backpressure} is declared by the orchestrator, which sees the policy enum.
     */
    public static List<ConfigRequirement> coreRequirements() {
        return List.of(
                ConfigRequirement.required(APP_NAME, String.class),
                ConfigRequirement.optional(APP_LOGGING_LEVEL, String.class),
                ConfigRequirement.optional(PLUGINS_ENABLED, List.class),
                ConfigRequirement.optional(PLUGINS_DISABLED, List.class),
                ConfigRequirement.optional(PLUGINS_PATHS, List.class),
                ConfigRequirement.optional(UI_WINDOW_WIDTH, Integer.class),
                ConfigRequirement.optional(UI_WINDOW_HEIGHT, Integer.class),
                ConfigRequirement.optional(R_INTEGRATION_ENABLED, Boolean.class),
                ConfigRequirement.optional(R_INTEGRATION_TIMEOUT, Integer.class),
                ConfigRequirement.atLeast(EXECUTOR_POOL_SIZE, Integer.class, 1),
                ConfigRequirement.atLeast(EXECUTOR_QUEUE_DEPTH, Integer.class, 1),
                ConfigRequirement.atLeast(EXECUTOR_RETENTION_SECONDS, Long.class, 0),
                ConfigRequirement.atLeast(EXECUTOR_SHUTDOWN_GRACE_SECONDS, Long.class, 0),
                ConfigRequirement.atLeast(EVENTS_MAX_PENDING_ASYNC, Integer.class, 1),
                ConfigRequirement.atLeast(EVENTS_SLOW_HANDLER_WARN_MS, Long.class, 0),
                ConfigRequirement.optional(CONFIG_WATCH_FILES, Boolean.class));
    }
}
