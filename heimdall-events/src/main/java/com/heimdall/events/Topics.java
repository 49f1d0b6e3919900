package com.heimdall.events;

/**
 * Topics published by the runtime itself.
 */
public final class Topics {

    public static final String CONFIG_CHANGED = "config.changed";

    public static final String PLUGIN_ACTIVE = "plugin.active";
    public static final String PLUGIN_FAILED = "plugin.failed";
    public static final String PLUGIN_STOPPED = "plugin.stopped";
    public static final String PLUGIN_ALL = "plugin.*";

    public static final String TASK_STARTED = "task.started";
    public static final String TASK_PROGRESS = "task.progress";
    public static final String TASK_COMPLETED = "task.completed";
    public static final String TASK_FAILED = "task.failed";
    public static final String TASK_CANCELLED = "task.cancelled";
    public static final String TASK_ALL = "task.*";

    public static final String APP_STARTED = "app.started";
    public static final String APP_STOPPING = "app.stopping";

    public static final String COMMAND_PREFIX = "command.";

    private Topics() {
    }

    /** Topic a named command is published on, e.g. {@code command.export}. */
    public static String command(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("command name must be non-blank");
        }
        return COMMAND_PREFIX + name.trim();
    }
}
