package com.heimdall.executor;

/**
 * Payload of the {@code task.*} events.
 *
 * @param taskId   task id
 * @param name     task name
 * @param ownerId  submitting plugin id, or {@code core}
 * @param state    state after the transition
 * @param progress progress in [0, 1], or null when indeterminate
 * @param error    failure message for {@code task.failed}, otherwise null
 */
public record TaskEvent(String taskId, String name, String ownerId, TaskState state, Double progress, String error) {

    static TaskEvent of(TaskHandle<?> handle, String error) {
        double p = handle.progress();
        return new TaskEvent(handle.id(), handle.name(), handle.ownerId(), handle.state(),
                Double.isNaN(p) ? null : p, error);
    }
}
