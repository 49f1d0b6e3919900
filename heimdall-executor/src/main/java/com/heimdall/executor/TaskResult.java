package com.heimdall.executor;

import java.util.Objects;

/**
 * Terminal outcome of a task.
 *
 * @param taskId task id
 * @param state  COMPLETED, FAILED or CANCELLED
 * @param value  result when COMPLETED
 * @param error  cause when FAILED
 */
public record TaskResult<T>(String taskId, TaskState state, T value, Throwable error) {

    public TaskResult {
        Objects.requireNonNull(taskId, "taskId");
        Objects.requireNonNull(state, "state");
        if (!state.isTerminal()) {
            throw new IllegalArgumentException("result state must be terminal: " + state);
        }
    }

    public static <T> TaskResult<T> completed(String taskId, T value) {
        return new TaskResult<>(taskId, TaskState.COMPLETED, value, null);
    }

    public static <T> TaskResult<T> failed(String taskId, Throwable error) {
        return new TaskResult<>(taskId, TaskState.FAILED, null, error);
    }

    public static <T> TaskResult<T> cancelled(String taskId) {
        return new TaskResult<>(taskId, TaskState.CANCELLED, null, null);
    }

    public boolean isSuccess() {
        return state == TaskState.COMPLETED;
    }

    /**
     * The value of a completed task.
     *
     * @throws TaskException CANCELLED or EXECUTION_FAILED
     */
    public T getOrThrow() {
        switch (state) {
            case COMPLETED:
                return value;
            case CANCELLED:
                throw new TaskException(TaskException.Kind.CANCELLED, taskId, "Task " + taskId + " was cancelled");
            default:
                throw new TaskException(TaskException.Kind.EXECUTION_FAILED, taskId,
                        "Task " + taskId + " failed: " + (error != null ? error.getMessage() : "unknown error"), error);
        }
    }
}
