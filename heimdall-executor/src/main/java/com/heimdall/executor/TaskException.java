package com.heimdall.executor;

/**
 * Failure of a task or of an executor call.
 */
public class TaskException extends RuntimeException {

    public enum Kind {
        /** Queue full under {@link BackpressurePolicy#FAIL_FAST}, or interrupted while blocked. */
        BACKPRESSURE,
        /** The task was cancelled before it produced a result. */
        CANCELLED,
        /** The work threw. The cause is the thrown exception. */
        EXECUTION_FAILED,
        /** {@link AsyncExecutor#await} timed out. */
        TIMEOUT
    }

    private final Kind kind;
    private final String taskId;

    public TaskException(Kind kind, String taskId, String message) {
        this(kind, taskId, message, null);
    }

    public TaskException(Kind kind, String taskId, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.taskId = taskId;
    }

    public Kind getKind() {
        return kind;
    }

    /** Id of the task involved, or null when the task was never created (backpressure). */
    public String getTaskId() {
        return taskId;
    }
}
