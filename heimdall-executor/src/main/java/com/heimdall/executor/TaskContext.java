package com.heimdall.executor;

/**
 * Handed to running {@link Work}: cooperative cancellation and progress reporting.
 */
public interface TaskContext {

    String taskId();

    boolean isCancelled();

    /**
     * @throws TaskException with kind {@link TaskException.Kind#CANCELLED} when cancellation was requested
     */
    void throwIfCancelled();

    /** Reports progress in [0, 1]; values outside are clamped. Publishes {@code task.progress}. */
    void reportProgress(double fraction);

    /** Reports that progress cannot be estimated. */
    void reportIndeterminate();
}
