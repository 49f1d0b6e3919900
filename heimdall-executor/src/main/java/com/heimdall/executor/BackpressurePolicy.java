package com.heimdall.executor;

/**
 * What {@link AsyncExecutor#submit} does when the queue is full.
 */
public enum BackpressurePolicy {
    /** Block the submitting thread until a slot frees up. */
    BLOCK,
    /** Throw {@link TaskException} with kind {@link TaskException.Kind#BACKPRESSURE}. */
    FAIL_FAST
}
