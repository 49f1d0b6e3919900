package com.heimdall.executor;

/**
 * Lifecycle of a {@link TaskHandle}: PENDING → RUNNING → COMPLETED | FAILED, and CANCELLED from PENDING or RUNNING.
 */
public enum TaskState {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}
