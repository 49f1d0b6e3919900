package com.heimdall.executor;

import com.heimdall.events.Priority;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Handle to a submitted task. State and progress are updated by the executor; callers read them and
 * request cancellation through {@link AsyncExecutor#cancel(TaskHandle)}.
 */
public final class TaskHandle<T> {

    private final String id;
    private final String name;
    private final String ownerId;
    private final Priority priority;
    private final Instant submittedAt;
    private final AtomicReference<TaskState> state = new AtomicReference<>(TaskState.PENDING);
    private final CompletableFuture<TaskResult<T>> completion = new CompletableFuture<>();
    private volatile boolean cancelRequested;
    private volatile double progress = Double.NaN;
    private volatile Instant startedAt;
    private volatile Instant finishedAt;

    TaskHandle(String id, String name, String ownerId, Priority priority) {
        this.id = id;
        this.name = name;
        this.ownerId = ownerId;
        this.priority = priority;
        this.submittedAt = Instant.now();
    }

    public String id() {
        return id;
    }

    public String name() {
        return name;
    }

    public String ownerId() {
        return ownerId;
    }

    public Priority priority() {
        return priority;
    }

    public TaskState state() {
        return state.get();
    }

    /** Progress in [0, 1], or {@link Double#NaN} when indeterminate. */
    public double progress() {
        return progress;
    }

    public boolean isIndeterminate() {
        return Double.isNaN(progress);
    }

    public boolean isCancellationRequested() {
        return cancelRequested;
    }

    public boolean isDone() {
        return state.get().isTerminal();
    }

    public Instant submittedAt() {
        return submittedAt;
    }

    /** Null until the task starts running. */
    public Instant startedAt() {
        return startedAt;
    }

    /** Null until the task reaches a terminal state. */
    public Instant finishedAt() {
        return finishedAt;
    }

    CompletableFuture<TaskResult<T>> completion() {
        return completion;
    }

    boolean transition(TaskState from, TaskState to) {
        if (!state.compareAndSet(from, to)) {
            return false;
        }
        if (to == TaskState.RUNNING) {
            startedAt = Instant.now();
        } else if (to.isTerminal()) {
            finishedAt = Instant.now();
        }
        return true;
    }

    void requestCancel() {
        cancelRequested = true;
    }

    void setProgress(double value) {
        progress = value;
    }

    @Override
    public String toString() {
        return "TaskHandle{" + id + ", name=" + name + ", owner=" + ownerId + ", priority=" + priority
                + ", state=" + state.get() + "}";
    }
}
