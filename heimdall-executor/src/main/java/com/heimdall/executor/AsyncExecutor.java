package com.heimdall.executor;

import com.heimdall.events.AsyncDispatcher;
import com.heimdall.events.BusClosedException;
import com.heimdall.events.EventBus;
import com.heimdall.events.Priority;
import com.heimdall.events.Topics;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Fixed worker pool pulling from a bounded priority queue.
 * <p>
 * Work submitted before {@link #start()} waits in the queue in priority order. Cancellation is cooperative:
 * {@link #cancel(TaskHandle)} moves the handle to CANCELLED at once and publishes {@code task.cancelled};
 * the running work sees {@link TaskContext#isCancelled()} and any value it still returns is discarded.
 * Every transition of a tracked task is published on the bus ({@code task.started}, {@code task.progress},
 * {@code task.completed}, {@code task.failed}, {@code task.cancelled}).
 * <p>
 * As an {@link AsyncDispatcher} the executor also runs asynchronous event handler invocations. Those are
 * untracked: they share the queue and the workers but create no handle and publish no task events.
 */
public final class AsyncExecutor implements AsyncDispatcher, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AsyncExecutor.class);

    /** Owner id of tasks submitted by the runtime itself. */
    public static final String CORE_OWNER = "core";

    private static final long POLL_MS = 250;

    private final ExecutorSettings settings;
    private final EventBus bus;
    private final TaskQueue queue;
    private final Map<String, TaskHandle<?>> handles = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();
    private final AtomicInteger threadIndex = new AtomicInteger();
    private final MeterRegistry meterRegistry;
    private final Timer duration;
    private final Object lifecycleLock = new Object();
    private ExecutorService workers;
    private volatile boolean shutDown;

    public AsyncExecutor(ExecutorSettings settings, EventBus bus, MeterRegistry meterRegistry) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.bus = Objects.requireNonNull(bus, "bus");
        this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry");
        this.queue = new TaskQueue(settings.queueDepth());
        this.duration = meterRegistry.timer("heimdall.tasks.duration");
        Gauge.builder("heimdall.tasks.queued", queue, TaskQueue::size).register(meterRegistry);
    }

    public ExecutorSettings settings() {
        return settings;
    }

    /**
     * Starts the worker threads. Calling it again has no effect.
     *
     * @throws IllegalStateException after shutdown
     */
    public void start() {
        synchronized (lifecycleLock) {
            if (shutDown) throw new IllegalStateException("Executor is shut down");
            if (workers != null) return;
            workers = Executors.newFixedThreadPool(settings.poolSize(), r -> {
                Thread t = new Thread(r, "heimdall-worker-" + threadIndex.incrementAndGet());
                t.setDaemon(true);
                return t;
            });
            for (int i = 0; i < settings.poolSize(); i++) {
                workers.execute(this::workerLoop);
            }
            log.info("Async executor started | poolSize={} | queueDepth={} | backpressure={} | queued={}",
                    settings.poolSize(), settings.queueDepth(), settings.backpressure(), queue.size());
        }
    }

    public boolean isStarted() {
        synchronized (lifecycleLock) {
            return workers != null;
        }
    }

    public <T> TaskHandle<T> submit(Work<T> work, Priority priority) {
        return submit("task", CORE_OWNER, priority, work);
    }

    /**
     * Queues {@code work}.
     *
     * @param name     label for logs and events
     * @param ownerId  submitting plugin id or {@link #CORE_OWNER}; see {@link #cancelAllOwnedBy(String)}
     * @param priority queue priority
     * @throws TaskException         BACKPRESSURE when the queue is full under FAIL_FAST (or interrupted under BLOCK)
     * @throws IllegalStateException after shutdown
     */
    public <T> TaskHandle<T> submit(String name, String ownerId, Priority priority, Work<T> work) {
        Objects.requireNonNull(work, "work");
        if (shutDown) {
            throw new IllegalStateException("Executor is shut down; cannot submit " + name);
        }
        purgeExpired();
        Priority p = priority != null ? priority : Priority.NORMAL;
        long seq = sequence.incrementAndGet();
        TaskHandle<T> handle = new TaskHandle<>("task-" + seq, name, ownerId != null ? ownerId : CORE_OWNER, p);
        TaskQueue.Entry entry = new TaskQueue.Entry(p, seq, handle, () -> execute(handle, work));
        handles.put(handle.id(), handle);
        boolean queued;
        try {
            queued = queue.put(entry, settings.backpressure() == BackpressurePolicy.BLOCK);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            handles.remove(handle.id());
            throw new TaskException(TaskException.Kind.BACKPRESSURE, null,
                    "Interrupted while waiting for queue space for " + name, e);
        }
        if (!queued) {
            handles.remove(handle.id());
            if (queue.isClosed()) {
                throw new IllegalStateException("Executor is shut down; cannot submit " + name);
            }
            meterRegistry.counter("heimdall.tasks.rejected").increment();
            throw new TaskException(TaskException.Kind.BACKPRESSURE, null,
                    "Task queue full (" + settings.queueDepth() + "); rejected " + name);
        }
        log.debug("Task submitted | id={} | name={} | owner={} | priority={}", handle.id(), name, handle.ownerId(), p);
        return handle;
    }

    /**
     * Runs an event handler invocation without tracking. Never blocks: a full queue rejects it.
     */
    @Override
    public boolean dispatch(String name, Priority priority, Runnable invocation) {
        if (shutDown) return false;
        TaskQueue.Entry entry = new TaskQueue.Entry(priority != null ? priority : Priority.NORMAL,
                sequence.incrementAndGet(), null, invocation);
        try {
            return queue.put(entry, false);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /**
     * Requests cancellation. A pending or running task becomes CANCELLED immediately and {@code task.cancelled}
     * is published once.
     *
     * @return false when the task had already reached a terminal state
     */
    public boolean cancel(TaskHandle<?> handle) {
        Objects.requireNonNull(handle, "handle");
        handle.requestCancel();
        while (true) {
            TaskState current = handle.state();
            if (current.isTerminal()) {
                return false;
            }
            if (handle.transition(current, TaskState.CANCELLED)) {
                if (current == TaskState.PENDING) {
                    queue.remove(handle);
                }
                finish(handle, TaskResult.cancelled(handle.id()), Topics.TASK_CANCELLED, null);
                log.info("Task cancelled | id={} | name={} | was={}", handle.id(), handle.name(), current);
                return true;
            }
        }
    }

    /**
     * Cancels every pending or running task of {@code ownerId}.
     *
     * @return number of tasks cancelled
     */
    public int cancelAllOwnedBy(String ownerId) {
        int cancelled = 0;
        for (TaskHandle<?> handle : new ArrayList<>(handles.values())) {
            if (handle.ownerId().equals(ownerId) && cancel(handle)) {
                cancelled++;
            }
        }
        return cancelled;
    }

    /** Progress in [0, 1], or NaN when indeterminate. */
    public double progress(TaskHandle<?> handle) {
        return handle.progress();
    }

    public Optional<TaskHandle<?>> find(String taskId) {
        purgeExpired();
        return Optional.ofNullable(handles.get(taskId));
    }

    public <T> TaskResult<T> await(TaskHandle<T> handle) {
        return await(handle, null);
    }

    /**
     * Waits for the terminal outcome. A cancelled task returns its CANCELLED result even while its work is
     * still running. The handle is released from the lookup table once its result was collected.
     *
     * @param timeout maximum wait, or null to wait indefinitely
     * @throws TaskException TIMEOUT when the timeout elapses (the task keeps running)
     */
    public <T> TaskResult<T> await(TaskHandle<T> handle, Duration timeout) {
        Objects.requireNonNull(handle, "handle");
        try {
            TaskResult<T> result = timeout == null
                    ? handle.completion().get()
                    : handle.completion().get(timeout.toNanos(), TimeUnit.NANOSECONDS);
            handles.remove(handle.id());
            return result;
        } catch (TimeoutException e) {
            throw new TaskException(TaskException.Kind.TIMEOUT, handle.id(),
                    "Task " + handle.id() + " did not finish within " + timeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TaskException(TaskException.Kind.TIMEOUT, handle.id(),
                    "Interrupted while awaiting task " + handle.id(), e);
        } catch (ExecutionException e) {
            // completion is only ever completed normally
            throw new TaskException(TaskException.Kind.EXECUTION_FAILED, handle.id(), e.getMessage(), e.getCause());
        }
    }

    /** Number of tracked (not yet collected or expired) tasks. */
    public int trackedTasks() {
        return handles.size();
    }

    public int queuedCount() {
        return queue.size();
    }

    /**
     * Stops intake, lets queued and running work finish for up to {@code grace}, then cancels what is left
     * and interrupts the workers.
     *
     * @return number of tasks force-cancelled
     */
    public int shutdown(Duration grace) {
        ExecutorService pool;
        synchronized (lifecycleLock) {
            if (shutDown) return 0;
            shutDown = true;
            pool = workers;
        }
        queue.close();
        boolean drained = false;
        if (pool != null) {
            pool.shutdown();
            try {
                drained = pool.awaitTermination(grace.toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        int forced = 0;
        if (!drained) {
            queue.drain();
            for (TaskHandle<?> handle : new ArrayList<>(handles.values())) {
                if (cancel(handle)) forced++;
            }
            if (pool != null) {
                pool.shutdownNow();
                try {
                    if (!pool.awaitTermination(1, TimeUnit.SECONDS)) {
                        log.warn("Workers did not stop after interrupt");
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
        }
        log.info("Async executor shut down | drained={} | forceCancelled={}", drained, forced);
        return forced;
    }

    public int shutdown() {
        return shutdown(settings.shutdownGrace());
    }

    public boolean isShutDown() {
        return shutDown;
    }

    @Override
    public void close() {
        shutdown();
    }

    private void workerLoop() {
        while (true) {
            TaskQueue.Entry entry;
            try {
                entry = queue.take(POLL_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            if (entry == null) {
                if (queue.isClosed()) return;
                continue;
            }
            try {
                entry.body.run();
            } catch (Throwable e) {
                log.error("Unexpected failure in worker | error={}", e.getMessage(), e);
            }
            if (Thread.interrupted() && queue.isClosed()) {
                return;
            }
        }
    }

    private <T> void execute(TaskHandle<T> handle, Work<T> work) {
        if (!handle.transition(TaskState.PENDING, TaskState.RUNNING)) {
            return;
        }
        publish(Topics.TASK_STARTED, handle, null);
        T value;
        try {
            value = work.run(new Context(handle));
        } catch (Throwable e) {
            if (handle.transition(TaskState.RUNNING, TaskState.FAILED)) {
                log.warn("Task failed | id={} | name={} | error={}", handle.id(), handle.name(), e.getMessage(), e);
                finish(handle, TaskResult.failed(handle.id(), e), Topics.TASK_FAILED, String.valueOf(e.getMessage()));
            } else {
                log.debug("Task {} ended after cancellation | error={}", handle.id(), e.getMessage());
            }
            return;
        }
        if (handle.transition(TaskState.RUNNING, TaskState.COMPLETED)) {
            handle.setProgress(1.0);
            finish(handle, TaskResult.completed(handle.id(), value), Topics.TASK_COMPLETED, null);
        } else {
            log.debug("Discarding result of cancelled task {}", handle.id());
        }
    }

    private <T> void finish(TaskHandle<T> handle, TaskResult<T> result, String topic, String error) {
        String outcome = result.state().name().toLowerCase(Locale.ROOT);
        meterRegistry.counter("heimdall.tasks", "outcome", outcome).increment();
        Instant started = handle.startedAt();
        if (started != null) {
            duration.record(Duration.between(started, handle.finishedAt()));
        }
        publish(topic, handle, error);
        handle.completion().complete(result);
    }

    private void publish(String topic, TaskHandle<?> handle, String error) {
        try {
            bus.publish(topic, TaskEvent.of(handle, error), handle.priority());
        } catch (BusClosedException e) {
            log.debug("Task event not published, bus closed | topic={} | task={}", topic, handle.id());
        }
    }

    private void purgeExpired() {
        Instant cutoff = Instant.now().minus(settings.retention());
        handles.values().removeIf(h -> {
            Instant finished = h.finishedAt();
            return h.isDone() && finished != null && finished.isBefore(cutoff);
        });
    }

    private final class Context implements TaskContext {

        private final TaskHandle<?> handle;

        Context(TaskHandle<?> handle) {
            this.handle = handle;
        }

        @Override
        public String taskId() {
            return handle.id();
        }

        @Override
        public boolean isCancelled() {
            return handle.isCancellationRequested();
        }

        @Override
        public void throwIfCancelled() {
            if (handle.isCancellationRequested()) {
                throw new TaskException(TaskException.Kind.CANCELLED, handle.id(), "Task " + handle.id() + " was cancelled");
            }
        }

        @Override
        public void reportProgress(double fraction) {
            if (handle.state() != TaskState.RUNNING) return;
            handle.setProgress(Math.max(0.0, Math.min(1.0, fraction)));
            publish(Topics.TASK_PROGRESS, handle, null);
        }

        @Override
        public void reportIndeterminate() {
            if (handle.state() != TaskState.RUNNING) return;
            handle.setProgress(Double.NaN);
            publish(Topics.TASK_PROGRESS, handle, null);
        }
    }
}
