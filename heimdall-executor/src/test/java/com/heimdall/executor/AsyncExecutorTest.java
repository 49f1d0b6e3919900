package com.heimdall.executor;

import com.heimdall.events.DispatchMode;
import com.heimdall.events.EventBus;
import com.heimdall.events.EventEnvelope;
import com.heimdall.events.Priority;
import com.heimdall.events.Topics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AsyncExecutorTest {

    private final EventBus bus = new EventBus();
    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final List<EventEnvelope> taskEvents = Collections.synchronizedList(new ArrayList<>());
    private AsyncExecutor executor;

    private AsyncExecutor newExecutor(int poolSize, int queueDepth, BackpressurePolicy policy) {
        bus.subscribe(Topics.TASK_ALL, taskEvents::add, DispatchMode.SYNC, 0);
        executor = new AsyncExecutor(new ExecutorSettings(poolSize, queueDepth, policy,
                Duration.ofMinutes(5), Duration.ofSeconds(2)), bus, registry);
        return executor;
    }

    @AfterEach
    void tearDown() {
        if (executor != null) {
            executor.shutdown(Duration.ofMillis(200));
        }
    }

    private List<String> topics() {
        synchronized (taskEvents) {
            return taskEvents.stream().map(EventEnvelope::topic).toList();
        }
    }

    @Test
    void submit_singleWorkerRunsHighThenNormalThenLow() {
        AsyncExecutor exec = newExecutor(1, 3, BackpressurePolicy.FAIL_FAST);
        List<Priority> order = Collections.synchronizedList(new ArrayList<>());

        TaskHandle<Void> low = exec.submit(ctx -> { order.add(Priority.LOW); return null; }, Priority.LOW);
        TaskHandle<Void> high = exec.submit(ctx -> { order.add(Priority.HIGH); return null; }, Priority.HIGH);
        TaskHandle<Void> normal = exec.submit(ctx -> { order.add(Priority.NORMAL); return null; }, Priority.NORMAL);
        exec.start();

        exec.await(low, Duration.ofSeconds(5));
        exec.await(high, Duration.ofSeconds(5));
        exec.await(normal, Duration.ofSeconds(5));
        assertEquals(List.of(Priority.HIGH, Priority.NORMAL, Priority.LOW), order);
    }

    @Test
    void cancel_pollingWorkEndsCancelledWithSingleEvent() throws Exception {
        AsyncExecutor exec = newExecutor(2, 10, BackpressurePolicy.BLOCK);
        exec.start();
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch exited = new CountDownLatch(1);

        TaskHandle<String> handle = exec.submit("poller", "core", Priority.NORMAL, ctx -> {
            started.countDown();
            try {
                while (!ctx.isCancelled()) {
                    Thread.sleep(5);
                }
                return "ignored";
            } finally {
                exited.countDown();
            }
        });
        assertTrue(started.await(5, TimeUnit.SECONDS));

        assertTrue(exec.cancel(handle));
        TaskResult<String> result = exec.await(handle, Duration.ofSeconds(5));
        assertTrue(exited.await(5, TimeUnit.SECONDS));

        assertEquals(TaskState.CANCELLED, result.state());
        assertNull(result.value());
        assertEquals(TaskState.CANCELLED, handle.state());
        TaskException e = assertThrows(TaskException.class, result::getOrThrow);
        assertEquals(TaskException.Kind.CANCELLED, e.getKind());
        assertEquals(1, Collections.frequency(topics(), Topics.TASK_CANCELLED));
        assertFalse(topics().contains(Topics.TASK_COMPLETED));
        assertFalse(exec.cancel(handle));
    }

    @Test
    void cancel_pendingTaskNeverRuns() {
        AsyncExecutor exec = newExecutor(1, 3, BackpressurePolicy.BLOCK);
        AtomicBoolean ran = new AtomicBoolean();
        TaskHandle<Void> handle = exec.submit(ctx -> { ran.set(true); return null; }, Priority.HIGH);

        assertTrue(exec.cancel(handle));
        assertEquals(0, exec.queuedCount());
        exec.start();
        TaskHandle<Void> after = exec.submit(ctx -> null, Priority.LOW);
        exec.await(after, Duration.ofSeconds(5));

        assertEquals(TaskState.CANCELLED, exec.await(handle, Duration.ofSeconds(1)).state());
        assertFalse(ran.get());
        // only the second task started
        assertEquals(1, Collections.frequency(topics(), Topics.TASK_STARTED));
    }

    @Test
    void submit_failFastRejectsWhenQueueFull() {
        AsyncExecutor exec = newExecutor(1, 1, BackpressurePolicy.FAIL_FAST);
        exec.submit(ctx -> null, Priority.NORMAL);

        TaskException e = assertThrows(TaskException.class, () -> exec.submit(ctx -> null, Priority.HIGH));

        assertEquals(TaskException.Kind.BACKPRESSURE, e.getKind());
        assertEquals(1, exec.queuedCount());
    }

    @Test
    void await_timesOutWhileWorkKeepsRunning() throws Exception {
        AsyncExecutor exec = newExecutor(1, 3, BackpressurePolicy.BLOCK);
        exec.start();
        CountDownLatch release = new CountDownLatch(1);
        TaskHandle<Integer> handle = exec.submit(ctx -> {
            release.await();
            return 7;
        }, Priority.NORMAL);

        TaskException e = assertThrows(TaskException.class, () -> exec.await(handle, Duration.ofMillis(50)));
        assertEquals(TaskException.Kind.TIMEOUT, e.getKind());
        assertEquals(handle.id(), e.getTaskId());

        release.countDown();
        assertEquals(7, exec.await(handle, Duration.ofSeconds(5)).getOrThrow());
    }

    @Test
    void submit_failureIsDeliveredToHandleAndPoolSurvives() {
        AsyncExecutor exec = newExecutor(1, 3, BackpressurePolicy.BLOCK);
        exec.start();

        TaskHandle<Object> failing = exec.submit(ctx -> {
            throw new IllegalArgumentException("bad input");
        }, Priority.NORMAL);
        TaskResult<Object> failed = exec.await(failing, Duration.ofSeconds(5));
        TaskHandle<String> next = exec.submit(ctx -> "ok", Priority.NORMAL);

        assertEquals(TaskState.FAILED, failed.state());
        TaskException e = assertThrows(TaskException.class, failed::getOrThrow);
        assertEquals(TaskException.Kind.EXECUTION_FAILED, e.getKind());
        assertTrue(e.getCause() instanceof IllegalArgumentException);
        assertEquals("ok", exec.await(next, Duration.ofSeconds(5)).getOrThrow());
        assertTrue(topics().contains(Topics.TASK_FAILED));
        assertEquals(1.0, registry.counter("heimdall.tasks", "outcome", "failed").count());
    }

    @Test
    void submit_publishesLifecycleAndProgressEvents() {
        AsyncExecutor exec = newExecutor(1, 3, BackpressurePolicy.BLOCK);
        exec.start();

        TaskHandle<String> handle = exec.submit("report", "plugin.x", Priority.NORMAL, ctx -> {
            ctx.reportProgress(0.5);
            ctx.reportIndeterminate();
            ctx.reportProgress(2.0);
            return "done";
        });
        exec.await(handle, Duration.ofSeconds(5));

        assertEquals(List.of(Topics.TASK_STARTED, Topics.TASK_PROGRESS, Topics.TASK_PROGRESS, Topics.TASK_PROGRESS,
                Topics.TASK_COMPLETED), topics());
        TaskEvent first = taskEvents.get(1).payloadAs(TaskEvent.class);
        assertEquals(0.5, first.progress());
        assertNull(taskEvents.get(2).payloadAs(TaskEvent.class).progress());
        assertEquals(1.0, taskEvents.get(3).payloadAs(TaskEvent.class).progress());
        assertEquals("plugin.x", taskEvents.get(4).payloadAs(TaskEvent.class).ownerId());
        assertEquals(1.0, handle.progress());
        assertEquals(0, exec.trackedTasks());
    }

    @Test
    void cancelAllOwnedBy_cancelsOnlyThatOwner() {
        AsyncExecutor exec = newExecutor(1, 10, BackpressurePolicy.BLOCK);
        TaskHandle<Void> a1 = exec.submit("a1", "plugin.a", Priority.NORMAL, ctx -> null);
        TaskHandle<Void> a2 = exec.submit("a2", "plugin.a", Priority.NORMAL, ctx -> null);
        TaskHandle<Void> b = exec.submit("b", "plugin.b", Priority.NORMAL, ctx -> null);

        assertEquals(2, exec.cancelAllOwnedBy("plugin.a"));

        assertEquals(TaskState.CANCELLED, a1.state());
        assertEquals(TaskState.CANCELLED, a2.state());
        assertEquals(TaskState.PENDING, b.state());
    }

    @Test
    void shutdown_forceCancelsWorkThatOutlivesGrace() throws Exception {
        AsyncExecutor exec = newExecutor(1, 10, BackpressurePolicy.BLOCK);
        exec.start();
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch never = new CountDownLatch(1);
        TaskHandle<Void> blocking = exec.submit(ctx -> {
            started.countDown();
            never.await();
            return null;
        }, Priority.NORMAL);
        TaskHandle<Void> pending = exec.submit(ctx -> null, Priority.NORMAL);
        assertTrue(started.await(5, TimeUnit.SECONDS));

        int forced = exec.shutdown(Duration.ofMillis(100));

        assertEquals(2, forced);
        assertEquals(TaskState.CANCELLED, blocking.state());
        assertEquals(TaskState.CANCELLED, pending.state());
        assertThrows(IllegalStateException.class, () -> exec.submit(ctx -> null, Priority.NORMAL));
    }

    @Test
    void shutdown_drainsQueuedWorkWithinGrace() {
        AsyncExecutor exec = newExecutor(2, 10, BackpressurePolicy.BLOCK);
        exec.start();
        List<TaskHandle<Integer>> handles = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            int n = i;
            handles.add(exec.submit(ctx -> n, Priority.NORMAL));
        }

        assertEquals(0, exec.shutdown(Duration.ofSeconds(5)));

        for (TaskHandle<Integer> h : handles) {
            assertEquals(TaskState.COMPLETED, h.state());
        }
    }

    @Test
    void dispatch_runsUntrackedWithoutTaskEvents() throws Exception {
        AsyncExecutor exec = newExecutor(1, 3, BackpressurePolicy.BLOCK);
        exec.start();
        CountDownLatch ran = new CountDownLatch(1);

        assertTrue(exec.dispatch("topic/sub-1", Priority.NORMAL, ran::countDown));

        assertTrue(ran.await(5, TimeUnit.SECONDS));
        assertEquals(0, exec.trackedTasks());
        assertTrue(topics().isEmpty());
    }

    @Test
    void dispatch_rejectedWhenQueueFull() {
        AsyncExecutor exec = newExecutor(1, 1, BackpressurePolicy.BLOCK);

        assertTrue(exec.dispatch("a", Priority.NORMAL, () -> { }));
        assertFalse(exec.dispatch("b", Priority.NORMAL, () -> { }));
    }

    @Test
    void submit_errorThrownByWorkFailsTaskAndPoolSurvives() {
        AsyncExecutor exec = newExecutor(1, 4, BackpressurePolicy.FAIL_FAST);
        exec.start();

        TaskHandle<String> bad = exec.submit(ctx -> {
            throw new AssertionError("broken invariant");
        }, Priority.HIGH);
        TaskHandle<String> good = exec.submit(ctx -> "ok", Priority.NORMAL);

        TaskResult<String> badResult = exec.await(bad, Duration.ofSeconds(5));
        assertEquals(TaskState.FAILED, badResult.state());
        assertTrue(badResult.error() instanceof AssertionError);
        assertEquals(TaskState.FAILED, bad.state());
        assertTrue(topics().contains(Topics.TASK_FAILED));

        TaskResult<String> goodResult = exec.await(good, Duration.ofSeconds(5));
        assertEquals(TaskState.COMPLETED, goodResult.state());
        assertEquals("ok", goodResult.value());
    }

    @Test
    void dispatch_errorThrownByInvocationDoesNotStopWorker() {
        AsyncExecutor exec = newExecutor(1, 4, BackpressurePolicy.FAIL_FAST);
        exec.start();

        assertTrue(exec.dispatch("broken", Priority.HIGH, () -> {
            throw new AssertionError("handler bug");
        }));
        TaskHandle<String> after = exec.submit(ctx -> "ok", Priority.LOW);

        assertEquals("ok", exec.await(after, Duration.ofSeconds(5)).value());
    }

    @Test
    void submit_blockWaitsForQueueSpaceThenSucceeds() throws Exception {
        AsyncExecutor exec = newExecutor(1, 1, BackpressurePolicy.BLOCK);
        TaskHandle<String> first = exec.submit(ctx -> "first", Priority.NORMAL);
        List<TaskHandle<String>> submitted = Collections.synchronizedList(new ArrayList<>());
        CountDownLatch submitting = new CountDownLatch(1);

        Thread producer = new Thread(() -> {
            submitting.countDown();
            submitted.add(exec.submit(ctx -> "second", Priority.NORMAL));
        }, "blocked-producer");
        producer.start();
        assertTrue(submitting.await(5, TimeUnit.SECONDS));
        producer.join(200);

        // queue is full and no worker is pulling yet
        assertTrue(producer.isAlive());
        assertTrue(submitted.isEmpty());

        exec.start();
        producer.join(5_000);
        assertFalse(producer.isAlive());
        assertEquals(1, submitted.size());
        assertEquals("first", exec.await(first, Duration.ofSeconds(5)).value());
        assertEquals("second", exec.await(submitted.get(0), Duration.ofSeconds(5)).value());
    }

    @Test
    void submit_interruptedWhileBlockedIsBackpressure() {
        AsyncExecutor exec = newExecutor(1, 1, BackpressurePolicy.BLOCK);
        exec.submit(ctx -> null, Priority.NORMAL);

        Thread.currentThread().interrupt();
        TaskException e;
        try {
            e = assertThrows(TaskException.class, () -> exec.submit(ctx -> null, Priority.HIGH));
        } finally {
            assertTrue(Thread.interrupted());
        }

        assertEquals(TaskException.Kind.BACKPRESSURE, e.getKind());
        assertEquals(1, exec.queuedCount());
    }
}
