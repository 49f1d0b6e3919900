package com.heimdall.events;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EventBusTest {

    /** Queues invocations and runs them when asked, recording scheduling order. */
    private static final class QueueingDispatcher implements AsyncDispatcher {
        final Deque<Runnable> queued = new ArrayDeque<>();
        final List<String> names = new ArrayList<>();
        boolean reject;

        @Override
        public boolean dispatch(String name, Priority priority, Runnable invocation) {
            if (reject) return false;
            names.add(name);
            queued.add(invocation);
            return true;
        }

        void runAll() {
            while (!queued.isEmpty()) {
                queued.poll().run();
            }
        }
    }

    @Test
    void publish_invokesAllHandlersInPriorityThenRegistrationOrderDespiteFailure() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        EventBus bus = new EventBus(EventBusSettings.defaults(), registry);
        QueueingDispatcher dispatcher = new QueueingDispatcher();
        bus.bindDispatcher(dispatcher);
        List<String> calls = new ArrayList<>();

        bus.subscribe("orders.*", e -> calls.add("low-sync"), DispatchMode.SYNC, 1);
        bus.subscribe("orders.created", e -> calls.add("high-async"), DispatchMode.ASYNC, 10);
        bus.subscribe("orders.created", e -> {
            calls.add("mid-failing");
            throw new IllegalStateException("boom");
        }, DispatchMode.SYNC, 5);
        bus.subscribe("*", e -> calls.add("mid-second"), DispatchMode.SYNC, 5);
        bus.subscribe("orders.created", e -> calls.add("low-async"), DispatchMode.ASYNC, 1);
        bus.subscribe("other.topic", e -> calls.add("never"), DispatchMode.SYNC, 100);

        int selected = bus.publish("orders.created", "payload");
        dispatcher.runAll();

        assertEquals(5, selected);
        // sync handlers ran inline in order; async ones were scheduled in order and ran afterwards
        assertEquals(List.of("mid-failing", "mid-second", "low-sync", "high-async", "low-async"), calls);
        assertEquals(2, dispatcher.names.size());
        assertTrue(dispatcher.names.get(0).startsWith("orders.created/"));
        assertEquals(1.0, registry.counter("heimdall.events.handler.failures").count());
        assertEquals(1.0, registry.counter("heimdall.events.published").count());
    }

    @Test
    void publish_handlerThrowingErrorDoesNotReachPublisherOrLaterHandlers() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        EventBus bus = new EventBus(EventBusSettings.defaults(), registry);
        List<String> calls = new ArrayList<>();
        bus.subscribe("orders.created", e -> {
            calls.add("first");
            throw new AssertionError("handler bug");
        }, DispatchMode.SYNC, 10);
        bus.subscribe("orders.created", e -> {
            calls.add("second");
            throw new StackOverflowError();
        }, DispatchMode.SYNC, 5);
        bus.subscribe("orders.created", e -> calls.add("third"), DispatchMode.SYNC, 1);

        assertEquals(3, bus.publish("orders.created", "payload"));

        assertEquals(List.of("first", "second", "third"), calls);
        assertEquals(2.0, registry.counter("heimdall.events.handler.failures").count());
    }

    @Test
    void publish_withoutDispatcherRunsAsyncHandlersInlineInOrder() {
        EventBus bus = new EventBus();
        List<Integer> calls = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            int n = i;
            DispatchMode mode = i % 2 == 0 ? DispatchMode.SYNC : DispatchMode.ASYNC;
            bus.subscribe("t", e -> {
                calls.add(n);
                if (n == 2) throw new RuntimeException("handler " + n);
            }, mode, 0);
        }

        bus.publish("t", null);

        assertEquals(List.of(0, 1, 2, 3, 4, 5), calls);
    }

    @Test
    void publish_unsubscribeDuringDispatchDoesNotAffectCurrentPass() {
        EventBus bus = new EventBus();
        List<String> calls = new ArrayList<>();
        AtomicReference<Subscription> second = new AtomicReference<>();
        bus.subscribe("t", e -> {
            calls.add("first");
            bus.unsubscribe(second.get());
            bus.subscribe("t", x -> calls.add("late"));
        }, DispatchMode.SYNC, 10);
        second.set(bus.subscribe("t", e -> calls.add("second"), DispatchMode.SYNC, 0));

        bus.publish("t", null);
        assertEquals(List.of("first", "second"), calls);

        calls.clear();
        bus.publish("t", null);
        // second is gone; "late" was added during the first pass and the first handler adds another
        assertEquals(List.of("first", "late"), calls);
    }

    @Test
    void publish_subscriptionAddedAfterPublishDoesNotReceiveIt() {
        EventBus bus = new EventBus();
        List<String> calls = new ArrayList<>();
        bus.publish("t", "early");
        bus.subscribe("t", e -> calls.add(e.payloadAs(String.class)));
        bus.publish("t", "late");

        assertEquals(List.of("late"), calls);
    }

    @Test
    void publish_respectsMinimumPriorityFilter() {
        EventBus bus = new EventBus();
        List<Priority> seen = new ArrayList<>();
        bus.subscribe("core", "alerts.*", e -> seen.add(e.priority()), DispatchMode.SYNC, 0, Priority.HIGH);

        bus.publish("alerts.disk", null, Priority.LOW);
        bus.publish("alerts.disk", null, Priority.NORMAL);
        bus.publish("alerts.disk", null, Priority.HIGH);

        assertEquals(List.of(Priority.HIGH), seen);
    }

    @Test
    void publish_dropsAsyncInvocationsBeyondPendingLimit() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        EventBus bus = new EventBus(new EventBusSettings(1, 0), registry);
        QueueingDispatcher dispatcher = new QueueingDispatcher();
        bus.bindDispatcher(dispatcher);
        List<String> calls = new ArrayList<>();
        bus.subscribe("t", e -> calls.add("a"), DispatchMode.ASYNC, 0);

        bus.publish("t", null);
        bus.publish("t", null);
        dispatcher.runAll();
        bus.publish("t", null);
        dispatcher.runAll();

        assertEquals(List.of("a", "a"), calls);
        assertEquals(1.0, registry.counter("heimdall.events.async.dropped").count());
    }

    @Test
    void publish_rejectedAsyncInvocationIsDroppedNotThrown() {
        EventBus bus = new EventBus();
        QueueingDispatcher dispatcher = new QueueingDispatcher();
        dispatcher.reject = true;
        bus.bindDispatcher(dispatcher);
        bus.subscribe("t", e -> {
            throw new AssertionError("must not run");
        }, DispatchMode.ASYNC, 0);

        assertEquals(1, bus.publish("t", null));
    }

    @Test
    void unsubscribeAll_removesOnlyOwnersSubscriptions() {
        EventBus bus = new EventBus();
        bus.subscribe("plugin.a", "x", e -> { }, DispatchMode.SYNC, 0, Priority.LOW);
        bus.subscribe("plugin.a", "y.*", e -> { }, DispatchMode.ASYNC, 0, Priority.LOW);
        bus.subscribe("plugin.b", "x", e -> { }, DispatchMode.SYNC, 0, Priority.LOW);

        assertEquals(2, bus.unsubscribeAll("plugin.a"));

        assertTrue(bus.subscriptionsOwnedBy("plugin.a").isEmpty());
        assertEquals(1, bus.subscriptionCount());
    }

    @Test
    void close_rejectsLaterPublishAndSubscribe() {
        EventBus bus = new EventBus();
        bus.subscribe("t", e -> { });
        bus.close();

        BusClosedException e = assertThrows(BusClosedException.class, () -> bus.publish("t", null));
        assertEquals("t", e.getTopic());
        assertThrows(BusClosedException.class, () -> bus.subscribe("t", x -> { }));
        assertTrue(bus.isClosed());
        assertEquals(0, bus.subscriptionCount());
    }
}
