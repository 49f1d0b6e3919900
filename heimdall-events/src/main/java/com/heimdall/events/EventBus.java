package com.heimdall.events;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Publish/subscribe bus owned by the orchestrator.
 * <p>
 * A publish takes a snapshot of the matching subscriptions at call time and walks it in descending
 * subscription priority, then registration order. Synchronous handlers run inline; asynchronous ones are
 * handed to the bound {@link AsyncDispatcher} (or run inline when none is bound). A handler failure is
 * logged with topic and subscription id and never reaches the publisher or the remaining handlers.
 * <p>
 * Subscribing or unsubscribing during a dispatch only affects later publishes.
 */
public final class EventBus implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    /** Owner id for subscriptions made by the runtime rather than a plugin. */
    public static final String CORE_OWNER = "core";

    private final EventBusSettings settings;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final List<Subscription> subscriptions = new ArrayList<>();
    private final AtomicLong sequence = new AtomicLong();
    private final AtomicInteger pendingAsync = new AtomicInteger();
    private final Counter published;
    private final Counter handlerFailures;
    private final Counter asyncDropped;
    private volatile AsyncDispatcher dispatcher;
    private volatile boolean closed;

    public EventBus() {
        this(EventBusSettings.defaults(), new SimpleMeterRegistry());
    }

    public EventBus(EventBusSettings settings, MeterRegistry meterRegistry) {
        this.settings = Objects.requireNonNull(settings, "settings");
        Objects.requireNonNull(meterRegistry, "meterRegistry");
        this.published = meterRegistry.counter("heimdall.events.published");
        this.handlerFailures = meterRegistry.counter("heimdall.events.handler.failures");
        this.asyncDropped = meterRegistry.counter("heimdall.events.async.dropped");
    }

    /**
     * Binds the dispatcher used for {@link DispatchMode#ASYNC} subscriptions. Until bound, async handlers run inline.
     */
    public void bindDispatcher(AsyncDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    public Subscription subscribe(String pattern, EventHandler handler) {
        return subscribe(CORE_OWNER, pattern, handler, DispatchMode.SYNC, 0, Priority.LOW);
    }

    public Subscription subscribe(String pattern, EventHandler handler, DispatchMode mode, int priority) {
        return subscribe(CORE_OWNER, pattern, handler, mode, priority, Priority.LOW);
    }

    /**
     * Registers a handler.
     *
     * @param ownerId         plugin id or {@link #CORE_OWNER}; used by {@link #unsubscribeAll(String)}
     * @param pattern         exact topic, {@code prefix.*} or {@code *}
     * @param mode            sync or async invocation
     * @param priority        dispatch priority, higher first
     * @param minimumPriority envelopes below this priority are not delivered
     * @throws BusClosedException after {@link #close()}
     */
    public Subscription subscribe(String ownerId, String pattern, EventHandler handler, DispatchMode mode,
                                  int priority, Priority minimumPriority) {
        TopicPattern topicPattern = TopicPattern.of(pattern);
        lock.writeLock().lock();
        try {
            if (closed) {
                throw new BusClosedException(null);
            }
            Subscription subscription = new Subscription(sequence.incrementAndGet(), ownerId, topicPattern, handler,
                    mode, priority, minimumPriority);
            subscriptions.add(subscription);
            log.debug("Subscribed {}", subscription);
            return subscription;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * @return true if the subscription was registered
     */
    public boolean unsubscribe(Subscription subscription) {
        if (subscription == null) return false;
        lock.writeLock().lock();
        try {
            return subscriptions.remove(subscription);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Removes every subscription of {@code ownerId}.
     *
     * @return number removed
     */
    public int unsubscribeAll(String ownerId) {
        lock.writeLock().lock();
        try {
            int before = subscriptions.size();
            subscriptions.removeIf(s -> s.ownerId().equals(ownerId));
            int removed = before - subscriptions.size();
            if (removed > 0) {
                log.debug("Removed subscriptions | owner={} | count={}", ownerId, removed);
            }
            return removed;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public List<Subscription> subscriptionsOwnedBy(String ownerId) {
        lock.readLock().lock();
        try {
            return subscriptions.stream().filter(s -> s.ownerId().equals(ownerId)).toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    public int subscriptionCount() {
        lock.readLock().lock();
        try {
            return subscriptions.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public int publish(String topic, Object payload) {
        return publish(EventEnvelope.of(topic, payload));
    }

    public int publish(String topic, Object payload, Priority priority) {
        return publish(EventEnvelope.of(topic, payload, priority));
    }

    public int publish(String topic, Object payload, Priority priority, String correlationId) {
        return publish(EventEnvelope.of(topic, payload, priority, correlationId));
    }

    /**
     * Delivers {@code envelope} to the subscriptions matching it at call time.
     *
     * @return number of subscriptions selected for this dispatch
     * @throws BusClosedException after {@link #close()}
     */
    public int publish(EventEnvelope envelope) {
        Objects.requireNonNull(envelope, "envelope");
        if (closed) {
            throw new BusClosedException(envelope.topic());
        }
        List<Subscription> selected = select(envelope);
        published.increment();
        for (Subscription subscription : selected) {
            if (subscription.mode() == DispatchMode.ASYNC) {
                dispatchAsync(subscription, envelope);
            } else {
                invoke(subscription, envelope, true);
            }
        }
        return selected.size();
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Closes the bus. Later publishes and subscribes throw {@link BusClosedException}; subscriptions are dropped.
     */
    @Override
    public void close() {
        lock.writeLock().lock();
        try {
            if (closed) return;
            closed = true;
            int remaining = subscriptions.size();
            subscriptions.clear();
            log.info("Event bus closed | droppedSubscriptions={} | pendingAsync={}", remaining, pendingAsync.get());
        } finally {
            lock.writeLock().unlock();
        }
    }

    private List<Subscription> select(EventEnvelope envelope) {
        List<Subscription> selected = new ArrayList<>();
        lock.readLock().lock();
        try {
            for (Subscription s : subscriptions) {
                if (s.accepts(envelope)) {
                    selected.add(s);
                }
            }
        } finally {
            lock.readLock().unlock();
        }
        selected.sort(Subscription.DISPATCH_ORDER);
        return selected;
    }

    private void dispatchAsync(Subscription subscription, EventEnvelope envelope) {
        AsyncDispatcher current = dispatcher;
        if (current == null) {
            invoke(subscription, envelope, false);
            return;
        }
        if (pendingAsync.incrementAndGet() > settings.maxPendingAsync()) {
            pendingAsync.decrementAndGet();
            drop(subscription, envelope, "too many pending async invocations");
            return;
        }
        boolean accepted;
        try {
            accepted = current.dispatch(envelope.topic() + "/" + subscription.id(), envelope.priority(), () -> {
                try {
                    invoke(subscription, envelope, false);
                } finally {
                    pendingAsync.decrementAndGet();
                }
            });
        } catch (RuntimeException e) {
            log.debug("Async dispatcher threw | topic={} | subscription={} | error={}",
                    envelope.topic(), subscription.id(), e.getMessage());
            accepted = false;
        }
        if (!accepted) {
            pendingAsync.decrementAndGet();
            drop(subscription, envelope, "dispatcher rejected the invocation");
        }
    }

    private void drop(Subscription subscription, EventEnvelope envelope, String reason) {
        asyncDropped.increment();
        log.warn("Dropped async event delivery | topic={} | subscription={} | owner={} | reason={}",
                envelope.topic(), subscription.id(), subscription.ownerId(), reason);
    }

    private void invoke(Subscription subscription, EventEnvelope envelope, boolean timed) {
        long start = System.nanoTime();
        try {
            subscription.handler().handle(envelope);
        } catch (Throwable e) {
            handlerFailures.increment();
            EventDispatchException failure =
                    new EventDispatchException(envelope.topic(), subscription.id(), subscription.ownerId(), e);
            log.warn("Event handler failed | topic={} | subscription={} | owner={} | error={}",
                    envelope.topic(), subscription.id(), subscription.ownerId(), e.getMessage(), failure);
            return;
        }
        if (timed && settings.slowHandlerWarnMs() > 0) {
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
            if (elapsedMs > settings.slowHandlerWarnMs()) {
                log.warn("Slow synchronous event handler | topic={} | subscription={} | owner={} | elapsedMs={}",
                        envelope.topic(), subscription.id(), subscription.ownerId(), elapsedMs);
            }
        }
    }
}
