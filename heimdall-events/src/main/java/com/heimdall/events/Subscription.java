package com.heimdall.events;

import java.util.Comparator;
import java.util.Objects;

/**
 * A handler bound to a topic pattern. Returned by {@link EventBus#subscribe} and used to unsubscribe.
 * Higher {@link #priority()} is invoked first; equal priorities run in registration order.
 */
public final class Subscription {

    /** Dispatch order: descending priority, then registration order. */
    static final Comparator<Subscription> DISPATCH_ORDER =
            Comparator.comparingInt(Subscription::priority).reversed().thenComparingLong(Subscription::sequence);

    private final String id;
    private final String ownerId;
    private final TopicPattern pattern;
    private final EventHandler handler;
    private final DispatchMode mode;
    private final int priority;
    private final Priority minimumPriority;
    private final long sequence;

    Subscription(long sequence, String ownerId, TopicPattern pattern, EventHandler handler, DispatchMode mode,
                 int priority, Priority minimumPriority) {
        this.sequence = sequence;
        this.id = "sub-" + sequence;
        this.ownerId = Objects.requireNonNull(ownerId, "ownerId");
        this.pattern = Objects.requireNonNull(pattern, "pattern");
        this.handler = Objects.requireNonNull(handler, "handler");
        this.mode = mode != null ? mode : DispatchMode.SYNC;
        this.priority = priority;
        this.minimumPriority = minimumPriority != null ? minimumPriority : Priority.LOW;
    }

    public String id() {
        return id;
    }

    /** Plugin id, or {@link EventBus#CORE_OWNER} for runtime subscriptions. */
    public String ownerId() {
        return ownerId;
    }

    public TopicPattern pattern() {
        return pattern;
    }

    public DispatchMode mode() {
        return mode;
    }

    public int priority() {
        return priority;
    }

    public Priority minimumPriority() {
        return minimumPriority;
    }

    long sequence() {
        return sequence;
    }

    EventHandler handler() {
        return handler;
    }

    boolean accepts(EventEnvelope envelope) {
        return envelope.priority().isAtLeast(minimumPriority) && pattern.matches(envelope.topic());
    }

    @Override
    public String toString() {
        return "Subscription{" + id + ", owner=" + ownerId + ", pattern=" + pattern + ", mode=" + mode
                + ", priority=" + priority + "}";
    }
}
