package com.heimdall.events;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * One published event. Immutable; the payload is opaque to the bus.
 *
 * @param topic         dotted topic name (e.g. {@code export.csv.completed})
 * @param payload       typed payload, may be null
 * @param priority      envelope priority; subscriptions may filter on it
 * @param timestamp     publish time
 * @param correlationId id tying related events together (a command and its results)
 */
public record EventEnvelope(String topic, Object payload, Priority priority, Instant timestamp, String correlationId) {

    public EventEnvelope {
        Objects.requireNonNull(topic, "topic");
        if (topic.isBlank()) {
            throw new IllegalArgumentException("topic must be non-blank");
        }
        priority = priority != null ? priority : Priority.NORMAL;
        timestamp = timestamp != null ? timestamp : Instant.now();
        correlationId = correlationId != null && !correlationId.isBlank() ? correlationId : UUID.randomUUID().toString();
    }

    public static EventEnvelope of(String topic, Object payload) {
        return new EventEnvelope(topic, payload, Priority.NORMAL, null, null);
    }

    public static EventEnvelope of(String topic, Object payload, Priority priority) {
        return new EventEnvelope(topic, payload, priority, null, null);
    }

    public static EventEnvelope of(String topic, Object payload, Priority priority, String correlationId) {
        return new EventEnvelope(topic, payload, priority, null, correlationId);
    }

    /**
     * Payload cast to {@code type}.
     *
     * @throws ClassCastException when the payload is of another type
     */
    public <T> T payloadAs(Class<T> type) {
        return type.cast(payload);
    }
}
