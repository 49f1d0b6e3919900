package com.heimdall.events;

/**
 * Thrown by {@link EventBus} operations after the bus was closed.
 */
public final class BusClosedException extends IllegalStateException {

    private final String topic;

    public BusClosedException(String topic) {
        super("Event bus is closed" + (topic != null ? "; cannot publish " + topic : ""));
        this.topic = topic;
    }

    /** Topic of the rejected publish, or null for subscribe calls. */
    public String getTopic() {
        return topic;
    }
}
