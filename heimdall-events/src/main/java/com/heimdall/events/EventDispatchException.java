package com.heimdall.events;

/**
 * Failure of one handler invocation. Only created for logging; never thrown to a publisher.
 */
public final class EventDispatchException extends RuntimeException {

    private final String topic;
    private final String subscriptionId;
    private final String ownerId;

    public EventDispatchException(String topic, String subscriptionId, String ownerId, Throwable cause) {
        super("Handler " + subscriptionId + " (owner " + ownerId + ") failed on topic " + topic
                + (cause != null ? ": " + cause.getMessage() : ""), cause);
        this.topic = topic;
        this.subscriptionId = subscriptionId;
        this.ownerId = ownerId;
    }

    public String getTopic() {
        return topic;
    }

    public String getSubscriptionId() {
        return subscriptionId;
    }

    public String getOwnerId() {
        return ownerId;
    }
}
