package com.heimdall.events;

/**
 * Receives envelopes matching a subscription. A thrown exception is caught and logged by the bus; it never
 * reaches the publisher and does not stop other handlers.
 */
@FunctionalInterface
public interface EventHandler {

    void handle(EventEnvelope envelope) throws Exception;
}
