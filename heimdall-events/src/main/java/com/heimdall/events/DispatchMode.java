package com.heimdall.events;

/**
 * How a subscription is invoked by {@link EventBus#publish(EventEnvelope)}.
 */
public enum DispatchMode {
    /** Inline on the publisher's thread, before publish returns. */
    SYNC,
    /** Handed to the bound {@link AsyncDispatcher}; publish does not wait. */
    ASYNC
}
