package com.heimdall.events;

/**
 * Runs asynchronous handler invocations off the publisher's thread. Implemented by the async executor and
 * bound to the bus by the orchestrator.
 */
public interface AsyncDispatcher {

    /**
     * Schedules {@code invocation}.
     *
     * @param name       label for logs and thread diagnostics (topic and subscription id)
     * @param priority   scheduling priority
     * @param invocation the handler call; it never throws
     * @return false when the invocation was rejected and will not run
     */
    boolean dispatch(String name, Priority priority, Runnable invocation);
}
