/**
 * Async executor: bounded priority queue, fixed worker pool, cooperative cancellation and {@code task.*}
 * lifecycle events.
 */
package com.heimdall.executor;
