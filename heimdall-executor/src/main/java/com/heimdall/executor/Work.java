package com.heimdall.executor;

/**
 * A unit of asynchronous work. Long-running work should poll {@link TaskContext#isCancelled()} at safe points.
 */
@FunctionalInterface
public interface Work<T> {

    T run(TaskContext context) throws Exception;
}
