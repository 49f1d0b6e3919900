package com.heimdall.executor;

import com.heimdall.events.Priority;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.PriorityQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded priority queue: higher priority first, FIFO within one priority. {@link #close()} wakes waiting
 * takers once the queue is empty.
 */
final class TaskQueue {

    static final class Entry {
        final Priority priority;
        final long sequence;
        final TaskHandle<?> handle;
        final Runnable body;

        Entry(Priority priority, long sequence, TaskHandle<?> handle, Runnable body) {
            this.priority = priority;
            this.sequence = sequence;
            this.handle = handle;
            this.body = body;
        }
    }

    private static final Comparator<Entry> ORDER = Comparator.<Entry, Priority>comparing(e -> e.priority)
            .reversed()
            .thenComparingLong(e -> e.sequence);

    private final int capacity;
    private final PriorityQueue<Entry> entries = new PriorityQueue<>(ORDER);
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final Condition notFull = lock.newCondition();
    private boolean closed;

    TaskQueue(int capacity) {
        this.capacity = capacity;
    }

    /**
     * Adds an entry, waiting for space when {@code block} is true.
     *
     * @return false when full and not blocking, or when closed
     */
    boolean put(Entry entry, boolean block) throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (!closed && entries.size() >= capacity) {
                if (!block) return false;
                notFull.await();
            }
            if (closed) return false;
            entries.add(entry);
            notEmpty.signal();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Next entry by priority; waits while empty. Returns null once closed and empty, or after {@code timeoutMs}.
     */
    Entry take(long timeoutMs) throws InterruptedException {
        long nanos = TimeUnit.MILLISECONDS.toNanos(timeoutMs);
        lock.lockInterruptibly();
        try {
            while (entries.isEmpty()) {
                if (closed || nanos <= 0) return null;
                nanos = notEmpty.awaitNanos(nanos);
            }
            Entry entry = entries.poll();
            notFull.signal();
            return entry;
        } finally {
            lock.unlock();
        }
    }

    boolean remove(TaskHandle<?> handle) {
        lock.lock();
        try {
            boolean removed = entries.removeIf(e -> e.handle == handle);
            if (removed) notFull.signal();
            return removed;
        } finally {
            lock.unlock();
        }
    }

    /** Removes and returns all queued entries. */
    List<Entry> drain() {
        lock.lock();
        try {
            List<Entry> all = new ArrayList<>(entries);
            entries.clear();
            notFull.signalAll();
            return all;
        } finally {
            lock.unlock();
        }
    }

    void close() {
        lock.lock();
        try {
            closed = true;
            notEmpty.signalAll();
            notFull.signalAll();
        } finally {
            lock.unlock();
        }
    }

    boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }
}
