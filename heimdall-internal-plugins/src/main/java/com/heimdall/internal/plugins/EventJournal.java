package com.heimdall.internal.plugins;

import com.heimdall.events.EventEnvelope;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Bounded in-memory ring of recent events; the oldest entry is evicted when full.
 */
public final class EventJournal {

    private final int capacity;
    private final Deque<EventEnvelope> entries;
    private long recorded;

    public EventJournal(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1");
        }
        this.capacity = capacity;
        this.entries = new ArrayDeque<>(capacity);
    }

    public synchronized void append(EventEnvelope envelope) {
        if (entries.size() == capacity) {
            entries.removeFirst();
        }
        entries.addLast(envelope);
        recorded++;
    }

    /** Oldest first. */
    public synchronized List<EventEnvelope> recent() {
        return new ArrayList<>(entries);
    }

    public synchronized List<EventEnvelope> recent(String topicPrefix) {
        return entries.stream().filter(e -> e.topic().startsWith(topicPrefix)).toList();
    }

    public synchronized int size() {
        return entries.size();
    }

    /** Events appended since creation, including evicted ones. */
    public synchronized long totalRecorded() {
        return recorded;
    }

    public int capacity() {
        return capacity;
    }
}
