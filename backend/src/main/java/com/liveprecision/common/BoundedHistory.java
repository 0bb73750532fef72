package com.liveprecision.common;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Thread-safe most-recent-N buffer. Adding beyond capacity evicts the oldest entry.
 */
public class BoundedHistory<T> {

    private final int capacity;
    private final Deque<T> entries;

    public BoundedHistory(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.capacity = capacity;
        this.entries = new ArrayDeque<>(Math.min(capacity, 1024));
    }

    public synchronized void add(T entry) {
        if (entries.size() == capacity) {
            entries.removeFirst();
        }
        entries.addLast(entry);
    }

    /**
     * Oldest first.
     */
    public synchronized List<T> snapshot() {
        return List.copyOf(entries);
    }

    /**
     * Up to {@code n} most recent entries, oldest first.
     */
    public synchronized List<T> latest(int n) {
        if (n <= 0) {
            return List.of();
        }
        List<T> all = new ArrayList<>(entries);
        return List.copyOf(all.subList(Math.max(0, all.size() - n), all.size()));
    }
}
