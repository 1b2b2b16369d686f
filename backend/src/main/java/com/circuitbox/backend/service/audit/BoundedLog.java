package com.circuitbox.backend.service.audit;

import java.util.ArrayDeque;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * Newest-first ring buffer. Appending past capacity evicts the oldest element.
 * Not thread-safe; owners synchronize access.
 */
class BoundedLog<T> {

    private final int capacity;
    private final ArrayDeque<T> entries;

    BoundedLog(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.entries = new ArrayDeque<>(Math.min(capacity, 1024));
    }

    /**
     * @return the evicted element, or null when nothing was evicted
     */
    T append(T entry) {
        entries.addFirst(entry);
        if (entries.size() > capacity) {
            return entries.removeLast();
        }
        return null;
    }

    List<T> newestFirst() {
        return List.copyOf(entries);
    }

    Optional<T> find(Predicate<T> predicate) {
        return entries.stream().filter(predicate).findFirst();
    }

    Stream<T> stream() {
        return entries.stream();
    }

    int size() {
        return entries.size();
    }

    int capacity() {
        return capacity;
    }

    void clear() {
        entries.clear();
    }
}
