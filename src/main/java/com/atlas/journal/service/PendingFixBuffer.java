package com.atlas.journal.service;

import java.util.ArrayDeque;
import java.util.Deque;

import com.atlas.journal.dto.LocationFix;

/**
 * Bounded FIFO of fixes waiting for delivery to the sink.
 *
 * <p>The ingest path is the only producer and the flush path the only consumer. The head is
 * peeked, delivered and only then removed, so a failed delivery leaves the buffer in arrival
 * order.
 */
public class PendingFixBuffer {

    private final Deque<LocationFix> fixes = new ArrayDeque<>();
    private final int capacity;

    public PendingFixBuffer(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Buffer capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
    }

    /**
     * @return false when the buffer is full and the fix was not added
     */
    public synchronized boolean offer(LocationFix fix) {
        if (fixes.size() >= capacity) {
            return false;
        }
        fixes.addLast(fix);
        return true;
    }

    public synchronized LocationFix peekOldest() {
        return fixes.peekFirst();
    }

    /**
     * Removes the head, but only if it is still {@code expected}.
     */
    public synchronized boolean removeOldest(LocationFix expected) {
        if (fixes.peekFirst() != expected) {
            return false;
        }
        fixes.removeFirst();
        return true;
    }

    public synchronized int size() {
        return fixes.size();
    }

    public synchronized boolean isFull() {
        return fixes.size() >= capacity;
    }

    public int capacity() {
        return capacity;
    }
}
