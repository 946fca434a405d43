package com.atlas.journal.repository;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

import com.atlas.journal.dto.LocationFix;
import com.atlas.journal.dto.PhotoCluster;

import lombok.extern.slf4j.Slf4j;

/**
 * Journal sink that keeps the most recent fixes and clusters in memory, in delivery order.
 *
 * <p>Meant for development and tests, where no real journal store is configured. Each list is
 * capped at {@code retainedEntries}; the oldest entries are evicted first.
 */
@Slf4j
public class InMemoryJournalSink implements JournalSink {

    public static final int DEFAULT_RETAINED_ENTRIES = 10_000;

    private final int retainedEntries;
    private final Deque<LocationFix> fixes = new ArrayDeque<>();
    private final Deque<PhotoCluster> clusters = new ArrayDeque<>();

    public InMemoryJournalSink() {
        this(DEFAULT_RETAINED_ENTRIES);
    }

    public InMemoryJournalSink(int retainedEntries) {
        if (retainedEntries < 1) {
            throw new IllegalArgumentException("retainedEntries must be at least 1, got " + retainedEntries);
        }
        this.retainedEntries = retainedEntries;
    }

    @Override
    public void append(LocationFix fix) {
        synchronized (fixes) {
            retain(fixes, fix);
        }
        log.debug("Stored fix {} for trip {}", fix.getId(), fix.getTripId());
    }

    @Override
    public void appendCluster(PhotoCluster cluster) {
        synchronized (clusters) {
            retain(clusters, cluster);
        }
        log.debug("Stored cluster {} for trip {}", cluster.getId(), cluster.getTripId());
    }

    private <T> void retain(Deque<T> entries, T entry) {
        if (entries.size() == retainedEntries) {
            entries.removeFirst();
        }
        entries.addLast(entry);
    }

    public List<LocationFix> getFixes() {
        synchronized (fixes) {
            return List.copyOf(fixes);
        }
    }

    public List<PhotoCluster> getClusters() {
        synchronized (clusters) {
            return List.copyOf(clusters);
        }
    }

    public int getRetainedEntries() {
        return retainedEntries;
    }
}
