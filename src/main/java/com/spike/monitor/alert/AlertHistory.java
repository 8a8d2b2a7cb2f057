package com.spike.monitor.alert;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Append-only record of dispatched alerts. Written only by {@link AlertDispatcher}; readers may
 * query it concurrently.
 */
public interface AlertHistory {

    /** Persists one entry; must be durable when this returns. */
    void append(AlertHistoryEntry entry);

    /** All entries, oldest dispatch first. */
    List<AlertHistoryEntry> entries();

    /** Up to {@code limit} entries, newest dispatch first. */
    List<AlertHistoryEntry> recent(int limit);

    /** Entries not yet resolved, newest dispatch first. */
    List<AlertHistoryEntry> unresolved();

    /**
     * Entries dispatched at or after {@code since}, newest dispatch first.
     *
     * @param level only entries of this level; null for all levels
     */
    List<AlertHistoryEntry> dispatchedSince(Instant since, AlertLevel level);

    AlertStats stats();

    Optional<AlertHistoryEntry> markResolved(String alertId, Instant at);

    /** Deletes entries dispatched before {@code cutoff}; returns how many were removed. */
    int pruneDispatchedBefore(Instant cutoff);

    int size();
}
