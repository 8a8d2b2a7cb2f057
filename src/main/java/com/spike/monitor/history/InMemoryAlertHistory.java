package com.spike.monitor.history;

import com.spike.monitor.alert.AlertHistory;
import com.spike.monitor.alert.AlertHistoryEntry;
import com.spike.monitor.alert.AlertLevel;
import com.spike.monitor.alert.AlertStats;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Predicate;

/**
 * Process-local history for single-node runs and tests. Lost on restart.
 */
@Component
@ConditionalOnProperty(name = "spike.monitor.history.store", havingValue = "memory")
public class InMemoryAlertHistory implements AlertHistory {

    private final CopyOnWriteArrayList<AlertHistoryEntry> entries = new CopyOnWriteArrayList<>();

    @Override
    public void append(AlertHistoryEntry entry) {
        entries.add(entry);
    }

    @Override
    public List<AlertHistoryEntry> entries() {
        return List.copyOf(entries);
    }

    @Override
    public List<AlertHistoryEntry> recent(int limit) {
        return newestFirst(e -> true, limit);
    }

    @Override
    public List<AlertHistoryEntry> unresolved() {
        return newestFirst(e -> !e.isResolved(), Integer.MAX_VALUE);
    }

    @Override
    public List<AlertHistoryEntry> dispatchedSince(Instant since, AlertLevel level) {
        return newestFirst(e -> !e.getDispatchedAt().isBefore(since) && (level == null || e.getLevel() == level),
                Integer.MAX_VALUE);
    }

    @Override
    public AlertStats stats() {
        return AlertStats.of(List.copyOf(entries));
    }

    @Override
    public synchronized Optional<AlertHistoryEntry> markResolved(String alertId, Instant at) {
        for (int i = 0; i < entries.size(); i++) {
            AlertHistoryEntry e = entries.get(i);
            if (e.getAlertId().equals(alertId)) {
                AlertHistoryEntry resolved = e.isResolved() ? e : e.resolvedAt(at);
                entries.set(i, resolved);
                return Optional.of(resolved);
            }
        }
        return Optional.empty();
    }

    @Override
    public synchronized int pruneDispatchedBefore(Instant cutoff) {
        List<AlertHistoryEntry> stale = new ArrayList<>();
        for (Iterator<AlertHistoryEntry> it = entries.iterator(); it.hasNext(); ) {
            AlertHistoryEntry e = it.next();
            if (e.getDispatchedAt().isBefore(cutoff)) stale.add(e);
        }
        entries.removeAll(stale);
        return stale.size();
    }

    @Override
    public int size() {
        return entries.size();
    }

    private List<AlertHistoryEntry> newestFirst(Predicate<AlertHistoryEntry> filter, int limit) {
        List<AlertHistoryEntry> snapshot = List.copyOf(entries);
        List<AlertHistoryEntry> out = new ArrayList<>();
        for (int i = snapshot.size() - 1; i >= 0 && out.size() < limit; i--) {
            if (filter.test(snapshot.get(i))) out.add(snapshot.get(i));
        }
        return out;
    }
}
