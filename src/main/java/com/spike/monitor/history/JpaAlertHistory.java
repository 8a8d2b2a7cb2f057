package com.spike.monitor.history;

import com.spike.monitor.alert.Alert;
import com.spike.monitor.alert.AlertHistory;
import com.spike.monitor.alert.AlertHistoryEntry;
import com.spike.monitor.alert.AlertLevel;
import com.spike.monitor.alert.AlertStats;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Alert history in PostgreSQL. Each append commits in its own transaction, so a crash loses at
 * most the alert in flight.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "spike.monitor.history.store", havingValue = "jpa", matchIfMissing = true)
public class JpaAlertHistory implements AlertHistory {

    private final AlertHistoryRepository repository;

    @Override
    @Transactional
    public void append(AlertHistoryEntry entry) {
        Alert alert = entry.getAlert();
        AlertHistoryEntity entity = AlertHistoryEntity.builder()
                .alertId(alert.getAlertId())
                .dataTimestamp(alert.getTimestamp())
                .dispatchedAt(entry.getDispatchedAt())
                .level(alert.getLevel())
                .priorityScore(alert.getPriorityScore())
                .reasons(new ArrayList<>(alert.getReasons()))
                .snapshot(new LinkedHashMap<>(alert.getSnapshot()))
                .resolved(entry.isResolved())
                .resolvedAt(entry.getResolvedAt())
                .build();
        repository.save(entity);
        log.debug("Persisted alert history entry: alertId={}, level={}, dispatchedAt={}",
                entity.getAlertId(), entity.getLevel(), entity.getDispatchedAt());
    }

    @Override
    @Transactional(readOnly = true)
    public List<AlertHistoryEntry> entries() {
        return repository.findAllByOrderByDispatchedAtAscAlertIdAsc().stream()
                .map(JpaAlertHistory::toEntry)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<AlertHistoryEntry> recent(int limit) {
        if (limit <= 0) {
            return List.of();
        }
        return repository.findAllByOrderByDispatchedAtDescAlertIdDesc(PageRequest.of(0, limit)).stream()
                .map(JpaAlertHistory::toEntry)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<AlertHistoryEntry> unresolved() {
        return repository.findByResolvedFalseOrderByDispatchedAtDescAlertIdDesc().stream()
                .map(JpaAlertHistory::toEntry)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<AlertHistoryEntry> dispatchedSince(Instant since, AlertLevel level) {
        List<AlertHistoryEntity> found = level == null
                ? repository.findByDispatchedAtGreaterThanEqualOrderByDispatchedAtDescAlertIdDesc(since)
                : repository.findByLevelAndDispatchedAtGreaterThanEqualOrderByDispatchedAtDescAlertIdDesc(level, since);
        return found.stream().map(JpaAlertHistory::toEntry).toList();
    }

    @Override
    @Transactional(readOnly = true)
    public AlertStats stats() {
        Map<AlertLevel, Long> byLevel = new EnumMap<>(AlertLevel.class);
        for (AlertLevel level : AlertLevel.values()) {
            long count = repository.countByLevel(level);
            if (count > 0) byLevel.put(level, count);
        }
        Map<String, List<String>> reasonsByAlert = new LinkedHashMap<>();
        for (Object[] row : repository.findAlertReasons()) {
            reasonsByAlert.computeIfAbsent((String) row[0], id -> new ArrayList<>()).add((String) row[1]);
        }
        Map<String, Long> byType = new TreeMap<>();
        reasonsByAlert.values().forEach(reasons -> AlertStats.countTypes(reasons, byType));
        return AlertStats.builder()
                .total(repository.count())
                .unresolved(repository.countByResolvedFalse())
                .byLevel(byLevel)
                .byType(byType)
                .build();
    }

    @Override
    @Transactional
    public Optional<AlertHistoryEntry> markResolved(String alertId, Instant at) {
        return repository.findById(alertId).map(entity -> {
            if (!entity.isResolved()) {
                entity.setResolved(true);
                entity.setResolvedAt(at);
                repository.save(entity);
            }
            return toEntry(entity);
        });
    }

    @Override
    @Transactional
    public int pruneDispatchedBefore(Instant cutoff) {
        List<AlertHistoryEntity> stale = repository.findDispatchedBefore(cutoff);
        repository.deleteAll(stale);
        return stale.size();
    }

    @Override
    @Transactional(readOnly = true)
    public int size() {
        return (int) repository.count();
    }

    static AlertHistoryEntry toEntry(AlertHistoryEntity entity) {
        Alert alert = Alert.builder()
                .alertId(entity.getAlertId())
                .timestamp(entity.getDataTimestamp())
                .reasons(entity.getReasons())
                .priorityScore(entity.getPriorityScore())
                .snapshot(entity.getSnapshot())
                .build();
        return AlertHistoryEntry.builder()
                .alert(alert)
                .dispatchedAt(entity.getDispatchedAt())
                .resolved(entity.isResolved())
                .resolvedAt(entity.getResolvedAt())
                .build();
    }
}
