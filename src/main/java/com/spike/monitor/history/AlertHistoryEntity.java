package com.spike.monitor.history;

import com.spike.monitor.alert.AlertLevel;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Persistent alert history entry: data timestamp, dispatch time, level, score, ordered reasons
 * and the raw channel snapshot at trigger time.
 */
@Entity
@Table(name = "alert_history", indexes = {
    @Index(name = "idx_alert_history_dispatched_at", columnList = "dispatched_at"),
    @Index(name = "idx_alert_history_level", columnList = "alert_level")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlertHistoryEntity {

    @Id
    @Column(name = "alert_id", nullable = false)
    private String alertId;

    @Column(name = "data_timestamp", nullable = false)
    private Instant dataTimestamp;

    @Column(name = "dispatched_at", nullable = false)
    private Instant dispatchedAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "alert_level", nullable = false)
    private AlertLevel level;

    @Column(name = "priority_score", nullable = false)
    private int priorityScore;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "alert_history_reasons", joinColumns = @JoinColumn(name = "alert_id"))
    @OrderColumn(name = "reason_index")
    @Column(name = "reason_text", nullable = false, length = 500)
    @Builder.Default
    private List<String> reasons = new ArrayList<>();

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "alert_history_snapshot", joinColumns = @JoinColumn(name = "alert_id"))
    @MapKeyColumn(name = "channel_name")
    @Column(name = "channel_value")
    @Builder.Default
    private Map<String, Double> snapshot = new LinkedHashMap<>();

    @Column(name = "resolved", nullable = false)
    private boolean resolved;

    @Column(name = "resolved_at")
    private Instant resolvedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
    }

    @PreUpdate
    protected void onUpdate() {
        if (resolved && resolvedAt == null) {
            resolvedAt = Instant.now();
        }
    }
}
