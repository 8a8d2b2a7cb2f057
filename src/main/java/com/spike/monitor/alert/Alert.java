package com.spike.monitor.alert;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Scored, leveled output of one evaluation. The level is always derived from the priority score.
 */
@Value
public class Alert {

    String alertId;
    /** Data timestamp of the triggering row. */
    Instant timestamp;
    /** Family contributions first, then co-occurrence bonuses. */
    List<String> reasons;
    int priorityScore;
    AlertLevel level;
    /** Raw channel values at the triggering row. */
    Map<String, Double> snapshot;

    @Builder
    private Alert(String alertId, Instant timestamp, List<String> reasons, int priorityScore, Map<String, Double> snapshot) {
        this.alertId = alertId != null ? alertId : UUID.randomUUID().toString();
        this.timestamp = timestamp;
        this.reasons = reasons != null ? List.copyOf(reasons) : List.of();
        this.priorityScore = priorityScore;
        this.level = AlertLevel.forScore(priorityScore);
        this.snapshot = snapshot != null ? Collections.unmodifiableMap(new LinkedHashMap<>(snapshot)) : Map.of();
    }

    public String reasonText() {
        return String.join("; ", reasons);
    }
}
