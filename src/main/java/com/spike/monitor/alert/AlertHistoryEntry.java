package com.spike.monitor.alert;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * A dispatched alert with its wall-clock dispatch time. Only {@code resolved} changes after append.
 */
@Value
@Builder(toBuilder = true)
public class AlertHistoryEntry {

    Alert alert;
    /** Wall-clock dispatch time, distinct from the data timestamp of the alert. */
    Instant dispatchedAt;
    boolean resolved;
    Instant resolvedAt;

    public String getAlertId() {
        return alert.getAlertId();
    }

    public AlertLevel getLevel() {
        return alert.getLevel();
    }

    public AlertHistoryEntry resolvedAt(Instant at) {
        return toBuilder().resolved(true).resolvedAt(at).build();
    }
}
