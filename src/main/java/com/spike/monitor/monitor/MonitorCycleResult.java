package com.spike.monitor.monitor;

import com.spike.monitor.alert.Alert;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Optional;

/**
 * Outcome of one evaluation cycle.
 */
@Value
@Builder
public class MonitorCycleResult {

    /** Latest data timestamp evaluated; null when the source was empty. */
    Instant dataTime;
    int rowsEvaluated;
    /** Detections on the latest row, across all detectors. */
    int detections;
    Alert alert;
    /** True when the alert reached the critical priority threshold and was handed to the dispatcher. */
    boolean submitted;
    boolean dispatched;

    public Optional<Alert> alertOpt() {
        return Optional.ofNullable(alert);
    }

    static MonitorCycleResult empty() {
        return MonitorCycleResult.builder().build();
    }
}
