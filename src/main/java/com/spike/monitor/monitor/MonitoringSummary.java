package com.spike.monitor.monitor;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Totals of one continuous monitoring run.
 */
@Value
@Builder
public class MonitoringSummary {

    public enum StopReason { DURATION_ELAPSED, STOP_REQUESTED, INTERRUPTED }

    Instant startedAt;
    Instant finishedAt;
    int cycles;
    int failedCycles;
    int alertsDetected;
    int alertsDispatched;
    StopReason stopReason;
}
