package com.spike.monitor.detect;

/**
 * Detection strategy that produced a {@link SpikeEvent}.
 */
public enum DetectorKind {
    /** |z| of the rolling Z-score above a threshold. */
    ZSCORE,
    /** Percent deviation from the rolling mean above a threshold. */
    MOVING_AVERAGE,
    /** Percent change against the value K rows earlier above a threshold. */
    RATE_OF_CHANGE,
    /** Weighted fusion of squashed Z-scores across several channels. */
    MULTI_INDICATOR,
    /** Two channels spiking on the same row. */
    CORRELATED
}
