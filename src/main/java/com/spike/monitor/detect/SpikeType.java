package com.spike.monitor.detect;

import java.util.Locale;

/**
 * Directional label of a detection.
 */
public enum SpikeType {
    POSITIVE_SPIKE,
    NEGATIVE_SPIKE,
    SURGE,
    DROP,
    RAPID_INCREASE,
    RAPID_DECREASE,
    MULTI_INDICATOR,
    CORRELATED_SPIKE,
    /** Both channels of a pair above the threshold in the positive direction. */
    COMBINED_SURGE;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
