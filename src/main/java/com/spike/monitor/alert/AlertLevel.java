package com.spike.monitor.alert;

/**
 * Discrete severity, a monotonic function of the priority score.
 */
public enum AlertLevel {
    LOW, MEDIUM, HIGH, CRITICAL;

    /** {@code >= 10} CRITICAL, {@code >= 5} HIGH, {@code >= 2} MEDIUM, otherwise LOW. */
    public static AlertLevel forScore(double score) {
        if (score >= 10) return CRITICAL;
        if (score >= 5) return HIGH;
        if (score >= 2) return MEDIUM;
        return LOW;
    }
}
