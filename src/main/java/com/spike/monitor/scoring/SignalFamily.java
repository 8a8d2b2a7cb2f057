package com.spike.monitor.scoring;

/**
 * Group of channels scored together. Large-transaction anomalies carry the most weight.
 */
public enum SignalFamily {

    COMMUNITY(2, "Community message surge"),
    LARGE_TRANSACTION(3, "Large-transaction surge"),
    SOCIAL_ENGAGEMENT(2, "Social engagement surge");

    private final int points;
    private final String reason;

    SignalFamily(int points, String reason) {
        this.points = points;
        this.reason = reason;
    }

    public int getPoints() {
        return points;
    }

    public String getReason() {
        return reason;
    }
}
