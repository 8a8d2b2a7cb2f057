package com.spike.monitor.stats;

import java.util.OptionalDouble;

/**
 * Rolling mean and sample standard deviation of one channel over a trailing window of rows.
 * A row with no observation in its window has no mean; fewer than two observations give std 0.
 */
public final class RollingWindowStat {

    private final int window;
    private final double[] means;
    private final double[] stds;

    RollingWindowStat(int window, double[] means, double[] stds) {
        this.window = window;
        this.means = means;
        this.stds = stds;
    }

    public int getWindow() {
        return window;
    }

    public int size() {
        return means.length;
    }

    public OptionalDouble meanAt(int row) {
        return Double.isNaN(means[row]) ? OptionalDouble.empty() : OptionalDouble.of(means[row]);
    }

    public double stdAt(int row) {
        return stds[row];
    }

    /** {@code (value - mean) / (std + epsilon)}, or empty when the value or the mean is missing. */
    public OptionalDouble zScoreAt(int row, double value) {
        if (Double.isNaN(value) || Double.isNaN(means[row])) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of((value - means[row]) / (stds[row] + RollingStats.EPSILON));
    }
}
