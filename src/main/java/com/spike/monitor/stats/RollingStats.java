package com.spike.monitor.stats;

import com.spike.monitor.frame.TimeSeriesFrame;

import java.util.Arrays;

/**
 * Rolling statistics with a minimum-periods-1 policy. Missing observations ({@code NaN})
 * are skipped, never counted as zero.
 */
public final class RollingStats {

    /** Added to every standard deviation used as a divisor. */
    public static final double EPSILON = 1e-10;

    public static final String ZSCORE_SUFFIX = "_zscore";

    private RollingStats() {
    }

    public static String zScoreChannel(String channel) {
        return channel + ZSCORE_SUFFIX;
    }

    public static RollingWindowStat compute(double[] values, int window) {
        if (window < 1) {
            throw new IllegalArgumentException("window must be >= 1, got " + window);
        }
        double[] means = new double[values.length];
        double[] stds = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            int from = Math.max(0, i - window + 1);
            int n = 0;
            double sum = 0.0;
            double min = Double.POSITIVE_INFINITY;
            double max = Double.NEGATIVE_INFINITY;
            for (int j = from; j <= i; j++) {
                double v = values[j];
                if (Double.isNaN(v)) continue;
                n++;
                sum += v;
                min = Math.min(min, v);
                max = Math.max(max, v);
            }
            if (n == 0) {
                means[i] = Double.NaN;
                stds[i] = 0.0;
                continue;
            }
            // a flat window has exactly zero spread; avoid rounding noise from the sum
            if (min == max) {
                means[i] = min;
                stds[i] = 0.0;
                continue;
            }
            double mean = sum / n;
            means[i] = mean;
            if (n < 2) {
                stds[i] = 0.0;
                continue;
            }
            double sq = 0.0;
            for (int j = from; j <= i; j++) {
                double v = values[j];
                if (Double.isNaN(v)) continue;
                sq += (v - mean) * (v - mean);
            }
            stds[i] = Math.sqrt(sq / (n - 1));
        }
        return new RollingWindowStat(window, means, stds);
    }

    /** Z-score per row; {@code NaN} where the value or the rolling mean is missing. */
    public static double[] zScores(double[] values, int window) {
        RollingWindowStat stat = compute(values, window);
        double[] z = new double[values.length];
        Arrays.fill(z, Double.NaN);
        for (int i = 0; i < values.length; i++) {
            final int row = i;
            stat.zScoreAt(i, values[i]).ifPresent(v -> z[row] = v);
        }
        return z;
    }

    /**
     * Returns {@code frame} with a {@code <channel>_zscore} channel added. Frames already carrying it,
     * or lacking {@code channel}, are returned unchanged.
     */
    public static TimeSeriesFrame withZScore(TimeSeriesFrame frame, String channel, int window) {
        String target = zScoreChannel(channel);
        if (frame.hasChannel(target)) {
            return frame;
        }
        return frame.channel(channel)
                .map(values -> frame.withChannel(target, zScores(values, window)))
                .orElse(frame);
    }
}
