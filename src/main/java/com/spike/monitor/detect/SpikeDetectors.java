package com.spike.monitor.detect;

import com.spike.monitor.frame.TimeSeriesFrame;
import com.spike.monitor.stats.RollingStats;
import com.spike.monitor.stats.RollingWindowStat;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Stateless spike detection strategies. Each returns one event per triggering row, in row order.
 * <p>
 * A channel absent from the frame, a row without enough history, or a missing observation yields
 * no event; none of these is an error. Z-scores are read from a {@code <channel>_zscore} channel
 * when the frame carries one and computed over {@code window} rows otherwise.
 */
public final class SpikeDetectors {

    private SpikeDetectors() {
    }

    /** Fires when {@code |z| > threshold}; magnitude is {@code |z|}. */
    public static List<SpikeEvent> zScore(TimeSeriesFrame frame, String channel, double threshold, int window) {
        Optional<double[]> zOpt = zScores(frame, channel, window);
        if (zOpt.isEmpty()) {
            return List.of();
        }
        double[] z = zOpt.get();
        List<SpikeEvent> events = new ArrayList<>();
        for (int i = 0; i < z.length; i++) {
            if (Double.isNaN(z[i]) || Math.abs(z[i]) <= threshold) continue;
            events.add(SpikeEvent.builder()
                    .channel(channel)
                    .detector(DetectorKind.ZSCORE)
                    .type(z[i] > 0 ? SpikeType.POSITIVE_SPIKE : SpikeType.NEGATIVE_SPIKE)
                    .magnitude(Math.abs(z[i]))
                    .timestamp(frame.timestampAt(i))
                    .row(i)
                    .value(rawValue(frame, channel, i))
                    .build());
        }
        return events;
    }

    /** Fires when the percent deviation from the rolling mean exceeds {@code thresholdPct} in magnitude. */
    public static List<SpikeEvent> movingAverage(TimeSeriesFrame frame, String channel, double thresholdPct, int window) {
        Optional<double[]> valuesOpt = frame.channel(channel);
        if (valuesOpt.isEmpty()) {
            return List.of();
        }
        double[] values = valuesOpt.get();
        RollingWindowStat stat = RollingStats.compute(values, window);
        List<SpikeEvent> events = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            if (Double.isNaN(values[i]) || stat.meanAt(i).isEmpty()) continue;
            double mean = stat.meanAt(i).getAsDouble();
            double deviation = (values[i] - mean) / (mean + RollingStats.EPSILON) * 100.0;
            if (!Double.isFinite(deviation) || Math.abs(deviation) <= thresholdPct) continue;
            events.add(SpikeEvent.builder()
                    .channel(channel)
                    .detector(DetectorKind.MOVING_AVERAGE)
                    .type(deviation > 0 ? SpikeType.SURGE : SpikeType.DROP)
                    .magnitude(Math.abs(deviation))
                    .timestamp(frame.timestampAt(i))
                    .row(i)
                    .value(values[i])
                    .build());
        }
        return events;
    }

    /**
     * Fires when the percent change against the value {@code lookback} rows earlier exceeds
     * {@code thresholdPct} in magnitude. Rows {@code 0..lookback-1} never fire, nor do rows whose
     * base value is zero or missing.
     */
    public static List<SpikeEvent> rateOfChange(TimeSeriesFrame frame, String channel, int lookback, double thresholdPct) {
        Optional<double[]> valuesOpt = frame.channel(channel);
        if (valuesOpt.isEmpty() || lookback < 1) {
            return List.of();
        }
        double[] values = valuesOpt.get();
        List<SpikeEvent> events = new ArrayList<>();
        for (int i = lookback; i < values.length; i++) {
            double base = values[i - lookback];
            double current = values[i];
            if (Double.isNaN(base) || Double.isNaN(current) || base == 0.0) continue;
            double change = (current - base) / base * 100.0;
            if (Math.abs(change) <= thresholdPct) continue;
            events.add(SpikeEvent.builder()
                    .channel(channel)
                    .detector(DetectorKind.RATE_OF_CHANGE)
                    .type(change > 0 ? SpikeType.RAPID_INCREASE : SpikeType.RAPID_DECREASE)
                    .magnitude(Math.abs(change))
                    .timestamp(frame.timestampAt(i))
                    .row(i)
                    .value(current)
                    .build());
        }
        return events;
    }

    /**
     * Weighted fusion of per-channel scores {@code |sigmoid(z) - 0.5| * 2}. Channels without a
     * {@code <channel>_zscore} channel, and rows with a missing z, contribute 0. An empty or null
     * {@code weights} map means uniform {@code 1/N}; channels missing from a non-empty map weigh 0.
     */
    public static List<SpikeEvent> multiIndicator(TimeSeriesFrame frame, List<String> channels,
                                                  Map<String, Double> weights, double threshold) {
        if (channels.isEmpty() || frame.isEmpty()) {
            return List.of();
        }
        double[] combined = new double[frame.size()];
        for (String channel : channels) {
            double weight = weights == null || weights.isEmpty()
                    ? 1.0 / channels.size()
                    : weights.getOrDefault(channel, 0.0);
            Optional<double[]> zOpt = frame.channel(RollingStats.zScoreChannel(channel));
            if (zOpt.isEmpty() || weight == 0.0) continue;
            double[] z = zOpt.get();
            for (int i = 0; i < z.length; i++) {
                if (Double.isNaN(z[i])) continue;
                combined[i] += weight * deviationFromNeutral(z[i]);
            }
        }
        List<SpikeEvent> events = new ArrayList<>();
        for (int i = 0; i < combined.length; i++) {
            if (combined[i] <= threshold) continue;
            events.add(SpikeEvent.builder()
                    .channels(channels)
                    .detector(DetectorKind.MULTI_INDICATOR)
                    .type(SpikeType.MULTI_INDICATOR)
                    .magnitude(combined[i])
                    .timestamp(frame.timestampAt(i))
                    .row(i)
                    .build());
        }
        return events;
    }

    /** Fires on rows where both channels have {@code |z| > threshold}; magnitude is the mean |z|. */
    public static List<SpikeEvent> correlated(TimeSeriesFrame frame, String first, String second,
                                              double threshold, int window) {
        return joint(frame, first, second, threshold, window, false);
    }

    /** Same-direction variant: both channels need {@code z > threshold}. */
    public static List<SpikeEvent> combinedSurge(TimeSeriesFrame frame, String first, String second,
                                                 double threshold, int window) {
        return joint(frame, first, second, threshold, window, true);
    }

    private static List<SpikeEvent> joint(TimeSeriesFrame frame, String first, String second,
                                          double threshold, int window, boolean positiveOnly) {
        Optional<double[]> z1Opt = zScores(frame, first, window);
        Optional<double[]> z2Opt = zScores(frame, second, window);
        if (z1Opt.isEmpty() || z2Opt.isEmpty()) {
            return List.of();
        }
        double[] z1 = z1Opt.get();
        double[] z2 = z2Opt.get();
        List<SpikeEvent> events = new ArrayList<>();
        for (int i = 0; i < z1.length; i++) {
            if (Double.isNaN(z1[i]) || Double.isNaN(z2[i])) continue;
            boolean hit = positiveOnly
                    ? z1[i] > threshold && z2[i] > threshold
                    : Math.abs(z1[i]) > threshold && Math.abs(z2[i]) > threshold;
            if (!hit) continue;
            events.add(SpikeEvent.builder()
                    .channel(first)
                    .channel(second)
                    .detector(DetectorKind.CORRELATED)
                    .type(positiveOnly ? SpikeType.COMBINED_SURGE : SpikeType.CORRELATED_SPIKE)
                    .magnitude((Math.abs(z1[i]) + Math.abs(z2[i])) / 2.0)
                    .timestamp(frame.timestampAt(i))
                    .row(i)
                    .build());
        }
        return events;
    }

    static double deviationFromNeutral(double z) {
        double squashed = 1.0 / (1.0 + Math.exp(-z));
        return Math.abs(squashed - 0.5) * 2.0;
    }

    private static Optional<double[]> zScores(TimeSeriesFrame frame, String channel, int window) {
        Optional<double[]> precomputed = frame.channel(RollingStats.zScoreChannel(channel));
        if (precomputed.isPresent()) {
            return precomputed;
        }
        return frame.channel(channel).map(values -> RollingStats.zScores(values, window));
    }

    private static Double rawValue(TimeSeriesFrame frame, String channel, int row) {
        return frame.isObserved(channel, row) ? frame.valueAt(channel, row).getAsDouble() : null;
    }
}
