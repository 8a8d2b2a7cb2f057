package com.spike.monitor.frame;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Ordered, timestamp-keyed table of named numeric channels.
 * <p>
 * Timestamps are unique and strictly ascending. A missing observation is stored as {@link Double#NaN}
 * and reported as absent by {@link #valueAt(String, int)}; it is never read back as zero.
 * Frames are immutable: derived channels are added through {@link #withChannel(String, double[])},
 * which returns a new frame.
 */
public final class TimeSeriesFrame {

    private static final TimeSeriesFrame EMPTY = new TimeSeriesFrame(List.of(), new LinkedHashMap<>());

    private final List<Instant> timestamps;
    private final Map<String, double[]> channels;

    private TimeSeriesFrame(List<Instant> timestamps, LinkedHashMap<String, double[]> channels) {
        this.timestamps = timestamps;
        this.channels = channels;
    }

    public static TimeSeriesFrame empty() {
        return EMPTY;
    }

    /**
     * Builds a frame from parallel arrays. Arrays are copied.
     *
     * @throws IllegalArgumentException when timestamps are not strictly ascending or a channel length
     *                                  differs from the number of timestamps
     */
    public static TimeSeriesFrame of(List<Instant> timestamps, Map<String, double[]> channels) {
        List<Instant> ts = List.copyOf(timestamps);
        for (int i = 1; i < ts.size(); i++) {
            if (!ts.get(i).isAfter(ts.get(i - 1))) {
                throw new IllegalArgumentException("Timestamps must be unique and ascending; row " + i
                        + " (" + ts.get(i) + ") is not after " + ts.get(i - 1));
            }
        }
        LinkedHashMap<String, double[]> copy = new LinkedHashMap<>();
        for (Map.Entry<String, double[]> e : channels.entrySet()) {
            if (e.getValue().length != ts.size()) {
                throw new IllegalArgumentException("Channel " + e.getKey() + " has " + e.getValue().length
                        + " values for " + ts.size() + " rows");
            }
            copy.put(e.getKey(), e.getValue().clone());
        }
        return new TimeSeriesFrame(ts, copy);
    }

    public static Builder builder() {
        return new Builder();
    }

    public int size() {
        return timestamps.size();
    }

    public boolean isEmpty() {
        return timestamps.isEmpty();
    }

    public List<Instant> timestamps() {
        return timestamps;
    }

    public Instant timestampAt(int row) {
        return timestamps.get(row);
    }

    public Optional<Instant> latestTimestamp() {
        return timestamps.isEmpty() ? Optional.empty() : Optional.of(timestamps.get(timestamps.size() - 1));
    }

    public Set<String> channelNames() {
        return Collections.unmodifiableSet(channels.keySet());
    }

    public boolean hasChannel(String name) {
        return channels.containsKey(name);
    }

    /** Copy of the channel values with {@code NaN} for missing observations, or empty when absent. */
    public Optional<double[]> channel(String name) {
        double[] values = channels.get(name);
        return values == null ? Optional.empty() : Optional.of(values.clone());
    }

    public boolean isObserved(String name, int row) {
        double[] values = channels.get(name);
        return values != null && !Double.isNaN(values[row]);
    }

    public OptionalDouble valueAt(String name, int row) {
        return isObserved(name, row) ? OptionalDouble.of(channels.get(name)[row]) : OptionalDouble.empty();
    }

    /** Returns a new frame carrying {@code values} as channel {@code name}, replacing any existing one. */
    public TimeSeriesFrame withChannel(String name, double[] values) {
        if (values.length != size()) {
            throw new IllegalArgumentException("Channel " + name + " has " + values.length
                    + " values for " + size() + " rows");
        }
        LinkedHashMap<String, double[]> copy = new LinkedHashMap<>(channels);
        copy.put(name, values.clone());
        return new TimeSeriesFrame(timestamps, copy);
    }

    /** Rows whose timestamp is at or after {@code from}. */
    public TimeSeriesFrame since(Instant from) {
        int start = 0;
        while (start < size() && timestamps.get(start).isBefore(from)) {
            start++;
        }
        return slice(start, size());
    }

    /** The last {@code rows} rows (or all of them when fewer exist). */
    public TimeSeriesFrame tail(int rows) {
        return slice(Math.max(0, size() - rows), size());
    }

    private TimeSeriesFrame slice(int from, int to) {
        if (from == 0 && to == size()) {
            return this;
        }
        LinkedHashMap<String, double[]> copy = new LinkedHashMap<>();
        channels.forEach((name, values) -> copy.put(name, Arrays.copyOfRange(values, from, to)));
        return new TimeSeriesFrame(List.copyOf(timestamps.subList(from, to)), copy);
    }

    /** Observed raw values at {@code row} for the given channels; missing or absent channels are left out. */
    public Map<String, Double> snapshot(int row, Collection<String> names) {
        Map<String, Double> out = new LinkedHashMap<>();
        for (String name : names) {
            valueAt(name, row).ifPresent(v -> out.put(name, v));
        }
        return out;
    }

    public Map<String, Double> snapshot(int row) {
        return snapshot(row, channels.keySet());
    }

    @Override
    public String toString() {
        return "TimeSeriesFrame{rows=" + size() + ", channels=" + channels.keySet() + "}";
    }

    /**
     * Row-wise builder. Channels are declared implicitly by the first row that mentions them;
     * a channel not mentioned in a row is missing there.
     */
    public static final class Builder {

        private final List<Instant> timestamps = new ArrayList<>();
        private final List<Map<String, Double>> rows = new ArrayList<>();
        private final Set<String> names = new LinkedHashSet<>();

        private Builder() {
        }

        public Builder channel(String name) {
            names.add(name);
            return this;
        }

        public Builder row(Instant timestamp, Map<String, ? extends Number> values) {
            Map<String, Double> row = new LinkedHashMap<>();
            values.forEach((k, v) -> {
                names.add(k);
                row.put(k, v == null ? Double.NaN : v.doubleValue());
            });
            timestamps.add(timestamp);
            rows.add(row);
            return this;
        }

        public TimeSeriesFrame build() {
            Map<String, double[]> columns = new LinkedHashMap<>();
            for (String name : names) {
                double[] values = new double[rows.size()];
                for (int i = 0; i < rows.size(); i++) {
                    values[i] = rows.get(i).getOrDefault(name, Double.NaN);
                }
                columns.put(name, values);
            }
            return TimeSeriesFrame.of(timestamps, columns);
        }
    }
}
