package com.spike.monitor.frame;

import com.spike.monitor.config.MonitorProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Rolling in-memory frame fed by incoming observations. Observations for the newest timestamp are
 * merged into that row; older timestamps are rejected. At most {@code buffer.max-rows} rows are kept.
 */
@Slf4j
@Component
public class ObservationBuffer implements TimeSeriesSource {

    private final int maxRows;
    private final Deque<Row> rows = new ArrayDeque<>();

    public ObservationBuffer(MonitorProperties properties) {
        this.maxRows = properties.getBuffer().getMaxRows();
    }

    /**
     * @return false when the observation is older than the newest buffered row
     */
    public synchronized boolean append(ChannelObservation observation) {
        Instant ts = observation.getTimestamp();
        Row last = rows.peekLast();
        if (last != null && ts.isBefore(last.timestamp())) {
            log.warn("Dropping out-of-order observation at {} (newest row {}), source={}", ts, last.timestamp(), observation.getSource());
            return false;
        }
        if (last != null && ts.equals(last.timestamp())) {
            last.values().putAll(observation.getValues());
        } else {
            rows.addLast(new Row(ts, new LinkedHashMap<>(observation.getValues())));
            while (rows.size() > maxRows) rows.removeFirst();
        }
        return true;
    }

    @Override
    public synchronized TimeSeriesFrame currentFrame() {
        TimeSeriesFrame.Builder builder = TimeSeriesFrame.builder();
        for (Row row : rows) {
            builder.row(row.timestamp(), row.values());
        }
        return builder.build();
    }

    public synchronized int size() {
        return rows.size();
    }

    private record Row(Instant timestamp, Map<String, Double> values) {}
}
