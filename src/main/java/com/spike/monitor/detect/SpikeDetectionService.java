package com.spike.monitor.detect;

import com.spike.monitor.config.MonitorProperties;
import com.spike.monitor.frame.TimeSeriesFrame;
import com.spike.monitor.stats.RollingStats;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs the configured detector set over a frame. Keys of {@link #detectAll(TimeSeriesFrame)} are
 * {@code <channel>_zscore}, {@code <channel>_ma}, {@code <channel>_roc} per monitored channel, then
 * {@code multi_indicator}, {@code correlation} and {@code combined_surge}. Detectors with no events
 * are left out.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SpikeDetectionService {

    public static final String MULTI_INDICATOR_KEY = "multi_indicator";
    public static final String CORRELATION_KEY = "correlation";
    public static final String COMBINED_SURGE_KEY = "combined_surge";

    private final MonitorProperties properties;

    public Map<String, List<SpikeEvent>> detectAll(TimeSeriesFrame frame) {
        return detectAll(frame, properties.getRollingWindow());
    }

    /** Same as {@link #detectAll(TimeSeriesFrame)} with an explicit rolling window. */
    public Map<String, List<SpikeEvent>> detectAll(TimeSeriesFrame frame, int window) {
        Map<String, List<SpikeEvent>> results = new LinkedHashMap<>();
        if (frame.isEmpty()) {
            return results;
        }
        TimeSeriesFrame derived = withZScores(frame, properties.getMonitorColumns(), window);

        for (String channel : properties.getMonitorColumns()) {
            if (!derived.hasChannel(channel)) {
                log.debug("Monitored channel {} absent from frame; skipping", channel);
                continue;
            }
            putIfAny(results, channel + "_zscore",
                    SpikeDetectors.zScore(derived, channel, properties.getZscoreThreshold(), window));
            putIfAny(results, channel + "_ma",
                    SpikeDetectors.movingAverage(derived, channel, properties.getMaThresholdPct(), window));
            putIfAny(results, channel + "_roc",
                    SpikeDetectors.rateOfChange(derived, channel, properties.getRocWindow(), properties.getRocThresholdPct()));
        }

        putIfAny(results, MULTI_INDICATOR_KEY, SpikeDetectors.multiIndicator(derived, properties.getMonitorColumns(),
                properties.getChannelWeights(), properties.getMultiThreshold()));

        List<String> pair = properties.getCorrelationPair();
        if (pair != null && pair.size() == 2) {
            putIfAny(results, CORRELATION_KEY, SpikeDetectors.correlated(derived, pair.get(0), pair.get(1),
                    properties.getZscoreThreshold(), window));
        }
        List<String> surgePair = properties.getCombinedSurgePair();
        if (surgePair != null && surgePair.size() == 2) {
            putIfAny(results, COMBINED_SURGE_KEY, SpikeDetectors.combinedSurge(derived, surgePair.get(0), surgePair.get(1),
                    properties.getCombinedSurgeThreshold(), window));
        }
        log.debug("detectAll over {} rows: {}", frame.size(), summarize(results));
        return results;
    }

    /**
     * Z-score spikes of the monitored channels within the trailing {@code span} of data time,
     * newest first. Statistics are computed on the trailing rows only.
     */
    public List<SpikeEvent> recentZScoreSpikes(TimeSeriesFrame frame, Duration span) {
        if (frame.isEmpty()) {
            return List.of();
        }
        TimeSeriesFrame recent = frame.since(frame.latestTimestamp().orElseThrow().minus(span));
        List<SpikeEvent> events = new ArrayList<>();
        for (String channel : properties.getMonitorColumns()) {
            events.addAll(SpikeDetectors.zScore(recent, channel, properties.getZscoreThreshold(),
                    properties.getRollingWindow()));
        }
        events.sort((a, b) -> b.getTimestamp().compareTo(a.getTimestamp()));
        return events;
    }

    /**
     * Z-score events for every channel mapped to a signal family, at the family spike threshold.
     * Only positive spikes count towards severity; negative ones are still returned.
     */
    public List<SpikeEvent> detectFamilySpikes(TimeSeriesFrame frame, int window) {
        List<SpikeEvent> events = new ArrayList<>();
        for (String channel : properties.getChannelFamilies().keySet()) {
            events.addAll(SpikeDetectors.zScore(frame, channel, properties.getFamilySpikeThreshold(), window));
        }
        return events;
    }

    /** Adds {@code <channel>_zscore} for each present channel that lacks one. */
    public static TimeSeriesFrame withZScores(TimeSeriesFrame frame, Iterable<String> channels, int window) {
        TimeSeriesFrame out = frame;
        for (String channel : channels) {
            out = RollingStats.withZScore(out, channel, window);
        }
        return out;
    }

    private static void putIfAny(Map<String, List<SpikeEvent>> results, String key, List<SpikeEvent> events) {
        if (!events.isEmpty()) {
            results.put(key, events);
        }
    }

    private static Map<String, Integer> summarize(Map<String, List<SpikeEvent>> results) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        results.forEach((k, v) -> counts.put(k, v.size()));
        return counts;
    }
}
