package com.spike.monitor.scoring;

import com.spike.monitor.alert.Alert;
import com.spike.monitor.config.MonitorProperties;
import com.spike.monitor.detect.SpikeDetectionService;
import com.spike.monitor.detect.SpikeEvent;
import com.spike.monitor.frame.TimeSeriesFrame;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Batch scoring: labels every row of a frame and keeps alerts at or above a minimum priority.
 * Nothing is dispatched; cooldowns do not apply.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AlertReportService {

    private final SpikeDetectionService detectionService;
    private final SeverityScorer scorer;
    private final MonitorProperties properties;

    public List<Alert> report(TimeSeriesFrame frame) {
        return report(frame, properties.getMinPriorityScore());
    }

    /** Alerts sorted by priority score descending, then by timestamp descending. */
    public List<Alert> report(TimeSeriesFrame frame, double minPriorityScore) {
        if (frame.isEmpty()) {
            return List.of();
        }
        Map<Integer, List<SpikeEvent>> byRow = new TreeMap<>();
        for (SpikeEvent event : detectionService.detectFamilySpikes(frame, properties.getRollingWindow())) {
            byRow.computeIfAbsent(event.getRow(), r -> new ArrayList<>()).add(event);
        }
        List<Alert> alerts = new ArrayList<>();
        byRow.forEach((row, events) -> scorer.score(events, frame.timestampAt(row), frame.snapshot(row))
                .filter(a -> a.getPriorityScore() >= minPriorityScore)
                .ifPresent(alerts::add));
        alerts.sort(Comparator.comparingInt(Alert::getPriorityScore).reversed()
                .thenComparing(Alert::getTimestamp, Comparator.reverseOrder()));
        log.info("Batch report over {} rows: {} alert(s) with priority >= {}", frame.size(), alerts.size(), minPriorityScore);
        return alerts;
    }
}
