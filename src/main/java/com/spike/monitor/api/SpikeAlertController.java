package com.spike.monitor.api;

import com.spike.monitor.alert.Alert;
import com.spike.monitor.alert.AlertDispatcher;
import com.spike.monitor.alert.AlertHistoryEntry;
import com.spike.monitor.alert.AlertLevel;
import com.spike.monitor.alert.AlertStats;
import com.spike.monitor.detect.SpikeDetectionService;
import com.spike.monitor.detect.SpikeEvent;
import com.spike.monitor.frame.ChannelObservation;
import com.spike.monitor.frame.ObservationBuffer;
import com.spike.monitor.monitor.MonitorCycleResult;
import com.spike.monitor.monitor.MonitorLoop;
import com.spike.monitor.scoring.AlertReportService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * REST API over the alert history, ad-hoc detection, the batch report and single-shot monitoring.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/spikes")
@RequiredArgsConstructor
@Tag(name = "Spikes", description = "Spike detections, scored alerts and alert history")
public class SpikeAlertController {

    private static final int DEFAULT_WINDOW_HOURS = 24;

    private final AlertDispatcher dispatcher;
    private final SpikeDetectionService detectionService;
    private final AlertReportService reportService;
    private final MonitorLoop monitorLoop;
    private final ObservationBuffer observationBuffer;

    @GetMapping("/alerts")
    @Operation(summary = "List dispatched alerts",
            description = "Alert history, newest dispatch first. A level filter without hours looks back 24 hours.")
    public ResponseEntity<List<AlertHistoryEntry>> listAlerts(@RequestParam(defaultValue = "50") int limit,
                                                              @RequestParam(required = false) AlertLevel level,
                                                              @RequestParam(required = false) Integer hours,
                                                              @RequestParam(defaultValue = "false") boolean unresolved) {
        if (limit < 1 || limit > 1000) {
            throw new IllegalArgumentException("limit must be between 1 and 1000");
        }
        if (hours != null && hours < 1) {
            throw new IllegalArgumentException("hours must be >= 1");
        }
        Stream<AlertHistoryEntry> entries;
        if (hours != null || level != null) {
            int window = hours != null ? hours : DEFAULT_WINDOW_HOURS;
            entries = dispatcher.dispatchedWithin(Duration.ofHours(window), level).stream();
            if (unresolved) {
                entries = entries.filter(e -> !e.isResolved());
            }
        } else if (unresolved) {
            entries = dispatcher.unresolved().stream();
        } else {
            return ResponseEntity.ok(dispatcher.recent(limit));
        }
        return ResponseEntity.ok(entries.limit(limit).toList());
    }

    @GetMapping("/alerts/stats")
    @Operation(summary = "Alert history statistics", description = "Total, unresolved, per-level and per-reason-type counts")
    public ResponseEntity<AlertStats> alertStats() {
        return ResponseEntity.ok(dispatcher.stats());
    }

    @GetMapping(value = "/alerts/export", produces = "text/csv")
    @Operation(summary = "Export alert history (CSV)", description = "Full history, oldest dispatch first")
    public ResponseEntity<String> exportAlerts() {
        StringBuilder csv = new StringBuilder("timestamp,alert_time,level,priority,reasons,resolved,snapshot\n");
        for (AlertHistoryEntry entry : dispatcher.history()) {
            Alert alert = entry.getAlert();
            String snapshot = alert.getSnapshot().entrySet().stream()
                    .map(e -> e.getKey() + "=" + e.getValue())
                    .collect(Collectors.joining(" "));
            csv.append(alert.getTimestamp()).append(',')
                    .append(entry.getDispatchedAt()).append(',')
                    .append(alert.getLevel()).append(',')
                    .append(alert.getPriorityScore()).append(',')
                    .append(escapeCsv(alert.reasonText())).append(',')
                    .append(entry.isResolved()).append(',')
                    .append(escapeCsv(snapshot)).append('\n');
        }
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.parseMediaType("text/csv"));
        headers.set(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=alert_history.csv");
        return ResponseEntity.ok().headers(headers).body(csv.toString());
    }

    @PostMapping("/alerts/{alertId}/resolve")
    @Operation(summary = "Resolve an alert")
    public ResponseEntity<AlertHistoryEntry> resolve(@PathVariable String alertId) {
        return dispatcher.resolve(alertId)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> new AlertNotFoundException(alertId));
    }

    @DeleteMapping("/alerts")
    @Operation(summary = "Prune alert history", description = "Deletes entries dispatched more than olderThanDays days ago")
    public ResponseEntity<Map<String, Object>> prune(@RequestParam int olderThanDays) {
        int removed = dispatcher.pruneOlderThan(olderThanDays);
        return ResponseEntity.ok(Map.of("removed", removed, "olderThanDays", olderThanDays));
    }

    @GetMapping("/detections")
    @Operation(summary = "Run all detectors", description = "Detections over the buffered frame, keyed by detector")
    public ResponseEntity<Map<String, List<SpikeEvent>>> detections() {
        return ResponseEntity.ok(detectionService.detectAll(observationBuffer.currentFrame()));
    }

    @GetMapping("/detections/recent")
    @Operation(summary = "Recent Z-score spikes", description = "Z-score spikes of the monitored channels in the trailing hours of data")
    public ResponseEntity<List<SpikeEvent>> recentDetections(@RequestParam(defaultValue = "24") int hours) {
        if (hours < 1) {
            throw new IllegalArgumentException("hours must be >= 1");
        }
        return ResponseEntity.ok(detectionService.recentZScoreSpikes(observationBuffer.currentFrame(), Duration.ofHours(hours)));
    }

    @GetMapping("/report")
    @Operation(summary = "Batch alert report", description = "Scores every buffered row; sorted by priority then time, both descending")
    public ResponseEntity<List<Alert>> report(@RequestParam(required = false) Double minPriority) {
        List<Alert> alerts = minPriority != null
                ? reportService.report(observationBuffer.currentFrame(), minPriority)
                : reportService.report(observationBuffer.currentFrame());
        return ResponseEntity.ok(alerts);
    }

    @PostMapping("/monitor/once")
    @Operation(summary = "Evaluate the latest row once", description = "Scores the latest row and dispatches it when it reaches the critical threshold and is not cooling")
    public ResponseEntity<MonitorCycleResult> monitorOnce() {
        MonitorCycleResult result = monitorLoop.runCycle();
        log.info("Single-shot monitor: dataTime={}, alert={}, dispatched={}", result.getDataTime(),
                result.getAlert() != null ? result.getAlert().getLevel() : null, result.isDispatched());
        return ResponseEntity.ok(result);
    }

    @GetMapping("/status")
    @Operation(summary = "Monitor status", description = "Buffer size, continuous mode state and per-level cooldowns")
    public ResponseEntity<Map<String, Object>> status() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("bufferedRows", observationBuffer.size());
        body.put("continuousRunning", monitorLoop.isRunning());
        body.put("cooldown", dispatcher.cooldown().toString());
        body.put("lastDispatchedByLevel", dispatcher.cooldownState().snapshot());
        return ResponseEntity.ok(body);
    }

    @PostMapping("/observations")
    @Operation(summary = "Ingest an observation", description = "Appends channel values for one timestamp; same-timestamp values merge into the newest row")
    public ResponseEntity<Map<String, Object>> ingest(@Valid @RequestBody ChannelObservation observation) {
        boolean accepted = observationBuffer.append(observation);
        HttpStatus status = accepted ? HttpStatus.ACCEPTED : HttpStatus.CONFLICT;
        return ResponseEntity.status(status).body(Map.of(
                "accepted", accepted,
                "bufferedRows", observationBuffer.size()));
    }

    private static String escapeCsv(String value) {
        if (value == null) return "";
        if (value.contains(",") || value.contains("\"") || value.contains("\n")) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }
}
