package com.spike.monitor.api;

import com.spike.monitor.alert.Alert;
import com.spike.monitor.alert.AlertDispatcher;
import com.spike.monitor.alert.AlertHistoryEntry;
import com.spike.monitor.alert.AlertLevel;
import com.spike.monitor.alert.AlertStats;
import com.spike.monitor.alert.CooldownState;
import com.spike.monitor.detect.DetectorKind;
import com.spike.monitor.detect.SpikeDetectionService;
import com.spike.monitor.detect.SpikeEvent;
import com.spike.monitor.detect.SpikeType;
import com.spike.monitor.frame.ObservationBuffer;
import com.spike.monitor.frame.TimeSeriesFrame;
import com.spike.monitor.monitor.MonitorCycleResult;
import com.spike.monitor.monitor.MonitorLoop;
import com.spike.monitor.scoring.AlertReportService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Unit tests for SpikeAlertController.
 */
@WebMvcTest(controllers = SpikeAlertController.class)
class SpikeAlertControllerTest {

    private static final Instant DATA_TIME = Instant.parse("2024-03-02T11:00:00Z");
    private static final Instant DISPATCHED = Instant.parse("2024-03-02T11:00:05Z");

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private AlertDispatcher dispatcher;

    @MockitoBean
    private SpikeDetectionService detectionService;

    @MockitoBean
    private AlertReportService reportService;

    @MockitoBean
    private MonitorLoop monitorLoop;

    @MockitoBean
    private ObservationBuffer observationBuffer;

    @Test
    void listAlertsReturnsNewestFirst() throws Exception {
        when(dispatcher.recent(50)).thenReturn(List.of(entry()));

        mockMvc.perform(get("/api/v1/spikes/alerts"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1))
                .andExpect(jsonPath("$[0].alertId").value("alert-1"))
                .andExpect(jsonPath("$[0].level").value("CRITICAL"))
                .andExpect(jsonPath("$[0].alert.priorityScore").value(10))
                .andExpect(jsonPath("$[0].alert.reasons[2]").value("Community and large-transaction surge together"))
                .andExpect(jsonPath("$[0].dispatchedAt").value("2024-03-02T11:00:05Z"));
    }

    @Test
    void listAlertsRejectsOutOfRangeLimit() throws Exception {
        mockMvc.perform(get("/api/v1/spikes/alerts").param("limit", "0"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("BAD_REQUEST"));
    }

    @Test
    void listAlertsFiltersByLevelAndHours() throws Exception {
        when(dispatcher.dispatchedWithin(Duration.ofHours(6), AlertLevel.CRITICAL)).thenReturn(List.of(entry()));

        mockMvc.perform(get("/api/v1/spikes/alerts").param("level", "CRITICAL").param("hours", "6"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1))
                .andExpect(jsonPath("$[0].alertId").value("alert-1"));
    }

    @Test
    void levelWithoutHoursLooksBackOneDay() throws Exception {
        when(dispatcher.dispatchedWithin(Duration.ofHours(24), AlertLevel.HIGH)).thenReturn(List.of());

        mockMvc.perform(get("/api/v1/spikes/alerts").param("level", "HIGH"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(0));
    }

    @Test
    void windowedListDropsResolvedWhenUnresolvedRequested() throws Exception {
        AlertHistoryEntry resolved = entry().resolvedAt(DISPATCHED.plusSeconds(60));
        when(dispatcher.dispatchedWithin(Duration.ofHours(2), null)).thenReturn(List.of(resolved));

        mockMvc.perform(get("/api/v1/spikes/alerts").param("hours", "2").param("unresolved", "true"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(0));
    }

    @Test
    void listUnresolvedAlerts() throws Exception {
        when(dispatcher.unresolved()).thenReturn(List.of(entry()));

        mockMvc.perform(get("/api/v1/spikes/alerts").param("unresolved", "true"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].resolved").value(false));
    }

    @Test
    void unknownLevelIsBadRequest() throws Exception {
        mockMvc.perform(get("/api/v1/spikes/alerts").param("level", "SEVERE"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("BAD_REQUEST"));
    }

    @Test
    void alertStatsAreReported() throws Exception {
        when(dispatcher.stats()).thenReturn(AlertStats.of(List.of(entry())));

        mockMvc.perform(get("/api/v1/spikes/alerts/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total").value(1))
                .andExpect(jsonPath("$.unresolved").value(1))
                .andExpect(jsonPath("$.byLevel.CRITICAL").value(1))
                .andExpect(jsonPath("$.byType['Large-transaction surge']").value(1));
    }

    @Test
    void exportWritesCsvHistory() throws Exception {
        when(dispatcher.history()).thenReturn(List.of(entry()));

        mockMvc.perform(get("/api/v1/spikes/alerts/export"))
                .andExpect(status().isOk())
                .andExpect(header().string("Content-Disposition", containsString("alert_history.csv")))
                .andExpect(content().string(containsString("timestamp,alert_time,level,priority,reasons,resolved,snapshot")))
                .andExpect(content().string(containsString("2024-03-02T11:00:00Z,2024-03-02T11:00:05Z,CRITICAL,10,")))
                .andExpect(content().string(containsString("whale_tx_count=9.0")));
    }

    @Test
    void resolveUnknownAlertIs404() throws Exception {
        when(dispatcher.resolve("nope")).thenReturn(Optional.empty());

        mockMvc.perform(post("/api/v1/spikes/alerts/nope/resolve"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("ALERT_NOT_FOUND"));
    }

    @Test
    void resolveKnownAlert() throws Exception {
        when(dispatcher.resolve("alert-1")).thenReturn(Optional.of(entry().resolvedAt(DISPATCHED.plusSeconds(60))));

        mockMvc.perform(post("/api/v1/spikes/alerts/alert-1/resolve"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.resolved").value(true));
    }

    @Test
    void pruneReportsRemovedCount() throws Exception {
        when(dispatcher.pruneOlderThan(30)).thenReturn(4);

        mockMvc.perform(delete("/api/v1/spikes/alerts").param("olderThanDays", "30"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.removed").value(4))
                .andExpect(jsonPath("$.olderThanDays").value(30));
    }

    @Test
    void pruneWithoutRetentionIsBadRequest() throws Exception {
        mockMvc.perform(delete("/api/v1/spikes/alerts"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("BAD_REQUEST"));
    }

    @Test
    void detectionsAreKeyedByDetector() throws Exception {
        TimeSeriesFrame frame = TimeSeriesFrame.empty();
        when(observationBuffer.currentFrame()).thenReturn(frame);
        SpikeEvent event = SpikeEvent.builder()
                .channel("message_count")
                .detector(DetectorKind.ZSCORE)
                .type(SpikeType.POSITIVE_SPIKE)
                .magnitude(4.69)
                .timestamp(DATA_TIME)
                .row(30)
                .value(100.0)
                .build();
        when(detectionService.detectAll(frame)).thenReturn(Map.of("message_count_zscore", List.of(event)));

        mockMvc.perform(get("/api/v1/spikes/detections"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message_count_zscore[0].type").value("POSITIVE_SPIKE"))
                .andExpect(jsonPath("$.message_count_zscore[0].row").value(30));
    }

    @Test
    void recentDetectionsUseRequestedHours() throws Exception {
        TimeSeriesFrame frame = TimeSeriesFrame.empty();
        when(observationBuffer.currentFrame()).thenReturn(frame);
        when(detectionService.recentZScoreSpikes(frame, Duration.ofHours(6))).thenReturn(List.of());

        mockMvc.perform(get("/api/v1/spikes/detections/recent").param("hours", "6"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$").isArray());
    }

    @Test
    void reportHonoursMinPriority() throws Exception {
        when(observationBuffer.currentFrame()).thenReturn(TimeSeriesFrame.empty());
        when(reportService.report(any(TimeSeriesFrame.class), eq(5.0))).thenReturn(List.of(entry().getAlert()));

        mockMvc.perform(get("/api/v1/spikes/report").param("minPriority", "5"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].level").value("CRITICAL"));
    }

    @Test
    void monitorOnceReturnsCycleResult() throws Exception {
        when(monitorLoop.runCycle()).thenReturn(MonitorCycleResult.builder()
                .dataTime(DATA_TIME)
                .rowsEvaluated(25)
                .detections(2)
                .alert(entry().getAlert())
                .submitted(true)
                .dispatched(false)
                .build());

        mockMvc.perform(post("/api/v1/spikes/monitor/once"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.alert.priorityScore").value(10))
                .andExpect(jsonPath("$.submitted").value(true))
                .andExpect(jsonPath("$.dispatched").value(false));
    }

    @Test
    void statusReportsBufferAndCooldown() throws Exception {
        when(observationBuffer.size()).thenReturn(12);
        when(monitorLoop.isRunning()).thenReturn(true);
        when(dispatcher.cooldown()).thenReturn(Duration.ofHours(1));
        when(dispatcher.cooldownState()).thenReturn(new CooldownState());

        mockMvc.perform(get("/api/v1/spikes/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.bufferedRows").value(12))
                .andExpect(jsonPath("$.continuousRunning").value(true))
                .andExpect(jsonPath("$.cooldown").value("PT1H"));
    }

    @Test
    void ingestAcceptsObservation() throws Exception {
        when(observationBuffer.append(any())).thenReturn(true);
        when(observationBuffer.size()).thenReturn(1);

        mockMvc.perform(post("/api/v1/spikes/observations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "timestamp": "2024-03-02T11:00:00Z",
                                  "values": {"telegram_message_count": 140, "whale_tx_count": 9},
                                  "source": "collector-1"
                                }
                                """))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.accepted").value(true))
                .andExpect(jsonPath("$.bufferedRows").value(1));
    }

    @Test
    void ingestRejectsOutOfOrderObservation() throws Exception {
        when(observationBuffer.append(any())).thenReturn(false);

        mockMvc.perform(post("/api/v1/spikes/observations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"timestamp\":\"2024-03-01T00:00:00Z\",\"values\":{\"whale_tx_count\":1}}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.accepted").value(false));
    }

    @Test
    void ingestValidatesBody() throws Exception {
        mockMvc.perform(post("/api/v1/spikes/observations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"values\":{}}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("VALIDATION_FAILED"))
                .andExpect(jsonPath("$.details.timestamp").exists())
                .andExpect(jsonPath("$.details.values").exists());
    }

    private static AlertHistoryEntry entry() {
        Alert alert = Alert.builder()
                .alertId("alert-1")
                .timestamp(DATA_TIME)
                .reasons(List.of(
                        "Community message surge in telegram_message_count (z=4.70)",
                        "Large-transaction surge in whale_tx_count (z=3.10)",
                        "Community and large-transaction surge together"))
                .priorityScore(10)
                .snapshot(Map.of("whale_tx_count", 9.0))
                .build();
        return AlertHistoryEntry.builder().alert(alert).dispatchedAt(DISPATCHED).build();
    }
}
