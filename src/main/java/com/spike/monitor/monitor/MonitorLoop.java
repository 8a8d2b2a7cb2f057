package com.spike.monitor.monitor;

import com.spike.monitor.alert.Alert;
import com.spike.monitor.alert.AlertDispatcher;
import com.spike.monitor.alert.AlertHistoryEntry;
import com.spike.monitor.config.MonitorProperties;
import com.spike.monitor.detect.SpikeDetectionService;
import com.spike.monitor.detect.SpikeEvent;
import com.spike.monitor.frame.TimeSeriesFrame;
import com.spike.monitor.frame.TimeSeriesSource;
import com.spike.monitor.scoring.SeverityScorer;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Drives evaluation cycles: trailing window, Z-scores, detectors, scoring and dispatch.
 * <p>
 * Cycles never overlap; single-shot calls made while a continuous cycle runs wait for it.
 * Continuous mode sleeps for the interval minus the cycle time (drift is accepted, cycles are
 * never skipped) and checks for a stop request only between cycles. A stop requested before a run
 * has installed its wake-up latch is kept and ends that run after its first cycle.
 */
@Slf4j
public class MonitorLoop {

    private final TimeSeriesSource source;
    private final SpikeDetectionService detectionService;
    private final SeverityScorer scorer;
    private final AlertDispatcher dispatcher;
    private final MonitorProperties properties;
    private final Clock clock;

    private final ReentrantLock evaluationLock = new ReentrantLock();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean stopRequested = new AtomicBoolean(false);
    private volatile CountDownLatch stopSignal = new CountDownLatch(1);

    public MonitorLoop(TimeSeriesSource source, SpikeDetectionService detectionService, SeverityScorer scorer,
                       AlertDispatcher dispatcher, MonitorProperties properties, Clock clock) {
        this.source = source;
        this.detectionService = detectionService;
        this.scorer = scorer;
        this.dispatcher = dispatcher;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Evaluates the latest row once. The alert is returned whenever one was scored, whether or not
     * it reached the dispatch threshold or passed the cooldown.
     */
    public Optional<Alert> monitorOnce() {
        return runCycle().alertOpt();
    }

    public MonitorCycleResult runCycle() {
        evaluationLock.lock();
        try {
            return evaluate();
        } finally {
            evaluationLock.unlock();
        }
    }

    private MonitorCycleResult evaluate() {
        TimeSeriesFrame frame = source.currentFrame();
        if (frame.isEmpty()) {
            log.debug("No observations yet; nothing to evaluate");
            return MonitorCycleResult.empty();
        }
        Instant latest = frame.latestTimestamp().orElseThrow();
        TimeSeriesFrame recent = frame.since(latest.minus(properties.window()));
        int window = Math.min(properties.getWindowHours(), recent.size());

        Set<String> channels = new LinkedHashSet<>(properties.getChannelFamilies().keySet());
        channels.addAll(properties.getMonitorColumns());
        TimeSeriesFrame derived = SpikeDetectionService.withZScores(recent, channels, window);
        int lastRow = derived.size() - 1;

        List<SpikeEvent> events = new ArrayList<>(detectionService.detectFamilySpikes(derived, window));
        detectionService.detectAll(derived, window).values().forEach(events::addAll);
        events.removeIf(e -> e.getRow() != lastRow);
        if (log.isDebugEnabled()) {
            events.forEach(e -> log.debug("{} at {}", e.describe(), latest));
        }

        Optional<Alert> alertOpt = scorer.score(events, latest, recent.snapshot(lastRow));
        boolean submitted = false;
        boolean dispatched = false;
        if (alertOpt.isPresent()) {
            Alert alert = alertOpt.get();
            if (alert.getPriorityScore() >= properties.getCriticalPriorityThreshold()) {
                submitted = true;
                dispatched = dispatcher.submit(alert);
            } else {
                log.debug("Alert {} scored {} below critical threshold {}; not submitted",
                        alert.getAlertId(), alert.getPriorityScore(), properties.getCriticalPriorityThreshold());
            }
        }
        return MonitorCycleResult.builder()
                .dataTime(latest)
                .rowsEvaluated(recent.size())
                .detections(events.size())
                .alert(alertOpt.orElse(null))
                .submitted(submitted)
                .dispatched(dispatched)
                .build();
    }

    /**
     * Repeats {@link #runCycle()} every {@code check-interval-seconds} until {@code maxDuration} has
     * elapsed (checked after each cycle) or {@link #requestStop()} is called. A null duration runs
     * until stopped.
     *
     * @throws IllegalStateException when a continuous run is already active
     */
    public MonitoringSummary startMonitoring(Duration maxDuration) {
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("Continuous monitoring is already running");
        }
        CountDownLatch stop = new CountDownLatch(1);
        stopSignal = stop;
        if (stopRequested.get()) {
            stop.countDown();
        }
        Duration interval = properties.checkInterval();
        Instant startedAt = clock.instant();
        log.info("Continuous monitoring started: interval={}s, familySpikeThreshold={}, cooldown={}, duration={}",
                interval.getSeconds(), properties.getFamilySpikeThreshold(), dispatcher.cooldown(),
                maxDuration != null ? maxDuration : "until stopped");

        int cycles = 0;
        int failed = 0;
        int detected = 0;
        int dispatchedCount = 0;
        MonitoringSummary.StopReason reason;
        try {
            while (true) {
                Instant cycleStart = clock.instant();
                cycles++;
                try {
                    MonitorCycleResult result = runCycle();
                    if (result.getAlert() != null) {
                        detected++;
                        if (result.isDispatched()) dispatchedCount++;
                        log.info("Check #{} [data {}]: spike detected (priority={}, level={}, dispatched={})",
                                cycles, result.getDataTime(), result.getAlert().getPriorityScore(),
                                result.getAlert().getLevel(), result.isDispatched());
                    } else {
                        log.info("Check #{} [data {}]: normal ({} detections on latest row)",
                                cycles, result.getDataTime(), result.getDetections());
                    }
                    if (properties.getHistory().getRetentionDays() > 0) {
                        dispatcher.pruneOlderThan(properties.getHistory().getRetentionDays());
                    }
                } catch (RuntimeException e) {
                    failed++;
                    log.error("Check #{} failed", cycles, e);
                }

                Instant now = clock.instant();
                if (maxDuration != null && Duration.between(startedAt, now).compareTo(maxDuration) >= 0) {
                    log.info("Monitoring duration {} elapsed", maxDuration);
                    reason = MonitoringSummary.StopReason.DURATION_ELAPSED;
                    break;
                }
                long sleepMs = Math.max(0L, interval.minus(Duration.between(cycleStart, now)).toMillis());
                if (stop.await(sleepMs, TimeUnit.MILLISECONDS)) {
                    log.info("Monitoring stop requested");
                    reason = MonitoringSummary.StopReason.STOP_REQUESTED;
                    break;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Monitoring interrupted while sleeping");
            reason = MonitoringSummary.StopReason.INTERRUPTED;
        } finally {
            stopRequested.set(false);
            running.set(false);
        }

        MonitoringSummary summary = MonitoringSummary.builder()
                .startedAt(startedAt)
                .finishedAt(clock.instant())
                .cycles(cycles)
                .failedCycles(failed)
                .alertsDetected(detected)
                .alertsDispatched(dispatchedCount)
                .stopReason(reason)
                .build();
        logSummary(summary);
        return summary;
    }

    /**
     * Wakes a sleeping continuous run; a cycle in progress finishes first. The request sticks until a
     * run consumes it, so calling this just before {@link #startMonitoring(Duration)} installs its
     * latch is not lost.
     */
    public void requestStop() {
        stopRequested.set(true);
        stopSignal.countDown();
    }

    public boolean isRunning() {
        return running.get();
    }

    private void logSummary(MonitoringSummary summary) {
        log.info("Monitoring summary: checks={}, failed={}, alerts detected={}, dispatched={}, stop={}",
                summary.getCycles(), summary.getFailedCycles(), summary.getAlertsDetected(),
                summary.getAlertsDispatched(), summary.getStopReason());
        for (AlertHistoryEntry entry : dispatcher.recent(10)) {
            log.info("  [{}] {} - {}", entry.getDispatchedAt(), entry.getLevel(), entry.getAlert().reasonText());
        }
    }
}
