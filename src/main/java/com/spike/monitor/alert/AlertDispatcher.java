package com.spike.monitor.alert;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Cooldown-gated dispatch of scored alerts.
 * <p>
 * Each level is idle until an alert of that level is dispatched, then cooling for the configured
 * duration. An alert submitted while its level is cooling is not appended and not emitted; the caller
 * still holds it. On dispatch the entry is appended to the history first, then the cooldown is recorded,
 * then notifiers run. A failing notifier never undoes the history write.
 * <p>
 * This class is the only writer of its {@link AlertHistory} and {@link CooldownState}.
 */
@Slf4j
public class AlertDispatcher {

    private final AlertHistory history;
    private final CooldownState cooldownState;
    private final Duration cooldown;
    private final Clock clock;
    private final List<AlertNotifier> notifiers;

    public AlertDispatcher(AlertHistory history, CooldownState cooldownState, Duration cooldown,
                           Clock clock, List<AlertNotifier> notifiers) {
        this.history = history;
        this.cooldownState = cooldownState;
        this.cooldown = cooldown;
        this.clock = clock;
        this.notifiers = List.copyOf(notifiers);
    }

    /**
     * @return true when the alert was appended to the history and emitted, false when its level is cooling
     */
    public synchronized boolean submit(Alert alert) {
        Instant now = clock.instant();
        AlertLevel level = alert.getLevel();
        if (cooldownState.isCooling(level, now, cooldown)) {
            Instant last = cooldownState.lastDispatched(level).orElseThrow();
            log.info("Alert computed but not dispatched: alertId={}, level={}, score={}, cooling since {} ({} remaining)",
                    alert.getAlertId(), level, alert.getPriorityScore(), last,
                    cooldown.minus(Duration.between(last, now)));
            return false;
        }
        AlertHistoryEntry entry = AlertHistoryEntry.builder()
                .alert(alert)
                .dispatchedAt(now)
                .build();
        history.append(entry);
        cooldownState.record(level, now);
        log.warn("[ALERT] level={} score={} dataTime={} reasons=[{}] snapshot={}",
                level, alert.getPriorityScore(), alert.getTimestamp(), alert.reasonText(), alert.getSnapshot());
        for (AlertNotifier notifier : notifiers) {
            try {
                notifier.notify(entry);
            } catch (RuntimeException e) {
                log.error("Notifier {} failed for alert {}", notifier.getClass().getSimpleName(), alert.getAlertId(), e);
            }
        }
        return true;
    }

    public synchronized Optional<AlertHistoryEntry> resolve(String alertId) {
        Optional<AlertHistoryEntry> resolved = history.markResolved(alertId, clock.instant());
        resolved.ifPresent(e -> log.info("Alert resolved: alertId={}, level={}", alertId, e.getLevel()));
        return resolved;
    }

    /** Drops entries dispatched more than {@code retentionDays} days ago. */
    public synchronized int pruneOlderThan(int retentionDays) {
        if (retentionDays < 0) {
            throw new IllegalArgumentException("retentionDays must be >= 0, got " + retentionDays);
        }
        Instant cutoff = clock.instant().minus(Duration.ofDays(retentionDays));
        int removed = history.pruneDispatchedBefore(cutoff);
        if (removed > 0) {
            log.info("Pruned {} alert history entries dispatched before {}", removed, cutoff);
        }
        return removed;
    }

    public List<AlertHistoryEntry> history() {
        return history.entries();
    }

    public List<AlertHistoryEntry> recent(int limit) {
        return history.recent(limit);
    }

    public List<AlertHistoryEntry> unresolved() {
        return history.unresolved();
    }

    /**
     * Entries dispatched within {@code window} of now, newest first.
     *
     * @param level only this level; null for all levels
     */
    public List<AlertHistoryEntry> dispatchedWithin(Duration window, AlertLevel level) {
        return history.dispatchedSince(clock.instant().minus(window), level);
    }

    public AlertStats stats() {
        return history.stats();
    }

    public CooldownState cooldownState() {
        return cooldownState;
    }

    public Duration cooldown() {
        return cooldown;
    }
}
