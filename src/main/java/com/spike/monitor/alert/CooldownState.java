package com.spike.monitor.alert;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Last dispatch time per alert level. Every level starts idle; state is not persisted.
 */
public class CooldownState {

    private final ConcurrentMap<AlertLevel, Instant> lastDispatched = new ConcurrentHashMap<>();

    public Optional<Instant> lastDispatched(AlertLevel level) {
        return Optional.ofNullable(lastDispatched.get(level));
    }

    /** True while less than {@code cooldown} has elapsed since the last dispatch of {@code level}. */
    public boolean isCooling(AlertLevel level, Instant now, Duration cooldown) {
        Instant last = lastDispatched.get(level);
        return last != null && Duration.between(last, now).compareTo(cooldown) < 0;
    }

    void record(AlertLevel level, Instant at) {
        lastDispatched.put(level, at);
    }

    public Map<AlertLevel, Instant> snapshot() {
        Map<AlertLevel, Instant> copy = new EnumMap<>(AlertLevel.class);
        copy.putAll(lastDispatched);
        return copy;
    }
}
