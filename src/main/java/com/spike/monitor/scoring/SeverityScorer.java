package com.spike.monitor.scoring;

import com.spike.monitor.alert.Alert;
import com.spike.monitor.config.MonitorProperties;
import com.spike.monitor.detect.DetectorKind;
import com.spike.monitor.detect.SpikeEvent;
import com.spike.monitor.detect.SpikeType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Turns the detections of one timestamp into a priority score and an {@link Alert}.
 * <p>
 * Each signal family with a positive Z-score spike contributes its points once. Pair bonuses
 * (community + large-transaction +5, social + large-transaction +4) and the all-three bonus (+10)
 * stack on top. Scores below {@link #MIN_ALERT_SCORE} produce no alert.
 */
@Slf4j
@Component
public class SeverityScorer {

    public static final int MIN_ALERT_SCORE = 2;

    static final int COMMUNITY_LARGE_TX_BONUS = 5;
    static final int SOCIAL_LARGE_TX_BONUS = 4;
    static final int ALL_FAMILIES_BONUS = 10;

    private final Map<String, SignalFamily> channelFamilies;

    public SeverityScorer(MonitorProperties properties) {
        this.channelFamilies = Map.copyOf(properties.getChannelFamilies());
    }

    /**
     * Scores the events of {@code timestamp}; events of other timestamps are ignored.
     *
     * @param snapshot raw channel values at the triggering row, copied into the alert
     */
    public Optional<Alert> score(List<SpikeEvent> events, Instant timestamp, Map<String, Double> snapshot) {
        Map<SignalFamily, SpikeEvent> strongest = new EnumMap<>(SignalFamily.class);
        for (SpikeEvent event : events) {
            if (!timestamp.equals(event.getTimestamp())) continue;
            if (event.getDetector() != DetectorKind.ZSCORE || event.getType() != SpikeType.POSITIVE_SPIKE) continue;
            SignalFamily family = channelFamilies.get(event.primaryChannel());
            if (family == null) continue;
            strongest.merge(family, event, (a, b) -> b.getMagnitude() > a.getMagnitude() ? b : a);
        }

        int score = 0;
        List<String> reasons = new ArrayList<>();
        for (SignalFamily family : SignalFamily.values()) {
            SpikeEvent event = strongest.get(family);
            if (event == null) continue;
            score += family.getPoints();
            reasons.add(String.format(Locale.ROOT, "%s in %s (z=%.2f)",
                    family.getReason(), event.primaryChannel(), event.getMagnitude()));
        }

        boolean community = strongest.containsKey(SignalFamily.COMMUNITY);
        boolean largeTx = strongest.containsKey(SignalFamily.LARGE_TRANSACTION);
        boolean social = strongest.containsKey(SignalFamily.SOCIAL_ENGAGEMENT);
        if (community && largeTx) {
            score += COMMUNITY_LARGE_TX_BONUS;
            reasons.add("Community and large-transaction surge together");
        }
        if (social && largeTx) {
            score += SOCIAL_LARGE_TX_BONUS;
            reasons.add("Social engagement and large-transaction surge together");
        }
        if (community && largeTx && social) {
            score += ALL_FAMILIES_BONUS;
            reasons.add("All three signal families surging (CRITICAL)");
        }

        if (score < MIN_ALERT_SCORE) {
            return Optional.empty();
        }
        Alert alert = Alert.builder()
                .timestamp(timestamp)
                .reasons(reasons)
                .priorityScore(score)
                .snapshot(snapshot)
                .build();
        log.debug("Scored {}: score={}, level={}, families={}", timestamp, score, alert.getLevel(), strongest.keySet());
        return Optional.of(alert);
    }
}
