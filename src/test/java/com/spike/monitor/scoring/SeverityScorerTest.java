package com.spike.monitor.scoring;

import com.spike.monitor.alert.Alert;
import com.spike.monitor.alert.AlertLevel;
import com.spike.monitor.config.MonitorProperties;
import com.spike.monitor.detect.DetectorKind;
import com.spike.monitor.detect.SpikeEvent;
import com.spike.monitor.detect.SpikeType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for SeverityScorer: family points, co-occurrence bonuses and level mapping.
 */
class SeverityScorerTest {

    private static final Instant TS = Instant.parse("2024-03-02T06:00:00Z");

    private SeverityScorer scorer;

    @BeforeEach
    void setUp() {
        scorer = new SeverityScorer(new MonitorProperties());
    }

    @Test
    void communityAndLargeTransactionIsCritical() {
        Optional<Alert> alert = scorer.score(List.of(
                spike("telegram_message_count", 4.7),
                spike("whale_tx_count", 3.1)), TS, Map.of("whale_tx_count", 12.0));

        assertThat(alert).isPresent();
        assertThat(alert.get().getPriorityScore()).isEqualTo(10);
        assertThat(alert.get().getLevel()).isEqualTo(AlertLevel.CRITICAL);
        assertThat(alert.get().getReasons()).containsExactly(
                "Community message surge in telegram_message_count (z=4.70)",
                "Large-transaction surge in whale_tx_count (z=3.10)",
                "Community and large-transaction surge together");
        assertThat(alert.get().getSnapshot()).containsEntry("whale_tx_count", 12.0);
        assertThat(alert.get().getTimestamp()).isEqualTo(TS);
    }

    @Test
    void allThreeFamiliesStackEveryBonus() {
        Optional<Alert> alert = scorer.score(List.of(
                spike("twitter_engagement", 2.4),
                spike("whale_tx_count", 3.1),
                spike("telegram_message_count", 4.7)), TS, Map.of());

        assertThat(alert).hasValueSatisfying(a -> {
            assertThat(a.getPriorityScore()).isEqualTo(2 + 3 + 2 + 5 + 4 + 10);
            assertThat(a.getLevel()).isEqualTo(AlertLevel.CRITICAL);
            assertThat(a.getReasons()).hasSize(6);
            assertThat(a.getReasons().get(5)).isEqualTo("All three signal families surging (CRITICAL)");
        });
    }

    @Test
    void socialAndLargeTransactionIsHigh() {
        Optional<Alert> alert = scorer.score(List.of(
                spike("twitter_engagement", 2.4),
                spike("whale_tx_count", 3.1)), TS, Map.of());

        assertThat(alert).hasValueSatisfying(a -> {
            assertThat(a.getPriorityScore()).isEqualTo(9);
            assertThat(a.getLevel()).isEqualTo(AlertLevel.HIGH);
        });
    }

    @Test
    void communityAndSocialHaveNoPairBonus() {
        Optional<Alert> alert = scorer.score(List.of(
                spike("telegram_message_count", 2.4),
                spike("twitter_engagement", 3.1)), TS, Map.of());

        assertThat(alert).hasValueSatisfying(a -> {
            assertThat(a.getPriorityScore()).isEqualTo(4);
            assertThat(a.getLevel()).isEqualTo(AlertLevel.MEDIUM);
        });
    }

    @Test
    void singleSocialSpikeIsMedium() {
        Optional<Alert> alert = scorer.score(List.of(spike("twitter_engagement", 2.2)), TS, Map.of());

        assertThat(alert).hasValueSatisfying(a -> {
            assertThat(a.getPriorityScore()).isEqualTo(2);
            assertThat(a.getLevel()).isEqualTo(AlertLevel.MEDIUM);
            assertThat(a.reasonText()).isEqualTo("Social engagement surge in twitter_engagement (z=2.20)");
        });
    }

    @Test
    void familyCountsOnceWhateverTheNumberOfEvents() {
        Optional<Alert> alert = scorer.score(List.of(
                spike("whale_tx_count", 2.1),
                spike("whale_tx_count", 5.0)), TS, Map.of());

        assertThat(alert).hasValueSatisfying(a -> {
            assertThat(a.getPriorityScore()).isEqualTo(3);
            assertThat(a.getReasons()).containsExactly("Large-transaction surge in whale_tx_count (z=5.00)");
        });
    }

    @Test
    void negativeSpikesOtherDetectorsAndOtherTimestampsDoNotScore() {
        SpikeEvent negative = SpikeEvent.builder()
                .channel("whale_tx_count")
                .detector(DetectorKind.ZSCORE)
                .type(SpikeType.NEGATIVE_SPIKE)
                .magnitude(4.0)
                .timestamp(TS)
                .build();
        SpikeEvent surge = SpikeEvent.builder()
                .channel("telegram_message_count")
                .detector(DetectorKind.MOVING_AVERAGE)
                .type(SpikeType.SURGE)
                .magnitude(300)
                .timestamp(TS)
                .build();
        SpikeEvent earlier = SpikeEvent.builder()
                .channel("twitter_engagement")
                .detector(DetectorKind.ZSCORE)
                .type(SpikeType.POSITIVE_SPIKE)
                .magnitude(3.0)
                .timestamp(TS.minusSeconds(3600))
                .build();
        SpikeEvent unmapped = spike("message_count", 9.0);

        assertThat(scorer.score(List.of(negative, surge, earlier, unmapped), TS, Map.of())).isEmpty();
    }

    @Test
    void noEventsNoAlert() {
        assertThat(scorer.score(List.of(), TS, Map.of())).isEmpty();
    }

    @Test
    void levelIsMonotonicInScore() {
        assertThat(AlertLevel.forScore(1)).isEqualTo(AlertLevel.LOW);
        assertThat(AlertLevel.forScore(2)).isEqualTo(AlertLevel.MEDIUM);
        assertThat(AlertLevel.forScore(4.99)).isEqualTo(AlertLevel.MEDIUM);
        assertThat(AlertLevel.forScore(5)).isEqualTo(AlertLevel.HIGH);
        assertThat(AlertLevel.forScore(10)).isEqualTo(AlertLevel.CRITICAL);
        assertThat(AlertLevel.forScore(26)).isEqualTo(AlertLevel.CRITICAL);
    }

    private static SpikeEvent spike(String channel, double z) {
        return SpikeEvent.builder()
                .channel(channel)
                .detector(DetectorKind.ZSCORE)
                .type(SpikeType.POSITIVE_SPIKE)
                .magnitude(z)
                .timestamp(TS)
                .build();
    }
}
