package com.spike.monitor.config;

import com.spike.monitor.scoring.SignalFamily;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Detector thresholds, scoring inputs and loop cadence, bound from {@code spike.monitor.*}.
 * Cross-field rules are checked by {@link #validate()}.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "spike.monitor")
public class MonitorProperties {

    /** |z| above which the Z-score detector fires. */
    @DecimalMin("0.0") private double zscoreThreshold = 2.5;

    /** Percent deviation from the rolling mean above which the moving-average detector fires. */
    @DecimalMin("0.0") private double maThresholdPct = 50;

    /** Percent change over {@link #rocWindow} rows above which the rate-of-change detector fires. */
    @DecimalMin("0.0") private double rocThresholdPct = 30;

    @Min(1) private int rocWindow = 3;

    /** Fused score in [0,1] above which the multi-indicator detector fires. */
    @DecimalMin("0.0") @DecimalMax("1.0") private double multiThreshold = 0.7;

    /** Rolling window, in rows, for mean and standard deviation. */
    @Min(1) private int rollingWindow = 24;

    @NotEmpty private List<String> monitorColumns = new ArrayList<>(List.of("message_count", "ETH_close", "tx_frequency"));

    /** Fusion weights per monitored channel; empty means uniform 1/N. */
    private Map<String, Double> channelWeights = new LinkedHashMap<>();

    /** Pair checked by the joint correlated-spike detector (both |z| above the Z-score threshold). */
    private List<String> correlationPair = new ArrayList<>(List.of("message_count", "ETH_close"));

    /** Pair checked by the same-direction joint detector. */
    private List<String> combinedSurgePair = new ArrayList<>(List.of("message_count", "tx_frequency"));

    @DecimalMin("0.0") private double combinedSurgeThreshold = 2.0;

    /** Trailing span, in hours of data time, evaluated by each monitor cycle. */
    @Min(1) private int windowHours = 24;

    @Min(1) private int checkIntervalSeconds = 60;

    /** Minimum wall-clock gap between two dispatched alerts of the same level. */
    @DecimalMin("0.0") private double alertCooldownHours = 1;

    /** Continuous mode only dispatches alerts scoring at least this much. */
    @DecimalMin("0.0") private double criticalPriorityThreshold = 10;

    /** Positive z above which a signal family counts as spiking. */
    @DecimalMin("0.0") private double familySpikeThreshold = 2.0;

    /** Channel name to signal family used by severity scoring. */
    private Map<String, SignalFamily> channelFamilies = new LinkedHashMap<>(Map.of(
            "telegram_message_count", SignalFamily.COMMUNITY,
            "whale_tx_count", SignalFamily.LARGE_TRANSACTION,
            "twitter_engagement", SignalFamily.SOCIAL_ENGAGEMENT));

    /** Lowest score kept by the batch alert report. */
    @DecimalMin("0.0") private double minPriorityScore = 2;

    @Valid private History history = new History();

    @Valid private Continuous continuous = new Continuous();

    @Valid private Buffer buffer = new Buffer();

    @Data
    public static class History {
        /** Entries older than this many days are pruned after each continuous cycle; 0 disables. */
        @Min(0) private int retentionDays = 30;
        /** {@code jpa} or {@code memory}. */
        private String store = "jpa";
    }

    @Data
    public static class Continuous {
        private boolean enabled = false;
        /** 0 runs until shutdown. */
        @Min(0) private long durationMinutes = 0;
    }

    @Data
    public static class Buffer {
        @Min(1) private int maxRows = 2000;
    }

    public Duration cooldown() {
        return Duration.ofMillis(Math.round(alertCooldownHours * 3_600_000d));
    }

    public Duration checkInterval() {
        return Duration.ofSeconds(checkIntervalSeconds);
    }

    public Duration window() {
        return Duration.ofHours(windowHours);
    }

    /**
     * Fails fast on values that would otherwise be silently clamped or produce meaningless scores.
     *
     * @throws InvalidMonitorConfigException on the first violated rule
     */
    public void validate() {
        requireNonNegative("zscore-threshold", zscoreThreshold);
        requireNonNegative("ma-threshold-pct", maThresholdPct);
        requireNonNegative("roc-threshold-pct", rocThresholdPct);
        requireNonNegative("combined-surge-threshold", combinedSurgeThreshold);
        requireNonNegative("family-spike-threshold", familySpikeThreshold);
        requireNonNegative("critical-priority-threshold", criticalPriorityThreshold);
        requireNonNegative("min-priority-score", minPriorityScore);
        requireNonNegative("alert-cooldown-hours", alertCooldownHours);
        if (!(multiThreshold >= 0.0 && multiThreshold <= 1.0)) {
            throw new InvalidMonitorConfigException("multi-threshold must be within [0,1], got " + multiThreshold);
        }
        requirePositive("rolling-window", rollingWindow);
        requirePositive("roc-window", rocWindow);
        requirePositive("window-hours", windowHours);
        requirePositive("check-interval-seconds", checkIntervalSeconds);
        requirePositive("buffer.max-rows", buffer.getMaxRows());
        if (history.getRetentionDays() < 0) {
            throw new InvalidMonitorConfigException("history.retention-days must be >= 0, got " + history.getRetentionDays());
        }
        if (continuous.getDurationMinutes() < 0) {
            throw new InvalidMonitorConfigException("continuous.duration-minutes must be >= 0, got " + continuous.getDurationMinutes());
        }
        if (monitorColumns == null || monitorColumns.isEmpty()) {
            throw new InvalidMonitorConfigException("monitor-columns must name at least one channel");
        }
        requirePair("correlation-pair", correlationPair);
        requirePair("combined-surge-pair", combinedSurgePair);
        if (!channelWeights.isEmpty()) {
            double sum = 0.0;
            for (Map.Entry<String, Double> e : channelWeights.entrySet()) {
                if (e.getValue() == null || e.getValue() < 0 || e.getValue().isNaN()) {
                    throw new InvalidMonitorConfigException("channel-weights." + e.getKey() + " must be >= 0, got " + e.getValue());
                }
                if (monitorColumns.contains(e.getKey())) {
                    sum += e.getValue();
                }
            }
            if (sum <= 0.0) {
                throw new InvalidMonitorConfigException("channel-weights over monitor-columns sum to zero");
            }
        }
    }

    private static void requireNonNegative(String name, double value) {
        if (!(value >= 0.0)) {
            throw new InvalidMonitorConfigException(name + " must be >= 0, got " + value);
        }
    }

    private static void requirePositive(String name, long value) {
        if (value < 1) {
            throw new InvalidMonitorConfigException(name + " must be >= 1, got " + value);
        }
    }

    private static void requirePair(String name, List<String> pair) {
        if (pair != null && !pair.isEmpty() && pair.size() != 2) {
            throw new InvalidMonitorConfigException(name + " must name exactly two channels, got " + pair);
        }
    }
}
