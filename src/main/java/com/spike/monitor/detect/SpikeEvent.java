package com.spike.monitor.detect;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Locale;

/**
 * One flagged row from one detector. Created fresh on each evaluation and never mutated.
 */
@Value
@Builder
public class SpikeEvent {

    /** One channel, or two for joint detectors; fusion events list every fused channel. */
    @Singular
    List<String> channels;
    DetectorKind detector;
    SpikeType type;
    /** |z|, |percent deviation|, |percent change| or the fused score, depending on {@link #detector}. */
    double magnitude;
    Instant timestamp;
    /** Row index within the frame the detector ran on. */
    int row;
    /** Raw value of the single source channel; null for multi-channel detections. */
    Double value;

    public String primaryChannel() {
        return channels.isEmpty() ? null : channels.get(0);
    }

    public String describe() {
        return String.format(Locale.ROOT, "%s detected in %s (magnitude: %.2f)", type.label(), String.join(" & ", channels), magnitude);
    }
}
