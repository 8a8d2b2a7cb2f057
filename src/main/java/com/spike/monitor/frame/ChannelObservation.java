package com.spike.monitor.frame;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.Map;

/**
 * Channel values observed at one timestamp, as received from Kafka or the REST API.
 * A channel left out, or sent as null, is missing for that row.
 */
@Value
@Builder
@Jacksonized
public class ChannelObservation {

    @NotNull
    Instant timestamp;
    @NotEmpty
    Map<String, Double> values;
    /** Producer of the observation, e.g. the collector name. Informational. */
    String source;
}
