package com.spike.monitor.messaging;

import com.spike.monitor.frame.ChannelObservation;
import com.spike.monitor.frame.ObservationBuffer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.KafkaHeaders;
import org.springframework.messaging.handler.annotation.Header;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.stereotype.Component;

/**
 * Feeds channel observations from Kafka into the {@link ObservationBuffer}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "spike.monitor.kafka.enabled", havingValue = "true", matchIfMissing = true)
public class ObservationConsumer {

    private final ObservationBuffer buffer;

    @KafkaListener(
            topics = "${spike.monitor.kafka.topic.observations:channel-observations}",
            groupId = "${spike.monitor.kafka.consumer-group:spike-monitor}",
            containerFactory = "observationListenerContainerFactory"
    )
    public void onObservation(
            @Payload(required = false) ChannelObservation observation,
            @Header(value = KafkaHeaders.RECEIVED_KEY, required = false) String key,
            @Header(value = KafkaHeaders.OFFSET, required = false) Long offset) {
        if (observation == null || observation.getTimestamp() == null || observation.getValues() == null) {
            log.warn("Skipping malformed observation key={}, offset={}: {}", key, offset, observation);
            return;
        }
        if (buffer.append(observation)) {
            log.debug("Buffered observation at {} channels={} source={}", observation.getTimestamp(),
                    observation.getValues().keySet(), observation.getSource());
        }
    }
}
