package com.spike.monitor.messaging;

import com.spike.monitor.alert.AlertHistoryEntry;
import com.spike.monitor.alert.AlertNotifier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * Publishes dispatched alerts for dashboards and downstream automation. Keyed by alert level.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "spike.monitor.kafka.enabled", havingValue = "true", matchIfMissing = true)
public class AlertProducer implements AlertNotifier {

    private final KafkaTemplate<String, AlertHistoryEntry> alertKafkaTemplate;

    @Value("${spike.monitor.kafka.topic.alerts:spike-alerts}")
    private String topic;

    @Override
    public void notify(AlertHistoryEntry entry) {
        CompletableFuture<SendResult<String, AlertHistoryEntry>> future =
                alertKafkaTemplate.send(topic, entry.getLevel().name(), entry);
        future.whenComplete((result, ex) -> {
            if (ex != null) log.error("Failed to publish alert {}", entry.getAlertId(), ex);
            else log.debug("Published alert {} partition={}", entry.getAlertId(),
                    result != null ? result.getRecordMetadata().partition() : null);
        });
    }
}
