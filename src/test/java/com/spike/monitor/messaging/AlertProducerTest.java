package com.spike.monitor.messaging;

import com.spike.monitor.alert.Alert;
import com.spike.monitor.alert.AlertHistoryEntry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AlertProducerTest {

    @Mock
    private KafkaTemplate<String, AlertHistoryEntry> kafkaTemplate;

    @Test
    void publishesEntryKeyedByLevel() {
        AlertProducer producer = new AlertProducer(kafkaTemplate);
        ReflectionTestUtils.setField(producer, "topic", "spike-alerts");
        AlertHistoryEntry entry = AlertHistoryEntry.builder()
                .alert(Alert.builder()
                        .timestamp(Instant.parse("2024-03-02T11:00:00Z"))
                        .reasons(List.of("Large-transaction surge in whale_tx_count (z=3.10)"))
                        .priorityScore(3)
                        .build())
                .dispatchedAt(Instant.parse("2024-03-02T11:00:01Z"))
                .build();
        CompletableFuture<SendResult<String, AlertHistoryEntry>> failed = new CompletableFuture<>();
        failed.completeExceptionally(new IllegalStateException("broker unavailable"));
        when(kafkaTemplate.send("spike-alerts", "MEDIUM", entry)).thenReturn(failed);

        producer.notify(entry);

        verify(kafkaTemplate).send("spike-alerts", "MEDIUM", entry);
    }
}
