package com.spike.monitor.messaging;

import com.spike.monitor.alert.Alert;
import com.spike.monitor.alert.AlertHistoryEntry;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.Executor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for WebhookNotifier: retry, circuit breaker and fan-out to every URL.
 */
@ExtendWith(MockitoExtension.class)
class WebhookNotifierTest {

    private static final String URL = "http://hooks.example.test/alerts";
    private static final Executor DIRECT = Runnable::run;

    @Mock
    private RestTemplate restTemplate;

    private RetryRegistry retryRegistry;
    private CircuitBreakerRegistry circuitBreakerRegistry;
    private AlertHistoryEntry entry;

    @BeforeEach
    void setUp() {
        retryRegistry = RetryRegistry.of(RetryConfig.custom()
                .maxAttempts(3)
                .waitDuration(Duration.ofMillis(1))
                .build());
        circuitBreakerRegistry = CircuitBreakerRegistry.ofDefaults();
        Alert alert = Alert.builder()
                .alertId("alert-1")
                .timestamp(Instant.parse("2024-03-02T11:00:00Z"))
                .reasons(List.of("All three signal families surging (CRITICAL)"))
                .priorityScore(26)
                .build();
        entry = AlertHistoryEntry.builder().alert(alert).dispatchedAt(Instant.parse("2024-03-02T11:00:05Z")).build();
    }

    @Test
    void deliverPostsEntry() {
        when(restTemplate.postForEntity(eq(URL), any(), eq(String.class))).thenReturn(ResponseEntity.ok("ok"));
        WebhookNotifier notifier = notifier(List.of(URL));

        assertThat(notifier.deliver(URL, entry)).isTrue();
        verify(restTemplate).postForEntity(URL, entry, String.class);
    }

    @Test
    void deliverRetriesThenGivesUp() {
        when(restTemplate.postForEntity(eq(URL), any(), eq(String.class)))
                .thenThrow(new ResourceAccessException("connection refused"));
        WebhookNotifier notifier = notifier(List.of(URL));

        assertThat(notifier.deliver(URL, entry)).isFalse();
        verify(restTemplate, times(3)).postForEntity(eq(URL), any(), eq(String.class));
    }

    @Test
    void openCircuitSkipsCall() {
        circuitBreakerRegistry.circuitBreaker(WebhookNotifier.INSTANCE).transitionToOpenState();
        WebhookNotifier notifier = notifier(List.of(URL));

        assertThat(notifier.deliver(URL, entry)).isFalse();
        verify(restTemplate, never()).postForEntity(eq(URL), any(), eq(String.class));
    }

    @Test
    void notifyFansOutToEveryConfiguredUrl() {
        String second = "http://ops.example.test/hook";
        when(restTemplate.postForEntity(any(String.class), any(), eq(String.class))).thenReturn(ResponseEntity.ok("ok"));
        WebhookNotifier notifier = notifier(List.of(URL, " ", second));

        notifier.notify(entry);

        verify(restTemplate).postForEntity(URL, entry, String.class);
        verify(restTemplate).postForEntity(second, entry, String.class);
    }

    private WebhookNotifier notifier(List<String> urls) {
        return new WebhookNotifier(restTemplate, retryRegistry, circuitBreakerRegistry, urls, DIRECT);
    }
}
