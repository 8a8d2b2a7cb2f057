package com.spike.monitor.messaging;

import com.spike.monitor.alert.AlertHistoryEntry;
import com.spike.monitor.alert.AlertNotifier;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Supplier;

/**
 * POSTs each dispatched alert to the configured webhook URLs off the dispatch thread.
 * Delivery goes through the {@code alertWebhook} retry and circuit breaker instances.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "spike.monitor.webhook.enabled", havingValue = "true")
public class WebhookNotifier implements AlertNotifier {

    static final String INSTANCE = "alertWebhook";

    private final RestTemplate restTemplate;
    private final RetryRegistry retryRegistry;
    private final CircuitBreakerRegistry circuitBreakerRegistry;
    private final List<String> urls;
    private final Executor executor;

    @Autowired
    public WebhookNotifier(RetryRegistry retryRegistry,
                           CircuitBreakerRegistry circuitBreakerRegistry,
                           @Value("${spike.monitor.webhook.urls:}") List<String> urls,
                           @Value("${spike.monitor.webhook.timeout-ms:5000}") int timeoutMs) {
        this(restTemplate(timeoutMs), retryRegistry, circuitBreakerRegistry, urls, Executors.newFixedThreadPool(2));
    }

    WebhookNotifier(RestTemplate restTemplate, RetryRegistry retryRegistry, CircuitBreakerRegistry circuitBreakerRegistry,
                    List<String> urls, Executor executor) {
        this.restTemplate = restTemplate;
        this.retryRegistry = retryRegistry;
        this.circuitBreakerRegistry = circuitBreakerRegistry;
        this.urls = urls.stream().filter(u -> u != null && !u.isBlank()).toList();
        this.executor = executor;
        log.info("Webhook notifier enabled for {} url(s)", this.urls.size());
    }

    private static RestTemplate restTemplate(int timeoutMs) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(timeoutMs);
        factory.setReadTimeout(timeoutMs);
        return new RestTemplate(factory);
    }

    @Override
    public void notify(AlertHistoryEntry entry) {
        for (String url : urls) {
            CompletableFuture.runAsync(() -> deliver(url, entry), executor)
                    .exceptionally(ex -> {
                        log.error("Failed to schedule webhook delivery to {} for alert {}", url, entry.getAlertId(), ex);
                        return null;
                    });
        }
    }

    /** @return true when the webhook accepted the alert */
    boolean deliver(String url, AlertHistoryEntry entry) {
        CircuitBreaker cb = circuitBreakerRegistry.circuitBreaker(INSTANCE);
        Retry retry = retryRegistry.retry(INSTANCE);
        Supplier<ResponseEntity<String>> call = () -> restTemplate.postForEntity(url, entry, String.class);
        Supplier<ResponseEntity<String>> withRetry = Retry.decorateSupplier(retry, call);
        Supplier<ResponseEntity<String>> withCb = CircuitBreaker.decorateSupplier(cb, withRetry);
        try {
            ResponseEntity<String> response = withCb.get();
            log.info("Delivered alert {} to webhook {} status={}", entry.getAlertId(), url, response.getStatusCode());
            return true;
        } catch (CallNotPermittedException e) {
            log.warn("Webhook circuit open; alert {} not delivered to {}", entry.getAlertId(), url);
            return false;
        } catch (RuntimeException e) {
            log.error("Failed to deliver alert {} to webhook {} after retries", entry.getAlertId(), url, e);
            return false;
        }
    }

    @PreDestroy
    public void shutdown() {
        if (executor instanceof ExecutorService service) {
            service.shutdown();
        }
    }
}
