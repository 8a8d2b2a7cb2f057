package com.spike.monitor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Entry point for the Spike Alert Monitor. Enables:
 * <ul>
 *   <li>Rolling Z-score, moving-average, rate-of-change, fusion and joint spike detection</li>
 *   <li>Severity scoring across signal families with co-occurrence bonuses</li>
 *   <li>Cooldown-gated alert dispatch with a persisted history (JPA)</li>
 *   <li>Kafka ingestion of observations and publication of alerts, webhooks (Resilience4j)</li>
 *   <li>REST API and OpenAPI docs at /swagger-ui/index.html</li>
 * </ul>
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class SpikeMonitorApplication {

    public static void main(String[] args) {
        SpringApplication.run(SpikeMonitorApplication.class, args);
    }
}
