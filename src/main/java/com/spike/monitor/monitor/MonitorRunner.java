package com.spike.monitor.monitor;

import com.spike.monitor.config.MonitorProperties;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Starts continuous monitoring on a dedicated thread after startup and stops it on shutdown.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "spike.monitor.continuous.enabled", havingValue = "true")
public class MonitorRunner implements ApplicationRunner {

    private final MonitorLoop monitorLoop;
    private final MonitorProperties properties;
    private final ExecutorService executor = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "spike-monitor");
        t.setDaemon(true);
        return t;
    });

    @Override
    public void run(ApplicationArguments args) {
        long minutes = properties.getContinuous().getDurationMinutes();
        Duration duration = minutes > 0 ? Duration.ofMinutes(minutes) : null;
        executor.submit(() -> {
            try {
                monitorLoop.startMonitoring(duration);
            } catch (RuntimeException e) {
                log.error("Continuous monitoring terminated unexpectedly", e);
            }
        });
    }

    @PreDestroy
    public void stop() throws InterruptedException {
        monitorLoop.requestStop();
        executor.shutdown();
        if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
            log.warn("Monitor thread did not finish within 30s; forcing shutdown");
            executor.shutdownNow();
        }
    }
}
