package com.spike.monitor.config;

import com.spike.monitor.alert.AlertDispatcher;
import com.spike.monitor.alert.AlertHistory;
import com.spike.monitor.alert.AlertNotifier;
import com.spike.monitor.alert.CooldownState;
import com.spike.monitor.detect.SpikeDetectionService;
import com.spike.monitor.frame.TimeSeriesSource;
import com.spike.monitor.monitor.MonitorLoop;
import com.spike.monitor.scoring.SeverityScorer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the dispatch state and the monitor loop. Configuration is validated here, before any
 * evaluation can run.
 */
@Slf4j
@Configuration
public class MonitorConfig {

    private final MonitorProperties properties;

    public MonitorConfig(MonitorProperties properties) {
        properties.validate();
        this.properties = properties;
        log.info("Spike monitor configured: columns={}, zscore={}, ma={}%, roc={}% over {} rows, multi={}, window={} rows, families={}",
                properties.getMonitorColumns(), properties.getZscoreThreshold(), properties.getMaThresholdPct(),
                properties.getRocThresholdPct(), properties.getRocWindow(), properties.getMultiThreshold(),
                properties.getRollingWindow(), properties.getChannelFamilies());
    }

    @Bean
    @ConditionalOnMissingBean(Clock.class)
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public CooldownState cooldownState() {
        return new CooldownState();
    }

    @Bean
    public AlertDispatcher alertDispatcher(AlertHistory alertHistory, CooldownState cooldownState, Clock clock,
                                           ObjectProvider<AlertNotifier> notifiers) {
        return new AlertDispatcher(alertHistory, cooldownState, properties.cooldown(), clock,
                notifiers.orderedStream().toList());
    }

    @Bean
    public MonitorLoop monitorLoop(TimeSeriesSource source, SpikeDetectionService detectionService,
                                   SeverityScorer scorer, AlertDispatcher alertDispatcher, Clock clock) {
        return new MonitorLoop(source, detectionService, scorer, alertDispatcher, properties, clock);
    }
}
