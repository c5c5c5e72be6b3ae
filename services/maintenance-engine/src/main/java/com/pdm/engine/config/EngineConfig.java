package com.pdm.engine.config;

import com.pdm.engine.history.HistoricalRecordsProvider;
import com.pdm.engine.history.SeededHistoricalRecordsProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;

/**
 * Engine infrastructure: time source, the scheduler equipment assessments
 * run on, and the history provider.
 */
@Slf4j
@Configuration
public class EngineConfig {

    private static final int QUEUED_TASK_CAP = 10_000;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(destroyMethod = "dispose")
    public Scheduler analysisScheduler(@Value("${pdm.engine.concurrency:8}") int concurrency) {
        return Schedulers.newBoundedElastic(Math.max(1, concurrency), QUEUED_TASK_CAP, "pdm-analysis");
    }

    @Bean
    @ConditionalOnProperty(name = "pdm.history.provider", havingValue = "seeded")
    public HistoricalRecordsProvider seededHistoricalRecordsProvider(
            @Value("${pdm.history.work-order-issues}") Resource workOrderIssues,
            Clock clock) {
        log.warn("Using seeded demo maintenance history; connect a CMMS-backed provider for production");
        return SeededHistoricalRecordsProvider.fromResource(workOrderIssues, clock);
    }

    @Bean
    @ConditionalOnProperty(name = "pdm.history.provider", havingValue = "none", matchIfMissing = true)
    public HistoricalRecordsProvider emptyHistoricalRecordsProvider() {
        log.info("No maintenance-history provider configured; assessments use OEM data and live readings only");
        return HistoricalRecordsProvider.none();
    }
}
