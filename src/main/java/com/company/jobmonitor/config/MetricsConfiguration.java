package com.company.jobmonitor.config;

import com.company.jobmonitor.store.JobTrackingStore;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.binder.MeterBinder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Application-specific metrics
 */
@Configuration
@Slf4j
@RequiredArgsConstructor
public class MetricsConfiguration {

    private final JobTrackingStore trackingStore;
    private final JobCatalog catalog;

    @Bean
    public MeterBinder monitorMetrics() {
        return (registry) -> {
            Gauge.builder("monitor.jobs.configured", catalog, c -> c.enabledJobs().size())
                    .description("Number of enabled jobs being monitored")
                    .register(registry);

            Gauge.builder("monitor.jobs.tracked", trackingStore, JobTrackingStore::size)
                    .description("Number of jobs with a tracking record")
                    .register(registry);

            Gauge.builder("monitor.jobs.in_incident", trackingStore, JobTrackingStore::incidentCount)
                    .description("Number of jobs currently in a missed or failed state")
                    .register(registry);

            log.info("Custom metrics registered");
        };
    }
}
