package com.company.jobmonitor.config;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.sdk.autoconfigure.AutoConfiguredOpenTelemetrySdk;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@Slf4j
public class OpenTelemetryConfig {

    @Bean
    public OpenTelemetry openTelemetry(MonitorProperties properties) {
        if (!properties.getTracing().isEnabled()) {
            log.debug("Tracing disabled, using no-op OpenTelemetry");
            return OpenTelemetry.noop();
        }
        log.info("Initializing OpenTelemetry SDK");
        return AutoConfiguredOpenTelemetrySdk.initialize().getOpenTelemetrySdk();
    }

    @Bean
    public Tracer tracer(OpenTelemetry openTelemetry) {
        return openTelemetry.getTracer("job-schedule-monitor");
    }
}
