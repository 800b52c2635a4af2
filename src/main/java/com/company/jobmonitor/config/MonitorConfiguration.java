package com.company.jobmonitor.config;

import com.company.jobmonitor.exception.SourceUnavailableException;
import com.company.jobmonitor.service.ConformanceDecider;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Core wiring: validated job catalog, Jenkins transport and the check worker pool.
 */
@Configuration
@Slf4j
@EnableConfigurationProperties(MonitorProperties.class)
public class MonitorConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public JobCatalog jobCatalog(MonitorProperties properties, Clock clock) {
        return JobCatalog.fromProperties(properties, clock);
    }

    @Bean
    public ConformanceDecider conformanceDecider(MonitorProperties properties) {
        log.info("First observation policy: {}", properties.getEngine().getFirstObservationPolicy());
        return new ConformanceDecider(properties.getEngine().getFirstObservationPolicy());
    }

    @Bean
    public HttpClient jenkinsHttpClient(MonitorProperties properties) {
        return HttpClient.newBuilder()
                .connectTimeout(properties.getJenkins().getTimeout())
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    /**
     * Opens after repeated transport failures (timeouts, connection errors, 5xx).
     * Auth, not-found and parse errors are answers from a reachable server and do
     * not count.
     */
    @Bean
    public CircuitBreaker jenkinsCircuitBreaker(MonitorProperties properties) {
        MonitorProperties.CircuitBreaker cb = properties.getJenkins().getCircuitBreaker();

        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .failureRateThreshold(cb.getFailureRateThreshold())
                .slidingWindowSize(cb.getSlidingWindowSize())
                .minimumNumberOfCalls(cb.getMinimumNumberOfCalls())
                .waitDurationInOpenState(cb.getWaitInOpenState())
                .recordException(e -> e instanceof SourceUnavailableException
                        && ((SourceUnavailableException) e).getReason().isTransportFailure())
                .build();

        CircuitBreaker breaker = CircuitBreaker.of("jenkins", config);
        breaker.getEventPublisher().onStateTransition(event ->
                log.warn("Jenkins circuit breaker: {}", event.getStateTransition()));
        return breaker;
    }

    /** Shut down by the container on close. */
    @Bean
    public ExecutorService monitorExecutor(MonitorProperties properties) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable, "job-check-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newFixedThreadPool(properties.getWorkerThreads(), threadFactory);
    }
}
