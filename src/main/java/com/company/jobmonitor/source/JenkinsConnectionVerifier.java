package com.company.jobmonitor.source;

import com.company.jobmonitor.config.MonitorProperties;
import com.company.jobmonitor.exception.SourceUnavailableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Probes Jenkins once at startup. An unreachable server is only a warning since
 * every cycle retries anyway.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(
        value = "monitor.jenkins.verify-on-startup",
        havingValue = "true",
        matchIfMissing = true
)
public class JenkinsConnectionVerifier implements ApplicationRunner {

    private final ExecutionSource executionSource;
    private final MonitorProperties properties;

    @Override
    public void run(ApplicationArguments args) {
        String url = properties.getJenkins().getUrl();
        log.info("Testing Jenkins connection to {}", url);
        try {
            executionSource.verifyConnection();
            log.info("Successfully connected to Jenkins");
        } catch (SourceUnavailableException e) {
            log.warn("Failed to connect to Jenkins at {} ({}): {}. Monitoring will continue and retry every cycle",
                    url, e.getReason(), e.getMessage());
        }
    }
}
