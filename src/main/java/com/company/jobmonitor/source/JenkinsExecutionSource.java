package com.company.jobmonitor.source;

import com.company.jobmonitor.config.MonitorProperties;
import com.company.jobmonitor.domain.ExecutionInfo;
import com.company.jobmonitor.domain.JobSpec;
import com.company.jobmonitor.domain.enums.BuildStatus;
import com.company.jobmonitor.exception.SourceUnavailableException;
import com.company.jobmonitor.exception.SourceUnavailableException.Reason;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.Base64;

/**
 * Reads the latest build of a job from the Jenkins JSON API.
 * <p>
 * The job view is fetched with a {@code tree} filter so that one request usually
 * carries the whole last build. If the build timestamp is missing the build's own
 * API endpoint is read from {@code lastBuild.url}.
 */
@Component
@Slf4j
public class JenkinsExecutionSource implements ExecutionSource {

    static final String JOB_TREE = "name,lastBuild[number,url,timestamp,result,building]";

    private final MonitorProperties.Jenkins config;
    private final String baseUrl;
    private final HttpClient http;
    private final ObjectMapper objectMapper;
    private final CircuitBreaker circuitBreaker;
    private final Clock clock;

    public JenkinsExecutionSource(MonitorProperties properties,
                                  HttpClient jenkinsHttpClient,
                                  ObjectMapper objectMapper,
                                  CircuitBreaker jenkinsCircuitBreaker,
                                  Clock clock) {
        this.config = properties.getJenkins();
        this.baseUrl = JenkinsJobPaths.trimTrailingSlash(config.getUrl());
        this.http = jenkinsHttpClient;
        this.objectMapper = objectMapper;
        this.circuitBreaker = jenkinsCircuitBreaker;
        this.clock = clock;
    }

    @Override
    public ExecutionInfo fetchLatestExecution(JobSpec job) {
        Instant observedAt = clock.instant();
        String jobUrl = baseUrl + JenkinsJobPaths.apiPath(job.getId())
                + "?tree=" + URLEncoder.encode(JOB_TREE, StandardCharsets.UTF_8);

        log.debug("Fetching job info from: {}", jobUrl);
        JsonNode jobNode = getJson(jobUrl, job.getId());

        JsonNode lastBuild = jobNode.path("lastBuild");
        if (lastBuild.isMissingNode() || lastBuild.isNull()) {
            log.debug("Job '{}' has never been built", job.getId());
            return ExecutionInfo.neverBuilt(observedAt);
        }

        if (!lastBuild.hasNonNull("timestamp")) {
            String reportedUrl = lastBuild.path("url").asText(null);
            if (reportedUrl == null || reportedUrl.isBlank()) {
                throw new SourceUnavailableException(Reason.PARSE,
                        "Job '" + job.getId() + "' reports a last build without timestamp or url");
            }
            String buildUrl;
            try {
                buildUrl = JenkinsJobPaths.buildApiUrl(reportedUrl, baseUrl);
            } catch (IllegalArgumentException e) {
                throw new SourceUnavailableException(Reason.PARSE, e.getMessage(), e);
            }
            log.debug("Fetching build details from: {}", buildUrl);
            lastBuild = getJson(buildUrl, job.getId());
        }

        return toExecutionInfo(lastBuild, observedAt);
    }

    @Override
    public void verifyConnection() {
        getJson(baseUrl + "/api/json?tree=mode", "(root)");
    }

    ExecutionInfo toExecutionInfo(JsonNode build, Instant observedAt) {
        if (!build.hasNonNull("timestamp")) {
            throw new SourceUnavailableException(Reason.PARSE, "Build details carry no timestamp");
        }
        String result = build.hasNonNull("result") ? build.get("result").asText() : null;

        return ExecutionInfo.builder()
                .observedAt(observedAt)
                .lastBuildTime(Instant.ofEpochMilli(build.get("timestamp").asLong()))
                .lastBuildStatus(BuildStatus.fromString(result))
                .lastBuildNumber(build.hasNonNull("number") ? build.get("number").asLong() : null)
                .lastBuildUrl(build.path("url").asText(null))
                .build();
    }

    private JsonNode getJson(String url, String jobId) {
        try {
            return circuitBreaker.executeSupplier(() -> doGet(url, jobId));
        } catch (CallNotPermittedException e) {
            throw new SourceUnavailableException(Reason.CIRCUIT_OPEN,
                    "Jenkins circuit breaker is open, skipping request for job '" + jobId + "'", e);
        }
    }

    private JsonNode doGet(String url, String jobId) {
        HttpRequest request;
        try {
            HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(url))
                    .timeout(config.getTimeout())
                    .header("Accept", "application/json")
                    .GET();
            if (config.hasCredentials()) {
                builder.header("Authorization", basicAuth(config.getUsername(), config.getApiToken()));
            }
            request = builder.build();
        } catch (IllegalArgumentException e) {
            throw new SourceUnavailableException(Reason.PARSE, "Invalid Jenkins URL: " + url, e);
        }

        HttpResponse<String> response;
        try {
            response = http.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (HttpTimeoutException e) {
            throw new SourceUnavailableException(Reason.TIMEOUT,
                    "Timed out after " + config.getTimeout().toSeconds() + "s fetching " + url, e);
        } catch (IOException e) {
            throw new SourceUnavailableException(Reason.NETWORK,
                    "Failed to fetch job info for '" + jobId + "': " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SourceUnavailableException(Reason.NETWORK,
                    "Interrupted while fetching job info for '" + jobId + "'", e);
        }

        int status = response.statusCode();
        if (status == 401 || status == 403) {
            throw new SourceUnavailableException(Reason.AUTH,
                    "Jenkins rejected credentials (" + status + ") for job '" + jobId + "'");
        }
        if (status == 404) {
            throw new SourceUnavailableException(Reason.NOT_FOUND,
                    "Jenkins has no job '" + jobId + "' at " + url);
        }
        if (status >= 500) {
            throw new SourceUnavailableException(Reason.SERVER_ERROR,
                    "Jenkins API returned error status " + status + " for job '" + jobId + "'");
        }
        if (status < 200 || status >= 300) {
            throw new SourceUnavailableException(Reason.HTTP_STATUS,
                    "Jenkins API returned unexpected status " + status + " for job '" + jobId + "'");
        }

        try {
            return objectMapper.readTree(response.body());
        } catch (JsonProcessingException e) {
            throw new SourceUnavailableException(Reason.PARSE,
                    "Failed to parse JSON response for job '" + jobId + "'", e);
        }
    }

    private static String basicAuth(String username, String token) {
        String raw = username + ":" + token;
        return "Basic " + Base64.getEncoder().encodeToString(raw.getBytes(StandardCharsets.UTF_8));
    }
}
