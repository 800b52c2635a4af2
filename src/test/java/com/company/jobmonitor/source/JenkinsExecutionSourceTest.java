package com.company.jobmonitor.source;

import com.company.jobmonitor.config.MonitorConfiguration;
import com.company.jobmonitor.config.MonitorProperties;
import com.company.jobmonitor.domain.ExecutionInfo;
import com.company.jobmonitor.domain.JobSpec;
import com.company.jobmonitor.domain.enums.BuildStatus;
import com.company.jobmonitor.exception.SourceUnavailableException;
import com.company.jobmonitor.exception.SourceUnavailableException.Reason;
import com.company.jobmonitor.schedule.CronSchedule;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Jenkins execution source")
class JenkinsExecutionSourceTest {

    private static final Instant NOW = Instant.parse("2025-01-02T03:45:00Z");

    private MockWebServer server;
    private MonitorProperties properties;
    private CircuitBreaker circuitBreaker;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();

        properties = new MonitorProperties();
        properties.getJenkins().setUrl(server.url("/").toString());
        properties.getJenkins().setTimeout(Duration.ofSeconds(2));
        circuitBreaker = CircuitBreaker.ofDefaults("test");
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
    }

    private JenkinsExecutionSource source() {
        return new JenkinsExecutionSource(properties, HttpClient.newHttpClient(), new ObjectMapper(),
                circuitBreaker, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static JobSpec job(String id) {
        return JobSpec.builder()
                .id(id)
                .cronExpression("0 0 2 * * *")
                .schedule(CronSchedule.parse("0 0 2 * * *"))
                .alertThreshold(Duration.ofMinutes(90))
                .enabled(true)
                .build();
    }

    private static MockResponse json(String body) {
        return new MockResponse().setHeader("Content-Type", "application/json").setBody(body);
    }

    @Test
    @DisplayName("reads the last build from the job view of a nested job")
    void reads_last_build() throws Exception {
        server.enqueue(json("""
                {"name":"nightly-build","lastBuild":{"number":42,"url":"http://jenkins/job/team/job/nightly-build/42/",
                 "timestamp":1735783210000,"result":"FAILURE","building":false}}
                """));

        ExecutionInfo info = source().fetchLatestExecution(job("team/nightly-build"));

        assertThat(info.getObservedAt()).isEqualTo(NOW);
        assertThat(info.getLastBuildTime()).isEqualTo(Instant.parse("2025-01-02T02:00:10Z"));
        assertThat(info.getLastBuildNumber()).isEqualTo(42L);
        assertThat(info.getLastBuildStatus()).isEqualTo(BuildStatus.FAILURE);
        assertThat(info.getLastBuildUrl()).endsWith("/42/");

        RecordedRequest request = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(request.getPath()).startsWith("/job/team/job/nightly-build/api/json?tree=");
        assertThat(request.getHeader("Accept")).isEqualTo("application/json");
        assertThat(request.getHeader("Authorization")).isNull();
    }

    @Test
    @DisplayName("sends basic auth when username and API token are configured")
    void sends_basic_auth() throws Exception {
        properties.getJenkins().setUsername("monitor");
        properties.getJenkins().setApiToken("s3cret");
        server.enqueue(json("{\"lastBuild\":{\"number\":1,\"timestamp\":1735783210000,\"result\":\"SUCCESS\"}}"));

        source().fetchLatestExecution(job("nightly"));

        // monitor:s3cret
        assertThat(server.takeRequest().getHeader("Authorization")).isEqualTo("Basic bW9uaXRvcjpzM2NyZXQ=");
    }

    @Test
    @DisplayName("a job without builds yields no build time")
    void never_built() {
        server.enqueue(json("{\"name\":\"fresh\",\"lastBuild\":null}"));

        ExecutionInfo info = source().fetchLatestExecution(job("fresh"));

        assertThat(info.hasBuild()).isFalse();
        assertThat(info.getLastBuildStatus()).isEqualTo(BuildStatus.UNKNOWN);
    }

    @Test
    @DisplayName("an in-progress build has no result and maps to UNKNOWN")
    void running_build_is_unknown() {
        server.enqueue(json("{\"lastBuild\":{\"number\":9,\"timestamp\":1735783210000,\"result\":null,\"building\":true}}"));

        ExecutionInfo info = source().fetchLatestExecution(job("nightly"));

        assertThat(info.getLastBuildStatus()).isEqualTo(BuildStatus.UNKNOWN);
        assertThat(info.hasBuild()).isTrue();
    }

    @Test
    @DisplayName("follows lastBuild.url when the job view carries no timestamp")
    void follows_build_url() throws Exception {
        String buildUrl = server.url("/job/nightly/12").toString();
        server.enqueue(json("{\"lastBuild\":{\"number\":12,\"url\":\"" + buildUrl + "\"}}"));
        server.enqueue(json("{\"number\":12,\"timestamp\":1735783210000,\"result\":\"SUCCESS\"}"));

        ExecutionInfo info = source().fetchLatestExecution(job("nightly"));

        assertThat(info.getLastBuildNumber()).isEqualTo(12L);
        assertThat(info.getLastBuildStatus()).isEqualTo(BuildStatus.SUCCESS);
        server.takeRequest();
        assertThat(server.takeRequest().getPath()).isEqualTo("/job/nightly/12/api/json");
    }

    @Test
    @DisplayName("HTTP errors map to source-unavailable reasons")
    void maps_http_errors() {
        server.enqueue(new MockResponse().setResponseCode(401));
        server.enqueue(new MockResponse().setResponseCode(404));
        server.enqueue(new MockResponse().setResponseCode(503));
        server.enqueue(new MockResponse().setResponseCode(302));
        JenkinsExecutionSource source = source();

        assertThat(reasonOf(() -> source.fetchLatestExecution(job("a")))).isEqualTo(Reason.AUTH);
        assertThat(reasonOf(() -> source.fetchLatestExecution(job("a")))).isEqualTo(Reason.NOT_FOUND);
        assertThat(reasonOf(() -> source.fetchLatestExecution(job("a")))).isEqualTo(Reason.SERVER_ERROR);
        assertThat(reasonOf(() -> source.fetchLatestExecution(job("a")))).isEqualTo(Reason.HTTP_STATUS);
    }

    @Test
    @DisplayName("malformed JSON is a parse failure")
    void maps_parse_errors() {
        server.enqueue(json("<html>login</html>"));

        assertThat(reasonOf(() -> source().fetchLatestExecution(job("a")))).isEqualTo(Reason.PARSE);
    }

    @Test
    @DisplayName("a slow server times out instead of hanging the check")
    void times_out() {
        properties.getJenkins().setTimeout(Duration.ofMillis(300));
        server.enqueue(json("{}").setHeadersDelay(3, TimeUnit.SECONDS));

        assertThat(reasonOf(() -> source().fetchLatestExecution(job("a")))).isEqualTo(Reason.TIMEOUT);
    }

    @Test
    @DisplayName("an unreachable server is a network failure")
    void unreachable_server() throws Exception {
        MockWebServer gone = new MockWebServer();
        gone.start();
        properties.getJenkins().setUrl(gone.url("/").toString());
        gone.shutdown();

        assertThat(reasonOf(() -> source().fetchLatestExecution(job("a")))).isEqualTo(Reason.NETWORK);
    }

    @Test
    @DisplayName("an open circuit fails fast without calling Jenkins")
    void open_circuit_fails_fast() {
        circuitBreaker.transitionToOpenState();

        assertThat(reasonOf(() -> source().fetchLatestExecution(job("a")))).isEqualTo(Reason.CIRCUIT_OPEN);
        assertThat(server.getRequestCount()).isZero();
    }

    @Test
    @DisplayName("only transport failures count towards opening the circuit")
    void circuit_counts_transport_failures_only() {
        properties.getJenkins().getCircuitBreaker().setSlidingWindowSize(2);
        properties.getJenkins().getCircuitBreaker().setMinimumNumberOfCalls(2);
        circuitBreaker = new MonitorConfiguration().jenkinsCircuitBreaker(properties);
        JenkinsExecutionSource source = source();

        server.enqueue(new MockResponse().setResponseCode(404));
        server.enqueue(new MockResponse().setResponseCode(404));
        reasonOf(() -> source.fetchLatestExecution(job("a")));
        reasonOf(() -> source.fetchLatestExecution(job("a")));
        assertThat(circuitBreaker.getState()).isEqualTo(CircuitBreaker.State.CLOSED);

        server.enqueue(new MockResponse().setResponseCode(500));
        server.enqueue(new MockResponse().setResponseCode(500));
        reasonOf(() -> source.fetchLatestExecution(job("a")));
        reasonOf(() -> source.fetchLatestExecution(job("a")));
        assertThat(circuitBreaker.getState()).isEqualTo(CircuitBreaker.State.OPEN);
    }

    @Test
    @DisplayName("connection check hits the root API")
    void verify_connection() throws Exception {
        server.enqueue(json("{\"mode\":\"NORMAL\"}"));

        source().verifyConnection();

        assertThat(server.takeRequest().getPath()).isEqualTo("/api/json?tree=mode");
    }

    private static Reason reasonOf(Runnable call) {
        Throwable thrown = catchThrowable(call::run);
        assertThat(thrown).isInstanceOf(SourceUnavailableException.class);
        return ((SourceUnavailableException) thrown).getReason();
    }
}
