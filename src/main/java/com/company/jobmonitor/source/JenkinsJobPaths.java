package com.company.jobmonitor.source;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Maps job ids onto Jenkins URL paths. Nested jobs repeat the {@code /job/}
 * marker once per folder segment:
 * {@code folder/sub/name -> /job/folder/job/sub/job/name/api/json}.
 */
public final class JenkinsJobPaths {

    private static final String JOB_MARKER = "/job/";
    private static final String API_SUFFIX = "/api/json";

    private JenkinsJobPaths() {
    }

    public static String jobPath(String jobId) {
        Objects.requireNonNull(jobId, "jobId");
        if (jobId.isEmpty()) {
            throw new IllegalArgumentException("Job id must not be empty");
        }
        StringBuilder path = new StringBuilder();
        for (String segment : jobId.split("/", -1)) {
            if (segment.isEmpty()) {
                throw new IllegalArgumentException("Job id '" + jobId + "' has an empty segment");
            }
            path.append(JOB_MARKER).append(encodeSegment(segment));
        }
        return path.toString();
    }

    public static String apiPath(String jobId) {
        return jobPath(jobId) + API_SUFFIX;
    }

    /** Browser URL of a job, used in alert bodies. */
    public static String jobUrl(String baseUrl, String jobId) {
        return trimTrailingSlash(baseUrl) + jobPath(jobId) + "/";
    }

    /**
     * API URL of a build from the {@code lastBuild.url} Jenkins reported. A missing
     * trailing slash and unencoded spaces are tolerated. When Jenkins reports a
     * host other than the configured one (e.g. its internal IP), the build path
     * is re-homed onto the configured base.
     */
    public static String buildApiUrl(String reportedBuildUrl, String configuredBase) {
        String raw = reportedBuildUrl.trim();
        if (!raw.endsWith("/")) {
            raw = raw + "/";
        }

        URI build;
        try {
            build = new URI(raw);
        } catch (URISyntaxException e) {
            try {
                build = new URI(raw.replace(" ", "%20"));
            } catch (URISyntaxException again) {
                throw new IllegalArgumentException("Invalid build URL from Jenkins: " + reportedBuildUrl, again);
            }
        }

        URI base = URI.create(trimTrailingSlash(configuredBase) + "/");
        boolean sameHost = Objects.equals(lowerCase(build.getScheme()), lowerCase(base.getScheme()))
                && Objects.equals(lowerCase(build.getHost()), lowerCase(base.getHost()));
        if (sameHost) {
            return build.resolve("api/json").toString();
        }
        return base.resolve(build.getRawPath()).resolve("api/json").toString();
    }

    static String encodeSegment(String segment) {
        return URLEncoder.encode(segment, StandardCharsets.UTF_8).replace("+", "%20");
    }

    static String trimTrailingSlash(String url) {
        String result = url.trim();
        while (result.endsWith("/")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }

    private static String lowerCase(String value) {
        return value == null ? null : value.toLowerCase();
    }
}
