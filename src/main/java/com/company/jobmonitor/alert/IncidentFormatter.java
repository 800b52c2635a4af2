package com.company.jobmonitor.alert;

import com.company.jobmonitor.config.MonitorProperties;
import com.company.jobmonitor.domain.Incident;
import com.company.jobmonitor.source.JenkinsJobPaths;
import com.company.jobmonitor.util.TimeUtils;
import org.springframework.stereotype.Component;

/**
 * Renders incidents as plain-text alert messages.
 */
@Component
public class IncidentFormatter {

    private final String jenkinsUrl;

    public IncidentFormatter(MonitorProperties properties) {
        this.jenkinsUrl = properties.getJenkins().getUrl();
    }

    public String subject(Incident incident) {
        switch (incident.getKind()) {
            case FAILED:
                return "Jenkins Job Failure: " + incident.getJobId();
            case RECOVERED:
                return "Jenkins Job Recovered: " + incident.getJobId();
            default:
                return "Jenkins Job Alert: " + incident.getJobId();
        }
    }

    public String body(Incident incident) {
        StringBuilder body = new StringBuilder();
        body.append("Jenkins Monitor Alert\n\n");
        body.append("Job: ").append(incident.getJobId()).append('\n');
        body.append("Status: ").append(statusLine(incident)).append("\n\n");

        body.append("Expected Schedule: ").append(incident.getSchedule()).append('\n');
        body.append("Last Expected Run: ").append(TimeUtils.formatInstant(incident.getExpectedAt())).append('\n');

        if (incident.getLastBuildTime() != null) {
            body.append("Last Build: ").append(TimeUtils.formatInstant(incident.getLastBuildTime()));
            if (incident.getLastBuildNumber() != null) {
                body.append(" (Build #").append(incident.getLastBuildNumber()).append(')');
            }
            body.append('\n');
            body.append("Build Result: ")
                    .append(incident.getLastBuildStatus() == null ? "UNKNOWN" : incident.getLastBuildStatus())
                    .append('\n');
            body.append("Time Since Last Build: ")
                    .append(TimeUtils.minutesBetween(incident.getLastBuildTime(), incident.getDetectedAt()))
                    .append(" minutes\n");
        } else {
            body.append("Last Build: None\n");
        }
        body.append("Alert Threshold: ").append(incident.getAlertThreshold().toMinutes()).append(" minutes\n");
        body.append("Detected At: ").append(TimeUtils.formatInstant(incident.getDetectedAt())).append("\n\n");

        if (incident.getSummary() != null) {
            body.append(incident.getSummary()).append("\n\n");
        }
        body.append(advice(incident)).append("\n\n");
        body.append("Jenkins URL: ").append(JenkinsJobPaths.jobUrl(jenkinsUrl, incident.getJobId())).append('\n');
        return body.toString();
    }

    private String statusLine(Incident incident) {
        switch (incident.getKind()) {
            case FAILED:
                return "Latest build failed";
            case RECOVERED:
                return "Job is running as expected again";
            default:
                return incident.getLastBuildTime() == null ? "No builds found" : "Job has not run as expected";
        }
    }

    private String advice(Incident incident) {
        switch (incident.getKind()) {
            case FAILED:
                return "The latest build finished with a failing status.\nPlease check the build log in Jenkins.";
            case RECOVERED:
                return "No action required.";
            default:
                return "The job has not run since the expected time plus the configured threshold.\n"
                        + "Please check Jenkins for issues.";
        }
    }
}
