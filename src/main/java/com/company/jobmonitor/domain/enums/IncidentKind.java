package com.company.jobmonitor.domain.enums;

public enum IncidentKind {
    MISSED("Job did not run within its alert threshold after a scheduled instant"),
    FAILED("Latest build finished with a failing status"),
    RECOVERED("Job is back on schedule with a successful build");

    private final String description;

    IncidentKind(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
