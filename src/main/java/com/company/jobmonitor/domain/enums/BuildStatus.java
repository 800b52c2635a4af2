package com.company.jobmonitor.domain.enums;

public enum BuildStatus {
    SUCCESS("Build completed successfully"),
    FAILURE("Build failed"),
    UNSTABLE("Build completed with test failures"),
    ABORTED("Build was aborted"),
    UNKNOWN("Build is running or reported an unrecognized result");

    private final String description;

    BuildStatus(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    /** Terminal statuses that raise a failure alert. */
    public boolean isFailure() {
        return this == FAILURE || this == UNSTABLE || this == ABORTED;
    }

    public boolean isSuccessful() {
        return this == SUCCESS;
    }

    public static BuildStatus fromString(String status) {
        if (status == null) {
            return UNKNOWN;
        }
        try {
            return BuildStatus.valueOf(status.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return UNKNOWN;
        }
    }
}
