package com.company.jobmonitor.exception;

public class JobNotFoundException extends RuntimeException {
    public JobNotFoundException(String jobId) {
        super("Job not configured: " + jobId);
    }
}
