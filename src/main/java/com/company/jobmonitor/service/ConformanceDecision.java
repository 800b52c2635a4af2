package com.company.jobmonitor.service;

import com.company.jobmonitor.domain.Incident;
import com.company.jobmonitor.domain.JobTrackingRecord;
import com.company.jobmonitor.domain.enums.CheckOutcome;
import lombok.Value;

import java.time.Instant;

@Value
public class ConformanceDecision {
    CheckOutcome outcome;
    /** Null when the check found nothing alert-worthy. */
    Incident incident;
    /** Record to commit for the job. */
    JobTrackingRecord record;
    Instant due;
}
