package com.company.jobmonitor.controller;

import com.company.jobmonitor.dto.response.JobStatusResponse;
import com.company.jobmonitor.service.JobStatusService;
import io.micrometer.core.instrument.MeterRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.NotBlank;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.CacheControl;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.concurrent.TimeUnit;

@RestController
@RequestMapping("/api/v1/jobs")
@Tag(name = "Job Status", description = "Schedule conformance state of monitored Jenkins jobs")
@RequiredArgsConstructor
@Slf4j
@Validated
public class JobStatusController {

    private final JobStatusService statusService;
    private final MeterRegistry meterRegistry;

    @GetMapping
    @Operation(summary = "List all configured jobs with their current conformance state")
    public ResponseEntity<List<JobStatusResponse>> getAllJobs() {
        meterRegistry.counter("api.jobs.list.requests").increment();

        return ResponseEntity.ok()
                .cacheControl(CacheControl.maxAge(10, TimeUnit.SECONDS).cachePrivate())
                .body(statusService.getAllStatuses());
    }

    /**
     * Job names may contain folder separators, so the name travels as a query parameter.
     */
    @GetMapping("/status")
    @Operation(summary = "Get the conformance state of one job")
    public ResponseEntity<JobStatusResponse> getJobStatus(
            @Parameter(description = "Job name, e.g. team/nightly-build")
            @RequestParam("id") @NotBlank String jobName) {

        meterRegistry.counter("api.jobs.status.requests").increment();

        return ResponseEntity.ok()
                .cacheControl(CacheControl.maxAge(10, TimeUnit.SECONDS).cachePrivate())
                .body(statusService.getStatus(jobName));
    }
}
