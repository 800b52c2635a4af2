package com.company.jobmonitor.controller;

import com.company.jobmonitor.config.JobCatalog;
import com.company.jobmonitor.store.JobTrackingStore;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.HashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/health")
@Tag(name = "Health", description = "Health check endpoints")
@RequiredArgsConstructor
public class HealthController {

    private final JobCatalog catalog;
    private final JobTrackingStore trackingStore;
    private final Clock clock;

    @GetMapping
    @Operation(summary = "Health check")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new HashMap<>();
        response.put("status", "UP");
        response.put("timestamp", clock.instant());
        response.put("service", "job-schedule-monitor");
        response.put("version", "1.0.0");
        response.put("jobsConfigured", catalog.size());
        response.put("jobsTracked", trackingStore.size());

        return ResponseEntity.ok(response);
    }
}
