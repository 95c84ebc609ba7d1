package com.example.jobscheduler.controller;

import com.example.jobscheduler.dto.ApiResponse;
import com.example.jobscheduler.dto.ExecutionStatistics;
import com.example.jobscheduler.dto.FailureSummary;
import com.example.jobscheduler.dto.JobStatistics;
import com.example.jobscheduler.service.ObservabilityService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

/**
 * REST API controller for scheduler statistics.
 * Raw time series are exported through /actuator/prometheus.
 */
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/observability")
@Tag(name = "Observability", description = "Job and execution statistics")
public class ObservabilityController {

    private final ObservabilityService observabilityService;

    @GetMapping("/stats/jobs")
    @Operation(summary = "Job statistics", description = "Total, active, inactive and registered job counts")
    public ResponseEntity<ApiResponse<JobStatistics>> getJobStatistics() {
        return ResponseEntity.ok(ApiResponse.success(observabilityService.getJobStatistics()));
    }

    @GetMapping("/stats/executions")
    @Operation(summary = "Execution statistics", description = "Counts, durations and drift over the last N hours")
    public ResponseEntity<ApiResponse<ExecutionStatistics>> getExecutionStatistics(
            @Parameter(description = "Window in hours") @RequestParam(defaultValue = "24") int hours) {
        return ResponseEntity.ok(ApiResponse.success(observabilityService.getExecutionStatistics(hours)));
    }

    @GetMapping("/stats/jobs/{jobId}")
    @Operation(summary = "Execution statistics of one job", description = "Counts, durations and drift of one job over the last N hours")
    public ResponseEntity<ApiResponse<ExecutionStatistics>> getJobExecutionStatistics(
            @Parameter(description = "Job UUID") @PathVariable UUID jobId,
            @Parameter(description = "Window in hours") @RequestParam(defaultValue = "24") int hours) {
        return observabilityService.getJobExecutionStatistics(jobId, hours)
                .map(stats -> ResponseEntity.ok(ApiResponse.success(stats)))
                .orElse(ResponseEntity.status(HttpStatus.NOT_FOUND)
                        .body(ApiResponse.error("No executions found for this job in the specified time range")));
    }

    @GetMapping("/alerts/failures")
    @Operation(summary = "Recent failures", description = "Jobs with failed executions over the last N hours, most failures first")
    public ResponseEntity<ApiResponse<List<FailureSummary>>> getRecentFailures(
            @Parameter(description = "Window in hours") @RequestParam(defaultValue = "1") int hours) {
        if (hours < 1) {
            throw new IllegalArgumentException("hours must be at least 1");
        }
        return ResponseEntity.ok(ApiResponse.success(observabilityService.getRecentFailures(hours * 60, false)));
    }
}
