package com.example.jobscheduler.controller;

import com.example.jobscheduler.dto.ApiResponse;
import com.example.jobscheduler.dto.CreateJobRequest;
import com.example.jobscheduler.dto.JobResponse;
import com.example.jobscheduler.dto.UpdateJobRequest;
import com.example.jobscheduler.service.JobManagementService;
import com.example.jobscheduler.service.scheduler.JobSchedulerService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

/**
 * REST API controller for job management operations.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/jobs")
@Tag(name = "Job Management", description = "APIs for managing scheduled HTTP jobs")
public class JobController {

    private final JobManagementService jobManagementService;
    private final JobSchedulerService jobSchedulerService;

    @PostMapping
    @Operation(summary = "Create a new job", description = "Create a job that calls an endpoint on a cron schedule")
    public ResponseEntity<ApiResponse<JobResponse>> createJob(@Valid @RequestBody CreateJobRequest request) {
        log.info("API: Create job with schedule '{}' for {}", request.getSchedule(), request.getApi());

        var response = jobManagementService.createJob(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.success(response, "Job created successfully"));
    }

    @GetMapping
    @Operation(summary = "List jobs", description = "List all jobs, newest first")
    public ResponseEntity<ApiResponse<List<JobResponse>>> listJobs() {
        return ResponseEntity.ok(ApiResponse.success(jobManagementService.listJobs()));
    }

    @GetMapping("/{jobId}")
    @Operation(summary = "Get job by ID", description = "Retrieve a job with its next and last execution times")
    public ResponseEntity<ApiResponse<JobResponse>> getJob(@Parameter(description = "Job UUID") @PathVariable UUID jobId) {
        return ResponseEntity.ok(ApiResponse.success(jobManagementService.getJob(jobId)));
    }

    @PutMapping("/{jobId}")
    @Operation(summary = "Update a job", description = "Change schedule, endpoint, type or active flag")
    public ResponseEntity<ApiResponse<JobResponse>> updateJob(
            @Parameter(description = "Job UUID") @PathVariable UUID jobId,
            @RequestBody UpdateJobRequest request) {
        log.info("API: Update job {}", jobId);

        var response = jobManagementService.updateJob(jobId, request);
        return ResponseEntity.ok(ApiResponse.success(response, "Job updated successfully"));
    }

    @DeleteMapping("/{jobId}")
    @Operation(summary = "Delete a job", description = "Unschedule a job and delete it with its execution history")
    public ResponseEntity<ApiResponse<UUID>> deleteJob(@Parameter(description = "Job UUID") @PathVariable UUID jobId) {
        log.info("API: Delete job {}", jobId);

        jobManagementService.deleteJob(jobId);
        return ResponseEntity.ok(ApiResponse.success(jobId, "Job deleted successfully"));
    }

    // === Health Check ===

    @GetMapping("/health")
    @Operation(summary = "Health check", description = "Check if the job scheduler is ticking")
    public ResponseEntity<ApiResponse<String>> healthCheck() {
        if (!jobSchedulerService.isRunning()) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(ApiResponse.error("Job scheduler is not running"));
        }
        return ResponseEntity.ok(ApiResponse.success("OK", "Job scheduler is running"));
    }
}
