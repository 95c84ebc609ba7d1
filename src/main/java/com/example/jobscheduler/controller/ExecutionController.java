package com.example.jobscheduler.controller;

import com.example.jobscheduler.dto.ApiResponse;
import com.example.jobscheduler.dto.ExecutionResponse;
import com.example.jobscheduler.dto.JobExecutionsResponse;
import com.example.jobscheduler.service.JobManagementService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

/**
 * REST API controller for execution history.
 */
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/executions")
@Tag(name = "Executions", description = "APIs for job execution history")
public class ExecutionController {

    private final JobManagementService jobManagementService;

    @GetMapping("/{jobId}")
    @Operation(summary = "Latest executions of a job", description = "Get the last N executions of a job, newest first")
    public ResponseEntity<ApiResponse<JobExecutionsResponse>> getJobExecutions(
            @Parameter(description = "Job UUID") @PathVariable UUID jobId,
            @Parameter(description = "Number of executions (default 5)") @RequestParam(required = false) Integer limit) {
        return ResponseEntity.ok(ApiResponse.success(jobManagementService.getJobExecutions(jobId, limit)));
    }

    @GetMapping
    @Operation(summary = "List executions", description = "Page through all executions, optionally for one job")
    public ResponseEntity<ApiResponse<Page<ExecutionResponse>>> listExecutions(
            @Parameter(description = "Job filter") @RequestParam(required = false) UUID jobId,
            @Parameter(description = "Page number") @RequestParam(defaultValue = "0") int page,
            @Parameter(description = "Page size") @RequestParam(defaultValue = "50") int size) {
        return ResponseEntity.ok(ApiResponse.success(jobManagementService.listExecutions(jobId, page, size)));
    }
}
