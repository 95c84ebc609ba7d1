package com.example.jobscheduler.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Recent failures of one job, as reported by the alert sweep
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FailureSummary {

    private UUID jobId;
    private String apiEndpoint;
    private long failureCount;
    private Instant lastFailure;
    private String lastError;
}
