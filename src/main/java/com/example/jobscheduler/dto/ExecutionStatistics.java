package com.example.jobscheduler.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Execution statistics over a time window
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExecutionStatistics {

    private int windowHours;
    private long totalExecutions;
    private long successfulExecutions;
    private long failedExecutions;
    private Double avgDurationMs;
    private Long minDurationMs;
    private Long maxDurationMs;

    /**
     * Average of execution time minus scheduled time
     */
    private Double avgDriftMs;

    private Instant generatedAt;
}
