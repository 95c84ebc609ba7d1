package com.example.jobscheduler.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Job count statistics
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobStatistics {

    private long totalJobs;
    private long activeJobs;
    private long inactiveJobs;

    /**
     * Jobs currently held by the in-memory scheduler
     */
    private int registeredJobs;

    private Instant generatedAt;
}
