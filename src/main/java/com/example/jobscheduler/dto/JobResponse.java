package com.example.jobscheduler.dto;

import com.example.jobscheduler.domain.enums.ExecutionType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Response DTO for job data
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobResponse {

    private UUID id;
    private String schedule;
    private String apiEndpoint;
    private ExecutionType type;
    private boolean active;
    private Instant createdAt;
    private Instant updatedAt;

    /**
     * Scheduler state, only present on detail requests for registered jobs
     */
    private Instant nextExecution;
    private Instant lastExecution;
}
