package com.example.jobscheduler.dto;

import com.example.jobscheduler.domain.enums.ExecutionStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Response DTO for one recorded execution
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExecutionResponse {

    private UUID id;
    private UUID jobId;
    private Instant executionTimestamp;
    private Instant scheduledTimestamp;
    private Integer httpStatus;
    private Long executionDuration;
    private String responseBody;
    private String errorMessage;
    private ExecutionStatus status;
}
