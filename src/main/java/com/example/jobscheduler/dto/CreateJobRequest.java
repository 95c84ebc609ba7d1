package com.example.jobscheduler.dto;

import com.example.jobscheduler.domain.enums.ExecutionType;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for creating a new job
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateJobRequest {

    /**
     * Six-field cron expression, e.g. "0 30 9 * * MON-FRI"
     */
    @NotBlank(message = "Schedule is required")
    private String schedule;

    /**
     * Absolute http(s) URL called for every occurrence
     */
    @NotBlank(message = "API endpoint is required")
    private String api;

    /**
     * Defaults to ATLEAST_ONCE
     */
    private ExecutionType type;
}
