package com.example.jobscheduler.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.UUID;

/**
 * Latest executions of a single job, newest first
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobExecutionsResponse {

    private UUID jobId;
    private List<ExecutionResponse> executions;
    private int count;
}
