package com.example.jobscheduler.service.executor;

import com.example.jobscheduler.domain.enums.ExecutionStatus;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * Represents the result of one job call.
 * <p>
 * Contains everything needed to write the execution row.
 */
@Data
@Builder
public class ExecutionResult {

    private ExecutionStatus status;

    /**
     * When the call was started
     */
    private Instant executedAt;

    /**
     * HTTP status code, absent when no response arrived
     */
    private Integer httpStatus;

    /**
     * Response body, truncated
     */
    private String responseBody;

    private String errorMessage;

    private long durationMs;

    public boolean isSuccess() {
        return status == ExecutionStatus.SUCCESS;
    }

    /**
     * Create a success result
     */
    public static ExecutionResult success(Instant executedAt, int httpStatus, String responseBody, long durationMs) {
        return ExecutionResult.builder()
                .status(ExecutionStatus.SUCCESS)
                .executedAt(executedAt)
                .httpStatus(httpStatus)
                .responseBody(responseBody)
                .durationMs(durationMs)
                .build();
    }

    /**
     * Create a failure result for a non-2xx response
     */
    public static ExecutionResult httpFailure(Instant executedAt, int httpStatus, String reasonPhrase, String responseBody, long durationMs) {
        return ExecutionResult.builder()
                .status(ExecutionStatus.FAILED)
                .executedAt(executedAt)
                .httpStatus(httpStatus)
                .responseBody(responseBody)
                .errorMessage(String.format("HTTP %d: %s", httpStatus, reasonPhrase))
                .durationMs(durationMs)
                .build();
    }

    /**
     * Create a failure result without an HTTP response
     */
    public static ExecutionResult failure(Instant executedAt, String errorMessage, long durationMs) {
        return ExecutionResult.builder()
                .status(ExecutionStatus.FAILED)
                .executedAt(executedAt)
                .errorMessage(errorMessage)
                .durationMs(durationMs)
                .build();
    }
}
