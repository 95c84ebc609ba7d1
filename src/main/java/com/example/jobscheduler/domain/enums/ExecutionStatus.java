package com.example.jobscheduler.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Outcome of a single job execution.
 */
@Getter
@RequiredArgsConstructor
public enum ExecutionStatus {

    /**
     * Target answered with a 2xx status.
     */
    SUCCESS("success"),

    /**
     * Non-2xx status, transport error, timeout or unexpected exception.
     */
    FAILED("failed");

    /**
     * Lower-case tag value used in metrics
     */
    private final String code;
}
