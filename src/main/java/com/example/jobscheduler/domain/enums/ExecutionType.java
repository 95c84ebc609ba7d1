package com.example.jobscheduler.domain.enums;

/**
 * Delivery guarantee requested for a job.
 * <p>
 * Only at-least-once is defined. A failed execution is logged and the job keeps
 * its normal schedule; the missed occurrence is not retried.
 */
public enum ExecutionType {

    ATLEAST_ONCE
}
