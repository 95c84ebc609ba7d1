package com.example.jobscheduler.cron;

/**
 * Syntactic form a cron field was written in.
 */
public enum FieldKind {
    ALL,
    SINGLE,
    LIST,
    RANGE,
    STEP
}
