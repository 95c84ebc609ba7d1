package com.example.jobscheduler.exception;

import lombok.Getter;

/**
 * Exception for a cron expression that cannot be parsed
 */
@Getter
public class InvalidScheduleException extends IllegalArgumentException {

    private final String expression;

    public InvalidScheduleException(String expression, String message) {
        super(message);
        this.expression = expression;
    }
}
