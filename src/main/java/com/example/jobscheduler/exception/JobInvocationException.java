package com.example.jobscheduler.exception;

import lombok.Getter;

/**
 * Exception for a job call that produced no HTTP response
 */
@Getter
public class JobInvocationException extends RuntimeException {

    private final String url;

    /**
     * True when the target never answered (connect failure, timeout, I/O error)
     */
    private final boolean noResponse;

    public JobInvocationException(String url, String message, Throwable cause, boolean noResponse) {
        super(message, cause);
        this.url = url;
        this.noResponse = noResponse;
    }
}
