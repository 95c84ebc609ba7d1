package com.example.jobscheduler.service.scheduler;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Result of a best-effort write. Failures are reported, never thrown.
 */
@Getter
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public class PersistenceOutcome {

    private static final PersistenceOutcome SUCCESS = new PersistenceOutcome(true, null);

    private final boolean success;
    private final String error;

    public static PersistenceOutcome success() {
        return SUCCESS;
    }

    public static PersistenceOutcome failure(String error) {
        return new PersistenceOutcome(false, error);
    }
}
