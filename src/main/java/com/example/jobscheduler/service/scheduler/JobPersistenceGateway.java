package com.example.jobscheduler.service.scheduler;

import com.example.jobscheduler.service.executor.ExecutionResult;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Storage operations the registry depends on
 */
public interface JobPersistenceGateway {

    List<JobSnapshot> listActiveJobs();

    PersistenceOutcome insertExecution(UUID jobId, Instant executedAt, Instant scheduledAt, ExecutionResult result);

    /**
     * Deactivate a job unless it has been modified since {@code version} was read
     */
    PersistenceOutcome markJobInactive(UUID jobId, Long version);
}
