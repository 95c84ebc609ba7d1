package com.example.jobscheduler.service.scheduler;

import com.example.jobscheduler.domain.entity.JobExecution;
import com.example.jobscheduler.domain.repository.JobExecutionRepository;
import com.example.jobscheduler.domain.repository.JobRepository;
import com.example.jobscheduler.service.executor.ExecutionResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * {@link JobPersistenceGateway} over the JPA repositories
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JpaJobPersistenceGateway implements JobPersistenceGateway {

    private final JobRepository jobRepository;
    private final JobExecutionRepository executionRepository;
    private final Clock clock;

    @Override
    @Transactional(readOnly = true)
    public List<JobSnapshot> listActiveJobs() {
        return jobRepository.findByActiveTrue().stream().map(JobSnapshot::of).toList();
    }

    @Override
    public PersistenceOutcome insertExecution(UUID jobId, Instant executedAt, Instant scheduledAt, ExecutionResult result) {
        try {
            var execution = JobExecution.builder()
                    .jobId(jobId)
                    .executionTimestamp(executedAt)
                    .scheduledTimestamp(scheduledAt)
                    .httpStatus(result.getHttpStatus())
                    .executionDuration(result.getDurationMs())
                    .responseBody(result.getResponseBody())
                    .errorMessage(result.getErrorMessage())
                    .status(result.getStatus())
                    .build();
            executionRepository.save(execution);
            return PersistenceOutcome.success();
        } catch (Exception e) {
            log.error("Failed to record execution of job {}: {}", jobId, e.getMessage());
            return PersistenceOutcome.failure(e.getMessage());
        }
    }

    @Override
    public PersistenceOutcome markJobInactive(UUID jobId, Long version) {
        try {
            var updated = jobRepository.markInactive(jobId, version, clock.instant());
            if (updated == 0) {
                log.debug("Job {} was deleted or modified since version {}, left as is", jobId, version);
            }
            return PersistenceOutcome.success();
        } catch (Exception e) {
            log.error("Failed to mark job {} inactive: {}", jobId, e.getMessage());
            return PersistenceOutcome.failure(e.getMessage());
        }
    }
}
