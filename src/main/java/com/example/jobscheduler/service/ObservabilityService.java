package com.example.jobscheduler.service;

import com.example.jobscheduler.domain.repository.JobExecutionRepository;
import com.example.jobscheduler.domain.repository.JobRepository;
import com.example.jobscheduler.dto.ExecutionStatistics;
import com.example.jobscheduler.dto.FailureSummary;
import com.example.jobscheduler.dto.JobStatistics;
import com.example.jobscheduler.exception.JobNotFoundException;
import com.example.jobscheduler.service.scheduler.JobRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Aggregated statistics over jobs and executions
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ObservabilityService {

    private final JobRepository jobRepository;
    private final JobExecutionRepository executionRepository;
    private final JobRegistry jobRegistry;
    private final Clock clock;

    @Transactional(readOnly = true)
    public JobStatistics getJobStatistics() {
        var active = jobRepository.countByActive(true);
        var inactive = jobRepository.countByActive(false);

        return JobStatistics.builder()
                .totalJobs(active + inactive)
                .activeJobs(active)
                .inactiveJobs(inactive)
                .registeredJobs(jobRegistry.size())
                .generatedAt(clock.instant())
                .build();
    }

    /**
     * Execution statistics for the last {@code hours} hours
     */
    @Transactional(readOnly = true)
    public ExecutionStatistics getExecutionStatistics(int hours) {
        var since = since(hours);
        return toStatistics(firstRow(executionRepository.getExecutionStats(since)), hours);
    }

    /**
     * Execution statistics of one job for the last {@code hours} hours
     *
     * @return empty if the job has no executions in the window
     */
    @Transactional(readOnly = true)
    public Optional<ExecutionStatistics> getJobExecutionStatistics(UUID jobId, int hours) {
        if (!jobRepository.existsById(jobId)) {
            throw new JobNotFoundException(jobId);
        }

        var stats = toStatistics(firstRow(executionRepository.getJobExecutionStats(jobId, since(hours))), hours);
        return stats.getTotalExecutions() > 0 ? Optional.of(stats) : Optional.empty();
    }

    /**
     * Jobs with failed executions in the last {@code minutes} minutes, most failures first
     *
     * @param activeOnly skip jobs that are no longer active
     */
    @Transactional(readOnly = true)
    public List<FailureSummary> getRecentFailures(int minutes, boolean activeOnly) {
        var since = clock.instant().minus(Duration.ofMinutes(minutes));

        return executionRepository.findFailureSummaries(since, activeOnly).stream()
                .map(row -> FailureSummary.builder()
                        .jobId((UUID) row[0])
                        .apiEndpoint((String) row[1])
                        .failureCount(toLong(row[2]))
                        .lastFailure((Instant) row[3])
                        .lastError((String) row[4])
                        .build())
                .toList();
    }

    private Instant since(int hours) {
        if (hours < 1) {
            throw new IllegalArgumentException("hours must be at least 1");
        }
        return clock.instant().minus(Duration.ofHours(hours));
    }

    private ExecutionStatistics toStatistics(Object[] row, int hours) {
        return ExecutionStatistics.builder()
                .windowHours(hours)
                .totalExecutions(toLong(row[0]))
                .successfulExecutions(toLong(row[1]))
                .failedExecutions(toLong(row[2]))
                .avgDurationMs(toDouble(row[3]))
                .minDurationMs(row[4] != null ? toLong(row[4]) : null)
                .maxDurationMs(row[5] != null ? toLong(row[5]) : null)
                .avgDriftMs(toDouble(row[6]))
                .generatedAt(clock.instant())
                .build();
    }

    private static Object[] firstRow(List<Object[]> rows) {
        return rows.isEmpty() ? new Object[7] : rows.get(0);
    }

    private static long toLong(Object value) {
        return value != null ? ((Number) value).longValue() : 0L;
    }

    private static Double toDouble(Object value) {
        return value != null ? ((Number) value).doubleValue() : null;
    }
}
