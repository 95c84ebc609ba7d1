package com.example.jobscheduler.domain.repository;

import com.example.jobscheduler.domain.entity.JobExecution;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Repository for JobExecution entity
 */
@Repository
public interface JobExecutionRepository extends JpaRepository<JobExecution, UUID> {

    String STATS_SELECT = """
            SELECT COUNT(*),
                   COUNT(*) FILTER (WHERE e.status = 'SUCCESS'),
                   COUNT(*) FILTER (WHERE e.status = 'FAILED'),
                   AVG(e.execution_duration),
                   MIN(e.execution_duration),
                   MAX(e.execution_duration),
                   AVG(EXTRACT(EPOCH FROM (e.execution_timestamp - e.scheduled_timestamp)) * 1000)
            FROM job_executions e
            """;

    /**
     * Latest executions of one job; size the page to limit the result
     */
    List<JobExecution> findByJobIdOrderByExecutionTimestampDesc(UUID jobId, Pageable pageable);

    Page<JobExecution> findByJobId(UUID jobId, Pageable pageable);

    /**
     * Execution counters, durations and average drift (execution minus scheduled time)
     * since the given instant. Returns a single row.
     */
    @Query(value = STATS_SELECT + " WHERE e.execution_timestamp >= :since", nativeQuery = true)
    List<Object[]> getExecutionStats(@Param("since") Instant since);

    /**
     * Same as {@link #getExecutionStats(Instant)} restricted to one job
     */
    @Query(value = STATS_SELECT + " WHERE e.job_id = :jobId AND e.execution_timestamp >= :since", nativeQuery = true)
    List<Object[]> getJobExecutionStats(@Param("jobId") UUID jobId, @Param("since") Instant since);

    /**
     * Failed executions since the given instant, grouped per job, most failures first:
     * job id, endpoint, failure count, last failure time, latest error.
     */
    @Query("""
            SELECT e.jobId, j.apiEndpoint, COUNT(e), MAX(e.executionTimestamp), MAX(e.errorMessage)
            FROM JobExecution e, Job j
            WHERE e.jobId = j.id
              AND e.status = com.example.jobscheduler.domain.enums.ExecutionStatus.FAILED
              AND e.executionTimestamp >= :since
              AND (:activeOnly = false OR j.active = true)
            GROUP BY e.jobId, j.apiEndpoint
            ORDER BY COUNT(e) DESC, MAX(e.executionTimestamp) DESC
            """)
    List<Object[]> findFailureSummaries(@Param("since") Instant since, @Param("activeOnly") boolean activeOnly);
}
