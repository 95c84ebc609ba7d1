package com.example.jobscheduler.config;

import com.example.jobscheduler.domain.enums.ExecutionStatus;
import com.example.jobscheduler.domain.repository.JobRepository;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.Scheduled;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Metrics configuration for monitoring job scheduler health and performance.
 * <p>
 * Exposes Prometheus metrics for:
 * - Job counts by state
 * - Execution times and outcomes
 * - Automatic deactivations
 */
@Configuration
@RequiredArgsConstructor
public class MetricsConfig {

    private final MeterRegistry meterRegistry;
    private final JobRepository jobRepository;

    private final AtomicLong activeJobs = new AtomicLong(0);
    private final AtomicLong inactiveJobs = new AtomicLong(0);

    @PostConstruct
    public void initializeMetrics() {
        Gauge.builder("job_scheduler_jobs", activeJobs, AtomicLong::get)
                .tag("state", "active")
                .description("Number of jobs by state")
                .register(meterRegistry);

        Gauge.builder("job_scheduler_jobs", inactiveJobs, AtomicLong::get)
                .tag("state", "inactive")
                .description("Number of jobs by state")
                .register(meterRegistry);
    }

    /**
     * Periodically update gauge metrics from database
     */
    @Scheduled(fixedDelayString = "${job-scheduler.metrics-update-interval-ms:60000}")
    public void updateMetrics() {
        activeJobs.set(jobRepository.countByActive(true));
        inactiveJobs.set(jobRepository.countByActive(false));
    }

    /**
     * Record the outcome and duration of one job call
     */
    public void recordExecution(ExecutionStatus status, long durationMs) {
        var tag = status.getCode();
        Timer.builder("job_scheduler_execution_time")
                .tag("status", tag)
                .description("Job execution time")
                .register(meterRegistry)
                .record(Duration.ofMillis(durationMs));
        meterRegistry.counter("job_scheduler_executions", "status", tag).increment();
    }

    /**
     * Count jobs handed to the dispatch pool by a tick
     */
    public void recordJobsDispatched(int count) {
        if (count > 0) {
            meterRegistry.counter("job_scheduler_jobs_executed").increment(count);
        }
    }

    public void recordJobRetired() {
        meterRegistry.counter("job_scheduler_jobs_auto_inactivated").increment();
    }

    /**
     * Record a management event (created, updated, deleted)
     */
    public void recordJobEvent(String event) {
        meterRegistry.counter("job_scheduler_job_events", "event", event).increment();
    }
}
