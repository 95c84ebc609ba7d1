package com.example.jobscheduler.service;

import com.example.jobscheduler.config.JobSchedulerProperties;
import com.example.jobscheduler.config.MetricsConfig;
import com.example.jobscheduler.cron.CronParser;
import com.example.jobscheduler.domain.entity.Job;
import com.example.jobscheduler.domain.enums.ExecutionType;
import com.example.jobscheduler.domain.repository.JobExecutionRepository;
import com.example.jobscheduler.domain.repository.JobRepository;
import com.example.jobscheduler.dto.CreateJobRequest;
import com.example.jobscheduler.dto.ExecutionResponse;
import com.example.jobscheduler.dto.JobExecutionsResponse;
import com.example.jobscheduler.dto.JobResponse;
import com.example.jobscheduler.dto.UpdateJobRequest;
import com.example.jobscheduler.exception.InvalidScheduleException;
import com.example.jobscheduler.exception.JobNotFoundException;
import com.example.jobscheduler.mapper.JobMapper;
import com.example.jobscheduler.service.scheduler.JobRegistry;
import com.example.jobscheduler.service.scheduler.JobSnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.net.URI;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * Service for managing jobs.
 * <p>
 * Provides:
 * - Job creation, update and deletion, kept in step with the scheduler
 * - Job queries with scheduler state
 * - Execution history
 * <p>
 * Writes are committed before the scheduler is told about them, so a job
 * retired by the scheduler during registration is visible to the caller.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobManagementService {

    private static final int MAX_EXECUTION_LIMIT = 1000;
    private static final int MAX_PAGE_SIZE = 500;

    private final JobRepository jobRepository;
    private final JobExecutionRepository executionRepository;
    private final JobRegistry jobRegistry;
    private final JobMapper jobMapper;
    private final MetricsConfig metricsConfig;
    private final JobSchedulerProperties properties;

    // === Job Lifecycle ===

    /**
     * Create a job and register it with the scheduler
     */
    public JobResponse createJob(CreateJobRequest request) {
        validateSchedule(request.getSchedule());
        validateEndpoint(request.getApi());

        var job = Job.builder()
                .schedule(request.getSchedule().trim())
                .apiEndpoint(request.getApi().trim())
                .type(request.getType() != null ? request.getType() : ExecutionType.ATLEAST_ONCE)
                .active(true)
                .build();

        job = jobRepository.save(job);
        log.info("Created job {} with schedule '{}' calling {}", job.getId(), job.getSchedule(), job.getApiEndpoint());

        jobRegistry.addJob(JobSnapshot.of(job));
        metricsConfig.recordJobEvent("created");

        return withSchedulerState(jobRepository.findById(job.getId()).orElse(job));
    }

    /**
     * Apply a partial update and re-register the job
     */
    public JobResponse updateJob(UUID jobId, UpdateJobRequest request) {
        if (request.isEmpty()) {
            throw new IllegalArgumentException("No fields to update");
        }

        var job = jobRepository.findById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));

        if (request.getSchedule() != null) {
            validateSchedule(request.getSchedule());
            job.setSchedule(request.getSchedule().trim());
        }
        if (request.getApi() != null) {
            validateEndpoint(request.getApi());
            job.setApiEndpoint(request.getApi().trim());
        }
        if (request.getType() != null) {
            job.setType(request.getType());
        }
        if (request.getActive() != null) {
            job.setActive(request.getActive());
        }

        job = jobRepository.save(job);
        log.info("Updated job {} (active: {}, schedule: '{}')", jobId, job.isActive(), job.getSchedule());

        jobRegistry.updateJob(JobSnapshot.of(job));
        metricsConfig.recordJobEvent("updated");

        return withSchedulerState(jobRepository.findById(jobId).orElse(job));
    }

    /**
     * Unschedule and delete a job; its executions are deleted with it
     */
    @Transactional
    public void deleteJob(UUID jobId) {
        if (!jobRepository.existsById(jobId)) {
            throw new JobNotFoundException(jobId);
        }

        jobRegistry.removeJob(jobId);
        jobRepository.deleteById(jobId);
        metricsConfig.recordJobEvent("deleted");

        log.info("Deleted job {}", jobId);
    }

    // === Job Retrieval ===

    @Transactional(readOnly = true)
    public JobResponse getJob(UUID jobId) {
        return jobRepository.findById(jobId)
                .map(this::withSchedulerState)
                .orElseThrow(() -> new JobNotFoundException(jobId));
    }

    /**
     * All jobs, newest first
     */
    @Transactional(readOnly = true)
    public List<JobResponse> listJobs() {
        return jobMapper.toResponseList(jobRepository.findAllByOrderByCreatedAtDesc());
    }

    // === Execution History ===

    /**
     * Latest executions of one job
     *
     * @param limit number of executions, default when null or not positive
     */
    @Transactional(readOnly = true)
    public JobExecutionsResponse getJobExecutions(UUID jobId, Integer limit) {
        if (!jobRepository.existsById(jobId)) {
            throw new JobNotFoundException(jobId);
        }

        var effectiveLimit = limit == null || limit < 1 ? properties.getDefaultExecutionLimit() : Math.min(limit, MAX_EXECUTION_LIMIT);
        var executions = executionRepository.findByJobIdOrderByExecutionTimestampDesc(jobId, PageRequest.of(0, effectiveLimit));
        var responses = jobMapper.toExecutionResponses(executions);

        return JobExecutionsResponse.builder()
                .jobId(jobId)
                .executions(responses)
                .count(responses.size())
                .build();
    }

    /**
     * Page through all executions, optionally for a single job, newest first
     */
    @Transactional(readOnly = true)
    public Page<ExecutionResponse> listExecutions(UUID jobId, int page, int size) {
        Pageable pageable = PageRequest.of(page, Math.min(size, MAX_PAGE_SIZE), Sort.by(Sort.Direction.DESC, "executionTimestamp"));

        var executions = jobId != null
                ? executionRepository.findByJobId(jobId, pageable)
                : executionRepository.findAll(pageable);

        return executions.map(jobMapper::toExecutionResponse);
    }

    // === Validation ===

    private void validateSchedule(String schedule) {
        try {
            CronParser.parse(schedule);
        } catch (InvalidScheduleException e) {
            throw new InvalidScheduleException(schedule, "Invalid schedule format: " + e.getMessage());
        }
    }

    private void validateEndpoint(String api) {
        URI uri;
        try {
            uri = URI.create(api.trim());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid API endpoint URL", e);
        }

        var scheme = uri.getScheme() != null ? uri.getScheme().toLowerCase(Locale.ROOT) : "";
        if (uri.getHost() == null || !(scheme.equals("http") || scheme.equals("https"))) {
            throw new IllegalArgumentException("Invalid API endpoint URL");
        }
    }

    private JobResponse withSchedulerState(Job job) {
        var response = jobMapper.toResponse(job);
        jobRegistry.getNextExecution(job.getId()).ifPresent(response::setNextExecution);
        jobRegistry.getLastExecution(job.getId()).ifPresent(response::setLastExecution);
        return response;
    }
}
