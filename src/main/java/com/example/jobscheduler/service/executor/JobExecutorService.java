package com.example.jobscheduler.service.executor;

import com.example.jobscheduler.client.ClientModels.JobInvocationRequest;
import com.example.jobscheduler.client.JobTargetClient;
import com.example.jobscheduler.config.JobSchedulerProperties;
import com.example.jobscheduler.exception.JobInvocationException;
import com.example.jobscheduler.service.scheduler.JobSnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;

/**
 * Service responsible for executing a single job occurrence.
 * <p>
 * Issues one POST to the job's endpoint and classifies the outcome.
 * Never throws: every outcome becomes an {@link ExecutionResult}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobExecutorService {

    static final String NO_RESPONSE_MESSAGE = "No response from server";

    private final JobTargetClient jobTargetClient;
    private final JobSchedulerProperties properties;
    private final Clock clock;

    /**
     * Execute one occurrence of a job.
     *
     * @param job           the job to call
     * @param scheduledTime the occurrence being executed
     * @return the classified result, duration always set
     */
    public ExecutionResult execute(JobSnapshot job, Instant scheduledTime) {
        var executedAt = clock.instant();
        var start = System.nanoTime();

        var request = JobInvocationRequest.builder()
                .jobId(job.getId().toString())
                .scheduledTime(scheduledTime.toString())
                .executionTime(executedAt.toString())
                .build();

        try {
            var response = jobTargetClient.invoke(job.getApiEndpoint(), request);
            var durationMs = elapsedMs(start);
            var body = truncate(response.getBody());

            if (response.is2xxSuccessful()) {
                log.debug("Job {} succeeded with HTTP {} in {}ms", job.getId(), response.getStatusCode(), durationMs);
                return ExecutionResult.success(executedAt, response.getStatusCode(), body, durationMs);
            }

            log.debug("Job {} got HTTP {} in {}ms", job.getId(), response.getStatusCode(), durationMs);
            return ExecutionResult.httpFailure(executedAt, response.getStatusCode(), response.getReasonPhrase(), body, durationMs);
        } catch (JobInvocationException e) {
            var message = e.isNoResponse() ? NO_RESPONSE_MESSAGE : messageOf(e);
            return ExecutionResult.failure(executedAt, message, elapsedMs(start));
        } catch (Exception e) {
            log.error("Unexpected error calling job {}: {}", job.getId(), e.getMessage(), e);
            return ExecutionResult.failure(executedAt, messageOf(e), elapsedMs(start));
        }
    }

    String truncate(String body) {
        if (body == null) {
            return null;
        }
        var max = properties.getResponseBodyMaxLength();
        return body.length() > max ? body.substring(0, max) : body;
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }

    private static String messageOf(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
