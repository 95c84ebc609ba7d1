package com.example.jobscheduler.service.scheduler;

import com.example.jobscheduler.config.JobSchedulerProperties;
import com.example.jobscheduler.config.MetricsConfig;
import com.example.jobscheduler.cron.CronSchedule;
import com.example.jobscheduler.domain.enums.ExecutionType;
import com.example.jobscheduler.service.executor.ExecutionResult;
import com.example.jobscheduler.service.executor.JobExecutorService;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * In-memory registry of active jobs and the tick that fires them.
 * <p>
 * Every read and write of the entry map happens while holding its monitor.
 * Outbound calls and storage writes happen outside it.
 * <p>
 * Per job the flow is:
 * 1. Scheduled: waiting for nextExecution
 * 2. Due: within one tolerance window of now, handed to the dispatch pool
 * 3. Executing: in flight, skipped by later ticks
 * 4. Rescheduled from the fired occurrence, or retired when the schedule has run out
 * <p>
 * An entry that was not fired in time (expired) is recomputed from now.
 */
@Slf4j
@Component
public class JobRegistry {

    private final Map<UUID, JobEntry> entries = new HashMap<>();

    private final JobExecutorService jobExecutorService;
    private final JobPersistenceGateway persistenceGateway;
    private final MetricsConfig metricsConfig;
    private final Executor dispatchExecutor;
    private final Clock clock;
    private final Duration tolerance;

    public JobRegistry(JobExecutorService jobExecutorService, JobPersistenceGateway persistenceGateway, MetricsConfig metricsConfig,
                       @Qualifier("jobDispatchExecutor") Executor dispatchExecutor, Clock clock, JobSchedulerProperties properties) {
        this.jobExecutorService = jobExecutorService;
        this.persistenceGateway = persistenceGateway;
        this.metricsConfig = metricsConfig;
        this.dispatchExecutor = dispatchExecutor;
        this.clock = clock;
        this.tolerance = Duration.ofMillis(properties.getTickIntervalMs());
    }

    // === Membership ===

    /**
     * Register a job at its first occurrence after now.
     *
     * @param job the job to register
     * @return the first occurrence, or empty if the job was retired instead
     * @throws com.example.jobscheduler.exception.InvalidScheduleException if the schedule does not parse
     */
    public Optional<Instant> addJob(JobSnapshot job) {
        var schedule = CronSchedule.parse(job.getSchedule());
        var now = clock.instant();
        var next = schedule.nextOccurrence(now, zone());

        if (next.isEmpty() || !next.get().isAfter(now)) {
            log.info("Job {} has no future occurrence for schedule '{}', marking inactive", job.getId(), job.getSchedule());
            retire(job);
            return Optional.empty();
        }

        synchronized (entries) {
            entries.put(job.getId(), new JobEntry(job, schedule, next.get()));
        }

        log.info("Scheduled job {} ('{}') next at {}", job.getId(), job.getSchedule(), next.get());
        return next;
    }

    /**
     * Drop a job from the registry. Calling it for an unknown job is a no-op.
     *
     * @return true if an entry was removed
     */
    public boolean removeJob(UUID jobId) {
        JobEntry removed;
        synchronized (entries) {
            removed = entries.remove(jobId);
        }

        if (removed != null) {
            log.info("Removed job {} from schedule", jobId);
        }
        return removed != null;
    }

    /**
     * Replace a job's entry; inactive jobs are only removed
     */
    public Optional<Instant> updateJob(JobSnapshot job) {
        removeJob(job.getId());

        if (!job.isActive()) {
            return Optional.empty();
        }
        return addJob(job);
    }

    /**
     * Register every active job from storage.
     * A job whose stored schedule does not parse is skipped.
     *
     * @return number of jobs registered
     */
    public int loadJobs() {
        var jobs = persistenceGateway.listActiveJobs();
        log.info("Loading {} active jobs", jobs.size());

        var loaded = 0;
        for (var job : jobs) {
            try {
                if (addJob(job).isPresent()) {
                    loaded++;
                }
            } catch (Exception e) {
                log.error("Failed to load job {} with schedule '{}': {}", job.getId(), job.getSchedule(), e.getMessage());
            }
        }

        log.info("Loaded {} of {} active jobs", loaded, jobs.size());
        return loaded;
    }

    // === Tick ===

    /**
     * Scan all entries once: recompute expired ones and dispatch due ones.
     * <p>
     * Returns without waiting for the calls; the future completes once every
     * dispatched call has been recorded and rescheduled.
     */
    public CompletableFuture<TickSummary> tick() {
        var now = clock.instant();
        var due = new LinkedHashMap<JobEntry, Instant>();
        var expired = new ArrayList<JobEntry>();

        synchronized (entries) {
            for (var entry : entries.values()) {
                if (entry.isInFlight()) {
                    continue;
                }

                var next = entry.getNextExecution();
                if (next.isBefore(now.minus(tolerance))) {
                    expired.add(entry);
                } else if (!next.isAfter(now.plus(tolerance))) {
                    entry.setInFlight(true);
                    due.put(entry, next);
                }
            }
        }

        var retiredByExpiry = handleExpired(expired, now);

        if (due.isEmpty()) {
            if (!expired.isEmpty()) {
                log.info("Tick: {} expired, {} retired", expired.size(), retiredByExpiry);
            }
            return CompletableFuture.completedFuture(TickSummary.builder()
                    .expired(expired.size())
                    .retired(retiredByExpiry)
                    .build());
        }

        log.debug("Tick at {}: dispatching {} due jobs", now, due.size());
        metricsConfig.recordJobsDispatched(due.size());

        var futures = due.entrySet().stream()
                .map(d -> dispatch(d.getKey(), d.getValue()))
                .toList();

        return CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                .thenApply(ignored -> summarize(futures, expired.size(), retiredByExpiry));
    }

    private int handleExpired(List<JobEntry> expired, Instant now) {
        var toRetire = new ArrayList<JobSnapshot>();

        synchronized (entries) {
            for (var entry : expired) {
                var jobId = entry.getJob().getId();
                if (entries.get(jobId) != entry) {
                    continue;
                }

                var missed = entry.getNextExecution();
                var next = entry.getSchedule().nextOccurrence(now, zone());
                if (next.isPresent() && next.get().isAfter(now)) {
                    entry.setNextExecution(next.get());
                    log.warn("Job {} missed occurrence {}, next at {}", jobId, missed, next.get());
                } else {
                    entries.remove(jobId);
                    toRetire.add(entry.getJob());
                }
            }
        }

        toRetire.forEach(job -> {
            log.info("Job {} expired with no future occurrence, marking inactive", job.getId());
            retire(job);
        });
        return toRetire.size();
    }

    private CompletableFuture<DispatchOutcome> dispatch(JobEntry entry, Instant scheduledAt) {
        try {
            return CompletableFuture.supplyAsync(() -> run(entry, scheduledAt), dispatchExecutor);
        } catch (RejectedExecutionException e) {
            log.error("Dispatch of job {} rejected: {}", entry.getJob().getId(), e.getMessage());
            synchronized (entries) {
                entry.setInFlight(false);
            }
            return CompletableFuture.completedFuture(new DispatchOutcome(null, false));
        }
    }

    /**
     * Execute, record and reschedule one occurrence. Runs on the dispatch pool.
     */
    private DispatchOutcome run(JobEntry entry, Instant scheduledAt) {
        var job = entry.getJob();
        ExecutionResult result;

        try {
            result = jobExecutorService.execute(job, scheduledAt);
        } catch (Exception e) {
            log.error("Unexpected error executing job {}: {}", job.getId(), e.getMessage(), e);
            result = ExecutionResult.failure(clock.instant(), e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName(), 0);
        }

        try {
            record(job, scheduledAt, result);
        } catch (Exception e) {
            log.error("Failed to record execution of job {}: {}", job.getId(), e.getMessage(), e);
        }

        var retired = reschedule(entry, scheduledAt);
        return new DispatchOutcome(result, retired);
    }

    private void record(JobSnapshot job, Instant scheduledAt, ExecutionResult result) {
        var executedAt = result.getExecutedAt() != null ? result.getExecutedAt() : clock.instant();
        var outcome = persistenceGateway.insertExecution(job.getId(), executedAt, scheduledAt, result);
        if (!outcome.isSuccess()) {
            log.warn("Execution of job {} for {} was not stored: {}", job.getId(), scheduledAt, outcome.getError());
        }

        metricsConfig.recordExecution(result.getStatus(), result.getDurationMs());

        if (result.isSuccess()) {
            log.info("Job {} executed for {}: HTTP {} in {}ms", job.getId(), scheduledAt, result.getHttpStatus(), result.getDurationMs());
        } else if (job.getType() == ExecutionType.ATLEAST_ONCE) {
            log.warn("At-least-once job {} failed for {}: {}. Continuing on schedule", job.getId(), scheduledAt, result.getErrorMessage());
        } else {
            log.warn("Job {} failed for {}: {}", job.getId(), scheduledAt, result.getErrorMessage());
        }
    }

    /**
     * Advance an entry past the occurrence it just fired.
     *
     * @return true if the job was retired
     */
    private boolean reschedule(JobEntry entry, Instant firedAt) {
        var jobId = entry.getJob().getId();
        var now = clock.instant();

        synchronized (entries) {
            if (entries.get(jobId) != entry) {
                log.debug("Job {} was removed or replaced while executing, skipping reschedule", jobId);
                return false;
            }

            entry.setInFlight(false);
            entry.setLastExecution(firedAt);

            var next = entry.getSchedule().nextOccurrence(firedAt, zone());
            if (next.isPresent() && next.get().isAfter(now)) {
                entry.setNextExecution(next.get());
                log.debug("Job {} next at {}", jobId, next.get());
                return false;
            }

            entries.remove(jobId);
        }

        log.info("Job {} has no future occurrence after {}, marking inactive", jobId, firedAt);
        retire(entry.getJob());
        return true;
    }

    /**
     * Deactivate a job in storage. Skipped when the id has been registered again since the
     * caller dropped it, and a no-op in storage when the row has moved past the snapshot's version.
     */
    private void retire(JobSnapshot job) {
        var jobId = job.getId();
        synchronized (entries) {
            if (entries.containsKey(jobId)) {
                log.info("Job {} was registered again before it could be retired, keeping it active", jobId);
                return;
            }
        }

        try {
            var outcome = persistenceGateway.markJobInactive(jobId, job.getVersion());
            if (!outcome.isSuccess()) {
                log.warn("Job {} could not be marked inactive: {}", jobId, outcome.getError());
            }
            metricsConfig.recordJobRetired();
        } catch (Exception e) {
            log.error("Failed to retire job {}: {}", jobId, e.getMessage(), e);
        }
    }

    private TickSummary summarize(List<CompletableFuture<DispatchOutcome>> futures, int expired, int retiredByExpiry) {
        var succeeded = 0;
        var failed = 0;
        var retired = retiredByExpiry;

        for (var future : futures) {
            var outcome = future.join();
            if (outcome.getResult() == null) {
                continue;
            }
            if (outcome.getResult().isSuccess()) {
                succeeded++;
            } else {
                failed++;
            }
            if (outcome.isRetired()) {
                retired++;
            }
        }

        var summary = TickSummary.builder()
                .dispatched(succeeded + failed)
                .succeeded(succeeded)
                .failed(failed)
                .expired(expired)
                .retired(retired)
                .build();

        log.info("Tick completed: {} dispatched, {} succeeded, {} failed, {} expired, {} retired",
                summary.getDispatched(), summary.getSucceeded(), summary.getFailed(), summary.getExpired(), summary.getRetired());
        return summary;
    }

    private ZoneId zone() {
        return clock.getZone();
    }

    // === Read access ===

    public Optional<Instant> getNextExecution(UUID jobId) {
        synchronized (entries) {
            return Optional.ofNullable(entries.get(jobId)).map(JobEntry::getNextExecution);
        }
    }

    public Optional<Instant> getLastExecution(UUID jobId) {
        synchronized (entries) {
            return Optional.ofNullable(entries.get(jobId)).map(JobEntry::getLastExecution);
        }
    }

    public boolean contains(UUID jobId) {
        synchronized (entries) {
            return entries.containsKey(jobId);
        }
    }

    public boolean isInFlight(UUID jobId) {
        synchronized (entries) {
            var entry = entries.get(jobId);
            return entry != null && entry.isInFlight();
        }
    }

    public int size() {
        synchronized (entries) {
            return entries.size();
        }
    }

    @Getter
    @RequiredArgsConstructor
    private static final class DispatchOutcome {
        private final ExecutionResult result;
        private final boolean retired;
    }
}
