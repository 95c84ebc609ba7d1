package com.example.jobscheduler.service.scheduler;

import com.example.jobscheduler.cron.CronSchedule;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

/**
 * Registry state for one job. Only touched while holding the registry lock.
 */
@Getter
@Setter
class JobEntry {

    private final JobSnapshot job;
    private final CronSchedule schedule;
    private Instant nextExecution;
    private Instant lastExecution;
    private boolean inFlight;

    JobEntry(JobSnapshot job, CronSchedule schedule, Instant nextExecution) {
        this.job = job;
        this.schedule = schedule;
        this.nextExecution = nextExecution;
    }
}
