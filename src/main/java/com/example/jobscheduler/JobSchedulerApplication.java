package com.example.jobscheduler;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Job Scheduler Service Application
 * <p>
 * Calls HTTP endpoints on recurring, seconds-resolution cron schedules.
 * <p>
 * Features:
 * - Six-field cron dialect with day-of-week names and wrapping ranges
 * - In-memory registry rebuilt from PostgreSQL at boot
 * - Parallel dispatch of due jobs with per-occurrence execution history
 * - Automatic deactivation of schedules that have run out
 * - Slack alerting for repeatedly failing jobs
 */
@EnableScheduling
@SpringBootApplication
public class JobSchedulerApplication {

    public static void main(String[] args) {
        SpringApplication.run(JobSchedulerApplication.class, args);
    }
}
