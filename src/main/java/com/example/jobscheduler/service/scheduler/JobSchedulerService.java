package com.example.jobscheduler.service.scheduler;

import com.example.jobscheduler.config.JobSchedulerProperties;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Drives the job registry.
 * <p>
 * Flow:
 * 1. Once the application is ready, active jobs are loaded from storage
 * 2. Every tick interval the registry is scanned for due and expired jobs
 * 3. Due jobs run on the dispatch pool; the tick thread does not wait for them
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobSchedulerService {

    private final JobRegistry jobRegistry;
    private final JobSchedulerProperties properties;

    private final AtomicBoolean running = new AtomicBoolean(false);

    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        if (!properties.isEnabled()) {
            log.info("Job scheduler is disabled");
            return;
        }

        try {
            var loaded = jobRegistry.loadJobs();
            log.info("Job scheduler started with {} jobs, ticking every {}ms", loaded, properties.getTickIntervalMs());
        } catch (Exception e) {
            log.error("Failed to load jobs at startup, starting with an empty schedule: {}", e.getMessage(), e);
        }
        running.set(true);
    }

    @Scheduled(fixedRateString = "${job-scheduler.tick-interval-ms:100}")
    public void tick() {
        if (!running.get()) {
            return;
        }

        try {
            jobRegistry.tick().exceptionally(ex -> {
                log.error("Error completing tick: {}", ex.getMessage(), ex);
                return null;
            });
        } catch (Exception e) {
            log.error("Error in scheduler tick: {}", e.getMessage(), e);
        }
    }

    @PreDestroy
    public void stop() {
        if (running.compareAndSet(true, false)) {
            log.info("Job scheduler stopped");
        }
    }

    public boolean isRunning() {
        return running.get();
    }
}
