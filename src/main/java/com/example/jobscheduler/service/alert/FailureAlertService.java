package com.example.jobscheduler.service.alert;

import com.example.jobscheduler.config.JobSchedulerProperties;
import com.example.jobscheduler.service.ObservabilityService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Periodic sweep for active jobs that failed recently.
 * <p>
 * ShedLock keeps the sweep to one instance when several share a database.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FailureAlertService {

    private final ObservabilityService observabilityService;
    private final SlackAlertService slackAlertService;
    private final JobSchedulerProperties properties;

    @Scheduled(fixedDelayString = "${job-scheduler.alert-check-interval-ms:300000}",
            initialDelayString = "${job-scheduler.alert-check-interval-ms:300000}")
    @SchedulerLock(name = "jobFailureAlertCheck", lockAtLeastFor = "30s", lockAtMostFor = "4m")
    public void checkAndAlertFailures() {
        try {
            var failures = observabilityService.getRecentFailures(properties.getAlertLookbackMinutes(), true);

            if (failures.isEmpty()) {
                log.debug("No job failures in the last {} minutes", properties.getAlertLookbackMinutes());
                return;
            }

            for (var failure : failures) {
                log.error("ALERT: Job {} has failed {} time(s). Last failure: {}. Error: {}",
                        failure.getJobId(), failure.getFailureCount(), failure.getLastFailure(), failure.getLastError());
                slackAlertService.sendJobFailureAlert(failure);
            }
        } catch (Exception e) {
            log.error("Error checking for job failures: {}", e.getMessage(), e);
        }
    }
}
