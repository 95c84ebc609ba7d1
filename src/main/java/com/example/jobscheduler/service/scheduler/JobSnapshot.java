package com.example.jobscheduler.service.scheduler;

import com.example.jobscheduler.domain.entity.Job;
import com.example.jobscheduler.domain.enums.ExecutionType;
import lombok.Builder;
import lombok.Value;

import java.util.UUID;

/**
 * Immutable copy of a job, taken when it enters the registry
 */
@Value
@Builder(toBuilder = true)
public class JobSnapshot {

    UUID id;
    String schedule;
    String apiEndpoint;
    ExecutionType type;
    boolean active;

    /**
     * Storage version the copy was taken at
     */
    Long version;

    public static JobSnapshot of(Job job) {
        return JobSnapshot.builder()
                .id(job.getId())
                .schedule(job.getSchedule())
                .apiEndpoint(job.getApiEndpoint())
                .type(job.getType())
                .active(job.isActive())
                .version(job.getVersion())
                .build();
    }
}
