package com.example.jobscheduler.domain.entity;

import com.example.jobscheduler.domain.enums.ExecutionType;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/**
 * A recurring job: a cron schedule and the endpoint it calls.
 */
@Entity
@Table(name = "jobs", indexes = {
        @Index(name = "idx_jobs_active", columnList = "active")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Job {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "job_id", updatable = false, nullable = false)
    private UUID id;

    /**
     * Six-field cron expression (second minute hour day month dayOfWeek)
     */
    @Column(name = "schedule", nullable = false)
    private String schedule;

    /**
     * URL that receives a POST for every occurrence
     */
    @Column(name = "api_endpoint", nullable = false, columnDefinition = "TEXT")
    private String apiEndpoint;

    @Enumerated(EnumType.STRING)
    @Column(name = "type", nullable = false, length = 50)
    @Builder.Default
    private ExecutionType type = ExecutionType.ATLEAST_ONCE;

    /**
     * Cleared by the scheduler once the schedule has no future occurrence
     */
    @Column(name = "active", nullable = false)
    @Builder.Default
    private boolean active = true;

    /**
     * Bumped on every write; guards the scheduler's deactivation against concurrent edits
     */
    @Version
    @Column(name = "version")
    private Long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        var now = Instant.now();
        this.createdAt = now;
        this.updatedAt = now;
        if (this.type == null) {
            this.type = ExecutionType.ATLEAST_ONCE;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        this.updatedAt = Instant.now();
    }
}
