package com.example.jobscheduler.domain.entity;

import com.example.jobscheduler.domain.enums.ExecutionStatus;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/**
 * One row per dispatched occurrence of a job.
 */
@Entity
@Table(name = "job_executions", indexes = {
        @Index(name = "idx_executions_job_id", columnList = "job_id"),
        @Index(name = "idx_executions_timestamp", columnList = "execution_timestamp DESC")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class JobExecution {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "job_id", nullable = false)
    private UUID jobId;

    /**
     * When the call was actually made
     */
    @Column(name = "execution_timestamp", nullable = false)
    private Instant executionTimestamp;

    /**
     * The occurrence the call belongs to
     */
    @Column(name = "scheduled_timestamp", nullable = false)
    private Instant scheduledTimestamp;

    @Column(name = "http_status")
    private Integer httpStatus;

    /**
     * Wall-clock duration of the call in milliseconds
     */
    @Column(name = "execution_duration")
    private Long executionDuration;

    @Column(name = "response_body", columnDefinition = "TEXT")
    private String responseBody;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 50)
    private ExecutionStatus status;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        this.createdAt = Instant.now();
    }
}
