package com.example.jobscheduler.service;

import com.example.jobscheduler.domain.repository.JobExecutionRepository;
import com.example.jobscheduler.domain.repository.JobRepository;
import com.example.jobscheduler.exception.JobNotFoundException;
import com.example.jobscheduler.service.scheduler.JobRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("ObservabilityService Tests")
class ObservabilityServiceTest {

    private static final Instant NOW = Instant.parse("2030-06-01T12:00:00Z");

    @Mock
    private JobRepository jobRepository;

    @Mock
    private JobExecutionRepository executionRepository;

    @Mock
    private JobRegistry jobRegistry;

    private ObservabilityService observabilityService;

    @BeforeEach
    void setUp() {
        observabilityService = new ObservabilityService(jobRepository, executionRepository, jobRegistry, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Should count jobs by state and report registry size")
    void shouldReturnJobStatistics() {
        when(jobRepository.countByActive(true)).thenReturn(7L);
        when(jobRepository.countByActive(false)).thenReturn(3L);
        when(jobRegistry.size()).thenReturn(6);

        var stats = observabilityService.getJobStatistics();

        assertThat(stats.getTotalJobs()).isEqualTo(10);
        assertThat(stats.getActiveJobs()).isEqualTo(7);
        assertThat(stats.getInactiveJobs()).isEqualTo(3);
        assertThat(stats.getRegisteredJobs()).isEqualTo(6);
        assertThat(stats.getGeneratedAt()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("Should convert the aggregate row for the requested window")
    void shouldReturnExecutionStatistics() {
        Object[] row = {10L, 8L, 2L, new BigDecimal("120.5"), 15L, 900L, 42.25d};
        when(executionRepository.getExecutionStats(Instant.parse("2030-06-01T00:00:00Z"))).thenReturn(Collections.singletonList(row));

        var stats = observabilityService.getExecutionStatistics(12);

        assertThat(stats.getWindowHours()).isEqualTo(12);
        assertThat(stats.getTotalExecutions()).isEqualTo(10);
        assertThat(stats.getSuccessfulExecutions()).isEqualTo(8);
        assertThat(stats.getFailedExecutions()).isEqualTo(2);
        assertThat(stats.getAvgDurationMs()).isEqualTo(120.5);
        assertThat(stats.getMinDurationMs()).isEqualTo(15L);
        assertThat(stats.getMaxDurationMs()).isEqualTo(900L);
        assertThat(stats.getAvgDriftMs()).isEqualTo(42.25);
    }

    @Test
    @DisplayName("Should reject a window shorter than one hour")
    void shouldRejectInvalidWindow() {
        assertThatThrownBy(() -> observabilityService.getExecutionStatistics(0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should return empty per-job statistics when the job has no executions")
    void shouldReturnEmptyJobStatistics() {
        var jobId = UUID.randomUUID();
        Object[] row = {0L, 0L, 0L, null, null, null, null};
        when(jobRepository.existsById(jobId)).thenReturn(true);
        when(executionRepository.getJobExecutionStats(jobId, Instant.parse("2030-05-31T12:00:00Z"))).thenReturn(Collections.singletonList(row));

        assertThat(observabilityService.getJobExecutionStatistics(jobId, 24)).isEmpty();
    }

    @Test
    @DisplayName("Should throw for statistics of an unknown job")
    void shouldThrowForUnknownJob() {
        var jobId = UUID.randomUUID();
        when(jobRepository.existsById(jobId)).thenReturn(false);

        assertThatThrownBy(() -> observabilityService.getJobExecutionStatistics(jobId, 24))
                .isInstanceOf(JobNotFoundException.class);
    }

    @Test
    @DisplayName("Should map failure rows to summaries")
    void shouldReturnRecentFailures() {
        var jobId = UUID.randomUUID();
        var lastFailure = Instant.parse("2030-06-01T11:55:00Z");
        Object[] row = {jobId, "https://example.test/hook", 4L, lastFailure, "HTTP 500: Internal Server Error"};
        when(executionRepository.findFailureSummaries(Instant.parse("2030-06-01T11:00:00Z"), true)).thenReturn(Collections.singletonList(row));

        var failures = observabilityService.getRecentFailures(60, true);

        assertThat(failures).hasSize(1);
        var failure = failures.get(0);
        assertThat(failure.getJobId()).isEqualTo(jobId);
        assertThat(failure.getFailureCount()).isEqualTo(4);
        assertThat(failure.getLastFailure()).isEqualTo(lastFailure);
        assertThat(failure.getLastError()).isEqualTo("HTTP 500: Internal Server Error");
        verify(executionRepository).findFailureSummaries(Instant.parse("2030-06-01T11:00:00Z"), true);
    }

    @Test
    @DisplayName("Should return an empty list when nothing failed")
    void shouldReturnNoFailures() {
        when(executionRepository.findFailureSummaries(Instant.parse("2030-06-01T11:00:00Z"), false)).thenReturn(List.of());

        assertThat(observabilityService.getRecentFailures(60, false)).isEmpty();
    }
}
