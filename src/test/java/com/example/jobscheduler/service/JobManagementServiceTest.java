package com.example.jobscheduler.service;

import com.example.jobscheduler.config.JobSchedulerProperties;
import com.example.jobscheduler.config.MetricsConfig;
import com.example.jobscheduler.domain.entity.Job;
import com.example.jobscheduler.domain.entity.JobExecution;
import com.example.jobscheduler.domain.enums.ExecutionStatus;
import com.example.jobscheduler.domain.enums.ExecutionType;
import com.example.jobscheduler.domain.repository.JobExecutionRepository;
import com.example.jobscheduler.domain.repository.JobRepository;
import com.example.jobscheduler.dto.CreateJobRequest;
import com.example.jobscheduler.dto.ExecutionResponse;
import com.example.jobscheduler.dto.JobResponse;
import com.example.jobscheduler.dto.UpdateJobRequest;
import com.example.jobscheduler.exception.InvalidScheduleException;
import com.example.jobscheduler.exception.JobNotFoundException;
import com.example.jobscheduler.mapper.JobMapper;
import com.example.jobscheduler.service.scheduler.JobRegistry;
import com.example.jobscheduler.service.scheduler.JobSnapshot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.Pageable;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("JobManagementService Tests")
class JobManagementServiceTest {

    @Mock
    private JobRepository jobRepository;

    @Mock
    private JobExecutionRepository executionRepository;

    @Mock
    private JobRegistry jobRegistry;

    @Mock
    private JobMapper jobMapper;

    @Mock
    private MetricsConfig metricsConfig;

    @Captor
    private ArgumentCaptor<Job> jobCaptor;

    @Captor
    private ArgumentCaptor<JobSnapshot> snapshotCaptor;

    @Captor
    private ArgumentCaptor<Pageable> pageableCaptor;

    private JobManagementService jobManagementService;

    private UUID testJobId;
    private Job testJob;
    private JobResponse testJobResponse;

    @BeforeEach
    void setUp() {
        jobManagementService = new JobManagementService(jobRepository, executionRepository, jobRegistry, jobMapper,
                metricsConfig, new JobSchedulerProperties());

        testJobId = UUID.randomUUID();
        testJob = Job.builder()
                .id(testJobId)
                .schedule("0 */5 * * * *")
                .apiEndpoint("https://example.test/hook")
                .type(ExecutionType.ATLEAST_ONCE)
                .active(true)
                .createdAt(Instant.now())
                .updatedAt(Instant.now())
                .build();

        testJobResponse = JobResponse.builder()
                .id(testJobId)
                .schedule("0 */5 * * * *")
                .apiEndpoint("https://example.test/hook")
                .type(ExecutionType.ATLEAST_ONCE)
                .active(true)
                .build();
    }

    @Nested
    @DisplayName("Create Job")
    class CreateJobTests {

        @Test
        @DisplayName("Should save, register and return the job with its next run")
        void shouldCreateJob() {
            // Given
            var request = CreateJobRequest.builder()
                    .schedule(" 0 */5 * * * * ")
                    .api("https://example.test/hook")
                    .build();
            var next = Instant.parse("2030-01-01T00:05:00Z");

            when(jobRepository.save(any(Job.class))).thenReturn(testJob);
            when(jobRepository.findById(testJobId)).thenReturn(Optional.of(testJob));
            when(jobMapper.toResponse(testJob)).thenReturn(testJobResponse);
            when(jobRegistry.getNextExecution(testJobId)).thenReturn(Optional.of(next));
            when(jobRegistry.getLastExecution(testJobId)).thenReturn(Optional.empty());

            // When
            var result = jobManagementService.createJob(request);

            // Then
            verify(jobRepository).save(jobCaptor.capture());
            var saved = jobCaptor.getValue();
            assertThat(saved.getSchedule()).isEqualTo("0 */5 * * * *");
            assertThat(saved.getType()).isEqualTo(ExecutionType.ATLEAST_ONCE);
            assertThat(saved.isActive()).isTrue();

            verify(jobRegistry).addJob(snapshotCaptor.capture());
            assertThat(snapshotCaptor.getValue().getId()).isEqualTo(testJobId);
            verify(metricsConfig).recordJobEvent("created");

            assertThat(result.getNextExecution()).isEqualTo(next);
        }

        @Test
        @DisplayName("Should reject an invalid schedule before saving")
        void shouldRejectInvalidSchedule() {
            var request = CreateJobRequest.builder().schedule("* * * *").api("https://example.test/hook").build();

            assertThatThrownBy(() -> jobManagementService.createJob(request))
                    .isInstanceOf(InvalidScheduleException.class)
                    .hasMessageStartingWith("Invalid schedule format: Invalid CRON expression");

            verify(jobRepository, never()).save(any());
            verifyNoInteractions(jobRegistry);
        }

        @ParameterizedTest
        @ValueSource(strings = {"not a url", "ftp://example.test/file", "/relative/path", "http://"})
        @DisplayName("Should reject endpoints that are not absolute http(s) URLs")
        void shouldRejectInvalidEndpoint(String api) {
            var request = CreateJobRequest.builder().schedule("* * * * * *").api(api).build();

            assertThatThrownBy(() -> jobManagementService.createJob(request))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessage("Invalid API endpoint URL");

            verify(jobRepository, never()).save(any());
        }
    }

    @Nested
    @DisplayName("Update Job")
    class UpdateJobTests {

        @Test
        @DisplayName("Should reject an empty update")
        void shouldRejectEmptyUpdate() {
            assertThatThrownBy(() -> jobManagementService.updateJob(testJobId, new UpdateJobRequest()))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessage("No fields to update");

            verifyNoInteractions(jobRepository);
        }

        @Test
        @DisplayName("Should throw when the job does not exist")
        void shouldThrowWhenNotFound() {
            when(jobRepository.findById(testJobId)).thenReturn(Optional.empty());
            var request = UpdateJobRequest.builder().active(false).build();

            assertThatThrownBy(() -> jobManagementService.updateJob(testJobId, request))
                    .isInstanceOf(JobNotFoundException.class);
        }

        @Test
        @DisplayName("Should apply provided fields and re-register the job")
        void shouldUpdateJob() {
            // Given
            var request = UpdateJobRequest.builder().schedule("0 0 * * * *").active(false).build();
            when(jobRepository.findById(testJobId)).thenReturn(Optional.of(testJob));
            when(jobRepository.save(any(Job.class))).thenAnswer(invocation -> invocation.getArgument(0));
            when(jobMapper.toResponse(any(Job.class))).thenReturn(testJobResponse);

            // When
            jobManagementService.updateJob(testJobId, request);

            // Then
            verify(jobRepository).save(jobCaptor.capture());
            assertThat(jobCaptor.getValue().getSchedule()).isEqualTo("0 0 * * * *");
            assertThat(jobCaptor.getValue().getApiEndpoint()).isEqualTo("https://example.test/hook");
            assertThat(jobCaptor.getValue().isActive()).isFalse();

            verify(jobRegistry).updateJob(snapshotCaptor.capture());
            assertThat(snapshotCaptor.getValue().isActive()).isFalse();
            verify(metricsConfig).recordJobEvent("updated");
        }
    }

    @Nested
    @DisplayName("Delete Job")
    class DeleteJobTests {

        @Test
        @DisplayName("Should unschedule and delete the job")
        void shouldDeleteJob() {
            when(jobRepository.existsById(testJobId)).thenReturn(true);

            jobManagementService.deleteJob(testJobId);

            verify(jobRegistry).removeJob(testJobId);
            verify(jobRepository).deleteById(testJobId);
            verify(metricsConfig).recordJobEvent("deleted");
        }

        @Test
        @DisplayName("Should throw for an unknown job")
        void shouldThrowWhenNotFound() {
            when(jobRepository.existsById(testJobId)).thenReturn(false);

            assertThatThrownBy(() -> jobManagementService.deleteJob(testJobId))
                    .isInstanceOf(JobNotFoundException.class)
                    .hasMessageContaining(testJobId.toString());

            verify(jobRepository, never()).deleteById(any());
            verifyNoInteractions(jobRegistry);
        }
    }

    @Nested
    @DisplayName("Execution History")
    class ExecutionHistoryTests {

        @Test
        @DisplayName("Should default to the configured limit")
        void shouldUseDefaultLimit() {
            var execution = JobExecution.builder().jobId(testJobId).status(ExecutionStatus.SUCCESS).build();
            var response = ExecutionResponse.builder().jobId(testJobId).status(ExecutionStatus.SUCCESS).build();
            when(jobRepository.existsById(testJobId)).thenReturn(true);
            when(executionRepository.findByJobIdOrderByExecutionTimestampDesc(eq(testJobId), any())).thenReturn(List.of(execution));
            when(jobMapper.toExecutionResponses(List.of(execution))).thenReturn(List.of(response));

            var result = jobManagementService.getJobExecutions(testJobId, null);

            verify(executionRepository).findByJobIdOrderByExecutionTimestampDesc(eq(testJobId), pageableCaptor.capture());
            assertThat(pageableCaptor.getValue().getPageSize()).isEqualTo(5);
            assertThat(result.getCount()).isEqualTo(1);
            assertThat(result.getJobId()).isEqualTo(testJobId);
        }

        @Test
        @DisplayName("Should cap large limits")
        void shouldCapLimit() {
            when(jobRepository.existsById(testJobId)).thenReturn(true);
            when(executionRepository.findByJobIdOrderByExecutionTimestampDesc(eq(testJobId), any())).thenReturn(List.of());
            when(jobMapper.toExecutionResponses(List.of())).thenReturn(List.of());

            var result = jobManagementService.getJobExecutions(testJobId, 50_000);

            verify(executionRepository).findByJobIdOrderByExecutionTimestampDesc(eq(testJobId), pageableCaptor.capture());
            assertThat(pageableCaptor.getValue().getPageSize()).isEqualTo(1000);
            assertThat(result.getCount()).isZero();
        }

        @Test
        @DisplayName("Should throw for an unknown job")
        void shouldThrowForUnknownJob() {
            when(jobRepository.existsById(testJobId)).thenReturn(false);

            assertThatThrownBy(() -> jobManagementService.getJobExecutions(testJobId, 10))
                    .isInstanceOf(JobNotFoundException.class);
        }

        @Test
        @DisplayName("Should page all executions newest first")
        void shouldListExecutions() {
            when(executionRepository.findAll(any(Pageable.class))).thenReturn(new PageImpl<>(List.of()));

            jobManagementService.listExecutions(null, 2, 25);

            verify(executionRepository).findAll(pageableCaptor.capture());
            var pageable = pageableCaptor.getValue();
            assertThat(pageable.getPageNumber()).isEqualTo(2);
            assertThat(pageable.getPageSize()).isEqualTo(25);
            assertThat(pageable.getSort().getOrderFor("executionTimestamp")).isNotNull();
            assertThat(pageable.getSort().getOrderFor("executionTimestamp").isDescending()).isTrue();
        }
    }
}
