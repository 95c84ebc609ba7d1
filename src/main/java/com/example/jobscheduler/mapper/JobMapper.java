package com.example.jobscheduler.mapper;

import com.example.jobscheduler.domain.entity.Job;
import com.example.jobscheduler.domain.entity.JobExecution;
import com.example.jobscheduler.dto.ExecutionResponse;
import com.example.jobscheduler.dto.JobResponse;
import org.mapstruct.Mapper;
import org.mapstruct.ReportingPolicy;

import java.util.List;

/**
 * MapStruct mapper for converting between entities and DTOs
 */
@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.IGNORE)
public interface JobMapper {

    /**
     * Convert Job entity to JobResponse DTO; scheduler state is filled in separately
     */
    JobResponse toResponse(Job job);

    List<JobResponse> toResponseList(List<Job> jobs);

    ExecutionResponse toExecutionResponse(JobExecution execution);

    List<ExecutionResponse> toExecutionResponses(List<JobExecution> executions);
}
