package com.example.jobscheduler.dto;

import com.example.jobscheduler.domain.enums.ExecutionType;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for a partial job update; null fields are left unchanged
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateJobRequest {

    private String schedule;
    private String api;
    private ExecutionType type;
    private Boolean active;

    @JsonIgnore
    public boolean isEmpty() {
        return schedule == null && api == null && type == null && active == null;
    }
}
