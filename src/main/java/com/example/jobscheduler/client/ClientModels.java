package com.example.jobscheduler.client;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request/Response models for outbound job calls
 */
public class ClientModels {
    private ClientModels() {
    }

    /**
     * Body POSTed to a job's endpoint; times are ISO-8601
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class JobInvocationRequest {
        private String jobId;
        private String scheduledTime;
        private String executionTime;
    }

    /**
     * Whatever the target answered, 2xx or not
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TargetResponse {
        private int statusCode;
        private String reasonPhrase;
        private String body;

        public boolean is2xxSuccessful() {
            return statusCode >= 200 && statusCode < 300;
        }
    }
}
