package com.example.jobscheduler.config;

import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the job scheduler.
 * Loaded from application.yml.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "job-scheduler")
public class JobSchedulerProperties {

    /**
     * Load jobs and start ticking once the application is ready
     */
    private boolean enabled = true;

    /**
     * Tick period in milliseconds; also the due/expired tolerance window
     */
    @Min(10)
    private long tickIntervalMs = 100;

    /**
     * Timeout for a single outbound job call
     */
    @Min(1)
    private int requestTimeoutSeconds = 30;

    /**
     * Response bodies are stored up to this many characters
     */
    @Min(0)
    private int responseBodyMaxLength = 1000;

    /**
     * Threads available for concurrent job calls
     */
    @Min(1)
    private int dispatchPoolSize = 20;

    /**
     * Interval of the failure alert sweep
     */
    @Min(1000)
    private long alertCheckIntervalMs = 300000;

    /**
     * How far back the failure alert sweep looks
     */
    @Min(1)
    private int alertLookbackMinutes = 60;

    /**
     * Executions returned per job when no limit is given
     */
    @Min(1)
    private int defaultExecutionLimit = 5;
}
