package com.example.jobscheduler.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

/**
 * Executors and clock used by the scheduling loop.
 * <p>
 * Due jobs are dispatched on a dedicated pool so the tick thread never
 * waits on an outbound call.
 */
@Slf4j
@Configuration
public class AsyncConfig {

    /**
     * Fixed-size executor for outbound job calls. On shutdown it lets in-flight
     * calls finish, waiting at most one request timeout plus a short grace period.
     */
    @Bean(name = "jobDispatchExecutor")
    public ThreadPoolTaskExecutor jobDispatchExecutor(JobSchedulerProperties properties) {
        log.info("Creating job dispatch executor with {} threads", properties.getDispatchPoolSize());

        var executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getDispatchPoolSize());
        executor.setMaxPoolSize(properties.getDispatchPoolSize());
        executor.setThreadNamePrefix("job-dispatch-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(properties.getRequestTimeoutSeconds() + 5);
        // started and stopped by the container through InitializingBean and DisposableBean
        return executor;
    }

    /**
     * Source of "now" for scheduling decisions
     */
    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
