package com.example.jobscheduler.client;

import com.example.jobscheduler.client.ClientModels.JobInvocationRequest;
import com.example.jobscheduler.client.ClientModels.TargetResponse;
import com.example.jobscheduler.config.JobSchedulerProperties;
import com.example.jobscheduler.exception.JobInvocationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.Exceptions;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * Client that calls job endpoints.
 * <p>
 * Every HTTP status is returned to the caller; only calls that got no
 * response at all end in a {@link JobInvocationException}.
 */
@Slf4j
@Component
public class JobTargetClient {

    private final WebClient webClient;
    private final Duration timeout;

    public JobTargetClient(@Qualifier("jobTargetWebClient") WebClient webClient, JobSchedulerProperties properties) {
        this.webClient = webClient;
        this.timeout = Duration.ofSeconds(properties.getRequestTimeoutSeconds());
    }

    /**
     * POST the invocation payload to the job's endpoint
     *
     * @param url     absolute target URL
     * @param request the invocation payload
     * @return status, reason phrase and body of the response
     * @throws JobInvocationException if the call fails before a response arrives
     */
    public TargetResponse invoke(String url, JobInvocationRequest request) {
        log.debug("Invoking job {} at {}", request.getJobId(), url);

        try {
            return webClient.post()
                    .uri(URI.create(url))
                    .bodyValue(request)
                    .exchangeToMono(response -> response.bodyToMono(String.class)
                            .defaultIfEmpty("")
                            .map(body -> TargetResponse.builder()
                                    .statusCode(response.statusCode().value())
                                    .reasonPhrase(reasonPhrase(response.statusCode().value()))
                                    .body(body)
                                    .build()))
                    .timeout(timeout)
                    .block();
        } catch (Exception e) {
            var cause = Exceptions.unwrap(e);
            var noResponse = isNoResponse(cause);
            log.debug("Call to {} failed (noResponse={}): {}", url, noResponse, cause.getMessage());
            throw new JobInvocationException(url, cause.getMessage(), cause, noResponse);
        }
    }

    private static boolean isNoResponse(Throwable error) {
        for (var current = error; current != null; current = current.getCause()) {
            if (current instanceof TimeoutException
                    || current instanceof WebClientRequestException
                    || current instanceof IOException) {
                return true;
            }
        }
        return false;
    }

    private static String reasonPhrase(int statusCode) {
        var status = HttpStatus.resolve(statusCode);
        return status != null ? status.getReasonPhrase() : "";
    }
}
