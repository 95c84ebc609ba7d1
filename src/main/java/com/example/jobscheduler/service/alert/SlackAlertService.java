package com.example.jobscheduler.service.alert;

import com.example.jobscheduler.config.SlackProperties;
import com.example.jobscheduler.dto.FailureSummary;
import com.slack.api.Slack;
import com.slack.api.model.Attachment;
import com.slack.api.model.Field;
import com.slack.api.webhook.Payload;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Arrays;
import java.util.List;

/**
 * Service for sending job failure alerts to Slack.
 * <p>
 * A failed webhook call is logged and never propagated.
 */
@Slf4j
@Service
public class SlackAlertService {

    private static final DateTimeFormatter DATE_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss z").withZone(ZoneId.systemDefault());

    private final SlackProperties slackProperties;
    private final Slack slack;

    @Value("${spring.application.name:job-scheduler}")
    private String applicationName;

    public SlackAlertService(SlackProperties slackProperties) {
        this(slackProperties, Slack.getInstance());
    }

    SlackAlertService(SlackProperties slackProperties, Slack slack) {
        this.slackProperties = slackProperties;
        this.slack = slack;
    }

    public boolean isConfigured() {
        return slackProperties.isEnabled() && slackProperties.getWebhookUrl() != null && !slackProperties.getWebhookUrl().isBlank();
    }

    /**
     * Send an alert for a job with recent failures
     *
     * @return true if Slack accepted the message
     */
    public boolean sendJobFailureAlert(FailureSummary failure) {
        if (!isConfigured()) {
            log.debug("Slack alerting is disabled or webhook URL not configured. No alert sent for job {}", failure.getJobId());
            return false;
        }

        try {
            var response = slack.send(slackProperties.getWebhookUrl(), buildFailurePayload(failure));

            if (response.getCode() != 200) {
                log.error("Failed to send Slack alert. Response code: {}, body: {}", response.getCode(), response.getBody());
                return false;
            }

            log.info("Slack alert sent for job {}", failure.getJobId());
            return true;
        } catch (Exception e) {
            log.error("Error sending Slack alert for job {}: {}", failure.getJobId(), e.getMessage(), e);
            return false;
        }
    }

    private Payload buildFailurePayload(FailureSummary failure) {
        var jobId = failure.getJobId().toString();
        var lastError = failure.getLastError() != null ? failure.getLastError() : "Unknown error";

        return Payload.builder()
                .channel(slackProperties.getChannel())
                .username(applicationName)
                .iconEmoji(":rotating_light:")
                .text(":rotating_light: *Job Failing - " + failure.getFailureCount() + " failed execution(s)*")
                .attachments(List.of(
                        Attachment.builder()
                                .color("danger")
                                .title(failure.getApiEndpoint())
                                .titleLink(buildExecutionsLink(jobId))
                                .fields(Arrays.asList(
                                        Field.builder()
                                                .title("Job ID")
                                                .value(jobId)
                                                .valueShortEnough(true)
                                                .build(),
                                        Field.builder()
                                                .title("Failures")
                                                .value(String.valueOf(failure.getFailureCount()))
                                                .valueShortEnough(true)
                                                .build(),
                                        Field.builder()
                                                .title("Last Failure")
                                                .value(failure.getLastFailure() != null ? DATE_FORMATTER.format(failure.getLastFailure()) : "-")
                                                .valueShortEnough(true)
                                                .build(),
                                        Field.builder()
                                                .title("Last Error")
                                                .value("```" + truncate(lastError, 400) + "```")
                                                .valueShortEnough(false)
                                                .build()
                                ))
                                .footer(applicationName)
                                .ts(String.valueOf(Instant.now().getEpochSecond()))
                                .build()
                ))
                .build();
    }

    private String buildExecutionsLink(String jobId) {
        return slackProperties.getDashboardBaseUrl() + "/api/v1/executions/" + jobId;
    }

    private String truncate(String text, int maxLength) {
        if (text == null) {
            return "";
        }
        if (text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength - 3) + "...";
    }
}
