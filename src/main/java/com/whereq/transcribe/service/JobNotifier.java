package com.whereq.transcribe.service;

import com.whereq.transcribe.config.TranscribeProperties;
import com.whereq.transcribe.exception.NotificationDeliveryException;
import com.whereq.transcribe.model.TranscriptionJob;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Sends terminal job notifications to the job owner through a mail relay webhook.
 * Delivery is best effort: failures are logged and never reach the caller.
 */
@Slf4j
@Service
public class JobNotifier {

    private final WebClient.Builder webClientBuilder;
    private final Clock clock;
    private final String webhookUrl;
    private final Duration timeout;

    public JobNotifier(WebClient.Builder webClientBuilder, Clock clock, TranscribeProperties properties) {
        this.webClientBuilder = webClientBuilder;
        this.clock = clock;
        this.webhookUrl = properties.getNotification().getWebhookUrl();
        this.timeout = properties.getNotification().getTimeout();
    }

    /**
     * Notify the owner about a terminal job
     *
     * @param job the finalized job
     * @param success true when a transcript document was created
     * @return Mono that completes when the notification was handed off or dropped
     */
    public Mono<Void> notify(TranscriptionJob job, boolean success) {
        Map<String, Object> payload = buildPayload(job, success);

        if (job.getOwnerRef() == null || job.getOwnerRef().isBlank()) {
            log.warn("Job {} has no owner, notification dropped: {}", job.getJobId(), payload.get("subject"));
            return Mono.empty();
        }

        if (webhookUrl == null || webhookUrl.isBlank()) {
            log.info("Notification for {} (job {}): {}", job.getOwnerRef(), job.getJobId(), payload.get("subject"));
            return Mono.empty();
        }

        return webClientBuilder.build()
            .post()
            .uri(webhookUrl)
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(payload)
            .retrieve()
            .toBodilessEntity()
            .timeout(timeout)
            .doOnSuccess(response -> log.info("Notification sent for job {} to {}: {}",
                job.getJobId(), job.getOwnerRef(), response.getStatusCode()))
            .onErrorMap(e -> new NotificationDeliveryException(
                "Failed to send notification for job " + job.getJobId() + ": " + e.getMessage(), e))
            .doOnError(error -> log.error(error.getMessage()))
            .onErrorResume(e -> Mono.empty()) // Don't fail the job if the notification fails
            .then();
    }

    Map<String, Object> buildPayload(TranscriptionJob job, boolean success) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("to", job.getOwnerRef());
        payload.put("jobId", job.getJobId());
        payload.put("correlationRef", job.getCorrelationRef());
        payload.put("status", job.getStatus().name());

        StringBuilder body = new StringBuilder();
        if (success) {
            payload.put("subject", "Transcript ready: " + job.getCorrelationRef());
            body.append("The queued transcription for ").append(job.getCorrelationRef())
                .append(" has finished.\n\n");
            if (job.getArtifact() != null) {
                payload.put("artifactLocation", job.getArtifact().getLocation());
                body.append("Transcript: ").append(job.getArtifact().getLocation()).append('\n');
            }
        } else {
            payload.put("subject", "Transcription failed: " + job.getCorrelationRef());
            payload.put("error", job.getLastError());
            body.append("The queued transcription for ").append(job.getCorrelationRef())
                .append(" could not be completed.\n\n")
                .append("Error: ").append(job.getLastError()).append("\n\n")
                .append("You can retry from the observation using the manual transcription option.\n");
        }
        body.append("\nJob: ").append(job.getJobId()).append('\n');

        payload.put("body", body.toString());
        payload.put("timestamp", clock.instant().toString());
        return payload;
    }
}
