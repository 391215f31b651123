package com.whereq.transcribe.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Persisted state of one queued transcription
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class TranscriptionJob {
    /**
     * Unique job identifier
     */
    private String jobId;

    /**
     * Owner identity (email), receives the terminal notification
     */
    private String ownerRef;

    /**
     * Business entity (observation) the transcript is linked to
     */
    private String correlationRef;

    /**
     * Media resource to transcribe
     */
    private ResourceRef resource;

    /**
     * Prompt text sent with the resource
     */
    private String requestPayload;

    @Builder.Default
    private JobStatus status = JobStatus.PENDING;

    /**
     * Handle returned by the transcription service, set once on submission
     */
    private String externalHandle;

    /**
     * Failed submission attempts
     */
    @Builder.Default
    private int attempts = 0;

    private String lastError;

    private Instant createdAt;

    private Instant submittedAt;

    private Instant completedAt;

    /**
     * Transcript document, set on completion
     */
    private ArtifactRef artifact;
}
