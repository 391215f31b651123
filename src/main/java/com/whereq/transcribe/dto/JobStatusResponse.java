package com.whereq.transcribe.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.whereq.transcribe.model.ArtifactRef;
import com.whereq.transcribe.model.JobStatus;
import com.whereq.transcribe.model.TranscriptionJob;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Response for job status query
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class JobStatusResponse {
    private String jobId;

    private String correlationRef;

    private JobStatus status;

    /**
     * Transcript document (if complete)
     */
    private ArtifactRef artifact;

    /**
     * Latest error, transient or final
     */
    private String lastError;

    private int attempts;

    private Instant createdAt;

    private Instant submittedAt;

    private Instant completedAt;

    public static JobStatusResponse from(TranscriptionJob job) {
        return JobStatusResponse.builder()
            .jobId(job.getJobId())
            .correlationRef(job.getCorrelationRef())
            .status(job.getStatus())
            .artifact(job.getArtifact())
            .lastError(job.getLastError())
            .attempts(job.getAttempts())
            .createdAt(job.getCreatedAt())
            .submittedAt(job.getSubmittedAt())
            .completedAt(job.getCompletedAt())
            .build();
    }
}
