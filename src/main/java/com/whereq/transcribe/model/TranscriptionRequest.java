package com.whereq.transcribe.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request sent to the transcription service for one job
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TranscriptionRequest {
    /**
     * Job identifier, sent as the remote display name
     */
    private String jobId;

    private String prompt;

    private String mimeType;

    private byte[] content;
}
