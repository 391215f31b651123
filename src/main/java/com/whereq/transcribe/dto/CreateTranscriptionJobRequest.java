package com.whereq.transcribe.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request to queue a recording for transcription
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateTranscriptionJobRequest {
    /**
     * Business record the transcript belongs to, e.g. an observation id
     */
    @NotBlank(message = "correlationRef is required")
    private String correlationRef;

    /**
     * Uploaded media resource to transcribe
     */
    @NotBlank(message = "resourceId is required")
    private String resourceId;

    /**
     * Transcription instructions sent along with the media
     */
    @NotBlank(message = "requestPayload is required")
    private String requestPayload;
}
