package com.whereq.transcribe.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.whereq.transcribe.model.JobStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response for transcription job creation
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CreateTranscriptionJobResponse {
    private String jobId;

    private JobStatus status;

    /**
     * Rough wait until the transcript is ready, based on queue depth and trigger interval
     */
    private Integer estimatedWaitMinutes;

    /**
     * Error message (if the job was not created)
     */
    private String errorMessage;

    /**
     * Create error response
     */
    public static CreateTranscriptionJobResponse error(String message) {
        return CreateTranscriptionJobResponse.builder()
            .errorMessage(message)
            .build();
    }
}
