package com.whereq.transcribe.model;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Status check result from the transcription service
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RemoteJobStatus {
    private RemoteJobState state;

    /**
     * Raw state string as reported
     */
    private String rawState;

    /**
     * Generation result, present when succeeded
     */
    private JsonNode result;

    /**
     * Error detail, present when failed
     */
    private String errorMessage;

    public static RemoteJobStatus running(String rawState) {
        return RemoteJobStatus.builder().state(RemoteJobState.RUNNING).rawState(rawState).build();
    }

    public static RemoteJobStatus succeeded(JsonNode result) {
        return RemoteJobStatus.builder().state(RemoteJobState.SUCCEEDED).rawState("SUCCEEDED").result(result).build();
    }

    public static RemoteJobStatus failed(String errorMessage) {
        return RemoteJobStatus.builder().state(RemoteJobState.FAILED).rawState("FAILED").errorMessage(errorMessage).build();
    }
}
