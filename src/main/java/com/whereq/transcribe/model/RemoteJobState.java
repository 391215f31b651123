package com.whereq.transcribe.model;

/**
 * State of a job as reported by the transcription service
 */
public enum RemoteJobState {
    RUNNING,
    SUCCEEDED,
    FAILED,

    /**
     * Unrecognized state, left for the next tick
     */
    UNKNOWN
}
