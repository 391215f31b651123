package com.whereq.transcribe.exception;

/**
 * Exception thrown when no record exists for a job id
 */
public class JobNotFoundException extends TranscriptionException {
    private final String jobId;

    public JobNotFoundException(String jobId) {
        super("Job not found: " + jobId);
        this.jobId = jobId;
    }

    public String getJobId() {
        return jobId;
    }
}
