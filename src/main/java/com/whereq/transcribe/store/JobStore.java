package com.whereq.transcribe.store;

import com.whereq.transcribe.exception.InvalidResourceException;
import com.whereq.transcribe.model.JobStatus;
import com.whereq.transcribe.model.ResourceRef;
import com.whereq.transcribe.model.TranscriptionJob;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Persisted job records plus the ordered queue index of non-terminal job ids.
 * <p>
 * Every operation is individually atomic. Sequences spanning several operations
 * (finalize a record and dequeue it) are ordered by the caller.
 */
public interface JobStore {

    /**
     * Persist a new pending job and append it to the queue
     *
     * @return Mono with the generated job id, or {@link InvalidResourceException}
     */
    Mono<String> createJob(String ownerRef, String correlationRef, ResourceRef resource, String payload);

    /**
     * Get a job record
     *
     * @return Mono with the record, or {@link com.whereq.transcribe.exception.JobNotFoundException}
     */
    Mono<TranscriptionJob> getJob(String jobId);

    /**
     * Get a job record
     *
     * @return Mono with the record, empty if absent
     */
    Mono<TranscriptionJob> findJob(String jobId);

    /**
     * Replace a job record (last writer wins)
     */
    Mono<Void> updateJob(TranscriptionJob job);

    /**
     * Queued job ids in enqueue order
     */
    Mono<List<String>> queueSnapshot();

    Mono<Void> removeFromQueue(String jobId);

    /**
     * Append a job id to the queue. No-op if already queued.
     */
    Mono<Void> enqueue(String jobId);

    Mono<Long> queueDepth();

    /**
     * Every stored job record, in no particular order
     */
    Flux<TranscriptionJob> allJobs();

    Mono<Void> deleteJob(String jobId);

    /**
     * Build the initial record for a new job
     */
    static TranscriptionJob newJob(String ownerRef, String correlationRef, ResourceRef resource,
                                   String payload, Instant now) {
        if (resource == null || resource.getResourceId() == null || resource.getResourceId().isBlank()) {
            throw new InvalidResourceException("Resource reference is missing");
        }
        if (resource.getSizeBytes() < 0) {
            throw new InvalidResourceException("Resource " + resource.getResourceId() + " has no readable size");
        }
        return TranscriptionJob.builder()
            .jobId(generateJobId())
            .ownerRef(ownerRef)
            .correlationRef(correlationRef)
            .resource(resource)
            .requestPayload(payload)
            .status(JobStatus.PENDING)
            .attempts(0)
            .createdAt(now)
            .build();
    }

    /**
     * Generate unique job ID
     */
    static String generateJobId() {
        return "job-" + UUID.randomUUID();
    }
}
