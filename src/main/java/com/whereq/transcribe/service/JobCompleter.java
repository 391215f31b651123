package com.whereq.transcribe.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.whereq.transcribe.artifact.ArtifactStore;
import com.whereq.transcribe.config.TranscribeProperties;
import com.whereq.transcribe.exception.LockAcquisitionTimeoutException;
import com.whereq.transcribe.lock.DistributedLock;
import com.whereq.transcribe.model.ArtifactRef;
import com.whereq.transcribe.model.CompletionOutcome;
import com.whereq.transcribe.model.JobStatus;
import com.whereq.transcribe.model.TranscriptionJob;
import com.whereq.transcribe.store.JobStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Turns a successful remote result into a transcript document and finalizes the job.
 * <p>
 * Runs under the job's completion lock and re-reads the record once the lock is held,
 * so concurrent ticks complete a job at most once. Extraction and document failures
 * fail the job instead of leaving it processing.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobCompleter {

    static final String LOCK_PREFIX = "complete:";

    private final JobStore jobStore;
    private final ArtifactStore artifactStore;
    private final DistributedLock distributedLock;
    private final TranscriptFormatter formatter;
    private final JobFailureHandler failureHandler;
    private final JobNotifier notifier;
    private final TranscribeProperties properties;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    private Counter completedCounter;
    private Counter lockTimeoutCounter;

    @PostConstruct
    public void initialize() {
        completedCounter = Counter.builder("transcribe.jobs.completed")
            .description("Number of jobs with a transcript document")
            .register(meterRegistry);

        lockTimeoutCounter = Counter.builder("transcribe.completion.lock.timeouts")
            .description("Completions skipped because the job lock was busy")
            .register(meterRegistry);
    }

    /**
     * Complete a job from its remote result
     *
     * @param jobId job identifier
     * @param rawResult generation result reported by the transcription service
     * @return Mono with the completion outcome
     */
    public Mono<CompletionOutcome> complete(String jobId, JsonNode rawResult) {
        Duration lockTimeout = properties.getCompletion().getLockTimeout();
        String lockName = LOCK_PREFIX + jobId;

        return distributedLock.withLock(lockName, lockTimeout, () -> completeLocked(jobId, rawResult))
            .switchIfEmpty(Mono.error(() -> new LockAcquisitionTimeoutException(lockName, lockTimeout)))
            .onErrorResume(LockAcquisitionTimeoutException.class, e -> {
                lockTimeoutCounter.increment();
                log.info("Completion of job {} deferred: {}", jobId, e.getMessage());
                return Mono.just(CompletionOutcome.LOCK_TIMEOUT);
            });
    }

    private Mono<CompletionOutcome> completeLocked(String jobId, JsonNode rawResult) {
        return jobStore.getJob(jobId).flatMap(job -> {
            if (job.getStatus().isTerminal()) {
                log.info("Job {} already {}, nothing to complete", jobId, job.getStatus());
                return Mono.just(CompletionOutcome.ALREADY_TERMINAL);
            }

            Instant now = clock.instant();
            return Mono.fromCallable(() -> formatter.renderDocument(job, formatter.extractText(rawResult), now))
                .flatMap(document -> artifactStore.createDocument(job, document))
                // finalization errors propagate; the next tick re-runs and the document is replaced, not duplicated
                .onErrorResume(e -> failureHandler.fail(job, e.getMessage()).then(Mono.<ArtifactRef>empty()))
                .flatMap(artifact -> finalizeComplete(job, artifact))
                .defaultIfEmpty(CompletionOutcome.FAILED);
        });
    }

    private Mono<CompletionOutcome> finalizeComplete(TranscriptionJob job, ArtifactRef artifact) {
        job.setStatus(JobStatus.COMPLETE);
        job.setCompletedAt(clock.instant());
        job.setArtifact(artifact);
        job.setLastError(null);

        return jobStore.updateJob(job)
            .then(jobStore.removeFromQueue(job.getJobId()))
            .doOnSuccess(v -> {
                completedCounter.increment();
                log.info("Job {} complete, transcript at {}", job.getJobId(), artifact.getLocation());
            })
            .then(notifier.notify(job, true))
            .thenReturn(CompletionOutcome.COMPLETED);
    }
}
