package com.whereq.transcribe.service;

import com.whereq.transcribe.client.TranscriptionClient;
import com.whereq.transcribe.config.TranscribeProperties;
import com.whereq.transcribe.exception.InvalidResourceException;
import com.whereq.transcribe.exception.PermanentSubmissionException;
import com.whereq.transcribe.exception.ResourceNotFoundException;
import com.whereq.transcribe.exception.ResourceTooLargeException;
import com.whereq.transcribe.model.JobStatus;
import com.whereq.transcribe.model.ResourceRef;
import com.whereq.transcribe.model.TranscriptionJob;
import com.whereq.transcribe.model.TranscriptionRequest;
import com.whereq.transcribe.resource.ResourceStore;
import com.whereq.transcribe.store.JobStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.function.Function;

/**
 * Submits pending jobs to the transcription service.
 * <p>
 * Precondition failures (oversized or unreadable resource) fail the job without
 * consuming an attempt. Transient submission errors consume one attempt and leave
 * the job pending until the attempts run out.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobSubmitter {

    private final JobStore jobStore;
    private final ResourceStore resourceStore;
    private final TranscriptionClient transcriptionClient;
    private final JobFailureHandler failureHandler;
    private final TranscribeProperties properties;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    private Counter submittedCounter;
    private Counter retryCounter;

    @PostConstruct
    public void initialize() {
        submittedCounter = Counter.builder("transcribe.jobs.submitted")
            .description("Number of jobs accepted by the transcription service")
            .register(meterRegistry);

        retryCounter = Counter.builder("transcribe.jobs.submission.retries")
            .description("Number of transient submission failures left for retry")
            .register(meterRegistry);
    }

    /**
     * Submit one pending job
     *
     * @param job a pending job; any other status is returned unchanged
     * @return Mono with the job after this attempt
     */
    public Mono<TranscriptionJob> submit(TranscriptionJob job) {
        if (job.getStatus() != JobStatus.PENDING) {
            log.debug("Skipping submission of job {} in status {}", job.getJobId(), job.getStatus());
            return Mono.just(job);
        }

        try {
            checkPreconditions(job.getResource());
        } catch (InvalidResourceException e) {
            return whilePending(job, current -> failureHandler.fail(current, e.getMessage()));
        }

        return resourceStore.load(job.getResource())
            .onErrorMap(e -> !(e instanceof ResourceNotFoundException),
                e -> new ResourceNotFoundException("Resource unreadable: " + job.getResource().getResourceId(), e))
            .doOnNext(content -> checkLoadedSize(job.getResource(), content))
            .flatMap(content -> transcriptionClient.submit(buildRequest(job, content)))
            .map(this::processingWith)
            .onErrorResume(e -> Mono.just(submissionFailure(e)))
            // store errors raised while recording the outcome propagate to the caller
            .flatMap(outcome -> whilePending(job, outcome))
            .defaultIfEmpty(job);
    }

    /**
     * Apply an outcome to the stored record, provided it is still pending. Another tick
     * may have moved the job on since this one read it.
     */
    private Mono<TranscriptionJob> whilePending(TranscriptionJob job,
                                                Function<TranscriptionJob, Mono<TranscriptionJob>> outcome) {
        return jobStore.findJob(job.getJobId())
            .flatMap(current -> {
                if (current.getStatus() != JobStatus.PENDING) {
                    log.warn("Job {} moved to {} during this submission, keeping the stored record",
                        current.getJobId(), current.getStatus());
                    return Mono.just(current);
                }
                return outcome.apply(current);
            })
            .switchIfEmpty(Mono.fromSupplier(() -> {
                log.warn("Job {} was removed during submission", job.getJobId());
                return job;
            }));
    }

    private Function<TranscriptionJob, Mono<TranscriptionJob>> processingWith(String handle) {
        return current -> markProcessing(current, handle);
    }

    private Function<TranscriptionJob, Mono<TranscriptionJob>> submissionFailure(Throwable error) {
        return current -> handleSubmissionError(current, error);
    }

    private void checkPreconditions(ResourceRef resource) {
        if (resource == null || resource.getResourceId() == null) {
            throw new ResourceNotFoundException("Resource reference is missing");
        }
        long maxBytes = properties.getSubmission().getMaxResourceBytes();
        if (resource.getSizeBytes() > maxBytes) {
            throw new ResourceTooLargeException(String.format(
                "Resource %s is %d bytes, which exceeds the %d byte limit for queued transcription",
                resource.getResourceId(), resource.getSizeBytes(), maxBytes));
        }
    }

    private void checkLoadedSize(ResourceRef resource, byte[] content) {
        long maxBytes = properties.getSubmission().getMaxResourceBytes();
        if (content.length > maxBytes) {
            throw new ResourceTooLargeException(String.format(
                "Resource %s grew to %d bytes, which exceeds the %d byte limit for queued transcription",
                resource.getResourceId(), content.length, maxBytes));
        }
    }

    private TranscriptionRequest buildRequest(TranscriptionJob job, byte[] content) {
        return TranscriptionRequest.builder()
            .jobId(job.getJobId())
            .prompt(job.getRequestPayload())
            .mimeType(job.getResource().getMimeType())
            .content(content)
            .build();
    }

    private Mono<TranscriptionJob> markProcessing(TranscriptionJob job, String handle) {
        job.setExternalHandle(handle);
        job.setStatus(JobStatus.PROCESSING);
        job.setSubmittedAt(clock.instant());
        job.setLastError(null);

        return jobStore.updateJob(job)
            .doOnSuccess(v -> {
                submittedCounter.increment();
                log.info("Job {} processing remotely as {}", job.getJobId(), handle);
            })
            .thenReturn(job);
    }

    private Mono<TranscriptionJob> recordTransientFailure(TranscriptionJob job, Throwable error) {
        int attempts = job.getAttempts() + 1;
        int maxAttempts = properties.getSubmission().getMaxAttempts();
        job.setAttempts(attempts);

        if (attempts >= maxAttempts) {
            return failureHandler.fail(job, "Submission failed after " + attempts + " attempts: " + error.getMessage());
        }

        job.setLastError(error.getMessage());
        retryCounter.increment();
        log.warn("Submission of job {} failed (attempt {}/{}), will retry: {}",
            job.getJobId(), attempts, maxAttempts, error.getMessage());
        return jobStore.updateJob(job).thenReturn(job);
    }
}
