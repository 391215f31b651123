package com.whereq.transcribe.service;

import com.whereq.transcribe.client.TranscriptionClient;
import com.whereq.transcribe.config.TranscribeProperties;
import com.whereq.transcribe.exception.ExternalProcessingException;
import com.whereq.transcribe.model.CompletionOutcome;
import com.whereq.transcribe.model.JobStatus;
import com.whereq.transcribe.model.PollOutcome;
import com.whereq.transcribe.model.RemoteJobStatus;
import com.whereq.transcribe.model.TranscriptionJob;
import com.whereq.transcribe.store.JobStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Checks processing jobs against the transcription service and hands successful
 * results to the {@link JobCompleter}. Polling never consumes submission attempts.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobPoller {

    private final JobStore jobStore;
    private final TranscriptionClient transcriptionClient;
    private final JobCompleter completer;
    private final JobFailureHandler failureHandler;
    private final TranscribeProperties properties;
    private final Clock clock;

    /**
     * Poll one processing job
     *
     * @param job a processing job; any other status is left unchanged
     * @return Mono with the poll outcome
     */
    public Mono<PollOutcome> poll(TranscriptionJob job) {
        if (job.getStatus() != JobStatus.PROCESSING) {
            return Mono.just(PollOutcome.UNCHANGED);
        }
        if (job.getExternalHandle() == null || job.getExternalHandle().isBlank()) {
            return failWhileProcessing(job, "Processing job has no external handle");
        }
        if (exceededProcessingAge(job)) {
            Duration maxAge = properties.getPoll().getMaxProcessingAge();
            return failWhileProcessing(job, "Transcription did not finish within " + maxAge.toMinutes() + " minutes");
        }

        return transcriptionClient.status(job.getExternalHandle())
            .onErrorResume(e -> {
                log.warn("Status check for job {} ({}) failed, retrying next tick: {}",
                    job.getJobId(), job.getExternalHandle(), e.getMessage());
                return Mono.empty();
            })
            .flatMap(status -> handleStatus(job, status))
            .onErrorResume(ExternalProcessingException.class, e -> failWhileProcessing(job, e.getMessage()))
            .defaultIfEmpty(PollOutcome.UNCHANGED);
    }

    private Mono<PollOutcome> handleStatus(TranscriptionJob job, RemoteJobStatus status) {
        return switch (status.getState()) {
            case RUNNING -> {
                log.debug("Job {} still running remotely ({})", job.getJobId(), status.getRawState());
                yield Mono.just(PollOutcome.RUNNING);
            }
            case SUCCEEDED -> completer.complete(job.getJobId(), status.getResult())
                .map(this::toPollOutcome);
            case FAILED -> Mono.error(new ExternalProcessingException(
                "Transcription service reported failure: " + status.getErrorMessage()));
            case UNKNOWN -> {
                log.warn("Job {} has unrecognized remote state '{}', retrying next tick",
                    job.getJobId(), status.getRawState());
                yield Mono.just(PollOutcome.UNCHANGED);
            }
        };
    }

    /**
     * Fail the stored record only while it is still processing; a concurrent tick may
     * already have completed or failed it.
     */
    private Mono<PollOutcome> failWhileProcessing(TranscriptionJob job, String reason) {
        return jobStore.findJob(job.getJobId())
            .flatMap(current -> {
                if (current.getStatus() != JobStatus.PROCESSING) {
                    log.info("Job {} is already {}, not failing it: {}", current.getJobId(), current.getStatus(), reason);
                    return Mono.just(PollOutcome.UNCHANGED);
                }
                return failureHandler.fail(current, reason).thenReturn(PollOutcome.FAILED);
            })
            .defaultIfEmpty(PollOutcome.UNCHANGED);
    }

    private boolean exceededProcessingAge(TranscriptionJob job) {
        Instant since = job.getSubmittedAt() != null ? job.getSubmittedAt() : job.getCreatedAt();
        if (since == null) {
            return false;
        }
        Duration age = Duration.between(since, clock.instant());
        return age.compareTo(properties.getPoll().getMaxProcessingAge()) > 0;
    }

    private PollOutcome toPollOutcome(CompletionOutcome outcome) {
        return switch (outcome) {
            case COMPLETED -> PollOutcome.COMPLETED;
            case FAILED -> PollOutcome.FAILED;
            case ALREADY_TERMINAL, LOCK_TIMEOUT -> PollOutcome.UNCHANGED;
        };
    }
}
