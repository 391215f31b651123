package com.whereq.transcribe.service;

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

/**
 * Terminal failure path shared by submission, polling and completion:
 * persist the failed record, drop it from the queue, notify the owner.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobFailureHandler {

    private final JobStore jobStore;
    private final JobNotifier notifier;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    private Counter failureCounter;

    @PostConstruct
    public void initialize() {
        failureCounter = Counter.builder("transcribe.jobs.failed")
            .description("Number of jobs that ended in failure")
            .register(meterRegistry);
    }

    /**
     * Mark a job failed
     *
     * @param job the job, mutated in place
     * @param reason failure detail stored as last error and sent to the owner
     * @return Mono with the failed job
     */
    public Mono<TranscriptionJob> fail(TranscriptionJob job, String reason) {
        job.setStatus(JobStatus.FAILED);
        job.setLastError(reason);
        job.setCompletedAt(clock.instant());

        return jobStore.updateJob(job)
            .then(jobStore.removeFromQueue(job.getJobId()))
            .doOnSuccess(v -> {
                failureCounter.increment();
                log.warn("Job {} failed after {} attempts: {}", job.getJobId(), job.getAttempts(), reason);
            })
            .then(notifier.notify(job, false))
            .thenReturn(job);
    }
}
