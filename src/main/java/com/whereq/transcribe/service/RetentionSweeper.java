package com.whereq.transcribe.service;

import com.whereq.transcribe.config.TranscribeProperties;
import com.whereq.transcribe.model.TranscriptionJob;
import com.whereq.transcribe.store.JobStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;

/**
 * Deletes terminal job records older than the retention horizon.
 * Pending and processing jobs are never touched.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RetentionSweeper {

    private final JobStore jobStore;
    private final TranscribeProperties properties;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    private Counter deletedCounter;

    @PostConstruct
    public void initialize() {
        deletedCounter = Counter.builder("transcribe.sweeper.deleted")
            .description("Number of expired job records deleted")
            .register(meterRegistry);
    }

    @Scheduled(cron = "${transcribe.retention.cron:0 0 3 * * *}")
    public void scheduledSweep() {
        sweep()
            .doOnError(e -> log.error("Retention sweep failed", e))
            .onErrorResume(e -> Mono.empty())
            .block();
    }

    /**
     * Delete expired terminal jobs
     *
     * @return Mono with the number of deleted records
     */
    public Mono<Long> sweep() {
        return Mono.defer(() -> {
            Instant cutoff = clock.instant().minus(properties.getRetention().getHorizon());

            return jobStore.allJobs()
                .filter(job -> isExpired(job, cutoff))
                .concatMap(job -> jobStore.deleteJob(job.getJobId())
                    .doOnSuccess(v -> log.debug("Deleted expired job {} ({})", job.getJobId(), job.getStatus()))
                    .thenReturn(job.getJobId()))
                .count()
                .doOnNext(deleted -> {
                    deletedCounter.increment(deleted);
                    log.info("Retention sweep deleted {} jobs finished before {}", deleted, cutoff);
                });
        });
    }

    private boolean isExpired(TranscriptionJob job, Instant cutoff) {
        if (job.getStatus() == null || !job.getStatus().isTerminal()) {
            return false;
        }
        Instant finishedAt = job.getCompletedAt() != null ? job.getCompletedAt() : job.getCreatedAt();
        return finishedAt != null && finishedAt.isBefore(cutoff);
    }
}
