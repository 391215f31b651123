package com.whereq.transcribe.store;

import com.whereq.transcribe.exception.JobNotFoundException;
import com.whereq.transcribe.model.ResourceRef;
import com.whereq.transcribe.model.TranscriptionJob;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Single-process job store. Records are copied on the way in and out so callers
 * never share instances, matching the Redis store's serialization boundary.
 */
@Slf4j
@Service
@ConditionalOnProperty(prefix = "transcribe.store", name = "type", havingValue = "MEMORY")
public class InMemoryJobStore implements JobStore {

    private final Map<String, TranscriptionJob> jobs = new ConcurrentHashMap<>();
    private final Set<String> queue = new LinkedHashSet<>();
    private final Clock clock;

    public InMemoryJobStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Mono<String> createJob(String ownerRef, String correlationRef, ResourceRef resource, String payload) {
        return Mono.fromCallable(() -> JobStore.newJob(ownerRef, correlationRef, resource, payload, clock.instant()))
            .flatMap(job -> updateJob(job)
                .then(enqueue(job.getJobId()))
                .thenReturn(job.getJobId()))
            .doOnSuccess(jobId -> log.info("Created job {} for {}", jobId, correlationRef));
    }

    @Override
    public Mono<TranscriptionJob> getJob(String jobId) {
        return findJob(jobId)
            .switchIfEmpty(Mono.error(() -> new JobNotFoundException(jobId)));
    }

    @Override
    public Mono<TranscriptionJob> findJob(String jobId) {
        return Mono.fromSupplier(() -> copy(jobs.get(jobId)));
    }

    @Override
    public Mono<Void> updateJob(TranscriptionJob job) {
        return Mono.fromRunnable(() -> jobs.put(job.getJobId(), copy(job)));
    }

    @Override
    public Mono<List<String>> queueSnapshot() {
        return Mono.fromSupplier(() -> {
            synchronized (queue) {
                return List.copyOf(queue);
            }
        });
    }

    @Override
    public Mono<Void> removeFromQueue(String jobId) {
        return Mono.fromRunnable(() -> {
            synchronized (queue) {
                queue.remove(jobId);
            }
        });
    }

    @Override
    public Mono<Void> enqueue(String jobId) {
        return Mono.fromRunnable(() -> {
            synchronized (queue) {
                queue.add(jobId);
            }
        });
    }

    @Override
    public Mono<Long> queueDepth() {
        return Mono.fromSupplier(() -> {
            synchronized (queue) {
                return (long) queue.size();
            }
        });
    }

    @Override
    public Flux<TranscriptionJob> allJobs() {
        return Flux.defer(() -> Flux.fromIterable(new ArrayList<>(jobs.values())))
            .map(this::copy);
    }

    @Override
    public Mono<Void> deleteJob(String jobId) {
        return Mono.fromRunnable(() -> jobs.remove(jobId));
    }

    private TranscriptionJob copy(TranscriptionJob job) {
        return job == null ? null : job.toBuilder().build();
    }
}
