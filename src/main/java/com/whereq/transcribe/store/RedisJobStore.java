package com.whereq.transcribe.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.transcribe.config.TranscribeProperties;
import com.whereq.transcribe.exception.JobNotFoundException;
import com.whereq.transcribe.model.ResourceRef;
import com.whereq.transcribe.model.TranscriptionJob;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.domain.Range;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.List;

/**
 * Redis-backed job store.
 * <p>
 * Records are JSON strings under {@code <prefix>:job:<jobId>}. The queue index is a sorted
 * set scored by a sequence counter, which keeps FIFO order and makes enqueue idempotent.
 */
@Slf4j
@Service
@ConditionalOnProperty(prefix = "transcribe.store", name = "type", havingValue = "REDIS", matchIfMissing = true)
public class RedisJobStore implements JobStore {

    // Adds the id with the next sequence number unless it is already queued
    private static final RedisScript<Long> ENQUEUE_SCRIPT = RedisScript.of(
        "if redis.call('ZSCORE', KEYS[1], ARGV[1]) then return 0 end\n" +
        "local seq = redis.call('INCR', KEYS[2])\n" +
        "redis.call('ZADD', KEYS[1], seq, ARGV[1])\n" +
        "return 1",
        Long.class);

    private final ReactiveRedisTemplate<String, String> redisTemplate;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final String jobKeyPrefix;
    private final String queueKey;
    private final String sequenceKey;

    public RedisJobStore(ReactiveRedisTemplate<String, String> redisTemplate,
                         ObjectMapper objectMapper,
                         Clock clock,
                         TranscribeProperties properties) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.clock = clock;

        String prefix = properties.getStore().getKeyPrefix();
        this.jobKeyPrefix = prefix + ":job:";
        this.queueKey = prefix + ":queue";
        this.sequenceKey = prefix + ":queue:seq";
    }

    @Override
    public Mono<String> createJob(String ownerRef, String correlationRef, ResourceRef resource, String payload) {
        return Mono.fromCallable(() -> JobStore.newJob(ownerRef, correlationRef, resource, payload, clock.instant()))
            .flatMap(job -> updateJob(job)
                .then(enqueue(job.getJobId()))
                .thenReturn(job.getJobId()))
            .doOnSuccess(jobId -> log.info("Created job {} for {} (resource {})",
                jobId, correlationRef, resource.getResourceId()));
    }

    @Override
    public Mono<TranscriptionJob> getJob(String jobId) {
        return findJob(jobId)
            .switchIfEmpty(Mono.error(() -> new JobNotFoundException(jobId)));
    }

    @Override
    public Mono<TranscriptionJob> findJob(String jobId) {
        return redisTemplate.opsForValue()
            .get(jobKeyPrefix + jobId)
            .map(this::deserialize);
    }

    @Override
    public Mono<Void> updateJob(TranscriptionJob job) {
        return Mono.fromCallable(() -> serialize(job))
            .flatMap(json -> redisTemplate.opsForValue().set(jobKeyPrefix + job.getJobId(), json))
            .then();
    }

    @Override
    public Mono<List<String>> queueSnapshot() {
        return redisTemplate.opsForZSet()
            .range(queueKey, Range.closed(0L, -1L))
            .collectList();
    }

    @Override
    public Mono<Void> removeFromQueue(String jobId) {
        return redisTemplate.opsForZSet()
            .remove(queueKey, jobId)
            .doOnSuccess(removed -> {
                if (removed != null && removed > 0) {
                    log.debug("Removed job {} from queue", jobId);
                }
            })
            .then();
    }

    @Override
    public Mono<Void> enqueue(String jobId) {
        return redisTemplate.execute(ENQUEUE_SCRIPT, List.of(queueKey, sequenceKey), List.of(jobId))
            .next()
            .doOnSuccess(added -> {
                if (added != null && added == 0L) {
                    log.debug("Job {} already queued", jobId);
                }
            })
            .then();
    }

    @Override
    public Mono<Long> queueDepth() {
        return redisTemplate.opsForZSet()
            .size(queueKey)
            .defaultIfEmpty(0L);
    }

    @Override
    public Flux<TranscriptionJob> allJobs() {
        ScanOptions options = ScanOptions.scanOptions()
            .match(jobKeyPrefix + "*")
            .count(500)
            .build();

        return redisTemplate.scan(options)
            .concatMap(key -> redisTemplate.opsForValue().get(key)
                .flatMap(json -> {
                    try {
                        return Mono.just(objectMapper.readValue(json, TranscriptionJob.class));
                    } catch (JsonProcessingException e) {
                        log.error("Skipping unreadable job record {}", key, e);
                        return Mono.empty();
                    }
                }));
    }

    @Override
    public Mono<Void> deleteJob(String jobId) {
        return redisTemplate.delete(jobKeyPrefix + jobId)
            .doOnSuccess(deleted -> log.debug("Deleted job record {}: {} keys removed", jobId, deleted))
            .then();
    }

    private String serialize(TranscriptionJob job) {
        try {
            return objectMapper.writeValueAsString(job);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize job " + job.getJobId(), e);
        }
    }

    private TranscriptionJob deserialize(String json) {
        try {
            return objectMapper.readValue(json, TranscriptionJob.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to deserialize job record", e);
        }
    }
}
