package com.whereq.transcribe.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.whereq.transcribe.config.TranscribeProperties;
import com.whereq.transcribe.exception.JobNotFoundException;
import com.whereq.transcribe.model.JobStatus;
import com.whereq.transcribe.model.TranscriptionJob;
import com.whereq.transcribe.support.MutableClock;
import com.whereq.transcribe.support.TestJobs;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.data.redis.core.ReactiveValueOperations;
import org.springframework.data.redis.core.ReactiveZSetOperations;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.script.RedisScript;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@SuppressWarnings("unchecked")
class RedisJobStoreTest {

    private static final Instant NOW = Instant.parse("2026-03-02T10:00:00Z");

    private ReactiveRedisTemplate<String, String> redisTemplate;
    private ReactiveValueOperations<String, String> valueOps;
    private ReactiveZSetOperations<String, String> zSetOps;
    private ObjectMapper objectMapper;
    private RedisJobStore store;

    @BeforeEach
    void setUp() {
        redisTemplate = mock(ReactiveRedisTemplate.class);
        valueOps = mock(ReactiveValueOperations.class);
        zSetOps = mock(ReactiveZSetOperations.class);
        when(redisTemplate.opsForValue()).thenReturn(valueOps);
        when(redisTemplate.opsForZSet()).thenReturn(zSetOps);

        objectMapper = new ObjectMapper().findAndRegisterModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

        store = new RedisJobStore(redisTemplate, objectMapper, new MutableClock(NOW), new TranscribeProperties());
    }

    @Test
    void createJobWritesRecordAndRunsEnqueueScript() {
        when(valueOps.set(anyString(), anyString())).thenReturn(Mono.just(true));
        when(redisTemplate.execute(any(RedisScript.class), anyList(), anyList())).thenReturn(Flux.just(1L));

        String jobId = store.createJob(TestJobs.OWNER, TestJobs.CORRELATION, TestJobs.resource(1024), "prompt")
            .block();

        ArgumentCaptor<String> json = ArgumentCaptor.forClass(String.class);
        verify(valueOps).set(eq("transcribe:job:" + jobId), json.capture());
        assertThat(json.getValue()).contains("\"status\":\"PENDING\"", "\"attempts\":0");

        verify(redisTemplate).execute(any(RedisScript.class),
            eq(List.of("transcribe:queue", "transcribe:queue:seq")), eq(List.of(jobId)));
    }

    @Test
    void findJobReadsRecordUnderPrefixedKey() throws Exception {
        TranscriptionJob job = TranscriptionJob.builder()
            .jobId("job-1")
            .ownerRef(TestJobs.OWNER)
            .correlationRef(TestJobs.CORRELATION)
            .resource(TestJobs.resource(2048))
            .status(JobStatus.PROCESSING)
            .externalHandle("batches/abc")
            .attempts(1)
            .createdAt(NOW)
            .submittedAt(NOW.plusSeconds(60))
            .build();
        when(valueOps.get("transcribe:job:job-1")).thenReturn(Mono.just(objectMapper.writeValueAsString(job)));

        StepVerifier.create(store.findJob("job-1"))
            .expectNext(job)
            .verifyComplete();
    }

    @Test
    void getJobOfMissingRecordFails() {
        when(valueOps.get("transcribe:job:job-missing")).thenReturn(Mono.empty());

        StepVerifier.create(store.getJob("job-missing"))
            .expectError(JobNotFoundException.class)
            .verify();
    }

    @Test
    void queueSnapshotReadsWholeSortedSet() {
        when(zSetOps.range(eq("transcribe:queue"), any())).thenReturn(Flux.just("job-1", "job-2"));

        StepVerifier.create(store.queueSnapshot())
            .expectNext(List.of("job-1", "job-2"))
            .verifyComplete();
    }

    @Test
    void removeFromQueueRemovesMember() {
        when(zSetOps.remove("transcribe:queue", "job-1")).thenReturn(Mono.just(1L));

        StepVerifier.create(store.removeFromQueue("job-1")).verifyComplete();

        verify(zSetOps).remove("transcribe:queue", "job-1");
    }

    @Test
    void queueDepthOfMissingKeyIsZero() {
        when(zSetOps.size("transcribe:queue")).thenReturn(Mono.empty());

        StepVerifier.create(store.queueDepth())
            .expectNext(0L)
            .verifyComplete();
    }

    @Test
    void allJobsSkipsUnreadableRecords() throws Exception {
        TranscriptionJob job = TranscriptionJob.builder()
            .jobId("job-1")
            .status(JobStatus.COMPLETE)
            .createdAt(NOW)
            .build();
        when(redisTemplate.scan(any(ScanOptions.class)))
            .thenReturn(Flux.just("transcribe:job:job-1", "transcribe:job:job-2"));
        when(valueOps.get("transcribe:job:job-1")).thenReturn(Mono.just(objectMapper.writeValueAsString(job)));
        when(valueOps.get("transcribe:job:job-2")).thenReturn(Mono.just("{not json"));

        StepVerifier.create(store.allJobs())
            .expectNextMatches(found -> found.getJobId().equals("job-1"))
            .verifyComplete();
    }

    @Test
    void deleteJobRemovesRecordKey() {
        when(redisTemplate.delete("transcribe:job:job-1")).thenReturn(Mono.just(1L));

        StepVerifier.create(store.deleteJob("job-1")).verifyComplete();

        verify(redisTemplate).delete("transcribe:job:job-1");
    }
}
