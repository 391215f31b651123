package com.whereq.transcribe.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.whereq.transcribe.client.TranscriptionClient;
import com.whereq.transcribe.config.TranscribeProperties;
import com.whereq.transcribe.model.CompletionOutcome;
import com.whereq.transcribe.model.JobStatus;
import com.whereq.transcribe.model.PollOutcome;
import com.whereq.transcribe.model.RemoteJobState;
import com.whereq.transcribe.model.RemoteJobStatus;
import com.whereq.transcribe.model.TranscriptionJob;
import com.whereq.transcribe.store.InMemoryJobStore;
import com.whereq.transcribe.support.MutableClock;
import com.whereq.transcribe.support.TestJobs;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class JobPollerTest {

    private MutableClock clock;
    private InMemoryJobStore store;
    private TranscriptionClient transcriptionClient;
    private JobCompleter completer;
    private JobNotifier notifier;
    private JobPoller poller;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-02T10:00:00Z"));
        store = new InMemoryJobStore(clock);
        transcriptionClient = mock(TranscriptionClient.class);
        completer = mock(JobCompleter.class);
        notifier = mock(JobNotifier.class);
        when(notifier.notify(any(), anyBoolean())).thenReturn(Mono.empty());

        JobFailureHandler failureHandler = new JobFailureHandler(store, notifier, new SimpleMeterRegistry(), clock);
        failureHandler.initialize();
        poller = new JobPoller(store, transcriptionClient, completer, failureHandler, new TranscribeProperties(), clock);
    }

    private TranscriptionJob processingJob() {
        return store.getJob(TestJobs.createProcessing(store, "batches/abc")).block();
    }

    @Test
    void runningJobIsLeftProcessing() {
        when(transcriptionClient.status("batches/abc")).thenReturn(Mono.just(RemoteJobStatus.running("BATCH_STATE_RUNNING")));
        TranscriptionJob job = processingJob();

        StepVerifier.create(poller.poll(job))
            .expectNext(PollOutcome.RUNNING)
            .verifyComplete();

        assertThat(store.getJob(job.getJobId()).block()).isEqualTo(job);
    }

    @Test
    void succeededJobIsHandedToCompleter() {
        JsonNode result = TestJobs.generationResult("Transcript");
        when(transcriptionClient.status("batches/abc")).thenReturn(Mono.just(RemoteJobStatus.succeeded(result)));
        TranscriptionJob job = processingJob();
        when(completer.complete(job.getJobId(), result)).thenReturn(Mono.just(CompletionOutcome.COMPLETED));

        StepVerifier.create(poller.poll(job))
            .expectNext(PollOutcome.COMPLETED)
            .verifyComplete();

        verify(completer).complete(job.getJobId(), result);
    }

    @Test
    void deferredCompletionLeavesJobUnchanged() {
        JsonNode result = TestJobs.generationResult("Transcript");
        when(transcriptionClient.status("batches/abc")).thenReturn(Mono.just(RemoteJobStatus.succeeded(result)));
        TranscriptionJob job = processingJob();
        when(completer.complete(job.getJobId(), result)).thenReturn(Mono.just(CompletionOutcome.LOCK_TIMEOUT));

        StepVerifier.create(poller.poll(job))
            .expectNext(PollOutcome.UNCHANGED)
            .verifyComplete();
    }

    @Test
    void remoteFailureFailsJob() {
        when(transcriptionClient.status("batches/abc"))
            .thenReturn(Mono.just(RemoteJobStatus.failed("Batch ended in state BATCH_STATE_EXPIRED")));
        TranscriptionJob job = processingJob();

        StepVerifier.create(poller.poll(job))
            .expectNext(PollOutcome.FAILED)
            .verifyComplete();

        TranscriptionJob failed = store.getJob(job.getJobId()).block();
        assertThat(failed.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(failed.getLastError()).contains("reported failure", "BATCH_STATE_EXPIRED");
        assertThat(failed.getAttempts()).isZero();
        assertThat(store.queueSnapshot().block()).isEmpty();
    }

    @Test
    void unreachableServiceLeavesJobForNextTick() {
        when(transcriptionClient.status("batches/abc")).thenReturn(Mono.error(
            new WebClientRequestException(new IOException("timeout"), HttpMethod.GET,
                URI.create("https://example.invalid/batches/abc"), new HttpHeaders())));
        TranscriptionJob job = processingJob();

        StepVerifier.create(poller.poll(job))
            .expectNext(PollOutcome.UNCHANGED)
            .verifyComplete();

        TranscriptionJob unchanged = store.getJob(job.getJobId()).block();
        assertThat(unchanged.getStatus()).isEqualTo(JobStatus.PROCESSING);
        assertThat(unchanged.getAttempts()).isZero();
    }

    @Test
    void unknownRemoteStateLeavesJobUnchanged() {
        when(transcriptionClient.status("batches/abc")).thenReturn(Mono.just(
            RemoteJobStatus.builder().state(RemoteJobState.UNKNOWN).rawState("BATCH_STATE_PAUSED").build()));
        TranscriptionJob job = processingJob();

        StepVerifier.create(poller.poll(job))
            .expectNext(PollOutcome.UNCHANGED)
            .verifyComplete();
    }

    @Test
    void jobPastMaxProcessingAgeIsFailed() {
        TranscriptionJob job = processingJob();
        clock.advance(Duration.ofHours(25));

        StepVerifier.create(poller.poll(job))
            .expectNext(PollOutcome.FAILED)
            .verifyComplete();

        assertThat(store.getJob(job.getJobId()).block().getLastError()).contains("did not finish within 1440 minutes");
        verify(transcriptionClient, never()).status(anyString());
    }

    private void completeStoredRecord(String jobId) {
        TranscriptionJob stored = store.getJob(jobId).block();
        stored.setStatus(JobStatus.COMPLETE);
        stored.setCompletedAt(clock.instant());
        store.updateJob(stored).block();
        store.removeFromQueue(jobId).block();
    }

    @Test
    void agedOutCopyDoesNotOverwriteCompletedRecord() {
        TranscriptionJob staleCopy = processingJob();
        clock.advance(Duration.ofHours(25));
        completeStoredRecord(staleCopy.getJobId());

        StepVerifier.create(poller.poll(staleCopy))
            .expectNext(PollOutcome.UNCHANGED)
            .verifyComplete();

        TranscriptionJob stored = store.getJob(staleCopy.getJobId()).block();
        assertThat(stored.getStatus()).isEqualTo(JobStatus.COMPLETE);
        assertThat(stored.getLastError()).isNull();
        verify(notifier, never()).notify(any(), eq(false));
    }

    @Test
    void remoteFailureDoesNotOverwriteCompletedRecord() {
        when(transcriptionClient.status("batches/abc"))
            .thenReturn(Mono.just(RemoteJobStatus.failed("Batch ended in state BATCH_STATE_CANCELLED")));
        TranscriptionJob staleCopy = processingJob();
        completeStoredRecord(staleCopy.getJobId());

        StepVerifier.create(poller.poll(staleCopy))
            .expectNext(PollOutcome.UNCHANGED)
            .verifyComplete();

        assertThat(store.getJob(staleCopy.getJobId()).block().getStatus()).isEqualTo(JobStatus.COMPLETE);
        verify(notifier, never()).notify(any(), anyBoolean());
    }

    @Test
    void pendingJobIsNotPolled() {
        TranscriptionJob pending = store.getJob(TestJobs.createPending(store, TestJobs.MB)).block();

        StepVerifier.create(poller.poll(pending))
            .expectNext(PollOutcome.UNCHANGED)
            .verifyComplete();

        verify(transcriptionClient, never()).status(anyString());
    }
}
