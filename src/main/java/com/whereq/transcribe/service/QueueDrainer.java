package com.whereq.transcribe.service;

import com.whereq.transcribe.config.TranscribeProperties;
import com.whereq.transcribe.model.DrainReport;
import com.whereq.transcribe.model.JobStatus;
import com.whereq.transcribe.model.PollOutcome;
import com.whereq.transcribe.model.TranscriptionJob;
import com.whereq.transcribe.store.JobStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * One scheduler tick over the queue: poll processing jobs first, then submit a
 * bounded batch of pending jobs in FIFO order.
 * <p>
 * A tick keeps no state between runs and stops starting new work once its time
 * budget is spent; whatever is left stays queued for the next tick. Errors of one
 * job are logged and counted without stopping the tick.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class QueueDrainer {

    private final JobStore jobStore;
    private final JobPoller poller;
    private final JobSubmitter submitter;
    private final TranscribeProperties properties;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    private Counter tickCounter;
    private Timer tickTimer;

    @PostConstruct
    public void initialize() {
        tickCounter = Counter.builder("transcribe.drain.ticks")
            .description("Number of drain ticks run")
            .register(meterRegistry);

        tickTimer = Timer.builder("transcribe.drain.duration")
            .description("Drain tick duration")
            .register(meterRegistry);
    }

    /**
     * Run one tick
     *
     * @return Mono with the tick summary
     */
    public Mono<DrainReport> drain() {
        return Mono.defer(() -> {
            DrainBudget budget = DrainBudget.start(clock, properties.getDrain().getTimeBudget());
            DrainReport report = new DrainReport();
            report.setStartedAt(budget.getStartedAt());

            return jobStore.queueSnapshot()
                .flatMap(ids -> {
                    report.setQueueSize(ids.size());
                    log.debug("Drain tick started with {} queued jobs", ids.size());
                    return loadQueuedJobs(ids, budget, report);
                })
                .flatMap(jobs -> pollProcessing(jobs, budget, report)
                    .then(submitPending(jobs, budget, report)))
                .then(Mono.fromSupplier(() -> finish(report, budget)));
        });
    }

    private Mono<List<TranscriptionJob>> loadQueuedJobs(List<String> ids, DrainBudget budget, DrainReport report) {
        return Flux.fromIterable(ids)
            .concatMap(id -> guarded(budget, report, id, () -> jobStore.findJob(id)
                .map(Optional::of)
                .defaultIfEmpty(Optional.empty())
                .flatMap(found -> {
                    if (found.isEmpty()) {
                        return repair(id, "no job record", report);
                    }
                    TranscriptionJob job = found.get();
                    if (job.getStatus().isTerminal()) {
                        return repair(id, "job is " + job.getStatus(), report);
                    }
                    return Mono.just(job);
                })))
            .collectList();
    }

    private Mono<TranscriptionJob> repair(String jobId, String reason, DrainReport report) {
        log.warn("Removing job {} from queue: {}", jobId, reason);
        report.incrementRepaired();
        return jobStore.removeFromQueue(jobId).then(Mono.empty());
    }

    private Mono<Void> pollProcessing(List<TranscriptionJob> jobs, DrainBudget budget, DrainReport report) {
        return Flux.fromIterable(jobs)
            .filter(job -> job.getStatus() == JobStatus.PROCESSING)
            .concatMap(job -> guarded(budget, report, job.getJobId(), () -> poller.poll(job)
                .doOnNext(outcome -> {
                    report.incrementPolled();
                    if (outcome == PollOutcome.COMPLETED) {
                        report.incrementCompleted();
                    } else if (outcome == PollOutcome.FAILED) {
                        report.incrementFailed();
                    }
                })))
            .then();
    }

    private Mono<Void> submitPending(List<TranscriptionJob> jobs, DrainBudget budget, DrainReport report) {
        return Flux.fromIterable(jobs)
            .filter(job -> job.getStatus() == JobStatus.PENDING)
            .take(properties.getDrain().getBatchSize())
            .concatMap(job -> guarded(budget, report, job.getJobId(), () -> submitter.submit(job)
                .doOnNext(result -> {
                    if (result.getStatus() == JobStatus.PROCESSING) {
                        report.incrementSubmitted();
                    } else if (result.getStatus() == JobStatus.FAILED) {
                        report.incrementFailed();
                    }
                })))
            .then();
    }

    /**
     * Run a per-job step unless the budget is spent, isolating its errors
     */
    private <T> Mono<T> guarded(DrainBudget budget, DrainReport report, String jobId, Supplier<Mono<T>> step) {
        if (budget.exhausted()) {
            if (!report.isBudgetExhausted()) {
                log.info("Drain time budget spent after {}, leaving remaining jobs for the next tick",
                    budget.elapsed());
            }
            report.setBudgetExhausted(true);
            report.incrementDeferred();
            return Mono.empty();
        }
        return Mono.defer(step)
            .onErrorResume(e -> {
                log.error("Error processing job {} during drain: {}", jobId, e.getMessage(), e);
                report.incrementErrors();
                return Mono.empty();
            });
    }

    private DrainReport finish(DrainReport report, DrainBudget budget) {
        report.setElapsed(budget.elapsed());
        tickCounter.increment();
        tickTimer.record(report.getElapsed());

        log.info("Drain tick finished in {}ms: queue={}, polled={}, submitted={}, completed={}, failed={}, "
                + "errors={}, deferred={}, repaired={}",
            report.getElapsed().toMillis(), report.getQueueSize(), report.getPolled(), report.getSubmitted(),
            report.getCompleted(), report.getFailed(), report.getErrors(), report.getDeferred(),
            report.getRepaired());
        return report;
    }
}
