package com.whereq.transcribe.service;

import com.whereq.transcribe.config.TranscribeProperties;
import com.whereq.transcribe.model.DrainReport;
import com.whereq.transcribe.model.DrainTrigger;
import com.whereq.transcribe.model.TriggerInterval;
import com.whereq.transcribe.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.TaskScheduler;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DrainSchedulerTest {

    private static final Instant NOW = Instant.parse("2026-03-02T10:00:00Z");

    private QueueDrainer drainer;
    private TaskScheduler taskScheduler;
    private ScheduledFuture<?> firstTick;
    private ScheduledFuture<?> secondTick;
    private TranscribeProperties properties;
    private DrainScheduler scheduler;

    @BeforeEach
    void setUp() {
        drainer = mock(QueueDrainer.class);
        taskScheduler = mock(TaskScheduler.class);
        firstTick = mock(ScheduledFuture.class);
        secondTick = mock(ScheduledFuture.class);
        doReturn(firstTick, secondTick).when(taskScheduler)
            .scheduleAtFixedRate(any(Runnable.class), any(Instant.class), any(Duration.class));

        properties = new TranscribeProperties();
        scheduler = new DrainScheduler(drainer, taskScheduler, properties, new MutableClock(NOW));
    }

    @Test
    void installSchedulesAtFixedRate() {
        DrainTrigger trigger = scheduler.install(TriggerInterval.FIVE_MINUTES);

        verify(taskScheduler).scheduleAtFixedRate(any(Runnable.class), eq(NOW.plus(Duration.ofMinutes(5))),
            eq(Duration.ofMinutes(5)));
        assertThat(trigger.getInterval()).isEqualTo(TriggerInterval.FIVE_MINUTES);
        assertThat(trigger.getInstalledAt()).isEqualTo(NOW);
        assertThat(scheduler.currentTrigger()).contains(trigger);
    }

    @Test
    void reinstallCancelsPreviousSchedule() {
        scheduler.install(TriggerInterval.FIFTEEN_MINUTES);
        scheduler.install(TriggerInterval.SIXTY_MINUTES);

        verify(firstTick).cancel(false);
        verify(secondTick, never()).cancel(false);
        assertThat(scheduler.currentTrigger()).get()
            .extracting(DrainTrigger::getInterval)
            .isEqualTo(TriggerInterval.SIXTY_MINUTES);
    }

    @Test
    void uninstallCancelsAndClearsTrigger() {
        scheduler.install(TriggerInterval.THIRTY_MINUTES);

        assertThat(scheduler.uninstall()).isTrue();
        assertThat(scheduler.uninstall()).isFalse();

        verify(firstTick).cancel(false);
        assertThat(scheduler.currentTrigger()).isEmpty();
    }

    @Test
    void configuredTriggerIsInstalledWhenEnabled() {
        properties.getDrain().setInterval(TriggerInterval.THIRTY_MINUTES);

        scheduler.installConfiguredTrigger();

        assertThat(scheduler.currentTrigger()).get()
            .extracting(DrainTrigger::getInterval)
            .isEqualTo(TriggerInterval.THIRTY_MINUTES);
    }

    @Test
    void disabledDrainInstallsNothing() {
        properties.getDrain().setEnabled(false);

        scheduler.installConfiguredTrigger();

        verify(taskScheduler, never()).scheduleAtFixedRate(any(Runnable.class), any(Instant.class), any(Duration.class));
        assertThat(scheduler.currentTrigger()).isEmpty();
    }

    @Test
    void scheduledRunDrainsQueue() {
        when(drainer.drain()).thenReturn(Mono.just(new DrainReport()));

        scheduler.runTick();

        verify(drainer).drain();
    }

    @Test
    void runExceedingCeilingIsCancelled() {
        properties.getDrain().setExecutionCeiling(Duration.ofMillis(100));
        when(drainer.drain()).thenReturn(Mono.never());

        assertThatCode(() -> scheduler.runTick()).doesNotThrowAnyException();
    }

    @Test
    void failingRunDoesNotEscape() {
        when(drainer.drain()).thenReturn(Mono.error(new IllegalArgumentException("boom")));

        assertThatCode(() -> scheduler.runTick()).doesNotThrowAnyException();
    }
}
