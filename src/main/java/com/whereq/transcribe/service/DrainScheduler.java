package com.whereq.transcribe.service;

import com.whereq.transcribe.config.TranscribeProperties;
import com.whereq.transcribe.model.DrainTrigger;
import com.whereq.transcribe.model.TriggerInterval;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;

/**
 * Installs the periodic drain trigger. At most one trigger is installed at a time;
 * installing a new one cancels the previous schedule.
 */
@Slf4j
@Service
public class DrainScheduler {

    private final QueueDrainer drainer;
    private final TaskScheduler taskScheduler;
    private final TranscribeProperties properties;
    private final Clock clock;

    private ScheduledFuture<?> scheduledTick;
    private DrainTrigger currentTrigger;

    public DrainScheduler(QueueDrainer drainer,
                          @Qualifier("drainTaskScheduler") TaskScheduler taskScheduler,
                          TranscribeProperties properties,
                          Clock clock) {
        this.drainer = drainer;
        this.taskScheduler = taskScheduler;
        this.properties = properties;
        this.clock = clock;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void installConfiguredTrigger() {
        if (!properties.getDrain().isEnabled()) {
            log.info("Drain trigger disabled, ticks only run on demand");
            return;
        }
        install(properties.getDrain().getInterval());
    }

    /**
     * Install the drain trigger, replacing any installed one
     *
     * @param interval tick interval
     * @return the installed trigger
     */
    public synchronized DrainTrigger install(TriggerInterval interval) {
        cancelScheduledTick();

        Instant now = clock.instant();
        Duration period = interval.toDuration();
        scheduledTick = taskScheduler.scheduleAtFixedRate(this::runTick, now.plus(period), period);
        currentTrigger = DrainTrigger.builder()
            .interval(interval)
            .installedAt(now)
            .build();

        log.info("Drain trigger installed: every {} minutes", interval.getMinutes());
        return currentTrigger;
    }

    /**
     * Remove the installed trigger
     *
     * @return true if a trigger was installed
     */
    public synchronized boolean uninstall() {
        boolean installed = cancelScheduledTick();
        if (installed) {
            log.info("Drain trigger uninstalled");
        }
        currentTrigger = null;
        return installed;
    }

    public synchronized Optional<DrainTrigger> currentTrigger() {
        return Optional.ofNullable(currentTrigger);
    }

    @PreDestroy
    public void shutdown() {
        uninstall();
    }

    /**
     * One scheduled run: waits for the tick up to the execution ceiling, then cancels it
     */
    void runTick() {
        Duration ceiling = properties.getDrain().getExecutionCeiling();
        try {
            drainer.drain().block(ceiling);
        } catch (IllegalStateException e) {
            log.error("Drain tick did not finish within {} and was cancelled: {}", ceiling, e.getMessage());
        } catch (Exception e) {
            log.error("Drain tick failed", e);
        }
    }

    private boolean cancelScheduledTick() {
        if (scheduledTick == null) {
            return false;
        }
        scheduledTick.cancel(false);
        scheduledTick = null;
        return true;
    }
}
