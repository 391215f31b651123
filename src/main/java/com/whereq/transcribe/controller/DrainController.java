package com.whereq.transcribe.controller;

import com.whereq.transcribe.dto.TriggerResponse;
import com.whereq.transcribe.model.DrainReport;
import com.whereq.transcribe.model.TriggerInterval;
import com.whereq.transcribe.service.DrainScheduler;
import com.whereq.transcribe.service.QueueDrainer;
import com.whereq.transcribe.service.RetentionSweeper;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Operations endpoints for the drain trigger and retention sweep.
 *
 * @author WhereQ Inc.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/transcriptions/drain")
@RequiredArgsConstructor
@Tag(name = "Drain Operations", description = "Run drain ticks and manage the drain trigger")
public class DrainController {

    private final QueueDrainer drainer;
    private final DrainScheduler drainScheduler;
    private final RetentionSweeper retentionSweeper;

    @PostMapping("/tick")
    @Operation(summary = "Run one drain tick", description = "Poll processing jobs, then submit the next pending batch")
    public Mono<ResponseEntity<DrainReport>> tick() {
        log.info("Manual drain tick requested");
        return drainer.drain()
            .map(ResponseEntity::ok)
            .onErrorResume(e -> {
                log.error("Manual drain tick failed", e);
                return Mono.just(ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).build());
            });
    }

    @GetMapping("/trigger")
    @Operation(summary = "Current drain trigger")
    public Mono<ResponseEntity<TriggerResponse>> currentTrigger() {
        return Mono.just(ResponseEntity.ok(drainScheduler.currentTrigger()
            .map(TriggerResponse::from)
            .orElseGet(TriggerResponse::none)));
    }

    @PutMapping("/trigger")
    @Operation(summary = "Install drain trigger", description = "Replace the installed trigger with one at the given interval")
    public Mono<ResponseEntity<TriggerResponse>> installTrigger(@RequestParam TriggerInterval interval) {
        return Mono.fromCallable(() -> drainScheduler.install(interval))
            .map(trigger -> ResponseEntity.ok(TriggerResponse.from(trigger)));
    }

    @DeleteMapping("/trigger")
    @Operation(summary = "Uninstall drain trigger")
    public Mono<ResponseEntity<TriggerResponse>> uninstallTrigger() {
        return Mono.fromCallable(drainScheduler::uninstall)
            .map(removed -> removed
                ? ResponseEntity.ok(TriggerResponse.none())
                : ResponseEntity.status(HttpStatus.NOT_FOUND).<TriggerResponse>build());
    }

    @PostMapping("/sweep")
    @Operation(summary = "Run retention sweep", description = "Delete terminal jobs older than the retention horizon")
    public Mono<ResponseEntity<Map<String, Object>>> sweep() {
        log.info("Manual retention sweep requested");
        return retentionSweeper.sweep()
            .map(deleted -> ResponseEntity.ok(Map.<String, Object>of("deleted", deleted)))
            .onErrorResume(e -> {
                log.error("Manual retention sweep failed", e);
                return Mono.just(ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(Map.of("error", String.valueOf(e.getMessage()))));
            });
    }
}
