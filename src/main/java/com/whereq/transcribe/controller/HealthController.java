package com.whereq.transcribe.controller;

import com.whereq.transcribe.store.JobStore;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.HashMap;
import java.util.Map;

/**
 * Health check controller to verify service and job store status.
 *
 * @author WhereQ Inc.
 */
@RestController
@RequestMapping("/api/v1/health")
@RequiredArgsConstructor
@Tag(name = "Health", description = "Service health check endpoints")
public class HealthController {

    private final JobStore jobStore;

    @GetMapping
    @Operation(summary = "Health check", description = "Check if the service and its job store are reachable")
    public Mono<ResponseEntity<Map<String, Object>>> health() {
        return jobStore.queueDepth()
                .map(depth -> {
                    Map<String, Object> health = new HashMap<>();
                    health.put("status", "UP");
                    health.put("service", "whereq-transcribe");

                    Map<String, Object> storeInfo = new HashMap<>();
                    storeInfo.put("status", "CONNECTED");
                    storeInfo.put("queueDepth", depth);
                    health.put("jobStore", storeInfo);
                    return ResponseEntity.ok(health);
                })
                .onErrorResume(e -> {
                    Map<String, Object> health = new HashMap<>();
                    health.put("status", "UP");
                    health.put("service", "whereq-transcribe");

                    Map<String, Object> storeInfo = new HashMap<>();
                    storeInfo.put("status", "ERROR");
                    storeInfo.put("error", e.getMessage());
                    health.put("jobStore", storeInfo);

                    return Mono.just(ResponseEntity.ok(health));
                });
    }
}
