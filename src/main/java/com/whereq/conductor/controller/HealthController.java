package com.whereq.conductor.controller;

import com.whereq.conductor.config.ConductorProperties;
import com.whereq.conductor.scheduler.JobScheduler;
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
 * Health check controller reporting service and scheduler status.
 */
@RestController
@RequestMapping("/api/v1/health")
@RequiredArgsConstructor
@Tag(name = "Health", description = "Service health check endpoints")
public class HealthController {

    /**
     * Ticks that may be missed before the scheduler is reported as stale
     */
    private static final int MISSED_TICKS = 3;

    private final JobScheduler scheduler;
    private final ConductorProperties properties;

    @GetMapping
    @Operation(summary = "Health check", description = "Service status including the age of the scheduler heartbeat")
    public Mono<ResponseEntity<Map<String, Object>>> health() {
        return scheduler.heartbeatAge()
            .map(age -> {
                Map<String, Object> schedulerInfo = new HashMap<>();
                boolean stale = age.compareTo(properties.getScheduler().getTickInterval().multipliedBy(MISSED_TICKS)) > 0;
                schedulerInfo.put("status", stale ? "STALE" : "UP");
                schedulerInfo.put("heartbeatAgeSeconds", age.toSeconds());
                return schedulerInfo;
            })
            .defaultIfEmpty(Map.of("status", "UNKNOWN"))
            .onErrorResume(e -> Mono.just(Map.of("status", "ERROR", "error", String.valueOf(e.getMessage()))))
            .map(schedulerInfo -> {
                Map<String, Object> health = new HashMap<>();
                health.put("status", "UP");
                health.put("service", "whereq-conductor");
                health.put("scheduler", schedulerInfo);
                return ResponseEntity.ok(health);
            });
    }
}
