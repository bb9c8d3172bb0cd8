package com.whereq.conductor.controller;

import com.whereq.conductor.config.ConductorProperties;
import com.whereq.conductor.scheduler.JobScheduler;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

import java.time.Duration;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class HealthControllerTest {

    private final JobScheduler scheduler = mock(JobScheduler.class);
    private final WebTestClient client = WebTestClient
        .bindToController(new HealthController(scheduler, new ConductorProperties()))
        .build();

    @Test
    void shouldReportFreshHeartbeat() {
        when(scheduler.heartbeatAge()).thenReturn(Mono.just(Duration.ofSeconds(4)));

        client.get().uri("/api/v1/health")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.status").isEqualTo("UP")
            .jsonPath("$.scheduler.status").isEqualTo("UP")
            .jsonPath("$.scheduler.heartbeatAgeSeconds").isEqualTo(4);
    }

    @Test
    void shouldReportStaleSchedulerAfterMissedTicks() {
        when(scheduler.heartbeatAge()).thenReturn(Mono.just(Duration.ofSeconds(16)));

        client.get().uri("/api/v1/health")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.scheduler.status").isEqualTo("STALE");
    }

    @Test
    void shouldReportUnknownWithoutHeartbeat() {
        when(scheduler.heartbeatAge()).thenReturn(Mono.empty());

        client.get().uri("/api/v1/health")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.scheduler.status").isEqualTo("UNKNOWN");
    }
}
