package com.whereq.conductor.controller;

import com.whereq.conductor.model.BackendType;
import com.whereq.conductor.model.JobLogEntry;
import com.whereq.conductor.model.JobResult;
import com.whereq.conductor.model.JobResultStatus;
import com.whereq.conductor.model.LogLevel;
import com.whereq.conductor.security.RequestUserResolver;
import com.whereq.conductor.support.ConductorHarness;
import com.whereq.conductor.support.ScriptedJob;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.util.List;

class JobResultControllerTest {

    private ConductorHarness harness;
    private WebTestClient client;

    @BeforeEach
    void setUp() {
        harness = new ConductorHarness(List.of(ScriptedJob.backup()));
        client = WebTestClient
            .bindToController(new JobResultController(harness.resultStore, harness.logStore,
                harness.dispatcher, new RequestUserResolver()))
            .controllerAdvice(new ApiExceptionHandler())
            .build();

        harness.resultStore.create(JobResult.builder()
            .id("r-1")
            .jobId("BackupJob")
            .jobName("Backup")
            .user("alice")
            .queue("default")
            .backendType(BackendType.WORKER_POOL)
            .status(JobResultStatus.PENDING)
            .createdAt(harness.clock.instant())
            .build()).block();
        for (LogLevel level : List.of(LogLevel.INFO, LogLevel.FAILURE)) {
            harness.logStore.append(JobLogEntry.builder()
                .id("log-" + level.name())
                .jobResultId("r-1")
                .createdAt(harness.clock.instant())
                .level(level)
                .message(level.name())
                .build()).block();
        }
    }

    @AfterEach
    void tearDown() {
        harness.close();
    }

    @Test
    void shouldReturnResultAndFilteredLogs() {
        client.get().uri("/api/v1/job-results/r-1")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.status").isEqualTo("PENDING")
            .jsonPath("$.jobName").isEqualTo("Backup");

        client.get().uri("/api/v1/job-results/r-1/logs?minLevel=WARNING")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.length()").isEqualTo(1)
            .jsonPath("$[0].message").isEqualTo("FAILURE");
    }

    @Test
    void shouldReturnNotFoundForUnknownResult() {
        client.get().uri("/api/v1/job-results/missing/logs")
            .exchange()
            .expectStatus().isNotFound()
            .expectBody()
            .jsonPath("$.error").isEqualTo("not_found");
    }

    @Test
    void shouldOnlyLetOwnerCancel() {
        client.post().uri("/api/v1/job-results/r-1/cancel")
            .header(RequestUserResolver.USER_HEADER, "mallory")
            .exchange()
            .expectStatus().isForbidden();

        client.post().uri("/api/v1/job-results/r-1/cancel")
            .header(RequestUserResolver.USER_HEADER, "alice")
            .exchange()
            .expectStatus().isBadRequest()
            .expectBody()
            .jsonPath("$.error").isEqualTo("validation_error");
    }
}
