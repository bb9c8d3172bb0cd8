package com.whereq.conductor.dispatch;

import com.whereq.conductor.dto.JobDefinitionUpdate;
import com.whereq.conductor.event.EventTopics;
import com.whereq.conductor.exception.SingletonConflictException;
import com.whereq.conductor.exception.ValidationException;
import com.whereq.conductor.kubernetes.ComputeRequest;
import com.whereq.conductor.model.DispatchRequest;
import com.whereq.conductor.model.JobResult;
import com.whereq.conductor.model.JobResultStatus;
import com.whereq.conductor.model.LogLevel;
import com.whereq.conductor.support.ConductorHarness;
import com.whereq.conductor.support.ScriptedJob;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

class DispatcherTest {

    private ConductorHarness harness;
    private Dispatcher dispatcher;

    @BeforeEach
    void setUp() {
        harness = new ConductorHarness(List.of(ScriptedJob.backup(), ScriptedJob.longAudit()));
        dispatcher = harness.dispatcher;
        harness.enable("BackupJob");
        harness.enable("LongAudit");
    }

    @AfterEach
    void tearDown() {
        harness.close();
    }

    private static DispatchRequest request(String jobId) {
        return DispatchRequest.builder().jobId(jobId).user("alice").build();
    }

    @Test
    void shouldRejectSecondDispatchOfRunningSingleton() {
        JobResult first = dispatcher.dispatch(request("LongAudit")).block(ConductorHarness.TIMEOUT);
        assertThat(first).isNotNull();
        assertThat(first.getStatus()).isEqualTo(JobResultStatus.PENDING);

        StepVerifier.create(dispatcher.dispatch(request("LongAudit")))
            .expectError(SingletonConflictException.class)
            .verify();
        assertThat(harness.resultStore.all()).hasSize(1);
        assertThat(harness.concurrencyGuard.holder("LongAudit").block()).isEqualTo(first.getId());

        harness.jobRunner.run(first.getId(), Map.of());

        assertThat(harness.resultStore.get(first.getId()).getStatus()).isEqualTo(JobResultStatus.COMPLETED);
        assertThat(harness.concurrencyGuard.holder("LongAudit").block()).isNull();
        StepVerifier.create(dispatcher.dispatch(request("LongAudit")))
            .assertNext(next -> assertThat(next.getStatus()).isEqualTo(JobResultStatus.PENDING))
            .verifyComplete();
    }

    @Test
    void shouldLogWhenSingletonLockIsIgnored() {
        dispatcher.dispatch(request("LongAudit")).block(ConductorHarness.TIMEOUT);

        DispatchRequest forced = request("LongAudit");
        forced.setIgnoreSingletonLock(true);
        JobResult second = dispatcher.dispatch(forced).block(ConductorHarness.TIMEOUT);

        assertThat(second).isNotNull();
        assertThat(harness.logStore.entries(second.getId()))
            .anySatisfy(entry -> assertThat(entry.getLevel()).isEqualTo(LogLevel.WARNING));
    }

    @Test
    void shouldRunSingletonOnPodQueueWithOneComputeObject() {
        harness.update("LongAudit", JobDefinitionUpdate.builder().defaultQueue(ConductorHarness.POD_QUEUE).build());
        AtomicReference<ComputeRequest> submitted = new AtomicReference<>();
        harness.orchestrator.setOnFinish(request -> {
            submitted.set(request);
            harness.jobRunner.run(request.getJobResultId(), Map.of());
        });

        JobResult result = dispatcher.dispatch(request("LongAudit")).block(ConductorHarness.TIMEOUT);

        assertThat(result).isNotNull();
        assertThat(result.getStatus()).isEqualTo(JobResultStatus.COMPLETED);
        assertThat(result.getResult()).isEqualTo("audited");
        assertThat(result.getComputeObjectName()).isEqualTo(PodTaskBackend.computeObjectName(result.getId()));
        assertThat(harness.orchestrator.created()).containsExactly(result.getComputeObjectName());
        assertThat(harness.orchestrator.remaining()).isZero();
        assertThat(harness.concurrencyGuard.holder("LongAudit").block()).isNull();
        assertThat(harness.events.payloads(EventTopics.JOB_COMPLETED))
            .singleElement()
            .satisfies(payload -> assertThat(payload.get("job_output")).isEqualTo(result.getResult()));

        ComputeRequest request = submitted.get();
        assertThat(request.getLabels()).containsEntry("conductor.whereq.com/job-id", "LongAudit");
        assertThat(request.getActiveDeadline()).isEqualTo(Duration.ofSeconds(60).plusMillis(10));
        assertThat(harness.logStore.entries(result.getId()))
            .anySatisfy(entry -> assertThat(entry.getMessage()).isEqualTo("pod says hello"));
    }

    @Test
    void shouldErrorResultWhenPodFinishesWithoutRunner() {
        harness.update("BackupJob", JobDefinitionUpdate.builder().defaultQueue(ConductorHarness.POD_QUEUE).build());

        JobResult result = dispatcher.dispatch(request("BackupJob")).block(ConductorHarness.TIMEOUT);

        assertThat(result).isNotNull();
        assertThat(result.getStatus()).isEqualTo(JobResultStatus.ERRORED);
        assertThat(result.getFailure().getExcMessage()).contains("without recording a result");
        assertThat(harness.orchestrator.remaining()).isZero();
    }

    @Test
    void shouldErrorResultAndReleaseLockWhenSubmissionFails() {
        harness.update("LongAudit", JobDefinitionUpdate.builder().defaultQueue(ConductorHarness.POD_QUEUE).build());
        harness.orchestrator.setFailOnCreate(true);

        JobResult result = dispatcher.dispatch(request("LongAudit")).block(ConductorHarness.TIMEOUT);

        assertThat(result).isNotNull();
        assertThat(result.getStatus()).isEqualTo(JobResultStatus.ERRORED);
        assertThat(result.getFailure().getExcType()).isEqualTo("BackendException");
        assertThat(harness.concurrencyGuard.holder("LongAudit").block()).isNull();
        assertThat(harness.events.payloads(EventTopics.JOB_COMPLETED))
            .singleElement()
            .satisfies(payload -> assertThat(payload.get("einfo")).isEqualTo(Map.of(
                "exc_type", result.getFailure().getExcType(),
                "exc_message", result.getFailure().getExcMessage())));
    }

    @Test
    void shouldDeletePodAndReleaseLockWhenPollingKeepsFailing() {
        harness.update("LongAudit", JobDefinitionUpdate.builder().defaultQueue(ConductorHarness.POD_QUEUE).build());
        harness.orchestrator.setPhaseFailures(Integer.MAX_VALUE);

        JobResult result = dispatcher.dispatch(request("LongAudit")).block(ConductorHarness.TIMEOUT);

        assertThat(result).isNotNull();
        assertThat(result.getStatus()).isEqualTo(JobResultStatus.ERRORED);
        assertThat(result.getFailure().getExcType()).isEqualTo("BackendException");
        assertThat(result.getFailure().getExcMessage()).contains("api server unavailable");
        assertThat(harness.orchestrator.deleted()).contains(result.getComputeObjectName());
        assertThat(harness.orchestrator.remaining()).isZero();
        assertThat(harness.concurrencyGuard.holder("LongAudit").block()).isNull();
        assertThat(harness.logStore.entries(result.getId()))
            .anySatisfy(entry -> assertThat(entry.getLevel()).isEqualTo(LogLevel.ERROR));
        await().atMost(ConductorHarness.TIMEOUT)
            .until(() -> harness.events.payloads(EventTopics.JOB_COMPLETED).size() == 1);

        harness.orchestrator.setPhaseFailures(0);
        harness.orchestrator.setOnFinish(request -> harness.jobRunner.run(request.getJobResultId(), Map.of()));
        JobResult next = dispatcher.dispatch(request("LongAudit")).block(ConductorHarness.TIMEOUT);

        assertThat(next).isNotNull();
        assertThat(next.getStatus()).isEqualTo(JobResultStatus.COMPLETED);
    }

    @Test
    void shouldKeepWatchingPodThroughBriefPollingFailures() {
        harness.update("LongAudit", JobDefinitionUpdate.builder().defaultQueue(ConductorHarness.POD_QUEUE).build());
        harness.orchestrator.setPhaseFailures(PodTaskBackend.POLL_RETRIES - 1);
        harness.orchestrator.setOnFinish(request -> harness.jobRunner.run(request.getJobResultId(), Map.of()));

        JobResult result = dispatcher.dispatch(request("LongAudit")).block(ConductorHarness.TIMEOUT);

        assertThat(result).isNotNull();
        assertThat(result.getStatus()).isEqualTo(JobResultStatus.COMPLETED);
        assertThat(harness.orchestrator.remaining()).isZero();
        assertThat(harness.concurrencyGuard.holder("LongAudit").block()).isNull();
    }

    @Test
    void shouldReleaseLockWhenResultCannotBeStored() {
        harness.resultStore.setFailOnCreate(true);

        StepVerifier.create(dispatcher.dispatch(request("LongAudit")))
            .expectError(IllegalStateException.class)
            .verify();

        assertThat(harness.concurrencyGuard.holder("LongAudit").block()).isNull();
        assertThat(harness.broker.size("default").block()).isZero();

        harness.resultStore.setFailOnCreate(false);
        StepVerifier.create(dispatcher.dispatch(request("LongAudit")))
            .assertNext(next -> assertThat(next.getStatus()).isEqualTo(JobResultStatus.PENDING))
            .verifyComplete();
    }

    @Test
    void shouldTimeOutPodThatNeverFinishes() {
        harness.update("BackupJob", JobDefinitionUpdate.builder().defaultQueue(ConductorHarness.POD_QUEUE).build());
        harness.properties.getKubernetes().setWatchTimeout(Duration.ofMillis(200));
        harness.orchestrator.setNeverFinish(true);

        JobResult result = dispatcher.dispatch(request("BackupJob")).block(ConductorHarness.TIMEOUT);

        assertThat(result).isNotNull();
        assertThat(result.getStatus()).isEqualTo(JobResultStatus.ERRORED);
        assertThat(result.getFailure().getExcType()).isEqualTo("JobTimeoutException");
        assertThat(harness.orchestrator.deleted()).contains(result.getComputeObjectName());
        assertThat(harness.orchestrator.remaining()).isZero();
    }

    @Test
    void shouldReturnPendingResultOfDetachedPodDispatch() {
        harness.update("BackupJob", JobDefinitionUpdate.builder().defaultQueue(ConductorHarness.POD_QUEUE).build());
        harness.orchestrator.setNeverFinish(true);

        JobResult result = dispatcher.dispatchDetached(request("BackupJob")).block(ConductorHarness.TIMEOUT);

        assertThat(result).isNotNull();
        assertThat(result.getStatus()).isEqualTo(JobResultStatus.PENDING);
        await().atMost(ConductorHarness.TIMEOUT)
            .until(() -> harness.resultStore.get(result.getId()).getComputeObjectName() != null);

        StepVerifier.create(dispatcher.cancel(result.getId())).verifyComplete();

        JobResult cancelled = harness.resultStore.get(result.getId());
        assertThat(cancelled.getStatus()).isEqualTo(JobResultStatus.ERRORED);
        assertThat(cancelled.getFailure().getExcType()).isEqualTo("Cancelled");
        await().atMost(ConductorHarness.TIMEOUT).until(() -> harness.orchestrator.remaining() == 0);
        assertThat(harness.events.payloads(EventTopics.JOB_COMPLETED)).hasSize(1);
    }

    @Test
    void shouldNotCancelWorkerPoolResults() {
        JobResult result = dispatcher.dispatch(request("BackupJob")).block(ConductorHarness.TIMEOUT);

        StepVerifier.create(dispatcher.cancel(result.getId()))
            .expectError(ValidationException.class)
            .verify();
    }

    @Test
    void shouldNotCancelTerminalResults() {
        JobResult result = dispatcher.dispatch(request("BackupJob")).block(ConductorHarness.TIMEOUT);
        harness.jobRunner.run(result.getId(), Map.of());

        StepVerifier.create(dispatcher.cancel(result.getId()))
            .expectError(ValidationException.class)
            .verify();
    }

    @Test
    void shouldEnqueueTaskMessageWithLimits() {
        JobResult result = dispatcher.dispatch(request("LongAudit")).block(ConductorHarness.TIMEOUT);

        var delivery = harness.broker.reserve("default", "worker-1").block();

        assertThat(delivery).isNotNull();
        assertThat(delivery.getMessage().getJobResultId()).isEqualTo(result.getId());
        assertThat(delivery.getMessage().getSoftTimeLimitSeconds()).isEqualTo(30);
        assertThat(delivery.getMessage().getTimeLimitSeconds()).isEqualTo(60);
    }
}
