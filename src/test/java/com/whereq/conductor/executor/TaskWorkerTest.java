package com.whereq.conductor.executor;

import com.whereq.conductor.event.EventTopics;
import com.whereq.conductor.job.builtin.ExportObjectListJob;
import com.whereq.conductor.model.DispatchRequest;
import com.whereq.conductor.model.JobLogEntry;
import com.whereq.conductor.model.JobResult;
import com.whereq.conductor.model.JobResultStatus;
import com.whereq.conductor.model.LogLevel;
import com.whereq.conductor.queue.TaskDelivery;
import com.whereq.conductor.support.ConductorHarness;
import com.whereq.conductor.support.FakeRecordStoreClient;
import com.whereq.conductor.support.ScriptedJob;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

class TaskWorkerTest {

    private final ScriptedJob backup = ScriptedJob.backup();
    private ConductorHarness harness;

    @BeforeEach
    void setUp() {
        FakeRecordStoreClient records = new FakeRecordStoreClient()
            .add("dcim.device", device("1", "sw1", "active"))
            .add("dcim.device", device("2", "sw2", "planned"));
        harness = new ConductorHarness(
            List.of(new ExportObjectListJob(records), backup, ScriptedJob.failing()), records);
        harness.enable(ExportObjectListJob.ID);
        harness.enable("BackupJob");
        harness.enable("Failing");
    }

    @AfterEach
    void tearDown() {
        harness.close();
    }

    private static Map<String, Object> device(String id, String name, String status) {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("id", id);
        record.put("name", name);
        record.put("status", status);
        return record;
    }

    private JobResult dispatch(String jobId, Map<String, Object> args) {
        return harness.dispatcher.dispatch(DispatchRequest.builder()
            .jobId(jobId)
            .user("alice")
            .args(args)
            .build()).block(ConductorHarness.TIMEOUT);
    }

    private JobResult awaitTerminal(String id) {
        await().atMost(ConductorHarness.TIMEOUT)
            .until(() -> harness.resultStore.get(id).getStatus().isTerminal());
        return harness.resultStore.get(id);
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldRunExportFromDefaultQueue() {
        JobResult pending = dispatch(ExportObjectListJob.ID,
            Map.of("content_type", "dcim.device", "query_string", "status=active"));
        assertThat(pending.getStatus()).isEqualTo(JobResultStatus.PENDING);
        assertThat(pending.getQueue()).isEqualTo("default");

        harness.worker.start();
        JobResult done = awaitTerminal(pending.getId());

        assertThat(done.getStatus()).isEqualTo(JobResultStatus.COMPLETED);
        assertThat(done.getStartedAt()).isNotNull();
        assertThat(done.getCompletedAt()).isAfterOrEqualTo(done.getStartedAt());
        Map<String, Object> output = (Map<String, Object>) done.getResult();
        assertThat(output)
            .containsEntry("filename", "devices.csv")
            .containsEntry("row_count", 1)
            .containsEntry("content", "id,name,status\n1,sw1,active\n");

        List<JobLogEntry> logs = harness.logStore.entries(pending.getId());
        assertThat(logs).isNotEmpty();
        assertThat(logs).extracting(JobLogEntry::getLevel).contains(LogLevel.SUCCESS);
        assertThat(harness.events.payloads(EventTopics.JOB_STARTED)).hasSize(1);
        await().atMost(ConductorHarness.TIMEOUT)
            .until(() -> !harness.events.payloads(EventTopics.JOB_COMPLETED).isEmpty());
        assertThat(harness.events.payloads(EventTopics.JOB_COMPLETED))
            .singleElement()
            .satisfies(payload -> {
                assertThat(payload).containsEntry("status", "COMPLETED");
                assertThat(payload).containsEntry("job_result_id", done.getId());
                assertThat(payload.get("job_output")).isEqualTo(done.getResult());
                assertThat(payload).doesNotContainKey("einfo");
            });
    }

    @Test
    void shouldRecordFailureOfJobBody() {
        JobResult pending = dispatch("Failing", Map.of());

        harness.worker.start();
        JobResult done = awaitTerminal(pending.getId());

        assertThat(done.getStatus()).isEqualTo(JobResultStatus.ERRORED);
        assertThat(done.getFailure().getExcType()).isEqualTo("IllegalStateException");
        assertThat(done.getFailure().getExcMessage()).isEqualTo("boom");
        assertThat(harness.logStore.entries(pending.getId()))
            .anySatisfy(entry -> assertThat(entry.getLevel()).isEqualTo(LogLevel.ERROR));
        await().atMost(ConductorHarness.TIMEOUT)
            .until(() -> !harness.events.payloads(EventTopics.JOB_COMPLETED).isEmpty());
        assertThat(harness.events.payloads(EventTopics.JOB_COMPLETED))
            .singleElement()
            .satisfies(payload -> {
                assertThat(payload).containsEntry("status", "ERRORED");
                assertThat(payload).doesNotContainKey("job_output");
                assertThat(payload.get("einfo")).isEqualTo(Map.of(
                    "exc_type", done.getFailure().getExcType(),
                    "exc_message", done.getFailure().getExcMessage()));
            });
    }

    @Test
    void shouldAcknowledgeBeforeRunningByDefault() {
        JobResult pending = dispatch("BackupJob", Map.of());

        int reserved = harness.worker.pollOnce();

        assertThat(reserved).isEqualTo(1);
        assertThat(harness.broker.unackedCount(harness.worker.getWorkerName())).isZero();
        assertThat(awaitTerminal(pending.getId()).getStatus()).isEqualTo(JobResultStatus.COMPLETED);
    }

    @Test
    void shouldAcknowledgeAfterRunningWhenAcksLate() {
        harness.properties.getWorker().setAcksLate(true);
        harness.properties.getWorker().setName("late-worker");
        TaskWorker lateWorker = new TaskWorker(harness.broker, harness.jobRunner, harness.resultStore,
            harness.meterRegistry, harness.properties);
        JobResult pending = dispatch("BackupJob", Map.of());

        lateWorker.pollOnce();

        assertThat(awaitTerminal(pending.getId()).getStatus()).isEqualTo(JobResultStatus.COMPLETED);
        await().atMost(ConductorHarness.TIMEOUT).until(() -> harness.broker.unackedCount("late-worker") == 0);
        lateWorker.stop();
    }

    @Test
    void shouldRedeliverTaskOfDeadWorkerAndSkipDuplicates() {
        JobResult pending = dispatch("BackupJob", Map.of());
        TaskDelivery lost = harness.broker.reserve("default", "dead-worker").block();
        assertThat(lost).isNotNull();

        harness.broker.expireWorker("dead-worker");
        assertThat(harness.broker.recoverAbandoned().block()).isEqualTo(1L);
        TaskDelivery redelivered = harness.broker.reserve("default", harness.worker.getWorkerName()).block();
        harness.worker.process(redelivered);

        assertThat(harness.resultStore.get(pending.getId()).getStatus()).isEqualTo(JobResultStatus.COMPLETED);
        assertThat(backup.runs()).isEqualTo(1);

        harness.worker.process(lost);
        assertThat(backup.runs()).isEqualTo(1);
        assertThat(harness.events.payloads(EventTopics.JOB_COMPLETED)).hasSize(1);
    }
}
