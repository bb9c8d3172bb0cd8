package com.whereq.conductor.runner;

import com.whereq.conductor.job.JobMeta;
import com.whereq.conductor.kubernetes.KubernetesJobOrchestrator;
import com.whereq.conductor.model.DispatchRequest;
import com.whereq.conductor.model.ExecutionOutcome;
import com.whereq.conductor.model.JobResult;
import com.whereq.conductor.model.JobResultStatus;
import com.whereq.conductor.model.JobVariable;
import com.whereq.conductor.model.VariableType;
import com.whereq.conductor.support.ConductorHarness;
import com.whereq.conductor.support.Copies;
import com.whereq.conductor.support.ScriptedJob;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.DefaultApplicationArguments;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OneShotJobRunnerTest {

    private final ScriptedJob echo = new ScriptedJob(
        JobMeta.builder()
            .id("Echo")
            .variables(List.of(JobVariable.builder()
                .name("word")
                .type(VariableType.STRING)
                .build()))
            .build(),
        (context, args) -> args.getString("word"));

    private ConductorHarness harness;

    @BeforeEach
    void setUp() {
        harness = new ConductorHarness(List.of(echo, ScriptedJob.failing()));
        harness.enable("Echo");
        harness.enable("Failing");
    }

    @AfterEach
    void tearDown() {
        harness.close();
    }

    private OneShotJobRunner runner(Map<String, String> env) {
        return new OneShotJobRunner(harness.jobRunner, harness.registry, harness.resultStore, Copies.MAPPER,
            harness.properties, harness.clock, env::get);
    }

    private JobResult dispatch(String jobId, Map<String, Object> args) {
        return harness.dispatcher.dispatch(DispatchRequest.builder().jobId(jobId).user("alice").args(args).build())
            .block(ConductorHarness.TIMEOUT);
    }

    @Test
    void shouldRunDispatchedResultWithArgumentsFromEnvironment() {
        JobResult pending = dispatch("Echo", Map.of("word", "stored"));
        harness.properties.getRunner().setJobResultId(pending.getId());
        OneShotJobRunner runner = runner(Map.of(KubernetesJobOrchestrator.ENV_JOB_ARGS, "{\"word\":\"from-env\"}"));

        runner.run(new DefaultApplicationArguments());

        assertThat(runner.getExitCode()).isZero();
        JobResult done = harness.resultStore.get(pending.getId());
        assertThat(done.getStatus()).isEqualTo(JobResultStatus.COMPLETED);
        assertThat(done.getResult()).isEqualTo("from-env");
    }

    @Test
    void shouldFallBackToStoredArguments() {
        JobResult pending = dispatch("Echo", Map.of("word", "stored"));

        ExecutionOutcome outcome = runner(Map.of()).runDispatched(pending.getId());

        assertThat(outcome.getKind()).isEqualTo(ExecutionOutcome.Kind.COMPLETED);
        assertThat(outcome.getOutput()).isEqualTo("stored");
    }

    @Test
    void shouldRunJobLocally() {
        harness.properties.getRunner().setJob("Echo");
        harness.properties.getRunner().setData("{\"word\":\"local\"}");
        OneShotJobRunner runner = runner(Map.of());

        runner.run(new DefaultApplicationArguments());

        assertThat(runner.getExitCode()).isZero();
        assertThat(harness.resultStore.all())
            .singleElement()
            .satisfies(result -> {
                assertThat(result.getQueue()).isEqualTo(OneShotJobRunner.LOCAL_QUEUE);
                assertThat(result.getUser()).isEqualTo("local");
                assertThat(result.getStatus()).isEqualTo(JobResultStatus.COMPLETED);
            });
    }

    @Test
    void shouldExitNonZeroWhenJobFails() {
        harness.properties.getRunner().setJob("Failing");
        OneShotJobRunner runner = runner(Map.of());

        runner.run(new DefaultApplicationArguments());

        assertThat(runner.getExitCode()).isEqualTo(1);
    }

    @Test
    void shouldRejectMalformedArguments() {
        assertThatThrownBy(() -> runner(Map.of()).runLocal("Echo", "[1, 2"))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
