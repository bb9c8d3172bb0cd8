package com.whereq.conductor.runner;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.conductor.config.ConductorProperties;
import com.whereq.conductor.executor.JobRunner;
import com.whereq.conductor.kubernetes.KubernetesJobOrchestrator;
import com.whereq.conductor.model.ExecutionOutcome;
import com.whereq.conductor.model.JobDefinition;
import com.whereq.conductor.model.JobResult;
import com.whereq.conductor.model.JobResultStatus;
import com.whereq.conductor.registry.JobRegistry;
import com.whereq.conductor.store.JobResultStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;

/**
 * Runs a single job in this process and reports the outcome as exit code.
 * <p>
 * With {@code conductor.runner.job-result-id} it executes a result created by the dispatcher,
 * which is how pod-per-task containers start. With {@code conductor.runner.job} it creates a
 * local result for that job from {@code conductor.runner.data} first.
 */
@Slf4j
@Component
@ConditionalOnExpression("'${conductor.runner.job-result-id:}' != '' or '${conductor.runner.job:}' != ''")
public class OneShotJobRunner implements ApplicationRunner, ExitCodeGenerator {

    static final String LOCAL_QUEUE = "local";

    private static final Duration STORE_TIMEOUT = Duration.ofSeconds(10);

    private final JobRunner jobRunner;
    private final JobRegistry registry;
    private final JobResultStore resultStore;
    private final ObjectMapper objectMapper;
    private final ConductorProperties.RunnerConfig config;
    private final Function<String, String> environment;
    private final Clock clock;

    private int exitCode;

    public OneShotJobRunner(JobRunner jobRunner,
                            JobRegistry registry,
                            JobResultStore resultStore,
                            ObjectMapper objectMapper,
                            ConductorProperties properties,
                            Clock clock) {
        this(jobRunner, registry, resultStore, objectMapper, properties, clock, System::getenv);
    }

    OneShotJobRunner(JobRunner jobRunner,
                     JobRegistry registry,
                     JobResultStore resultStore,
                     ObjectMapper objectMapper,
                     ConductorProperties properties,
                     Clock clock,
                     Function<String, String> environment) {
        this.jobRunner = jobRunner;
        this.registry = registry;
        this.resultStore = resultStore;
        this.objectMapper = objectMapper;
        this.config = properties.getRunner();
        this.clock = clock;
        this.environment = environment;
    }

    @Override
    public void run(ApplicationArguments args) {
        ExecutionOutcome outcome;
        if (config.getJobResultId() != null && !config.getJobResultId().isBlank()) {
            outcome = runDispatched(config.getJobResultId());
        } else {
            outcome = runLocal(config.getJob(), config.getData());
        }
        exitCode = outcome.getKind() == ExecutionOutcome.Kind.COMPLETED ? 0 : 1;
        if (exitCode == 0) {
            log.info("Job finished, output: {}", outcome.getOutput());
        } else {
            log.error("Job did not complete ({}): {}", outcome.getKind(),
                outcome.getFailure() != null ? outcome.getFailure().getExcMessage() : "no detail");
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    ExecutionOutcome runDispatched(String jobResultId) {
        Map<String, Object> args = parseArgs(environment.apply(KubernetesJobOrchestrator.ENV_JOB_ARGS));
        if (args == null) {
            JobResult result = resultStore.find(jobResultId).block(STORE_TIMEOUT);
            args = result != null && result.getTaskArgs() != null ? result.getTaskArgs() : new HashMap<>();
        }
        log.info("Running dispatched job result {}", jobResultId);
        return jobRunner.run(jobResultId, args);
    }

    ExecutionOutcome runLocal(String jobId, String data) {
        Map<String, Object> args = parseArgs(data);
        JobDefinition definition = registry.lookupRunnable(jobId).block(STORE_TIMEOUT);
        JobResult result = JobResult.builder()
            .id(UUID.randomUUID().toString())
            .jobId(jobId)
            .jobName(definition.getName())
            .user(config.getUser())
            .queue(LOCAL_QUEUE)
            .taskArgs(definition.isHasSensitiveVariables() ? null : args)
            .status(JobResultStatus.PENDING)
            .createdAt(clock.instant())
            .build();
        resultStore.create(result).block(STORE_TIMEOUT);
        log.info("Running job {} locally as job result {}", jobId, result.getId());
        return jobRunner.run(result.getId(), args == null ? new HashMap<>() : args);
    }

    private Map<String, Object> parseArgs(String json) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readValue(json, new TypeReference<Map<String, Object>>() {
            });
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Job arguments are not a JSON object: " + e.getOriginalMessage(), e);
        }
    }
}
