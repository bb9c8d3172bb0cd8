package com.whereq.conductor.dispatch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.conductor.config.ConductorProperties;
import com.whereq.conductor.exception.BackendException;
import com.whereq.conductor.exception.JobTimeoutException;
import com.whereq.conductor.executor.ResultFinalizer;
import com.whereq.conductor.job.JobLogger;
import com.whereq.conductor.kubernetes.ComputeOrchestrator;
import com.whereq.conductor.kubernetes.ComputePhase;
import com.whereq.conductor.kubernetes.ComputeRequest;
import com.whereq.conductor.model.BackendType;
import com.whereq.conductor.model.ExecutionOutcome;
import com.whereq.conductor.model.FailureInfo;
import com.whereq.conductor.model.JobDefinition;
import com.whereq.conductor.model.JobResult;
import com.whereq.conductor.model.LogLevel;
import com.whereq.conductor.model.TaskMessage;
import com.whereq.conductor.store.JobLogStore;
import com.whereq.conductor.store.JobResultStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.util.retry.Retry;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * One compute object per task. Submission creates the object, then polls it until it is
 * terminal or the watch times out, mirrors its log into the result, and deletes it.
 * The returned Mono completes only after all of that.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "conductor.kubernetes", name = "enabled", havingValue = "true", matchIfMissing = true)
public class PodTaskBackend implements TaskBackend {

    public static final String NAME_PREFIX = "conductor-job-";
    public static final String LOG_GROUPING = "pod";

    static final int POLL_RETRIES = 3;

    private final ComputeOrchestrator orchestrator;
    private final JobResultStore resultStore;
    private final JobLogStore logStore;
    private final ResultFinalizer finalizer;
    private final ObjectMapper objectMapper;
    private final ConductorProperties.KubernetesConfig config;
    private final Clock clock;

    public PodTaskBackend(ComputeOrchestrator orchestrator,
                          JobResultStore resultStore,
                          JobLogStore logStore,
                          ResultFinalizer finalizer,
                          ObjectMapper objectMapper,
                          ConductorProperties properties,
                          Clock clock) {
        this.orchestrator = orchestrator;
        this.resultStore = resultStore;
        this.logStore = logStore;
        this.finalizer = finalizer;
        this.objectMapper = objectMapper;
        this.config = properties.getKubernetes();
        this.clock = clock;
    }

    @Override
    public BackendType type() {
        return BackendType.POD_PER_TASK;
    }

    public static String computeObjectName(String jobResultId) {
        return NAME_PREFIX + jobResultId.toLowerCase();
    }

    @Override
    public Mono<Void> submit(JobDefinition definition, JobResult result, TaskMessage message) {
        String name = computeObjectName(result.getId());
        Duration hardLimit = Duration.ofSeconds(message.getTimeLimitSeconds());
        Duration watchTimeout = config.getWatchTimeout() != null
            ? config.getWatchTimeout()
            : hardLimit.plusMinutes(1);

        ComputeRequest request = ComputeRequest.builder()
            .name(name)
            .jobResultId(result.getId())
            .jobId(definition.getId())
            .argsJson(toJson(message.getArgs()))
            .labels(Map.of("conductor.whereq.com/job-id", sanitizeLabel(definition.getId())))
            .activeDeadline(hardLimit.plus(config.getCleanupGrace()))
            .ttlAfterFinished(config.getTtlAfterFinished())
            .build();

        return Mono.fromCallable(() -> orchestrator.create(request))
            .subscribeOn(Schedulers.boundedElastic())
            .flatMap(created -> resultStore.setComputeObjectName(result.getId(), created)
                .then(appendLog(result.getId(), LogLevel.INFO, "Created Kubernetes job " + created))
                .thenReturn(created))
            .flatMap(created -> watch(created, watchTimeout)
                .flatMap(phase -> afterTerminal(definition, result, created, phase, message))
                .onErrorResume(TimeoutException.class, e -> onWatchTimeout(definition, result, created, hardLimit, message))
                .onErrorResume(e -> !(e instanceof TimeoutException), e -> abandon(result, created, e)));
    }

    @Override
    public Mono<Void> cancel(JobDefinition definition, JobResult result) {
        String name = result.getComputeObjectName() != null
            ? result.getComputeObjectName()
            : computeObjectName(result.getId());
        return Mono.fromCallable(() -> orchestrator.delete(name))
            .subscribeOn(Schedulers.boundedElastic())
            .then(appendLog(result.getId(), LogLevel.WARNING, "Kubernetes job " + name + " deleted on request"))
            .then(finalizer.finish(definition, result.getId(),
                ExecutionOutcome.errored(FailureInfo.of("Cancelled", "Job was cancelled")), result.getTaskArgs()))
            .then();
    }

    /**
     * Poll until the object is terminal.
     *
     * @return the terminal phase, a TimeoutException after {@code timeout}, or the poll error once
     * {@link #POLL_RETRIES} retries of one poll failed
     */
    Mono<ComputePhase> watch(String name, Duration timeout) {
        return Flux.interval(Duration.ZERO, config.getPollInterval(), Schedulers.boundedElastic())
            .onBackpressureDrop()
            .concatMap(tick -> Mono.fromCallable(() -> orchestrator.phase(name))
                .doOnError(BackendException.class, e -> log.warn("Polling Kubernetes job {} failed: {}", name, e.getMessage()))
                .retryWhen(Retry.fixedDelay(POLL_RETRIES, config.getPollInterval())
                    .filter(BackendException.class::isInstance)
                    .onRetryExhaustedThrow((spec, signal) -> signal.failure())))
            .doOnNext(phase -> log.debug("Kubernetes job {} is {}", name, phase))
            .filter(ComputePhase::isTerminal)
            .next()
            .timeout(timeout);
    }

    private Mono<Void> afterTerminal(JobDefinition definition, JobResult result, String name,
                                     ComputePhase phase, TaskMessage message) {
        log.info("Kubernetes job {} for job result {} ended {}", name, result.getId(), phase);
        Mono<Boolean> finish = switch (phase) {
            case SUCCEEDED -> finalizer.finish(definition, result.getId(),
                ExecutionOutcome.errored(FailureInfo.of("BackendException",
                    "Kubernetes job " + name + " succeeded without recording a result")), message.getArgs());
            case FAILED -> finalizer.finish(definition, result.getId(),
                ExecutionOutcome.errored(FailureInfo.of("BackendException", "Kubernetes job " + name + " failed")),
                message.getArgs());
            default -> finalizer.finish(definition, result.getId(),
                ExecutionOutcome.errored(FailureInfo.of("BackendException", "Kubernetes job " + name + " disappeared")),
                message.getArgs());
        };
        // Runner inside the pod normally finished the result already; these only apply if it did not
        return mirrorLogs(result.getId(), name)
            .then(finish)
            .then(cleanup(name));
    }

    private Mono<Void> onWatchTimeout(JobDefinition definition, JobResult result, String name,
                                      Duration hardLimit, TaskMessage message) {
        log.error("Kubernetes job {} for job result {} did not finish in time, deleting it", name, result.getId());
        return Mono.fromCallable(() -> orchestrator.delete(name))
            .subscribeOn(Schedulers.boundedElastic())
            .onErrorResume(BackendException.class, e -> {
                log.error("Failed to delete timed out Kubernetes job {}: {}", name, e.getMessage());
                return Mono.just(false);
            })
            .then(finalizer.finish(definition, result.getId(),
                ExecutionOutcome.timedOut(FailureInfo.from(new JobTimeoutException(definition.getId(), hardLimit))),
                message.getArgs()))
            .then();
    }

    /**
     * The object can no longer be followed. Delete it before the error reaches the dispatcher,
     * which finishes the result and releases the singleton lock.
     */
    private Mono<Void> abandon(JobResult result, String name, Throwable error) {
        log.error("Lost track of Kubernetes job {} for job result {}, deleting it: {}", name, result.getId(), error.getMessage());
        return Mono.fromCallable(() -> orchestrator.delete(name))
            .subscribeOn(Schedulers.boundedElastic())
            .onErrorResume(BackendException.class, e -> {
                log.error("Failed to delete Kubernetes job {}: {}", name, e.getMessage());
                return Mono.just(false);
            })
            .then(appendLog(result.getId(), LogLevel.ERROR, "Kubernetes job " + name + " deleted: " + error.getMessage()))
            .then(Mono.error(error));
    }

    private Mono<Void> mirrorLogs(String jobResultId, String name) {
        return Mono.fromCallable(() -> orchestrator.logs(name))
            .subscribeOn(Schedulers.boundedElastic())
            .flatMapMany(Flux::fromIterable)
            .concatMap(line -> appendLog(jobResultId, LogLevel.INFO, line))
            .then();
    }

    private Mono<Void> cleanup(String name) {
        return Mono.delay(config.getCleanupGrace())
            .then(Mono.fromCallable(() -> orchestrator.delete(name)).subscribeOn(Schedulers.boundedElastic()))
            .onErrorResume(BackendException.class, e -> {
                // ttlSecondsAfterFinished reclaims it anyway
                log.warn("Failed to delete Kubernetes job {}: {}", name, e.getMessage());
                return Mono.just(false);
            })
            .then();
    }

    private Mono<Void> appendLog(String jobResultId, LogLevel level, String message) {
        return logStore.append(JobLogger.entry(jobResultId, level, LOG_GROUPING, message, clock)).then();
    }

    private String toJson(Map<String, Object> args) {
        try {
            return objectMapper.writeValueAsString(args == null ? Map.of() : args);
        } catch (JsonProcessingException e) {
            throw new BackendException("Failed to serialize task arguments", e);
        }
    }

    private static String sanitizeLabel(String value) {
        String label = value.replaceAll("[^A-Za-z0-9._-]", "-");
        return label.length() > 63 ? label.substring(0, 63) : label;
    }
}
