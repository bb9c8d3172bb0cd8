package com.whereq.conductor.dispatch;

import com.whereq.conductor.exception.BackendException;
import com.whereq.conductor.exception.NotFoundException;
import com.whereq.conductor.exception.SingletonConflictException;
import com.whereq.conductor.exception.ValidationException;
import com.whereq.conductor.executor.ResultFinalizer;
import com.whereq.conductor.job.JobLogger;
import com.whereq.conductor.lock.ConcurrencyGuard;
import com.whereq.conductor.model.BackendType;
import com.whereq.conductor.model.DispatchRequest;
import com.whereq.conductor.model.ExecutionOutcome;
import com.whereq.conductor.model.FailureInfo;
import com.whereq.conductor.model.JobDefinition;
import com.whereq.conductor.model.JobQueue;
import com.whereq.conductor.model.JobResult;
import com.whereq.conductor.model.JobResultStatus;
import com.whereq.conductor.model.LogLevel;
import com.whereq.conductor.model.TaskMessage;
import com.whereq.conductor.queue.QueueDirectory;
import com.whereq.conductor.registry.JobRegistry;
import com.whereq.conductor.store.JobLogStore;
import com.whereq.conductor.store.JobResultStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Turns a run request into a PENDING JobResult and hands it to the backend of the resolved queue
 */
@Slf4j
@Service
public class Dispatcher {

    private final JobRegistry registry;
    private final QueueDirectory queueDirectory;
    private final ConcurrencyGuard concurrencyGuard;
    private final JobResultStore resultStore;
    private final JobLogStore logStore;
    private final ResultFinalizer finalizer;
    private final Map<BackendType, TaskBackend> backends = new EnumMap<>(BackendType.class);
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public Dispatcher(JobRegistry registry,
                      QueueDirectory queueDirectory,
                      ConcurrencyGuard concurrencyGuard,
                      JobResultStore resultStore,
                      JobLogStore logStore,
                      ResultFinalizer finalizer,
                      List<TaskBackend> backends,
                      MeterRegistry meterRegistry,
                      Clock clock) {
        this.registry = registry;
        this.queueDirectory = queueDirectory;
        this.concurrencyGuard = concurrencyGuard;
        this.resultStore = resultStore;
        this.logStore = logStore;
        this.finalizer = finalizer;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        backends.forEach(backend -> this.backends.put(backend.type(), backend));
    }

    /**
     * Dispatch and wait for the backend to accept the task. For the pod-per-task backend this
     * waits until the compute object is terminal.
     *
     * @return the JobResult as stored after submission
     */
    public Mono<JobResult> dispatch(DispatchRequest request) {
        return dispatch(request, false);
    }

    /**
     * Dispatch without waiting for a pod to finish; worker-pool enqueueing is still awaited
     *
     * @return the PENDING JobResult
     */
    public Mono<JobResult> dispatchDetached(DispatchRequest request) {
        return dispatch(request, true);
    }

    private Mono<JobResult> dispatch(DispatchRequest request, boolean detached) {
        return registry.lookupRunnable(request.getJobId())
            .flatMap(definition -> queueDirectory.resolve(definition, request.getQueue())
                .flatMap(queue -> {
                    TaskBackend backend = backends.get(queue.getBackendType());
                    if (backend == null) {
                        return Mono.error(new BackendException(
                            "No " + queue.getBackendType() + " backend is available for queue '" + queue.getName() + "'"));
                    }
                    String resultId = UUID.randomUUID().toString();
                    return lock(definition, request, resultId)
                        .then(createResult(definition, queue, request, resultId)
                            .onErrorResume(e -> unlock(definition, resultId).then(Mono.<JobResult>error(e))))
                        .flatMap(result -> submit(definition, result, request, backend, detached));
                }));
    }

    private Mono<Void> lock(JobDefinition definition, DispatchRequest request, String resultId) {
        if (!definition.isSingleton() || request.isIgnoreSingletonLock()) {
            return Mono.empty();
        }
        Duration ttl = registry.effectiveTimeLimit(definition);
        return concurrencyGuard.acquire(definition.getId(), resultId, ttl)
            .flatMap(acquired -> {
                if (!acquired) {
                    log.info("Job {} is already running, rejecting dispatch", definition.getId());
                    return Mono.error(new SingletonConflictException(definition.getId()));
                }
                log.debug("Acquired singleton lock of {} for {}", definition.getId(), resultId);
                return Mono.<Void>empty();
            });
    }

    /**
     * Release a lock taken for a result that was never stored. A no-op for locks held by others.
     */
    private Mono<Void> unlock(JobDefinition definition, String resultId) {
        if (!definition.isSingleton()) {
            return Mono.empty();
        }
        return concurrencyGuard.release(definition.getId(), resultId)
            .doOnNext(released -> {
                if (released) {
                    log.warn("Released singleton lock of {} after failing to store job result {}", definition.getId(), resultId);
                }
            })
            .then();
    }

    private Mono<JobResult> createResult(JobDefinition definition, JobQueue queue,
                                         DispatchRequest request, String resultId) {
        JobResult result = JobResult.builder()
            .id(resultId)
            .jobId(definition.getId())
            .jobName(definition.getName())
            .user(request.getUser())
            .scheduledRunId(request.getScheduledRunId())
            .queue(queue.getName())
            .backendType(queue.getBackendType())
            .taskArgs(definition.isHasSensitiveVariables() ? null : request.getArgs())
            .status(JobResultStatus.PENDING)
            .createdAt(clock.instant())
            .build();

        Mono<JobResult> created = resultStore.create(result);
        if (definition.isSingleton() && request.isIgnoreSingletonLock()) {
            created = created.flatMap(saved -> logStore.append(JobLogger.entry(resultId, LogLevel.WARNING, null,
                    "Singleton lock was ignored on request of " + request.getUser(), clock))
                .thenReturn(saved));
        }
        return created;
    }

    private Mono<JobResult> submit(JobDefinition definition, JobResult result, DispatchRequest request,
                                   TaskBackend backend, boolean detached) {
        TaskMessage message = TaskMessage.builder()
            .jobResultId(result.getId())
            .jobId(definition.getId())
            .queue(result.getQueue())
            .args(request.getArgs())
            .softTimeLimitSeconds(registry.effectiveSoftTimeLimit(definition).toSeconds())
            .timeLimitSeconds(registry.effectiveTimeLimit(definition).toSeconds())
            .enqueuedAt(clock.instant())
            .build();

        Counter.builder("conductor.dispatches")
            .description("Number of dispatched job results")
            .tag("backend", backend.type().name())
            .register(meterRegistry)
            .increment();
        log.info("Dispatching {} of job {} to queue {} ({})",
            result.getId(), definition.getId(), result.getQueue(), backend.type());

        Mono<JobResult> submission = backend.submit(definition, result, message)
            .then(Mono.defer(() -> resultStore.find(result.getId())))
            .defaultIfEmpty(result)
            .onErrorResume(e -> submissionFailed(definition, result, request, e));

        if (detached && backend.type() == BackendType.POD_PER_TASK) {
            submission.subscribe(
                done -> log.debug("Job result {} left backend {} as {}", done.getId(), backend.type(), done.getStatus()),
                e -> log.error("Detached submission of {} failed", result.getId(), e));
            return Mono.just(result);
        }
        return submission;
    }

    private Mono<JobResult> submissionFailed(JobDefinition definition, JobResult result,
                                             DispatchRequest request, Throwable error) {
        log.error("Submission of job result {} to {} failed: {}", result.getId(), result.getBackendType(), error.getMessage());
        return finalizer.finish(definition, result.getId(), ExecutionOutcome.errored(FailureInfo.from(error)), request.getArgs())
            .then(resultStore.find(result.getId()))
            .defaultIfEmpty(result);
    }

    /**
     * Ask the backend to stop a running result
     */
    public Mono<Void> cancel(String jobResultId) {
        return resultStore.find(jobResultId)
            .switchIfEmpty(Mono.error(() -> new NotFoundException("JobResult", jobResultId)))
            .flatMap(result -> {
                if (result.getStatus().isTerminal()) {
                    return Mono.error(new ValidationException("Job result " + jobResultId + " is already " + result.getStatus()));
                }
                TaskBackend backend = backends.get(result.getBackendType());
                if (backend == null) {
                    return Mono.error(new BackendException("No " + result.getBackendType() + " backend is available"));
                }
                return registry.lookup(result.getJobId())
                    .flatMap(definition -> backend.cancel(definition, result));
            });
    }
}
