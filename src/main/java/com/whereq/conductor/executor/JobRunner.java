package com.whereq.conductor.executor;

import com.whereq.conductor.event.EventPublisher;
import com.whereq.conductor.event.EventTopics;
import com.whereq.conductor.exception.ConductorException;
import com.whereq.conductor.exception.JobTimeoutException;
import com.whereq.conductor.job.Job;
import com.whereq.conductor.job.JobContext;
import com.whereq.conductor.job.JobLogger;
import com.whereq.conductor.model.ExecutionOutcome;
import com.whereq.conductor.model.FailureInfo;
import com.whereq.conductor.model.JobDefinition;
import com.whereq.conductor.model.JobResult;
import com.whereq.conductor.model.JobResultStatus;
import com.whereq.conductor.model.TypedArgs;
import com.whereq.conductor.registry.JobRegistry;
import com.whereq.conductor.store.FileProxyStore;
import com.whereq.conductor.store.JobLogStore;
import com.whereq.conductor.store.JobResultStore;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Executes one JobResult in the current process. Shared by the worker pool and the
 * one-shot runner inside pods. Blocking; call it from a worker thread.
 */
@Slf4j
@Service
public class JobRunner {

    private static final Duration STORE_TIMEOUT = Duration.ofSeconds(30);

    private final JobRegistry registry;
    private final JobResultStore resultStore;
    private final JobLogStore logStore;
    private final FileProxyStore fileProxyStore;
    private final ResultFinalizer finalizer;
    private final EventPublisher eventPublisher;
    private final Clock clock;
    private final Timer executionTimer;
    private final ExecutorService bodyExecutor;

    public JobRunner(JobRegistry registry,
                     JobResultStore resultStore,
                     JobLogStore logStore,
                     FileProxyStore fileProxyStore,
                     ResultFinalizer finalizer,
                     EventPublisher eventPublisher,
                     MeterRegistry meterRegistry,
                     Clock clock) {
        this.registry = registry;
        this.resultStore = resultStore;
        this.logStore = logStore;
        this.fileProxyStore = fileProxyStore;
        this.finalizer = finalizer;
        this.eventPublisher = eventPublisher;
        this.clock = clock;

        this.executionTimer = Timer.builder("conductor.jobs.execution.time")
            .description("Job execution time")
            .register(meterRegistry);

        AtomicInteger threadCount = new AtomicInteger();
        this.bodyExecutor = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "job-body-" + threadCount.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @PreDestroy
    public void shutdown() {
        bodyExecutor.shutdownNow();
    }

    /**
     * Run a result that the dispatcher created.
     *
     * @param jobResultId result to execute
     * @param rawArgs arguments as dispatched, validated again before the body runs
     * @return how the execution ended; for an already terminal result, its stored outcome
     */
    public ExecutionOutcome run(String jobResultId, Map<String, Object> rawArgs) {
        JobResult result = resultStore.find(jobResultId).block(STORE_TIMEOUT);
        if (result == null) {
            log.error("Job result {} not found, nothing to run", jobResultId);
            return ExecutionOutcome.errored(FailureInfo.of("NotFoundException", "Job result not found: " + jobResultId));
        }
        if (result.getStatus().isTerminal()) {
            log.info("Job result {} is already {}, skipping", jobResultId, result.getStatus());
            return storedOutcome(result);
        }

        Boolean started = resultStore.markRunning(jobResultId, clock.instant()).block(STORE_TIMEOUT);
        if (!Boolean.TRUE.equals(started)) {
            // Redelivered after the previous worker died mid-run
            log.warn("Job result {} was already running, executing it again", jobResultId);
        }

        JobDefinition definition;
        try {
            definition = registry.lookupRunnable(result.getJobId()).block(STORE_TIMEOUT);
        } catch (ConductorException e) {
            log.error("Job result {} cannot run: {}", jobResultId, e.getMessage());
            JobDefinition known = registry.lookup(result.getJobId()).onErrorResume(x -> Mono.empty())
                .block(STORE_TIMEOUT);
            ExecutionOutcome outcome = ExecutionOutcome.errored(FailureInfo.from(e));
            if (known != null) {
                finalizer.finish(known, jobResultId, outcome, rawArgs).block(STORE_TIMEOUT);
            } else {
                resultStore.markTerminal(jobResultId, JobResultStatus.ERRORED, clock.instant(), null, outcome.getFailure())
                    .block(STORE_TIMEOUT);
            }
            return outcome;
        }
        return execute(definition, result, rawArgs);
    }

    private ExecutionOutcome execute(JobDefinition definition, JobResult result, Map<String, Object> rawArgs) {
        String jobResultId = result.getId();
        Job body = registry.body(definition.getId()).orElse(null);
        JobLogger logger = new JobLogger(jobResultId, logStore,
            LoggerFactory.getLogger(body != null ? body.getClass() : JobRunner.class), clock);

        ExecutionOutcome outcome;
        if (body == null) {
            outcome = ExecutionOutcome.errored(FailureInfo.of("JobNotInstalled",
                "Job '" + definition.getId() + "' has no code in this process"));
        } else {
            outcome = prepareAndRun(definition, result, rawArgs, body, logger);
        }
        finalizer.finish(definition, jobResultId, outcome, rawArgs).block(STORE_TIMEOUT);
        return outcome;
    }

    private ExecutionOutcome prepareAndRun(JobDefinition definition, JobResult result, Map<String, Object> rawArgs,
                                           Job body, JobLogger logger) {
        TypedArgs args;
        try {
            args = registry.validateInputs(definition.getId(), rawArgs).block(STORE_TIMEOUT);
        } catch (ConductorException e) {
            return ExecutionOutcome.errored(FailureInfo.from(e));
        }

        Duration softLimit = registry.effectiveSoftTimeLimit(definition);
        Duration hardLimit = registry.effectiveTimeLimit(definition);
        if (hardLimit.compareTo(softLimit) <= 0) {
            log.warn("Job {} has a time limit ({}s) not greater than its soft time limit ({}s)",
                definition.getId(), hardLimit.toSeconds(), softLimit.toSeconds());
            logger.warning("Time limit " + hardLimit.toSeconds() + "s is less than or equal to soft time limit "
                + softLimit.toSeconds() + "s; the soft limit will never be signalled");
        }

        eventPublisher.publish(EventTopics.JOB_STARTED, startedPayload(definition, result, args));

        JobContext context = new JobContext(result.getId(), definition.getId(), result.getUser(),
            args.isDryrun(), logger, fileProxyStore);
        logger.info("Running job");

        long startTime = System.currentTimeMillis();
        ExecutionOutcome outcome = executeWithLimits(definition.getId(), body, context, args, softLimit, hardLimit);
        long executionTime = System.currentTimeMillis() - startTime;
        executionTimer.record(Duration.ofMillis(executionTime));

        if (outcome.getKind() == ExecutionOutcome.Kind.COMPLETED) {
            logger.success("Job completed in " + executionTime + "ms");
        }
        log.info("Job result {} of {} ended {} in {}ms", result.getId(), definition.getId(), outcome.getKind(), executionTime);
        return outcome;
    }

    /**
     * Soft limit: set the context flag and interrupt the body thread, then keep waiting.
     * Hard limit: cancel the body and report TIMED_OUT.
     */
    ExecutionOutcome executeWithLimits(String jobId, Job body, JobContext context, TypedArgs args,
                                       Duration softLimit, Duration hardLimit) {
        AtomicReference<Thread> bodyThread = new AtomicReference<>();
        Future<Object> future = bodyExecutor.submit(() -> {
            bodyThread.set(Thread.currentThread());
            return body.run(context, args);
        });
        long deadline = System.nanoTime() + hardLimit.toNanos();

        try {
            if (softLimit.compareTo(hardLimit) < 0) {
                try {
                    return ExecutionOutcome.completed(future.get(softLimit.toNanos(), TimeUnit.NANOSECONDS));
                } catch (TimeoutException e) {
                    log.warn("Job {} ({}) exceeded its soft time limit of {}s", jobId, context.getJobResultId(),
                        softLimit.toSeconds());
                    context.signalSoftLimit();
                    Thread thread = bodyThread.get();
                    if (thread != null) {
                        thread.interrupt();
                    }
                }
            }
            long remaining = Math.max(0L, deadline - System.nanoTime());
            return ExecutionOutcome.completed(future.get(remaining, TimeUnit.NANOSECONDS));
        } catch (TimeoutException e) {
            future.cancel(true);
            log.error("Job {} ({}) exceeded its time limit of {}s and was cancelled", jobId, context.getJobResultId(),
                hardLimit.toSeconds());
            return ExecutionOutcome.timedOut(FailureInfo.from(new JobTimeoutException(jobId, hardLimit)));
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (context.isSoftLimitExceeded() && cause instanceof InterruptedException) {
                return ExecutionOutcome.errored(FailureInfo.of("SoftTimeLimitExceeded",
                    "Job stopped after its soft time limit of " + softLimit.toSeconds() + "s"));
            }
            log.error("Job {} ({}) failed: {}", jobId, context.getJobResultId(), cause.getMessage(), cause);
            return ExecutionOutcome.errored(FailureInfo.from(cause));
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return ExecutionOutcome.errored(FailureInfo.from(e));
        }
    }

    private Map<String, Object> startedPayload(JobDefinition definition, JobResult result, TypedArgs args) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("job_result_id", result.getId());
        payload.put("job_name", definition.getName());
        payload.put("user_name", result.getUser());
        if (!definition.isHasSensitiveVariables()) {
            payload.put("job_kwargs", args.asMap());
        }
        return payload;
    }

    private static ExecutionOutcome storedOutcome(JobResult result) {
        return result.getStatus() == JobResultStatus.COMPLETED
            ? ExecutionOutcome.completed(result.getResult())
            : ExecutionOutcome.errored(result.getFailure());
    }
}
