package com.whereq.conductor.executor;

import com.whereq.conductor.event.EventPublisher;
import com.whereq.conductor.event.EventTopics;
import com.whereq.conductor.job.JobLogger;
import com.whereq.conductor.lock.ConcurrencyGuard;
import com.whereq.conductor.model.ExecutionOutcome;
import com.whereq.conductor.model.JobDefinition;
import com.whereq.conductor.model.JobResult;
import com.whereq.conductor.model.JobResultStatus;
import com.whereq.conductor.model.JobVariable;
import com.whereq.conductor.model.LogLevel;
import com.whereq.conductor.model.VariableType;
import com.whereq.conductor.store.FileProxyStore;
import com.whereq.conductor.store.JobLogStore;
import com.whereq.conductor.store.JobResultStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Moves a JobResult to its terminal status. Whoever wins the atomic transition, and only
 * they, release the singleton lock, clean up uploaded files and publish job.completed.
 */
@Slf4j
@Service
public class ResultFinalizer {

    private final JobResultStore resultStore;
    private final JobLogStore logStore;
    private final FileProxyStore fileProxyStore;
    private final ConcurrencyGuard concurrencyGuard;
    private final EventPublisher eventPublisher;
    private final Clock clock;
    private final Counter completedCounter;
    private final Counter erroredCounter;

    public ResultFinalizer(JobResultStore resultStore,
                           JobLogStore logStore,
                           FileProxyStore fileProxyStore,
                           ConcurrencyGuard concurrencyGuard,
                           EventPublisher eventPublisher,
                           MeterRegistry meterRegistry,
                           Clock clock) {
        this.resultStore = resultStore;
        this.logStore = logStore;
        this.fileProxyStore = fileProxyStore;
        this.concurrencyGuard = concurrencyGuard;
        this.eventPublisher = eventPublisher;
        this.clock = clock;

        this.completedCounter = Counter.builder("conductor.jobs.completed")
            .description("Number of job results that completed")
            .register(meterRegistry);
        this.erroredCounter = Counter.builder("conductor.jobs.errored")
            .description("Number of job results that errored, timeouts included")
            .register(meterRegistry);
    }

    /**
     * Record the outcome of an execution.
     *
     * @param definition job the result belongs to
     * @param jobResultId result to finish
     * @param outcome how the execution ended
     * @param args arguments of the run, used to find uploaded files to delete; may be null
     * @return true when this call performed the terminal transition
     */
    public Mono<Boolean> finish(JobDefinition definition, String jobResultId,
                                ExecutionOutcome outcome, Map<String, Object> args) {
        JobResultStatus status = outcome.toStatus();

        return resultStore.markTerminal(jobResultId, status, clock.instant(), outcome.getOutput(), outcome.getFailure())
            .flatMap(won -> {
                if (!won) {
                    log.debug("Job result {} was already terminal, dropping {} outcome", jobResultId, outcome.getKind());
                    return Mono.just(false);
                }
                log.info("Job result {} of {} finished: {}", jobResultId, definition.getId(), outcome.getKind());
                return logFailure(jobResultId, outcome)
                    .then(deleteFiles(definition, args))
                    .then(releaseLock(definition, jobResultId))
                    .then(resultStore.find(jobResultId))
                    .doOnNext(this::publishCompleted)
                    .thenReturn(true);
            });
    }

    private Mono<Void> logFailure(String jobResultId, ExecutionOutcome outcome) {
        if (outcome.getFailure() == null) {
            return Mono.empty();
        }
        String message = outcome.getKind() == ExecutionOutcome.Kind.TIMED_OUT
            ? "Job timed out: " + outcome.getFailure().getExcMessage()
            : "Job failed: " + outcome.getFailure().getExcType() + ": " + outcome.getFailure().getExcMessage();
        return logStore.append(JobLogger.entry(jobResultId, LogLevel.ERROR, null, message, clock)).then();
    }

    private Mono<Void> deleteFiles(JobDefinition definition, Map<String, Object> args) {
        if (args == null) {
            return Mono.empty();
        }
        return Flux.fromIterable(definition.getVariables())
            .filter(variable -> variable.getType() == VariableType.FILE)
            .map(JobVariable::getName)
            .filter(args::containsKey)
            .map(name -> args.get(name).toString())
            .concatMap(fileProxyStore::delete)
            .then();
    }

    private Mono<Void> releaseLock(JobDefinition definition, String jobResultId) {
        if (!definition.isSingleton()) {
            return Mono.empty();
        }
        return concurrencyGuard.release(definition.getId(), jobResultId).then();
    }

    private void publishCompleted(JobResult result) {
        if (result.getStatus() == JobResultStatus.COMPLETED) {
            completedCounter.increment();
        } else {
            erroredCounter.increment();
        }
        eventPublisher.publish(EventTopics.JOB_COMPLETED, completedPayload(result));
    }

    static Map<String, Object> completedPayload(JobResult result) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("job_result_id", result.getId());
        payload.put("job_name", result.getJobName());
        payload.put("user_name", result.getUser());
        payload.put("status", result.getStatus().name());
        if (result.getStatus() == JobResultStatus.COMPLETED) {
            payload.put("job_output", result.getResult());
        } else if (result.getFailure() != null) {
            Map<String, Object> einfo = new LinkedHashMap<>();
            einfo.put("exc_type", result.getFailure().getExcType());
            einfo.put("exc_message", result.getFailure().getExcMessage());
            payload.put("einfo", einfo);
        }
        return payload;
    }
}
