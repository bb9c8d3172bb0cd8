package com.whereq.conductor.store;

import com.whereq.conductor.model.FailureInfo;
import com.whereq.conductor.model.JobResult;
import com.whereq.conductor.model.JobResultStatus;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;

/**
 * Persistence for JobResults. Status changes are atomic compare-and-set operations so that
 * concurrent writers (worker, dispatcher, pod watcher) agree on a single terminal transition.
 */
public interface JobResultStore {

    Mono<JobResult> create(JobResult result);

    Mono<JobResult> find(String id);

    /**
     * List results, newest first.
     *
     * @param jobId filter by job, null for all
     * @param status filter by status, null for all
     * @param limit maximum number of results
     */
    Flux<JobResult> list(String jobId, JobResultStatus status, int limit);

    /**
     * PENDING to RUNNING.
     *
     * @return true when this call performed the transition
     */
    Mono<Boolean> markRunning(String id, Instant startedAt);

    /**
     * PENDING or RUNNING to a terminal status. Only one caller ever gets true for a given result.
     */
    Mono<Boolean> markTerminal(String id, JobResultStatus status, Instant completedAt,
                               Object output, FailureInfo failure);

    Mono<Void> setComputeObjectName(String id, String computeObjectName);

    Mono<Boolean> delete(String id);
}
