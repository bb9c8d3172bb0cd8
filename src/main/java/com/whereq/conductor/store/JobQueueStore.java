package com.whereq.conductor.store;

import com.whereq.conductor.model.JobQueue;
import com.whereq.conductor.model.JobQueueAssignment;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Persistence for queues and job-to-queue assignments
 */
public interface JobQueueStore {

    /**
     * Insert a queue.
     *
     * @return false when a queue with the same name already exists
     */
    Mono<Boolean> create(JobQueue queue);

    Mono<JobQueue> find(String name);

    Flux<JobQueue> findAll();

    Mono<Boolean> delete(String name);

    /**
     * Insert an assignment.
     *
     * @return false when the (job, queue) pair already exists
     */
    Mono<Boolean> assign(JobQueueAssignment assignment);

    Mono<Boolean> unassign(JobQueueAssignment assignment);

    Flux<String> queuesForJob(String jobId);

    Flux<String> jobsForQueue(String queueName);
}
