package com.whereq.conductor.dispatch;

import com.whereq.conductor.model.BackendType;
import com.whereq.conductor.model.JobDefinition;
import com.whereq.conductor.model.JobResult;
import com.whereq.conductor.model.TaskMessage;
import reactor.core.publisher.Mono;

/**
 * Execution backend behind a queue type
 */
public interface TaskBackend {

    BackendType type();

    /**
     * Hand a PENDING result to the backend. Errors mean the task never reached the backend.
     */
    Mono<Void> submit(JobDefinition definition, JobResult result, TaskMessage message);

    /**
     * Stop a running task, if the backend can
     */
    Mono<Void> cancel(JobDefinition definition, JobResult result);
}
