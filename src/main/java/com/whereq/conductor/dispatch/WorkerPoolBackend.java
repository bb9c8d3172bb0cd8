package com.whereq.conductor.dispatch;

import com.whereq.conductor.exception.ValidationException;
import com.whereq.conductor.model.BackendType;
import com.whereq.conductor.model.JobDefinition;
import com.whereq.conductor.model.JobResult;
import com.whereq.conductor.model.TaskMessage;
import com.whereq.conductor.queue.TaskBroker;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Fire-and-forget submission onto the broker queue named by the result
 */
@Component
@RequiredArgsConstructor
public class WorkerPoolBackend implements TaskBackend {

    private final TaskBroker broker;

    @Override
    public BackendType type() {
        return BackendType.WORKER_POOL;
    }

    @Override
    public Mono<Void> submit(JobDefinition definition, JobResult result, TaskMessage message) {
        return broker.enqueue(result.getQueue(), message);
    }

    @Override
    public Mono<Void> cancel(JobDefinition definition, JobResult result) {
        return Mono.error(new ValidationException(
            "Worker pool tasks cannot be cancelled; they stop at their time limit"));
    }
}
