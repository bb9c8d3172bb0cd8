package com.whereq.conductor.queue;

import com.whereq.conductor.model.TaskMessage;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;

/**
 * Interface for the worker-pool message broker
 */
public interface TaskBroker {

    /**
     * Append a task to the tail of a queue
     */
    Mono<Void> enqueue(String queue, TaskMessage message);

    /**
     * Move the head of a queue into the worker's unacked list.
     *
     * @return the delivery, or empty when the queue is empty
     */
    Mono<TaskDelivery> reserve(String queue, String workerName);

    /**
     * Drop a delivery from the unacked list
     */
    Mono<Void> acknowledge(TaskDelivery delivery);

    /**
     * Announce a live worker and the queues it consumes
     */
    Mono<Void> heartbeat(String workerName, List<String> queues, Duration ttl);

    /**
     * Put the unacked messages of workers whose heartbeat expired back at the head of their queues.
     *
     * @return number of messages redelivered
     */
    Mono<Long> recoverAbandoned();

    Mono<Long> size(String queue);
}
