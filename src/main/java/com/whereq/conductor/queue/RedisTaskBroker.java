package com.whereq.conductor.queue;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.conductor.exception.BackendException;
import com.whereq.conductor.model.TaskMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.ListOperations;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;

/**
 * Redis list based broker. Producers RPUSH onto the queue, workers LMOVE the head into a
 * per-worker unacked list. Messages left in the unacked list of a dead worker are redelivered.
 */
@Slf4j
@Service
public class RedisTaskBroker implements TaskBroker {

    private static final String QUEUE_KEY_PREFIX = "conductor:broker:queue:";
    private static final String UNACKED_KEY_PREFIX = "conductor:broker:unacked:";
    private static final String WORKERS_KEY = "conductor:broker:workers";
    private static final String WORKER_QUEUES_KEY_PREFIX = "conductor:broker:worker-queues:";
    private static final String HEARTBEAT_KEY_PREFIX = "conductor:broker:heartbeat:";

    /**
     * Moves every element of KEYS[1] to the head of KEYS[2], keeping their order
     */
    private static final RedisScript<Long> REQUEUE_SCRIPT = new DefaultRedisScript<>(
        "local n = 0; "
            + "while true do "
            + "local v = redis.call('RPOP', KEYS[1]); "
            + "if not v then break; end; "
            + "redis.call('LPUSH', KEYS[2], v); "
            + "n = n + 1; "
            + "end; "
            + "return n;",
        Long.class);

    private final ReactiveRedisTemplate<String, String> redisTemplate;
    private final ObjectMapper objectMapper;

    public RedisTaskBroker(ReactiveRedisTemplate<String, String> redisTemplate, ObjectMapper objectMapper) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public Mono<Void> enqueue(String queue, TaskMessage message) {
        return Mono.fromCallable(() -> {
                try {
                    return objectMapper.writeValueAsString(message);
                } catch (JsonProcessingException e) {
                    throw new BackendException("Failed to serialize task " + message.getJobResultId(), e);
                }
            })
            .flatMap(json -> redisTemplate.opsForList().rightPush(QUEUE_KEY_PREFIX + queue, json))
            .onErrorMap(e -> !(e instanceof BackendException),
                e -> new BackendException("Broker unavailable: " + e.getMessage(), e))
            .doOnSuccess(size -> log.info("Enqueued task {} on queue {}, queue size: {}",
                message.getJobResultId(), queue, size))
            .then();
    }

    @Override
    public Mono<TaskDelivery> reserve(String queue, String workerName) {
        return redisTemplate.opsForList()
            .move(ListOperations.MoveFrom.fromHead(QUEUE_KEY_PREFIX + queue),
                ListOperations.MoveTo.toTail(unackedKey(workerName, queue)))
            .flatMap(json -> {
                try {
                    TaskMessage message = objectMapper.readValue(json, TaskMessage.class);
                    log.debug("Worker {} reserved task {} from queue {}", workerName, message.getJobResultId(), queue);
                    return Mono.just(new TaskDelivery(queue, workerName, json, message));
                } catch (JsonProcessingException e) {
                    log.error("Dropping malformed message on queue {}: {}", queue, json, e);
                    return redisTemplate.opsForList()
                        .remove(unackedKey(workerName, queue), 1, json)
                        .then(Mono.empty());
                }
            });
    }

    @Override
    public Mono<Void> acknowledge(TaskDelivery delivery) {
        return redisTemplate.opsForList()
            .remove(unackedKey(delivery.getWorkerName(), delivery.getQueue()), 1, delivery.getPayload())
            .doOnSuccess(removed -> {
                if (removed == 0) {
                    log.warn("Attempted to acknowledge unknown task {}", delivery.getMessage().getJobResultId());
                } else {
                    log.debug("Acknowledged task {}", delivery.getMessage().getJobResultId());
                }
            })
            .then();
    }

    @Override
    public Mono<Void> heartbeat(String workerName, List<String> queues, Duration ttl) {
        String queuesKey = WORKER_QUEUES_KEY_PREFIX + workerName;
        return redisTemplate.opsForValue()
            .set(HEARTBEAT_KEY_PREFIX + workerName, String.valueOf(System.currentTimeMillis()), ttl)
            .then(redisTemplate.opsForSet().add(WORKERS_KEY, workerName))
            .then(redisTemplate.opsForSet().add(queuesKey, queues.toArray(new String[0])))
            .then();
    }

    @Override
    public Mono<Long> recoverAbandoned() {
        return redisTemplate.opsForSet().members(WORKERS_KEY)
            .filterWhen(worker -> redisTemplate.hasKey(HEARTBEAT_KEY_PREFIX + worker).map(alive -> !alive))
            .concatMap(this::requeueWorker)
            .reduce(0L, Long::sum);
    }

    @Override
    public Mono<Long> size(String queue) {
        return redisTemplate.opsForList().size(QUEUE_KEY_PREFIX + queue)
            .defaultIfEmpty(0L);
    }

    private Mono<Long> requeueWorker(String worker) {
        String queuesKey = WORKER_QUEUES_KEY_PREFIX + worker;
        return redisTemplate.opsForSet().members(queuesKey)
            .concatMap(queue -> redisTemplate.execute(REQUEUE_SCRIPT,
                    List.of(unackedKey(worker, queue), QUEUE_KEY_PREFIX + queue), List.of())
                .next()
                .defaultIfEmpty(0L)
                .doOnNext(count -> {
                    if (count > 0) {
                        log.warn("Redelivered {} unacknowledged task(s) of dead worker {} to queue {}", count, worker, queue);
                    }
                }))
            .reduce(0L, Long::sum)
            .flatMap(total -> redisTemplate.opsForSet().remove(WORKERS_KEY, worker)
                .then(redisTemplate.delete(queuesKey))
                .thenReturn(total));
    }

    private static String unackedKey(String workerName, String queue) {
        return UNACKED_KEY_PREFIX + workerName + ":" + queue;
    }
}
