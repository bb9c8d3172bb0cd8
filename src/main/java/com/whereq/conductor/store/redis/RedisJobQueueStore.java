package com.whereq.conductor.store.redis;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.conductor.model.JobQueue;
import com.whereq.conductor.model.JobQueueAssignment;
import com.whereq.conductor.store.JobQueueStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Queues in a hash keyed by name; assignments as two mirrored sets so both directions are cheap
 */
@Slf4j
@Repository
public class RedisJobQueueStore implements JobQueueStore {

    private static final String QUEUES_KEY = "conductor:queues";
    private static final String JOB_QUEUES_PREFIX = "conductor:assignments:job:";
    private static final String QUEUE_JOBS_PREFIX = "conductor:assignments:queue:";

    private final ReactiveRedisTemplate<String, String> redisTemplate;
    private final RedisJson json;

    public RedisJobQueueStore(ReactiveRedisTemplate<String, String> redisTemplate, ObjectMapper objectMapper) {
        this.redisTemplate = redisTemplate;
        this.json = new RedisJson(objectMapper);
    }

    @Override
    public Mono<Boolean> create(JobQueue queue) {
        return redisTemplate.<String, String>opsForHash()
            .putIfAbsent(QUEUES_KEY, queue.getName(), json.write(queue))
            .doOnSuccess(created -> log.info("Create queue {} ({}): {}",
                queue.getName(), queue.getBackendType(), created ? "created" : "exists"));
    }

    @Override
    public Mono<JobQueue> find(String name) {
        return redisTemplate.<String, String>opsForHash()
            .get(QUEUES_KEY, name)
            .map(value -> json.read(value, JobQueue.class));
    }

    @Override
    public Flux<JobQueue> findAll() {
        return redisTemplate.<String, String>opsForHash()
            .values(QUEUES_KEY)
            .map(value -> json.read(value, JobQueue.class));
    }

    @Override
    public Mono<Boolean> delete(String name) {
        return redisTemplate.<String, String>opsForHash()
            .remove(QUEUES_KEY, name)
            .map(removed -> removed > 0);
    }

    @Override
    public Mono<Boolean> assign(JobQueueAssignment assignment) {
        return redisTemplate.opsForSet()
            .add(JOB_QUEUES_PREFIX + assignment.getJobId(), assignment.getQueueName())
            .flatMap(added -> {
                if (added == 0) {
                    return Mono.just(false);
                }
                return redisTemplate.opsForSet()
                    .add(QUEUE_JOBS_PREFIX + assignment.getQueueName(), assignment.getJobId())
                    .thenReturn(true);
            });
    }

    @Override
    public Mono<Boolean> unassign(JobQueueAssignment assignment) {
        return redisTemplate.opsForSet()
            .remove(JOB_QUEUES_PREFIX + assignment.getJobId(), assignment.getQueueName())
            .flatMap(removed -> redisTemplate.opsForSet()
                .remove(QUEUE_JOBS_PREFIX + assignment.getQueueName(), assignment.getJobId())
                .thenReturn(removed > 0));
    }

    @Override
    public Flux<String> queuesForJob(String jobId) {
        return redisTemplate.opsForSet().members(JOB_QUEUES_PREFIX + jobId);
    }

    @Override
    public Flux<String> jobsForQueue(String queueName) {
        return redisTemplate.opsForSet().members(QUEUE_JOBS_PREFIX + queueName);
    }
}
