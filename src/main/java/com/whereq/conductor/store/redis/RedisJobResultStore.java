package com.whereq.conductor.store.redis;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.conductor.config.ConductorProperties;
import com.whereq.conductor.model.FailureInfo;
import com.whereq.conductor.model.JobResult;
import com.whereq.conductor.model.JobResultStatus;
import com.whereq.conductor.store.JobResultStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Range;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * JobResults in Redis. Each result is a hash: the immutable creation document under "doc" plus one
 * field per mutable attribute, so that status transitions can be done by a Lua script that checks
 * and writes in one step.
 */
@Slf4j
@Repository
public class RedisJobResultStore implements JobResultStore {

    private static final String RESULT_KEY_PREFIX = "conductor:result:";
    private static final String INDEX_KEY = "conductor:results";
    private static final String JOB_INDEX_KEY_PREFIX = "conductor:results:job:";

    private static final String F_DOC = "doc";
    private static final String F_STATUS = "status";
    private static final String F_STARTED = "startedAt";
    private static final String F_COMPLETED = "completedAt";
    private static final String F_OUTPUT = "output";
    private static final String F_FAILURE = "failure";
    private static final String F_COMPUTE = "computeObjectName";

    private static final RedisScript<Long> MARK_RUNNING = new DefaultRedisScript<>(
        "if redis.call('HGET', KEYS[1], 'status') == 'PENDING' then "
            + "redis.call('HSET', KEYS[1], 'status', 'RUNNING', 'startedAt', ARGV[1]); "
            + "return 1; end; "
            + "return 0;",
        Long.class);

    private static final RedisScript<Long> MARK_TERMINAL = new DefaultRedisScript<>(
        "local current = redis.call('HGET', KEYS[1], 'status'); "
            + "if current == 'PENDING' or current == 'RUNNING' then "
            + "redis.call('HSET', KEYS[1], 'status', ARGV[1], 'completedAt', ARGV[2], "
            + "'output', ARGV[3], 'failure', ARGV[4]); "
            + "return 1; end; "
            + "return 0;",
        Long.class);

    private final ReactiveRedisTemplate<String, String> redisTemplate;
    private final RedisJson json;
    private final Duration ttl;

    public RedisJobResultStore(ReactiveRedisTemplate<String, String> redisTemplate,
                               ObjectMapper objectMapper,
                               ConductorProperties properties) {
        this.redisTemplate = redisTemplate;
        this.json = new RedisJson(objectMapper);
        this.ttl = properties.getStore().getResultTtl();
    }

    @Override
    public Mono<JobResult> create(JobResult result) {
        String key = RESULT_KEY_PREFIX + result.getId();
        JobResult doc = result.toBuilder()
            .status(null)
            .startedAt(null)
            .completedAt(null)
            .result(null)
            .failure(null)
            .computeObjectName(null)
            .build();

        Map<String, String> fields = new HashMap<>();
        fields.put(F_DOC, json.write(doc));
        fields.put(F_STATUS, result.getStatus().name());
        double score = result.getCreatedAt().toEpochMilli();

        return redisTemplate.<String, String>opsForHash()
            .putAll(key, fields)
            .then(redisTemplate.expire(key, ttl))
            .then(redisTemplate.opsForZSet().add(INDEX_KEY, result.getId(), score))
            .then(redisTemplate.opsForZSet().add(JOB_INDEX_KEY_PREFIX + result.getJobId(), result.getId(), score))
            .doOnSuccess(v -> log.debug("Created job result {} for job {}", result.getId(), result.getJobId()))
            .thenReturn(result);
    }

    @Override
    public Mono<JobResult> find(String id) {
        return redisTemplate.<String, String>opsForHash()
            .entries(RESULT_KEY_PREFIX + id)
            .collectMap(Map.Entry::getKey, Map.Entry::getValue)
            .filter(fields -> fields.containsKey(F_DOC))
            .map(this::parse);
    }

    @Override
    public Flux<JobResult> list(String jobId, JobResultStatus status, int limit) {
        String indexKey = jobId == null ? INDEX_KEY : JOB_INDEX_KEY_PREFIX + jobId;
        return redisTemplate.opsForZSet()
            .reverseRange(indexKey, Range.unbounded())
            .concatMap(this::find)
            .filter(result -> status == null || result.getStatus() == status)
            .take(limit);
    }

    @Override
    public Mono<Boolean> markRunning(String id, Instant startedAt) {
        return redisTemplate.execute(MARK_RUNNING, List.of(RESULT_KEY_PREFIX + id), List.of(startedAt.toString()))
            .next()
            .map(changed -> changed == 1L)
            .defaultIfEmpty(false);
    }

    @Override
    public Mono<Boolean> markTerminal(String id, JobResultStatus status, Instant completedAt,
                                      Object output, FailureInfo failure) {
        if (!status.isTerminal()) {
            return Mono.error(new IllegalArgumentException("Not a terminal status: " + status));
        }
        List<String> args = List.of(
            status.name(),
            completedAt.toString(),
            output == null ? "" : json.write(output),
            failure == null ? "" : json.write(failure));

        return redisTemplate.execute(MARK_TERMINAL, List.of(RESULT_KEY_PREFIX + id), args)
            .next()
            .map(changed -> changed == 1L)
            .defaultIfEmpty(false)
            .doOnSuccess(won -> log.debug("Terminal transition of {} to {}: {}", id, status, won ? "applied" : "lost"));
    }

    @Override
    public Mono<Void> setComputeObjectName(String id, String computeObjectName) {
        return redisTemplate.<String, String>opsForHash()
            .put(RESULT_KEY_PREFIX + id, F_COMPUTE, computeObjectName)
            .then();
    }

    @Override
    public Mono<Boolean> delete(String id) {
        return find(id)
            .flatMap(result -> redisTemplate.delete(RESULT_KEY_PREFIX + id)
                .then(redisTemplate.opsForZSet().remove(INDEX_KEY, id))
                .then(redisTemplate.opsForZSet().remove(JOB_INDEX_KEY_PREFIX + result.getJobId(), id))
                .thenReturn(true))
            .defaultIfEmpty(false);
    }

    private JobResult parse(Map<String, String> fields) {
        JobResult result = json.read(fields.get(F_DOC), JobResult.class);
        result.setStatus(JobResultStatus.valueOf(fields.get(F_STATUS)));
        result.setStartedAt(instant(fields.get(F_STARTED)));
        result.setCompletedAt(instant(fields.get(F_COMPLETED)));
        String output = fields.get(F_OUTPUT);
        if (output != null && !output.isEmpty()) {
            result.setResult(json.readValue(output));
        }
        String failure = fields.get(F_FAILURE);
        if (failure != null && !failure.isEmpty()) {
            result.setFailure(json.read(failure, FailureInfo.class));
        }
        result.setComputeObjectName(fields.get(F_COMPUTE));
        return result;
    }

    private static Instant instant(String value) {
        return value == null || value.isEmpty() ? null : Instant.parse(value);
    }
}
