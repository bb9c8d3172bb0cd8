package com.whereq.conductor.store.redis;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.conductor.config.ConductorProperties;
import com.whereq.conductor.model.JobLogEntry;
import com.whereq.conductor.model.LogLevel;
import com.whereq.conductor.store.JobLogStore;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * One Redis list per JobResult, appended with RPUSH
 */
@Repository
public class RedisJobLogStore implements JobLogStore {

    private static final String LOG_KEY_PREFIX = "conductor:logs:";

    private final ReactiveRedisTemplate<String, String> redisTemplate;
    private final RedisJson json;
    private final Duration ttl;

    public RedisJobLogStore(ReactiveRedisTemplate<String, String> redisTemplate,
                            ObjectMapper objectMapper,
                            ConductorProperties properties) {
        this.redisTemplate = redisTemplate;
        this.json = new RedisJson(objectMapper);
        this.ttl = properties.getStore().getResultTtl();
    }

    @Override
    public Mono<JobLogEntry> append(JobLogEntry entry) {
        String key = LOG_KEY_PREFIX + entry.getJobResultId();
        return redisTemplate.opsForList()
            .rightPush(key, json.write(entry))
            .then(redisTemplate.expire(key, ttl))
            .thenReturn(entry);
    }

    @Override
    public Flux<JobLogEntry> list(String jobResultId, LogLevel minLevel) {
        return redisTemplate.opsForList()
            .range(LOG_KEY_PREFIX + jobResultId, 0, -1)
            .map(value -> json.read(value, JobLogEntry.class))
            .filter(entry -> minLevel == null || entry.getLevel().isAtLeast(minLevel));
    }

    @Override
    public Mono<Void> deleteAll(String jobResultId) {
        return redisTemplate.delete(LOG_KEY_PREFIX + jobResultId).then();
    }
}
