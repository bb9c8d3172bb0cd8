package com.whereq.conductor.store.redis;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.conductor.model.JobDefinition;
import com.whereq.conductor.store.JobDefinitionStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Job definitions as one JSON document per key in a hash
 */
@Slf4j
@Repository
public class RedisJobDefinitionStore implements JobDefinitionStore {

    private static final String DEFINITIONS_KEY = "conductor:jobs";

    private final ReactiveRedisTemplate<String, String> redisTemplate;
    private final RedisJson json;

    public RedisJobDefinitionStore(ReactiveRedisTemplate<String, String> redisTemplate, ObjectMapper objectMapper) {
        this.redisTemplate = redisTemplate;
        this.json = new RedisJson(objectMapper);
    }

    @Override
    public Mono<JobDefinition> save(JobDefinition definition) {
        return redisTemplate.<String, String>opsForHash()
            .put(DEFINITIONS_KEY, definition.getId(), json.write(definition))
            .doOnSuccess(v -> log.debug("Saved job definition {}", definition.getId()))
            .thenReturn(definition);
    }

    @Override
    public Mono<JobDefinition> find(String jobId) {
        return redisTemplate.<String, String>opsForHash()
            .get(DEFINITIONS_KEY, jobId)
            .map(value -> json.read(value, JobDefinition.class));
    }

    @Override
    public Flux<JobDefinition> findAll() {
        return redisTemplate.<String, String>opsForHash()
            .values(DEFINITIONS_KEY)
            .map(value -> json.read(value, JobDefinition.class));
    }
}
