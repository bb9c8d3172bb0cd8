package com.whereq.conductor.store.redis;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.conductor.model.ScheduledRun;
import com.whereq.conductor.store.ScheduledRunStore;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Repository
public class RedisScheduledRunStore implements ScheduledRunStore {

    static final String SCHEDULES_KEY = "conductor:schedules";

    private final ReactiveRedisTemplate<String, String> redisTemplate;
    private final RedisJson json;

    public RedisScheduledRunStore(ReactiveRedisTemplate<String, String> redisTemplate, ObjectMapper objectMapper) {
        this.redisTemplate = redisTemplate;
        this.json = new RedisJson(objectMapper);
    }

    @Override
    public Mono<ScheduledRun> save(ScheduledRun run) {
        return redisTemplate.<String, String>opsForHash()
            .put(SCHEDULES_KEY, run.getId(), json.write(run))
            .thenReturn(run);
    }

    @Override
    public Mono<ScheduledRun> find(String id) {
        return redisTemplate.<String, String>opsForHash()
            .get(SCHEDULES_KEY, id)
            .map(value -> json.read(value, ScheduledRun.class));
    }

    @Override
    public Flux<ScheduledRun> findAll() {
        return redisTemplate.<String, String>opsForHash()
            .values(SCHEDULES_KEY)
            .map(value -> json.read(value, ScheduledRun.class));
    }

    @Override
    public Mono<Boolean> delete(String id) {
        return redisTemplate.<String, String>opsForHash()
            .remove(SCHEDULES_KEY, id)
            .map(removed -> removed > 0);
    }
}
