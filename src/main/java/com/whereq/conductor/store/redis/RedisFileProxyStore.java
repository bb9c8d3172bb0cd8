package com.whereq.conductor.store.redis;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.conductor.config.ConductorProperties;
import com.whereq.conductor.model.FileProxy;
import com.whereq.conductor.store.FileProxyStore;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Uploaded files as JSON documents (content base64 encoded) with a TTL
 */
@Repository
public class RedisFileProxyStore implements FileProxyStore {

    private static final String FILE_KEY_PREFIX = "conductor:file:";

    private final ReactiveRedisTemplate<String, String> redisTemplate;
    private final RedisJson json;
    private final Duration ttl;

    public RedisFileProxyStore(ReactiveRedisTemplate<String, String> redisTemplate,
                               ObjectMapper objectMapper,
                               ConductorProperties properties) {
        this.redisTemplate = redisTemplate;
        this.json = new RedisJson(objectMapper);
        this.ttl = properties.getStore().getFileProxyTtl();
    }

    @Override
    public Mono<FileProxy> save(FileProxy file) {
        return redisTemplate.opsForValue()
            .set(FILE_KEY_PREFIX + file.getId(), json.write(file), ttl)
            .thenReturn(file);
    }

    @Override
    public Mono<FileProxy> find(String id) {
        return redisTemplate.opsForValue()
            .get(FILE_KEY_PREFIX + id)
            .map(value -> json.read(value, FileProxy.class));
    }

    @Override
    public Mono<Boolean> delete(String id) {
        return redisTemplate.delete(FILE_KEY_PREFIX + id).map(deleted -> deleted > 0);
    }
}
