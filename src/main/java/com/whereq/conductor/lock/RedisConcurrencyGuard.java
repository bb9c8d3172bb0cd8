package com.whereq.conductor.lock;

import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;

/**
 * Singleton lock as a Redis key: SET NX PX to acquire, compare-and-delete script to release
 */
@Slf4j
@Component
public class RedisConcurrencyGuard implements ConcurrencyGuard {

    private static final String LOCK_KEY_PREFIX = "conductor:lock:running:";

    private static final RedisScript<Long> RELEASE_SCRIPT = new DefaultRedisScript<>(
        "if redis.call('GET', KEYS[1]) == ARGV[1] then "
            + "return redis.call('DEL', KEYS[1]); end; "
            + "return 0;",
        Long.class);

    private final ReactiveRedisTemplate<String, String> redisTemplate;

    public RedisConcurrencyGuard(ReactiveRedisTemplate<String, String> redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    @Override
    public Mono<Boolean> acquire(String jobId, String ownerToken, Duration ttl) {
        return redisTemplate.opsForValue()
            .setIfAbsent(LOCK_KEY_PREFIX + jobId, ownerToken, ttl)
            .defaultIfEmpty(false)
            .doOnSuccess(acquired -> {
                if (acquired) {
                    log.info("Acquired singleton lock for job {} (owner {}, ttl {}s)", jobId, ownerToken, ttl.toSeconds());
                } else {
                    log.info("Singleton lock for job {} is already held", jobId);
                }
            });
    }

    @Override
    public Mono<Boolean> release(String jobId, String ownerToken) {
        return redisTemplate.execute(RELEASE_SCRIPT, List.of(LOCK_KEY_PREFIX + jobId), List.of(ownerToken))
            .next()
            .map(deleted -> deleted > 0)
            .defaultIfEmpty(false)
            .doOnSuccess(released -> {
                if (released) {
                    log.info("Released singleton lock for job {} (owner {})", jobId, ownerToken);
                }
            });
    }

    @Override
    public Mono<String> holder(String jobId) {
        return redisTemplate.opsForValue().get(LOCK_KEY_PREFIX + jobId);
    }
}
