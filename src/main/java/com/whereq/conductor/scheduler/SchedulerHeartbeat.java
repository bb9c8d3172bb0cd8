package com.whereq.conductor.scheduler;

import com.whereq.conductor.config.ConductorProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.time.Instant;

/**
 * Liveness marker of the scheduler: epoch millis of the last tick in Redis, and optionally the
 * modification time of a file for container probes
 */
@Slf4j
@Component
public class SchedulerHeartbeat {

    private final ReactiveRedisTemplate<String, String> redisTemplate;
    private final ConductorProperties.SchedulerConfig config;

    public SchedulerHeartbeat(ReactiveRedisTemplate<String, String> redisTemplate, ConductorProperties properties) {
        this.redisTemplate = redisTemplate;
        this.config = properties.getScheduler();
    }

    public Mono<Void> beat(Instant now) {
        touchFile(now);
        return redisTemplate.opsForValue()
            .set(config.getHeartbeatKey(), String.valueOf(now.toEpochMilli()))
            .then();
    }

    /**
     * Time since the last tick, empty when the scheduler never ran
     */
    public Mono<Duration> age(Instant now) {
        return redisTemplate.opsForValue()
            .get(config.getHeartbeatKey())
            .map(value -> Duration.between(Instant.ofEpochMilli(Long.parseLong(value)), now));
    }

    private void touchFile(Instant now) {
        if (config.getHeartbeatFile() == null || config.getHeartbeatFile().isBlank()) {
            return;
        }
        Path file = Path.of(config.getHeartbeatFile());
        try {
            if (Files.notExists(file)) {
                Files.createFile(file);
            }
            Files.setLastModifiedTime(file, FileTime.from(now));
        } catch (IOException e) {
            log.warn("Failed to touch scheduler heartbeat file {}: {}", file, e.getMessage());
        }
    }
}
