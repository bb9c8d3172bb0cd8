package com.whereq.conductor.event;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.conductor.config.ConductorProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Publishes events on Redis pub/sub, one channel per topic
 */
@Slf4j
@Component
public class RedisEventSubscriber implements EventSubscriber {

    private final ReactiveRedisTemplate<String, String> redisTemplate;
    private final ObjectMapper objectMapper;
    private final String channelPrefix;

    public RedisEventSubscriber(ReactiveRedisTemplate<String, String> redisTemplate,
                                ObjectMapper objectMapper,
                                ConductorProperties properties) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.channelPrefix = properties.getEvents().getRedisChannelPrefix();
    }

    @Override
    public String name() {
        return "redis";
    }

    @Override
    public void onEvent(String topic, Map<String, Object> payload) {
        String message;
        try {
            message = objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + topic + " event", e);
        }
        String channel = channelPrefix + "." + topic;
        redisTemplate.convertAndSend(channel, message)
            .subscribe(
                receivers -> log.debug("Published {} to {} ({} receivers)", topic, channel, receivers),
                error -> log.error("Failed to publish {} to {}: {}", topic, channel, error.getMessage()));
    }
}
