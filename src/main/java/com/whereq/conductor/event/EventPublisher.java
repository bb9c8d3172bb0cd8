package com.whereq.conductor.event;

import com.whereq.conductor.config.ConductorProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Fans events out to the subscribers enabled at startup. A failing subscriber is logged and
 * skipped; publishing never fails the caller.
 */
@Slf4j
@Service
public class EventPublisher {

    private final List<EventSubscriber> subscribers;

    public EventPublisher(List<EventSubscriber> available, ConductorProperties properties) {
        List<String> enabled = properties.getEvents().getSubscribers();
        this.subscribers = available.stream()
            .filter(subscriber -> enabled.contains(subscriber.name()))
            .collect(Collectors.toUnmodifiableList());
        log.info("Event subscribers: {}", this.subscribers.stream().map(EventSubscriber::name).toList());
    }

    public void publish(String topic, Map<String, Object> payload) {
        for (EventSubscriber subscriber : subscribers) {
            try {
                subscriber.onEvent(topic, payload);
            } catch (RuntimeException e) {
                log.error("Event subscriber {} failed on {}: {}", subscriber.name(), topic, e.getMessage(), e);
            }
        }
    }
}
