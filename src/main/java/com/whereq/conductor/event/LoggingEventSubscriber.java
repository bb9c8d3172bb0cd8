package com.whereq.conductor.event;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;

@Slf4j
@Component
public class LoggingEventSubscriber implements EventSubscriber {

    @Override
    public String name() {
        return "log";
    }

    @Override
    public void onEvent(String topic, Map<String, Object> payload) {
        log.info("Event {}: {}", topic, payload);
    }
}
