package com.whereq.conductor.event;

import java.util.Map;

/**
 * Receives published events. Implementations must not block the caller for long; slow
 * deliveries are handed off to their own publisher chain.
 */
public interface EventSubscriber {

    /**
     * Name used in {@code conductor.events.subscribers}
     */
    String name();

    void onEvent(String topic, Map<String, Object> payload);
}
