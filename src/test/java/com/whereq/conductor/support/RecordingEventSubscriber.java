package com.whereq.conductor.support;

import com.whereq.conductor.event.EventSubscriber;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

public class RecordingEventSubscriber implements EventSubscriber {

    public static final String NAME = "recording";

    private final List<Map.Entry<String, Map<String, Object>>> events = new CopyOnWriteArrayList<>();

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void onEvent(String topic, Map<String, Object> payload) {
        events.add(Map.entry(topic, payload));
    }

    public List<Map<String, Object>> payloads(String topic) {
        return events.stream()
            .filter(event -> event.getKey().equals(topic))
            .map(Map.Entry::getValue)
            .collect(Collectors.toList());
    }
}
