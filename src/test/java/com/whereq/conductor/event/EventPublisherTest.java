package com.whereq.conductor.event;

import com.whereq.conductor.config.ConductorProperties;
import com.whereq.conductor.support.RecordingEventSubscriber;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class EventPublisherTest {

    @Test
    void shouldDeliverOnlyToEnabledSubscribers() {
        RecordingEventSubscriber recording = new RecordingEventSubscriber();
        EventSubscriber disabled = mock(EventSubscriber.class);
        when(disabled.name()).thenReturn("webhook");
        ConductorProperties properties = new ConductorProperties();
        properties.getEvents().setSubscribers(List.of(RecordingEventSubscriber.NAME));

        new EventPublisher(List.of(recording, disabled), properties)
            .publish(EventTopics.JOB_STARTED, Map.of("job_result_id", "r-1"));

        assertThat(recording.payloads(EventTopics.JOB_STARTED)).containsExactly(Map.of("job_result_id", "r-1"));
        verify(disabled, never()).onEvent(any(), anyMap());
    }

    @Test
    void shouldKeepPublishingWhenSubscriberFails() {
        EventSubscriber broken = mock(EventSubscriber.class);
        when(broken.name()).thenReturn("broken");
        doThrow(new IllegalStateException("down")).when(broken).onEvent(any(), anyMap());
        RecordingEventSubscriber recording = new RecordingEventSubscriber();
        ConductorProperties properties = new ConductorProperties();
        properties.getEvents().setSubscribers(List.of("broken", RecordingEventSubscriber.NAME));

        new EventPublisher(List.of(broken, recording), properties)
            .publish(EventTopics.JOB_COMPLETED, Map.of("status", "COMPLETED"));

        assertThat(recording.payloads(EventTopics.JOB_COMPLETED)).hasSize(1);
    }
}
