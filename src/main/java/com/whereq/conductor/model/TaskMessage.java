package com.whereq.conductor.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Represents a task on a worker-pool broker queue
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskMessage {

    private String jobResultId;

    private String jobId;

    private String queue;

    private Map<String, Object> args;

    private long softTimeLimitSeconds;

    private long timeLimitSeconds;

    private Instant enqueuedAt;
}
