package com.whereq.conductor.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DispatchRequest {

    private String jobId;

    /**
     * Requested queue, null for the job's default
     */
    private String queue;

    /**
     * Validated, JSON-friendly arguments
     */
    @Builder.Default
    private Map<String, Object> args = new HashMap<>();

    private String user;

    private String scheduledRunId;

    private boolean ignoreSingletonLock;
}
