package com.whereq.conductor.kubernetes;

import lombok.Builder;
import lombok.Data;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Everything needed to create the compute object of one task
 */
@Data
@Builder
public class ComputeRequest {

    private String name;

    private String jobResultId;

    private String jobId;

    /**
     * Task arguments as JSON, handed to the runner through the environment
     */
    private String argsJson;

    @Builder.Default
    private Map<String, String> labels = new HashMap<>();

    /**
     * Kubernetes kills the task after this long
     */
    private Duration activeDeadline;

    private Duration ttlAfterFinished;
}
