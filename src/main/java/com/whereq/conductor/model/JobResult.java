package com.whereq.conductor.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Record of one execution attempt
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class JobResult {

    private String id;

    private String jobId;

    private String jobName;

    private String user;

    private String scheduledRunId;

    private String queue;

    private BackendType backendType;

    /**
     * Arguments as submitted. Null when the job has sensitive variables.
     */
    private Map<String, Object> taskArgs;

    private JobResultStatus status;

    private Instant createdAt;

    private Instant startedAt;

    private Instant completedAt;

    /**
     * Value returned by the job body
     */
    private Object result;

    private FailureInfo failure;

    /**
     * Name of the Kubernetes job for the pod-per-task backend
     */
    private String computeObjectName;
}
