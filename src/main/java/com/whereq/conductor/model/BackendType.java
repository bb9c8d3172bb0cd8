package com.whereq.conductor.model;

/**
 * Execution backend a queue routes to
 */
public enum BackendType {
    /**
     * Broker queue consumed by long-lived workers
     */
    WORKER_POOL,

    /**
     * One Kubernetes job per task
     */
    POD_PER_TASK
}
