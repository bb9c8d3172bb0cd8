package com.whereq.conductor.kubernetes;

import java.util.List;

/**
 * Orchestration API used by the pod-per-task backend. Calls are blocking.
 */
public interface ComputeOrchestrator {

    /**
     * Create the compute object.
     *
     * @return its name
     * @throws com.whereq.conductor.exception.BackendException when the API call fails
     */
    String create(ComputeRequest request);

    ComputePhase phase(String name);

    /**
     * Log lines of the object's containers, oldest first
     */
    List<String> logs(String name);

    /**
     * @return true when something was deleted
     */
    boolean delete(String name);
}
