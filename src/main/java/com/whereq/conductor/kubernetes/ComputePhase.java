package com.whereq.conductor.kubernetes;

/**
 * Observed state of a compute object
 */
public enum ComputePhase {
    PENDING,
    RUNNING,
    SUCCEEDED,
    FAILED,
    /**
     * Deleted, or never existed
     */
    MISSING;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == MISSING;
    }
}
