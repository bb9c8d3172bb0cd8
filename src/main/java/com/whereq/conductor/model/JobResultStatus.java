package com.whereq.conductor.model;

/**
 * JobResult lifecycle: PENDING -> RUNNING -> COMPLETED | ERRORED.
 * PENDING may also go straight to a terminal state when submission fails.
 */
public enum JobResultStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    ERRORED;

    public boolean isTerminal() {
        return this == COMPLETED || this == ERRORED;
    }
}
