package com.whereq.conductor.model;

/**
 * Dispatch eligibility of a ScheduledRun
 */
public enum ScheduleState {
    /**
     * Waiting on its approval workflow
     */
    PENDING_APPROVAL,
    ELIGIBLE,
    /**
     * One-off run already dispatched
     */
    FIRED,
    DENIED,
    CANCELLED
}
