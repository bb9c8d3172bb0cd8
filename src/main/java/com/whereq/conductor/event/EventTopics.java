package com.whereq.conductor.event;

public final class EventTopics {

    public static final String JOB_STARTED = "job.started";
    public static final String JOB_COMPLETED = "job.completed";
    public static final String APPROVAL_APPROVED = "approval.approved";
    public static final String APPROVAL_DENIED = "approval.denied";

    private EventTopics() {
    }
}
