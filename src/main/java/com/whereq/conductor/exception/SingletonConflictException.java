package com.whereq.conductor.exception;

import org.springframework.http.HttpStatus;

/**
 * Thrown when a singleton job is dispatched while another execution still holds its lock.
 * The request is not queued; callers retry later.
 */
public class SingletonConflictException extends ConductorException {

    private final String jobId;

    public SingletonConflictException(String jobId) {
        super("Job '" + jobId + "' is a singleton and already running");
        this.jobId = jobId;
    }

    public String getJobId() {
        return jobId;
    }

    @Override
    public String getErrorCode() {
        return "singleton_conflict";
    }

    @Override
    public HttpStatus getHttpStatus() {
        return HttpStatus.CONFLICT;
    }
}
