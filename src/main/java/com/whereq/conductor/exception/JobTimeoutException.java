package com.whereq.conductor.exception;

import org.springframework.http.HttpStatus;

import java.time.Duration;

/**
 * Describes a job that exceeded its hard time limit. Used as failure detail on the
 * JobResult rather than thrown across the backend boundary.
 */
public class JobTimeoutException extends ConductorException {

    public JobTimeoutException(String jobId, Duration limit) {
        super("Job '" + jobId + "' exceeded its hard time limit of " + limit.toSeconds() + " seconds");
    }

    @Override
    public String getErrorCode() {
        return "timeout";
    }

    @Override
    public HttpStatus getHttpStatus() {
        return HttpStatus.GATEWAY_TIMEOUT;
    }
}
