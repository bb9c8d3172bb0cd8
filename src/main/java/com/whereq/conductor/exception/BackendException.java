package com.whereq.conductor.exception;

import org.springframework.http.HttpStatus;

/**
 * Thrown when an execution backend cannot be reached: broker unavailable,
 * orchestration API failure.
 */
public class BackendException extends ConductorException {

    public BackendException(String message) {
        super(message);
    }

    public BackendException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getErrorCode() {
        return "backend_error";
    }

    @Override
    public HttpStatus getHttpStatus() {
        return HttpStatus.SERVICE_UNAVAILABLE;
    }
}
