package com.whereq.conductor.exception;

import org.springframework.http.HttpStatus;

/**
 * Base class for every failure the conductor surfaces to its callers.
 * Each subclass maps to one HTTP status for the REST layer.
 */
public abstract class ConductorException extends RuntimeException {

    protected ConductorException(String message) {
        super(message);
    }

    protected ConductorException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Short machine readable error code, e.g. "validation_error"
     */
    public abstract String getErrorCode();

    public abstract HttpStatus getHttpStatus();
}
