package com.whereq.conductor.exception;

import org.springframework.http.HttpStatus;

/**
 * Thrown when a request is rejected by a precondition check: a disabled job, a bad
 * schedule, invalid inputs or a queue the job may not use.
 */
public class ValidationException extends ConductorException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getErrorCode() {
        return "validation_error";
    }

    @Override
    public HttpStatus getHttpStatus() {
        return HttpStatus.BAD_REQUEST;
    }
}
