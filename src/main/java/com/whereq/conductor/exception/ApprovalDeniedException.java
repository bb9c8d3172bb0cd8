package com.whereq.conductor.exception;

import org.springframework.http.HttpStatus;

/**
 * Thrown for any action on a scheduled run whose approval workflow was denied.
 * Terminal, never retryable.
 */
public class ApprovalDeniedException extends ConductorException {

    public ApprovalDeniedException(String message) {
        super(message);
    }

    @Override
    public String getErrorCode() {
        return "approval_denied";
    }

    @Override
    public HttpStatus getHttpStatus() {
        return HttpStatus.CONFLICT;
    }
}
