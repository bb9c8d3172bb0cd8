package com.whereq.conductor.exception;

import org.springframework.http.HttpStatus;

/**
 * Thrown when approving a one-off run whose start time has already passed.
 * The approver must repeat the call with explicit confirmation.
 */
public class StaleScheduleException extends ValidationException {

    public StaleScheduleException(String message) {
        super(message);
    }

    @Override
    public String getErrorCode() {
        return "stale_schedule";
    }

    @Override
    public HttpStatus getHttpStatus() {
        return HttpStatus.CONFLICT;
    }
}
