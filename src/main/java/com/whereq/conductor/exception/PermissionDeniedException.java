package com.whereq.conductor.exception;

import org.springframework.http.HttpStatus;

public class PermissionDeniedException extends ConductorException {

    public PermissionDeniedException(String message) {
        super(message);
    }

    @Override
    public String getErrorCode() {
        return "permission_denied";
    }

    @Override
    public HttpStatus getHttpStatus() {
        return HttpStatus.FORBIDDEN;
    }
}
