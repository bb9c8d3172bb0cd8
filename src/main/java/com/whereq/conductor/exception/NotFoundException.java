package com.whereq.conductor.exception;

import org.springframework.http.HttpStatus;

public class NotFoundException extends ConductorException {

    public NotFoundException(String kind, String id) {
        super(kind + " not found: " + id);
    }

    @Override
    public String getErrorCode() {
        return "not_found";
    }

    @Override
    public HttpStatus getHttpStatus() {
        return HttpStatus.NOT_FOUND;
    }
}
