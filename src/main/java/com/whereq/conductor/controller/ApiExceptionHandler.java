package com.whereq.conductor.controller;

import com.whereq.conductor.dto.ErrorResponse;
import com.whereq.conductor.exception.ConductorException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebInputException;

import java.time.Instant;
import java.util.stream.Collectors;

/**
 * Maps exceptions to the JSON error body of the API
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(ConductorException.class)
    public ResponseEntity<ErrorResponse> handleConductorException(ConductorException e) {
        if (e.getHttpStatus().is5xxServerError()) {
            log.error("Request failed: {}", e.getMessage(), e);
        } else {
            log.warn("Request rejected ({}): {}", e.getErrorCode(), e.getMessage());
        }
        return error(e.getHttpStatus(), e.getErrorCode(), e.getMessage());
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ErrorResponse> handleBindException(WebExchangeBindException e) {
        String message = e.getFieldErrors().stream()
            .map(field -> field.getField() + ": " + field.getDefaultMessage())
            .collect(Collectors.joining("; "));
        log.warn("Validation failed: {}", message);
        return error(HttpStatus.BAD_REQUEST, "validation_error", message);
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ErrorResponse> handleInputException(ServerWebInputException e) {
        log.warn("Unreadable request: {}", e.getReason());
        return error(HttpStatus.BAD_REQUEST, "validation_error", e.getReason());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleException(Exception e) {
        log.error("Unhandled exception: {}", e.getMessage(), e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "internal_error",
            e.getMessage() != null ? e.getMessage() : "Internal server error");
    }

    private static ResponseEntity<ErrorResponse> error(HttpStatus status, String code, String message) {
        return ResponseEntity.status(status).body(ErrorResponse.builder()
            .error(code)
            .message(message)
            .timestamp(Instant.now())
            .build());
    }
}
