package com.whereq.conductor.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ErrorResponse {

    /**
     * Error code, e.g. "singleton_conflict"
     */
    private String error;

    private String message;

    private Instant timestamp;
}
