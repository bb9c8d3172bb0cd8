package com.whereq.conductor.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.PrintWriter;
import java.io.StringWriter;

/**
 * Failure detail captured on an errored JobResult
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FailureInfo {

    private String excType;

    private String excMessage;

    private String traceback;

    public static FailureInfo of(String excType, String excMessage) {
        return FailureInfo.builder()
            .excType(excType)
            .excMessage(excMessage)
            .build();
    }

    public static FailureInfo from(Throwable error) {
        StringWriter trace = new StringWriter();
        error.printStackTrace(new PrintWriter(trace));
        return FailureInfo.builder()
            .excType(error.getClass().getSimpleName())
            .excMessage(error.getMessage())
            .traceback(trace.toString())
            .build();
    }
}
