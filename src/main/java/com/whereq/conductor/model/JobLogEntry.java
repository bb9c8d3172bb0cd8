package com.whereq.conductor.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobLogEntry {

    public static final String DEFAULT_GROUPING = "main";

    private String id;

    private String jobResultId;

    private Instant createdAt;

    private LogLevel level;

    @Builder.Default
    private String grouping = DEFAULT_GROUPING;

    private String message;

    /**
     * String form of the record the line refers to, if any
     */
    private String logObject;

    private String absoluteUrl;
}
