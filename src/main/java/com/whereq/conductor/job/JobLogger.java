package com.whereq.conductor.job;

import com.whereq.conductor.model.JobLogEntry;
import com.whereq.conductor.model.LogLevel;
import com.whereq.conductor.store.JobLogStore;
import com.whereq.conductor.util.LogSanitizer;
import org.slf4j.Logger;

import java.time.Clock;
import java.time.Duration;
import java.util.UUID;

/**
 * Logger handed to job bodies. Every line becomes a JobLogEntry of the running result and is
 * mirrored to the job's SLF4J logger.
 */
public class JobLogger {

    private static final Duration APPEND_TIMEOUT = Duration.ofSeconds(10);

    private final String jobResultId;
    private final JobLogStore logStore;
    private final Logger delegate;
    private final Clock clock;

    public JobLogger(String jobResultId, JobLogStore logStore, Logger delegate, Clock clock) {
        this.jobResultId = jobResultId;
        this.logStore = logStore;
        this.delegate = delegate;
        this.clock = clock;
    }

    public void debug(String message) {
        log(LogLevel.DEBUG, JobLogEntry.DEFAULT_GROUPING, message, null);
    }

    public void info(String message) {
        log(LogLevel.INFO, JobLogEntry.DEFAULT_GROUPING, message, null);
    }

    public void success(String message) {
        log(LogLevel.SUCCESS, JobLogEntry.DEFAULT_GROUPING, message, null);
    }

    public void warning(String message) {
        log(LogLevel.WARNING, JobLogEntry.DEFAULT_GROUPING, message, null);
    }

    public void failure(String message) {
        log(LogLevel.FAILURE, JobLogEntry.DEFAULT_GROUPING, message, null);
    }

    public void error(String message) {
        log(LogLevel.ERROR, JobLogEntry.DEFAULT_GROUPING, message, null);
    }

    public void critical(String message) {
        log(LogLevel.CRITICAL, JobLogEntry.DEFAULT_GROUPING, message, null);
    }

    /**
     * Log a line about a specific record, under a grouping of the caller's choice
     */
    public void log(LogLevel level, String grouping, String message, Object logObject) {
        JobLogEntry entry = entry(jobResultId, level, grouping, message, clock);
        if (logObject != null) {
            entry.setLogObject(logObject.toString());
        }
        mirror(level, entry.getMessage());
        logStore.append(entry).block(APPEND_TIMEOUT);
    }

    private void mirror(LogLevel level, String message) {
        switch (level) {
            case DEBUG -> delegate.debug("[{}] {}", jobResultId, message);
            case INFO, SUCCESS -> delegate.info("[{}] {}", jobResultId, message);
            case WARNING -> delegate.warn("[{}] {}", jobResultId, message);
            case FAILURE, ERROR, CRITICAL -> delegate.error("[{}] {}", jobResultId, message);
        }
    }

    /**
     * Build a sanitized entry without storing it
     */
    public static JobLogEntry entry(String jobResultId, LogLevel level, String grouping, String message, Clock clock) {
        return JobLogEntry.builder()
            .id(UUID.randomUUID().toString())
            .jobResultId(jobResultId)
            .createdAt(clock.instant())
            .level(level)
            .grouping(grouping == null ? JobLogEntry.DEFAULT_GROUPING : grouping)
            .message(LogSanitizer.sanitize(message))
            .build();
    }
}
