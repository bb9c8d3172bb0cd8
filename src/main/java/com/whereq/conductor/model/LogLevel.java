package com.whereq.conductor.model;

/**
 * Levels of job log entries, ordered by severity
 */
public enum LogLevel {
    DEBUG(10),
    INFO(20),
    SUCCESS(25),
    WARNING(30),
    FAILURE(35),
    ERROR(40),
    CRITICAL(50);

    private final int severity;

    LogLevel(int severity) {
        this.severity = severity;
    }

    public int getSeverity() {
        return severity;
    }

    public boolean isAtLeast(LogLevel other) {
        return severity >= other.severity;
    }
}
