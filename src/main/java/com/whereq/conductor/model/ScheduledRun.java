package com.whereq.conductor.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Persisted request to run a job once or repeatedly
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ScheduledRun {

    private String id;

    private String name;

    private String description;

    private String jobId;

    private String user;

    /**
     * Snapshot of validated arguments. Null for jobs with sensitive variables.
     */
    private Map<String, Object> args;

    private String queue;

    private ScheduleInterval interval;

    private Instant startTime;

    /**
     * Five-field crontab, derived for recurring intervals
     */
    private String crontab;

    private String timeZone;

    @Builder.Default
    private boolean enabled = true;

    private boolean ignoreSingletonLock;

    private Instant lastRunAt;

    private int totalRunCount;

    private boolean approvalRequired;

    private Instant approvedAt;

    private String approvedBy;

    private ScheduleState state;

    private Instant createdAt;
}
