package com.whereq.conductor.dto;

import jakarta.validation.Valid;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

/**
 * Request to run a job now or on a schedule
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RunJobRequest {

    /**
     * Target queue, defaults to the job's default queue
     */
    private String queue;

    /**
     * Input values keyed by variable name
     */
    @Builder.Default
    private Map<String, Object> data = new HashMap<>();

    /**
     * Absent to run immediately
     */
    @Valid
    private ScheduleSpec schedule;

    private boolean ignoreSingletonLock;
}
