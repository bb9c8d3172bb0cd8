package com.whereq.conductor.dto;

import com.whereq.conductor.model.ScheduleInterval;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScheduleSpec {

    private String name;

    @NotNull
    private ScheduleInterval interval;

    /**
     * Required unless CUSTOM. Ignored for IMMEDIATE.
     */
    private Instant startTime;

    /**
     * Five-field crontab, required for CUSTOM only
     */
    private String crontab;

    /**
     * IANA zone id, defaults to the scheduler's zone
     */
    private String timeZone;

    private String description;
}
