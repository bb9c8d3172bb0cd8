package com.whereq.conductor.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.whereq.conductor.model.JobResult;
import com.whereq.conductor.model.ScheduledRun;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * The JobResult of an immediate dispatch, the ScheduledRun that was created, or both when an
 * IMMEDIATE schedule was dispatched on submission
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RunJobResponse {

    private String jobResultId;

    private String scheduledRunId;

    /**
     * JobResult status or ScheduledRun state
     */
    private String status;

    private JobResult jobResult;

    private ScheduledRun scheduledRun;

    public static RunJobResponse dispatched(JobResult result) {
        return RunJobResponse.builder()
            .jobResultId(result.getId())
            .status(result.getStatus().name())
            .jobResult(result)
            .build();
    }

    public static RunJobResponse scheduled(ScheduledRun run) {
        return RunJobResponse.builder()
            .scheduledRunId(run.getId())
            .status(run.getState().name())
            .scheduledRun(run)
            .build();
    }

    public static RunJobResponse fired(JobResult result, ScheduledRun run) {
        return RunJobResponse.builder()
            .jobResultId(result.getId())
            .scheduledRunId(run.getId())
            .status(run.getState().name())
            .jobResult(result)
            .scheduledRun(run)
            .build();
    }
}
