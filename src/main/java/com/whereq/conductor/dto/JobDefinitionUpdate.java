package com.whereq.conductor.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;

/**
 * Administrator edit of a job definition. Null fields are left unchanged; setting an
 * overridable field also sets its override flag.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobDefinitionUpdate {

    private Boolean enabled;

    private String name;

    private String grouping;

    private String description;

    private Duration softTimeLimit;

    private Duration timeLimit;

    private Boolean hasSensitiveVariables;

    private Boolean dryrunDefault;

    /**
     * Approval workflow definition name. Empty string removes the gate.
     */
    private String approvalWorkflow;

    private String defaultQueue;

    /**
     * Drop all overrides and take every field from code again
     */
    private Boolean resetOverrides;
}
