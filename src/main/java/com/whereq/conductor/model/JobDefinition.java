package com.whereq.conductor.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Persisted record of a discovered job: metadata from code plus administrator settings.
 * Fields with an override flag keep the administrator's value across registry refreshes.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobDefinition {

    /**
     * Stable job key, e.g. "ExportObjectList"
     */
    private String id;

    private String name;

    private String grouping;

    private String description;

    @Builder.Default
    private List<JobVariable> variables = new ArrayList<>();

    /**
     * False once the job body is no longer present in code
     */
    @Builder.Default
    private boolean installed = true;

    private boolean enabled;

    private boolean singleton;

    private boolean hasSensitiveVariables;

    private Duration softTimeLimit;

    private Duration timeLimit;

    private boolean dryrunDefault;

    private boolean hidden;

    private boolean readOnly;

    /**
     * Name of the approval workflow definition gating this job, null when ungated
     */
    private String approvalWorkflow;

    private String defaultQueue;

    private boolean nameOverride;

    private boolean groupingOverride;

    private boolean descriptionOverride;

    private boolean softTimeLimitOverride;

    private boolean timeLimitOverride;

    private boolean hasSensitiveVariablesOverride;

    private boolean dryrunDefaultOverride;

    private Instant createdAt;

    private Instant lastUpdated;

    @JsonIgnore
    public boolean isRunnable() {
        return installed && enabled;
    }

    public boolean requiresApproval() {
        return approvalWorkflow != null && !approvalWorkflow.isBlank();
    }
}
