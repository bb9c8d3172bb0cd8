package com.whereq.conductor.job;

import com.whereq.conductor.model.JobVariable;
import lombok.Builder;
import lombok.Data;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Metadata a job declares in code
 */
@Data
@Builder
public class JobMeta {

    /**
     * Stable identifier, used as the registry key
     */
    private String id;

    private String name;

    @Builder.Default
    private String grouping = "System Jobs";

    private String description;

    @Builder.Default
    private List<JobVariable> variables = new ArrayList<>();

    private boolean singleton;

    private boolean hasSensitiveVariables;

    /**
     * Null means the configured default
     */
    private Duration softTimeLimit;

    /**
     * Null means the configured default
     */
    private Duration timeLimit;

    private boolean dryrunDefault;

    private boolean hidden;

    /**
     * The job does not modify inventory data
     */
    private boolean readOnly;
}
