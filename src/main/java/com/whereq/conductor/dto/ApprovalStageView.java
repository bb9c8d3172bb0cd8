package com.whereq.conductor.dto;

import com.whereq.conductor.model.ApprovalStage;
import com.whereq.conductor.model.ApprovalState;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A stage as listed to approvers, with the workflow it belongs to
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ApprovalStageView {

    private ApprovalStage stage;

    private String workflowId;

    private ApprovalState workflowState;

    private String scheduledRunId;

    private String requestedBy;

    /**
     * Set by approve/deny: the outcome message shown to the caller
     */
    private String message;
}
