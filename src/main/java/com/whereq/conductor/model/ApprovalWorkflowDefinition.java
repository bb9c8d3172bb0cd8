package com.whereq.conductor.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered list of approval stages a gated job must pass
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ApprovalWorkflowDefinition {

    private String name;

    @Builder.Default
    private List<ApprovalStageDefinition> stages = new ArrayList<>();
}
