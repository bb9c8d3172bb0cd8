package com.whereq.conductor.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ApprovalStageDefinition {

    private String name;

    /**
     * Stage order inside the workflow, unique per definition
     */
    private int weight;

    private String approverGroup;

    @Builder.Default
    private int minApprovers = 1;

    private String denialMessage;
}
