package com.whereq.conductor.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ApprovalStage {

    private String id;

    private String workflowId;

    private String name;

    private int weight;

    private String approverGroup;

    private int minApprovers;

    private String denialMessage;

    @Builder.Default
    private ApprovalState state = ApprovalState.PENDING;

    private Instant decisionDate;

    @Builder.Default
    private List<StageResponse> responses = new ArrayList<>();

    public long approvalCount() {
        return responses.stream().filter(r -> r.getState() == ApprovalState.APPROVED).count();
    }

    public boolean hasDecisionFrom(String user) {
        return responses.stream().anyMatch(r -> r.getState() != null && r.getUser().equals(user));
    }
}
