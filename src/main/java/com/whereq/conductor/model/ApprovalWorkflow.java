package com.whereq.conductor.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Approval instance attached to one ScheduledRun
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ApprovalWorkflow {

    private String id;

    private String definitionName;

    private String scheduledRunId;

    private String requestedBy;

    @Builder.Default
    private ApprovalState state = ApprovalState.PENDING;

    private Instant createdAt;

    private Instant decisionDate;

    @Builder.Default
    private List<ApprovalStage> stages = new ArrayList<>();

    /**
     * Optimistic-lock counter, bumped on every save
     */
    private long version;

    /**
     * First stage, by weight, that is still pending
     */
    public Optional<ApprovalStage> activeStage() {
        if (state != ApprovalState.PENDING) {
            return Optional.empty();
        }
        return stages.stream()
            .sorted(Comparator.comparingInt(ApprovalStage::getWeight))
            .filter(s -> s.getState() == ApprovalState.PENDING)
            .findFirst();
    }

    public Optional<ApprovalStage> stage(String stageId) {
        return stages.stream().filter(s -> s.getId().equals(stageId)).findFirst();
    }
}
