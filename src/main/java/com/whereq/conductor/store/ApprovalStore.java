package com.whereq.conductor.store;

import com.whereq.conductor.model.ApprovalWorkflow;
import com.whereq.conductor.model.ApprovalWorkflowDefinition;
import com.whereq.conductor.model.ScheduledRun;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Persistence for approval workflow definitions and instances
 */
public interface ApprovalStore {

    Mono<ApprovalWorkflowDefinition> saveDefinition(ApprovalWorkflowDefinition definition);

    Mono<ApprovalWorkflowDefinition> findDefinition(String name);

    Flux<ApprovalWorkflowDefinition> findAllDefinitions();

    /**
     * Store a new workflow together with the run it gates, atomically. Neither is visible
     * without the other.
     */
    Mono<Void> createWithRun(ApprovalWorkflow workflow, ScheduledRun run);

    /**
     * Replace a workflow if nobody saved it since it was read.
     *
     * @return false when the stored version differs from {@code workflow.getVersion()}
     */
    Mono<Boolean> compareAndSave(ApprovalWorkflow workflow);

    Mono<ApprovalWorkflow> findWorkflow(String id);

    Mono<ApprovalWorkflow> findWorkflowByStage(String stageId);

    Mono<ApprovalWorkflow> findWorkflowByRun(String scheduledRunId);

    Flux<ApprovalWorkflow> findAllWorkflows();
}
