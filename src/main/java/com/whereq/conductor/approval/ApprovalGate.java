package com.whereq.conductor.approval;

import com.whereq.conductor.dto.ApprovalStageView;
import com.whereq.conductor.event.EventPublisher;
import com.whereq.conductor.event.EventTopics;
import com.whereq.conductor.exception.ApprovalDeniedException;
import com.whereq.conductor.exception.NotFoundException;
import com.whereq.conductor.exception.PermissionDeniedException;
import com.whereq.conductor.exception.StaleScheduleException;
import com.whereq.conductor.exception.ValidationException;
import com.whereq.conductor.model.ApprovalStage;
import com.whereq.conductor.model.ApprovalStageDefinition;
import com.whereq.conductor.model.ApprovalState;
import com.whereq.conductor.model.ApprovalWorkflow;
import com.whereq.conductor.model.ApprovalWorkflowDefinition;
import com.whereq.conductor.model.RequestUser;
import com.whereq.conductor.model.ScheduleInterval;
import com.whereq.conductor.model.ScheduleState;
import com.whereq.conductor.model.ScheduledRun;
import com.whereq.conductor.model.StageResponse;
import com.whereq.conductor.scheduler.JobScheduler;
import com.whereq.conductor.store.ApprovalStore;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.BiFunction;

/**
 * Human approval of gated scheduled runs. A run stays PENDING_APPROVAL until every stage of its
 * workflow is approved in weight order; a single denial ends it.
 * <p>
 * Workflows are updated with an optimistic version check so that concurrent decisions on the
 * same workflow cannot both finish it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ApprovalGate {

    private static final int MAX_UPDATE_ATTEMPTS = 3;

    private final ApprovalStore approvalStore;
    private final JobScheduler scheduler;
    private final EventPublisher eventPublisher;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    // ---- definitions ----

    public Mono<ApprovalWorkflowDefinition> createDefinition(ApprovalWorkflowDefinition definition) {
        validateDefinition(definition);
        return approvalStore.findDefinition(definition.getName())
            .flatMap(existing -> Mono.<ApprovalWorkflowDefinition>error(
                new ValidationException("Approval workflow '" + definition.getName() + "' already exists")))
            .switchIfEmpty(Mono.defer(() -> approvalStore.saveDefinition(definition)))
            .doOnNext(saved -> log.info("Created approval workflow definition {} with {} stage(s)",
                saved.getName(), saved.getStages().size()));
    }

    public Mono<ApprovalWorkflowDefinition> findDefinition(String name) {
        return approvalStore.findDefinition(name)
            .switchIfEmpty(Mono.error(() -> new NotFoundException("ApprovalWorkflowDefinition", name)));
    }

    public Flux<ApprovalWorkflowDefinition> listDefinitions() {
        return approvalStore.findAllDefinitions();
    }

    static void validateDefinition(ApprovalWorkflowDefinition definition) {
        if (definition.getName() == null || definition.getName().isBlank()) {
            throw new ValidationException("Approval workflow name is required");
        }
        if (definition.getStages() == null || definition.getStages().isEmpty()) {
            throw new ValidationException("Approval workflow '" + definition.getName() + "' needs at least one stage");
        }
        Set<Integer> weights = new HashSet<>();
        for (ApprovalStageDefinition stage : definition.getStages()) {
            if (stage.getName() == null || stage.getName().isBlank()) {
                throw new ValidationException("Every approval stage needs a name");
            }
            if (stage.getApproverGroup() == null || stage.getApproverGroup().isBlank()) {
                throw new ValidationException("Stage '" + stage.getName() + "' needs an approver group");
            }
            if (stage.getMinApprovers() < 1) {
                throw new ValidationException("Stage '" + stage.getName() + "' needs at least one approver");
            }
            if (!weights.add(stage.getWeight())) {
                throw new ValidationException("Stage weight " + stage.getWeight() + " is used more than once");
            }
        }
    }

    // ---- workflows ----

    /**
     * Attach a new workflow instance to a gated run and store both atomically
     */
    public Mono<ScheduledRun> submit(ScheduledRun run, String workflowName) {
        return findDefinition(workflowName)
            .onErrorMap(NotFoundException.class,
                e -> new ValidationException("Approval workflow '" + workflowName + "' does not exist"))
            .flatMap(definition -> {
                Instant now = clock.instant();
                String workflowId = UUID.randomUUID().toString();
                List<ApprovalStage> stages = new ArrayList<>();
                definition.getStages().stream()
                    .sorted(Comparator.comparingInt(ApprovalStageDefinition::getWeight))
                    .forEach(stage -> stages.add(ApprovalStage.builder()
                        .id(UUID.randomUUID().toString())
                        .workflowId(workflowId)
                        .name(stage.getName())
                        .weight(stage.getWeight())
                        .approverGroup(stage.getApproverGroup())
                        .minApprovers(stage.getMinApprovers())
                        .denialMessage(stage.getDenialMessage())
                        .build()));
                ApprovalWorkflow workflow = ApprovalWorkflow.builder()
                    .id(workflowId)
                    .definitionName(definition.getName())
                    .scheduledRunId(run.getId())
                    .requestedBy(run.getUser())
                    .createdAt(now)
                    .stages(stages)
                    .build();
                ScheduledRun gated = run.toBuilder()
                    .approvalRequired(true)
                    .state(ScheduleState.PENDING_APPROVAL)
                    .build();
                return approvalStore.createWithRun(workflow, gated)
                    .doOnSuccess(v -> log.info("Scheduled run {} of job {} awaits approval ({})",
                        gated.getId(), gated.getJobId(), definition.getName()))
                    .thenReturn(gated);
            });
    }

    public Mono<ApprovalStageView> approve(String stageId, RequestUser approver, String comment, boolean force) {
        return decide(stageId, (workflow, stage) -> {
            checkCanDecide(workflow, stage, approver);
            return scheduler.find(workflow.getScheduledRunId()).map(run -> {
                if (isWithdrawn(run)) {
                    throw new ValidationException("Scheduled run " + run.getId() + " is " + run.getState()
                        + " and can no longer be approved");
                }
                boolean finalApproval = stage.approvalCount() + 1 >= stage.getMinApprovers()
                    && workflow.getStages().stream()
                        .filter(s -> s.getState() == ApprovalState.PENDING)
                        .count() == 1;
                Instant now = clock.instant();
                if (finalApproval && !force && run.getInterval() == ScheduleInterval.FUTURE
                    && run.getStartTime() != null && run.getStartTime().isBefore(now)) {
                    throw new StaleScheduleException("Start time " + run.getStartTime() + " of scheduled run "
                        + run.getId() + " has passed; approve again with force to run it now");
                }
                stage.getResponses().add(StageResponse.builder()
                    .user(approver.getUsername())
                    .state(ApprovalState.APPROVED)
                    .comment(comment)
                    .createdAt(now)
                    .build());
                if (stage.approvalCount() >= stage.getMinApprovers()) {
                    stage.setState(ApprovalState.APPROVED);
                    stage.setDecisionDate(now);
                }
                if (workflow.getStages().stream().allMatch(s -> s.getState() == ApprovalState.APPROVED)) {
                    workflow.setState(ApprovalState.APPROVED);
                    workflow.setDecisionDate(now);
                }
                return workflow;
            });
        }).flatMap(workflow -> {
            ApprovalStage stage = workflow.stage(stageId).orElseThrow();
            meterRegistry.counter("conductor.approvals.responses", "decision", "approved").increment();
            if (workflow.getState() != ApprovalState.APPROVED) {
                String message = stage.getState() == ApprovalState.APPROVED
                    ? "Stage '" + stage.getName() + "' approved"
                    : "Approval recorded, " + (stage.getMinApprovers() - stage.approvalCount()) + " more needed";
                return Mono.just(view(workflow, stage, message));
            }
            return onWorkflowApproved(workflow, approver)
                .thenReturn(view(workflow, stage, "Approval workflow approved"));
        });
    }

    public Mono<ApprovalStageView> deny(String stageId, RequestUser approver, String comment) {
        return decide(stageId, (workflow, stage) -> {
            checkCanDecide(workflow, stage, approver);
            Instant now = clock.instant();
            stage.getResponses().add(StageResponse.builder()
                .user(approver.getUsername())
                .state(ApprovalState.DENIED)
                .comment(comment)
                .createdAt(now)
                .build());
            stage.setState(ApprovalState.DENIED);
            stage.setDecisionDate(now);
            workflow.setState(ApprovalState.DENIED);
            workflow.setDecisionDate(now);
            return Mono.just(workflow);
        }).flatMap(workflow -> {
            ApprovalStage stage = workflow.stage(stageId).orElseThrow();
            meterRegistry.counter("conductor.approvals.responses", "decision", "denied").increment();
            String message = stage.getDenialMessage() != null && !stage.getDenialMessage().isBlank()
                ? stage.getDenialMessage()
                : "Stage '" + stage.getName() + "' denied";
            return scheduler.find(workflow.getScheduledRunId())
                .map(run -> run.toBuilder().state(ScheduleState.DENIED).enabled(false).build())
                .flatMap(scheduler::save)
                .doOnNext(run -> {
                    log.info("Scheduled run {} denied by {} at stage {}", run.getId(), approver.getUsername(), stage.getName());
                    eventPublisher.publish(EventTopics.APPROVAL_DENIED, decisionPayload(workflow, run, stage, approver));
                })
                .thenReturn(view(workflow, stage, message));
        });
    }

    public Mono<ApprovalStageView> comment(String stageId, RequestUser user, String text) {
        if (text == null || text.isBlank()) {
            return Mono.error(new ValidationException("A comment is required"));
        }
        return decide(stageId, (workflow, stage) -> {
            if (!user.isAdmin() && !user.inGroup(stage.getApproverGroup())
                && !user.getUsername().equals(workflow.getRequestedBy())) {
                throw new PermissionDeniedException("User '" + user.getUsername() + "' cannot comment on stage " + stageId);
            }
            stage.getResponses().add(StageResponse.builder()
                .user(user.getUsername())
                .comment(text)
                .createdAt(clock.instant())
                .build());
            return Mono.just(workflow);
        }).map(workflow -> view(workflow, workflow.stage(stageId).orElseThrow(), "Comment added"));
    }

    /**
     * Stages visible to the caller.
     *
     * @param pendingApprovals true for stages awaiting the caller's decision, false for the
     *                         others, null for all
     */
    public Flux<ApprovalStageView> listStages(RequestUser user, Boolean pendingApprovals) {
        return approvalStore.findAllWorkflows()
            .flatMapIterable(workflow -> {
                List<ApprovalStageView> views = new ArrayList<>();
                for (ApprovalStage stage : workflow.getStages()) {
                    if (pendingApprovals != null && isPendingFor(workflow, stage, user) != pendingApprovals) {
                        continue;
                    }
                    views.add(view(workflow, stage, null));
                }
                return views;
            });
    }

    public Mono<ApprovalWorkflow> findWorkflowByRun(String scheduledRunId) {
        return approvalStore.findWorkflowByRun(scheduledRunId);
    }

    static boolean isPendingFor(ApprovalWorkflow workflow, ApprovalStage stage, RequestUser user) {
        return workflow.activeStage().map(active -> active.getId().equals(stage.getId())).orElse(false)
            && user.inGroup(stage.getApproverGroup())
            && stage.getResponses().stream().noneMatch(r -> r.getUser().equals(user.getUsername()));
    }

    private void checkCanDecide(ApprovalWorkflow workflow, ApprovalStage stage, RequestUser user) {
        if (!user.isAdmin() && !user.inGroup(stage.getApproverGroup())) {
            throw new PermissionDeniedException("User '" + user.getUsername()
                + "' is not in approver group '" + stage.getApproverGroup() + "'");
        }
        if (user.getUsername().equals(workflow.getRequestedBy())) {
            throw new PermissionDeniedException("User '" + user.getUsername() + "' cannot decide on their own request");
        }
        if (stage.hasDecisionFrom(user.getUsername())) {
            throw new ValidationException("User '" + user.getUsername() + "' already responded to stage '" + stage.getName() + "'");
        }
        String activeId = workflow.activeStage().map(ApprovalStage::getId).orElse(null);
        if (!stage.getId().equals(activeId)) {
            throw new ValidationException(stage.getState() == ApprovalState.PENDING
                ? "Prior stages of the workflow must be approved first"
                : "Stage '" + stage.getName() + "' is already " + stage.getState());
        }
    }

    /**
     * Read-modify-write of the workflow owning {@code stageId}, retried when another decision
     * saved the workflow in between
     */
    private Mono<ApprovalWorkflow> decide(String stageId,
                                          BiFunction<ApprovalWorkflow, ApprovalStage, Mono<ApprovalWorkflow>> change) {
        return Mono.defer(() -> approvalStore.findWorkflowByStage(stageId)
                .switchIfEmpty(Mono.error(() -> new NotFoundException("ApprovalStage", stageId)))
                .flatMap(workflow -> {
                    if (workflow.getState() == ApprovalState.DENIED) {
                        return Mono.error(new ApprovalDeniedException("Approval workflow " + workflow.getId() + " was denied"));
                    }
                    if (workflow.getState() == ApprovalState.APPROVED) {
                        return Mono.error(new ValidationException("Approval workflow " + workflow.getId() + " is already approved"));
                    }
                    ApprovalStage stage = workflow.stage(stageId).orElseThrow();
                    return change.apply(workflow, stage);
                })
                .flatMap(workflow -> approvalStore.compareAndSave(workflow)
                    .flatMap(saved -> saved
                        ? Mono.just(workflow)
                        : Mono.error(new ConcurrentDecisionException(workflow.getId())))))
            .retryWhen(Retry.max(MAX_UPDATE_ATTEMPTS - 1)
                .filter(ConcurrentDecisionException.class::isInstance)
                .onRetryExhaustedThrow((spec, signal) -> new ValidationException(
                    "Approval workflow was modified concurrently, try again")));
    }

    private Mono<Void> onWorkflowApproved(ApprovalWorkflow workflow, RequestUser approver) {
        Instant now = clock.instant();
        return scheduler.find(workflow.getScheduledRunId())
            .filter(run -> {
                if (isWithdrawn(run)) {
                    log.warn("Approval workflow {} approved, but scheduled run {} is {}; leaving it alone",
                        workflow.getId(), run.getId(), run.getState());
                    return false;
                }
                return true;
            })
            .map(run -> run.toBuilder()
                .approvedAt(now)
                .approvedBy(approver.getUsername())
                .state(ScheduleState.ELIGIBLE)
                .build())
            .flatMap(scheduler::save)
            .flatMap(run -> {
                log.info("Scheduled run {} of job {} approved by {}", run.getId(), run.getJobId(), approver.getUsername());
                eventPublisher.publish(EventTopics.APPROVAL_APPROVED,
                    decisionPayload(workflow, run, workflow.stage(lastStageId(workflow)).orElseThrow(), approver));
                if (run.getInterval() == ScheduleInterval.IMMEDIATE) {
                    return scheduler.fire(run, now).then();
                }
                return Mono.empty();
            });
    }

    private static boolean isWithdrawn(ScheduledRun run) {
        return run.getState() == ScheduleState.CANCELLED || run.getState() == ScheduleState.DENIED;
    }

    private static String lastStageId(ApprovalWorkflow workflow) {
        return workflow.getStages().stream()
            .max(Comparator.comparingInt(ApprovalStage::getWeight))
            .map(ApprovalStage::getId)
            .orElseThrow();
    }

    private static Map<String, Object> decisionPayload(ApprovalWorkflow workflow, ScheduledRun run,
                                                       ApprovalStage stage, RequestUser decidedBy) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("approval_workflow_id", workflow.getId());
        payload.put("approval_workflow", workflow.getDefinitionName());
        payload.put("scheduled_run_id", run.getId());
        payload.put("job_id", run.getJobId());
        payload.put("requested_by", workflow.getRequestedBy());
        payload.put("decided_by", decidedBy.getUsername());
        payload.put("stage", stage.getName());
        payload.put("state", workflow.getState().name());
        return payload;
    }

    private static ApprovalStageView view(ApprovalWorkflow workflow, ApprovalStage stage, String message) {
        return ApprovalStageView.builder()
            .stage(stage)
            .workflowId(workflow.getId())
            .workflowState(workflow.getState())
            .scheduledRunId(workflow.getScheduledRunId())
            .requestedBy(workflow.getRequestedBy())
            .message(message)
            .build();
    }

    static class ConcurrentDecisionException extends RuntimeException {
        ConcurrentDecisionException(String workflowId) {
            super("Approval workflow " + workflowId + " changed since it was read");
        }
    }
}
