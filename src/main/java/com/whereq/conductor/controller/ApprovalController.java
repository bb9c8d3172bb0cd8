package com.whereq.conductor.controller;

import com.whereq.conductor.approval.ApprovalGate;
import com.whereq.conductor.dto.ApprovalActionRequest;
import com.whereq.conductor.dto.ApprovalStageView;
import com.whereq.conductor.model.ApprovalWorkflowDefinition;
import com.whereq.conductor.model.RequestUser;
import com.whereq.conductor.security.RequestUserResolver;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Slf4j
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
@Tag(name = "Approvals", description = "Approval workflow definitions and stage decisions")
public class ApprovalController {

    private final ApprovalGate approvalGate;
    private final RequestUserResolver userResolver;

    @GetMapping("/approval-workflow-definitions")
    @Operation(summary = "List approval workflow definitions")
    public Flux<ApprovalWorkflowDefinition> listDefinitions() {
        return approvalGate.listDefinitions();
    }

    @GetMapping("/approval-workflow-definitions/{name}")
    @Operation(summary = "Get approval workflow definition")
    public Mono<ApprovalWorkflowDefinition> getDefinition(@PathVariable String name) {
        return approvalGate.findDefinition(name);
    }

    @PostMapping("/approval-workflow-definitions")
    @ResponseStatus(HttpStatus.CREATED)
    @Operation(summary = "Create approval workflow definition")
    public Mono<ApprovalWorkflowDefinition> createDefinition(@RequestBody ApprovalWorkflowDefinition definition,
                                                             @RequestHeader HttpHeaders headers) {
        userResolver.requireAdmin(headers);
        return approvalGate.createDefinition(definition);
    }

    @GetMapping("/approval-stages")
    @Operation(summary = "List approval stages",
        description = "pendingApprovals=true lists the stages awaiting the caller's decision")
    public Flux<ApprovalStageView> listStages(@RequestParam(required = false) Boolean pendingApprovals,
                                              @RequestHeader HttpHeaders headers) {
        return approvalGate.listStages(userResolver.resolve(headers), pendingApprovals);
    }

    @PostMapping("/approval-stages/{stageId}/approve")
    @Operation(summary = "Approve stage", description = "force=true confirms a FUTURE run whose start time has passed")
    public Mono<ApprovalStageView> approve(@PathVariable String stageId,
                                           @RequestBody(required = false) ApprovalActionRequest request,
                                           @RequestHeader HttpHeaders headers) {
        RequestUser user = userResolver.resolve(headers);
        ApprovalActionRequest action = request != null ? request : new ApprovalActionRequest();
        log.info("User {} approves stage {}", user.getUsername(), stageId);
        return approvalGate.approve(stageId, user, action.getComment(), action.isForce());
    }

    @PostMapping("/approval-stages/{stageId}/deny")
    @Operation(summary = "Deny stage")
    public Mono<ApprovalStageView> deny(@PathVariable String stageId,
                                        @RequestBody(required = false) ApprovalActionRequest request,
                                        @RequestHeader HttpHeaders headers) {
        RequestUser user = userResolver.resolve(headers);
        log.info("User {} denies stage {}", user.getUsername(), stageId);
        return approvalGate.deny(stageId, user, request != null ? request.getComment() : null);
    }

    @PostMapping("/approval-stages/{stageId}/comment")
    @Operation(summary = "Comment on stage")
    public Mono<ApprovalStageView> comment(@PathVariable String stageId,
                                           @RequestBody ApprovalActionRequest request,
                                           @RequestHeader HttpHeaders headers) {
        return approvalGate.comment(stageId, userResolver.resolve(headers), request.getComment());
    }
}
