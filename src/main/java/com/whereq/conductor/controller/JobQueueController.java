package com.whereq.conductor.controller;

import com.whereq.conductor.dto.CreateQueueRequest;
import com.whereq.conductor.dto.QueueAssignmentRequest;
import com.whereq.conductor.model.JobQueue;
import com.whereq.conductor.model.JobQueueAssignment;
import com.whereq.conductor.queue.QueueDirectory;
import com.whereq.conductor.security.RequestUserResolver;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
@Tag(name = "Job Queues", description = "Queues and the jobs allowed on them")
public class JobQueueController {

    private final QueueDirectory queueDirectory;
    private final RequestUserResolver userResolver;

    @GetMapping("/job-queues")
    @Operation(summary = "List queues")
    public Flux<JobQueue> listQueues() {
        return queueDirectory.list();
    }

    @GetMapping("/job-queues/{name}")
    @Operation(summary = "Get queue")
    public Mono<JobQueue> getQueue(@PathVariable String name) {
        return queueDirectory.find(name);
    }

    @PostMapping("/job-queues")
    @ResponseStatus(HttpStatus.CREATED)
    @Operation(summary = "Create queue")
    public Mono<JobQueue> createQueue(@Valid @RequestBody CreateQueueRequest request,
                                      @RequestHeader HttpHeaders headers) {
        userResolver.requireAdmin(headers);
        return queueDirectory.create(JobQueue.builder()
            .name(request.getName())
            .backendType(request.getBackendType())
            .description(request.getDescription())
            .tenant(request.getTenant())
            .build());
    }

    @DeleteMapping("/job-queues/{name}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    @Operation(summary = "Delete queue", description = "Refused while the queue is the default queue of a job")
    public Mono<Void> deleteQueue(@PathVariable String name, @RequestHeader HttpHeaders headers) {
        userResolver.requireAdmin(headers);
        return queueDirectory.delete(name);
    }

    @PostMapping("/job-queue-assignments")
    @ResponseStatus(HttpStatus.CREATED)
    @Operation(summary = "Assign a job to a queue")
    public Mono<JobQueueAssignment> assign(@Valid @RequestBody QueueAssignmentRequest request,
                                           @RequestHeader HttpHeaders headers) {
        userResolver.requireAdmin(headers);
        return queueDirectory.assign(new JobQueueAssignment(request.getJobId(), request.getQueueName()));
    }

    @DeleteMapping("/job-queue-assignments")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    @Operation(summary = "Remove a job from a queue")
    public Mono<Void> unassign(@Valid @RequestBody QueueAssignmentRequest request,
                               @RequestHeader HttpHeaders headers) {
        userResolver.requireAdmin(headers);
        return queueDirectory.unassign(new JobQueueAssignment(request.getJobId(), request.getQueueName()));
    }
}
