package com.whereq.conductor.controller;

import com.whereq.conductor.dispatch.Dispatcher;
import com.whereq.conductor.exception.NotFoundException;
import com.whereq.conductor.exception.PermissionDeniedException;
import com.whereq.conductor.model.JobLogEntry;
import com.whereq.conductor.model.JobResult;
import com.whereq.conductor.model.JobResultStatus;
import com.whereq.conductor.model.LogLevel;
import com.whereq.conductor.model.RequestUser;
import com.whereq.conductor.security.RequestUserResolver;
import com.whereq.conductor.store.JobLogStore;
import com.whereq.conductor.store.JobResultStore;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Slf4j
@RestController
@RequestMapping("/api/v1/job-results")
@RequiredArgsConstructor
@Tag(name = "Job Results", description = "Execution records and their logs")
public class JobResultController {

    private static final int MAX_LIMIT = 1000;

    private final JobResultStore resultStore;
    private final JobLogStore logStore;
    private final Dispatcher dispatcher;
    private final RequestUserResolver userResolver;

    @GetMapping
    @Operation(summary = "List job results", description = "Newest first, optionally filtered by job and status")
    public Flux<JobResult> listResults(@RequestParam(required = false) String jobId,
                                       @RequestParam(required = false) JobResultStatus status,
                                       @RequestParam(defaultValue = "50") int limit) {
        return resultStore.list(jobId, status, Math.max(1, Math.min(limit, MAX_LIMIT)));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get job result")
    public Mono<JobResult> getResult(@PathVariable String id) {
        return find(id);
    }

    @GetMapping("/{id}/logs")
    @Operation(summary = "Get job result logs", description = "Readable while the job is still running")
    public Flux<JobLogEntry> getLogs(@PathVariable String id,
                                     @RequestParam(required = false) LogLevel minLevel) {
        return find(id).thenMany(logStore.list(id, minLevel));
    }

    @PostMapping("/{id}/cancel")
    @ResponseStatus(HttpStatus.ACCEPTED)
    @Operation(summary = "Cancel job result", description = "Only pod-per-task executions can be cancelled")
    public Mono<JobResult> cancel(@PathVariable String id, @RequestHeader HttpHeaders headers) {
        RequestUser user = userResolver.resolve(headers);
        return find(id)
            .flatMap(result -> {
                if (!user.isAdmin() && !user.getUsername().equals(result.getUser())) {
                    return Mono.error(new PermissionDeniedException(
                        "User '" + user.getUsername() + "' may not cancel job result " + id));
                }
                log.info("User {} cancels job result {}", user.getUsername(), id);
                return dispatcher.cancel(id);
            })
            .then(find(id));
    }

    private Mono<JobResult> find(String id) {
        return resultStore.find(id)
            .switchIfEmpty(Mono.error(() -> new NotFoundException("JobResult", id)));
    }
}
