package com.whereq.conductor.controller;

import com.whereq.conductor.exception.PermissionDeniedException;
import com.whereq.conductor.model.RequestUser;
import com.whereq.conductor.model.ScheduledRun;
import com.whereq.conductor.scheduler.JobScheduler;
import com.whereq.conductor.security.RequestUserResolver;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1/scheduled-runs")
@RequiredArgsConstructor
@Tag(name = "Scheduled Runs", description = "One-off and recurring job schedules")
public class ScheduledRunController {

    private final JobScheduler scheduler;
    private final RequestUserResolver userResolver;

    @GetMapping
    @Operation(summary = "List scheduled runs")
    public Flux<ScheduledRun> listRuns() {
        return scheduler.list();
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get scheduled run")
    public Mono<ScheduledRun> getRun(@PathVariable String id) {
        return scheduler.find(id);
    }

    @PostMapping("/{id}/enable")
    @Operation(summary = "Enable scheduled run")
    public Mono<ScheduledRun> enable(@PathVariable String id, @RequestHeader HttpHeaders headers) {
        return checkOwner(id, headers).then(scheduler.setEnabled(id, true));
    }

    @PostMapping("/{id}/disable")
    @Operation(summary = "Disable scheduled run")
    public Mono<ScheduledRun> disable(@PathVariable String id, @RequestHeader HttpHeaders headers) {
        return checkOwner(id, headers).then(scheduler.setEnabled(id, false));
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Delete scheduled run", description = "Cancels all future firings; the record is kept")
    public Mono<ScheduledRun> deleteRun(@PathVariable String id, @RequestHeader HttpHeaders headers) {
        return checkOwner(id, headers).then(scheduler.cancel(id));
    }

    private Mono<Void> checkOwner(String id, HttpHeaders headers) {
        RequestUser user = userResolver.resolve(headers);
        return scheduler.find(id)
            .flatMap(run -> user.isAdmin() || user.getUsername().equals(run.getUser())
                ? Mono.<Void>empty()
                : Mono.error(new PermissionDeniedException(
                    "User '" + user.getUsername() + "' may not change scheduled run " + id)));
    }
}
