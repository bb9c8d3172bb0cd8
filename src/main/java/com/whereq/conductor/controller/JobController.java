package com.whereq.conductor.controller;

import com.whereq.conductor.dto.JobDefinitionUpdate;
import com.whereq.conductor.dto.RunJobRequest;
import com.whereq.conductor.dto.RunJobResponse;
import com.whereq.conductor.model.FileProxy;
import com.whereq.conductor.model.JobDefinition;
import com.whereq.conductor.model.RequestUser;
import com.whereq.conductor.registry.JobRegistry;
import com.whereq.conductor.security.RequestUserResolver;
import com.whereq.conductor.service.JobSubmissionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.multipart.FilePart;
import org.springframework.http.codec.multipart.FormFieldPart;
import org.springframework.http.codec.multipart.Part;
import org.springframework.util.MultiValueMap;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/v1/jobs")
@RequiredArgsConstructor
@Tag(name = "Jobs", description = "Browse, configure and run jobs")
public class JobController {

    private final JobRegistry registry;
    private final JobSubmissionService submissionService;
    private final RequestUserResolver userResolver;

    @GetMapping
    @Operation(summary = "List jobs", description = "All known job definitions, installed or not")
    public Flux<JobDefinition> listJobs() {
        return registry.list();
    }

    @GetMapping("/{jobId}")
    @Operation(summary = "Get job")
    public Mono<JobDefinition> getJob(@PathVariable String jobId) {
        return registry.lookup(jobId);
    }

    @PatchMapping("/{jobId}")
    @Operation(summary = "Update job", description = "Enable a job or override its metadata")
    public Mono<JobDefinition> updateJob(@PathVariable String jobId,
                                         @RequestBody JobDefinitionUpdate update,
                                         @RequestHeader HttpHeaders headers) {
        RequestUser user = userResolver.requireAdmin(headers);
        log.info("User {} updates job {}", user.getUsername(), jobId);
        return registry.update(jobId, update);
    }

    @PostMapping("/refresh")
    @Operation(summary = "Refresh registry", description = "Reconcile stored definitions with the installed job bodies")
    public Mono<List<JobDefinition>> refresh(@RequestHeader HttpHeaders headers) {
        userResolver.requireAdmin(headers);
        return registry.refresh();
    }

    @PostMapping(value = "/{jobId}/run", consumes = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Run job", description = "Dispatch now, or create a scheduled run when a schedule is given or approval is required")
    public Mono<ResponseEntity<RunJobResponse>> runJob(@PathVariable String jobId,
                                                       @Valid @RequestBody RunJobRequest request,
                                                       @RequestHeader HttpHeaders headers) {
        RequestUser user = userResolver.resolve(headers);
        log.info("User {} requests run of job {}", user.getUsername(), jobId);
        return submissionService.run(jobId, request, user).map(JobController::accepted);
    }

    @PostMapping(value = "/{jobId}/run", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @Operation(summary = "Run job with file uploads",
        description = "Form variant; schedule options go in _schedule_* fields, the queue in _queue")
    public Mono<ResponseEntity<RunJobResponse>> runJobMultipart(@PathVariable String jobId,
                                                                ServerWebExchange exchange) {
        RequestUser user = userResolver.resolve(exchange.getRequest().getHeaders());
        return exchange.getMultipartData()
            .flatMap(parts -> readForm(parts)
                .flatMap(uploads -> submissionService.runMultipart(jobId, formFields(parts), uploads, user)))
            .map(JobController::accepted);
    }

    private static Map<String, List<String>> formFields(MultiValueMap<String, Part> parts) {
        Map<String, List<String>> form = new HashMap<>();
        parts.forEach((name, values) -> values.stream()
            .filter(FormFieldPart.class::isInstance)
            .map(part -> ((FormFieldPart) part).value())
            .forEach(value -> form.computeIfAbsent(name, key -> new ArrayList<>()).add(value)));
        return form;
    }

    private static Mono<Map<String, FileProxy>> readForm(MultiValueMap<String, Part> parts) {
        return Flux.fromIterable(parts.entrySet())
            .flatMap(entry -> Flux.fromIterable(entry.getValue())
                .filter(FilePart.class::isInstance)
                .cast(FilePart.class)
                .take(1)
                .flatMap(file -> DataBufferUtils.join(file.content())
                    .map(buffer -> {
                        byte[] bytes = new byte[buffer.readableByteCount()];
                        buffer.read(bytes);
                        DataBufferUtils.release(buffer);
                        MediaType type = file.headers().getContentType();
                        return Map.entry(entry.getKey(), FileProxy.builder()
                            .name(file.filename())
                            .contentType(type != null ? type.toString() : MediaType.APPLICATION_OCTET_STREAM_VALUE)
                            .content(bytes)
                            .build());
                    })))
            .collectMap(Map.Entry::getKey, Map.Entry::getValue);
    }

    private static ResponseEntity<RunJobResponse> accepted(RunJobResponse response) {
        URI location = response.getJobResultId() != null
            ? URI.create("/api/v1/job-results/" + response.getJobResultId())
            : URI.create("/api/v1/scheduled-runs/" + response.getScheduledRunId());
        return ResponseEntity.status(HttpStatus.ACCEPTED).location(location).body(response);
    }
}
