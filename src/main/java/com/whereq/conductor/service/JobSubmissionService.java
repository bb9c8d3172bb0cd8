package com.whereq.conductor.service;

import com.whereq.conductor.approval.ApprovalGate;
import com.whereq.conductor.dispatch.Dispatcher;
import com.whereq.conductor.dto.RunJobRequest;
import com.whereq.conductor.dto.RunJobResponse;
import com.whereq.conductor.dto.ScheduleSpec;
import com.whereq.conductor.exception.PermissionDeniedException;
import com.whereq.conductor.exception.ValidationException;
import com.whereq.conductor.model.DispatchRequest;
import com.whereq.conductor.model.FileProxy;
import com.whereq.conductor.model.JobDefinition;
import com.whereq.conductor.model.RequestUser;
import com.whereq.conductor.model.ScheduleInterval;
import com.whereq.conductor.model.ScheduledRun;
import com.whereq.conductor.model.TypedArgs;
import com.whereq.conductor.queue.QueueDirectory;
import com.whereq.conductor.registry.JobRegistry;
import com.whereq.conductor.scheduler.JobScheduler;
import com.whereq.conductor.store.FileProxyStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Entry point of run requests: validates them once, then either dispatches right away or
 * records a ScheduledRun, gated by approval when the job asks for it
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobSubmissionService {

    public static final String FORM_QUEUE = "_queue";
    public static final String FORM_IGNORE_SINGLETON_LOCK = "_ignore_singleton_lock";
    public static final String FORM_SCHEDULE_NAME = "_schedule_name";
    public static final String FORM_SCHEDULE_INTERVAL = "_schedule_interval";
    public static final String FORM_SCHEDULE_START_TIME = "_schedule_start_time";
    public static final String FORM_SCHEDULE_CRONTAB = "_schedule_crontab";
    public static final String FORM_SCHEDULE_TIME_ZONE = "_schedule_time_zone";

    private final JobRegistry registry;
    private final QueueDirectory queueDirectory;
    private final Dispatcher dispatcher;
    private final JobScheduler scheduler;
    private final ApprovalGate approvalGate;
    private final FileProxyStore fileProxyStore;
    private final Clock clock;

    public Mono<RunJobResponse> run(String jobId, RunJobRequest request, RequestUser user) {
        return registry.lookupRunnable(jobId)
            .flatMap(definition -> {
                if (!user.canRun(jobId)) {
                    return Mono.error(new PermissionDeniedException(
                        "User '" + user.getUsername() + "' may not run job '" + jobId + "'"));
                }
                if (definition.isHasSensitiveVariables() && request.getSchedule() != null
                    && request.getSchedule().getInterval() != ScheduleInterval.IMMEDIATE) {
                    return Mono.error(new ValidationException(
                        "Job '" + jobId + "' has sensitive variables and can only be run immediately"));
                }
                return registry.validateInputs(jobId, request.getData())
                    .zipWith(queueDirectory.resolve(definition, request.getQueue()))
                    .flatMap(validated -> submit(definition, request, user, validated.getT1(), validated.getT2().getName()));
            });
    }

    private Mono<RunJobResponse> submit(JobDefinition definition, RunJobRequest request, RequestUser user,
                                        TypedArgs args, String queue) {
        Map<String, Object> values = new HashMap<>(args.asMap());
        if (request.getSchedule() == null && !definition.requiresApproval()) {
            return dispatcher.dispatchDetached(DispatchRequest.builder()
                    .jobId(definition.getId())
                    .queue(queue)
                    .args(values)
                    .user(user.getUsername())
                    .ignoreSingletonLock(request.isIgnoreSingletonLock())
                    .build())
                .map(RunJobResponse::dispatched);
        }

        ScheduleSpec spec = request.getSchedule() != null
            ? request.getSchedule()
            : ScheduleSpec.builder().interval(ScheduleInterval.IMMEDIATE).build();
        ScheduledRun run = scheduler.prepare(definition, spec, user.getUsername(), values, queue,
            request.isIgnoreSingletonLock());

        if (definition.requiresApproval()) {
            return approvalGate.submit(run, definition.getApprovalWorkflow())
                .map(RunJobResponse::scheduled);
        }
        if (run.getInterval() == ScheduleInterval.IMMEDIATE) {
            return dispatchImmediately(run);
        }
        log.info("Scheduled job {} as run {} ({})", definition.getId(), run.getId(), run.getInterval());
        return scheduler.save(run).map(RunJobResponse::scheduled);
    }

    /**
     * Dispatch an ungated IMMEDIATE run before storing it, so that a rejected dispatch reaches
     * the caller and leaves no run behind
     */
    private Mono<RunJobResponse> dispatchImmediately(ScheduledRun run) {
        Instant now = clock.instant();
        return dispatcher.dispatchDetached(JobScheduler.dispatchRequest(run))
            .flatMap(result -> scheduler.recordFiring(run, now)
                .map(saved -> {
                    log.info("Scheduled run {} of job {} dispatched as job result {}",
                        saved.getId(), saved.getJobId(), result.getId());
                    return RunJobResponse.fired(result, saved);
                }));
    }

    /**
     * Run from a multipart form. Uploaded files become FileProxies referenced by id; they are
     * deleted again when the request is rejected.
     *
     * @param form plain form fields, lists for repeated fields
     * @param uploads uploaded files keyed by variable name
     */
    public Mono<RunJobResponse> runMultipart(String jobId, Map<String, List<String>> form,
                                             Map<String, FileProxy> uploads, RequestUser user) {
        return Flux.fromIterable(uploads.entrySet())
            .concatMap(entry -> storeUpload(entry.getValue())
                .map(saved -> Map.entry(entry.getKey(), saved.getId())))
            .collectMap(Map.Entry::getKey, Map.Entry::getValue)
            .flatMap(fileIds -> {
                RunJobRequest request;
                try {
                    request = fromForm(form, fileIds);
                } catch (ValidationException e) {
                    return discardUploads(fileIds).then(Mono.error(e));
                }
                return run(jobId, request, user)
                    .onErrorResume(e -> discardUploads(fileIds).then(Mono.error(e)));
            });
    }

    private Mono<FileProxy> storeUpload(FileProxy upload) {
        FileProxy file = FileProxy.builder()
            .id(UUID.randomUUID().toString())
            .name(upload.getName())
            .contentType(upload.getContentType())
            .content(upload.getContent())
            .uploadedAt(clock.instant())
            .build();
        return fileProxyStore.save(file);
    }

    private Mono<Void> discardUploads(Map<String, String> fileIds) {
        return Flux.fromIterable(fileIds.values())
            .concatMap(fileProxyStore::delete)
            .then();
    }

    /**
     * Translate flattened form fields into a run request. Underscore-prefixed fields carry
     * queue and schedule options, everything else is job input.
     */
    public static RunJobRequest fromForm(Map<String, List<String>> form, Map<String, String> fileIds) {
        Map<String, Object> data = new HashMap<>();
        form.forEach((key, values) -> {
            if (key.startsWith("_") || values == null || values.isEmpty()) {
                return;
            }
            data.put(key, values.size() == 1 ? values.get(0) : List.copyOf(values));
        });
        data.putAll(fileIds);

        ScheduleSpec schedule = null;
        String interval = first(form, FORM_SCHEDULE_INTERVAL);
        if (interval != null && !interval.isBlank()) {
            ScheduleInterval parsed;
            try {
                String name = interval.trim().toUpperCase().replace('-', '_');
                parsed = ScheduleInterval.valueOf("CUSTOM_CRON".equals(name) ? "CUSTOM" : name);
            } catch (IllegalArgumentException e) {
                throw new ValidationException("Unknown schedule interval '" + interval + "'");
            }
            String startTime = first(form, FORM_SCHEDULE_START_TIME);
            schedule = ScheduleSpec.builder()
                .name(first(form, FORM_SCHEDULE_NAME))
                .interval(parsed)
                .startTime(parseInstant(startTime))
                .crontab(first(form, FORM_SCHEDULE_CRONTAB))
                .timeZone(first(form, FORM_SCHEDULE_TIME_ZONE))
                .build();
        }

        return RunJobRequest.builder()
            .queue(first(form, FORM_QUEUE))
            .data(data)
            .schedule(schedule)
            .ignoreSingletonLock(Boolean.parseBoolean(first(form, FORM_IGNORE_SINGLETON_LOCK)))
            .build();
    }

    private static String first(Map<String, List<String>> form, String key) {
        List<String> values = form.get(key);
        return values == null || values.isEmpty() ? null : values.get(0);
    }

    private static Instant parseInstant(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw new ValidationException("Invalid schedule start time '" + value + "', expected ISO-8601");
        }
    }
}
