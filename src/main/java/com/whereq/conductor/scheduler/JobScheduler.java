package com.whereq.conductor.scheduler;

import com.whereq.conductor.config.ConductorProperties;
import com.whereq.conductor.dispatch.Dispatcher;
import com.whereq.conductor.dto.ScheduleSpec;
import com.whereq.conductor.exception.NotFoundException;
import com.whereq.conductor.exception.ValidationException;
import com.whereq.conductor.model.DispatchRequest;
import com.whereq.conductor.model.JobDefinition;
import com.whereq.conductor.model.ScheduleInterval;
import com.whereq.conductor.model.ScheduleState;
import com.whereq.conductor.model.ScheduledRun;
import com.whereq.conductor.store.ScheduledRunStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Periodic tick that fires due ScheduledRuns, plus schedule management
 */
@Slf4j
@Service
public class JobScheduler {

    private final ScheduledRunStore runStore;
    private final Dispatcher dispatcher;
    private final SchedulerHeartbeat heartbeat;
    private final ConductorProperties.SchedulerConfig config;
    private final Clock clock;
    private final Counter firedCounter;

    public JobScheduler(ScheduledRunStore runStore,
                        Dispatcher dispatcher,
                        SchedulerHeartbeat heartbeat,
                        ConductorProperties properties,
                        MeterRegistry meterRegistry,
                        Clock clock) {
        this.runStore = runStore;
        this.dispatcher = dispatcher;
        this.heartbeat = heartbeat;
        this.config = properties.getScheduler();
        this.clock = clock;
        this.firedCounter = Counter.builder("conductor.scheduler.fired")
            .description("Number of scheduled run occurrences fired")
            .register(meterRegistry);
    }

    /**
     * Build a validated run from a schedule request. The state depends on whether the job is gated.
     */
    public ScheduledRun prepare(JobDefinition definition, ScheduleSpec spec, String user,
                                Map<String, Object> args, String queue, boolean ignoreSingletonLock) {
        Instant now = clock.instant();
        ScheduleInterval interval = spec.getInterval();
        if (interval == null) {
            throw new ValidationException("A schedule interval is required");
        }
        if (definition.isHasSensitiveVariables() && interval != ScheduleInterval.IMMEDIATE) {
            throw new ValidationException("Job '" + definition.getId() + "' has sensitive variables and can only be run immediately");
        }
        ZoneId zone = ScheduleCalculator.zone(spec.getTimeZone(), config.getDefaultTimeZone());
        ScheduleCalculator.validateStartTime(interval, spec.getStartTime(), now);

        Instant startTime = interval == ScheduleInterval.IMMEDIATE ? now : spec.getStartTime();
        String crontab;
        if (interval == ScheduleInterval.CUSTOM) {
            ScheduleCalculator.validateCrontab(spec.getCrontab());
            crontab = spec.getCrontab().trim();
        } else {
            if (spec.getCrontab() != null && !spec.getCrontab().isBlank()) {
                throw new ValidationException("A crontab can only be given for CUSTOM schedules");
            }
            crontab = ScheduleCalculator.crontabFor(interval, startTime, zone);
        }

        String name = spec.getName() != null && !spec.getName().isBlank()
            ? spec.getName()
            : definition.getName() + " - " + interval.name().toLowerCase() + " - " + now;

        return ScheduledRun.builder()
            .id(UUID.randomUUID().toString())
            .name(name)
            .description(spec.getDescription())
            .jobId(definition.getId())
            .user(user)
            .args(definition.isHasSensitiveVariables() ? null : args)
            .queue(queue)
            .interval(interval)
            .startTime(startTime)
            .crontab(crontab)
            .timeZone(zone.getId())
            .enabled(true)
            .ignoreSingletonLock(ignoreSingletonLock)
            .approvalRequired(definition.requiresApproval())
            .state(definition.requiresApproval() ? ScheduleState.PENDING_APPROVAL : ScheduleState.ELIGIBLE)
            .createdAt(now)
            .build();
    }

    @Scheduled(fixedDelayString = "${conductor.scheduler.tick-interval:PT5S}")
    public void scheduledTick() {
        if (!config.isEnabled()) {
            return;
        }
        try {
            Long fired = tick(clock.instant()).block(Duration.ofMinutes(1));
            if (fired != null && fired > 0) {
                log.info("Scheduler tick fired {} run(s)", fired);
            }
        } catch (RuntimeException e) {
            log.error("Scheduler tick failed", e);
        }
    }

    /**
     * One pass over the schedules: record the heartbeat, then fire every eligible run that is due.
     *
     * @return number of runs fired
     */
    public Mono<Long> tick(Instant now) {
        return heartbeat.beat(now)
            .thenMany(runStore.findAll())
            .filter(run -> run.isEnabled() && run.getState() == ScheduleState.ELIGIBLE)
            .sort(Comparator.comparing(ScheduledRun::getCreatedAt))
            .concatMap(run -> {
                Instant occurrence = ScheduleCalculator.nextOccurrence(run, config.getDefaultTimeZone());
                if (occurrence == null || occurrence.isAfter(now)) {
                    return Mono.empty();
                }
                return fire(run, occurrence)
                    .onErrorResume(e -> {
                        log.error("Failed to fire scheduled run {}: {}", run.getId(), e.getMessage());
                        return Mono.empty();
                    });
            })
            .count();
    }

    /**
     * Persist the firing of an occurrence, then dispatch without waiting for the outcome.
     * Runs that are disabled or not ELIGIBLE are left alone.
     */
    public Mono<ScheduledRun> fire(ScheduledRun run, Instant occurrence) {
        if (!run.isEnabled() || run.getState() != ScheduleState.ELIGIBLE) {
            log.info("Not firing scheduled run {}, it is {}{}",
                run.getId(), run.getState(), run.isEnabled() ? "" : " and disabled");
            return Mono.empty();
        }
        return recordFiring(run, occurrence)
            .doOnNext(saved -> dispatcher.dispatchDetached(dispatchRequest(saved))
                .subscribe(
                    result -> log.info("Scheduled run {} dispatched as job result {}", saved.getId(), result.getId()),
                    e -> log.warn("Dispatch of scheduled run {} failed: {}", saved.getId(), e.getMessage())));
    }

    /**
     * Store that {@code occurrence} of the run fired. One-off runs become FIRED.
     */
    public Mono<ScheduledRun> recordFiring(ScheduledRun run, Instant occurrence) {
        ScheduledRun fired = run.toBuilder()
            .lastRunAt(occurrence)
            .totalRunCount(run.getTotalRunCount() + 1)
            .state(run.getInterval().isOneOff() ? ScheduleState.FIRED : ScheduleState.ELIGIBLE)
            .build();

        return runStore.save(fired)
            .doOnNext(saved -> {
                firedCounter.increment();
                log.info("Firing scheduled run {} ({}) of job {} for {}",
                    saved.getId(), saved.getInterval(), saved.getJobId(), occurrence);
            });
    }

    public static DispatchRequest dispatchRequest(ScheduledRun run) {
        return DispatchRequest.builder()
            .jobId(run.getJobId())
            .queue(run.getQueue())
            .args(run.getArgs() == null ? new HashMap<>() : new HashMap<>(run.getArgs()))
            .user(run.getUser())
            .scheduledRunId(run.getId())
            .ignoreSingletonLock(run.isIgnoreSingletonLock())
            .build();
    }

    public Mono<ScheduledRun> save(ScheduledRun run) {
        return runStore.save(run);
    }

    public Mono<ScheduledRun> find(String id) {
        return runStore.find(id)
            .switchIfEmpty(Mono.error(() -> new NotFoundException("ScheduledRun", id)));
    }

    public Flux<ScheduledRun> list() {
        return runStore.findAll()
            .sort(Comparator.comparing(ScheduledRun::getCreatedAt).reversed());
    }

    public Mono<ScheduledRun> setEnabled(String id, boolean enabled) {
        return find(id)
            .map(run -> run.toBuilder().enabled(enabled).build())
            .flatMap(runStore::save)
            .doOnNext(run -> log.info("Scheduled run {} {}", id, enabled ? "enabled" : "disabled"));
    }

    /**
     * Stop all future firings. The record is kept for history.
     */
    public Mono<ScheduledRun> cancel(String id) {
        return find(id)
            .map(run -> run.toBuilder().enabled(false).state(ScheduleState.CANCELLED).build())
            .flatMap(runStore::save)
            .doOnNext(run -> log.info("Scheduled run {} cancelled", id));
    }

    public Mono<Duration> heartbeatAge() {
        return heartbeat.age(clock.instant());
    }
}
