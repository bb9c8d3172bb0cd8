package com.whereq.conductor.registry;

import com.whereq.conductor.config.ConductorProperties;
import com.whereq.conductor.dto.JobDefinitionUpdate;
import com.whereq.conductor.exception.NotFoundException;
import com.whereq.conductor.exception.ValidationException;
import com.whereq.conductor.job.Job;
import com.whereq.conductor.job.JobMeta;
import com.whereq.conductor.model.JobDefinition;
import com.whereq.conductor.model.JobQueueAssignment;
import com.whereq.conductor.model.TypedArgs;
import com.whereq.conductor.store.ApprovalStore;
import com.whereq.conductor.store.JobDefinitionStore;
import com.whereq.conductor.store.JobQueueStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The only table from job id to definition and body. Bodies are the {@link Job} beans of the
 * application context; definitions are persisted so administrator settings survive restarts.
 */
@Slf4j
@Service
public class JobRegistry {

    private final Map<String, Job> bodies = new LinkedHashMap<>();
    private final JobDefinitionStore definitionStore;
    private final JobQueueStore queueStore;
    private final ApprovalStore approvalStore;
    private final VariableValidator variableValidator;
    private final ConductorProperties properties;
    private final Clock clock;

    public JobRegistry(List<Job> jobs,
                       JobDefinitionStore definitionStore,
                       JobQueueStore queueStore,
                       ApprovalStore approvalStore,
                       VariableValidator variableValidator,
                       ConductorProperties properties,
                       Clock clock) {
        for (Job job : jobs) {
            Job previous = bodies.put(job.meta().getId(), job);
            if (previous != null) {
                throw new IllegalStateException("Duplicate job id " + job.meta().getId() + ": "
                    + previous.getClass().getName() + " and " + job.getClass().getName());
            }
        }
        this.definitionStore = definitionStore;
        this.queueStore = queueStore;
        this.approvalStore = approvalStore;
        this.variableValidator = variableValidator;
        this.properties = properties;
        this.clock = clock;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void refreshOnStartup() {
        List<JobDefinition> definitions = refresh().block(Duration.ofSeconds(30));
        log.info("Job registry loaded with {} definition(s), {} installed",
            definitions == null ? 0 : definitions.size(), bodies.size());
    }

    /**
     * Sync persisted definitions with the job bodies present in code. New jobs are stored
     * disabled; jobs whose body disappeared are marked not installed.
     */
    public Mono<List<JobDefinition>> refresh() {
        Instant now = clock.instant();

        Flux<JobDefinition> discovered = Flux.fromIterable(bodies.values())
            .concatMap(job -> definitionStore.find(job.meta().getId())
                .map(existing -> applyMeta(existing, job.meta(), now))
                .switchIfEmpty(Mono.fromSupplier(() -> newDefinition(job.meta(), now)))
                .flatMap(definitionStore::save));

        Flux<JobDefinition> removed = definitionStore.findAll()
            .filter(definition -> !bodies.containsKey(definition.getId()) && definition.isInstalled())
            .concatMap(definition -> {
                log.warn("Job {} is no longer present in code, marking it not installed", definition.getId());
                definition.setInstalled(false);
                definition.setLastUpdated(now);
                return definitionStore.save(definition);
            });

        return discovered.concatWith(removed)
            .thenMany(definitionStore.findAll())
            .collectList();
    }

    public Mono<JobDefinition> lookup(String jobId) {
        return definitionStore.find(jobId)
            .switchIfEmpty(Mono.error(() -> new NotFoundException("Job", jobId)));
    }

    /**
     * Lookup that fails with a ValidationException when the job is disabled or not installed
     */
    public Mono<JobDefinition> lookupRunnable(String jobId) {
        return lookup(jobId).flatMap(definition -> {
            if (!definition.isInstalled()) {
                return Mono.error(new ValidationException("Job '" + jobId + "' is not installed"));
            }
            if (!definition.isEnabled()) {
                return Mono.error(new ValidationException("Job '" + jobId + "' is not enabled to be run"));
            }
            return Mono.just(definition);
        });
    }

    public Flux<JobDefinition> list() {
        return definitionStore.findAll();
    }

    public Optional<Job> body(String jobId) {
        return Optional.ofNullable(bodies.get(jobId));
    }

    public Mono<TypedArgs> validateInputs(String jobId, Map<String, Object> rawArgs) {
        return lookup(jobId).flatMap(definition -> variableValidator.validate(definition, rawArgs));
    }

    public Duration effectiveSoftTimeLimit(JobDefinition definition) {
        return definition.getSoftTimeLimit() != null
            ? definition.getSoftTimeLimit()
            : properties.getLimits().getDefaultSoftTimeLimit();
    }

    public Duration effectiveTimeLimit(JobDefinition definition) {
        return definition.getTimeLimit() != null
            ? definition.getTimeLimit()
            : properties.getLimits().getDefaultTimeLimit();
    }

    public Mono<JobDefinition> update(String jobId, JobDefinitionUpdate update) {
        return lookup(jobId)
            .map(definition -> applyUpdate(definition, update))
            .flatMap(this::checkReferences)
            .flatMap(definition -> {
                if (definition.isHasSensitiveVariables() && definition.requiresApproval()) {
                    return Mono.error(new ValidationException("Job '" + jobId
                        + "' has sensitive variables and cannot require approval"));
                }
                definition.setLastUpdated(clock.instant());
                return definitionStore.save(definition);
            })
            .doOnSuccess(definition -> log.info("Updated job definition {} (enabled={})",
                definition.getId(), definition.isEnabled()));
    }

    private Mono<JobDefinition> checkReferences(JobDefinition definition) {
        Mono<Boolean> workflowCheck = definition.requiresApproval()
            ? approvalStore.findDefinition(definition.getApprovalWorkflow()).hasElement()
            : Mono.just(true);
        Mono<Boolean> queueCheck = definition.getDefaultQueue() != null
            ? queueStore.find(definition.getDefaultQueue()).hasElement()
            : Mono.just(true);

        return workflowCheck.zipWith(queueCheck).flatMap(checks -> {
            if (!checks.getT1()) {
                return Mono.error(new ValidationException(
                    "Unknown approval workflow '" + definition.getApprovalWorkflow() + "'"));
            }
            if (!checks.getT2()) {
                return Mono.error(new ValidationException("Unknown queue '" + definition.getDefaultQueue() + "'"));
            }
            if (definition.getDefaultQueue() == null) {
                return Mono.just(definition);
            }
            // The default queue is always eligible
            return queueStore.assign(new JobQueueAssignment(definition.getId(), definition.getDefaultQueue()))
                .thenReturn(definition);
        });
    }

    private JobDefinition applyUpdate(JobDefinition definition, JobDefinitionUpdate update) {
        if (Boolean.TRUE.equals(update.getResetOverrides())) {
            definition.setNameOverride(false);
            definition.setGroupingOverride(false);
            definition.setDescriptionOverride(false);
            definition.setSoftTimeLimitOverride(false);
            definition.setTimeLimitOverride(false);
            definition.setHasSensitiveVariablesOverride(false);
            definition.setDryrunDefaultOverride(false);
            Job body = bodies.get(definition.getId());
            if (body != null) {
                applyMeta(definition, body.meta(), clock.instant());
            }
        }
        if (update.getEnabled() != null) {
            definition.setEnabled(update.getEnabled());
        }
        if (update.getName() != null) {
            definition.setName(update.getName());
            definition.setNameOverride(true);
        }
        if (update.getGrouping() != null) {
            definition.setGrouping(update.getGrouping());
            definition.setGroupingOverride(true);
        }
        if (update.getDescription() != null) {
            definition.setDescription(update.getDescription());
            definition.setDescriptionOverride(true);
        }
        if (update.getSoftTimeLimit() != null) {
            definition.setSoftTimeLimit(update.getSoftTimeLimit());
            definition.setSoftTimeLimitOverride(true);
        }
        if (update.getTimeLimit() != null) {
            definition.setTimeLimit(update.getTimeLimit());
            definition.setTimeLimitOverride(true);
        }
        if (update.getHasSensitiveVariables() != null) {
            definition.setHasSensitiveVariables(update.getHasSensitiveVariables());
            definition.setHasSensitiveVariablesOverride(true);
        }
        if (update.getDryrunDefault() != null) {
            definition.setDryrunDefault(update.getDryrunDefault());
            definition.setDryrunDefaultOverride(true);
        }
        if (update.getApprovalWorkflow() != null) {
            definition.setApprovalWorkflow(update.getApprovalWorkflow().isBlank() ? null : update.getApprovalWorkflow());
        }
        if (update.getDefaultQueue() != null) {
            definition.setDefaultQueue(update.getDefaultQueue().isBlank() ? null : update.getDefaultQueue());
        }
        return definition;
    }

    private JobDefinition newDefinition(JobMeta meta, Instant now) {
        log.info("Discovered new job {}, stored disabled", meta.getId());
        JobDefinition definition = JobDefinition.builder()
            .id(meta.getId())
            .enabled(false)
            .createdAt(now)
            .build();
        return applyMeta(definition, meta, now);
    }

    private JobDefinition applyMeta(JobDefinition definition, JobMeta meta, Instant now) {
        definition.setInstalled(true);
        definition.setVariables(new ArrayList<>(meta.getVariables()));
        definition.setSingleton(meta.isSingleton());
        definition.setHidden(meta.isHidden());
        definition.setReadOnly(meta.isReadOnly());
        if (!definition.isNameOverride()) {
            definition.setName(meta.getName() != null ? meta.getName() : meta.getId());
        }
        if (!definition.isGroupingOverride()) {
            definition.setGrouping(meta.getGrouping());
        }
        if (!definition.isDescriptionOverride()) {
            definition.setDescription(meta.getDescription());
        }
        if (!definition.isSoftTimeLimitOverride()) {
            definition.setSoftTimeLimit(meta.getSoftTimeLimit());
        }
        if (!definition.isTimeLimitOverride()) {
            definition.setTimeLimit(meta.getTimeLimit());
        }
        if (!definition.isHasSensitiveVariablesOverride()) {
            definition.setHasSensitiveVariables(meta.isHasSensitiveVariables());
        }
        if (!definition.isDryrunDefaultOverride()) {
            definition.setDryrunDefault(meta.isDryrunDefault());
        }
        definition.setLastUpdated(now);
        return definition;
    }
}
