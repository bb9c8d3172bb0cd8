package com.whereq.conductor.queue;

import com.whereq.conductor.config.ConductorProperties;
import com.whereq.conductor.exception.NotFoundException;
import com.whereq.conductor.exception.ValidationException;
import com.whereq.conductor.model.BackendType;
import com.whereq.conductor.model.JobDefinition;
import com.whereq.conductor.model.JobQueue;
import com.whereq.conductor.model.JobQueueAssignment;
import com.whereq.conductor.store.JobDefinitionStore;
import com.whereq.conductor.store.JobQueueStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Named queues, their backend types, and which jobs may use which queue
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class QueueDirectory {

    private final JobQueueStore queueStore;
    private final JobDefinitionStore definitionStore;
    private final ConductorProperties properties;
    private final Clock clock;

    @EventListener(ApplicationReadyEvent.class)
    public void bootstrapQueues() {
        bootstrap().block(Duration.ofSeconds(30));
    }

    /**
     * Create the default queue and the configured bootstrap queues when absent
     */
    public Mono<Void> bootstrap() {
        List<JobQueue> seeds = new ArrayList<>();
        seeds.add(JobQueue.builder()
            .name(properties.getQueues().getDefaultName())
            .backendType(BackendType.WORKER_POOL)
            .description("Default queue")
            .build());
        for (ConductorProperties.QueueSeed seed : properties.getQueues().getBootstrap()) {
            seeds.add(JobQueue.builder()
                .name(seed.getName())
                .backendType(BackendType.valueOf(seed.getBackendType()))
                .description(seed.getDescription())
                .build());
        }
        return Flux.fromIterable(seeds)
            .concatMap(queue -> {
                queue.setCreatedAt(clock.instant());
                return queueStore.create(queue);
            })
            .then();
    }

    public Mono<JobQueue> create(JobQueue queue) {
        queue.setCreatedAt(clock.instant());
        return queueStore.create(queue)
            .flatMap(created -> created
                ? Mono.just(queue)
                : Mono.error(new ValidationException("Queue '" + queue.getName() + "' already exists")));
    }

    public Mono<JobQueue> find(String name) {
        return queueStore.find(name)
            .switchIfEmpty(Mono.error(() -> new NotFoundException("Queue", name)));
    }

    public Flux<JobQueue> list() {
        return queueStore.findAll();
    }

    /**
     * Delete a queue that no job uses as its default queue
     */
    public Mono<Void> delete(String name) {
        return find(name)
            .thenMany(definitionStore.findAll())
            .filter(definition -> name.equals(definition.getDefaultQueue()))
            .map(JobDefinition::getId)
            .collectList()
            .flatMap(users -> {
                if (!users.isEmpty()) {
                    return Mono.error(new ValidationException(
                        "Queue '" + name + "' is the default queue of " + users + " and cannot be deleted"));
                }
                return queueStore.jobsForQueue(name)
                    .concatMap(jobId -> queueStore.unassign(new JobQueueAssignment(jobId, name)))
                    .then(queueStore.delete(name))
                    .doOnSuccess(v -> log.info("Deleted queue {}", name))
                    .then();
            });
    }

    public Mono<JobQueueAssignment> assign(JobQueueAssignment assignment) {
        return definitionStore.find(assignment.getJobId())
            .switchIfEmpty(Mono.error(() -> new NotFoundException("Job", assignment.getJobId())))
            .then(find(assignment.getQueueName()))
            .then(queueStore.assign(assignment))
            .flatMap(added -> added
                ? Mono.just(assignment)
                : Mono.error(new ValidationException("Job '" + assignment.getJobId()
                    + "' is already assigned to queue '" + assignment.getQueueName() + "'")));
    }

    public Mono<Void> unassign(JobQueueAssignment assignment) {
        return definitionStore.find(assignment.getJobId())
            .filter(definition -> assignment.getQueueName().equals(definition.getDefaultQueue()))
            .flatMap(definition -> Mono.<Boolean>error(new ValidationException(
                "Queue '" + assignment.getQueueName() + "' is the default queue of job '" + assignment.getJobId() + "'")))
            .then(queueStore.unassign(assignment))
            .flatMap(removed -> removed
                ? Mono.<Void>empty()
                : Mono.error(new NotFoundException("Assignment", assignment.getJobId() + "/" + assignment.getQueueName())));
    }

    /**
     * Queues a job may run on: its assignments plus its default queue, or the configured
     * default queue when it has neither
     */
    public Mono<List<String>> eligibleQueues(JobDefinition definition) {
        return queueStore.queuesForJob(definition.getId())
            .collectList()
            .map(assigned -> {
                Set<String> eligible = new LinkedHashSet<>();
                if (definition.getDefaultQueue() != null) {
                    eligible.add(definition.getDefaultQueue());
                }
                assigned.stream().sorted().forEach(eligible::add);
                if (eligible.isEmpty()) {
                    eligible.add(properties.getQueues().getDefaultName());
                }
                return new ArrayList<>(eligible);
            });
    }

    /**
     * Pick the queue for a run request.
     *
     * @param requested queue named by the caller, null for the default
     * @return the queue, or a ValidationException when it is not eligible for the job
     */
    public Mono<JobQueue> resolve(JobDefinition definition, String requested) {
        return eligibleQueues(definition).flatMap(eligible -> {
            String name = requested;
            if (name == null || name.isBlank()) {
                name = definition.getDefaultQueue() != null
                    ? definition.getDefaultQueue()
                    : properties.getQueues().getDefaultName();
                if (!eligible.contains(name)) {
                    name = eligible.get(0);
                }
            }
            if (!eligible.contains(name)) {
                return Mono.error(new ValidationException(
                    "Queue '" + name + "' is not eligible for job '" + definition.getId() + "', eligible: " + eligible));
            }
            String resolved = name;
            return queueStore.find(resolved)
                .switchIfEmpty(Mono.error(() -> new ValidationException("Queue '" + resolved + "' does not exist")));
        });
    }
}
