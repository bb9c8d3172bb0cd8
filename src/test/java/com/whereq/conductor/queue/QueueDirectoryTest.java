package com.whereq.conductor.queue;

import com.whereq.conductor.dto.JobDefinitionUpdate;
import com.whereq.conductor.exception.NotFoundException;
import com.whereq.conductor.exception.ValidationException;
import com.whereq.conductor.model.BackendType;
import com.whereq.conductor.model.JobDefinition;
import com.whereq.conductor.model.JobQueue;
import com.whereq.conductor.model.JobQueueAssignment;
import com.whereq.conductor.support.ConductorHarness;
import com.whereq.conductor.support.ScriptedJob;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class QueueDirectoryTest {

    private ConductorHarness harness;
    private QueueDirectory directory;

    @BeforeEach
    void setUp() {
        harness = new ConductorHarness(List.of(ScriptedJob.backup()));
        directory = harness.queueDirectory;
    }

    @AfterEach
    void tearDown() {
        harness.close();
    }

    @Test
    void shouldCreateDefaultQueueOnBootstrap() {
        StepVerifier.create(directory.find("default"))
            .assertNext(queue -> assertThat(queue.getBackendType()).isEqualTo(BackendType.WORKER_POOL))
            .verifyComplete();
    }

    @Test
    void shouldRejectDuplicateQueue() {
        StepVerifier.create(directory.create(JobQueue.builder().name("default").backendType(BackendType.WORKER_POOL).build()))
            .expectError(ValidationException.class)
            .verify();
    }

    @Test
    void shouldRejectDuplicateAssignment() {
        JobQueueAssignment assignment = new JobQueueAssignment("BackupJob", ConductorHarness.POD_QUEUE);

        StepVerifier.create(directory.assign(assignment)).expectNext(assignment).verifyComplete();
        StepVerifier.create(directory.assign(assignment))
            .expectError(ValidationException.class)
            .verify();
    }

    @Test
    void shouldRejectAssignmentToUnknownQueue() {
        StepVerifier.create(directory.assign(new JobQueueAssignment("BackupJob", "nowhere")))
            .expectError(NotFoundException.class)
            .verify();
    }

    @Test
    void shouldResolveConfiguredDefaultWhenJobHasNoQueues() {
        JobDefinition definition = harness.registry.lookup("BackupJob").block();

        StepVerifier.create(directory.resolve(definition, null))
            .assertNext(queue -> assertThat(queue.getName()).isEqualTo("default"))
            .verifyComplete();
        StepVerifier.create(directory.resolve(definition, ConductorHarness.POD_QUEUE))
            .expectError(ValidationException.class)
            .verify();
    }

    @Test
    void shouldTreatDefaultQueueAsEligible() {
        JobDefinition definition = harness.update("BackupJob",
            JobDefinitionUpdate.builder().defaultQueue(ConductorHarness.POD_QUEUE).build());

        StepVerifier.create(directory.eligibleQueues(definition))
            .expectNext(List.of(ConductorHarness.POD_QUEUE))
            .verifyComplete();
        StepVerifier.create(directory.resolve(definition, null))
            .assertNext(queue -> assertThat(queue.getBackendType()).isEqualTo(BackendType.POD_PER_TASK))
            .verifyComplete();
    }

    @Test
    void shouldNotDeleteQueueUsedAsDefault() {
        harness.update("BackupJob", JobDefinitionUpdate.builder().defaultQueue(ConductorHarness.POD_QUEUE).build());

        StepVerifier.create(directory.delete(ConductorHarness.POD_QUEUE))
            .expectError(ValidationException.class)
            .verify();
        StepVerifier.create(directory.unassign(new JobQueueAssignment("BackupJob", ConductorHarness.POD_QUEUE)))
            .expectError(ValidationException.class)
            .verify();
    }
}
