package com.whereq.conductor.support;

import com.whereq.conductor.approval.ApprovalGate;
import com.whereq.conductor.config.ConductorProperties;
import com.whereq.conductor.dispatch.Dispatcher;
import com.whereq.conductor.dispatch.PodTaskBackend;
import com.whereq.conductor.dispatch.WorkerPoolBackend;
import com.whereq.conductor.dto.JobDefinitionUpdate;
import com.whereq.conductor.event.EventPublisher;
import com.whereq.conductor.executor.JobRunner;
import com.whereq.conductor.executor.ResultFinalizer;
import com.whereq.conductor.executor.TaskWorker;
import com.whereq.conductor.job.Job;
import com.whereq.conductor.model.BackendType;
import com.whereq.conductor.model.JobDefinition;
import com.whereq.conductor.model.JobQueue;
import com.whereq.conductor.queue.QueueDirectory;
import com.whereq.conductor.registry.JobRegistry;
import com.whereq.conductor.registry.VariableValidator;
import com.whereq.conductor.scheduler.JobScheduler;
import com.whereq.conductor.scheduler.SchedulerHeartbeat;
import com.whereq.conductor.service.JobSubmissionService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * The whole engine wired on in-memory stores, a fake compute orchestrator and a manual clock
 */
public class ConductorHarness implements AutoCloseable {

    public static final String POD_QUEUE = "kubernetes";
    public static final Duration TIMEOUT = Duration.ofSeconds(10);

    public final MutableClock clock = new MutableClock(Instant.parse("2024-03-01T00:00:00Z"));
    public final ConductorProperties properties = new ConductorProperties();
    public final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();

    public final InMemoryJobDefinitionStore definitionStore = new InMemoryJobDefinitionStore();
    public final InMemoryJobQueueStore queueStore = new InMemoryJobQueueStore();
    public final InMemoryJobResultStore resultStore = new InMemoryJobResultStore();
    public final InMemoryJobLogStore logStore = new InMemoryJobLogStore();
    public final InMemoryScheduledRunStore runStore = new InMemoryScheduledRunStore();
    public final InMemoryApprovalStore approvalStore = new InMemoryApprovalStore(runStore);
    public final InMemoryFileProxyStore fileProxyStore = new InMemoryFileProxyStore();
    public final InMemoryConcurrencyGuard concurrencyGuard = new InMemoryConcurrencyGuard();
    public final InMemoryTaskBroker broker = new InMemoryTaskBroker();
    public final FakeComputeOrchestrator orchestrator = new FakeComputeOrchestrator();
    public final FakeRecordStoreClient recordStore;
    public final RecordingEventSubscriber events = new RecordingEventSubscriber();

    public final EventPublisher eventPublisher;
    public final JobRegistry registry;
    public final QueueDirectory queueDirectory;
    public final ResultFinalizer finalizer;
    public final JobRunner jobRunner;
    public final TaskWorker worker;
    public final PodTaskBackend podBackend;
    public final Dispatcher dispatcher;
    public final SchedulerHeartbeat heartbeat;
    public final JobScheduler scheduler;
    public final ApprovalGate approvalGate;
    public final JobSubmissionService submissionService;

    public ConductorHarness(List<Job> jobs) {
        this(jobs, new FakeRecordStoreClient());
    }

    public ConductorHarness(List<Job> jobs, FakeRecordStoreClient recordStore) {
        this.recordStore = recordStore;
        properties.getEvents().setSubscribers(List.of(RecordingEventSubscriber.NAME));
        properties.getWorker().setConcurrency(2);
        properties.getWorker().setPrefetchMultiplier(2);
        properties.getWorker().setPollInterval(Duration.ofMillis(20));
        properties.getWorker().setName("test-worker");
        properties.getKubernetes().setPollInterval(Duration.ofMillis(10));
        properties.getKubernetes().setCleanupGrace(Duration.ofMillis(10));

        eventPublisher = new EventPublisher(List.of(events), properties);
        VariableValidator validator = new VariableValidator(recordStore, fileProxyStore);
        registry = new JobRegistry(jobs, definitionStore, queueStore, approvalStore, validator, properties, clock);
        queueDirectory = new QueueDirectory(queueStore, definitionStore, properties, clock);
        finalizer = new ResultFinalizer(resultStore, logStore, fileProxyStore, concurrencyGuard,
            eventPublisher, meterRegistry, clock);
        jobRunner = new JobRunner(registry, resultStore, logStore, fileProxyStore, finalizer,
            eventPublisher, meterRegistry, clock);
        worker = new TaskWorker(broker, jobRunner, resultStore, meterRegistry, properties);
        podBackend = new PodTaskBackend(orchestrator, resultStore, logStore, finalizer,
            Copies.MAPPER, properties, clock);
        dispatcher = new Dispatcher(registry, queueDirectory, concurrencyGuard, resultStore, logStore, finalizer,
            List.of(new WorkerPoolBackend(broker), podBackend), meterRegistry, clock);

        heartbeat = mock(SchedulerHeartbeat.class);
        when(heartbeat.beat(any())).thenReturn(Mono.empty());
        when(heartbeat.age(any())).thenReturn(Mono.empty());

        scheduler = new JobScheduler(runStore, dispatcher, heartbeat, properties, meterRegistry, clock);
        approvalGate = new ApprovalGate(approvalStore, scheduler, eventPublisher, meterRegistry, clock);
        submissionService = new JobSubmissionService(registry, queueDirectory, dispatcher, scheduler,
            approvalGate, fileProxyStore, clock);

        queueDirectory.bootstrap().block(TIMEOUT);
        queueDirectory.create(JobQueue.builder()
            .name(POD_QUEUE)
            .backendType(BackendType.POD_PER_TASK)
            .build()).block(TIMEOUT);
        registry.refresh().block(TIMEOUT);
    }

    public JobDefinition enable(String jobId) {
        return update(jobId, JobDefinitionUpdate.builder().enabled(true).build());
    }

    public JobDefinition update(String jobId, JobDefinitionUpdate update) {
        return registry.update(jobId, update).block(TIMEOUT);
    }

    @Override
    public void close() {
        worker.stop();
        jobRunner.shutdown();
    }
}
