package com.whereq.conductor.executor;

import com.whereq.conductor.config.ConductorProperties;
import com.whereq.conductor.model.JobResult;
import com.whereq.conductor.model.TaskMessage;
import com.whereq.conductor.queue.TaskBroker;
import com.whereq.conductor.queue.TaskDelivery;
import com.whereq.conductor.store.JobResultStore;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Worker-pool consumer. Reserves up to {@code concurrency * prefetchMultiplier} messages from its
 * queues and runs up to {@code concurrency} of them at once.
 */
@Slf4j
@Service
@ConditionalOnProperty(prefix = "conductor.worker", name = "enabled", havingValue = "true")
public class TaskWorker {

    private static final Duration BROKER_TIMEOUT = Duration.ofSeconds(10);

    private final TaskBroker broker;
    private final JobRunner jobRunner;
    private final JobResultStore resultStore;
    private final MeterRegistry meterRegistry;
    private final ConductorProperties.WorkerConfig config;
    private final String workerName;
    private final List<String> queues;
    private final Semaphore reservations;
    private final AtomicInteger running = new AtomicInteger();
    private final ExecutorService executor;

    private final Map<String, AtomicLong> queueDepths = new ConcurrentHashMap<>();
    private final List<Disposable> loops = new ArrayList<>();

    public TaskWorker(TaskBroker broker,
                      JobRunner jobRunner,
                      JobResultStore resultStore,
                      MeterRegistry meterRegistry,
                      ConductorProperties properties) {
        this.broker = broker;
        this.jobRunner = jobRunner;
        this.resultStore = resultStore;
        this.meterRegistry = meterRegistry;
        this.config = properties.getWorker();
        this.workerName = config.getName() != null && !config.getName().isBlank()
            ? config.getName()
            : defaultWorkerName();
        this.queues = config.getQueues().isEmpty()
            ? List.of(properties.getQueues().getDefaultName())
            : List.copyOf(config.getQueues());
        this.reservations = new Semaphore(config.getConcurrency() * Math.max(1, config.getPrefetchMultiplier()));

        AtomicInteger threadCount = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(config.getConcurrency(), runnable -> {
            Thread thread = new Thread(runnable, "worker-" + threadCount.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @PostConstruct
    public void start() {
        Gauge.builder("conductor.worker.tasks.running", running::get)
            .description("Tasks executing on this worker")
            .register(meterRegistry);
        for (String queue : queues) {
            AtomicLong depth = new AtomicLong();
            queueDepths.put(queue, depth);
            Gauge.builder("conductor.queue.depth", depth::get)
                .tag("queue", queue)
                .description("Messages waiting on a broker queue")
                .register(meterRegistry);
        }

        log.info("Starting worker {} on queues {} (concurrency={}, prefetch={}, acksLate={})",
            workerName, queues, config.getConcurrency(), reservations.availablePermits(), config.isAcksLate());

        broker.heartbeat(workerName, queues, config.getHeartbeatTtl()).block(BROKER_TIMEOUT);

        loops.add(Flux.interval(config.getPollInterval(), Schedulers.boundedElastic())
            .onBackpressureDrop()
            .concatMap(tick -> Mono.fromRunnable(this::pollOnce))
            .doOnError(e -> log.error("Fatal error in worker poll loop", e))
            .retry()
            .subscribe());

        loops.add(Flux.interval(config.getHeartbeatTtl().dividedBy(3), Schedulers.boundedElastic())
            .concatMap(tick -> broker.heartbeat(workerName, queues, config.getHeartbeatTtl())
                .onErrorResume(e -> {
                    log.warn("Worker {} heartbeat failed: {}", workerName, e.getMessage());
                    return Mono.empty();
                }))
            .subscribe());

        loops.add(Flux.interval(config.getRecoveryInterval(), Schedulers.boundedElastic())
            .concatMap(tick -> broker.recoverAbandoned()
                .onErrorResume(e -> {
                    log.warn("Redelivery of abandoned tasks failed: {}", e.getMessage());
                    return Mono.just(0L);
                }))
            .subscribe());
    }

    @PreDestroy
    public void stop() {
        log.info("Stopping worker {}", workerName);
        loops.forEach(Disposable::dispose);
        executor.shutdown();
        try {
            if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                log.warn("Worker {} stopped with tasks still running", workerName);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Reserve as many messages as the prefetch window allows and hand them to the executor.
     *
     * @return number of messages reserved
     */
    int pollOnce() {
        int reserved = 0;
        for (String queue : queues) {
            while (reservations.tryAcquire()) {
                TaskDelivery delivery;
                try {
                    delivery = broker.reserve(queue, workerName).block(BROKER_TIMEOUT);
                } catch (RuntimeException e) {
                    reservations.release();
                    log.error("Worker {} failed to reserve from queue {}: {}", workerName, queue, e.getMessage());
                    break;
                }
                if (delivery == null) {
                    reservations.release();
                    break;
                }
                reserved++;
                if (!config.isAcksLate()) {
                    acknowledge(delivery);
                }
                executor.execute(() -> process(delivery));
            }
            refreshDepth(queue);
        }
        return reserved;
    }

    void process(TaskDelivery delivery) {
        TaskMessage message = delivery.getMessage();
        running.incrementAndGet();
        try {
            JobResult result = resultStore.find(message.getJobResultId()).block(BROKER_TIMEOUT);
            if (result == null) {
                log.warn("Dropping task {}: job result no longer exists", message.getJobResultId());
            } else if (result.getStatus().isTerminal()) {
                log.info("Skipping redelivered task {}: job result is already {}",
                    message.getJobResultId(), result.getStatus());
            } else {
                jobRunner.run(message.getJobResultId(), message.getArgs());
            }
        } catch (RuntimeException e) {
            log.error("Error processing task {}: {}", message.getJobResultId(), e.getMessage(), e);
        } finally {
            running.decrementAndGet();
            if (config.isAcksLate()) {
                acknowledge(delivery);
            }
            reservations.release();
        }
    }

    public String getWorkerName() {
        return workerName;
    }

    private void acknowledge(TaskDelivery delivery) {
        try {
            broker.acknowledge(delivery).block(BROKER_TIMEOUT);
        } catch (RuntimeException e) {
            log.error("Failed to acknowledge task {}: {}", delivery.getMessage().getJobResultId(), e.getMessage());
        }
    }

    private void refreshDepth(String queue) {
        AtomicLong depth = queueDepths.get(queue);
        if (depth != null) {
            Long size = broker.size(queue).onErrorReturn(-1L).block(BROKER_TIMEOUT);
            depth.set(size == null ? 0L : size);
        }
    }

    private static String defaultWorkerName() {
        String host;
        try {
            host = InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            host = "worker";
        }
        return host + "-" + UUID.randomUUID().toString().substring(0, 8);
    }
}
