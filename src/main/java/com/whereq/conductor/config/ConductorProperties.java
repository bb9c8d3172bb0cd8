package com.whereq.conductor.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.unit.DataSize;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for WhereQ Conductor.
 *
 * @author WhereQ Inc.
 */
@Configuration
@ConfigurationProperties(prefix = "conductor")
@Data
public class ConductorProperties {

    private SchedulerConfig scheduler = new SchedulerConfig();

    private WorkerConfig worker = new WorkerConfig();

    private LimitsConfig limits = new LimitsConfig();

    private KubernetesConfig kubernetes = new KubernetesConfig();

    private EventsConfig events = new EventsConfig();

    private StoreConfig store = new StoreConfig();

    private RecordStoreConfig recordStore = new RecordStoreConfig();

    private QueuesConfig queues = new QueuesConfig();

    private RunnerConfig runner = new RunnerConfig();

    private HttpConfig http = new HttpConfig();

    @Data
    public static class SchedulerConfig {
        /**
         * Run the scheduler tick on this node. Exactly one node per deployment should.
         */
        private boolean enabled = true;

        private Duration tickInterval = Duration.ofSeconds(5);

        /**
         * Redis key holding the epoch millis of the last completed tick.
         */
        private String heartbeatKey = "conductor:scheduler:heartbeat";

        /**
         * Optional file touched on every tick, for container liveness probes.
         */
        private String heartbeatFile;

        private String defaultTimeZone = "UTC";
    }

    @Data
    public static class WorkerConfig {
        /**
         * Consume worker-pool queues on this node.
         */
        private boolean enabled = false;

        /**
         * Queue names consumed. Empty means the default queue only.
         */
        private List<String> queues = new ArrayList<>();

        /**
         * Maximum tasks executing at once.
         */
        private int concurrency = 4;

        /**
         * Reserved-but-not-running messages per execution slot.
         */
        private int prefetchMultiplier = 4;

        /**
         * Acknowledge after completion instead of at reservation.
         */
        private boolean acksLate = false;

        private Duration pollInterval = Duration.ofSeconds(1);

        private Duration heartbeatTtl = Duration.ofSeconds(30);

        private Duration recoveryInterval = Duration.ofSeconds(15);

        /**
         * Stable worker name. Generated when blank.
         */
        private String name;
    }

    @Data
    public static class LimitsConfig {
        private Duration defaultSoftTimeLimit = Duration.ofSeconds(300);

        private Duration defaultTimeLimit = Duration.ofSeconds(600);
    }

    @Data
    public static class KubernetesConfig {
        private boolean enabled = true;

        private String namespace = "default";

        /**
         * Classpath location of the batch/v1 Job manifest template.
         */
        private String manifestTemplate = "kubernetes/job-template.yaml";

        /**
         * Overrides the image of the template's first container when set.
         */
        private String image;

        private Duration pollInterval = Duration.ofSeconds(2);

        /**
         * Maximum time to wait for a compute object. Unset means hard time limit plus one minute.
         */
        private Duration watchTimeout;

        private Duration ttlAfterFinished = Duration.ofSeconds(30);

        private Duration cleanupGrace = Duration.ofSeconds(5);

        private List<String> command = new ArrayList<>(List.of(
            "java", "-jar", "/app/whereq-conductor.jar"));
    }

    @Data
    public static class EventsConfig {
        /**
         * Enabled subscribers: log, redis, webhook.
         */
        private List<String> subscribers = new ArrayList<>(List.of("log"));

        private String redisChannelPrefix = "conductor.events";

        private List<String> webhookUrls = new ArrayList<>();

        private Duration webhookTimeout = Duration.ofSeconds(10);
    }

    @Data
    public static class StoreConfig {
        private Duration resultTtl = Duration.ofDays(30);

        private Duration fileProxyTtl = Duration.ofDays(1);
    }

    @Data
    public static class RecordStoreConfig {
        /**
         * Base URL of the inventory record store. Object references are not checked when blank.
         */
        private String baseUrl;
    }

    @Data
    public static class HttpConfig {
        /**
         * Largest response body buffered by outgoing HTTP calls.
         */
        private DataSize maxInMemorySize = DataSize.ofMegabytes(4);

        private String userAgent = "whereq-conductor";
    }

    @Data
    public static class QueuesConfig {
        private String defaultName = "default";

        /**
         * Queues created at startup when absent.
         */
        private List<QueueSeed> bootstrap = new ArrayList<>();
    }

    @Data
    public static class QueueSeed {
        private String name;

        private String backendType = "WORKER_POOL";

        private String description;
    }

    @Data
    public static class RunnerConfig {
        /**
         * Run this already-created result and exit.
         */
        private String jobResultId;

        /**
         * Run this job locally with {@link #data} and exit.
         */
        private String job;

        private String data;

        private String user = "local";
    }
}
