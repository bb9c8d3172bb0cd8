package com.whereq.conductor.kubernetes;

import com.whereq.conductor.config.ConductorProperties;
import com.whereq.conductor.exception.BackendException;
import io.fabric8.kubernetes.api.model.Container;
import io.fabric8.kubernetes.api.model.DeletionPropagation;
import io.fabric8.kubernetes.api.model.EnvVar;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.StatusDetails;
import io.fabric8.kubernetes.api.model.batch.v1.Job;
import io.fabric8.kubernetes.api.model.batch.v1.JobCondition;
import io.fabric8.kubernetes.api.model.batch.v1.JobStatus;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Compute objects as Kubernetes batch/v1 Jobs built from a manifest template on the classpath
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "conductor.kubernetes", name = "enabled", havingValue = "true", matchIfMissing = true)
public class KubernetesJobOrchestrator implements ComputeOrchestrator {

    public static final String MANAGED_BY_LABEL = "app.kubernetes.io/managed-by";
    public static final String MANAGED_BY = "whereq-conductor";
    public static final String JOB_RESULT_LABEL = "conductor.whereq.com/job-result-id";
    private static final String JOB_NAME_LABEL = "job-name";

    public static final String ENV_JOB_RESULT_ID = "CONDUCTOR_JOB_RESULT_ID";
    public static final String ENV_JOB_ID = "CONDUCTOR_JOB_ID";
    public static final String ENV_JOB_ARGS = "CONDUCTOR_JOB_ARGS";

    private final KubernetesClient client;
    private final ConductorProperties.KubernetesConfig config;

    public KubernetesJobOrchestrator(KubernetesClient client, ConductorProperties properties) {
        this.client = client;
        this.config = properties.getKubernetes();
    }

    @Override
    public String create(ComputeRequest request) {
        Job job = buildJob(request);
        try {
            Job created = client.batch().v1().jobs()
                .inNamespace(config.getNamespace())
                .resource(job)
                .create();
            log.info("Created Kubernetes job {}/{} for job result {}",
                config.getNamespace(), created.getMetadata().getName(), request.getJobResultId());
            return created.getMetadata().getName();
        } catch (KubernetesClientException e) {
            throw new BackendException("Failed to create Kubernetes job " + request.getName() + ": " + e.getMessage(), e);
        }
    }

    Job buildJob(ComputeRequest request) {
        Job job = loadTemplate();

        job.getMetadata().setName(request.getName());
        job.getMetadata().setNamespace(config.getNamespace());
        Map<String, String> labels = job.getMetadata().getLabels() != null
            ? new HashMap<>(job.getMetadata().getLabels())
            : new HashMap<>();
        labels.putAll(request.getLabels());
        labels.put(MANAGED_BY_LABEL, MANAGED_BY);
        labels.put(JOB_RESULT_LABEL, request.getJobResultId());
        job.getMetadata().setLabels(labels);

        var spec = job.getSpec();
        spec.setBackoffLimit(0);
        if (request.getTtlAfterFinished() != null) {
            spec.setTtlSecondsAfterFinished((int) request.getTtlAfterFinished().toSeconds());
        }
        if (request.getActiveDeadline() != null) {
            spec.setActiveDeadlineSeconds(request.getActiveDeadline().toSeconds());
        }
        var podSpec = spec.getTemplate().getSpec();
        podSpec.setRestartPolicy("Never");

        Container container = podSpec.getContainers().get(0);
        if (config.getImage() != null && !config.getImage().isBlank()) {
            container.setImage(config.getImage());
        }
        List<String> command = new ArrayList<>(config.getCommand());
        command.add("--conductor.runner.job-result-id=" + request.getJobResultId());
        command.add("--conductor.scheduler.enabled=false");
        command.add("--spring.main.web-application-type=none");
        container.setCommand(command);

        List<EnvVar> env = container.getEnv() != null ? new ArrayList<>(container.getEnv()) : new ArrayList<>();
        env.add(new EnvVar(ENV_JOB_RESULT_ID, request.getJobResultId(), null));
        env.add(new EnvVar(ENV_JOB_ID, request.getJobId(), null));
        env.add(new EnvVar(ENV_JOB_ARGS, request.getArgsJson(), null));
        container.setEnv(env);
        return job;
    }

    @Override
    public ComputePhase phase(String name) {
        Job job;
        try {
            job = client.batch().v1().jobs().inNamespace(config.getNamespace()).withName(name).get();
        } catch (KubernetesClientException e) {
            throw new BackendException("Failed to read Kubernetes job " + name + ": " + e.getMessage(), e);
        }
        if (job == null) {
            return ComputePhase.MISSING;
        }
        JobStatus status = job.getStatus();
        if (status == null) {
            return ComputePhase.PENDING;
        }
        if (status.getConditions() != null) {
            for (JobCondition condition : status.getConditions()) {
                if ("True".equals(condition.getStatus())) {
                    if ("Complete".equals(condition.getType())) {
                        return ComputePhase.SUCCEEDED;
                    }
                    if ("Failed".equals(condition.getType())) {
                        return ComputePhase.FAILED;
                    }
                }
            }
        }
        if (status.getSucceeded() != null && status.getSucceeded() > 0) {
            return ComputePhase.SUCCEEDED;
        }
        if (status.getFailed() != null && status.getFailed() > 0) {
            return ComputePhase.FAILED;
        }
        return status.getActive() != null && status.getActive() > 0 ? ComputePhase.RUNNING : ComputePhase.PENDING;
    }

    @Override
    public List<String> logs(String name) {
        List<String> lines = new ArrayList<>();
        try {
            List<Pod> pods = client.pods()
                .inNamespace(config.getNamespace())
                .withLabel(JOB_NAME_LABEL, name)
                .list()
                .getItems();
            for (Pod pod : pods) {
                String text = client.pods()
                    .inNamespace(config.getNamespace())
                    .withName(pod.getMetadata().getName())
                    .getLog();
                if (text != null && !text.isEmpty()) {
                    lines.addAll(List.of(text.split("\\R")));
                }
            }
        } catch (KubernetesClientException e) {
            log.warn("Failed to read logs of Kubernetes job {}: {}", name, e.getMessage());
        }
        return lines;
    }

    @Override
    public boolean delete(String name) {
        try {
            List<StatusDetails> details = client.batch().v1().jobs()
                .inNamespace(config.getNamespace())
                .withName(name)
                .withPropagationPolicy(DeletionPropagation.BACKGROUND)
                .delete();
            boolean deleted = details != null && !details.isEmpty();
            if (deleted) {
                log.info("Deleted Kubernetes job {}/{}", config.getNamespace(), name);
            }
            return deleted;
        } catch (KubernetesClientException e) {
            throw new BackendException("Failed to delete Kubernetes job " + name + ": " + e.getMessage(), e);
        }
    }

    private Job loadTemplate() {
        try (InputStream stream = Objects.requireNonNull(getClass()
            .getClassLoader()
            .getResourceAsStream(config.getManifestTemplate()),
            "Manifest template not found: " + config.getManifestTemplate())) {
            return client.batch().v1().jobs()
                .load(stream)
                .item();
        } catch (IOException e) {
            throw new BackendException("Error while reading Kubernetes job template", e);
        }
    }
}
