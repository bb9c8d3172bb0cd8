package com.whereq.conductor.config;

import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Kubernetes client for the pod-per-task backend. Picks up in-cluster service account
 * credentials or the local kubeconfig.
 */
@Configuration
@ConditionalOnProperty(prefix = "conductor.kubernetes", name = "enabled", havingValue = "true", matchIfMissing = true)
public class KubernetesConfig {

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public KubernetesClient kubernetesClient() {
        return new KubernetesClientBuilder().build();
    }
}
