package com.whereq.conductor.config;

import org.springframework.beans.factory.config.ConfigurableBeanFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Scope;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * WebClient builder for webhook subscribers and record store lookups. Prototype scoped so
 * that one consumer's customizations never leak into another's client.
 */
@Configuration
public class WebClientConfig {

    @Bean
    @Scope(ConfigurableBeanFactory.SCOPE_PROTOTYPE)
    public WebClient.Builder webClientBuilder(ConductorProperties properties) {
        ConductorProperties.HttpConfig http = properties.getHttp();
        return WebClient.builder()
            .defaultHeader(HttpHeaders.USER_AGENT, http.getUserAgent())
            .codecs(configurer -> configurer
                .defaultCodecs()
                .maxInMemorySize((int) http.getMaxInMemorySize().toBytes()));
    }
}
