package com.whereq.conductor.store;

import com.whereq.conductor.model.JobDefinition;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

public interface JobDefinitionStore {

    Mono<JobDefinition> save(JobDefinition definition);

    /**
     * @return the definition, or empty when unknown
     */
    Mono<JobDefinition> find(String jobId);

    Flux<JobDefinition> findAll();
}
