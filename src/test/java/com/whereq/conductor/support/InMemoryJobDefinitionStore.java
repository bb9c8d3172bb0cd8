package com.whereq.conductor.support;

import com.whereq.conductor.model.JobDefinition;
import com.whereq.conductor.store.JobDefinitionStore;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryJobDefinitionStore implements JobDefinitionStore {

    private final Map<String, JobDefinition> definitions = new ConcurrentHashMap<>();

    @Override
    public Mono<JobDefinition> save(JobDefinition definition) {
        return Mono.fromSupplier(() -> {
            definitions.put(definition.getId(), Copies.copy(definition));
            return definition;
        });
    }

    @Override
    public Mono<JobDefinition> find(String jobId) {
        return Mono.fromSupplier(() -> Copies.copy(definitions.get(jobId)));
    }

    @Override
    public Flux<JobDefinition> findAll() {
        return Flux.defer(() -> Flux.fromIterable(definitions.values()).map(Copies::copy));
    }
}
