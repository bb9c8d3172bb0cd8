package com.whereq.conductor.store;

import com.whereq.conductor.model.ScheduledRun;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

public interface ScheduledRunStore {

    Mono<ScheduledRun> save(ScheduledRun run);

    Mono<ScheduledRun> find(String id);

    Flux<ScheduledRun> findAll();

    Mono<Boolean> delete(String id);
}
