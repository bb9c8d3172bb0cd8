package com.whereq.conductor.store;

import com.whereq.conductor.model.JobLogEntry;
import com.whereq.conductor.model.LogLevel;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Append-only log entries per JobResult, readable while the job runs
 */
public interface JobLogStore {

    Mono<JobLogEntry> append(JobLogEntry entry);

    /**
     * @param minLevel lowest level returned, null for all
     */
    Flux<JobLogEntry> list(String jobResultId, LogLevel minLevel);

    Mono<Void> deleteAll(String jobResultId);
}
