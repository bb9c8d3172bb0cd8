package com.whereq.conductor.lock;

import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * TTL-bound mutual exclusion for singleton jobs
 */
public interface ConcurrencyGuard {

    /**
     * Take the lock of a job if nobody holds it.
     *
     * @param jobId job to lock
     * @param ownerToken identifies the holder, used again on release
     * @param ttl lock expiry, so a crashed holder cannot block the job forever
     * @return true when acquired
     */
    Mono<Boolean> acquire(String jobId, String ownerToken, Duration ttl);

    /**
     * Release the lock only if it is still held by {@code ownerToken}.
     *
     * @return true when a lock was deleted
     */
    Mono<Boolean> release(String jobId, String ownerToken);

    /**
     * Current owner token, empty when unlocked
     */
    Mono<String> holder(String jobId);
}
