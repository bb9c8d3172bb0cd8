package com.whereq.conductor.support;

import com.whereq.conductor.lock.ConcurrencyGuard;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Lock without expiry
 */
public class InMemoryConcurrencyGuard implements ConcurrencyGuard {

    private final Map<String, String> locks = new ConcurrentHashMap<>();

    @Override
    public Mono<Boolean> acquire(String jobId, String ownerToken, Duration ttl) {
        return Mono.fromSupplier(() -> locks.putIfAbsent(jobId, ownerToken) == null);
    }

    @Override
    public Mono<Boolean> release(String jobId, String ownerToken) {
        return Mono.fromSupplier(() -> locks.remove(jobId, ownerToken));
    }

    @Override
    public Mono<String> holder(String jobId) {
        return Mono.fromSupplier(() -> locks.get(jobId));
    }
}
