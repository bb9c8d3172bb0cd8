package com.whereq.conductor.registry;

import com.whereq.conductor.model.ObjectRef;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Read access to the inventory record store that jobs operate on
 */
public interface RecordStoreClient {

    /**
     * @return true when the referenced record exists
     */
    Mono<Boolean> exists(ObjectRef ref);

    /**
     * All records of a type, as loosely typed maps
     */
    Flux<Map<String, Object>> list(String type);
}
