package com.whereq.conductor.store;

import com.whereq.conductor.model.FileProxy;
import reactor.core.publisher.Mono;

public interface FileProxyStore {

    Mono<FileProxy> save(FileProxy file);

    Mono<FileProxy> find(String id);

    Mono<Boolean> delete(String id);
}
