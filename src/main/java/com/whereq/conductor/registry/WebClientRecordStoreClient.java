package com.whereq.conductor.registry;

import com.whereq.conductor.config.ConductorProperties;
import com.whereq.conductor.exception.BackendException;
import com.whereq.conductor.model.ObjectRef;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Record store REST client. A type "dcim.device" maps to {@code <base>/api/dcim/devices/}.
 * When no base URL is configured every reference is accepted.
 */
@Slf4j
@Component
public class WebClientRecordStoreClient implements RecordStoreClient {

    private final WebClient webClient;
    private final String baseUrl;

    public WebClientRecordStoreClient(WebClient.Builder webClientBuilder, ConductorProperties properties) {
        this.baseUrl = properties.getRecordStore().getBaseUrl();
        this.webClient = webClientBuilder.build();
    }

    @Override
    public Mono<Boolean> exists(ObjectRef ref) {
        if (baseUrl == null || baseUrl.isBlank()) {
            return Mono.just(true);
        }
        String url = collectionUrl(ref.getType()) + ref.getId() + "/";
        return webClient.get()
            .uri(url)
            .accept(MediaType.APPLICATION_JSON)
            .exchangeToMono(response -> {
                if (response.statusCode().is2xxSuccessful()) {
                    return Mono.just(true);
                }
                if (response.statusCode().value() == HttpStatus.NOT_FOUND.value()) {
                    return Mono.just(false);
                }
                return Mono.error(new BackendException(
                    "Record store answered " + response.statusCode().value() + " for " + ref));
            })
            .doOnError(e -> log.error("Failed to resolve {}: {}", ref, e.getMessage()));
    }

    @Override
    public Flux<Map<String, Object>> list(String type) {
        if (baseUrl == null || baseUrl.isBlank()) {
            return Flux.error(new BackendException("conductor.record-store.base-url is not configured"));
        }
        return fetchPage(collectionUrl(type))
            .expand(page -> page.getNext() == null ? Mono.empty() : fetchPage(page.getNext()))
            .flatMapIterable(RecordPage::getResults);
    }

    private Mono<RecordPage> fetchPage(String url) {
        return webClient.get()
            .uri(url)
            .accept(MediaType.APPLICATION_JSON)
            .retrieve()
            .bodyToMono(RecordPage.class)
            .onErrorMap(e -> new BackendException("Failed to list records from " + url + ": " + e.getMessage(), e));
    }

    private String collectionUrl(String type) {
        String[] parts = type.split("\\.", 2);
        String path = parts.length == 2 ? parts[0] + "/" + parts[1] + "s" : type;
        String base = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        return base + "/api/" + path + "/";
    }

    @Data
    static class RecordPage {
        private List<Map<String, Object>> results = new ArrayList<>();
        private String next;
    }
}
