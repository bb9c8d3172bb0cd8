package com.whereq.conductor.registry;

import com.whereq.conductor.config.ConductorProperties;
import com.whereq.conductor.exception.BackendException;
import com.whereq.conductor.model.ObjectRef;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.Map;

class WebClientRecordStoreClientTest {

    private static final String BASE = "http://records.local/";

    private static WebClientRecordStoreClient client(String baseUrl, Map<String, ClientResponse> responses) {
        ConductorProperties properties = new ConductorProperties();
        properties.getRecordStore().setBaseUrl(baseUrl);
        WebClient.Builder builder = WebClient.builder().exchangeFunction(request -> {
            ClientResponse response = responses.get(request.url().toString());
            return Mono.just(response != null ? response : ClientResponse.create(HttpStatus.NOT_FOUND).build());
        });
        return new WebClientRecordStoreClient(builder, properties);
    }

    private static ClientResponse json(String body) {
        return ClientResponse.create(HttpStatus.OK)
            .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
            .body(body)
            .build();
    }

    @Test
    void shouldFollowPagesWhenListing() {
        WebClientRecordStoreClient client = client(BASE, Map.of(
            "http://records.local/api/dcim/devices/",
            json("{\"results\":[{\"id\":1,\"name\":\"sw1\"}],\"next\":\"http://records.local/api/dcim/devices/?offset=1\"}"),
            "http://records.local/api/dcim/devices/?offset=1",
            json("{\"results\":[{\"id\":2,\"name\":\"sw2\"}],\"next\":null}")));

        StepVerifier.create(client.list("dcim.device").map(record -> record.get("name")))
            .expectNext("sw1", "sw2")
            .verifyComplete();
    }

    @Test
    void shouldResolveReferences() {
        WebClientRecordStoreClient client = client(BASE, Map.of(
            "http://records.local/api/dcim/devices/1/", json("{\"id\":1}"),
            "http://records.local/api/dcim/devices/3/", ClientResponse.create(HttpStatus.BAD_GATEWAY).build()));

        StepVerifier.create(client.exists(new ObjectRef("dcim.device", "1"))).expectNext(true).verifyComplete();
        StepVerifier.create(client.exists(new ObjectRef("dcim.device", "2"))).expectNext(false).verifyComplete();
        StepVerifier.create(client.exists(new ObjectRef("dcim.device", "3")))
            .expectError(BackendException.class)
            .verify();
    }

    @Test
    void shouldAcceptEveryReferenceWithoutBaseUrl() {
        WebClientRecordStoreClient client = client(null, Map.of());

        StepVerifier.create(client.exists(new ObjectRef("dcim.device", "42"))).expectNext(true).verifyComplete();
        StepVerifier.create(client.list("dcim.device")).expectError(BackendException.class).verify();
    }
}
