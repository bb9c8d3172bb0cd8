package com.whereq.conductor.event;

import com.whereq.conductor.config.ConductorProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Posts events to the configured webhook URLs
 */
@Slf4j
@Component
public class WebhookEventSubscriber implements EventSubscriber {

    private final WebClient webClient;
    private final List<String> webhookUrls;
    private final Duration timeout;

    public WebhookEventSubscriber(WebClient.Builder webClientBuilder, ConductorProperties properties) {
        this.webClient = webClientBuilder.build();
        this.webhookUrls = properties.getEvents().getWebhookUrls();
        this.timeout = properties.getEvents().getWebhookTimeout();
    }

    @Override
    public String name() {
        return "webhook";
    }

    @Override
    public void onEvent(String topic, Map<String, Object> payload) {
        for (String url : webhookUrls) {
            send(url, topic, payload).subscribe();
        }
    }

    /**
     * Deliver one event to one URL
     *
     * @return Mono that completes when the webhook answered, failed or timed out
     */
    Mono<Void> send(String url, String topic, Map<String, Object> payload) {
        Map<String, Object> body = new HashMap<>();
        body.put("topic", topic);
        body.put("payload", payload);
        body.put("timestamp", System.currentTimeMillis());

        return webClient
            .post()
            .uri(url)
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(body)
            .retrieve()
            .toBodilessEntity()
            .timeout(timeout)
            .doOnSuccess(response -> log.info("Webhook notification sent for {}: {}",
                topic, response.getStatusCode()))
            .doOnError(error -> log.error("Failed to send webhook notification for {} to {}: {}",
                topic, url, error.getMessage()))
            .onErrorResume(e -> Mono.empty())
            .then();
    }
}
