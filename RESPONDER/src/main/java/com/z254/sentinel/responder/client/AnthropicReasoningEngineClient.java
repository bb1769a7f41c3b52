package com.z254.sentinel.responder.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.z254.sentinel.responder.config.ResponderProperties;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Reasoning engine backed by the Anthropic Messages API.
 */
@Slf4j
@Component
public class AnthropicReasoningEngineClient implements ReasoningEngineClient {

    private static final String MESSAGES_PATH = "/messages";

    private final WebClient webClient;
    private final ResponderProperties.ReasoningEngine config;
    private final Timer callTimer;
    private final Counter errorCounter;

    public AnthropicReasoningEngineClient(WebClient.Builder webClientBuilder,
                                          ResponderProperties properties,
                                          MeterRegistry meterRegistry) {
        this.config = properties.getReasoningEngine();
        this.webClient = webClientBuilder
                .baseUrl(config.getUrl())
                .defaultHeader("x-api-key", config.getApiKey() != null ? config.getApiKey() : "")
                .defaultHeader("anthropic-version", config.getApiVersion())
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .build();
        this.callTimer = Timer.builder("responder.reasoning.latency")
                .description("Reasoning engine call latency")
                .register(meterRegistry);
        this.errorCounter = Counter.builder("responder.reasoning.errors")
                .description("Reasoning engine call failures")
                .register(meterRegistry);
    }

    @Override
    public boolean isAvailable() {
        return config.isEnabled() && config.getApiKey() != null && !config.getApiKey().isBlank();
    }

    @Override
    @CircuitBreaker(name = "reasoning-engine")
    @Retry(name = "reasoning-engine")
    public Mono<String> complete(String system, String prompt) {
        long startTime = System.currentTimeMillis();

        Map<String, Object> body = new HashMap<>();
        body.put("model", config.getModel());
        body.put("max_tokens", config.getMaxTokens());
        body.put("system", system);
        body.put("messages", List.of(Map.of("role", "user", "content", prompt)));

        return webClient.post()
                .uri(MESSAGES_PATH)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .timeout(config.getTimeout())
                .map(this::extractText)
                .doOnSuccess(text -> {
                    long duration = System.currentTimeMillis() - startTime;
                    callTimer.record(Duration.ofMillis(duration));
                    log.debug("Reasoning engine completion: {}ms", duration);
                })
                .doOnError(e -> {
                    errorCounter.increment();
                    log.error("Reasoning engine completion error: {}", e.getMessage());
                });
    }

    private String extractText(JsonNode json) {
        StringBuilder text = new StringBuilder();
        JsonNode content = json.path("content");
        if (content.isArray()) {
            for (JsonNode block : content) {
                if ("text".equals(block.path("type").asText())) {
                    text.append(block.path("text").asText());
                }
            }
        }
        if (text.length() == 0) {
            throw new IllegalStateException("Reasoning engine returned no text content");
        }
        return text.toString();
    }
}
