package com.z254.sentinel.responder.client;

import com.z254.sentinel.responder.config.ResponderProperties;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * Remote safety validator: {@code POST /session/check} with the fix as an assistant message.
 */
@Slf4j
@Component
public class HttpSafetyValidationClient implements SafetyValidationClient {

    private final WebClient webClient;
    private final ResponderProperties.SafetyValidation config;

    public HttpSafetyValidationClient(WebClient.Builder webClientBuilder, ResponderProperties properties) {
        this.config = properties.getSafetyValidation();
        this.webClient = webClientBuilder
                .baseUrl(config.getUrl())
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + (config.getApiKey() != null ? config.getApiKey() : ""))
                .build();
    }

    @Override
    public boolean isEnabled() {
        return config.isEnabled() && config.getApiKey() != null && !config.getApiKey().isBlank();
    }

    @Override
    @CircuitBreaker(name = "safety-validation")
    public Mono<Verdict> check(String content, Map<String, Object> context) {
        String framing = "Incident context: " + context;
        Map<String, Object> body = Map.of(
                "messages", List.of(
                        Map.of("role", "user", "content", framing),
                        Map.of("role", "assistant", "content", content)));

        return webClient.post()
                .uri("/session/check")
                .bodyValue(body)
                .retrieve()
                .bodyToMono(Verdict.class)
                .timeout(config.getTimeout())
                .doOnError(e -> log.warn("Remote safety validation failed: {}", e.getMessage()));
    }
}
