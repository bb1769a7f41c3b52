package com.z254.sentinel.responder.client;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.z254.sentinel.responder.config.ResponderProperties;
import com.z254.sentinel.responder.domain.model.SandboxResult;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Sandbox execution over HTTP: {@code POST /execute {code, language, timeout}}.
 */
@Slf4j
@Component
public class HttpSandboxClient implements SandboxClient {

    private static final int MAX_OUTPUT = 5000;

    private final WebClient webClient;
    private final ResponderProperties.Sandbox config;

    public HttpSandboxClient(WebClient.Builder webClientBuilder, ResponderProperties properties) {
        this.config = properties.getSandbox();
        this.webClient = webClientBuilder
                .baseUrl(config.getUrl())
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + (config.getApiKey() != null ? config.getApiKey() : ""))
                .build();
    }

    @Override
    @CircuitBreaker(name = "sandbox", fallbackMethod = "testFallback")
    public Mono<SandboxResult> test(String fixCode, String testCode) {
        if (!config.isEnabled()) {
            return Mono.just(SandboxResult.unavailable("Sandbox not configured"));
        }
        return execute(fixCode)
                .flatMap(fix -> {
                    if (!fix.isSuccess()) {
                        return Mono.just(SandboxResult.builder()
                                .fixApplied(false)
                                .testPassed(false)
                                .output(truncate(fix.getOutput()))
                                .error(truncate(fix.getError()))
                                .build());
                    }
                    return execute(testCode)
                            .map(test -> SandboxResult.builder()
                                    .fixApplied(true)
                                    .testPassed(test.isSuccess())
                                    .output(truncate(test.getOutput()))
                                    .error(truncate(test.getError()))
                                    .build());
                });
    }

    private Mono<SandboxResult> testFallback(String fixCode, String testCode, Throwable t) {
        log.warn("Sandbox unavailable, recording conservative result: {}", t.getMessage());
        return Mono.just(SandboxResult.unavailable("Sandbox unavailable: " + t.getMessage()));
    }

    private Mono<ExecutionResponse> execute(String code) {
        return webClient.post()
                .uri("/execute")
                .bodyValue(Map.of(
                        "code", code != null ? code : "",
                        "language", "python",
                        "timeout", config.getTimeout().toSeconds()))
                .retrieve()
                .bodyToMono(ExecutionResponse.class)
                .timeout(config.getTimeout());
    }

    private static String truncate(String value) {
        if (value == null || value.length() <= MAX_OUTPUT) {
            return value;
        }
        return value.substring(0, MAX_OUTPUT);
    }

    @Data
    static class ExecutionResponse {
        private boolean success;
        private String output;
        private String error;
        @JsonAlias("exit_code")
        private int exitCode;
    }
}
