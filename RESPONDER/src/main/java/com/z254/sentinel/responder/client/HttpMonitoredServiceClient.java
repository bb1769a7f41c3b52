package com.z254.sentinel.responder.client;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.z254.sentinel.responder.config.ResponderProperties;
import com.z254.sentinel.responder.domain.model.FaultType;
import com.z254.sentinel.responder.domain.model.HealthSignal;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * HTTP client for the monitored application's health and admin endpoints.
 */
@Slf4j
@Component
public class HttpMonitoredServiceClient implements MonitoredServiceClient {

    private static final ParameterizedTypeReference<Map<String, Object>> JSON_MAP = new ParameterizedTypeReference<>() {
    };

    private final WebClient webClient;
    private final ResponderProperties.MonitoredService config;

    public HttpMonitoredServiceClient(WebClient.Builder webClientBuilder, ResponderProperties properties) {
        this.config = properties.getMonitoredService();
        this.webClient = webClientBuilder
                .baseUrl(config.getUrl())
                .build();
    }

    @Override
    public Mono<HealthSignal> checkHealth() {
        long start = System.currentTimeMillis();
        return webClient.get()
                .uri("/health")
                .exchangeToMono(response -> response.bodyToMono(HealthBody.class)
                        .defaultIfEmpty(new HealthBody())
                        .map(body -> toSignal(body, response.statusCode().value(),
                                response.statusCode().is2xxSuccessful(), start)))
                .timeout(config.getTimeout())
                .onErrorResume(this::unreachable);
    }

    @Override
    public Mono<List<String>> recentLogs(int limit) {
        return webClient.get()
                .uri(uri -> uri.path("/logs").queryParam("limit", limit).build())
                .retrieve()
                .bodyToMono(JSON_MAP)
                .map(this::extractLogLines)
                .timeout(config.getTimeout())
                .onErrorResume(e -> {
                    log.warn("Failed to fetch logs from monitored service: {}", e.getMessage());
                    return Mono.just(List.of());
                });
    }

    @Override
    public Mono<String> fetchFile(String name) {
        return webClient.get()
                .uri("/files/{name}", name)
                .retrieve()
                .bodyToMono(String.class)
                .defaultIfEmpty("")
                .timeout(config.getTimeout())
                .onErrorResume(e -> {
                    log.warn("Failed to fetch {} from monitored service: {}", name, e.getMessage());
                    return Mono.just("");
                });
    }

    @Override
    @Retry(name = "monitored-service")
    public Mono<Void> recover(FaultType faultType) {
        log.info("Requesting recovery for fault type {}", faultType.getKey());
        return webClient.post()
                .uri("/admin/recover/{faultType}", faultType.getKey())
                .retrieve()
                .bodyToMono(Void.class)
                .timeout(config.getRecoveryTimeout());
    }

    @Override
    @Retry(name = "monitored-service")
    public Mono<Void> restart() {
        log.info("Requesting restart of monitored service");
        return webClient.post()
                .uri("/admin/restart")
                .retrieve()
                .bodyToMono(Void.class)
                .timeout(config.getRecoveryTimeout());
    }

    @Override
    public Mono<Void> injectFault(FaultType faultType) {
        return webClient.post()
                .uri("/admin/faults/{faultType}", faultType.getKey())
                .retrieve()
                .bodyToMono(Void.class)
                .timeout(config.getTimeout());
    }

    @Override
    public Mono<Void> clearFaults() {
        return webClient.delete()
                .uri("/admin/faults")
                .retrieve()
                .bodyToMono(Void.class)
                .timeout(config.getTimeout());
    }

    // ========== Private Methods ==========

    private HealthSignal toSignal(HealthBody body, int statusCode, boolean success, long start) {
        boolean healthy = success && (body.getHealthy() == null || body.getHealthy());
        String error = body.getError();
        if (!healthy && error == null) {
            error = "Health endpoint returned HTTP " + statusCode;
        }
        return HealthSignal.builder()
                .healthy(healthy)
                .error(error)
                .errorType(body.getErrorType())
                .traceback(body.getTraceback())
                .detail(body.getDetail())
                .statusCode(statusCode)
                .responseTimeMs(System.currentTimeMillis() - start)
                .checkedAt(Instant.now())
                .build();
    }

    private Mono<HealthSignal> unreachable(Throwable e) {
        if (e instanceof TimeoutException) {
            return Mono.just(HealthSignal.unreachable("Timeout",
                    "Health check timed out after " + config.getTimeout().toSeconds() + "s"));
        }
        if (e instanceof WebClientRequestException) {
            return Mono.just(HealthSignal.unreachable("ConnectionRefused",
                    "Connection refused: " + e.getMessage()));
        }
        log.warn("Health check failed: {}", e.getMessage());
        return Mono.just(HealthSignal.unreachable("ProcessDown", e.getMessage()));
    }

    private List<String> extractLogLines(Map<String, Object> body) {
        Object logs = body.get("logs");
        if (logs instanceof List<?> list) {
            return list.stream().map(String::valueOf).toList();
        }
        if (logs instanceof String text) {
            return List.of(text.split("\n"));
        }
        return List.of();
    }

    /**
     * Body returned by the health endpoint on both success and failure.
     */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class HealthBody {
        private Boolean healthy;
        private String error;
        @JsonAlias("error_type")
        private String errorType;
        private String traceback;
        private String detail;
    }
}
