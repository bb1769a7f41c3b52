package com.z254.sentinel.responder.client;

import com.z254.sentinel.responder.config.ResponderProperties;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.Map;

@Slf4j
@Component
public class HttpSpeechSynthesisClient implements SpeechSynthesisClient {

    private final WebClient webClient;
    private final ResponderProperties.Speech config;

    public HttpSpeechSynthesisClient(WebClient.Builder webClientBuilder, ResponderProperties properties) {
        this.config = properties.getSpeech();
        this.webClient = webClientBuilder
                .baseUrl(config.getUrl())
                .defaultHeader("xi-api-key", config.getApiKey() != null ? config.getApiKey() : "")
                .build();
    }

    @Override
    @CircuitBreaker(name = "speech", fallbackMethod = "synthesizeFallback")
    public Mono<byte[]> synthesize(String text) {
        if (!config.isEnabled()) {
            return Mono.empty();
        }
        return webClient.post()
                .uri("/text-to-speech/{voiceId}", config.getVoiceId())
                .accept(MediaType.parseMediaType("audio/mpeg"))
                .bodyValue(Map.of(
                        "text", text,
                        "model_id", "eleven_monolingual_v1",
                        "voice_settings", Map.of("stability", 0.5, "similarity_boost", 0.75)))
                .retrieve()
                .bodyToMono(byte[].class)
                .timeout(config.getTimeout());
    }

    private Mono<byte[]> synthesizeFallback(String text, Throwable t) {
        log.warn("Speech synthesis unavailable: {}", t.getMessage());
        return Mono.empty();
    }
}
