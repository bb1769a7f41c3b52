package com.z254.sentinel.responder.client;

import reactor.core.publisher.Mono;

/**
 * Text-completion collaborator used for diagnosis and fix generation.
 */
public interface ReasoningEngineClient {

    /**
     * Complete {@code prompt} under the given system instructions and return the raw text.
     */
    Mono<String> complete(String system, String prompt);

    /**
     * Whether the engine is configured; checked at call time so credentials can be added live.
     */
    boolean isAvailable();
}
