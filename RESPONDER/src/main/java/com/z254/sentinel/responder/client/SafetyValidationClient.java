package com.z254.sentinel.responder.client;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Remote policy-based safety validation of a proposed fix.
 */
public interface SafetyValidationClient {

    boolean isEnabled();

    /**
     * Ask the remote validator whether {@code content} violates any policy. Errors propagate
     * so the caller can fall back to local rules.
     */
    Mono<Verdict> check(String content, Map<String, Object> context);

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    class Verdict {
        private boolean flagged;

        @Builder.Default
        private Map<String, PolicyVerdict> policies = new LinkedHashMap<>();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    class PolicyVerdict {
        private String name;
        private boolean flagged;
    }
}
