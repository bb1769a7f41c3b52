package com.z254.sentinel.responder.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Outcome of running a proposed fix through the safety gate.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SafetyResult {

    private boolean passed;

    /** Safety score in [0, 1] */
    private double score;

    @Builder.Default
    private List<SafetyCheck> checks = new ArrayList<>();

    @Builder.Default
    private List<String> warnings = new ArrayList<>();

    private String reasoning;

    /** Engine that produced the result: local rules or the remote validator */
    private String provider;

    private String providerMode;

    private Instant evaluatedAt;

    public List<SafetyCheck> failedChecks() {
        return checks.stream().filter(check -> !check.isPassed()).toList();
    }

    /**
     * A single named safety check.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SafetyCheck {
        private String name;
        private CheckCategory category;
        private boolean passed;
        private String message;
    }

    public enum CheckCategory {
        CRITICAL,
        ADVISORY;

        @JsonValue
        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}
