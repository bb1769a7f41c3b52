package com.z254.sentinel.responder.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Evidence gathered when an incident is detected.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Evidence {

    private HealthSignal healthSignal;

    @Builder.Default
    private List<String> recentLogs = new ArrayList<>();

    private String traceback;

    /** Relevant source/config files keyed by file name */
    @Builder.Default
    private Map<String, String> files = new LinkedHashMap<>();

    /**
     * Human-readable evidence text shown to engineers and fed to the reasoning engine.
     */
    public String toText() {
        StringBuilder sb = new StringBuilder();
        sb.append("=== HEALTH CHECK ===\n");
        if (healthSignal != null) {
            sb.append("healthy: ").append(healthSignal.isHealthy()).append('\n');
            appendIfPresent(sb, "error", healthSignal.getError());
            appendIfPresent(sb, "error_type", healthSignal.getErrorType());
            appendIfPresent(sb, "detail", healthSignal.getDetail());
            if (healthSignal.getStatusCode() != null) {
                sb.append("status_code: ").append(healthSignal.getStatusCode()).append('\n');
            }
        } else {
            sb.append("(no health signal)\n");
        }
        if (traceback != null && !traceback.isBlank()) {
            sb.append("\n=== TRACEBACK ===\n").append(traceback).append('\n');
        }
        if (recentLogs != null && !recentLogs.isEmpty()) {
            sb.append("\n=== APPLICATION LOGS ===\n");
            recentLogs.forEach(line -> sb.append(line).append('\n'));
        }
        return sb.toString();
    }

    private static void appendIfPresent(StringBuilder sb, String key, String value) {
        if (value != null && !value.isBlank()) {
            sb.append(key).append(": ").append(value).append('\n');
        }
    }
}
