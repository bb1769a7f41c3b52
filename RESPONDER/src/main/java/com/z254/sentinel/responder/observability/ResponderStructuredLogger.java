package com.z254.sentinel.responder.observability;

import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * Structured logging for incident, approval and remediation events.
 * <p>
 * Every line is {@code message | data={...}} with the incident id pushed into the MDC
 * for the duration of the call, so the console pattern can pick it up.
 */
@Slf4j
@Component
public class ResponderStructuredLogger {

    // MDC keys
    public static final String MDC_INCIDENT_ID = "incidentId";
    public static final String MDC_ACTOR = "actor";
    public static final String MDC_FAULT_TYPE = "faultType";

    public void logIncidentEvent(String incidentId, IncidentEventType eventType, String message) {
        logIncidentEvent(incidentId, eventType, message, null);
    }

    public void logIncidentEvent(String incidentId, IncidentEventType eventType,
                                 String message, Map<String, Object> details) {
        try (var scope = withContext(Map.of(MDC_INCIDENT_ID, nullToEmpty(incidentId)))) {
            Map<String, Object> logData = eventData(eventType.name(), incidentId, details);

            switch (eventType) {
                case PIPELINE_FAILED, TICK_FAILED ->
                        log.error("{} | data={}", message, formatLogData(logData));
                case SUPPRESSED, DIAGNOSIS_FALLBACK, SAFETY_BLOCKED, ESCALATED ->
                        log.warn("{} | data={}", message, formatLogData(logData));
                default -> log.info("{} | data={}", message, formatLogData(logData));
            }
        }
    }

    /**
     * Log a human action against an incident.
     */
    public void logApprovalEvent(String incidentId, String actor, ApprovalEventType eventType,
                                 String message, Map<String, Object> details) {
        try (var scope = withContext(Map.of(
                MDC_INCIDENT_ID, nullToEmpty(incidentId),
                MDC_ACTOR, nullToEmpty(actor)))) {
            Map<String, Object> logData = eventData(eventType.name(), incidentId, details);
            logData.put("actor", actor);

            switch (eventType) {
                case DENIED, INVALID -> log.warn("{} | data={}", message, formatLogData(logData));
                default -> log.info("{} | data={}", message, formatLogData(logData));
            }
        }
    }

    /**
     * Log an apply-and-verify event.
     */
    public void logRemediationEvent(String incidentId, RemediationEventType eventType,
                                    String message, Map<String, Object> details) {
        try (var scope = withContext(Map.of(MDC_INCIDENT_ID, nullToEmpty(incidentId)))) {
            Map<String, Object> logData = eventData(eventType.name(), incidentId, details);

            switch (eventType) {
                case DEPLOY_FAILED -> log.error("{} | data={}", message, formatLogData(logData));
                case VERIFY_RETRY -> log.warn("{} | data={}", message, formatLogData(logData));
                default -> log.info("{} | data={}", message, formatLogData(logData));
            }
        }
    }

    public MDCScope withContext(Map<String, String> context) {
        context.forEach(MDC::put);
        return new MDCScope(context.keySet().toArray(new String[0]));
    }

    private Map<String, Object> eventData(String event, String incidentId, Map<String, Object> details) {
        Map<String, Object> logData = new HashMap<>();
        logData.put("event", event);
        if (incidentId != null) {
            logData.put("incidentId", incidentId);
        }
        if (details != null) {
            logData.putAll(details);
        }
        return logData;
    }

    private String formatLogData(Map<String, Object> data) {
        StringBuilder sb = new StringBuilder("{");
        boolean first = true;
        for (Map.Entry<String, Object> entry : data.entrySet()) {
            if (!first) sb.append(", ");
            first = false;

            sb.append("\"").append(entry.getKey()).append("\": ");
            Object value = entry.getValue();
            if (value == null) {
                sb.append("null");
            } else if (value instanceof Number || value instanceof Boolean) {
                sb.append(value);
            } else {
                sb.append("\"").append(escapeJson(value.toString())).append("\"");
            }
        }
        sb.append("}");
        return sb.toString();
    }

    private String escapeJson(String value) {
        return value.replace("\\", "\\\\")
                .replace("\"", "\\\"")
                .replace("\n", "\\n")
                .replace("\r", "\\r")
                .replace("\t", "\\t");
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }

    // ========== Event Type Enums ==========

    public enum IncidentEventType {
        DETECTED, SUPPRESSED, DIAGNOSED, DIAGNOSIS_FALLBACK, FIX_PROPOSED, SAFETY_BLOCKED,
        SCORED, AUTO_APPLY, ESCALATED, STATUS_CHANGED, RESOLVED, REJECTED,
        PIPELINE_FAILED, TICK_FAILED
    }

    public enum ApprovalEventType {
        SUBMITTED, APPROVED, REJECTED, OVERRIDDEN, CHANGES_REQUESTED, DENIED, INVALID,
        CLEARANCE_SENT, COMMENTED
    }

    public enum RemediationEventType {
        DEPLOYING, VERIFY_RETRY, VERIFIED, DEPLOY_FAILED
    }

    /**
     * Auto-closeable MDC scope for cleanup.
     */
    public static class MDCScope implements AutoCloseable {
        private final String[] keys;

        public MDCScope(String... keys) {
            this.keys = keys;
        }

        @Override
        public void close() {
            for (String key : keys) {
                MDC.remove(key);
            }
        }
    }
}
