package com.z254.sentinel.responder.monitor;

import com.z254.sentinel.responder.config.ResponderProperties;
import com.z254.sentinel.responder.domain.model.ApprovalSeverity;
import com.z254.sentinel.responder.domain.model.Evidence;
import com.z254.sentinel.responder.domain.model.FaultType;
import com.z254.sentinel.responder.domain.model.HealthSignal;
import com.z254.sentinel.responder.domain.model.ImpactSeverity;
import com.z254.sentinel.responder.domain.model.Incident;
import com.z254.sentinel.responder.domain.model.IncidentStatus;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.UUID;

/**
 * Builds new incidents from a classified health signal: severities, title, description and impact.
 */
@Component
public class IncidentFactory {

    public static final String REPORTER = "agent (auto-detected)";
    private static final int TITLE_LIMIT = 80;

    private final ResponderProperties properties;

    public IncidentFactory(ResponderProperties properties) {
        this.properties = properties;
    }

    public static String newIncidentId() {
        return UUID.randomUUID().toString().replace("-", "").substring(0, 8);
    }

    public Incident create(String id, FaultType faultType, HealthSignal signal) {
        ImpactSeverity impact = impactSeverity(faultType);
        Instant now = Instant.now();
        return Incident.builder()
                .id(id)
                .serviceName(properties.getServiceName())
                .faultType(faultType)
                .title(title(signal))
                .description(description(faultType, signal))
                .impactAnalysis(impactAnalysis(faultType, impact, signal))
                .impactSeverity(impact)
                .approvalSeverity(approvalSeverity(faultType, impact))
                .status(IncidentStatus.DETECTED)
                .evidence(Evidence.builder()
                        .healthSignal(signal)
                        .traceback(signal.getTraceback())
                        .build())
                .reportedBy(REPORTER)
                .assignedTo("agent")
                .detectedAt(now)
                .updatedAt(now)
                .build();
    }

    public ImpactSeverity impactSeverity(FaultType faultType) {
        return switch (faultType) {
            case CRASH -> ImpactSeverity.CRITICAL;
            case BAD_CONFIG, BUG -> ImpactSeverity.HIGH;
            case SLOW, UNKNOWN -> ImpactSeverity.MEDIUM;
        };
    }

    /**
     * Crash and bad-config faults always need a blocker-level approver (data loss risk).
     */
    public ApprovalSeverity approvalSeverity(FaultType faultType, ImpactSeverity impact) {
        if (faultType == FaultType.CRASH || faultType == FaultType.BAD_CONFIG) {
            return ApprovalSeverity.BLOCKER;
        }
        return impact.getDefaultApprovalSeverity();
    }

    private String title(HealthSignal signal) {
        String error = signal.getError() != null && !signal.getError().isBlank() ? signal.getError() : "Unknown";
        return error.length() <= TITLE_LIMIT ? error : error.substring(0, TITLE_LIMIT);
    }

    private String description(FaultType faultType, HealthSignal signal) {
        String error = signal.getError() != null ? signal.getError() : "Unknown";
        String errorType = signal.getErrorType() != null ? signal.getErrorType() : "";
        return switch (faultType) {
            case CRASH -> "Application process crashed - " + error;
            case BAD_CONFIG -> "Configuration error - " + error;
            case BUG -> "Code error in handler - " + errorType + ": " + error;
            case SLOW -> "Performance degradation - " + error;
            case UNKNOWN -> "Application error - " + error;
        };
    }

    private String impactAnalysis(FaultType faultType, ImpactSeverity impact, HealthSignal signal) {
        return switch (faultType) {
            case CRASH -> "CRITICAL IMPACT - Complete Service Outage\n\n"
                    + "* All API endpoints are unreachable\n"
                    + "* Customers cannot browse, order or check out\n"
                    + "* In-flight transactions may be lost\n"
                    + "* Upstream services depending on this API will also fail\n"
                    + "* Estimated blast radius: 100% of users";
            case BAD_CONFIG -> "HIGH IMPACT - Configuration Corruption\n\n"
                    + "* Application fails on startup due to invalid config\n"
                    + "* Database connection settings unreadable, potential data loss\n"
                    + "* All API endpoints return HTTP 500\n"
                    + "* Estimated blast radius: 100% of users";
            case BUG -> "HIGH IMPACT - Code Defect in Business Logic\n\n"
                    + "* Health validation fails and the app reports unhealthy\n"
                    + "* Requests touching the broken code path error out\n"
                    + "* Endpoints not using the broken path may still work\n"
                    + "* Estimated blast radius: 60-80% of API calls";
            case SLOW -> "MEDIUM IMPACT - Performance Degradation\n\n"
                    + "* Requests take seconds instead of milliseconds\n"
                    + "* Health checks time out\n"
                    + "* No data loss but severe latency for users\n"
                    + "* Estimated blast radius: 100% of users (degraded, not blocked)";
            case UNKNOWN -> "UNKNOWN IMPACT\n\nSeverity: " + impact.wireName()
                    + "\nError: " + (signal.getError() != null ? signal.getError() : "Unknown");
        };
    }
}
