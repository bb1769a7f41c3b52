package com.z254.sentinel.responder.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * How badly an incident hurts the monitored service.
 */
public enum ImpactSeverity {
    LOW(ApprovalSeverity.LOW, 0.0),
    MEDIUM(ApprovalSeverity.MEDIUM, -0.05),
    HIGH(ApprovalSeverity.MEDIUM, -0.10),
    CRITICAL(ApprovalSeverity.BLOCKER, -0.15);

    private final ApprovalSeverity defaultApprovalSeverity;
    private final double confidencePenalty;

    ImpactSeverity(ApprovalSeverity defaultApprovalSeverity, double confidencePenalty) {
        this.defaultApprovalSeverity = defaultApprovalSeverity;
        this.confidencePenalty = confidencePenalty;
    }

    /**
     * Amount added to a fix's confidence score; more severe incidents need more certainty.
     */
    public double getConfidencePenalty() {
        return confidencePenalty;
    }

    /**
     * Approval severity implied by this impact when the fault type has no override.
     */
    public ApprovalSeverity getDefaultApprovalSeverity() {
        return defaultApprovalSeverity;
    }

    public boolean isHighOrAbove() {
        return this == HIGH || this == CRITICAL;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ImpactSeverity fromWire(String value) {
        return valueOf(value.toUpperCase(Locale.ROOT));
    }
}
