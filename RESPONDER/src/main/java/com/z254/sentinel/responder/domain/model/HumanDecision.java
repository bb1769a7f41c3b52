package com.z254.sentinel.responder.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum HumanDecision {
    APPROVED(0.05),
    REJECTED(-0.05),
    MODIFIED(-0.05);

    private final double confidenceAdjustment;

    HumanDecision(double confidenceAdjustment) {
        this.confidenceAdjustment = confidenceAdjustment;
    }

    public double getConfidenceAdjustment() {
        return confidenceAdjustment;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
