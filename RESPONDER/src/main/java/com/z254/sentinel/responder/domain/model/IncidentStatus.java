package com.z254.sentinel.responder.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Lifecycle status of an incident, with the allowed transition table.
 */
public enum IncidentStatus {
    DETECTED,
    DIAGNOSING,
    FIX_PROPOSED,
    AWAITING_APPROVAL,
    DEPLOYING,
    RESOLVED,
    REJECTED;

    public boolean isTerminal() {
        return this == RESOLVED || this == REJECTED;
    }

    /**
     * Whether a fix is on the table and can be approved, overridden or refined.
     */
    public boolean isActionable() {
        return this == FIX_PROPOSED || this == AWAITING_APPROVAL;
    }

    public Set<IncidentStatus> allowedTargets() {
        return switch (this) {
            case DETECTED -> EnumSet.of(DIAGNOSING, REJECTED);
            case DIAGNOSING -> EnumSet.of(FIX_PROPOSED, REJECTED);
            case FIX_PROPOSED -> EnumSet.of(AWAITING_APPROVAL, DEPLOYING, FIX_PROPOSED, REJECTED);
            case AWAITING_APPROVAL -> EnumSet.of(DEPLOYING, FIX_PROPOSED, REJECTED);
            case DEPLOYING -> EnumSet.of(RESOLVED, FIX_PROPOSED);
            case RESOLVED, REJECTED -> EnumSet.noneOf(IncidentStatus.class);
        };
    }

    public boolean canTransitionTo(IncidentStatus target) {
        return allowedTargets().contains(target);
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static IncidentStatus fromWire(String value) {
        return valueOf(value.toUpperCase(Locale.ROOT));
    }
}
