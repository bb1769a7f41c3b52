package com.z254.sentinel.responder.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Actions a human can submit against an incident.
 */
public enum ApprovalAction {
    APPROVE,
    REJECT,
    OVERRIDE,
    REQUEST_CHANGES;

    /**
     * Approve and override put a fix into production and are gated by role.
     */
    public boolean requiresAuthority() {
        return this == APPROVE || this == OVERRIDE;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ApprovalAction fromWire(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Action is required");
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
