package com.z254.sentinel.responder.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Gates who may approve or override a fix.
 */
public enum ApprovalSeverity {
    LOW(1),
    MEDIUM(2),
    HIGH(3),
    BLOCKER(4);

    private final int minLevel;

    ApprovalSeverity(int minLevel) {
        this.minLevel = minLevel;
    }

    public int getMinLevel() {
        return minLevel;
    }

    /**
     * Lowest role allowed to approve at this severity.
     */
    public Role minimumRole() {
        return Role.fromLevel(minLevel);
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ApprovalSeverity fromWire(String value) {
        return valueOf(value.toUpperCase(Locale.ROOT));
    }
}
