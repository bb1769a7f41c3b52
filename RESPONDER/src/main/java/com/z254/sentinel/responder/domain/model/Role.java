package com.z254.sentinel.responder.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;

/**
 * Approval roles, totally ordered by level.
 */
public enum Role {
    JUNIOR_DEV(1),
    SENIOR_DEV(2),
    TEAM_LEAD(3),
    ENGINEERING_MANAGER(4),
    CTO(5);

    private final int level;

    Role(int level) {
        this.level = level;
    }

    public int getLevel() {
        return level;
    }

    public boolean canApprove(ApprovalSeverity severity) {
        return level >= severity.getMinLevel();
    }

    public static Role fromLevel(int level) {
        return Arrays.stream(values())
                .filter(role -> role.level == level)
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("No role with level " + level));
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Role fromWire(String value) {
        return valueOf(value.toUpperCase(Locale.ROOT));
    }
}
