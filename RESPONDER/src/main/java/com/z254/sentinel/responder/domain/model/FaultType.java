package com.z254.sentinel.responder.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Fault-type key assigned by the classifier. The key is what the dedup guard indexes on.
 */
public enum FaultType {
    CRASH("crash"),
    SLOW("slow"),
    BAD_CONFIG("bad_config"),
    BUG("bug"),
    UNKNOWN("unknown");

    private final String key;

    FaultType(String key) {
        this.key = key;
    }

    @JsonValue
    public String getKey() {
        return key;
    }

    @JsonCreator
    public static FaultType fromKey(String key) {
        if (key == null) {
            return UNKNOWN;
        }
        return Arrays.stream(values())
                .filter(type -> type.key.equalsIgnoreCase(key) || type.name().equalsIgnoreCase(key))
                .findFirst()
                .orElse(UNKNOWN);
    }
}
