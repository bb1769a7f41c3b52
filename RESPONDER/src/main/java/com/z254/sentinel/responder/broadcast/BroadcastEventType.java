package com.z254.sentinel.responder.broadcast;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Event types pushed to observers.
 */
public enum BroadcastEventType {
    HEALTH_UPDATE,
    INCIDENT_NEW,
    INCIDENT_UPDATE,
    VOICE_ALERT,
    ACTIVITY,
    PRESENCE,
    USER_TYPING,
    AGENT_STATUS,
    NEW_COMMENT,
    CLEARANCE_REPORT,
    PONG,
    ERROR;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
