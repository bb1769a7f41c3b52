package com.z254.sentinel.responder.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Immutable record of a human action on an incident.
 */
@Value
@Builder
public class ApprovalRecord {
    String id;
    String incidentId;
    String actor;
    /** Null when the actor is not in the user directory */
    Role actorRole;
    ApprovalAction action;
    String comment;
    Instant createdAt;
}
