package com.z254.sentinel.responder.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Append-only audit trail entry.
 */
@Value
@Builder
public class ActivityLogEntry {
    long id;
    /** Null for service-wide entries such as agent start/stop */
    String incidentId;
    String actor;
    String action;
    String detail;
    Instant createdAt;
}
