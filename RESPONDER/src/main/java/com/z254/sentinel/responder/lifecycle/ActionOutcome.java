package com.z254.sentinel.responder.lifecycle;

import com.z254.sentinel.responder.domain.model.IncidentStatus;
import lombok.Value;

/**
 * Result of an accepted human action: the incident's status once the action took effect.
 */
@Value
public class ActionOutcome {
    String incidentId;
    IncidentStatus status;
    /** Confidence the deploy, if any, was decided on */
    Double confidence;
}
