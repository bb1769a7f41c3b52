package com.z254.sentinel.responder.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * One human decision captured for future confidence scoring.
 */
@Value
@Builder
public class LearningRecord {
    String id;
    /** Diagnosis category the decision applies to */
    String incidentType;
    /** Leading slice of the evidence text */
    String errorPattern;
    String fixPattern;
    HumanDecision humanDecision;
    double confidenceAdjustment;
    Instant createdAt;
}
