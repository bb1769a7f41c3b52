package com.z254.sentinel.responder.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Duration;
import java.time.Instant;

/**
 * Incident raised for one detected fault of the monitored service.
 * <p>
 * {@code status} and {@code resolvedAt} have no setters: they change only through
 * {@link #applyStatus(IncidentStatus, Instant)}, which the lifecycle state machine owns.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Incident {

    /** Unique incident identifier */
    private String id;

    /** Service the incident was raised against */
    private String serviceName;

    /** Classifier key, also the dedup guard key */
    private FaultType faultType;

    private String title;

    private String description;

    /** Human-readable blast radius */
    private String impactAnalysis;

    private ImpactSeverity impactSeverity;

    private ApprovalSeverity approvalSeverity;

    /** Current lifecycle status */
    @Setter(AccessLevel.NONE)
    @Builder.Default
    private IncidentStatus status = IncidentStatus.DETECTED;

    private Evidence evidence;

    private String rootCause;

    private Diagnosis diagnosis;

    private FixProposal proposedFix;

    private SandboxResult sandboxResult;

    /** Confidence in [0, 1]; null until scored */
    private Double confidenceScore;

    private SafetyResult safetyResult;

    /** True when resolved without a human decision */
    private boolean autoResolved;

    private String reportedBy;

    private String assignedTo;

    /** Final-authority user the clearance report went to */
    private String clearedBy;

    private Instant clearedAt;

    private Instant detectedAt;

    private Instant updatedAt;

    @Setter(AccessLevel.NONE)
    private Instant resolvedAt;

    /**
     * Move to {@code target}, keeping {@code resolvedAt} set exactly when resolved.
     */
    public void applyStatus(IncidentStatus target, Instant at) {
        this.status = target;
        this.updatedAt = at;
        this.resolvedAt = target == IncidentStatus.RESOLVED ? at : null;
    }

    @JsonIgnore
    public boolean isTerminal() {
        return status.isTerminal();
    }

    /**
     * Time to resolution, or null while the incident is open.
     */
    public Duration timeToResolve() {
        if (resolvedAt == null || detectedAt == null) {
            return null;
        }
        return Duration.between(detectedAt, resolvedAt);
    }
}
