package com.z254.sentinel.responder.api.dto;

import com.z254.sentinel.responder.domain.model.Diagnosis;
import com.z254.sentinel.responder.domain.model.FixProposal;
import com.z254.sentinel.responder.domain.model.SafetyResult;
import com.z254.sentinel.responder.domain.model.SandboxResult;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * DTO for incident representation in API responses.
 */
@Data
@Builder
public class IncidentDto {
    private String id;
    private String title;
    private String description;
    private String serviceName;
    private String faultType;
    private String status;
    private String impactSeverity;
    private String approvalSeverity;
    private String impactAnalysis;
    private String rootCause;
    private Diagnosis diagnosis;
    private FixProposal proposedFix;
    private SandboxResult sandboxResult;
    private SafetyResult safetyResult;
    private Double confidenceScore;
    private boolean autoResolved;
    private String evidence;
    private String reportedBy;
    private String assignedTo;
    private String clearedBy;
    private Instant clearedAt;
    private Instant detectedAt;
    private Instant updatedAt;
    private Instant resolvedAt;
    private Long mttrMs;
}
