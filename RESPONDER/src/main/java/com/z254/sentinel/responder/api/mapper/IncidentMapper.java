package com.z254.sentinel.responder.api.mapper;

import com.z254.sentinel.responder.api.dto.IncidentDto;
import com.z254.sentinel.responder.domain.model.Incident;

import java.time.Duration;

/**
 * Mapper for incident to DTO conversion.
 */
public final class IncidentMapper {

    private IncidentMapper() {}

    public static IncidentDto toDto(Incident incident) {
        Duration mttr = incident.timeToResolve();
        return IncidentDto.builder()
                .id(incident.getId())
                .title(incident.getTitle())
                .description(incident.getDescription())
                .serviceName(incident.getServiceName())
                .faultType(incident.getFaultType() != null ? incident.getFaultType().getKey() : null)
                .status(incident.getStatus().wireName())
                .impactSeverity(incident.getImpactSeverity() != null ? incident.getImpactSeverity().wireName() : null)
                .approvalSeverity(incident.getApprovalSeverity() != null ? incident.getApprovalSeverity().wireName() : null)
                .impactAnalysis(incident.getImpactAnalysis())
                .rootCause(incident.getRootCause())
                .diagnosis(incident.getDiagnosis())
                .proposedFix(incident.getProposedFix())
                .sandboxResult(incident.getSandboxResult())
                .safetyResult(incident.getSafetyResult())
                .confidenceScore(incident.getConfidenceScore())
                .autoResolved(incident.isAutoResolved())
                .evidence(incident.getEvidence() != null ? incident.getEvidence().toText() : null)
                .reportedBy(incident.getReportedBy())
                .assignedTo(incident.getAssignedTo())
                .clearedBy(incident.getClearedBy())
                .clearedAt(incident.getClearedAt())
                .detectedAt(incident.getDetectedAt())
                .updatedAt(incident.getUpdatedAt())
                .resolvedAt(incident.getResolvedAt())
                .mttrMs(mttr != null ? mttr.toMillis() : null)
                .build();
    }
}
