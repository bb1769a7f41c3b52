package com.z254.sentinel.responder.api.dto;

import lombok.Builder;
import lombok.Data;

/**
 * Outcome of a human action: the new status on success, or the error and, for authorization
 * failures, the minimum role required.
 */
@Data
@Builder
public class ActionResponse {
    private String incidentId;
    private String status;
    private String error;
    private String requiredRole;
}
