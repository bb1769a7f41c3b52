package com.z254.sentinel.responder.api.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

/**
 * A human action on an incident. {@code comment} carries the replacement fix for {@code override}
 * and the feedback for {@code request_changes}.
 */
@Data
public class ActionRequest {
    @NotBlank
    private String actor;
    @NotBlank
    private String action;
    private String comment;
}
