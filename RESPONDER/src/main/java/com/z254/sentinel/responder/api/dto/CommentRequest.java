package com.z254.sentinel.responder.api.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class CommentRequest {
    @NotBlank
    private String author;
    @NotBlank
    private String content;
}
