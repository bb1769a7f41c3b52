package com.z254.sentinel.responder.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class Comment {
    String id;
    String incidentId;
    String author;
    String content;
    Instant createdAt;
}
