package com.z254.sentinel.responder.domain.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.sentinel.responder.domain.model.Incident;

/**
 * Deep copies through the JSON tree, so stored incidents never share state with callers.
 */
final class IncidentCopies {

    private IncidentCopies() {
    }

    static Incident copy(ObjectMapper objectMapper, Incident incident) {
        try {
            return objectMapper.treeToValue(objectMapper.valueToTree(incident), Incident.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to copy incident " + incident.getId(), e);
        }
    }
}
