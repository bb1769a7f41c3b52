package com.z254.sentinel.responder.domain.exception;

public class IncidentNotFoundException extends IncidentValidationException {

    private final String incidentId;

    public IncidentNotFoundException(String incidentId) {
        super("Incident not found: " + incidentId);
        this.incidentId = incidentId;
    }

    public String getIncidentId() {
        return incidentId;
    }
}
