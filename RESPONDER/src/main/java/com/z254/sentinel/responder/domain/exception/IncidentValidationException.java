package com.z254.sentinel.responder.domain.exception;

/**
 * Malformed or inapplicable human action. Nothing is mutated.
 */
public class IncidentValidationException extends ResponderException {

    public IncidentValidationException(String message) {
        super(message);
    }
}
