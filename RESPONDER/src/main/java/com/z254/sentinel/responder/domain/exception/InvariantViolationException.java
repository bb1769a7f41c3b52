package com.z254.sentinel.responder.domain.exception;

/**
 * Attempted an illegal transition, such as leaving a terminal state.
 */
public class InvariantViolationException extends ResponderException {

    public InvariantViolationException(String message) {
        super(message);
    }
}
