package com.z254.sentinel.responder.domain.exception;

/**
 * Base class for responder failures.
 */
public class ResponderException extends RuntimeException {

    public ResponderException(String message) {
        super(message);
    }

    public ResponderException(String message, Throwable cause) {
        super(message, cause);
    }
}
