package com.z254.sentinel.responder.domain.exception;

/**
 * Fix applied but the service never came back healthy.
 */
public class RetryExhaustedException extends ResponderException {

    private final int attempts;
    private final String lastError;

    public RetryExhaustedException(int attempts, String lastError) {
        super("Fix applied but still unhealthy after " + attempts + " attempts: " + lastError);
        this.attempts = attempts;
        this.lastError = lastError;
    }

    public int getAttempts() {
        return attempts;
    }

    public String getLastError() {
        return lastError;
    }
}
