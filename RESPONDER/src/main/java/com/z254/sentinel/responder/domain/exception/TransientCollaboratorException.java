package com.z254.sentinel.responder.domain.exception;

/**
 * A collaborator call timed out or failed in transport. Adapters replace it with a fallback.
 */
public class TransientCollaboratorException extends ResponderException {

    private final String collaborator;

    public TransientCollaboratorException(String collaborator, String message, Throwable cause) {
        super(collaborator + ": " + message, cause);
        this.collaborator = collaborator;
    }

    public TransientCollaboratorException(String collaborator, String message) {
        super(collaborator + ": " + message);
        this.collaborator = collaborator;
    }

    public String getCollaborator() {
        return collaborator;
    }
}
