package com.z254.sentinel.responder.domain.exception;

import com.z254.sentinel.responder.domain.model.Role;

/**
 * Actor lacks the role needed for the action. The message names the minimum role.
 */
public class AuthorizationException extends ResponderException {

    private final Role requiredRole;

    public AuthorizationException(String actor, Role requiredRole) {
        super("User '" + actor + "' is not allowed to perform this action; requires at least "
                + requiredRole.wireName());
        this.requiredRole = requiredRole;
    }

    public Role getRequiredRole() {
        return requiredRole;
    }
}
