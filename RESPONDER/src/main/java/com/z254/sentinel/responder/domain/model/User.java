package com.z254.sentinel.responder.domain.model;

import lombok.Value;

@Value
public class User {
    String name;
    Role role;
    /** Receives clearance reports */
    boolean finalAuthority;
}
