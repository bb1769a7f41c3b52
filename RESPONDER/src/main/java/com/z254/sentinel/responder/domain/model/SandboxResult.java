package com.z254.sentinel.responder.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SandboxResult {

    private boolean fixApplied;

    private boolean testPassed;

    private String output;

    private String error;

    /** True when the sandbox could not be used and a default was recorded */
    private boolean skipped;

    /**
     * Nothing to execute: treated as applied and passing.
     */
    public static SandboxResult noTestPayload() {
        return SandboxResult.builder()
                .fixApplied(true)
                .testPassed(true)
                .output("No test payload supplied")
                .skipped(true)
                .build();
    }

    /**
     * Sandbox unreachable: recorded conservatively so the fix is never auto-applied.
     */
    public static SandboxResult unavailable(String reason) {
        return SandboxResult.builder()
                .fixApplied(false)
                .testPassed(false)
                .error(reason)
                .skipped(true)
                .build();
    }
}
