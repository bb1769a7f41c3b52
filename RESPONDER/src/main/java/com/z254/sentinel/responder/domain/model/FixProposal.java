package com.z254.sentinel.responder.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Candidate remediation for an incident.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class FixProposal {

    private String description;

    private String diff;

    /** Executable fix payload for the sandbox */
    private String fixCode;

    /** Test payload verifying the fix in the sandbox */
    private String testCode;

    @Builder.Default
    private RiskLevel riskLevel = RiskLevel.MEDIUM;

    private String source;

    private String llmError;

    /**
     * Text the safety gate inspects: description, diff and executable fix together.
     */
    public String safetyText() {
        StringBuilder sb = new StringBuilder();
        if (description != null) {
            sb.append(description).append('\n');
        }
        if (diff != null) {
            sb.append(diff).append('\n');
        }
        if (fixCode != null) {
            sb.append(fixCode);
        }
        return sb.toString();
    }

    public boolean hasTest() {
        return testCode != null && !testCode.isBlank();
    }

    /**
     * Fix proposal entered verbatim by an engineer on override.
     */
    public static FixProposal manual(String text, String author) {
        return FixProposal.builder()
                .description(text)
                .fixCode(text)
                .riskLevel(RiskLevel.MEDIUM)
                .source("override:" + author)
                .build();
    }
}
