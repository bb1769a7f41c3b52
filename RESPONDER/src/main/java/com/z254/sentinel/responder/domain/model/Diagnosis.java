package com.z254.sentinel.responder.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Root-cause diagnosis produced by a diagnosis strategy.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Diagnosis {

    /** Diagnosis category: crash, config, bug, performance or unknown */
    private String category;

    private String rootCause;

    private String fileAtFault;

    private String lineNumber;

    private String explanation;

    /** Strategy that produced this diagnosis */
    private String source;

    /** Reasoning-engine failure that forced the rule-based fallback, if any */
    private String llmError;

    public boolean hasKnownCategory() {
        return category != null && !category.isBlank() && !"unknown".equalsIgnoreCase(category);
    }

    public boolean hasFileAtFault() {
        return fileAtFault != null && !fileAtFault.isBlank();
    }
}
