package com.z254.sentinel.responder.diagnosis;

import com.z254.sentinel.responder.domain.model.Diagnosis;
import com.z254.sentinel.responder.domain.model.Evidence;
import com.z254.sentinel.responder.domain.model.FaultType;
import com.z254.sentinel.responder.domain.model.FixProposal;
import com.z254.sentinel.responder.domain.model.Incident;
import com.z254.sentinel.responder.observability.ResponderMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Chooses between the reasoning engine and the rule-based strategy on every call.
 * <p>
 * Any failure of the reasoning engine (timeout, transport, malformed answer) is replaced by the
 * rule-based result with {@code llmError} recording what went wrong; errors never escape.
 */
@Slf4j
@Service
public class DiagnosisAdapter {

    private static final String COLLABORATOR = "reasoning-engine";

    private final DiagnosisStrategy primary;
    private final RuleBasedDiagnosisStrategy fallback;
    private final ResponderMetrics metrics;

    public DiagnosisAdapter(ReasoningEngineDiagnosisStrategy primary,
                            RuleBasedDiagnosisStrategy fallback,
                            ResponderMetrics metrics) {
        this.primary = primary;
        this.fallback = fallback;
        this.metrics = metrics;
    }

    public Mono<Diagnosis> diagnose(FaultType faultType, Evidence evidence) {
        if (!primary.isAvailable()) {
            return fallback.diagnose(faultType, evidence);
        }
        return primary.diagnose(faultType, evidence)
                .switchIfEmpty(Mono.error(new IllegalStateException("Empty diagnosis")))
                .onErrorResume(e -> {
                    recordFallback("diagnose", e);
                    return fallback.diagnose(faultType, evidence)
                            .map(diagnosis -> diagnosis.toBuilder().llmError(message(e)).build());
                });
    }

    public Mono<FixProposal> generateFix(FaultType faultType, Diagnosis diagnosis, Evidence evidence) {
        if (!primary.isAvailable()) {
            return fallback.generateFix(faultType, diagnosis, evidence);
        }
        return primary.generateFix(faultType, diagnosis, evidence)
                .switchIfEmpty(Mono.error(new IllegalStateException("Empty fix proposal")))
                .onErrorResume(e -> {
                    recordFallback("generateFix", e);
                    return fallback.generateFix(faultType, diagnosis, evidence)
                            .map(fix -> fix.toBuilder().llmError(message(e)).build());
                });
    }

    /**
     * Refine the incident's fix with feedback; falls back to appending the feedback text.
     */
    public Mono<FixProposal> refineFix(Incident incident, String feedback) {
        if (!primary.isAvailable()) {
            return fallback.refineFix(incident, feedback);
        }
        return primary.refineFix(incident, feedback)
                .switchIfEmpty(Mono.error(new IllegalStateException("Empty refinement")))
                .onErrorResume(e -> {
                    recordFallback("refineFix", e);
                    return fallback.refineFix(incident, feedback);
                });
    }

    public String activeStrategy() {
        return primary.isAvailable() ? primary.name() : fallback.name();
    }

    private void recordFallback(String operation, Throwable e) {
        metrics.recordFallback(COLLABORATOR);
        log.warn("Reasoning engine {} failed, using rule-based fallback: {}", operation, message(e));
    }

    private static String message(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
