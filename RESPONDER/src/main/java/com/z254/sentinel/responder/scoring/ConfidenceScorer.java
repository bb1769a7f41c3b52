package com.z254.sentinel.responder.scoring;

import com.z254.sentinel.responder.domain.model.Diagnosis;
import com.z254.sentinel.responder.domain.model.HumanDecision;
import com.z254.sentinel.responder.domain.model.ImpactSeverity;
import com.z254.sentinel.responder.domain.model.Incident;
import com.z254.sentinel.responder.domain.model.LearningRecord;
import com.z254.sentinel.responder.domain.model.SafetyResult;
import com.z254.sentinel.responder.domain.model.SandboxResult;
import lombok.Builder;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.UUID;

/**
 * Confidence that a proposed fix is right, in [0, 1].
 * <p>
 * Starts at 0.5, adds evidence-quality and verification bonuses, subtracts the incident's
 * severity penalty and shifts by {@code (approvalRate - 0.5) * 0.2} when past decisions for the
 * same diagnosis category exist.
 */
@Slf4j
@Component
public class ConfidenceScorer {

    static final double BASE = 0.5;
    static final double KNOWN_CATEGORY_BONUS = 0.10;
    static final double FILE_AT_FAULT_BONUS = 0.05;
    static final double TEST_PASSED_BONUS = 0.15;
    static final double FIX_APPLIED_BONUS = 0.05;
    static final double SAFETY_PASSED_BONUS = 0.10;
    static final double SAFETY_SCORE_WEIGHT = 0.10;
    static final double LEARNING_WEIGHT = 0.2;

    private final LearningStore learningStore;

    public ConfidenceScorer(LearningStore learningStore) {
        this.learningStore = learningStore;
    }

    public double score(Diagnosis diagnosis, SandboxResult sandbox, SafetyResult safety, ImpactSeverity severity) {
        return breakdown(diagnosis, sandbox, safety, severity).getTotal();
    }

    public ScoreBreakdown breakdown(Diagnosis diagnosis, SandboxResult sandbox, SafetyResult safety,
                                    ImpactSeverity severity) {
        double evidence = 0.0;
        if (diagnosis != null && diagnosis.hasKnownCategory()) {
            evidence += KNOWN_CATEGORY_BONUS;
        }
        if (diagnosis != null && diagnosis.hasFileAtFault()) {
            evidence += FILE_AT_FAULT_BONUS;
        }

        double verification = 0.0;
        if (sandbox != null && sandbox.isTestPassed()) {
            verification += TEST_PASSED_BONUS;
        }
        if (sandbox != null && sandbox.isFixApplied()) {
            verification += FIX_APPLIED_BONUS;
        }

        double safetyTerm = 0.0;
        if (safety != null) {
            if (safety.isPassed()) {
                safetyTerm += SAFETY_PASSED_BONUS;
            }
            safetyTerm += SAFETY_SCORE_WEIGHT * clamp(safety.getScore());
        }

        double severityPenalty = severity != null ? severity.getConfidencePenalty() : 0.0;

        String category = diagnosis != null && diagnosis.getCategory() != null ? diagnosis.getCategory() : "unknown";
        double learning = learningStore.approvalRate(category)
                .map(rate -> (rate - 0.5) * LEARNING_WEIGHT)
                .orElse(0.0);

        double total = round(clamp(BASE + evidence + verification + safetyTerm + severityPenalty + learning));

        return ScoreBreakdown.builder()
                .base(BASE)
                .evidence(evidence)
                .verification(verification)
                .safety(safetyTerm)
                .severityPenalty(severityPenalty)
                .learningAdjustment(learning)
                .total(total)
                .build();
    }

    /**
     * Capture a human decision on {@code incident} so later scores for the same category shift.
     */
    public LearningRecord recordDecision(Incident incident, HumanDecision decision) {
        Diagnosis diagnosis = incident.getDiagnosis();
        String category = diagnosis != null && diagnosis.getCategory() != null ? diagnosis.getCategory() : "unknown";
        String evidenceText = incident.getEvidence() != null ? incident.getEvidence().toText() : "";
        String fixPattern = incident.getProposedFix() != null && incident.getProposedFix().getDescription() != null
                ? incident.getProposedFix().getDescription() : "";

        LearningRecord record = LearningRecord.builder()
                .id(UUID.randomUUID().toString())
                .incidentType(category)
                .errorPattern(LearningStore.errorPattern(evidenceText))
                .fixPattern(fixPattern)
                .humanDecision(decision)
                .confidenceAdjustment(decision.getConfidenceAdjustment())
                .createdAt(Instant.now())
                .build();
        log.info("Recorded {} decision for category {}", decision.wireName(), category);
        return learningStore.append(record);
    }

    // Six decimals absorbs summation drift so threshold comparisons are stable.
    private static double round(double value) {
        return Math.round(value * 1_000_000.0) / 1_000_000.0;
    }

    private static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }

    /**
     * Individual terms of a confidence score.
     */
    @Value
    @Builder
    public static class ScoreBreakdown {
        double base;
        double evidence;
        double verification;
        double safety;
        double severityPenalty;
        double learningAdjustment;
        double total;
    }
}
