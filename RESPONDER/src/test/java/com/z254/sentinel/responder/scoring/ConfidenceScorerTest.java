package com.z254.sentinel.responder.scoring;

import com.z254.sentinel.responder.domain.model.Diagnosis;
import com.z254.sentinel.responder.domain.model.Evidence;
import com.z254.sentinel.responder.domain.model.FixProposal;
import com.z254.sentinel.responder.domain.model.HumanDecision;
import com.z254.sentinel.responder.domain.model.ImpactSeverity;
import com.z254.sentinel.responder.domain.model.Incident;
import com.z254.sentinel.responder.domain.model.LearningRecord;
import com.z254.sentinel.responder.domain.model.SafetyResult;
import com.z254.sentinel.responder.domain.model.SandboxResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ConfidenceScorerTest {

    private LearningStore learningStore;
    private ConfidenceScorer scorer;

    @BeforeEach
    void setUp() {
        learningStore = new LearningStore();
        scorer = new ConfidenceScorer(learningStore);
    }

    @Nested
    @DisplayName("Score composition")
    class CompositionTests {

        @Test
        @DisplayName("verified crash restart scores exactly the auto-fix threshold")
        void crashRestartScore() {
            double score = scorer.score(crashDiagnosis(), passedSandbox(), safety(true, 1.0), ImpactSeverity.CRITICAL);

            assertThat(score).isEqualTo(0.85);
        }

        @Test
        @DisplayName("unavailable sandbox removes the verification bonus")
        void unavailableSandbox() {
            ConfidenceScorer.ScoreBreakdown breakdown = scorer.breakdown(crashDiagnosis(),
                    SandboxResult.unavailable("disabled"), safety(true, 1.0), ImpactSeverity.CRITICAL);

            assertThat(breakdown.getVerification()).isZero();
            assertThat(breakdown.getTotal()).isEqualTo(0.65);
        }

        @Test
        @DisplayName("file at fault adds evidence bonus")
        void fileAtFaultBonus() {
            Diagnosis diagnosis = Diagnosis.builder().category("config").fileAtFault("config.json").build();

            ConfidenceScorer.ScoreBreakdown breakdown =
                    scorer.breakdown(diagnosis, passedSandbox(), safety(true, 0.9), ImpactSeverity.MEDIUM);

            assertThat(breakdown.getEvidence()).isCloseTo(0.15, within(1e-9));
            assertThat(breakdown.getSeverityPenalty()).isEqualTo(-0.05);
            assertThat(breakdown.getTotal()).isEqualTo(0.99);
        }

        @Test
        @DisplayName("score is clamped to [0, 1]")
        void clamped() {
            Diagnosis diagnosis = Diagnosis.builder().category("config").fileAtFault("config.json").build();

            double high = scorer.score(diagnosis, passedSandbox(), safety(true, 1.0), ImpactSeverity.LOW);
            double low = scorer.score(null, null, null, ImpactSeverity.CRITICAL);

            assertThat(high).isEqualTo(1.0);
            assertThat(low).isBetween(0.0, 1.0);
            assertThat(low).isEqualTo(0.35);
        }

        @Test
        @DisplayName("unknown category earns no evidence bonus")
        void unknownCategory() {
            Diagnosis diagnosis = Diagnosis.builder().category("unknown").build();

            assertThat(scorer.breakdown(diagnosis, null, null, null).getEvidence()).isZero();
        }
    }

    @Nested
    @DisplayName("Learning adjustment")
    class LearningTests {

        @Test
        @DisplayName("no history means no adjustment")
        void noHistory() {
            assertThat(scorer.breakdown(crashDiagnosis(), null, null, null).getLearningAdjustment()).isZero();
        }

        @Test
        @DisplayName("shift is (approvalRate - 0.5) * 0.2")
        void shiftFromApprovalRate() {
            learningStore.append(record("crash", HumanDecision.APPROVED));
            learningStore.append(record("crash", HumanDecision.APPROVED));
            learningStore.append(record("crash", HumanDecision.APPROVED));
            learningStore.append(record("crash", HumanDecision.REJECTED));

            ConfidenceScorer.ScoreBreakdown breakdown = scorer.breakdown(crashDiagnosis(), null, null, null);

            assertThat(breakdown.getLearningAdjustment()).isCloseTo((0.75 - 0.5) * 0.2, within(1e-9));
        }

        @Test
        @DisplayName("rejections lower later scores for the same category only")
        void rejectionsLowerScore() {
            double before = scorer.score(crashDiagnosis(), passedSandbox(), safety(true, 1.0), ImpactSeverity.CRITICAL);
            learningStore.append(record("crash", HumanDecision.REJECTED));
            learningStore.append(record("config", HumanDecision.APPROVED));

            double after = scorer.score(crashDiagnosis(), passedSandbox(), safety(true, 1.0), ImpactSeverity.CRITICAL);

            assertThat(after).isCloseTo(before - 0.1, within(1e-9));
        }

        @Test
        @DisplayName("recordDecision captures category, fix and evidence")
        void recordDecision() {
            Incident incident = Incident.builder()
                    .id("inc-1")
                    .diagnosis(crashDiagnosis())
                    .proposedFix(FixProposal.builder().description("Restart").build())
                    .evidence(Evidence.builder().traceback("boom").build())
                    .build();

            LearningRecord record = scorer.recordDecision(incident, HumanDecision.MODIFIED);

            assertThat(record.getIncidentType()).isEqualTo("crash");
            assertThat(record.getFixPattern()).isEqualTo("Restart");
            assertThat(record.getErrorPattern()).contains("boom");
            assertThat(record.getConfidenceAdjustment()).isEqualTo(-0.05);
            assertThat(learningStore.all()).containsExactly(record);
        }
    }

    @Nested
    @DisplayName("Bounds")
    class BoundsTests {

        @ParameterizedTest
        @ValueSource(ints = {0, 2, 4})
        @DisplayName("every combination of inputs scores within [0, 1]")
        void alwaysWithinUnitInterval(int approvedOfFour) {
            for (int i = 0; i < 4; i++) {
                learningStore.append(record("config",
                        i < approvedOfFour ? HumanDecision.APPROVED : HumanDecision.REJECTED));
            }
            List<Diagnosis> diagnoses = Arrays.asList(null,
                    Diagnosis.builder().category("unknown").build(),
                    Diagnosis.builder().category("config").build(),
                    Diagnosis.builder().category("config").fileAtFault("config.json").build());
            List<SandboxResult> sandboxes = Arrays.asList(null,
                    SandboxResult.unavailable("disabled"),
                    SandboxResult.builder().fixApplied(true).build(),
                    SandboxResult.builder().testPassed(true).build(),
                    passedSandbox());
            List<SafetyResult> safeties = Arrays.asList(null,
                    safety(true, 1.0), safety(true, 0.2), safety(false, 0.0), safety(true, 1.7),
                    safety(false, -0.5), safety(true, Double.NaN));
            List<ImpactSeverity> severities = new ArrayList<>(Arrays.asList(ImpactSeverity.values()));
            severities.add(null);

            for (Diagnosis diagnosis : diagnoses) {
                for (SandboxResult sandbox : sandboxes) {
                    for (SafetyResult safety : safeties) {
                        for (ImpactSeverity severity : severities) {
                            double score = scorer.score(diagnosis, sandbox, safety, severity);
                            assertThat(score)
                                    .as("%s / %s / %s / %s", diagnosis, sandbox, safety, severity)
                                    .isBetween(0.0, 1.0);
                        }
                    }
                }
            }
        }
    }

    private static Diagnosis crashDiagnosis() {
        return Diagnosis.builder().category("crash").rootCause("process killed").build();
    }

    private static SandboxResult passedSandbox() {
        return SandboxResult.builder().fixApplied(true).testPassed(true).build();
    }

    private static SafetyResult safety(boolean passed, double score) {
        return SafetyResult.builder().passed(passed).score(score).build();
    }

    static LearningRecord record(String category, HumanDecision decision) {
        return LearningRecord.builder()
                .id(category + "-" + decision)
                .incidentType(category)
                .humanDecision(decision)
                .build();
    }
}
