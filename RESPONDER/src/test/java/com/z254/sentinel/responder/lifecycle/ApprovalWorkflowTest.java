package com.z254.sentinel.responder.lifecycle;

import com.fasterxml.jackson.databind.JsonNode;
import com.z254.sentinel.responder.broadcast.BroadcastEventType;
import com.z254.sentinel.responder.client.MonitoredServiceClient;
import com.z254.sentinel.responder.client.SandboxClient;
import com.z254.sentinel.responder.domain.exception.AuthorizationException;
import com.z254.sentinel.responder.domain.exception.IncidentNotFoundException;
import com.z254.sentinel.responder.domain.exception.IncidentValidationException;
import com.z254.sentinel.responder.domain.exception.InvariantViolationException;
import com.z254.sentinel.responder.domain.model.ApprovalAction;
import com.z254.sentinel.responder.domain.model.ApprovalRecord;
import com.z254.sentinel.responder.domain.model.ApprovalSeverity;
import com.z254.sentinel.responder.domain.model.Comment;
import com.z254.sentinel.responder.domain.model.Diagnosis;
import com.z254.sentinel.responder.domain.model.FaultType;
import com.z254.sentinel.responder.domain.model.FixProposal;
import com.z254.sentinel.responder.domain.model.HealthSignal;
import com.z254.sentinel.responder.domain.model.HumanDecision;
import com.z254.sentinel.responder.domain.model.Incident;
import com.z254.sentinel.responder.domain.model.IncidentStatus;
import com.z254.sentinel.responder.domain.model.LearningRecord;
import com.z254.sentinel.responder.domain.model.Role;
import com.z254.sentinel.responder.support.RecordingObserverChannel;
import com.z254.sentinel.responder.support.ResponderFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ApprovalWorkflowTest {

    private static final String INCIDENT_ID = "a1b2c3d4";

    @Mock
    private MonitoredServiceClient monitoredService;

    @Mock
    private SandboxClient sandbox;

    private ResponderFixture fixture;
    private ApprovalWorkflow workflow;

    @BeforeEach
    void setUp() {
        fixture = new ResponderFixture(monitoredService, sandbox);
        workflow = fixture.workflow;
        seedIncident(IncidentStatus.AWAITING_APPROVAL);
    }

    @Nested
    @DisplayName("Authorization")
    class AuthorizationTests {

        @Test
        @DisplayName("junior developer cannot approve a blocker incident")
        void juniorCannotApproveBlocker() {
            assertThatThrownBy(() -> workflow.submitAction(INCIDENT_ID, "alice", ApprovalAction.APPROVE, null))
                    .isInstanceOf(AuthorizationException.class)
                    .satisfies(e -> assertThat(((AuthorizationException) e).getRequiredRole())
                            .isEqualTo(Role.ENGINEERING_MANAGER));

            assertThat(incident().getStatus()).isEqualTo(IncidentStatus.AWAITING_APPROVAL);
            assertThat(workflow.approvals(INCIDENT_ID)).isEmpty();
            assertThat(fixture.meterRegistry.get("responder.actions.denied").counter().count()).isEqualTo(1.0);
            verifyNoInteractions(monitoredService);
        }

        @Test
        @DisplayName("unknown user cannot override")
        void unknownUserCannotOverride() {
            assertThatThrownBy(() -> workflow.submitAction(INCIDENT_ID, "mallory", ApprovalAction.OVERRIDE, "restart"))
                    .isInstanceOf(AuthorizationException.class);
            assertThat(incident().getProposedFix().getSource()).isEqualTo("rule-based");
        }

        @Test
        @DisplayName("senior developer can approve a medium severity incident")
        void seniorApprovesMedium() {
            incident().setApprovalSeverity(ApprovalSeverity.MEDIUM);
            stubHealthyRecovery();

            ActionOutcome outcome = workflow.submitAction(INCIDENT_ID, "bob", ApprovalAction.APPROVE, null);

            assertThat(outcome.getStatus()).isEqualTo(IncidentStatus.DEPLOYING);
        }

        @Test
        @DisplayName("anyone may reject")
        void anyoneMayReject() {
            ActionOutcome outcome = workflow.submitAction(INCIDENT_ID, "alice", ApprovalAction.REJECT, "false alarm");

            assertThat(outcome.getStatus()).isEqualTo(IncidentStatus.REJECTED);
        }
    }

    @Nested
    @DisplayName("Approve")
    class ApproveTests {

        @Test
        @DisplayName("approval deploys, verifies and resolves without marking auto-resolved")
        void approveResolves() {
            RecordingObserverChannel eve = new RecordingObserverChannel("eve");
            fixture.broadcaster.connect(eve);
            stubHealthyRecovery();

            ActionOutcome outcome = workflow.submitAction(INCIDENT_ID, "dave", ApprovalAction.APPROVE, "ship it");

            assertThat(outcome.getStatus()).isEqualTo(IncidentStatus.DEPLOYING);
            Incident incident = incident();
            assertThat(incident.getStatus()).isEqualTo(IncidentStatus.RESOLVED);
            assertThat(incident.isAutoResolved()).isFalse();
            assertThat(incident.getResolvedAt()).isNotNull();
            assertThat(incident.getClearedBy()).isEqualTo("dave");
            assertThat(fixture.dedupGuard.isHeld(INCIDENT_ID)).isFalse();

            List<ApprovalRecord> records = workflow.approvals(INCIDENT_ID);
            assertThat(records).hasSize(1);
            assertThat(records.get(0).getActorRole()).isEqualTo(Role.ENGINEERING_MANAGER);
            assertThat(fixture.learningStore.all())
                    .extracting(LearningRecord::getHumanDecision)
                    .containsExactly(HumanDecision.APPROVED);

            List<JsonNode> reports = eve.events(BroadcastEventType.CLEARANCE_REPORT);
            assertThat(reports).hasSize(1);
            assertThat(reports.get(0).get("clearedBy").asText()).isEqualTo("dave");
            assertThat(fixture.activityActions(INCIDENT_ID))
                    .containsSubsequence("approved", "clearance_report", "deploying", "resolved");
            verify(monitoredService).recover(FaultType.BAD_CONFIG);
            verify(monitoredService).restart();
        }

        @Test
        @DisplayName("approving an incident without a proposed fix is invalid")
        void approveWhileDetected() {
            seedIncident(IncidentStatus.DETECTED);

            assertThatThrownBy(() -> workflow.submitAction(INCIDENT_ID, "dave", ApprovalAction.APPROVE, null))
                    .isInstanceOf(IncidentValidationException.class)
                    .hasMessageContaining("while it is detected");
            assertThat(workflow.approvals(INCIDENT_ID)).isEmpty();
        }

        @Test
        @DisplayName("resolved incidents accept no further actions")
        void terminalIncident() {
            incident().applyStatus(IncidentStatus.RESOLVED, Instant.now());

            assertThatThrownBy(() -> workflow.submitAction(INCIDENT_ID, "eve", ApprovalAction.APPROVE, null))
                    .isInstanceOf(InvariantViolationException.class);
            assertThatThrownBy(() -> workflow.submitAction(INCIDENT_ID, "eve", ApprovalAction.REJECT, null))
                    .isInstanceOf(InvariantViolationException.class);
        }

        @Test
        @DisplayName("unknown incident is reported as not found")
        void unknownIncident() {
            assertThatThrownBy(() -> workflow.submitAction("missing", "eve", ApprovalAction.APPROVE, null))
                    .isInstanceOf(IncidentNotFoundException.class);
        }

        @Test
        @DisplayName("blank actor is rejected before any lookup")
        void blankActor() {
            assertThatThrownBy(() -> workflow.submitAction(INCIDENT_ID, " ", ApprovalAction.APPROVE, null))
                    .isInstanceOf(IncidentValidationException.class);
        }
    }

    @Nested
    @DisplayName("Override, reject and request changes")
    class OtherActionTests {

        @Test
        @DisplayName("override replaces the fix with the engineer's text and deploys it")
        void overrideDeploysManualFix() {
            stubHealthyRecovery();

            workflow.submitAction(INCIDENT_ID, "eve", ApprovalAction.OVERRIDE, "Restore config.json from backup");

            Incident incident = incident();
            assertThat(incident.getProposedFix().getDescription()).isEqualTo("Restore config.json from backup");
            assertThat(incident.getProposedFix().getSource()).isEqualTo("override:eve");
            assertThat(incident.getStatus()).isEqualTo(IncidentStatus.RESOLVED);
            assertThat(fixture.learningStore.all())
                    .extracting(LearningRecord::getHumanDecision)
                    .containsExactly(HumanDecision.MODIFIED);
        }

        @Test
        @DisplayName("override without replacement text is invalid")
        void overrideNeedsText() {
            assertThatThrownBy(() -> workflow.submitAction(INCIDENT_ID, "eve", ApprovalAction.OVERRIDE, ""))
                    .isInstanceOf(IncidentValidationException.class);
        }

        @Test
        @DisplayName("reject frees the dedup key and records the decision")
        void rejectReleasesDedup() {
            assertThat(fixture.dedupGuard.isHeld(INCIDENT_ID)).isTrue();

            workflow.submitAction(INCIDENT_ID, "carol", ApprovalAction.REJECT, null);

            assertThat(incident().getStatus()).isEqualTo(IncidentStatus.REJECTED);
            assertThat(fixture.dedupGuard.isHeld(INCIDENT_ID)).isFalse();
            assertThat(fixture.learningStore.all())
                    .extracting(LearningRecord::getHumanDecision)
                    .containsExactly(HumanDecision.REJECTED);
            assertThat(fixture.meterRegistry.get("responder.incidents.rejected").counter().count()).isEqualTo(1.0);
            verify(monitoredService, never()).recover(any());
        }

        @Test
        @DisplayName("request changes refines the fix and returns to fix_proposed")
        void requestChangesRefines() {
            ActionOutcome outcome = workflow.submitAction(INCIDENT_ID, "bob", ApprovalAction.REQUEST_CHANGES,
                    "add a backup step first");

            assertThat(outcome.getStatus()).isEqualTo(IncidentStatus.FIX_PROPOSED);
            assertThat(incident().getProposedFix().getDescription())
                    .startsWith("Restore config.json")
                    .endsWith("Updated per engineer feedback: add a backup step first");
            assertThat(fixture.activityActions(INCIDENT_ID)).containsSubsequence("changes_requested", "fix_refined");
            assertThat(fixture.dedupGuard.isHeld(INCIDENT_ID)).isTrue();
        }

        @Test
        @DisplayName("request changes needs feedback")
        void requestChangesNeedsFeedback() {
            assertThatThrownBy(() -> workflow.submitAction(INCIDENT_ID, "bob", ApprovalAction.REQUEST_CHANGES, null))
                    .isInstanceOf(IncidentValidationException.class);
            assertThat(incident().getStatus()).isEqualTo(IncidentStatus.AWAITING_APPROVAL);
        }
    }

    @Nested
    @DisplayName("Comments")
    class CommentTests {

        @Test
        @DisplayName("comment is stored and broadcast without touching status")
        void addComment() {
            RecordingObserverChannel observer = new RecordingObserverChannel("carol");
            fixture.broadcaster.connect(observer);

            Comment comment = workflow.addComment(INCIDENT_ID, "alice", "Looks like the deploy at 14:02");

            assertThat(workflow.comments(INCIDENT_ID)).containsExactly(comment);
            assertThat(observer.events(BroadcastEventType.NEW_COMMENT))
                    .extracting(node -> node.get("content").asText())
                    .containsExactly("Looks like the deploy at 14:02");
            assertThat(incident().getStatus()).isEqualTo(IncidentStatus.AWAITING_APPROVAL);
        }

        @Test
        @DisplayName("empty comment and unknown incident are rejected")
        void invalidComments() {
            assertThatThrownBy(() -> workflow.addComment(INCIDENT_ID, "alice", " "))
                    .isInstanceOf(IncidentValidationException.class);
            assertThatThrownBy(() -> workflow.addComment("missing", "alice", "hello"))
                    .isInstanceOf(IncidentNotFoundException.class);
        }
    }

    private void stubHealthyRecovery() {
        when(monitoredService.recover(any())).thenReturn(Mono.empty());
        when(monitoredService.restart()).thenReturn(Mono.empty());
        when(monitoredService.checkHealth()).thenReturn(Mono.just(HealthSignal.healthy(12)));
    }

    private void seedIncident(IncidentStatus status) {
        HealthSignal signal = HealthSignal.builder()
                .healthy(false)
                .errorType("ConfigParseError")
                .error("Invalid config.json")
                .build();
        Incident incident = fixture.factory.create(INCIDENT_ID, FaultType.BAD_CONFIG, signal);
        incident.applyStatus(status, Instant.now());
        incident.setDiagnosis(Diagnosis.builder().category("config").fileAtFault("config.json").build());
        incident.setRootCause("config.json contains invalid JSON");
        incident.setProposedFix(FixProposal.builder()
                .description("Restore config.json with valid JSON")
                .source("rule-based")
                .build());
        incident.setConfidenceScore(0.7);
        fixture.incidents.save(incident);
        fixture.dedupGuard.releaseIncident(INCIDENT_ID);
        fixture.dedupGuard.tryClaim(FaultType.BAD_CONFIG, INCIDENT_ID);
    }

    private Incident incident() {
        return fixture.incidents.findById(INCIDENT_ID).orElseThrow();
    }
}
