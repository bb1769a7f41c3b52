package com.z254.sentinel.responder.api.v1;

import com.z254.sentinel.responder.api.dto.ActionRequest;
import com.z254.sentinel.responder.domain.exception.AuthorizationException;
import com.z254.sentinel.responder.domain.exception.IncidentNotFoundException;
import com.z254.sentinel.responder.domain.exception.InvariantViolationException;
import com.z254.sentinel.responder.domain.model.ApprovalAction;
import com.z254.sentinel.responder.domain.model.FaultType;
import com.z254.sentinel.responder.domain.model.Incident;
import com.z254.sentinel.responder.domain.model.IncidentStatus;
import com.z254.sentinel.responder.domain.model.Role;
import com.z254.sentinel.responder.domain.repository.IncidentRepository;
import com.z254.sentinel.responder.domain.service.ActivityLogService;
import com.z254.sentinel.responder.lifecycle.ActionOutcome;
import com.z254.sentinel.responder.lifecycle.ApprovalWorkflow;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Web layer tests for {@link IncidentController}.
 */
@ExtendWith(MockitoExtension.class)
class IncidentControllerTest {

    @Mock
    private IncidentRepository incidentRepository;

    @Mock
    private ApprovalWorkflow approvalWorkflow;

    @Mock
    private ActivityLogService activityLog;

    private WebTestClient webTestClient;

    @BeforeEach
    void setUp() {
        webTestClient = WebTestClient.bindToController(
                new IncidentController(incidentRepository, approvalWorkflow, activityLog)).build();
    }

    @Nested
    @DisplayName("GET /api/v1/incidents")
    class QueryTests {

        @Test
        @DisplayName("should filter by wire status and page results")
        void listFiltered() {
            Incident waiting = incident("inc-1", FaultType.BAD_CONFIG);
            waiting.applyStatus(IncidentStatus.AWAITING_APPROVAL, Instant.now());
            Incident fresh = incident("inc-2", FaultType.SLOW);
            when(incidentRepository.findAll()).thenReturn(List.of(waiting, fresh));

            webTestClient.get()
                    .uri("/api/v1/incidents?status=awaiting_approval")
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.total").isEqualTo(1)
                    .jsonPath("$.incidents[0].id").isEqualTo("inc-1")
                    .jsonPath("$.incidents[0].faultType").isEqualTo("bad_config")
                    .jsonPath("$.incidents[0].status").isEqualTo("awaiting_approval");
        }

        @Test
        @DisplayName("should reject an unknown status filter")
        void unknownStatus() {
            webTestClient.get()
                    .uri("/api/v1/incidents?status=sleeping")
                    .exchange()
                    .expectStatus().isBadRequest();
        }

        @Test
        @DisplayName("should return 404 for a missing incident")
        void missing() {
            when(incidentRepository.findById("nope")).thenReturn(Optional.empty());

            webTestClient.get()
                    .uri("/api/v1/incidents/nope")
                    .exchange()
                    .expectStatus().isNotFound();
        }
    }

    @Nested
    @DisplayName("POST /api/v1/incidents/{id}/actions")
    class ActionTests {

        @Test
        @DisplayName("should return the new status on approval")
        void approve() {
            when(approvalWorkflow.submitAction("inc-1", "dave", ApprovalAction.APPROVE, null))
                    .thenReturn(new ActionOutcome("inc-1", IncidentStatus.DEPLOYING, 0.7));

            post("inc-1", request("dave", "approve", null))
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.incidentId").isEqualTo("inc-1")
                    .jsonPath("$.status").isEqualTo("deploying");
        }

        @Test
        @DisplayName("should return 403 with the required role when the actor lacks authority")
        void forbidden() {
            when(approvalWorkflow.submitAction(eq("inc-1"), eq("alice"), eq(ApprovalAction.APPROVE), isNull()))
                    .thenThrow(new AuthorizationException("alice", Role.ENGINEERING_MANAGER));

            post("inc-1", request("alice", "approve", null))
                    .expectStatus().isForbidden()
                    .expectBody()
                    .jsonPath("$.requiredRole").isEqualTo("engineering_manager")
                    .jsonPath("$.error").value(message ->
                            assertThat((String) message).contains("engineering_manager"));
        }

        @Test
        @DisplayName("should return 404 for an unknown incident")
        void notFound() {
            when(approvalWorkflow.submitAction(anyString(), anyString(), any(), any()))
                    .thenThrow(new IncidentNotFoundException("ghost"));

            post("ghost", request("dave", "reject", "no"))
                    .expectStatus().isNotFound()
                    .expectBody()
                    .jsonPath("$.error").isEqualTo("Incident not found: ghost");
        }

        @Test
        @DisplayName("should return 409 when the incident is not actionable")
        void conflict() {
            when(approvalWorkflow.submitAction(anyString(), anyString(), any(), any()))
                    .thenThrow(new InvariantViolationException("Incident inc-1 is resolved"));

            post("inc-1", request("dave", "approve", null))
                    .expectStatus().isEqualTo(409);
        }

        @Test
        @DisplayName("should return 400 for an unknown action without touching the workflow")
        void unknownAction() {
            post("inc-1", request("dave", "escalate", null))
                    .expectStatus().isBadRequest()
                    .expectBody()
                    .jsonPath("$.error").isEqualTo("Unknown action: escalate");

            verifyNoInteractions(approvalWorkflow);
        }
    }

    private WebTestClient.ResponseSpec post(String id, ActionRequest request) {
        return webTestClient.post()
                .uri("/api/v1/incidents/{id}/actions", id)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(request)
                .exchange();
    }

    private static ActionRequest request(String actor, String action, String comment) {
        ActionRequest request = new ActionRequest();
        request.setActor(actor);
        request.setAction(action);
        request.setComment(comment);
        return request;
    }

    private static Incident incident(String id, FaultType faultType) {
        return Incident.builder()
                .id(id)
                .faultType(faultType)
                .title(faultType.getKey())
                .detectedAt(Instant.now())
                .build();
    }
}
