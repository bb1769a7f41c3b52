package com.z254.sentinel.responder.monitor;

import com.z254.sentinel.responder.broadcast.BroadcastEventType;
import com.z254.sentinel.responder.client.MonitoredServiceClient;
import com.z254.sentinel.responder.client.ReasoningEngineClient;
import com.z254.sentinel.responder.client.SandboxClient;
import com.z254.sentinel.responder.config.ResponderProperties;
import com.z254.sentinel.responder.domain.model.ApprovalAction;
import com.z254.sentinel.responder.domain.model.Evidence;
import com.z254.sentinel.responder.domain.model.FaultType;
import com.z254.sentinel.responder.domain.model.HealthSignal;
import com.z254.sentinel.responder.domain.model.Incident;
import com.z254.sentinel.responder.domain.model.IncidentStatus;
import com.z254.sentinel.responder.domain.repository.JsonFileIncidentRepository;
import com.z254.sentinel.responder.support.RecordingObserverChannel;
import com.z254.sentinel.responder.support.ResponderFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class HealthMonitorTest {

    @Mock
    private MonitoredServiceClient monitoredService;

    @Mock
    private SandboxClient sandbox;

    private final List<Runnable> queued = new ArrayList<>();
    private ResponderFixture fixture;
    private HealthMonitor monitor;
    private RecordingObserverChannel dashboard;

    @BeforeEach
    void setUp() {
        fixture = new ResponderFixture(monitoredService, sandbox, mock(ReasoningEngineClient.class), queued::add);
        monitor = fixture.monitor;
        dashboard = new RecordingObserverChannel("dashboard");
        fixture.broadcaster.connect(dashboard);
    }

    @Nested
    @DisplayName("Detection")
    class DetectionTests {

        @Test
        @DisplayName("healthy tick broadcasts health and opens nothing")
        void healthyTick() {
            when(monitoredService.checkHealth()).thenReturn(Mono.just(HealthSignal.healthy(4)));

            assertThat(monitor.tick()).isNull();

            assertThat(monitor.lastHealth().isHealthy()).isTrue();
            assertThat(dashboard.events(BroadcastEventType.HEALTH_UPDATE)).hasSize(1);
            assertThat(fixture.incidents.findAll()).isEmpty();
            assertThat(queued).isEmpty();
        }

        @Test
        @DisplayName("repeated bad_config signal opens exactly one incident")
        void duplicateSuppressed() {
            when(monitoredService.checkHealth()).thenReturn(Mono.just(HealthSignal.builder()
                    .healthy(false).errorType("ConfigParseError").error("Invalid config.json").build()));

            Incident first = monitor.tick();
            Incident second = monitor.tick();

            assertThat(first).isNotNull();
            assertThat(first.getFaultType()).isEqualTo(FaultType.BAD_CONFIG);
            assertThat(second).isNull();
            assertThat(fixture.incidents.findAll()).hasSize(1);
            assertThat(dashboard.events(BroadcastEventType.INCIDENT_NEW)).hasSize(1);
            assertThat(queued).hasSize(1);
            assertThat(fixture.dedupGuard.holder(FaultType.BAD_CONFIG)).contains(first.getId());
            assertThat(fixture.meterRegistry.get("responder.incidents.suppressed").counter().count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("different fault types each get an incident")
        void distinctFaults() {
            when(monitoredService.checkHealth()).thenReturn(
                    Mono.just(HealthSignal.builder().healthy(false).errorType("ConfigParseError").build()),
                    Mono.just(HealthSignal.builder().healthy(false).errorType("Timeout").error("timed out").build()));

            monitor.tick();
            monitor.tick();

            assertThat(fixture.incidents.findAll())
                    .extracting(Incident::getFaultType)
                    .containsExactlyInAnyOrder(FaultType.BAD_CONFIG, FaultType.SLOW);
        }

        @Test
        @DisplayName("unreachable service is treated as a crash")
        void unreachableIsCrash() {
            when(monitoredService.checkHealth()).thenReturn(Mono.error(new IllegalStateException("Connection refused")));

            Incident incident = monitor.tick();

            assertThat(incident.getFaultType()).isEqualTo(FaultType.CRASH);
            assertThat(incident.getStatus()).isEqualTo(IncidentStatus.DETECTED);
            assertThat(fixture.activityActions(incident.getId())).containsExactly("incident_detected");
        }

        @Test
        @DisplayName("a failing tick is logged and does not propagate")
        void tickFailureContained() {
            when(monitoredService.checkHealth()).thenThrow(new IllegalStateException("client not initialised"));

            assertThatCode(() -> monitor.tick()).doesNotThrowAnyException();

            assertThat(fixture.activityLog.recent(1))
                    .singleElement()
                    .satisfies(entry -> assertThat(entry.getDetail())
                            .isEqualTo("Monitor cycle error: client not initialised"));
            assertThat(monitor.status().getTicks()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("Start and stop")
    class LifecycleTests {

        @Test
        @DisplayName("start rebuilds dedup from persisted open incidents")
        void startRebuildsDedup() {
            Incident open = Incident.builder()
                    .id("persisted")
                    .faultType(FaultType.BAD_CONFIG)
                    .evidence(Evidence.builder().healthSignal(HealthSignal.builder()
                            .healthy(false).errorType("ConfigParseError").build()).build())
                    .detectedAt(Instant.now())
                    .build();
            open.applyStatus(IncidentStatus.AWAITING_APPROVAL, Instant.now());
            Incident closed = Incident.builder().id("closed").faultType(FaultType.CRASH).detectedAt(Instant.now()).build();
            closed.applyStatus(IncidentStatus.RESOLVED, Instant.now());
            fixture.incidents.save(open);
            fixture.incidents.save(closed);
            when(monitoredService.checkHealth()).thenReturn(Mono.just(HealthSignal.builder()
                    .healthy(false).errorType("ConfigParseError").build()));

            assertThat(monitor.start()).isTrue();

            assertThat(fixture.dedupGuard.snapshot()).containsOnlyKeys("bad_config");
            assertThat(monitor.tick()).isNull();
            assertThat(fixture.incidents.findAll()).hasSize(2);
        }

        @Test
        @DisplayName("start and stop are idempotent and broadcast agent status")
        void startStop() {
            assertThat(monitor.start()).isTrue();
            assertThat(monitor.start()).isFalse();
            assertThat(monitor.isRunning()).isTrue();

            assertThat(monitor.stop()).isTrue();
            assertThat(monitor.stop()).isFalse();

            assertThat(dashboard.events(BroadcastEventType.AGENT_STATUS))
                    .extracting(node -> node.get("running").asBoolean())
                    .containsExactly(true, false);
        }

        @Test
        @DisplayName("scheduled tick does nothing while stopped")
        void scheduledTickWhileStopped() {
            monitor.scheduledTick();

            assertThat(monitor.status().getTicks()).isZero();
        }
    }

    @Nested
    @DisplayName("Unfinished incidents on first start")
    class ResumeTests {

        @TempDir
        Path tempDir;

        @Test
        @DisplayName("interrupted deploy returns to fix_proposed and can still be rejected")
        void interruptedDeployReturnsForReapproval() {
            fixture.incidents.save(incident("deploying-1", IncidentStatus.DEPLOYING));

            monitor.start();

            Incident incident = fixture.incidents.findById("deploying-1").orElseThrow();
            assertThat(incident.getStatus()).isEqualTo(IncidentStatus.FIX_PROPOSED);
            assertThat(fixture.activityActions("deploying-1")).containsExactly("deploy_failed");
            assertThat(fixture.activityLog.forIncident("deploying-1").get(0).getDetail())
                    .contains("interrupted by restart");
            assertThat(fixture.dedupGuard.isHeld("deploying-1")).isTrue();
            assertThat(queued).isEmpty();
            verify(monitoredService, never()).recover(any());

            fixture.workflow.submitAction("deploying-1", "eve", ApprovalAction.REJECT, "stale fix");

            assertThat(fixture.incidents.findById("deploying-1").orElseThrow().getStatus())
                    .isEqualTo(IncidentStatus.REJECTED);
            assertThat(fixture.dedupGuard.isHeld("deploying-1")).isFalse();
        }

        @Test
        @DisplayName("detected and diagnosing incidents are queued for the pipeline again")
        void earlyIncidentsResubmitted() {
            fixture.incidents.save(incident("detected-1", IncidentStatus.DETECTED));
            fixture.incidents.save(incident("diagnosing-1", IncidentStatus.DIAGNOSING));
            fixture.incidents.save(incident("waiting-1", IncidentStatus.AWAITING_APPROVAL));

            monitor.start();

            assertThat(queued).hasSize(2);
            assertThat(fixture.activityActions("detected-1")).containsExactly("resumed");
            assertThat(fixture.activityActions("diagnosing-1")).containsExactly("resumed");
            assertThat(fixture.activityActions("waiting-1")).isEmpty();
            assertThat(fixture.incidents.findById("waiting-1").orElseThrow().getStatus())
                    .isEqualTo(IncidentStatus.AWAITING_APPROVAL);
        }

        @Test
        @DisplayName("stop and start within one process leaves a live deploy alone")
        void secondStartDoesNotResume() {
            monitor.start();
            monitor.stop();
            fixture.incidents.save(incident("deploying-2", IncidentStatus.DEPLOYING));

            monitor.start();

            assertThat(fixture.incidents.findById("deploying-2").orElseThrow().getStatus())
                    .isEqualTo(IncidentStatus.DEPLOYING);
            assertThat(fixture.activityActions("deploying-2")).isEmpty();
        }

        @Test
        @DisplayName("deploy persisted by a previous process is recovered from the snapshot file")
        void recoversFromSnapshotFile() {
            ResponderProperties persistence = new ResponderProperties();
            persistence.getPersistence().setPath(tempDir.resolve("incidents.json").toString());
            ResponderFixture before = new ResponderFixture(monitoredService, sandbox,
                    mock(ReasoningEngineClient.class), queued::add,
                    mapper -> new JsonFileIncidentRepository(mapper, persistence));
            before.incidents.save(incident("deploying-3", IncidentStatus.DEPLOYING));

            ResponderFixture after = new ResponderFixture(monitoredService, sandbox,
                    mock(ReasoningEngineClient.class), queued::add,
                    mapper -> new JsonFileIncidentRepository(mapper, persistence));
            after.monitor.start();

            assertThat(after.incidents.findById("deploying-3").orElseThrow().getStatus())
                    .isEqualTo(IncidentStatus.FIX_PROPOSED);
            assertThat(after.dedupGuard.isHeld("deploying-3")).isTrue();
            JsonFileIncidentRepository reloaded = new JsonFileIncidentRepository(after.objectMapper, persistence);
            assertThat(reloaded.findById("deploying-3").orElseThrow().getStatus())
                    .isEqualTo(IncidentStatus.FIX_PROPOSED);

            when(monitoredService.checkHealth()).thenReturn(Mono.just(HealthSignal.builder()
                    .healthy(false).errorType("ConfigParseError").build()));
            assertThat(after.monitor.tick()).isNull();
            assertThat(after.incidents.findAll()).hasSize(1);
        }

        private Incident incident(String id, IncidentStatus status) {
            Incident incident = Incident.builder()
                    .id(id)
                    .faultType(FaultType.BAD_CONFIG)
                    .title("Configuration error")
                    .detectedAt(Instant.now())
                    .build();
            incident.applyStatus(status, Instant.now());
            return incident;
        }
    }
}
