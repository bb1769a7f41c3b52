package com.z254.sentinel.responder.api.v1;

import com.z254.sentinel.responder.alert.VoiceAlertService;
import com.z254.sentinel.responder.alert.VoiceAlertService.VoiceAlert;
import com.z254.sentinel.responder.broadcast.EventBroadcaster;
import com.z254.sentinel.responder.client.MonitoredServiceClient;
import com.z254.sentinel.responder.diagnosis.DiagnosisAdapter;
import com.z254.sentinel.responder.domain.model.ActivityLogEntry;
import com.z254.sentinel.responder.domain.model.FaultType;
import com.z254.sentinel.responder.domain.model.HealthSignal;
import com.z254.sentinel.responder.domain.model.User;
import com.z254.sentinel.responder.domain.service.ActivityLogService;
import com.z254.sentinel.responder.domain.service.IncidentStatsService;
import com.z254.sentinel.responder.domain.service.UserDirectory;
import com.z254.sentinel.responder.monitor.HealthMonitor;
import com.z254.sentinel.responder.safety.SafetyValidator;
import com.z254.sentinel.responder.scoring.LearningStore;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Monitoring control, fault drills and aggregate statistics.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/agent")
@Tag(name = "Agent", description = "Monitoring control, drills and statistics")
public class AgentController {

    private final HealthMonitor healthMonitor;
    private final MonitoredServiceClient monitoredService;
    private final IncidentStatsService statsService;
    private final DiagnosisAdapter diagnosisAdapter;
    private final SafetyValidator safetyValidator;
    private final LearningStore learningStore;
    private final VoiceAlertService voiceAlerts;
    private final ActivityLogService activityLog;
    private final EventBroadcaster broadcaster;
    private final UserDirectory userDirectory;

    public AgentController(HealthMonitor healthMonitor,
                           MonitoredServiceClient monitoredService,
                           IncidentStatsService statsService,
                           DiagnosisAdapter diagnosisAdapter,
                           SafetyValidator safetyValidator,
                           LearningStore learningStore,
                           VoiceAlertService voiceAlerts,
                           ActivityLogService activityLog,
                           EventBroadcaster broadcaster,
                           UserDirectory userDirectory) {
        this.healthMonitor = healthMonitor;
        this.monitoredService = monitoredService;
        this.statsService = statsService;
        this.diagnosisAdapter = diagnosisAdapter;
        this.safetyValidator = safetyValidator;
        this.learningStore = learningStore;
        this.voiceAlerts = voiceAlerts;
        this.activityLog = activityLog;
        this.broadcaster = broadcaster;
        this.userDirectory = userDirectory;
    }

    @GetMapping("/status")
    @Operation(summary = "Agent status", description = "Monitor state, incident counters and collaborator modes")
    public Mono<ResponseEntity<Map<String, Object>>> status() {
        return Mono.fromCallable(() -> {
            Map<String, Object> status = new LinkedHashMap<>();
            status.put("monitor", healthMonitor.status());
            status.put("incidents", statsService.current());
            status.put("diagnosisStrategy", diagnosisAdapter.activeStrategy());
            status.put("safety", safetyValidator.stats());
            status.put("presence", broadcaster.presence());
            return ResponseEntity.ok(status);
        });
    }

    @PostMapping("/start")
    @Operation(summary = "Start monitoring")
    public Mono<ResponseEntity<Map<String, Object>>> start() {
        return Mono.fromCallable(() -> ResponseEntity.ok(Map.<String, Object>of(
                        "running", true, "changed", healthMonitor.start())))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @PostMapping("/stop")
    @Operation(summary = "Stop monitoring")
    public Mono<ResponseEntity<Map<String, Object>>> stop() {
        return Mono.fromCallable(() -> ResponseEntity.ok(Map.<String, Object>of(
                "running", false, "changed", healthMonitor.stop())));
    }

    @GetMapping("/health")
    @Operation(summary = "Monitored service health", description = "Live health check of the monitored service")
    public Mono<ResponseEntity<HealthSignal>> monitoredHealth() {
        return monitoredService.checkHealth().map(ResponseEntity::ok);
    }

    @PostMapping("/faults/{faultType}")
    @Operation(summary = "Inject fault", description = "Inject a fault into the monitored service for a drill")
    public Mono<ResponseEntity<Map<String, Object>>> injectFault(
            @Parameter(description = "crash, slow, bad_config or bug") @PathVariable String faultType) {

        FaultType type = FaultType.fromKey(faultType);
        if (type == FaultType.UNKNOWN) {
            return Mono.just(ResponseEntity.badRequest().body(Map.of("error", "Invalid fault type: " + faultType)));
        }
        return monitoredService.injectFault(type)
                .then(Mono.fromCallable(() -> {
                    activityLog.record(null, "operator", "fault_injected", "Injected " + type.getKey() + " fault");
                    return ResponseEntity.ok(Map.<String, Object>of("injected", type.getKey()));
                }));
    }

    @DeleteMapping("/faults")
    @Operation(summary = "Clear faults", description = "Remove all injected faults from the monitored service")
    public Mono<ResponseEntity<Map<String, Object>>> clearFaults() {
        return monitoredService.clearFaults()
                .then(Mono.fromCallable(() -> {
                    activityLog.record(null, "operator", "faults_cleared", "All injected faults cleared");
                    return ResponseEntity.ok(Map.<String, Object>of("cleared", true));
                }));
    }

    @GetMapping("/voice/summary")
    @Operation(summary = "Spoken summary", description = "Status summary script, with audio when speech is configured")
    public Mono<ResponseEntity<VoiceAlert>> voiceSummary() {
        return Mono.fromCallable(statsService::current)
                .flatMap(voiceAlerts::statusSummary)
                .map(ResponseEntity::ok);
    }

    @GetMapping("/learning")
    @Operation(summary = "Learning statistics", description = "Human decisions recorded and approval rates by category")
    public Mono<ResponseEntity<Map<String, Object>>> learning() {
        return Mono.fromCallable(() -> ResponseEntity.ok(learningStore.stats()));
    }

    @GetMapping("/activity")
    @Operation(summary = "Activity feed", description = "Most recent activity across all incidents")
    public Mono<ResponseEntity<List<ActivityLogEntry>>> activity(
            @Parameter(description = "Maximum entries") @RequestParam(defaultValue = "100") int limit) {
        return Mono.fromCallable(() -> ResponseEntity.ok(activityLog.recent(limit)));
    }

    @GetMapping("/users")
    @Operation(summary = "Users", description = "Known users and their approval roles")
    public Mono<ResponseEntity<List<User>>> users() {
        return Mono.fromCallable(() -> ResponseEntity.ok(userDirectory.all()));
    }
}
