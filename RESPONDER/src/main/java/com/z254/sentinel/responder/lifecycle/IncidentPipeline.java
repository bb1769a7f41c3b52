package com.z254.sentinel.responder.lifecycle;

import com.z254.sentinel.responder.alert.VoiceAlertService;
import com.z254.sentinel.responder.broadcast.BroadcastEventType;
import com.z254.sentinel.responder.broadcast.EventBroadcaster;
import com.z254.sentinel.responder.client.MonitoredServiceClient;
import com.z254.sentinel.responder.client.SandboxClient;
import com.z254.sentinel.responder.config.ResponderProperties;
import com.z254.sentinel.responder.diagnosis.DiagnosisAdapter;
import com.z254.sentinel.responder.domain.exception.IncidentNotFoundException;
import com.z254.sentinel.responder.domain.model.Diagnosis;
import com.z254.sentinel.responder.domain.model.Evidence;
import com.z254.sentinel.responder.domain.model.FaultType;
import com.z254.sentinel.responder.domain.model.FixProposal;
import com.z254.sentinel.responder.domain.model.ImpactSeverity;
import com.z254.sentinel.responder.domain.model.Incident;
import com.z254.sentinel.responder.domain.model.IncidentStatus;
import com.z254.sentinel.responder.domain.model.SafetyResult;
import com.z254.sentinel.responder.domain.model.SandboxResult;
import com.z254.sentinel.responder.domain.repository.IncidentRepository;
import com.z254.sentinel.responder.domain.service.ActivityLogService;
import com.z254.sentinel.responder.observability.ResponderMetrics;
import com.z254.sentinel.responder.observability.ResponderStructuredLogger;
import com.z254.sentinel.responder.observability.ResponderStructuredLogger.IncidentEventType;
import com.z254.sentinel.responder.remediation.ApplyAndVerifyExecutor;
import com.z254.sentinel.responder.safety.SafetyValidator;
import com.z254.sentinel.responder.scoring.ConfidenceScorer;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Takes a freshly detected incident from evidence to a decision: diagnose, propose a fix, test it in
 * the sandbox, run the safety gate, score, then either auto-deploy or wait for a human.
 * <p>
 * Runs on the pipeline executor. The incident lock is held up to the decision; apply-and-verify runs
 * after the lock is released.
 */
@Slf4j
@Service
public class IncidentPipeline {

    static final String HANDLER_FILE = "handler.py";
    static final String CONFIG_FILE = "config.json";

    private final IncidentRepository incidentRepository;
    private final IncidentStateMachine stateMachine;
    private final IncidentLocks locks;
    private final MonitoredServiceClient monitoredService;
    private final DiagnosisAdapter diagnosisAdapter;
    private final SandboxClient sandboxClient;
    private final SafetyValidator safetyValidator;
    private final ConfidenceScorer confidenceScorer;
    private final ApplyAndVerifyExecutor applyAndVerify;
    private final VoiceAlertService voiceAlerts;
    private final EventBroadcaster broadcaster;
    private final ActivityLogService activityLog;
    private final ResponderProperties properties;
    private final ResponderMetrics metrics;
    private final ResponderStructuredLogger logger;

    public IncidentPipeline(IncidentRepository incidentRepository,
                            IncidentStateMachine stateMachine,
                            IncidentLocks locks,
                            MonitoredServiceClient monitoredService,
                            DiagnosisAdapter diagnosisAdapter,
                            SandboxClient sandboxClient,
                            SafetyValidator safetyValidator,
                            ConfidenceScorer confidenceScorer,
                            ApplyAndVerifyExecutor applyAndVerify,
                            VoiceAlertService voiceAlerts,
                            EventBroadcaster broadcaster,
                            ActivityLogService activityLog,
                            ResponderProperties properties,
                            ResponderMetrics metrics,
                            ResponderStructuredLogger logger) {
        this.incidentRepository = incidentRepository;
        this.stateMachine = stateMachine;
        this.locks = locks;
        this.monitoredService = monitoredService;
        this.diagnosisAdapter = diagnosisAdapter;
        this.sandboxClient = sandboxClient;
        this.safetyValidator = safetyValidator;
        this.confidenceScorer = confidenceScorer;
        this.applyAndVerify = applyAndVerify;
        this.voiceAlerts = voiceAlerts;
        this.broadcaster = broadcaster;
        this.activityLog = activityLog;
        this.properties = properties;
        this.metrics = metrics;
        this.logger = logger;
    }

    /**
     * Process one incident. Never throws: failures are logged and the incident is left for humans,
     * who may still reject it. An incident found in {@code diagnosing}, cut off by a restart, is
     * diagnosed again; one already past diagnosis is left alone.
     */
    public void run(String incidentId) {
        Timer.Sample sample = metrics.startPipelineTimer();
        try {
            Incident incident = locks.withLock(incidentId, () -> process(incidentId));
            if (incident == null) {
                return;
            }
            double confidence = incident.getConfidenceScore() != null ? incident.getConfidenceScore() : 0.0;
            metrics.recordPipelineCompleted(sample, confidence);

            if (incident.getStatus() == IncidentStatus.DEPLOYING) {
                applyAndVerify.execute(incidentId, confidence);
            }
        } catch (RuntimeException e) {
            metrics.recordPipelineError();
            activityLog.recordAgent(incidentId, "error", "Pipeline failed: " + e.getMessage());
            logger.logIncidentEvent(incidentId, IncidentEventType.PIPELINE_FAILED, "Incident pipeline failed",
                    Map.of("error", String.valueOf(e.getMessage()), "type", e.getClass().getSimpleName()));
            log.debug("Pipeline failure for {}", incidentId, e);
        }
    }

    private Incident process(String incidentId) {
        Incident incident = incidentRepository.findById(incidentId)
                .orElseThrow(() -> new IncidentNotFoundException(incidentId));
        if (incident.getStatus() != IncidentStatus.DETECTED && incident.getStatus() != IncidentStatus.DIAGNOSING) {
            log.debug("Incident {} is {}, nothing to process", incidentId, incident.getStatus().wireName());
            return null;
        }
        FaultType faultType = incident.getFaultType() != null ? incident.getFaultType() : FaultType.UNKNOWN;

        Evidence evidence = gatherEvidence(incident);
        if (incident.getStatus() == IncidentStatus.DETECTED) {
            stateMachine.transition(incident, IncidentStatus.DIAGNOSING);
        } else {
            stateMachine.update(incident, Map.of("resumed", true));
        }

        Diagnosis diagnosis = diagnosisAdapter.diagnose(faultType, evidence).block();
        incident.setDiagnosis(diagnosis);
        incident.setRootCause(diagnosis.getRootCause());
        if (diagnosis.getLlmError() != null) {
            logger.logIncidentEvent(incidentId, IncidentEventType.DIAGNOSIS_FALLBACK,
                    "Reasoning engine failed, used rule-based diagnosis", Map.of("error", diagnosis.getLlmError()));
        }
        stateMachine.update(incident, diagnosisPayload(diagnosis));
        activityLog.recordAgent(incidentId, "diagnosed", "Root cause: " + truncate(diagnosis.getRootCause(), 120));
        logger.logIncidentEvent(incidentId, IncidentEventType.DIAGNOSED, "Diagnosis complete",
                Map.of("category", String.valueOf(diagnosis.getCategory()), "source", String.valueOf(diagnosis.getSource())));

        FixProposal fix = diagnosisAdapter.generateFix(faultType, diagnosis, evidence).block();
        incident.setProposedFix(fix);
        stateMachine.transition(incident, IncidentStatus.FIX_PROPOSED);
        logger.logIncidentEvent(incidentId, IncidentEventType.FIX_PROPOSED, "Fix proposed",
                Map.of("risk", fix.getRiskLevel().wireName(), "source", String.valueOf(fix.getSource())));

        SandboxResult sandbox = testInSandbox(incidentId, fix);
        incident.setSandboxResult(sandbox);

        SafetyResult safety = safetyValidator.validate(faultType, diagnosis.getRootCause(), fix.safetyText()).block();
        incident.setSafetyResult(safety);
        activityLog.recordAgent(incidentId, "safety_check", String.format("Safety: %s (score: %.0f%%)",
                safety.isPassed() ? "PASSED" : "FAILED", safety.getScore() * 100));
        if (!safety.isPassed()) {
            logger.logIncidentEvent(incidentId, IncidentEventType.SAFETY_BLOCKED, "Fix blocked by safety gate",
                    Map.of("failed", safety.failedChecks().stream()
                            .map(SafetyResult.SafetyCheck::getName)
                            .collect(Collectors.joining(","))));
        }

        ImpactSeverity severity = incident.getImpactSeverity() != null ? incident.getImpactSeverity() : ImpactSeverity.MEDIUM;
        double confidence = confidenceScorer.score(diagnosis, sandbox, safety, severity);
        incident.setConfidenceScore(confidence);
        logger.logIncidentEvent(incidentId, IncidentEventType.SCORED, "Confidence scored",
                Map.of("confidence", confidence));

        decide(incident, confidence, sandbox, safety);
        return incident;
    }

    private Evidence gatherEvidence(Incident incident) {
        Evidence evidence = incident.getEvidence() != null ? incident.getEvidence() : new Evidence();
        List<String> logs = monitoredService.recentLogs(properties.getMonitor().getLogLines()).block();
        if (logs != null) {
            evidence.setRecentLogs(logs);
        }
        for (String file : List.of(HANDLER_FILE, CONFIG_FILE)) {
            String content = monitoredService.fetchFile(file).block();
            if (content != null && !content.isEmpty()) {
                evidence.getFiles().put(file, content);
            }
        }
        incident.setEvidence(evidence);
        return evidence;
    }

    private SandboxResult testInSandbox(String incidentId, FixProposal fix) {
        if (!fix.hasTest()) {
            return SandboxResult.noTestPayload();
        }
        activityLog.recordAgent(incidentId, "sandbox_test", "Testing fix in isolated sandbox");
        SandboxResult result = sandboxClient.test(fix.getFixCode(), fix.getTestCode())
                .onErrorResume(e -> Mono.just(SandboxResult.unavailable(e.getMessage())))
                .defaultIfEmpty(SandboxResult.unavailable("No sandbox response"))
                .block();
        activityLog.recordAgent(incidentId, "sandbox_test", "Sandbox result: "
                + (result.isTestPassed() ? "PASS" : result.isSkipped() ? "SKIPPED (" + result.getError() + ")" : "FAIL"));
        return result;
    }

    private void decide(Incident incident, double confidence, SandboxResult sandbox, SafetyResult safety) {
        ResponderProperties.Thresholds thresholds = properties.getThresholds();
        String incidentId = incident.getId();

        if (confidence >= thresholds.getAutoFix() && safety.isPassed() && sandbox.isTestPassed()) {
            activityLog.recordAgent(incidentId, "auto_deploying",
                    String.format("Confidence %.0f%% - auto-deploying fix", confidence * 100));
            logger.logIncidentEvent(incidentId, IncidentEventType.AUTO_APPLY, "Auto-applying fix",
                    Map.of("confidence", confidence));
            stateMachine.transition(incident, IncidentStatus.DEPLOYING, Map.of("auto", true));
            return;
        }

        boolean escalate = confidence < thresholds.getEscalation();
        String next = escalate ? "Low confidence - needs expert review" : "Awaiting team approval";
        stateMachine.transition(incident, IncidentStatus.AWAITING_APPROVAL, Map.of("auto", false));
        activityLog.recordAgent(incidentId, "fix_proposed",
                String.format("Confidence: %.0f%%. %s", confidence * 100, next));
        logger.logIncidentEvent(incidentId, escalate ? IncidentEventType.ESCALATED : IncidentEventType.FIX_PROPOSED,
                next, Map.of("confidence", confidence));

        if (incident.getImpactSeverity() != null && incident.getImpactSeverity().isHighOrAbove()) {
            voiceAlerts.alertFor(incident).subscribe(
                    alert -> broadcaster.broadcast(BroadcastEventType.VOICE_ALERT, alert),
                    e -> log.warn("Voice alert for {} skipped: {}", incidentId, e.getMessage()));
        }
    }

    private static Map<String, Object> diagnosisPayload(Diagnosis diagnosis) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("explanation", diagnosis.getExplanation());
        payload.put("fileAtFault", diagnosis.getFileAtFault());
        payload.put("lineHint", diagnosis.getLineNumber());
        payload.put("diagnosisSource", diagnosis.getSource());
        return payload;
    }

    private static String truncate(String value, int max) {
        if (value == null) {
            return "";
        }
        return value.length() <= max ? value : value.substring(0, max);
    }
}
