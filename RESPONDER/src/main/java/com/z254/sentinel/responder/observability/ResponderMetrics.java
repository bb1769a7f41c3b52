package com.z254.sentinel.responder.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.Getter;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Centralized metrics for the responder.
 * <p>
 * Provides metrics for:
 * <ul>
 *     <li>Incident lifecycle (created, suppressed, resolved, rejected, MTTR)</li>
 *     <li>Decision inputs (confidence, safety blocks, collaborator fallbacks)</li>
 *     <li>Apply-and-verify (attempts, outcomes)</li>
 *     <li>Human actions and observer connections</li>
 * </ul>
 */
@Component
public class ResponderMetrics {

    private final MeterRegistry meterRegistry;

    // Incident metrics
    @Getter
    private final Counter incidentsCreated;
    @Getter
    private final Counter incidentsSuppressed;
    @Getter
    private final Counter incidentsResolved;
    @Getter
    private final Counter incidentsAutoResolved;
    @Getter
    private final Counter incidentsRejected;
    private final Timer incidentMttr;
    private final AtomicInteger activeIncidents;

    // Pipeline metrics
    private final Timer pipelineDuration;
    private final DistributionSummary confidence;
    @Getter
    private final Counter safetyBlocked;
    @Getter
    private final Counter pipelineErrors;
    private final Map<String, Counter> fallbacksByCollaborator = new ConcurrentHashMap<>();

    // Verification metrics
    @Getter
    private final Counter verifyAttempts;
    @Getter
    private final Counter deploysSucceeded;
    @Getter
    private final Counter deploysFailed;

    // Human action metrics
    private final Map<String, Counter> actionsByType = new ConcurrentHashMap<>();
    @Getter
    private final Counter authorizationDenials;

    // Observer metrics
    private final AtomicInteger connectedObservers;
    @Getter
    private final Counter observersDropped;

    public ResponderMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.incidentsCreated = Counter.builder("responder.incidents.created")
                .description("Total incidents created")
                .register(meterRegistry);
        this.incidentsSuppressed = Counter.builder("responder.incidents.suppressed")
                .description("Detections suppressed by the dedup guard")
                .register(meterRegistry);
        this.incidentsResolved = Counter.builder("responder.incidents.resolved")
                .description("Total incidents resolved")
                .register(meterRegistry);
        this.incidentsAutoResolved = Counter.builder("responder.incidents.auto_resolved")
                .description("Incidents resolved without human approval")
                .register(meterRegistry);
        this.incidentsRejected = Counter.builder("responder.incidents.rejected")
                .description("Incidents rejected by an engineer")
                .register(meterRegistry);
        this.incidentMttr = Timer.builder("responder.incidents.mttr")
                .description("Time from detection to resolution")
                .publishPercentiles(0.5, 0.75, 0.95, 0.99)
                .register(meterRegistry);
        this.activeIncidents = meterRegistry.gauge("responder.incidents.active", new AtomicInteger(0));

        this.pipelineDuration = Timer.builder("responder.pipeline.duration")
                .description("Diagnose-to-decision pipeline duration")
                .publishPercentiles(0.5, 0.95)
                .register(meterRegistry);
        this.confidence = DistributionSummary.builder("responder.confidence")
                .description("Confidence scores assigned to proposed fixes")
                .publishPercentiles(0.5, 0.75, 0.95)
                .register(meterRegistry);
        this.safetyBlocked = Counter.builder("responder.safety.blocked")
                .description("Fixes failing a critical safety check")
                .register(meterRegistry);
        this.pipelineErrors = Counter.builder("responder.pipeline.errors")
                .description("Unexpected errors in the monitor tick or pipeline")
                .register(meterRegistry);

        this.verifyAttempts = Counter.builder("responder.verify.attempts")
                .description("Post-fix health checks performed")
                .register(meterRegistry);
        this.deploysSucceeded = Counter.builder("responder.deploys.succeeded")
                .description("Fixes verified healthy")
                .register(meterRegistry);
        this.deploysFailed = Counter.builder("responder.deploys.failed")
                .description("Fixes that never verified healthy")
                .register(meterRegistry);

        this.authorizationDenials = Counter.builder("responder.actions.denied")
                .description("Actions refused for insufficient role")
                .register(meterRegistry);

        this.connectedObservers = meterRegistry.gauge("responder.observers.connected", new AtomicInteger(0));
        this.observersDropped = Counter.builder("responder.observers.dropped")
                .description("Observers removed after a failed send")
                .register(meterRegistry);
    }

    // ========== Incident Methods ==========

    public void recordIncidentCreated() {
        incidentsCreated.increment();
        activeIncidents.incrementAndGet();
    }

    public void recordIncidentSuppressed() {
        incidentsSuppressed.increment();
    }

    public void recordIncidentResolved(Duration mttr, boolean autoResolved) {
        incidentsResolved.increment();
        if (autoResolved) {
            incidentsAutoResolved.increment();
        }
        activeIncidents.decrementAndGet();
        if (mttr != null) {
            incidentMttr.record(mttr);
        }
    }

    public void recordIncidentRejected() {
        incidentsRejected.increment();
        activeIncidents.decrementAndGet();
    }

    // ========== Pipeline Methods ==========

    public Timer.Sample startPipelineTimer() {
        return Timer.start(meterRegistry);
    }

    public void recordPipelineCompleted(Timer.Sample sample, double confidenceScore) {
        sample.stop(pipelineDuration);
        confidence.record(confidenceScore);
    }

    public void recordPipelineError() {
        pipelineErrors.increment();
    }

    public void recordSafetyBlocked() {
        safetyBlocked.increment();
    }

    public void recordFallback(String collaborator) {
        fallbacksByCollaborator.computeIfAbsent(collaborator, name ->
                Counter.builder("responder.collaborator.fallbacks")
                        .tag("collaborator", name)
                        .description("Collaborator calls answered by a fallback")
                        .register(meterRegistry))
                .increment();
    }

    // ========== Verification Methods ==========

    public void recordVerifyAttempt() {
        verifyAttempts.increment();
    }

    public void recordDeploySucceeded() {
        deploysSucceeded.increment();
    }

    public void recordDeployFailed() {
        deploysFailed.increment();
    }

    // ========== Human Action Methods ==========

    public void recordAction(String action) {
        actionsByType.computeIfAbsent(action, type ->
                Counter.builder("responder.actions")
                        .tag("action", type)
                        .description("Human actions by type")
                        .register(meterRegistry))
                .increment();
    }

    public void recordAuthorizationDenied() {
        authorizationDenials.increment();
    }

    // ========== Observer Methods ==========

    public void recordObserverCount(int count) {
        connectedObservers.set(count);
    }

    public void recordObserverDropped() {
        observersDropped.increment();
    }
}
