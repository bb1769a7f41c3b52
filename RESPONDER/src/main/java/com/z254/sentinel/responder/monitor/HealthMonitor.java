package com.z254.sentinel.responder.monitor;

import com.z254.sentinel.responder.broadcast.BroadcastEventType;
import com.z254.sentinel.responder.broadcast.EventBroadcaster;
import com.z254.sentinel.responder.client.MonitoredServiceClient;
import com.z254.sentinel.responder.config.ResponderConfig;
import com.z254.sentinel.responder.config.ResponderProperties;
import com.z254.sentinel.responder.domain.model.FaultType;
import com.z254.sentinel.responder.domain.model.HealthSignal;
import com.z254.sentinel.responder.domain.model.Incident;
import com.z254.sentinel.responder.domain.model.IncidentStatus;
import com.z254.sentinel.responder.domain.repository.IncidentRepository;
import com.z254.sentinel.responder.domain.service.ActivityLogService;
import com.z254.sentinel.responder.lifecycle.IncidentPipeline;
import com.z254.sentinel.responder.observability.ResponderMetrics;
import com.z254.sentinel.responder.observability.ResponderStructuredLogger;
import com.z254.sentinel.responder.observability.ResponderStructuredLogger.IncidentEventType;
import com.z254.sentinel.responder.remediation.ApplyAndVerifyExecutor;
import jakarta.annotation.PreDestroy;
import lombok.Builder;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Polls the monitored service and opens incidents for new faults.
 * <p>
 * Each tick broadcasts the raw health signal. An unhealthy signal is classified, checked against the
 * {@link DedupGuard}, and if new, persisted and handed to the {@link IncidentPipeline} on the pipeline
 * executor so the tick cadence never waits on an incident. A failing tick is logged and the next one
 * runs as usual.
 * <p>
 * The first start of the process also picks up incidents a previous process left unfinished:
 * {@code detected} and {@code diagnosing} ones go back through the pipeline, {@code deploying} ones
 * return to {@code fix_proposed} for a human to re-approve.
 */
@Slf4j
@Component
public class HealthMonitor {

    private final MonitoredServiceClient monitoredService;
    private final FaultClassifier classifier;
    private final DedupGuard dedupGuard;
    private final IncidentFactory incidentFactory;
    private final IncidentRepository incidentRepository;
    private final IncidentPipeline pipeline;
    private final ApplyAndVerifyExecutor applyAndVerify;
    private final Executor executor;
    private final EventBroadcaster broadcaster;
    private final ActivityLogService activityLog;
    private final ResponderProperties properties;
    private final ResponderMetrics metrics;
    private final ResponderStructuredLogger logger;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean resumed = new AtomicBoolean(false);
    private final AtomicLong ticks = new AtomicLong();
    private final AtomicReference<HealthSignal> lastHealth = new AtomicReference<>();
    private final AtomicReference<Instant> startedAt = new AtomicReference<>();

    public HealthMonitor(MonitoredServiceClient monitoredService,
                         FaultClassifier classifier,
                         DedupGuard dedupGuard,
                         IncidentFactory incidentFactory,
                         IncidentRepository incidentRepository,
                         IncidentPipeline pipeline,
                         ApplyAndVerifyExecutor applyAndVerify,
                         @Qualifier(ResponderConfig.PIPELINE_EXECUTOR) Executor executor,
                         EventBroadcaster broadcaster,
                         ActivityLogService activityLog,
                         ResponderProperties properties,
                         ResponderMetrics metrics,
                         ResponderStructuredLogger logger) {
        this.monitoredService = monitoredService;
        this.classifier = classifier;
        this.dedupGuard = dedupGuard;
        this.incidentFactory = incidentFactory;
        this.incidentRepository = incidentRepository;
        this.pipeline = pipeline;
        this.applyAndVerify = applyAndVerify;
        this.executor = executor;
        this.broadcaster = broadcaster;
        this.activityLog = activityLog;
        this.properties = properties;
        this.metrics = metrics;
        this.logger = logger;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (properties.getMonitor().isAutoStart()) {
            start();
        }
    }

    /**
     * Start monitoring. Rebuilds the dedup guard from persisted open incidents first, and on the
     * first start resumes the ones left unfinished.
     *
     * @return false if already running
     */
    public boolean start() {
        if (!running.compareAndSet(false, true)) {
            return false;
        }
        rebuildDedup();
        if (resumed.compareAndSet(false, true)) {
            resumeUnfinished();
        }
        startedAt.set(Instant.now());
        activityLog.recordAgent(null, "started", "Monitoring started for " + properties.getServiceName()
                + " at " + properties.getMonitoredService().getUrl());
        broadcaster.broadcast(BroadcastEventType.AGENT_STATUS, Map.of("running", true));
        log.info("Health monitor started, interval {}ms, dedup policy {}",
                properties.getMonitor().getIntervalMs(), dedupGuard.getPolicy());
        return true;
    }

    /**
     * @return false if not running
     */
    public boolean stop() {
        if (!running.compareAndSet(true, false)) {
            return false;
        }
        activityLog.recordAgent(null, "stopped", "Monitoring stopped");
        broadcaster.broadcast(BroadcastEventType.AGENT_STATUS, Map.of("running", false));
        log.info("Health monitor stopped after {} ticks", ticks.get());
        return true;
    }

    @PreDestroy
    public void shutdown() {
        stop();
    }

    public boolean isRunning() {
        return running.get();
    }

    @Scheduled(fixedDelayString = "${responder.monitor.interval-ms:5000}")
    public void scheduledTick() {
        if (running.get()) {
            tick();
        }
    }

    /**
     * One monitoring cycle. Never throws.
     *
     * @return the incident opened by this tick, if any
     */
    public Incident tick() {
        ticks.incrementAndGet();
        try {
            return checkOnce();
        } catch (RuntimeException e) {
            activityLog.recordAgent(null, "error", "Monitor cycle error: " + e.getMessage());
            logger.logIncidentEvent(null, IncidentEventType.TICK_FAILED, "Monitor tick failed",
                    Map.of("error", String.valueOf(e.getMessage()), "type", e.getClass().getSimpleName()));
            return null;
        }
    }

    private Incident checkOnce() {
        HealthSignal signal = monitoredService.checkHealth()
                .onErrorResume(e -> Mono.just(HealthSignal.unreachable("ProcessDown", e.getMessage())))
                .block();
        if (signal == null) {
            signal = HealthSignal.unreachable("ProcessDown", "No health response");
        }
        lastHealth.set(signal);
        broadcaster.broadcast(BroadcastEventType.HEALTH_UPDATE, signal);
        if (signal.isHealthy()) {
            return null;
        }

        FaultType faultType = classifier.classify(signal);
        String incidentId = IncidentFactory.newIncidentId();
        if (!dedupGuard.tryClaim(faultType, incidentId)) {
            metrics.recordIncidentSuppressed();
            logger.logIncidentEvent(dedupGuard.holder(faultType).orElse(null), IncidentEventType.SUPPRESSED,
                    "Duplicate detection suppressed", Map.of("faultType", faultType.getKey()));
            return null;
        }

        Incident incident = incidentFactory.create(incidentId, faultType, signal);
        try {
            incidentRepository.save(incident);
        } catch (RuntimeException e) {
            dedupGuard.release(faultType, incidentId);
            throw e;
        }
        metrics.recordIncidentCreated();
        broadcaster.broadcast(BroadcastEventType.INCIDENT_NEW, newIncidentPayload(incident));
        activityLog.recordAgent(incidentId, "incident_detected", "Detected: " + truncate(signal.getError(), 100));
        logger.logIncidentEvent(incidentId, IncidentEventType.DETECTED, "Incident detected",
                Map.of("faultType", faultType.getKey(),
                        "impactSeverity", incident.getImpactSeverity().wireName(),
                        "approvalSeverity", incident.getApprovalSeverity().wireName()));

        submitPipeline(incidentId);
        return incident;
    }

    private void submitPipeline(String incidentId) {
        try {
            executor.execute(() -> pipeline.run(incidentId));
        } catch (RejectedExecutionException e) {
            activityLog.recordAgent(incidentId, "error", "Pipeline queue full; incident left for manual handling");
            logger.logIncidentEvent(incidentId, IncidentEventType.PIPELINE_FAILED, "Pipeline rejected",
                    Map.of("error", String.valueOf(e.getMessage())));
        }
    }

    /**
     * Re-queue incidents left in {@code detected} or {@code diagnosing}, and return interrupted
     * deploys to {@code fix_proposed}. A failure on one incident does not stop the others.
     */
    void resumeUnfinished() {
        int resubmitted = 0;
        int abandoned = 0;
        for (Incident incident : incidentRepository.findActive()) {
            IncidentStatus status = incident.getStatus();
            if (status == IncidentStatus.DETECTED || status == IncidentStatus.DIAGNOSING) {
                activityLog.recordAgent(incident.getId(), "resumed", "Pipeline resumed after restart");
                submitPipeline(incident.getId());
                resubmitted++;
            } else if (status == IncidentStatus.DEPLOYING) {
                try {
                    if (applyAndVerify.abandon(incident.getId())) {
                        abandoned++;
                    }
                } catch (RuntimeException e) {
                    log.warn("Could not return interrupted deploy of {} to fix_proposed", incident.getId(), e);
                }
            }
        }
        if (resubmitted > 0 || abandoned > 0) {
            log.info("Resumed {} unfinished incidents, returned {} interrupted deploys for re-approval",
                    resubmitted, abandoned);
        }
    }

    /**
     * Re-register every open incident with the dedup guard, keyed by the same classification rules
     * used at detection.
     */
    void rebuildDedup() {
        Map<FaultType, String> active = new EnumMap<>(FaultType.class);
        for (Incident incident : incidentRepository.findActive()) {
            active.putIfAbsent(classifier.rekey(incident), incident.getId());
        }
        dedupGuard.rebuild(active);
    }

    public MonitorStatus status() {
        return MonitorStatus.builder()
                .running(running.get())
                .ticks(ticks.get())
                .startedAt(startedAt.get())
                .intervalMs(properties.getMonitor().getIntervalMs())
                .dedupPolicy(dedupGuard.getPolicy().name())
                .activeFaults(dedupGuard.snapshot())
                .lastHealth(lastHealth.get())
                .build();
    }

    public HealthSignal lastHealth() {
        return lastHealth.get();
    }

    static Map<String, Object> newIncidentPayload(Incident incident) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("id", incident.getId());
        payload.put("title", incident.getTitle());
        payload.put("faultType", incident.getFaultType());
        payload.put("status", incident.getStatus());
        payload.put("impactSeverity", incident.getImpactSeverity());
        payload.put("approvalSeverity", incident.getApprovalSeverity());
        payload.put("serviceName", incident.getServiceName());
        payload.put("impactAnalysis", incident.getImpactAnalysis());
        payload.put("reportedBy", incident.getReportedBy());
        payload.put("assignedTo", incident.getAssignedTo());
        payload.put("detectedAt", incident.getDetectedAt());
        return payload;
    }

    private static String truncate(String value, int max) {
        if (value == null) {
            return "Unknown";
        }
        return value.length() <= max ? value : value.substring(0, max);
    }

    @Value
    @Builder
    public static class MonitorStatus {
        boolean running;
        long ticks;
        Instant startedAt;
        long intervalMs;
        String dedupPolicy;
        Map<String, String> activeFaults;
        HealthSignal lastHealth;
    }
}
