package com.z254.sentinel.responder.remediation;

import com.z254.sentinel.responder.client.MonitoredServiceClient;
import com.z254.sentinel.responder.config.ResponderConfig;
import com.z254.sentinel.responder.config.ResponderProperties;
import com.z254.sentinel.responder.domain.exception.IncidentNotFoundException;
import com.z254.sentinel.responder.domain.exception.RetryExhaustedException;
import com.z254.sentinel.responder.domain.model.FaultType;
import com.z254.sentinel.responder.domain.model.HealthSignal;
import com.z254.sentinel.responder.domain.model.Incident;
import com.z254.sentinel.responder.domain.model.IncidentStatus;
import com.z254.sentinel.responder.domain.repository.IncidentRepository;
import com.z254.sentinel.responder.domain.service.ActivityLogService;
import com.z254.sentinel.responder.lifecycle.IncidentLocks;
import com.z254.sentinel.responder.lifecycle.IncidentStateMachine;
import com.z254.sentinel.responder.monitor.DedupGuard;
import com.z254.sentinel.responder.observability.ResponderMetrics;
import com.z254.sentinel.responder.observability.ResponderStructuredLogger;
import com.z254.sentinel.responder.observability.ResponderStructuredLogger.RemediationEventType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Applies the recovery action for an incident in {@code deploying} and verifies the service comes
 * back healthy.
 * <p>
 * Health is polled up to {@code verify.max-attempts} times with a fixed delay. Success resolves the
 * incident and frees its dedup key; exhaustion or any other failure returns it to
 * {@code fix_proposed} with a {@code deploy_failed} activity, keeping the dedup key. The incident is
 * never left in {@code deploying}.
 */
@Slf4j
@Component
public class ApplyAndVerifyExecutor {

    private final MonitoredServiceClient monitoredService;
    private final IncidentRepository incidentRepository;
    private final IncidentStateMachine stateMachine;
    private final IncidentLocks locks;
    private final DedupGuard dedupGuard;
    private final ActivityLogService activityLog;
    private final ResponderProperties properties;
    private final ResponderMetrics metrics;
    private final ResponderStructuredLogger logger;
    private final Executor executor;
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

    public ApplyAndVerifyExecutor(MonitoredServiceClient monitoredService,
                                  IncidentRepository incidentRepository,
                                  IncidentStateMachine stateMachine,
                                  IncidentLocks locks,
                                  DedupGuard dedupGuard,
                                  ActivityLogService activityLog,
                                  ResponderProperties properties,
                                  ResponderMetrics metrics,
                                  ResponderStructuredLogger logger,
                                  @Qualifier(ResponderConfig.PIPELINE_EXECUTOR) Executor executor) {
        this.monitoredService = monitoredService;
        this.incidentRepository = incidentRepository;
        this.stateMachine = stateMachine;
        this.locks = locks;
        this.dedupGuard = dedupGuard;
        this.activityLog = activityLog;
        this.properties = properties;
        this.metrics = metrics;
        this.logger = logger;
        this.executor = executor;
    }

    /**
     * Run {@link #execute} on the pipeline executor. A full queue fails the deploy immediately.
     */
    public void submit(String incidentId, double triggeringConfidence) {
        try {
            executor.execute(() -> execute(incidentId, triggeringConfidence));
        } catch (RejectedExecutionException e) {
            log.warn("Pipeline executor saturated, deploy of {} not started", incidentId);
            revert(incidentId, "Deploy failed: executor saturated", e.getClass().getSimpleName());
        }
    }

    /**
     * Run recovery and verification for an incident already moved to {@code deploying}.
     * Blocks the calling thread; run it on the pipeline executor.
     *
     * @param triggeringConfidence confidence at the moment the deploy was decided
     */
    public Incident execute(String incidentId, double triggeringConfidence) {
        Incident incident = incidentRepository.findById(incidentId)
                .orElseThrow(() -> new IncidentNotFoundException(incidentId));
        FaultType faultType = incident.getFaultType() != null ? incident.getFaultType() : FaultType.UNKNOWN;

        activityLog.recordAgent(incidentId, "deploying", "Applying fix for " + faultType.getKey() + " fault");
        logger.logRemediationEvent(incidentId, RemediationEventType.DEPLOYING, "Applying fix",
                Map.of("faultType", faultType.getKey(), "confidence", triggeringConfidence));

        inFlight.add(incidentId);
        try {
            HealthSignal healthy = recover(faultType)
                    .then(verify(incidentId))
                    .block();
            return resolve(incidentId, triggeringConfidence, healthy);
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            String reason = cause instanceof RetryExhaustedException
                    ? cause.getMessage()
                    : "Deploy failed: " + (cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName());
            return revert(incidentId, reason, cause.getClass().getSimpleName());
        } finally {
            inFlight.remove(incidentId);
        }
    }

    private Mono<Void> recover(FaultType faultType) {
        Mono<Void> recovery = monitoredService.recover(faultType);
        if (faultType != FaultType.CRASH) {
            recovery = recovery.then(monitoredService.restart());
        }
        return recovery;
    }

    /**
     * Emits the first healthy signal, or errors with {@link RetryExhaustedException}. A
     * {@code verify_retry} activity is recorded only for failures that will be retried.
     */
    Mono<HealthSignal> verify(String incidentId) {
        ResponderProperties.Verify config = properties.getVerify();
        int maxAttempts = config.getMaxAttempts();
        AtomicInteger attempts = new AtomicInteger();
        AtomicReference<String> lastError = new AtomicReference<>("unknown");

        Mono<HealthSignal> attempt = Mono.defer(monitoredService::checkHealth)
                .flatMap(signal -> {
                    int n = attempts.incrementAndGet();
                    metrics.recordVerifyAttempt();
                    if (signal.isHealthy()) {
                        return Mono.just(signal);
                    }
                    String error = signal.getError() != null ? signal.getError() : "unhealthy";
                    lastError.set(error);
                    if (n < maxAttempts) {
                        activityLog.recordAgent(incidentId, "verify_retry",
                                "Health check " + n + "/" + maxAttempts + " failed: " + error);
                        logger.logRemediationEvent(incidentId, RemediationEventType.VERIFY_RETRY,
                                "Verification attempt failed", Map.of("attempt", n, "error", error));
                    }
                    return Mono.error(new UnhealthyException(error));
                });

        return attempt
                .retryWhen(Retry.fixedDelay(maxAttempts - 1L, config.getRetryDelay())
                        .filter(UnhealthyException.class::isInstance)
                        .onRetryExhaustedThrow((spec, signal) ->
                                new RetryExhaustedException(attempts.get(), lastError.get())))
                .delaySubscription(config.getInitialDelay())
                .timeout(config.getMaxTotalTime(), Mono.error(() ->
                        new RetryExhaustedException(attempts.get(), "verification exceeded "
                                + config.getMaxTotalTime().toSeconds() + "s; last error: " + lastError.get())));
    }

    private Incident resolve(String incidentId, double triggeringConfidence, HealthSignal healthy) {
        return locks.withLock(incidentId, () -> {
            Incident incident = load(incidentId);
            boolean auto = triggeringConfidence >= properties.getThresholds().getAutoFix();
            incident.setAutoResolved(auto);
            stateMachine.transition(incident, IncidentStatus.RESOLVED, Map.of("autoResolved", auto));
            dedupGuard.releaseIncident(incidentId);

            metrics.recordDeploySucceeded();
            metrics.recordIncidentResolved(incident.timeToResolve(), auto);
            activityLog.recordAgent(incidentId, "resolved", auto
                    ? "Fix verified healthy; resolved automatically"
                    : "Fix verified healthy; resolved");
            logger.logRemediationEvent(incidentId, RemediationEventType.VERIFIED, "Fix verified",
                    Map.of("autoResolved", auto,
                            "responseTimeMs", healthy != null && healthy.getResponseTimeMs() != null
                                    ? healthy.getResponseTimeMs() : -1));
            return incident;
        });
    }

    /**
     * Return an incident left in {@code deploying} by a previous process to {@code fix_proposed}.
     * Its recovery may or may not have run, so the fix goes back to humans. A deploy this
     * process is still running is left alone.
     *
     * @return false if the deploy is running here
     */
    public boolean abandon(String incidentId) {
        if (inFlight.contains(incidentId)) {
            return false;
        }
        revert(incidentId, "Deploy interrupted by restart; fix needs re-approval", "Restart");
        return true;
    }

    private Incident revert(String incidentId, String reason, String cause) {
        return locks.withLock(incidentId, () -> {
            Incident incident = load(incidentId);
            metrics.recordDeployFailed();
            activityLog.recordAgent(incidentId, "deploy_failed", reason);
            logger.logRemediationEvent(incidentId, RemediationEventType.DEPLOY_FAILED, reason,
                    Map.of("cause", cause));
            if (incident.getStatus() == IncidentStatus.DEPLOYING) {
                stateMachine.transition(incident, IncidentStatus.FIX_PROPOSED, Map.of("error", reason));
            }
            return incident;
        });
    }

    private Incident load(String incidentId) {
        return incidentRepository.findById(incidentId)
                .orElseThrow(() -> new IncidentNotFoundException(incidentId));
    }

    /**
     * A single failed health check; retried until attempts run out.
     */
    static class UnhealthyException extends RuntimeException {
        UnhealthyException(String message) {
            super(message);
        }
    }
}
