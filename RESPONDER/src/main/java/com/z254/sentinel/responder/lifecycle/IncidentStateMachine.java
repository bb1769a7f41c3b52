package com.z254.sentinel.responder.lifecycle;

import com.z254.sentinel.responder.broadcast.BroadcastEventType;
import com.z254.sentinel.responder.broadcast.EventBroadcaster;
import com.z254.sentinel.responder.domain.exception.InvariantViolationException;
import com.z254.sentinel.responder.domain.model.Incident;
import com.z254.sentinel.responder.domain.model.IncidentStatus;
import com.z254.sentinel.responder.domain.repository.IncidentRepository;
import com.z254.sentinel.responder.observability.ResponderStructuredLogger;
import com.z254.sentinel.responder.observability.ResponderStructuredLogger.IncidentEventType;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The only place incident status changes. Every transition is checked against
 * {@link IncidentStatus#allowedTargets()}, saved, and broadcast as {@code incident_update}.
 * A transition whose save fails leaves the incident as it was and broadcasts nothing.
 * <p>
 * Callers hold the incident's lock from {@link IncidentLocks}; the lock is retired once the
 * incident reaches a terminal status.
 */
@Component
public class IncidentStateMachine {

    private final IncidentRepository incidentRepository;
    private final IncidentLocks locks;
    private final EventBroadcaster broadcaster;
    private final ResponderStructuredLogger logger;

    public IncidentStateMachine(IncidentRepository incidentRepository,
                                IncidentLocks locks,
                                EventBroadcaster broadcaster,
                                ResponderStructuredLogger logger) {
        this.incidentRepository = incidentRepository;
        this.locks = locks;
        this.broadcaster = broadcaster;
        this.logger = logger;
    }

    public Incident transition(Incident incident, IncidentStatus target) {
        return transition(incident, target, Map.of());
    }

    /**
     * Move {@code incident} to {@code target}, attaching {@code extra} to the broadcast payload.
     *
     * @throws InvariantViolationException if the transition is not allowed
     * @throws RuntimeException whatever the repository throws; the incident is rolled back first
     */
    public Incident transition(Incident incident, IncidentStatus target, Map<String, Object> extra) {
        IncidentStatus from = incident.getStatus();
        if (!from.canTransitionTo(target)) {
            throw new InvariantViolationException("Illegal transition for incident " + incident.getId()
                    + ": " + from.wireName() + " -> " + target.wireName());
        }
        Instant previousUpdatedAt = incident.getUpdatedAt();
        incident.applyStatus(target, Instant.now());
        try {
            incidentRepository.save(incident);
        } catch (RuntimeException e) {
            incident.applyStatus(from, previousUpdatedAt);
            throw e;
        }
        if (target.isTerminal()) {
            locks.retire(incident.getId());
        }

        logger.logIncidentEvent(incident.getId(), IncidentEventType.STATUS_CHANGED,
                "Incident status changed", Map.of("from", from.wireName(), "to", target.wireName()));
        broadcaster.broadcast(BroadcastEventType.INCIDENT_UPDATE, updatePayload(incident, extra));
        return incident;
    }

    /**
     * Persist content changes that do not move the status, and broadcast them.
     */
    public Incident update(Incident incident, Map<String, Object> extra) {
        Instant previousUpdatedAt = incident.getUpdatedAt();
        incident.setUpdatedAt(Instant.now());
        try {
            incidentRepository.save(incident);
        } catch (RuntimeException e) {
            incident.setUpdatedAt(previousUpdatedAt);
            throw e;
        }
        broadcaster.broadcast(BroadcastEventType.INCIDENT_UPDATE, updatePayload(incident, extra));
        return incident;
    }

    static Map<String, Object> updatePayload(Incident incident, Map<String, Object> extra) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("id", incident.getId());
        payload.put("status", incident.getStatus());
        payload.put("faultType", incident.getFaultType());
        payload.put("rootCause", incident.getRootCause());
        payload.put("confidence", incident.getConfidenceScore());
        if (incident.getProposedFix() != null) {
            payload.put("proposedFix", incident.getProposedFix().getDescription());
            payload.put("fixDiff", incident.getProposedFix().getDiff());
        }
        if (incident.getSafetyResult() != null) {
            payload.put("safetyPassed", incident.getSafetyResult().isPassed());
            payload.put("safetyScore", incident.getSafetyResult().getScore());
        }
        payload.put("resolvedAt", incident.getResolvedAt());
        payload.putAll(extra);
        return payload;
    }
}
