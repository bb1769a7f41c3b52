package com.z254.sentinel.responder.lifecycle;

import com.z254.sentinel.responder.broadcast.BroadcastEventType;
import com.z254.sentinel.responder.broadcast.EventBroadcaster;
import com.z254.sentinel.responder.diagnosis.DiagnosisAdapter;
import com.z254.sentinel.responder.domain.exception.AuthorizationException;
import com.z254.sentinel.responder.domain.exception.IncidentNotFoundException;
import com.z254.sentinel.responder.domain.exception.IncidentValidationException;
import com.z254.sentinel.responder.domain.exception.InvariantViolationException;
import com.z254.sentinel.responder.domain.model.ApprovalAction;
import com.z254.sentinel.responder.domain.model.ApprovalRecord;
import com.z254.sentinel.responder.domain.model.ApprovalSeverity;
import com.z254.sentinel.responder.domain.model.Comment;
import com.z254.sentinel.responder.domain.model.FixProposal;
import com.z254.sentinel.responder.domain.model.HumanDecision;
import com.z254.sentinel.responder.domain.model.Incident;
import com.z254.sentinel.responder.domain.model.IncidentStatus;
import com.z254.sentinel.responder.domain.model.Role;
import com.z254.sentinel.responder.domain.model.User;
import com.z254.sentinel.responder.domain.repository.ApprovalRecordRepository;
import com.z254.sentinel.responder.domain.repository.IncidentRepository;
import com.z254.sentinel.responder.domain.service.ActivityLogService;
import com.z254.sentinel.responder.domain.service.UserDirectory;
import com.z254.sentinel.responder.monitor.DedupGuard;
import com.z254.sentinel.responder.observability.ResponderMetrics;
import com.z254.sentinel.responder.observability.ResponderStructuredLogger;
import com.z254.sentinel.responder.observability.ResponderStructuredLogger.ApprovalEventType;
import com.z254.sentinel.responder.remediation.ApplyAndVerifyExecutor;
import com.z254.sentinel.responder.scoring.ConfidenceScorer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Human actions on incidents: approve, reject, override and request changes.
 * <p>
 * Every check runs before anything is written, so a refused action leaves the incident, the approval
 * log and the learning store untouched. Actions on one incident are serialized with the same lock
 * the monitor pipeline uses. Methods block; call them off event-loop threads.
 */
@Slf4j
@Service
public class ApprovalWorkflow {

    private final IncidentRepository incidentRepository;
    private final ApprovalRecordRepository approvalRepository;
    private final UserDirectory userDirectory;
    private final IncidentStateMachine stateMachine;
    private final IncidentLocks locks;
    private final DedupGuard dedupGuard;
    private final DiagnosisAdapter diagnosisAdapter;
    private final ConfidenceScorer confidenceScorer;
    private final ClearanceReporter clearanceReporter;
    private final ApplyAndVerifyExecutor applyAndVerify;
    private final ActivityLogService activityLog;
    private final EventBroadcaster broadcaster;
    private final ResponderMetrics metrics;
    private final ResponderStructuredLogger logger;

    public ApprovalWorkflow(IncidentRepository incidentRepository,
                            ApprovalRecordRepository approvalRepository,
                            UserDirectory userDirectory,
                            IncidentStateMachine stateMachine,
                            IncidentLocks locks,
                            DedupGuard dedupGuard,
                            DiagnosisAdapter diagnosisAdapter,
                            ConfidenceScorer confidenceScorer,
                            ClearanceReporter clearanceReporter,
                            ApplyAndVerifyExecutor applyAndVerify,
                            ActivityLogService activityLog,
                            EventBroadcaster broadcaster,
                            ResponderMetrics metrics,
                            ResponderStructuredLogger logger) {
        this.incidentRepository = incidentRepository;
        this.approvalRepository = approvalRepository;
        this.userDirectory = userDirectory;
        this.stateMachine = stateMachine;
        this.locks = locks;
        this.dedupGuard = dedupGuard;
        this.diagnosisAdapter = diagnosisAdapter;
        this.confidenceScorer = confidenceScorer;
        this.clearanceReporter = clearanceReporter;
        this.applyAndVerify = applyAndVerify;
        this.activityLog = activityLog;
        this.broadcaster = broadcaster;
        this.metrics = metrics;
        this.logger = logger;
    }

    /**
     * Apply a human action.
     *
     * @throws IncidentNotFoundException     no such incident
     * @throws InvariantViolationException   the incident is already resolved or rejected
     * @throws AuthorizationException        the actor's role is below the incident's approval severity
     * @throws IncidentValidationException   the action does not apply in the current status, or is malformed
     */
    public ActionOutcome submitAction(String incidentId, String actor, ApprovalAction action, String comment) {
        if (actor == null || actor.isBlank()) {
            throw new IncidentValidationException("Actor is required");
        }
        if (action == null) {
            throw new IncidentValidationException("Action is required");
        }

        ActionOutcome outcome = locks.withLock(incidentId, () -> {
            Incident incident = apply(incidentId, actor, action, comment);
            return new ActionOutcome(incidentId, incident.getStatus(), incident.getConfidenceScore());
        });

        if (outcome.getStatus() == IncidentStatus.DEPLOYING) {
            applyAndVerify.submit(incidentId, outcome.getConfidence() != null ? outcome.getConfidence() : 0.0);
        }
        return outcome;
    }

    private Incident apply(String incidentId, String actor, ApprovalAction action, String comment) {
        Incident incident = incidentRepository.findById(incidentId)
                .orElseThrow(() -> new IncidentNotFoundException(incidentId));
        if (incident.isTerminal()) {
            throw new InvariantViolationException("Incident " + incidentId + " is already "
                    + incident.getStatus().wireName());
        }

        Optional<User> user = userDirectory.find(actor);
        authorize(incident, actor, user, action);
        validate(incident, action, comment);

        approvalRepository.append(ApprovalRecord.builder()
                .id(UUID.randomUUID().toString())
                .incidentId(incidentId)
                .actor(actor)
                .actorRole(user.map(User::getRole).orElse(null))
                .action(action)
                .comment(comment)
                .createdAt(Instant.now())
                .build());
        metrics.recordAction(action.wireName());

        switch (action) {
            case APPROVE -> approve(incident, actor, comment);
            case OVERRIDE -> override(incident, actor, comment);
            case REJECT -> reject(incident, actor, comment);
            case REQUEST_CHANGES -> requestChanges(incident, actor, comment);
        }
        return incident;
    }

    private void authorize(Incident incident, String actor, Optional<User> user, ApprovalAction action) {
        if (!action.requiresAuthority()) {
            return;
        }
        ApprovalSeverity severity = incident.getApprovalSeverity() != null
                ? incident.getApprovalSeverity() : ApprovalSeverity.BLOCKER;
        boolean allowed = user.map(u -> u.getRole() != null && u.getRole().canApprove(severity)).orElse(false);
        if (!allowed) {
            Role required = severity.minimumRole();
            metrics.recordAuthorizationDenied();
            logger.logApprovalEvent(incident.getId(), actor, ApprovalEventType.DENIED,
                    "Action refused: insufficient role",
                    Map.of("action", action.wireName(),
                            "approvalSeverity", severity.wireName(),
                            "requiredRole", required.wireName(),
                            "actorRole", user.map(u -> u.getRole().wireName()).orElse("none")));
            throw new AuthorizationException(actor, required);
        }
    }

    private void validate(Incident incident, ApprovalAction action, String comment) {
        IncidentStatus status = incident.getStatus();
        boolean applicable = switch (action) {
            case APPROVE, OVERRIDE, REQUEST_CHANGES -> status.isActionable();
            case REJECT -> status.canTransitionTo(IncidentStatus.REJECTED);
        };
        if (!applicable) {
            logger.logApprovalEvent(incident.getId(), null, ApprovalEventType.INVALID,
                    "Action does not apply in current status",
                    Map.of("action", action.wireName(), "status", status.wireName()));
            throw new IncidentValidationException("Cannot " + action.wireName() + " incident "
                    + incident.getId() + " while it is " + status.wireName());
        }
        if (action == ApprovalAction.OVERRIDE && isBlank(comment)) {
            throw new IncidentValidationException("Override requires the replacement fix in the comment");
        }
        if (action == ApprovalAction.REQUEST_CHANGES && isBlank(comment)) {
            throw new IncidentValidationException("Requesting changes requires feedback in the comment");
        }
    }

    private void approve(Incident incident, String actor, String comment) {
        activityLog.record(incident.getId(), actor, "approved", isBlank(comment) ? "Fix approved" : comment);
        clearanceReporter.report(incident, actor, ApprovalAction.APPROVE);
        stateMachine.transition(incident, IncidentStatus.DEPLOYING, Map.of("approvedBy", actor));
        confidenceScorer.recordDecision(incident, HumanDecision.APPROVED);
        logger.logApprovalEvent(incident.getId(), actor, ApprovalEventType.APPROVED, "Fix approved", Map.of());
    }

    private void override(Incident incident, String actor, String replacement) {
        incident.setProposedFix(FixProposal.manual(replacement, actor));
        activityLog.record(incident.getId(), actor, "overridden", "Human override: " + replacement);
        clearanceReporter.report(incident, actor, ApprovalAction.OVERRIDE);
        stateMachine.transition(incident, IncidentStatus.DEPLOYING, Map.of("overriddenBy", actor));
        confidenceScorer.recordDecision(incident, HumanDecision.MODIFIED);
        logger.logApprovalEvent(incident.getId(), actor, ApprovalEventType.OVERRIDDEN, "Fix overridden", Map.of());
    }

    private void reject(Incident incident, String actor, String comment) {
        stateMachine.transition(incident, IncidentStatus.REJECTED, Map.of("rejectedBy", actor));
        dedupGuard.releaseIncident(incident.getId());
        activityLog.record(incident.getId(), actor, "rejected", isBlank(comment) ? "Fix rejected" : comment);
        confidenceScorer.recordDecision(incident, HumanDecision.REJECTED);
        metrics.recordIncidentRejected();
        logger.logApprovalEvent(incident.getId(), actor, ApprovalEventType.REJECTED, "Fix rejected", Map.of());
    }

    private void requestChanges(Incident incident, String actor, String feedback) {
        activityLog.record(incident.getId(), actor, "changes_requested", feedback);
        logger.logApprovalEvent(incident.getId(), actor, ApprovalEventType.CHANGES_REQUESTED,
                "Changes requested", Map.of("strategy", diagnosisAdapter.activeStrategy()));

        FixProposal refined = diagnosisAdapter.refineFix(incident, feedback).block();
        if (refined != null) {
            incident.setProposedFix(refined);
        }
        stateMachine.transition(incident, IncidentStatus.FIX_PROPOSED,
                Map.of("refined", true, "changesRequestedBy", actor));
        activityLog.recordAgent(incident.getId(), "fix_refined", "Fix updated per feedback from " + actor);
    }

    /**
     * Add a discussion comment. Comments are open to anyone and never change status.
     */
    public Comment addComment(String incidentId, String author, String content) {
        if (author == null || author.isBlank()) {
            throw new IncidentValidationException("Author is required");
        }
        if (isBlank(content)) {
            throw new IncidentValidationException("Comment content is required");
        }
        incidentRepository.findById(incidentId).orElseThrow(() -> new IncidentNotFoundException(incidentId));

        Comment comment = approvalRepository.appendComment(Comment.builder()
                .id(UUID.randomUUID().toString())
                .incidentId(incidentId)
                .author(author)
                .content(content)
                .createdAt(Instant.now())
                .build());
        broadcaster.broadcast(BroadcastEventType.NEW_COMMENT, comment);
        logger.logApprovalEvent(incidentId, author, ApprovalEventType.COMMENTED, "Comment added", Map.of());
        return comment;
    }

    public List<ApprovalRecord> approvals(String incidentId) {
        return approvalRepository.findByIncidentId(incidentId);
    }

    public List<Comment> comments(String incidentId) {
        return approvalRepository.findCommentsByIncidentId(incidentId);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
