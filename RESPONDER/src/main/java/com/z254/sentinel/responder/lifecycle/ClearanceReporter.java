package com.z254.sentinel.responder.lifecycle;

import com.z254.sentinel.responder.broadcast.BroadcastEventType;
import com.z254.sentinel.responder.broadcast.EventBroadcaster;
import com.z254.sentinel.responder.domain.model.ApprovalAction;
import com.z254.sentinel.responder.domain.model.Incident;
import com.z254.sentinel.responder.domain.model.User;
import com.z254.sentinel.responder.domain.service.ActivityLogService;
import com.z254.sentinel.responder.domain.service.UserDirectory;
import com.z254.sentinel.responder.observability.ResponderStructuredLogger;
import com.z254.sentinel.responder.observability.ResponderStructuredLogger.ApprovalEventType;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Notifies final-authority users that a fix was cleared for deploy.
 * <p>
 * Marks the incident cleared, then sends a {@code clearance_report} directly to each final-authority
 * user who is connected. Users who are offline see it in the activity log.
 */
@Component
public class ClearanceReporter {

    private final UserDirectory userDirectory;
    private final EventBroadcaster broadcaster;
    private final ActivityLogService activityLog;
    private final ResponderStructuredLogger logger;

    public ClearanceReporter(UserDirectory userDirectory,
                             EventBroadcaster broadcaster,
                             ActivityLogService activityLog,
                             ResponderStructuredLogger logger) {
        this.userDirectory = userDirectory;
        this.broadcaster = broadcaster;
        this.activityLog = activityLog;
        this.logger = logger;
    }

    /**
     * Caller holds the incident lock and saves the incident afterwards.
     *
     * @return names of the users the report was delivered to
     */
    public List<String> report(Incident incident, String actor, ApprovalAction action) {
        incident.setClearedBy(actor);
        incident.setClearedAt(Instant.now());

        Map<String, Object> report = compose(incident, actor, action);
        List<String> delivered = new ArrayList<>();
        for (User user : userDirectory.finalAuthorities()) {
            if (broadcaster.sendTo(user.getName(), BroadcastEventType.CLEARANCE_REPORT, report)) {
                delivered.add(user.getName());
            }
        }

        activityLog.record(incident.getId(), actor, "clearance_report", (String) report.get("summary"));
        logger.logApprovalEvent(incident.getId(), actor, ApprovalEventType.CLEARANCE_SENT,
                "Clearance report sent", Map.of("recipients", String.join(",", delivered)));
        return delivered;
    }

    static Map<String, Object> compose(Incident incident, String actor, ApprovalAction action) {
        String fix = incident.getProposedFix() != null ? incident.getProposedFix().getDescription() : "n/a";
        String verb = action == ApprovalAction.OVERRIDE ? "overrode the proposed fix for" : "cleared";
        String summary = String.format("%s %s incident %s (%s, %s severity): %s",
                actor, verb, incident.getId(),
                incident.getFaultType() != null ? incident.getFaultType().getKey() : "unknown",
                incident.getApprovalSeverity() != null ? incident.getApprovalSeverity().wireName() : "unknown",
                fix);

        Map<String, Object> report = new LinkedHashMap<>();
        report.put("incidentId", incident.getId());
        report.put("title", incident.getTitle());
        report.put("clearedBy", actor);
        report.put("clearedAt", incident.getClearedAt());
        report.put("action", action);
        report.put("approvalSeverity", incident.getApprovalSeverity());
        report.put("rootCause", incident.getRootCause());
        report.put("fix", fix);
        report.put("confidence", incident.getConfidenceScore());
        report.put("summary", summary);
        return report;
    }
}
