package com.z254.sentinel.responder.monitor;

import com.z254.sentinel.responder.domain.model.FaultType;
import com.z254.sentinel.responder.domain.model.HealthSignal;
import com.z254.sentinel.responder.domain.model.Incident;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Set;

/**
 * Maps raw health signals to fault-type keys. Precedence is first match wins.
 */
@Component
public class FaultClassifier {

    private static final Set<String> CRASH_ERROR_TYPES = Set.of("ProcessDown", "ConnectionRefused");

    public FaultType classify(HealthSignal signal) {
        String errorType = nullToEmpty(signal.getErrorType());
        String error = nullToEmpty(signal.getError()).toLowerCase(Locale.ROOT);
        String traceback = nullToEmpty(signal.getTraceback());

        if (CRASH_ERROR_TYPES.contains(errorType)) {
            return FaultType.CRASH;
        }
        if ("Timeout".equals(errorType)) {
            return FaultType.SLOW;
        }
        if ("ConfigParseError".equals(errorType) || error.contains("config") || error.contains("json")) {
            return FaultType.BAD_CONFIG;
        }
        if ("NameError".equals(errorType) || traceback.contains("NameError") || traceback.contains("ZeroDivision")) {
            return FaultType.BUG;
        }
        if (traceback.contains("time.sleep")) {
            return FaultType.SLOW;
        }
        return FaultType.UNKNOWN;
    }

    /**
     * Best-effort key from free text, for incidents that have no stored health signal.
     */
    public FaultType classifyRootCause(String text) {
        String lower = nullToEmpty(text).toLowerCase(Locale.ROOT);
        if (containsAny(lower, "config", "json")) {
            return FaultType.BAD_CONFIG;
        }
        if (containsAny(lower, "nameerror", "bug", "undefined", "zerodivision")) {
            return FaultType.BUG;
        }
        if (containsAny(lower, "timeout", "sleep", "slow")) {
            return FaultType.SLOW;
        }
        if (containsAny(lower, "crash", "process", "killed", "connection refused")) {
            return FaultType.CRASH;
        }
        return FaultType.UNKNOWN;
    }

    /**
     * Re-derive the dedup key of a persisted incident with the same rules used at detection.
     */
    public FaultType rekey(Incident incident) {
        if (incident.getEvidence() != null && incident.getEvidence().getHealthSignal() != null) {
            return classify(incident.getEvidence().getHealthSignal());
        }
        if (incident.getRootCause() != null) {
            return classifyRootCause(incident.getRootCause());
        }
        if (incident.getFaultType() != null) {
            return incident.getFaultType();
        }
        return classifyRootCause(incident.getTitle());
    }

    private static boolean containsAny(String text, String... needles) {
        for (String needle : needles) {
            if (text.contains(needle)) {
                return true;
            }
        }
        return false;
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
