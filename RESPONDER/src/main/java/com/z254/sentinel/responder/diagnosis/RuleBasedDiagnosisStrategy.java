package com.z254.sentinel.responder.diagnosis;

import com.z254.sentinel.responder.domain.model.Diagnosis;
import com.z254.sentinel.responder.domain.model.Evidence;
import com.z254.sentinel.responder.domain.model.FaultType;
import com.z254.sentinel.responder.domain.model.FixProposal;
import com.z254.sentinel.responder.domain.model.HealthSignal;
import com.z254.sentinel.responder.domain.model.Incident;
import com.z254.sentinel.responder.domain.model.RiskLevel;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Deterministic diagnosis keyed by fault type. Always available; also the fallback whenever the
 * reasoning engine cannot answer.
 */
@Component
public class RuleBasedDiagnosisStrategy implements DiagnosisStrategy {

    public static final String NAME = "rule-based";

    static final String FEEDBACK_PREFIX = "\n\nUpdated per engineer feedback: ";

    private static final Pattern TRACEBACK_LINE = Pattern.compile("line (\\d+)");

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public Mono<Diagnosis> diagnose(FaultType faultType, Evidence evidence) {
        return Mono.fromCallable(() -> diagnoseNow(faultType, evidence));
    }

    @Override
    public Mono<FixProposal> generateFix(FaultType faultType, Diagnosis diagnosis, Evidence evidence) {
        return Mono.fromCallable(() -> fixFor(faultType));
    }

    @Override
    public Mono<FixProposal> refineFix(Incident incident, String feedback) {
        return Mono.fromCallable(() -> refine(incident.getProposedFix(), feedback));
    }

    Diagnosis diagnoseNow(FaultType faultType, Evidence evidence) {
        HealthSignal signal = evidence != null ? evidence.getHealthSignal() : null;
        String error = signal != null && signal.getError() != null ? signal.getError() : "";
        String errorType = signal != null && signal.getErrorType() != null ? signal.getErrorType() : "";
        String detail = signal != null && signal.getDetail() != null ? signal.getDetail() : "";
        String traceback = tracebackOf(evidence, signal);

        Diagnosis.DiagnosisBuilder builder = Diagnosis.builder().source(NAME);
        FaultType type = faultType != null ? faultType : FaultType.UNKNOWN;
        switch (type) {
            case CRASH -> builder
                    .category("crash")
                    .rootCause("Application process is not running - it was killed or crashed. "
                            + "No response on health endpoint.")
                    .explanation("Health check returned: " + error + " (" + errorType + "). "
                            + "The process is no longer alive and needs a restart.");
            case BAD_CONFIG -> builder
                    .category("config")
                    .rootCause("config.json contains invalid JSON - parser error: "
                            + (detail.isBlank() ? error : detail))
                    .fileAtFault("config.json")
                    .lineNumber("1-10")
                    .explanation("The configuration file cannot be parsed, so the service fails on startup. "
                            + "Restore config.json from the last known-good backup and restart.");
            case BUG -> {
                String[] lines = traceback.isBlank() ? new String[0] : traceback.strip().split("\n");
                String errorLine = lines.length > 0 ? lines[lines.length - 1].strip() : error;
                builder.category("bug")
                        .rootCause("Code bug in handler.py - " + errorLine
                                + ". A code change references something that is not defined.")
                        .fileAtFault("handler.py")
                        .lineNumber(handlerLine(lines, errorLine))
                        .explanation("Requests fail with " + (errorType.isBlank() ? "an exception" : errorType)
                                + " raised from handler.py. Revert handler.py to the last working version.");
            }
            case SLOW -> builder
                    .category("performance")
                    .rootCause("Health check timed out (>5s) - handler.py contains blocking "
                            + "time.sleep() calls injected at line 54")
                    .fileAtFault("handler.py")
                    .lineNumber("54-70")
                    .explanation("Blocking sleeps in the request path make every request exceed the health "
                            + "timeout. Remove them and restart so the cached module is reloaded.");
            default -> builder
                    .category("unknown")
                    .rootCause("Application error: " + error)
                    .explanation("The application reported an unexpected error. A manual review may be needed.");
        }
        return builder.build();
    }

    FixProposal fixFor(FaultType faultType) {
        FaultType type = faultType != null ? faultType : FaultType.UNKNOWN;
        FixProposal.FixProposalBuilder builder = FixProposal.builder().source(NAME).riskLevel(RiskLevel.LOW);
        return switch (type) {
            case CRASH -> builder
                    .description("Restart the application process. The process was killed and needs "
                            + "to be brought back online.")
                    .diff("No file changes needed - process restart required.")
                    .fixCode("# Restart the target app process")
                    .testCode("import urllib.request, json\n"
                            + "r = urllib.request.urlopen('http://127.0.0.1:8001/health', timeout=3)\n"
                            + "d = json.loads(r.read())\n"
                            + "assert d['status'] == 'healthy', f'Not healthy: {d}'\n"
                            + "print('App is healthy after restart')")
                    .build();
            case BAD_CONFIG -> builder
                    .description("Restore config.json with valid JSON. The current file has a syntax "
                            + "error (unquoted value).")
                    .diff("--- config.json (broken)\n"
                            + "+++ config.json (fixed)\n"
                            + "@@ -1 +1,6 @@\n"
                            + "-{\"version\": \"1.0.0\", \"database_url\": INVALID_NOT_QUOTED, \"cache_ttl\": 300}\n"
                            + "+{\n"
                            + "+    \"version\": \"1.0.0\",\n"
                            + "+    \"database_url\": \"postgresql://db.internal:5432/production\",\n"
                            + "+    \"cache_ttl\": 300\n"
                            + "+}")
                    .fixCode("# Restore valid config.json from backup")
                    .testCode("import json\n"
                            + "with open('target_app/config.json') as f:\n"
                            + "    config = json.load(f)\n"
                            + "assert 'database_url' in config, 'Missing database_url'\n"
                            + "print('Config valid')")
                    .build();
            case BUG -> builder
                    .description("Revert handler.py - validate() calls an undefined function. Restore the "
                            + "direct config assertion and fix the division in compute_analytics().")
                    .diff("--- handler.py (buggy)\n"
                            + "+++ handler.py (fixed)\n"
                            + "@@ def validate():\n"
                            + "-    status = verify_database_connection(config[\"database_url\"])\n"
                            + "+    assert config.get(\"database_url\"), \"Database URL not configured\"\n"
                            + "@@ def compute_analytics():\n"
                            + "-    avg_order_value = total_revenue / (len(ORDERS) - len(ORDERS))\n"
                            + "+    avg_order_value = total_revenue / len(ORDERS) if ORDERS else 0\n")
                    .fixCode("# Restore handler.py from last known-good version")
                    .testCode("import importlib.util\n"
                            + "spec = importlib.util.spec_from_file_location('h', 'target_app/handler.py')\n"
                            + "mod = importlib.util.module_from_spec(spec)\n"
                            + "spec.loader.exec_module(mod)\n"
                            + "assert mod.validate() == True, 'validate() failed'\n"
                            + "print('All checks passed')")
                    .build();
            case SLOW -> builder
                    .description("Remove blocking time.sleep() calls from handler.py and restart so the "
                            + "module is reloaded.")
                    .diff("--- handler.py (slow)\n"
                            + "+++ handler.py (fixed)\n"
                            + "@@ def validate():\n"
                            + "-    time.sleep(10)\n"
                            + "     config = _load_config()\n")
                    .fixCode("# Restore handler.py - remove time.sleep() calls")
                    .testCode("import time, importlib.util\n"
                            + "spec = importlib.util.spec_from_file_location('h', 'target_app/handler.py')\n"
                            + "mod = importlib.util.module_from_spec(spec)\n"
                            + "spec.loader.exec_module(mod)\n"
                            + "start = time.time()\n"
                            + "mod.validate()\n"
                            + "assert time.time() - start < 1, 'Still slow'\n"
                            + "print('validate() is fast again')")
                    .build();
            default -> builder
                    .description("Restart the application")
                    .diff("N/A")
                    .fixCode("# restart")
                    .testCode("print('OK')")
                    .riskLevel(RiskLevel.MEDIUM)
                    .build();
        };
    }

    /**
     * Append engineer feedback to the current fix description.
     */
    static FixProposal refine(FixProposal current, String feedback) {
        FixProposal base = current != null ? current : FixProposal.builder().description("").build();
        String description = (base.getDescription() != null ? base.getDescription() : "")
                + FEEDBACK_PREFIX + feedback;
        return base.toBuilder().description(description).build();
    }

    private static String tracebackOf(Evidence evidence, HealthSignal signal) {
        if (evidence != null && evidence.getTraceback() != null) {
            return evidence.getTraceback();
        }
        if (signal != null && signal.getTraceback() != null) {
            return signal.getTraceback();
        }
        return "";
    }

    private static String handlerLine(String[] lines, String fallback) {
        String fileLine = null;
        String lineNumber = null;
        for (String line : lines) {
            if (line.contains("handler.py")) {
                fileLine = line.strip();
                Matcher matcher = TRACEBACK_LINE.matcher(line);
                if (matcher.find()) {
                    lineNumber = matcher.group(1);
                }
            }
        }
        if (lineNumber != null) {
            return lineNumber;
        }
        return fileLine != null ? fileLine : fallback;
    }
}
