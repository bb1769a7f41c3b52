package com.z254.sentinel.responder.safety;

import com.z254.sentinel.responder.domain.model.FaultType;
import com.z254.sentinel.responder.domain.model.SafetyResult;
import com.z254.sentinel.responder.domain.model.SafetyResult.CheckCategory;
import com.z254.sentinel.responder.domain.model.SafetyResult.SafetyCheck;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Local rule engine that screens a proposed fix before it can be applied.
 * <p>
 * Critical checks decide pass/fail; advisory checks only lower the score:
 * {@code score = (critical ? 1.0 : 0.2) * (0.7 + 0.3 * advisoryPassed / advisoryTotal)}.
 * Pure function of its input.
 */
@Slf4j
@Component
public class SafetyGate {

    public static final String PROVIDER = "local-rules";

    private static final List<String> DESTRUCTIVE_PATTERNS = List.of(
            "rm -rf /", "rm -rf", "drop table", "drop database", "truncate",
            "format c:", "fdisk", "mkfs", "dd if=/dev/zero", ":(){ :|:& };:",
            "> /dev/sda", "chmod -r 777 /");

    private static final List<String> DATA_LOSS_PATTERNS = List.of(
            "delete from", "drop ", "truncate ", "remove all", "purge", "wipe", "destroy");

    private static final List<String> SECURITY_PATTERNS = List.of(
            "chmod 777", "chmod 666", "password=", "secret=", "disable_auth", "allow_all",
            "skip-grant-tables", "nosql injection", "eval(", "exec(", "__import__");

    private static final List<Pattern> CREDENTIAL_PATTERNS = List.of(
            Pattern.compile("[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Z|a-z]{2,}", Pattern.CASE_INSENSITIVE),
            Pattern.compile("sk-[a-zA-Z0-9]{20,}", Pattern.CASE_INSENSITIVE),
            Pattern.compile("-----BEGIN (RSA |EC )?PRIVATE KEY", Pattern.CASE_INSENSITIVE),
            Pattern.compile("aws_secret_access_key", Pattern.CASE_INSENSITIVE),
            Pattern.compile("AKIA[0-9A-Z]{16}", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\b\\d{3}-\\d{2}-\\d{4}\\b", Pattern.CASE_INSENSITIVE));

    private static final List<String> ROLLBACK_INDICATORS = List.of(
            "backup", "restore", "revert", "rollback", ".bak", "undo");

    private static final Map<FaultType, List<String>> COHERENCE_KEYWORDS = Map.of(
            FaultType.CRASH, List.of("restart", "start", "process", "run"),
            FaultType.BAD_CONFIG, List.of("config", "json", "restore", "backup"),
            FaultType.BUG, List.of("handler", "fix", "restore", "revert", "code"),
            FaultType.SLOW, List.of("sleep", "remove", "handler", "restore", "timeout"));

    private static final List<String> BROAD_SCOPE_PATTERNS = List.of(
            "find /", "sed -i", "for file in", "glob.glob");

    /**
     * Evaluate {@code fixText} proposed for a fault of type {@code faultType}.
     */
    public SafetyResult evaluate(FaultType faultType, String fixText) {
        String raw = fixText != null ? fixText : "";
        String lower = raw.toLowerCase(Locale.ROOT);

        List<SafetyCheck> checks = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        // ========== Critical Checks ==========

        checks.add(substringCheck("no_destructive_commands", lower, DESTRUCTIVE_PATTERNS,
                "Destructive command detected"));
        checks.add(substringCheck("no_data_loss", lower, DATA_LOSS_PATTERNS,
                "Potential data loss operation"));
        checks.add(substringCheck("no_security_regression", lower, SECURITY_PATTERNS,
                "Security regression pattern"));
        checks.add(credentialCheck(raw));

        // ========== Advisory Checks ==========

        SafetyCheck rollback = rollbackCheck(faultType, lower);
        SafetyCheck coherence = coherenceCheck(faultType, lower);
        SafetyCheck scope = scopeCheck(lower);
        for (SafetyCheck advisory : List.of(rollback, coherence, scope)) {
            checks.add(advisory);
            if (!advisory.isPassed()) {
                warnings.add(advisory.getMessage());
            }
        }

        boolean criticalPassed = checks.stream()
                .filter(check -> check.getCategory() == CheckCategory.CRITICAL)
                .allMatch(SafetyCheck::isPassed);
        long advisoryTotal = checks.stream()
                .filter(check -> check.getCategory() == CheckCategory.ADVISORY)
                .count();
        long advisoryPassed = checks.stream()
                .filter(check -> check.getCategory() == CheckCategory.ADVISORY)
                .filter(SafetyCheck::isPassed)
                .count();

        double score = score(criticalPassed, advisoryPassed, advisoryTotal);

        SafetyResult result = SafetyResult.builder()
                .passed(criticalPassed)
                .score(score)
                .checks(checks)
                .warnings(warnings)
                .reasoning(reasoning(criticalPassed, checks))
                .provider(PROVIDER)
                .providerMode("local")
                .evaluatedAt(Instant.now())
                .build();

        if (!criticalPassed) {
            log.warn("Safety gate blocked fix for {}: {}", faultType, result.getReasoning());
        }
        return result;
    }

    static double score(boolean criticalPassed, long advisoryPassed, long advisoryTotal) {
        double base = criticalPassed ? 1.0 : 0.2;
        double advisoryFraction = advisoryTotal == 0 ? 1.0 : (double) advisoryPassed / advisoryTotal;
        double raw = base * (0.7 + 0.3 * advisoryFraction);
        return Math.round(raw * 1000.0) / 1000.0;
    }

    // ========== Check Helpers ==========

    private SafetyCheck substringCheck(String name, String lower, List<String> patterns, String label) {
        List<String> found = patterns.stream().filter(lower::contains).toList();
        return SafetyCheck.builder()
                .name(name)
                .category(CheckCategory.CRITICAL)
                .passed(found.isEmpty())
                .message(found.isEmpty() ? "No matches" : label + ": " + String.join(", ", found))
                .build();
    }

    private SafetyCheck credentialCheck(String raw) {
        List<String> found = CREDENTIAL_PATTERNS.stream()
                .filter(pattern -> pattern.matcher(raw).find())
                .map(Pattern::pattern)
                .toList();
        return SafetyCheck.builder()
                .name("no_credential_exposure")
                .category(CheckCategory.CRITICAL)
                .passed(found.isEmpty())
                .message(found.isEmpty() ? "No credentials or PII found"
                        : "Sensitive data pattern found (" + found.size() + " match types)")
                .build();
    }

    private SafetyCheck rollbackCheck(FaultType faultType, String lower) {
        boolean passed = faultType == FaultType.CRASH
                || ROLLBACK_INDICATORS.stream().anyMatch(lower::contains);
        return SafetyCheck.builder()
                .name("rollback_possible")
                .category(CheckCategory.ADVISORY)
                .passed(passed)
                .message(passed ? "Fix is reversible" : "No rollback path evident in fix")
                .build();
    }

    private SafetyCheck coherenceCheck(FaultType faultType, String lower) {
        List<String> keywords = faultType != null ? COHERENCE_KEYWORDS.get(faultType) : null;
        boolean passed = keywords == null || keywords.stream().anyMatch(lower::contains);
        return SafetyCheck.builder()
                .name("fix_fault_coherence")
                .category(CheckCategory.ADVISORY)
                .passed(passed)
                .message(passed ? "Fix addresses the detected fault"
                        : "Fix does not mention anything related to a " + faultType.getKey() + " fault")
                .build();
    }

    private SafetyCheck scopeCheck(String lower) {
        List<String> found = BROAD_SCOPE_PATTERNS.stream().filter(lower::contains).toList();
        return SafetyCheck.builder()
                .name("minimal_scope")
                .category(CheckCategory.ADVISORY)
                .passed(found.isEmpty())
                .message(found.isEmpty() ? "Fix is narrowly scoped"
                        : "Broad-scope operation: " + String.join(", ", found))
                .build();
    }

    private String reasoning(boolean criticalPassed, List<SafetyCheck> checks) {
        List<String> failed = checks.stream()
                .filter(check -> !check.isPassed())
                .map(check -> check.getName() + " (" + check.getMessage() + ")")
                .toList();
        if (failed.isEmpty()) {
            return "All safety checks passed";
        }
        String prefix = criticalPassed ? "Passed with warnings: " : "Blocked by critical check: ";
        return prefix + String.join("; ", failed);
    }
}
