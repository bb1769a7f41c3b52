package com.z254.sentinel.responder.safety;

import com.z254.sentinel.responder.client.SafetyValidationClient;
import com.z254.sentinel.responder.domain.model.FaultType;
import com.z254.sentinel.responder.domain.model.SafetyResult;
import com.z254.sentinel.responder.domain.model.SafetyResult.CheckCategory;
import com.z254.sentinel.responder.domain.model.SafetyResult.SafetyCheck;
import com.z254.sentinel.responder.observability.ResponderMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs a fix through the remote validator when one is configured, else through the local
 * {@link SafetyGate}. Once the remote fails it is marked unavailable and the local gate is used
 * from then on.
 */
@Slf4j
@Service
public class SafetyValidator {

    public static final String REMOTE_PROVIDER = "remote-validator";

    private final SafetyGate safetyGate;
    private final SafetyValidationClient remote;
    private final ResponderMetrics metrics;

    private final AtomicBoolean remoteUnavailable = new AtomicBoolean(false);
    private final AtomicLong checksRun = new AtomicLong();
    private final AtomicLong checksPassed = new AtomicLong();
    private final AtomicLong checksFailed = new AtomicLong();

    public SafetyValidator(SafetyGate safetyGate, SafetyValidationClient remote, ResponderMetrics metrics) {
        this.safetyGate = safetyGate;
        this.remote = remote;
        this.metrics = metrics;
    }

    public Mono<SafetyResult> validate(FaultType faultType, String rootCause, String fixText) {
        Mono<SafetyResult> result = useRemote()
                ? checkRemote(faultType, rootCause, fixText)
                        .onErrorResume(e -> {
                            remoteUnavailable.set(true);
                            metrics.recordFallback("safety-validation");
                            log.warn("Remote safety validation unavailable, using local rules: {}", e.getMessage());
                            return Mono.fromCallable(() -> safetyGate.evaluate(faultType, fixText));
                        })
                : Mono.fromCallable(() -> safetyGate.evaluate(faultType, fixText));

        return result.doOnNext(this::recordStats);
    }

    public Map<String, Object> stats() {
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("provider", useRemote() ? REMOTE_PROVIDER : SafetyGate.PROVIDER);
        stats.put("checksRun", checksRun.get());
        stats.put("passed", checksPassed.get());
        stats.put("failed", checksFailed.get());
        return stats;
    }

    public long checksRun() {
        return checksRun.get();
    }

    public long checksPassed() {
        return checksPassed.get();
    }

    private boolean useRemote() {
        return remote.isEnabled() && !remoteUnavailable.get();
    }

    private Mono<SafetyResult> checkRemote(FaultType faultType, String rootCause, String fixText) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("faultType", faultType.getKey());
        context.put("rootCause", rootCause);
        return remote.check(fixText, context)
                .map(verdict -> toResult(verdict, fixText));
    }

    private SafetyResult toResult(SafetyValidationClient.Verdict verdict, String fixText) {
        List<SafetyCheck> checks = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        verdict.getPolicies().forEach((id, policy) -> {
            String name = policy.getName() != null ? policy.getName() : id;
            checks.add(SafetyCheck.builder()
                    .name(name)
                    .category(CheckCategory.CRITICAL)
                    .passed(!policy.isFlagged())
                    .message(policy.isFlagged() ? "Policy violated" : "Policy satisfied")
                    .build());
            if (policy.isFlagged()) {
                warnings.add("Policy flagged: " + name);
            }
        });
        boolean passed = !verdict.isFlagged();
        return SafetyResult.builder()
                .passed(passed)
                .score(passed ? 1.0 : 0.1)
                .checks(checks)
                .warnings(warnings)
                .reasoning(passed ? "Remote validator found no policy violations"
                        : "Remote validator flagged the fix")
                .provider(REMOTE_PROVIDER)
                .providerMode("remote")
                .evaluatedAt(Instant.now())
                .build();
    }

    private void recordStats(SafetyResult result) {
        checksRun.incrementAndGet();
        if (result.isPassed()) {
            checksPassed.incrementAndGet();
        } else {
            checksFailed.incrementAndGet();
            metrics.recordSafetyBlocked();
        }
    }
}
