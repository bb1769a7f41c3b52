package com.z254.sentinel.responder.client;

import com.z254.sentinel.responder.domain.model.FaultType;
import com.z254.sentinel.responder.domain.model.HealthSignal;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Operations against the monitored application.
 */
public interface MonitoredServiceClient {

    /**
     * Current health. Never errors: an unreachable service yields an unhealthy signal.
     */
    Mono<HealthSignal> checkHealth();

    /**
     * Most recent log lines; empty when unavailable.
     */
    Mono<List<String>> recentLogs(int limit);

    /**
     * Contents of a file of the monitored application; empty string when unavailable.
     */
    Mono<String> fetchFile(String name);

    /**
     * Run the recovery action for a fault type (restore known-good files, restart process).
     */
    Mono<Void> recover(FaultType faultType);

    Mono<Void> restart();

    /**
     * Inject a fault for drills.
     */
    Mono<Void> injectFault(FaultType faultType);

    Mono<Void> clearFaults();
}
