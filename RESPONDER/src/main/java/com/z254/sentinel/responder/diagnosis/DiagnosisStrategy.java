package com.z254.sentinel.responder.diagnosis;

import com.z254.sentinel.responder.domain.model.Diagnosis;
import com.z254.sentinel.responder.domain.model.Evidence;
import com.z254.sentinel.responder.domain.model.FaultType;
import com.z254.sentinel.responder.domain.model.FixProposal;
import com.z254.sentinel.responder.domain.model.Incident;
import reactor.core.publisher.Mono;

/**
 * Produces a diagnosis and a candidate fix for a classified fault.
 */
public interface DiagnosisStrategy {

    /**
     * Short identifier recorded as the source of diagnoses and fixes.
     */
    String name();

    /**
     * Whether the strategy can be used right now.
     */
    boolean isAvailable();

    Mono<Diagnosis> diagnose(FaultType faultType, Evidence evidence);

    Mono<FixProposal> generateFix(FaultType faultType, Diagnosis diagnosis, Evidence evidence);

    /**
     * Re-propose the incident's fix taking engineer feedback into account.
     */
    Mono<FixProposal> refineFix(Incident incident, String feedback);
}
