package com.z254.sentinel.responder.domain.service;

import com.z254.sentinel.responder.domain.model.Incident;
import com.z254.sentinel.responder.domain.model.IncidentStatus;
import com.z254.sentinel.responder.domain.repository.IncidentRepository;
import com.z254.sentinel.responder.safety.SafetyValidator;
import com.z254.sentinel.responder.scoring.LearningStore;
import lombok.Builder;
import lombok.Value;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Objects;

/**
 * Aggregate counters over all incidents, for the agent status endpoint and the spoken summary.
 */
@Service
public class IncidentStatsService {

    private final IncidentRepository incidentRepository;
    private final SafetyValidator safetyValidator;
    private final LearningStore learningStore;

    public IncidentStatsService(IncidentRepository incidentRepository,
                                SafetyValidator safetyValidator,
                                LearningStore learningStore) {
        this.incidentRepository = incidentRepository;
        this.safetyValidator = safetyValidator;
        this.learningStore = learningStore;
    }

    public IncidentStats current() {
        List<Incident> incidents = incidentRepository.findAll();
        long resolved = incidents.stream().filter(i -> i.getStatus() == IncidentStatus.RESOLVED).count();
        long rejected = incidents.stream().filter(i -> i.getStatus() == IncidentStatus.REJECTED).count();
        long autoResolved = incidents.stream()
                .filter(i -> i.getStatus() == IncidentStatus.RESOLVED && i.isAutoResolved())
                .count();
        double averageConfidence = incidents.stream()
                .map(Incident::getConfidenceScore)
                .filter(Objects::nonNull)
                .mapToDouble(Double::doubleValue)
                .average()
                .orElse(0.0);

        return IncidentStats.builder()
                .total(incidents.size())
                .resolved(resolved)
                .rejected(rejected)
                .autoResolved(autoResolved)
                .active(incidents.size() - resolved - rejected)
                .averageConfidence(averageConfidence)
                .safetyChecksRun(safetyValidator.checksRun())
                .safetyChecksPassed(safetyValidator.checksPassed())
                .learningRecords(learningStore.all().size())
                .build();
    }

    @Value
    @Builder
    public static class IncidentStats {
        long total;
        long resolved;
        long rejected;
        long autoResolved;
        long active;
        double averageConfidence;
        long safetyChecksRun;
        long safetyChecksPassed;
        long learningRecords;
    }
}
