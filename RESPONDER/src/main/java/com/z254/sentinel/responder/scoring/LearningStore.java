package com.z254.sentinel.responder.scoring;

import com.z254.sentinel.responder.domain.model.HumanDecision;
import com.z254.sentinel.responder.domain.model.LearningRecord;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Append-only record of human decisions, queried by diagnosis category.
 */
@Component
public class LearningStore {

    static final int ERROR_PATTERN_LIMIT = 500;

    private final List<LearningRecord> records = new CopyOnWriteArrayList<>();

    public LearningRecord append(LearningRecord record) {
        records.add(record);
        return record;
    }

    /**
     * Fraction of approved decisions for {@code category}; empty when there are no records.
     */
    public Optional<Double> approvalRate(String category) {
        List<LearningRecord> matching = records.stream()
                .filter(record -> record.getIncidentType().equalsIgnoreCase(category))
                .toList();
        if (matching.isEmpty()) {
            return Optional.empty();
        }
        long approved = matching.stream()
                .filter(record -> record.getHumanDecision() == HumanDecision.APPROVED)
                .count();
        return Optional.of((double) approved / matching.size());
    }

    public List<LearningRecord> all() {
        return List.copyOf(records);
    }

    /**
     * Totals by decision plus the per-category approval rate.
     */
    public Map<String, Object> stats() {
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("totalDecisions", records.size());
        for (HumanDecision decision : HumanDecision.values()) {
            stats.put(decision.wireName(), records.stream()
                    .filter(record -> record.getHumanDecision() == decision)
                    .count());
        }
        Map<String, Double> rates = records.stream()
                .map(LearningRecord::getIncidentType)
                .distinct()
                .collect(Collectors.toMap(category -> category,
                        category -> approvalRate(category).orElse(0.0),
                        (a, b) -> a,
                        LinkedHashMap::new));
        stats.put("approvalRateByCategory", rates);
        return stats;
    }

    static String errorPattern(String evidenceText) {
        if (evidenceText == null) {
            return "";
        }
        return evidenceText.length() <= ERROR_PATTERN_LIMIT
                ? evidenceText
                : evidenceText.substring(0, ERROR_PATTERN_LIMIT);
    }
}
