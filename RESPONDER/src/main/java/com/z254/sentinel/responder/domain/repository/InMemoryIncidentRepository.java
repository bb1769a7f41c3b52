package com.z254.sentinel.responder.domain.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.sentinel.responder.domain.model.Incident;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local store. Incidents are lost on restart. Stores and hands out copies: a caller
 * mutating an incident changes nothing until it saves.
 */
@Repository
@ConditionalOnProperty(prefix = "responder.persistence", name = "mode", havingValue = "IN_MEMORY", matchIfMissing = true)
public class InMemoryIncidentRepository implements IncidentRepository {

    private final ObjectMapper objectMapper;
    private final Map<String, Incident> store = new ConcurrentHashMap<>();

    public InMemoryIncidentRepository(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public Incident save(Incident incident) {
        store.put(incident.getId(), IncidentCopies.copy(objectMapper, incident));
        return incident;
    }

    @Override
    public Optional<Incident> findById(String id) {
        return Optional.ofNullable(store.get(id)).map(incident -> IncidentCopies.copy(objectMapper, incident));
    }

    @Override
    public List<Incident> findAll() {
        return store.values().stream()
                .sorted(Comparator.comparing(Incident::getDetectedAt,
                        Comparator.nullsLast(Comparator.reverseOrder())))
                .map(incident -> IncidentCopies.copy(objectMapper, incident))
                .toList();
    }
}
