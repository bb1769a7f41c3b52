package com.z254.sentinel.responder.domain.repository;

import com.z254.sentinel.responder.domain.model.Incident;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Repository abstraction for incident persistence.
 */
public interface IncidentRepository {

    /**
     * Persist the given incident. Existing incidents are replaced.
     */
    Incident save(Incident incident);

    Optional<Incident> findById(String id);

    /**
     * All incidents, newest first.
     */
    List<Incident> findAll();

    /**
     * Incidents not yet resolved or rejected. Used to rebuild the dedup guard on start.
     */
    default List<Incident> findActive() {
        return findAll().stream()
                .filter(incident -> !incident.isTerminal())
                .sorted(Comparator.comparing(Incident::getDetectedAt,
                        Comparator.nullsLast(Comparator.naturalOrder())))
                .toList();
    }
}
