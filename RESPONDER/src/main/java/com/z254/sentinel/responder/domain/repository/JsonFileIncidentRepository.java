package com.z254.sentinel.responder.domain.repository;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.sentinel.responder.config.ResponderProperties;
import com.z254.sentinel.responder.domain.model.Incident;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable single-writer store: the whole incident set is rewritten to a JSON snapshot on
 * every save, through a temp file and an atomic move, so a crash never leaves a torn file.
 * A save whose write fails is undone in memory too. Callers always get copies.
 */
@Slf4j
@Repository
@ConditionalOnProperty(prefix = "responder.persistence", name = "mode", havingValue = "FILE")
public class JsonFileIncidentRepository implements IncidentRepository {

    private static final TypeReference<List<Incident>> INCIDENT_LIST = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;
    private final Path path;
    private final Map<String, Incident> store = new LinkedHashMap<>();

    public JsonFileIncidentRepository(ObjectMapper objectMapper, ResponderProperties properties) {
        this.objectMapper = objectMapper;
        this.path = Path.of(properties.getPersistence().getPath());
        load();
    }

    @Override
    public synchronized Incident save(Incident incident) {
        Incident previous = store.put(incident.getId(), IncidentCopies.copy(objectMapper, incident));
        try {
            flush();
        } catch (UncheckedIOException e) {
            if (previous == null) {
                store.remove(incident.getId());
            } else {
                store.put(incident.getId(), previous);
            }
            throw e;
        }
        return incident;
    }

    @Override
    public synchronized Optional<Incident> findById(String id) {
        return Optional.ofNullable(store.get(id)).map(incident -> IncidentCopies.copy(objectMapper, incident));
    }

    @Override
    public synchronized List<Incident> findAll() {
        List<Incident> all = new ArrayList<>();
        store.values().forEach(incident -> all.add(IncidentCopies.copy(objectMapper, incident)));
        all.sort(Comparator.comparing(Incident::getDetectedAt,
                Comparator.nullsLast(Comparator.reverseOrder())));
        return all;
    }

    private void load() {
        if (!Files.exists(path)) {
            log.info("No incident snapshot at {}, starting empty", path);
            return;
        }
        try {
            List<Incident> incidents = objectMapper.readValue(path.toFile(), INCIDENT_LIST);
            incidents.forEach(incident -> store.put(incident.getId(), incident));
            log.info("Loaded {} incidents from {}", incidents.size(), path);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read incident snapshot " + path, e);
        }
    }

    private void flush() {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
            objectMapper.writerWithDefaultPrettyPrinter()
                    .writeValue(tmp.toFile(), new ArrayList<>(store.values()));
            Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write incident snapshot " + path, e);
        }
    }
}
