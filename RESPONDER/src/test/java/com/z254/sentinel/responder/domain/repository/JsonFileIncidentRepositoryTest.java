package com.z254.sentinel.responder.domain.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.z254.sentinel.responder.config.ResponderProperties;
import com.z254.sentinel.responder.domain.model.FaultType;
import com.z254.sentinel.responder.domain.model.FixProposal;
import com.z254.sentinel.responder.domain.model.Incident;
import com.z254.sentinel.responder.domain.model.IncidentStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonFileIncidentRepositoryTest {

    @TempDir
    Path tempDir;

    private ObjectMapper objectMapper;
    private ResponderProperties properties;
    private Path snapshot;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper().findAndRegisterModules()
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        snapshot = tempDir.resolve("state").resolve("incidents.json");
        properties = new ResponderProperties();
        properties.getPersistence().setPath(snapshot.toString());
    }

    @Test
    @DisplayName("starts empty when no snapshot exists")
    void startsEmpty() {
        JsonFileIncidentRepository repository = new JsonFileIncidentRepository(objectMapper, properties);

        assertThat(repository.findAll()).isEmpty();
        assertThat(Files.exists(snapshot)).isFalse();
    }

    @Test
    @DisplayName("incidents survive a restart with status and fix intact")
    void survivesRestart() {
        Instant detected = Instant.parse("2026-03-01T10:00:00Z");
        Incident incident = incident("inc-1", FaultType.BAD_CONFIG, detected);
        incident.setProposedFix(FixProposal.builder().description("Restore config.json").build());
        incident.setConfidenceScore(0.65);
        incident.applyStatus(IncidentStatus.RESOLVED, detected.plusSeconds(90));

        new JsonFileIncidentRepository(objectMapper, properties).save(incident);
        JsonFileIncidentRepository reloaded = new JsonFileIncidentRepository(objectMapper, properties);

        Incident restored = reloaded.findById("inc-1").orElseThrow();
        assertThat(restored.getStatus()).isEqualTo(IncidentStatus.RESOLVED);
        assertThat(restored.getFaultType()).isEqualTo(FaultType.BAD_CONFIG);
        assertThat(restored.getResolvedAt()).isEqualTo(detected.plusSeconds(90));
        assertThat(restored.getProposedFix().getDescription()).isEqualTo("Restore config.json");
        assertThat(restored.getConfidenceScore()).isEqualTo(0.65);
        assertThat(Files.exists(tempDir.resolve("state").resolve("incidents.json.tmp"))).isFalse();
    }

    @Test
    @DisplayName("findAll is newest first while findActive is oldest first and skips terminal incidents")
    void ordering() {
        JsonFileIncidentRepository repository = new JsonFileIncidentRepository(objectMapper, properties);
        Instant base = Instant.parse("2026-03-01T10:00:00Z");
        repository.save(incident("old", FaultType.SLOW, base));
        repository.save(incident("new", FaultType.BUG, base.plusSeconds(60)));
        Incident rejected = incident("gone", FaultType.CRASH, base.plusSeconds(30));
        rejected.applyStatus(IncidentStatus.REJECTED, base.plusSeconds(45));
        repository.save(rejected);

        assertThat(repository.findAll()).extracting(Incident::getId).containsExactly("new", "gone", "old");
        assertThat(repository.findActive()).extracting(Incident::getId).containsExactly("old", "new");
    }

    @Test
    @DisplayName("a corrupt snapshot fails startup")
    void corruptSnapshot() throws Exception {
        Files.createDirectories(snapshot.getParent());
        Files.writeString(snapshot, "{ not a list");

        assertThatThrownBy(() -> new JsonFileIncidentRepository(objectMapper, properties))
                .isInstanceOf(UncheckedIOException.class)
                .hasMessageContaining("Failed to read incident snapshot");
    }

    @Test
    @DisplayName("a save that cannot be written is undone in memory")
    void failedWriteKeepsPreviousVersion() throws Exception {
        JsonFileIncidentRepository repository = new JsonFileIncidentRepository(objectMapper, properties);
        Incident incident = incident("inc-1", FaultType.BAD_CONFIG, Instant.parse("2026-03-01T10:00:00Z"));
        repository.save(incident);
        Files.delete(snapshot);
        Files.createDirectories(snapshot.resolve("occupied"));

        incident.applyStatus(IncidentStatus.DIAGNOSING, Instant.parse("2026-03-01T10:00:05Z"));
        assertThatThrownBy(() -> repository.save(incident))
                .isInstanceOf(UncheckedIOException.class)
                .hasMessageContaining("Failed to write incident snapshot");

        assertThat(repository.findById("inc-1").orElseThrow().getStatus()).isEqualTo(IncidentStatus.DETECTED);
    }

    @Test
    @DisplayName("returned incidents are copies of the stored ones")
    void returnsCopies() {
        JsonFileIncidentRepository repository = new JsonFileIncidentRepository(objectMapper, properties);
        repository.save(incident("inc-1", FaultType.SLOW, Instant.parse("2026-03-01T10:00:00Z")));

        repository.findById("inc-1").orElseThrow().setTitle("changed");
        repository.findAll().get(0).setRootCause("changed");

        Incident stored = repository.findById("inc-1").orElseThrow();
        assertThat(stored.getTitle()).isEqualTo("slow detected");
        assertThat(stored.getRootCause()).isNull();
    }

    private static Incident incident(String id, FaultType faultType, Instant detectedAt) {
        return Incident.builder()
                .id(id)
                .serviceName("checkout")
                .faultType(faultType)
                .title(faultType.getKey() + " detected")
                .detectedAt(detectedAt)
                .updatedAt(detectedAt)
                .build();
    }
}
