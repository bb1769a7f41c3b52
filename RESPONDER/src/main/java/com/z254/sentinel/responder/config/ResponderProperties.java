package com.z254.sentinel.responder.config;

import com.z254.sentinel.responder.domain.model.Role;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the responder service.
 * <p>
 * Provides centralized configuration for:
 * <ul>
 *     <li>Monitor cadence and duplicate suppression</li>
 *     <li>Auto-fix and escalation thresholds</li>
 *     <li>Apply-and-verify retry budget</li>
 *     <li>Collaborator clients (monitored service, reasoning engine, sandbox, safety, speech)</li>
 *     <li>Incident persistence, the activity log and the user directory</li>
 * </ul>
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "responder")
public class ResponderProperties {

    /** Name of the monitored service, stamped on every incident */
    @NotBlank
    private String serviceName = "demo-app";

    private final Monitor monitor = new Monitor();
    private final Thresholds thresholds = new Thresholds();
    private final Verify verify = new Verify();
    private final Persistence persistence = new Persistence();
    private final Activity activity = new Activity();
    private final MonitoredService monitoredService = new MonitoredService();
    private final ReasoningEngine reasoningEngine = new ReasoningEngine();
    private final Sandbox sandbox = new Sandbox();
    private final SafetyValidation safetyValidation = new SafetyValidation();
    private final Speech speech = new Speech();

    @Valid
    private List<UserEntry> users = new ArrayList<>();

    /**
     * Health monitor configuration.
     */
    @Data
    public static class Monitor {
        /** Delay between monitor ticks in milliseconds */
        @Positive
        private long intervalMs = 5000;

        /** Start ticking as soon as the application is ready */
        private boolean autoStart = true;

        /** Number of log lines gathered as evidence */
        @Positive
        private int logLines = 50;

        /** Worker threads running incident pipelines */
        @Positive
        private int pipelineThreads = 4;

        /** Queued pipelines before new detections are rejected */
        @Positive
        private int pipelineQueueCapacity = 32;

        private DedupPolicy dedupPolicy = DedupPolicy.PER_FAULT_TYPE;
    }

    /**
     * Decision thresholds for the confidence score.
     */
    @Data
    public static class Thresholds {
        /** Minimum confidence for applying a fix without a human */
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double autoFix = 0.85;

        /** Below this confidence the incident is flagged for escalation */
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double escalation = 0.5;
    }

    /**
     * Apply-and-verify loop configuration.
     */
    @Data
    public static class Verify {
        /** Wait after the recovery action before the first health check */
        private Duration initialDelay = Duration.ofSeconds(3);

        /** Fixed delay between health checks */
        private Duration retryDelay = Duration.ofSeconds(3);

        /** Total number of health checks */
        @Positive
        private int maxAttempts = 4;

        /** Wall-clock cap for the whole verification */
        private Duration maxTotalTime = Duration.ofSeconds(60);
    }

    /**
     * Activity log retention.
     */
    @Data
    public static class Activity {
        /** Entries kept in memory; the oldest are dropped first */
        @Positive
        private int maxEntries = 1000;
    }

    /**
     * Incident persistence configuration.
     */
    @Data
    public static class Persistence {
        private PersistenceMode mode = PersistenceMode.IN_MEMORY;

        /** Snapshot file used in FILE mode */
        private String path = "data/incidents.json";
    }

    @Data
    public static class MonitoredService {
        @NotBlank
        private String url = "http://localhost:8000";
        private Duration timeout = Duration.ofSeconds(5);
        private Duration recoveryTimeout = Duration.ofSeconds(15);
    }

    /**
     * Reasoning engine (Anthropic Messages API) configuration.
     */
    @Data
    public static class ReasoningEngine {
        private boolean enabled = false;
        @NotBlank
        private String url = "https://api.anthropic.com/v1";
        private String apiKey;
        private String model = "claude-sonnet-4-20250514";
        private String apiVersion = "2023-06-01";
        @Positive
        private int maxTokens = 2000;
        private Duration timeout = Duration.ofSeconds(60);
    }

    @Data
    public static class Sandbox {
        private boolean enabled = false;
        @NotBlank
        private String url = "https://api.daytona.io";
        private String apiKey;
        private Duration timeout = Duration.ofSeconds(30);
    }

    @Data
    public static class SafetyValidation {
        private boolean enabled = false;
        @NotBlank
        private String url = "https://api.whitecircle.ai/v1";
        private String apiKey;
        private Duration timeout = Duration.ofSeconds(10);
    }

    @Data
    public static class Speech {
        private boolean enabled = false;
        @NotBlank
        private String url = "https://api.elevenlabs.io/v1";
        private String apiKey;
        private String voiceId = "21m00Tcm4TlvDq8ikWAM";
        private Duration timeout = Duration.ofSeconds(15);
    }

    /**
     * A configured user and their approval role.
     */
    @Data
    public static class UserEntry {
        @NotBlank
        private String name;
        private Role role = Role.JUNIOR_DEV;
        private boolean finalAuthority = false;
    }

    /**
     * Scope of the duplicate-suppression guard.
     */
    public enum DedupPolicy {
        /** At most one live incident per fault-type key */
        PER_FAULT_TYPE,
        /** At most one live incident at all */
        GLOBAL
    }

    public enum PersistenceMode {
        IN_MEMORY,
        FILE
    }
}
