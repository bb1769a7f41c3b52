package com.z254.sentinel.responder.alert;

import com.z254.sentinel.responder.client.SpeechSynthesisClient;
import com.z254.sentinel.responder.domain.model.ImpactSeverity;
import com.z254.sentinel.responder.domain.model.Incident;
import com.z254.sentinel.responder.domain.service.IncidentStatsService.IncidentStats;
import lombok.Builder;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

/**
 * Spoken alerts for high-impact incidents awaiting approval, and a spoken status summary.
 * <p>
 * Speech synthesis is optional: without it the script is still returned, with no audio.
 */
@Slf4j
@Service
public class VoiceAlertService {

    static final int ROOT_CAUSE_LIMIT = 150;
    static final int FIX_LIMIT = 120;

    private final SpeechSynthesisClient speechClient;

    public VoiceAlertService(SpeechSynthesisClient speechClient) {
        this.speechClient = speechClient;
    }

    public Mono<VoiceAlert> alertFor(Incident incident) {
        String script = alertScript(incident);
        return synthesize(script)
                .map(audio -> VoiceAlert.of(incident.getId(), script, audio))
                .defaultIfEmpty(VoiceAlert.of(incident.getId(), script, null));
    }

    public Mono<VoiceAlert> statusSummary(IncidentStats stats) {
        String script = summaryScript(stats);
        return synthesize(script)
                .map(audio -> VoiceAlert.of(null, script, audio))
                .defaultIfEmpty(VoiceAlert.of(null, script, null));
    }

    static String alertScript(Incident incident) {
        ImpactSeverity severity = incident.getImpactSeverity();
        String title = incident.getTitle() != null ? incident.getTitle().trim() : "Unknown failure";

        StringBuilder script = new StringBuilder();
        if (severity == ImpactSeverity.CRITICAL) {
            script.append("Critical alert! ");
        } else if (severity == ImpactSeverity.HIGH) {
            script.append("High priority incident. ");
        } else {
            script.append("New incident detected. ");
        }
        script.append(title).append(". ");

        if (hasText(incident.getRootCause())) {
            script.append("Root cause analysis: ")
                    .append(shorten(incident.getRootCause(), ROOT_CAUSE_LIMIT))
                    .append(". ");
        }
        String fix = incident.getProposedFix() != null ? incident.getProposedFix().getDescription() : null;
        if (hasText(fix)) {
            script.append("Proposed fix: ")
                    .append(shorten(fix, FIX_LIMIT))
                    .append(". Awaiting your approval on the dashboard.");
        } else {
            script.append("The agent is investigating. Stand by.");
        }
        return script.toString();
    }

    static String summaryScript(IncidentStats stats) {
        if (stats.getTotal() == 0) {
            return "Status report. No incidents detected yet. All monitored services are healthy. "
                    + "The agent is standing by.";
        }
        List<String> parts = new ArrayList<>();
        parts.add("Status report. " + plural(stats.getTotal(), "incident") + " detected.");
        if (stats.getResolved() > 0) {
            parts.add(stats.getResolved() + " resolved.");
        }
        if (stats.getAutoResolved() > 0) {
            parts.add(stats.getAutoResolved() + " were fixed automatically without human intervention.");
        } else if (stats.getResolved() > 0) {
            parts.add("All fixes were approved by the engineering team.");
        }
        if (stats.getAverageConfidence() > 0) {
            parts.add(String.format("Average agent confidence: %.0f percent.", stats.getAverageConfidence() * 100));
        }
        if (stats.getSafetyChecksRun() > 0) {
            parts.add(stats.getSafetyChecksPassed() + " of " + stats.getSafetyChecksRun() + " safety checks passed.");
        }
        if (stats.getLearningRecords() > 0) {
            parts.add("The agent has " + stats.getLearningRecords()
                    + " learning records from human decisions, improving future responses.");
        }
        long pending = stats.getTotal() - stats.getResolved();
        if (pending > 0) {
            parts.add(plural(pending, "incident") + " still pending review.");
        } else {
            parts.add("All systems are now operational.");
        }
        return String.join(" ", parts);
    }

    /**
     * Cut {@code text} to {@code limit} characters, backing off to the last word boundary.
     */
    static String shorten(String text, int limit) {
        if (text.length() <= limit) {
            return text;
        }
        String head = text.substring(0, limit);
        int space = head.lastIndexOf(' ');
        return space > 0 ? head.substring(0, space) : head;
    }

    private Mono<String> synthesize(String script) {
        return speechClient.synthesize(script)
                .filter(audio -> audio.length > 0)
                .map(audio -> Base64.getEncoder().encodeToString(audio))
                .onErrorResume(e -> {
                    log.warn("Speech synthesis failed, sending script only: {}", e.getMessage());
                    return Mono.empty();
                });
    }

    private static String plural(long count, String noun) {
        return count + " " + noun + (count == 1 ? "" : "s");
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    /**
     * Payload of a {@code voice_alert} event.
     */
    @Value
    @Builder
    public static class VoiceAlert {
        String incidentId;
        String script;
        String audioBase64;
        boolean hasAudio;

        static VoiceAlert of(String incidentId, String script, String audioBase64) {
            return VoiceAlert.builder()
                    .incidentId(incidentId)
                    .script(script)
                    .audioBase64(audioBase64)
                    .hasAudio(audioBase64 != null)
                    .build();
        }
    }
}
