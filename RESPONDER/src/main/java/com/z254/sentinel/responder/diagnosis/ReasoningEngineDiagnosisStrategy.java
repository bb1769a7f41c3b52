package com.z254.sentinel.responder.diagnosis;

import com.fasterxml.jackson.databind.JsonNode;
import com.z254.sentinel.responder.client.ReasoningEngineClient;
import com.z254.sentinel.responder.domain.model.Diagnosis;
import com.z254.sentinel.responder.domain.model.Evidence;
import com.z254.sentinel.responder.domain.model.FaultType;
import com.z254.sentinel.responder.domain.model.FixProposal;
import com.z254.sentinel.responder.domain.model.Incident;
import com.z254.sentinel.responder.domain.model.RiskLevel;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Diagnosis and fix generation delegated to the reasoning engine.
 */
@Component
public class ReasoningEngineDiagnosisStrategy implements DiagnosisStrategy {

    public static final String NAME = "reasoning-engine";

    private static final String SYSTEM_PROMPT = "You are a senior DevOps engineer responding to a production "
            + "incident. Answer only with the JSON object requested.";

    private static final int MAX_FILE_CHARS = 2000;

    private final ReasoningEngineClient client;
    private final ReasoningResponseParser parser;

    public ReasoningEngineDiagnosisStrategy(ReasoningEngineClient client, ReasoningResponseParser parser) {
        this.client = client;
        this.parser = parser;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean isAvailable() {
        return client.isAvailable();
    }

    @Override
    public Mono<Diagnosis> diagnose(FaultType faultType, Evidence evidence) {
        return client.complete(SYSTEM_PROMPT, diagnosisPrompt(faultType, evidence))
                .map(parser::parse)
                .map(this::toDiagnosis);
    }

    @Override
    public Mono<FixProposal> generateFix(FaultType faultType, Diagnosis diagnosis, Evidence evidence) {
        return client.complete(SYSTEM_PROMPT, fixPrompt(faultType, diagnosis, evidence))
                .map(parser::parse)
                .map(this::toFix);
    }

    @Override
    public Mono<FixProposal> refineFix(Incident incident, String feedback) {
        FixProposal current = incident.getProposedFix();
        String prompt = "A proposed fix for incident \"" + incident.getTitle() + "\" needs changes.\n\n"
                + "ROOT CAUSE: " + incident.getRootCause() + "\n\n"
                + "CURRENT FIX:\n" + (current != null ? current.getDescription() : "") + "\n\n"
                + "CURRENT DIFF:\n" + (current != null ? current.getDiff() : "") + "\n\n"
                + "ENGINEER FEEDBACK: " + feedback + "\n\n"
                + fixResponseFormat();
        return client.complete(SYSTEM_PROMPT, prompt)
                .map(parser::parse)
                .map(this::toFix);
    }

    // ========== Prompt Building ==========

    private String diagnosisPrompt(FaultType faultType, Evidence evidence) {
        return "A production app is failing. Analyze the evidence and diagnose the root cause.\n\n"
                + evidence.toText() + "\n"
                + filesSection(evidence)
                + "Respond in JSON:\n"
                + "{\n"
                + "  \"root_cause\": \"concise root cause (1-2 sentences)\",\n"
                + "  \"reasoning\": \"step-by-step analysis\",\n"
                + "  \"category\": \"" + faultType.getKey() + "\",\n"
                + "  \"file_at_fault\": \"handler.py or config.json or null\",\n"
                + "  \"line_hint\": \"which line/function is broken\"\n"
                + "}";
    }

    private String fixPrompt(FaultType faultType, Diagnosis diagnosis, Evidence evidence) {
        String file = diagnosis.getFileAtFault();
        String content = file != null ? evidence.getFiles().getOrDefault(file, "") : "";
        return "Fix this production issue.\n\n"
                + "FAULT TYPE: " + faultType.getKey() + "\n"
                + "ROOT CAUSE: " + diagnosis.getRootCause() + "\n"
                + "EXPLANATION: " + diagnosis.getExplanation() + "\n\n"
                + "CURRENT FILE (" + file + "):\n" + truncate(content, 3000) + "\n\n"
                + fixResponseFormat();
    }

    private String fixResponseFormat() {
        return "Respond in JSON:\n"
                + "{\n"
                + "  \"fix_description\": \"what the fix does\",\n"
                + "  \"fix_diff\": \"the change as a unified diff\",\n"
                + "  \"fix_code\": \"the corrected file content or shell commands to apply\",\n"
                + "  \"test_code\": \"python code to verify the fix\",\n"
                + "  \"risk_level\": \"low/medium/high\"\n"
                + "}";
    }

    private String filesSection(Evidence evidence) {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, String> file : evidence.getFiles().entrySet()) {
            sb.append("CURRENT ").append(file.getKey()).append(":\n")
                    .append(truncate(file.getValue(), MAX_FILE_CHARS)).append("\n\n");
        }
        return sb.toString();
    }

    // ========== Response Mapping ==========

    private Diagnosis toDiagnosis(JsonNode json) {
        return Diagnosis.builder()
                .rootCause(text(json, "root_cause", "Unknown"))
                .category(text(json, "category", "unknown"))
                .fileAtFault(text(json, "file_at_fault", null))
                .lineNumber(text(json, "line_hint", null))
                .explanation(text(json, "reasoning", text(json, "explanation", "")))
                .source(NAME)
                .build();
    }

    private FixProposal toFix(JsonNode json) {
        return FixProposal.builder()
                .description(text(json, "fix_description", ""))
                .diff(text(json, "fix_diff", ""))
                .fixCode(text(json, "fix_code", ""))
                .testCode(text(json, "test_code", null))
                .riskLevel(RiskLevel.fromWire(text(json, "risk_level", "medium")))
                .source(NAME)
                .build();
    }

    private static String text(JsonNode json, String field, String defaultValue) {
        JsonNode node = json.get(field);
        if (node == null || node.isNull()) {
            return defaultValue;
        }
        String value = node.isTextual() ? node.asText() : node.toString();
        return "null".equalsIgnoreCase(value) || value.isBlank() ? defaultValue : value;
    }

    private static String truncate(String value, int max) {
        if (value == null) {
            return "";
        }
        return value.length() <= max ? value : value.substring(0, max);
    }
}
