package com.z254.sentinel.responder.diagnosis;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.sentinel.responder.domain.exception.TransientCollaboratorException;
import org.springframework.stereotype.Component;

/**
 * Turns free-form reasoning-engine text into a JSON tree.
 * <p>
 * Accepts a fenced {@code ```json} block, any fenced block, or a bare object embedded in prose.
 */
@Component
public class ReasoningResponseParser {

    private static final String JSON_FENCE = "```json";
    private static final String FENCE = "```";

    private final ObjectMapper objectMapper;

    public ReasoningResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public JsonNode parse(String text) {
        String candidate = extractJson(text);
        try {
            JsonNode node = objectMapper.readTree(candidate);
            if (node == null || !node.isObject()) {
                throw new TransientCollaboratorException("reasoning-engine", "Response is not a JSON object");
            }
            return node;
        } catch (JsonProcessingException e) {
            throw new TransientCollaboratorException("reasoning-engine",
                    "Malformed JSON in response: " + e.getOriginalMessage(), e);
        }
    }

    static String extractJson(String text) {
        if (text == null || text.isBlank()) {
            throw new TransientCollaboratorException("reasoning-engine", "Empty response");
        }
        int jsonFence = text.indexOf(JSON_FENCE);
        if (jsonFence >= 0) {
            return untilFence(text, jsonFence + JSON_FENCE.length());
        }
        int fence = text.indexOf(FENCE);
        if (fence >= 0) {
            return untilFence(text, fence + FENCE.length());
        }
        int open = text.indexOf('{');
        int close = text.lastIndexOf('}');
        if (open >= 0 && close > open) {
            return text.substring(open, close + 1);
        }
        return text.strip();
    }

    private static String untilFence(String text, int start) {
        int end = text.indexOf(FENCE, start);
        return (end >= 0 ? text.substring(start, end) : text.substring(start)).strip();
    }
}
