package com.z254.sentinel.responder.support;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.sentinel.responder.broadcast.BroadcastEventType;
import com.z254.sentinel.responder.broadcast.ObserverChannel;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Observer channel that keeps every payload it receives, for asserting on broadcasts.
 */
public class RecordingObserverChannel implements ObserverChannel {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final String name;
    private final List<String> payloads = new CopyOnWriteArrayList<>();
    private volatile boolean failing;
    private volatile boolean closed;

    public RecordingObserverChannel(String name) {
        this.name = name;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public void send(String payload) {
        if (failing) {
            throw new IllegalStateException("connection reset");
        }
        payloads.add(payload);
    }

    @Override
    public void close() {
        closed = true;
    }

    public void failOnSend() {
        this.failing = true;
    }

    public boolean isClosed() {
        return closed;
    }

    public List<String> payloads() {
        return List.copyOf(payloads);
    }

    /**
     * Data nodes of the received events of {@code type}, in arrival order.
     */
    public List<JsonNode> events(BroadcastEventType type) {
        return payloads.stream()
                .map(RecordingObserverChannel::read)
                .filter(node -> type.wireName().equals(node.path("type").asText()))
                .map(node -> node.get("data"))
                .toList();
    }

    private static JsonNode read(String payload) {
        try {
            return MAPPER.readTree(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Broadcast payload is not JSON: " + payload, e);
        }
    }
}
