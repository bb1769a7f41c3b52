package com.z254.sentinel.responder.broadcast;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.sentinel.responder.observability.ResponderMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of connected observers plus their presence.
 * <p>
 * Each event is serialized once and handed to every channel. A channel whose send throws is
 * dropped from the registry without affecting the others or the caller.
 */
@Slf4j
@Component
public class EventBroadcaster {

    private final ObjectMapper objectMapper;
    private final ResponderMetrics metrics;

    private final Map<String, ObserverChannel> channels = new ConcurrentHashMap<>();
    private final Map<String, String> viewing = new ConcurrentHashMap<>();

    public EventBroadcaster(ObjectMapper objectMapper, ResponderMetrics metrics) {
        this.objectMapper = objectMapper;
        this.metrics = metrics;
    }

    /**
     * Register a channel, replacing any previous channel with the same name.
     */
    public void connect(ObserverChannel channel) {
        ObserverChannel previous = channels.put(channel.name(), channel);
        if (previous != null && previous != channel) {
            previous.close();
        }
        metrics.recordObserverCount(channels.size());
        log.info("Observer connected: {} ({} online)", channel.name(), channels.size());
        broadcastPresence();
    }

    public void disconnect(String name) {
        ObserverChannel removed = channels.remove(name);
        viewing.remove(name);
        if (removed != null) {
            removed.close();
            metrics.recordObserverCount(channels.size());
            log.info("Observer disconnected: {} ({} online)", name, channels.size());
            broadcastPresence();
        }
    }

    /**
     * Disconnect only if {@code channel} is still the registered one for its name.
     */
    public void disconnect(ObserverChannel channel) {
        if (channels.get(channel.name()) == channel) {
            disconnect(channel.name());
        }
    }

    public void broadcast(BroadcastEventType type, Object data) {
        String payload = serialize(type, data);
        if (payload == null) {
            return;
        }
        List<ObserverChannel> failed = new ArrayList<>();
        for (ObserverChannel channel : channels.values()) {
            if (!deliver(channel, payload)) {
                failed.add(channel);
            }
        }
        failed.forEach(this::drop);
    }

    /**
     * Send to a single named observer, if connected.
     */
    public boolean sendTo(String name, BroadcastEventType type, Object data) {
        ObserverChannel channel = channels.get(name);
        if (channel == null) {
            return false;
        }
        String payload = serialize(type, data);
        if (payload == null) {
            return false;
        }
        if (!deliver(channel, payload)) {
            drop(channel);
            return false;
        }
        return true;
    }

    /**
     * Record which incident a user is looking at; {@code null} clears the entry.
     */
    public void setViewing(String name, String incidentId) {
        if (incidentId == null || incidentId.isBlank()) {
            viewing.remove(name);
        } else {
            viewing.put(name, incidentId);
        }
        broadcastPresence();
    }

    public void broadcastPresence() {
        broadcast(BroadcastEventType.PRESENCE, presence());
    }

    public Map<String, Object> presence() {
        Map<String, Object> presence = new LinkedHashMap<>();
        presence.put("online", onlineUsers());
        presence.put("viewing", new TreeMap<>(viewing));
        return presence;
    }

    public List<String> onlineUsers() {
        return channels.keySet().stream().sorted().toList();
    }

    public boolean isConnected(String name) {
        return channels.containsKey(name);
    }

    private boolean deliver(ObserverChannel channel, String payload) {
        try {
            channel.send(payload);
            return true;
        } catch (RuntimeException e) {
            log.debug("Send to observer {} failed: {}", channel.name(), e.getMessage());
            return false;
        }
    }

    private void drop(ObserverChannel channel) {
        if (channels.remove(channel.name(), channel)) {
            viewing.remove(channel.name());
            channel.close();
            metrics.recordObserverDropped();
            metrics.recordObserverCount(channels.size());
            log.info("Dropped failed observer: {}", channel.name());
        }
    }

    private String serialize(BroadcastEventType type, Object data) {
        Map<String, Object> envelope = new LinkedHashMap<>();
        envelope.put("type", type);
        envelope.put("data", data);
        envelope.put("timestamp", Instant.now());
        try {
            return objectMapper.writeValueAsString(envelope);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize {} event", type.wireName(), e);
            return null;
        }
    }
}
