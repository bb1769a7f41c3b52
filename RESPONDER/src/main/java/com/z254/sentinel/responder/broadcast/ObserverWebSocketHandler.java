package com.z254.sentinel.responder.broadcast;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.socket.WebSocketHandler;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * WebSocket endpoint for observers (dashboards, engineers).
 * <p>
 * Clients connect with {@code ?user=<name>} and may send:
 * {@code viewing} (incident focus), {@code typing} (relayed as {@code user_typing}) and
 * {@code ping}.
 */
@Slf4j
@Component
public class ObserverWebSocketHandler implements WebSocketHandler {

    public static final String PATH = "/ws/observers";

    private static final Duration HEARTBEAT_INTERVAL = Duration.ofSeconds(30);

    private final EventBroadcaster broadcaster;
    private final ObjectMapper objectMapper;

    public ObserverWebSocketHandler(EventBroadcaster broadcaster, ObjectMapper objectMapper) {
        this.broadcaster = broadcaster;
        this.objectMapper = objectMapper;
    }

    @Override
    public Mono<Void> handle(WebSocketSession session) {
        String user = resolveUser(session);
        SinkObserverChannel channel = new SinkObserverChannel(user);
        broadcaster.connect(channel);

        log.info("Observer session opened: {} as {}", session.getId(), user);

        Mono<Void> input = session.receive()
                .flatMap(msg -> handleMessage(user, msg))
                .then();

        Flux<WebSocketMessage> output = channel.asFlux()
                .map(session::textMessage);

        Flux<WebSocketMessage> heartbeat = Flux.interval(HEARTBEAT_INTERVAL)
                .map(tick -> session.textMessage("{\"type\":\"heartbeat\",\"timestamp\":\""
                        + Instant.now() + "\"}"));

        return session.send(Flux.merge(output, heartbeat))
                .and(input)
                .doFinally(signalType -> {
                    broadcaster.disconnect(channel);
                    log.info("Observer session closed: {} ({}) - {}", session.getId(), user, signalType);
                });
    }

    Mono<Void> handleMessage(String user, WebSocketMessage message) {
        ObserverRequest request;
        try {
            request = objectMapper.readValue(message.getPayloadAsText(), ObserverRequest.class);
        } catch (JsonProcessingException e) {
            log.warn("Invalid observer message from {}: {}", user, e.getMessage());
            broadcaster.sendTo(user, BroadcastEventType.ERROR, Map.of("message", "Invalid JSON"));
            return Mono.empty();
        }

        String type = request.getType() != null ? request.getType() : "";
        switch (type) {
            case "viewing" -> broadcaster.setViewing(user, request.getIncidentId());
            case "typing" -> {
                Map<String, Object> typing = new LinkedHashMap<>();
                typing.put("user", user);
                typing.put("incidentId", request.getIncidentId());
                broadcaster.broadcast(BroadcastEventType.USER_TYPING, typing);
            }
            case "ping" -> broadcaster.sendTo(user, BroadcastEventType.PONG, Map.of("user", user));
            default -> broadcaster.sendTo(user, BroadcastEventType.ERROR,
                    Map.of("message", "Unknown message type: " + type));
        }
        return Mono.empty();
    }

    private String resolveUser(WebSocketSession session) {
        String user = UriComponentsBuilder.fromUri(session.getHandshakeInfo().getUri())
                .build()
                .getQueryParams()
                .getFirst("user");
        return user != null && !user.isBlank() ? user : "anonymous-" + session.getId();
    }

    /**
     * Inbound observer message.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    static class ObserverRequest {
        private String type;
        private String incidentId;
    }
}
