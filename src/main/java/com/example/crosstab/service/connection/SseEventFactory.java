package com.example.crosstab.service.connection;

import com.example.crosstab.dto.event.ConnectionPayloads;
import com.example.crosstab.util.Constants.CrossTabEventType;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Map;

@Component
@RequiredArgsConstructor
@Slf4j
public class SseEventFactory {

    private final ObjectMapper objectMapper;

    /**
     * Serializes {@code data} and wraps it into an SSE event named after the event's wire name.
     *
     * @return the event, or null if serialization fails
     */
    public ServerSentEvent<String> createEvent(CrossTabEventType eventType, String eventId, Object data) {
        try {
            return createRawEvent(eventType, eventId, objectMapper.writeValueAsString(data));
        } catch (JsonProcessingException e) {
            log.error("Error serializing payload for SSE event type {}: {}", eventType.wireName(), e.getMessage());
            return null;
        }
    }

    /** For payloads that are already JSON, e.g. relayed from another pod. */
    public ServerSentEvent<String> createRawEvent(CrossTabEventType eventType, String eventId, String json) {
        return ServerSentEvent.<String>builder()
                .event(eventType.wireName())
                .id(eventId)
                .data(json)
                .build();
    }

    public ServerSentEvent<String> createHeartbeatEvent() {
        return createEvent(CrossTabEventType.HEARTBEAT, null, Map.of("timestamp", Instant.now().toString()));
    }

    public ServerSentEvent<String> createConnectedEvent(String connectionId, String podId) {
        ConnectionPayloads.Connected data = ConnectionPayloads.Connected.builder()
                .message("SSE connection established")
                .connectionId(connectionId)
                .podId(podId)
                .timestamp(Instant.now())
                .build();
        return createEvent(CrossTabEventType.CONNECTED, connectionId, data);
    }

    public ServerSentEvent<String> createShutdownEvent() {
        return ServerSentEvent.<String>builder()
                .event(CrossTabEventType.SERVER_SHUTDOWN.wireName())
                .data("Server is shutting down. Please reconnect momentarily.")
                .build();
    }
}
