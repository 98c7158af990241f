package com.example.crosstab.support;

import com.example.crosstab.service.connection.Connection;
import com.example.crosstab.service.connection.ConnectionService;
import com.example.crosstab.util.Constants.CrossTabEventType;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.http.codec.ServerSentEvent;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * A subscribed SSE client that records every event it receives.
 */
public class TestClient {

    private final Connection connection;
    private final ObjectMapper objectMapper;
    private final List<ServerSentEvent<String>> events = new CopyOnWriteArrayList<>();
    private volatile boolean completed;

    TestClient(ConnectionService.Attachment attachment, ObjectMapper objectMapper) {
        this.connection = attachment.connection();
        this.objectMapper = objectMapper;
        attachment.stream().subscribe(events::add, error -> completed = true, () -> completed = true);
    }

    public Connection connection() {
        return connection;
    }

    public String id() {
        return connection.getConnectionId();
    }

    public boolean isLeader() {
        return connection.isLeader();
    }

    public boolean isCompleted() {
        return completed;
    }

    public List<String> eventNames() {
        return events.stream().map(ServerSentEvent::event).toList();
    }

    public List<JsonNode> payloads(CrossTabEventType type) {
        return events.stream()
                .filter(event -> type.wireName().equals(event.event()))
                .map(event -> parse(event.data()))
                .toList();
    }

    public Optional<JsonNode> lastPayload(CrossTabEventType type) {
        List<JsonNode> payloads = payloads(type);
        return payloads.isEmpty() ? Optional.empty() : Optional.of(payloads.get(payloads.size() - 1));
    }

    public long count(CrossTabEventType type) {
        return events.stream().filter(event -> type.wireName().equals(event.event())).count();
    }

    public void clearEvents() {
        events.clear();
    }

    private JsonNode parse(String json) {
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Event data is not JSON: " + json, e);
        }
    }
}
