package com.example.crosstab.service.room;

import com.example.crosstab.aspect.Monitored;
import com.example.crosstab.config.AppProperties;
import com.example.crosstab.config.AppProperties.Propagation.EventRule;
import com.example.crosstab.config.AppProperties.Propagation.RoomTypeRule;
import com.example.crosstab.model.RoomEventHistory;
import com.example.crosstab.service.connection.Connection;
import com.example.crosstab.service.connection.LocalConnectionRegistry;
import com.example.crosstab.service.connection.SseEventFactory;
import com.example.crosstab.store.CoordinationStore;
import com.example.crosstab.store.StoreKeys;
import com.example.crosstab.util.Constants;
import com.example.crosstab.util.Constants.CrossTabEventType;
import com.example.crosstab.util.Constants.PropagationDirection;
import com.example.crosstab.util.Constants.RoomType;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Emits events to rooms and walks the room tree for directional propagation.
 * <p>
 * One call produces one {@link RoomEventEnvelope}: every pod serves its own members from it, and a
 * connection that sits in several of the target rooms receives the event once.
 */
@Service
@Slf4j
@RequiredArgsConstructor
@Monitored("propagation")
public class EventPropagationService {

    static final int DEFAULT_DEPTH = 3;

    private final RoomRegistryService roomRegistry;
    private final LocalConnectionRegistry connectionRegistry;
    private final RoomEventRelay roomEventRelay;
    private final SseEventFactory sseEventFactory;
    private final CoordinationStore store;
    private final ObjectMapper objectMapper;
    private final AppProperties appProperties;

    public int emit(String roomId, CrossTabEventType eventType, Object data) {
        return emitExcept(roomId, eventType, data, Collections.emptySet());
    }

    /**
     * @return the number of connections on this pod that received the event
     */
    public int emitExcept(String roomId, CrossTabEventType eventType, Object data, Set<String> excludedConnectionIds) {
        RoomEventEnvelope envelope = newEnvelope(eventType)
                .delivery(new RoomEventEnvelope.Delivery(roomId, serialize(data)))
                .excludedConnectionIds(excludedConnectionIds)
                .build();
        return dispatch(envelope);
    }

    public void emitToConnection(String connectionId, CrossTabEventType eventType, Object data) {
        RoomEventEnvelope envelope = newEnvelope(eventType)
                .targetConnectionId(connectionId)
                .delivery(new RoomEventEnvelope.Delivery(null, serialize(data)))
                .build();
        if (deliverLocally(envelope) == 0) {
            roomEventRelay.publish(envelope);
        }
    }

    /**
     * Emits to {@code roomId} and then walks the tree in the resolved direction.
     *
     * @return the rooms the event was delivered to, in delivery order
     */
    public List<String> emitWithPropagation(String roomId, CrossTabEventType eventType, Object data, PropagationOptions options) {
        EventRule rule = appProperties.getPropagation().getEvents().get(eventType.wireName());
        PropagationOptions effective = resolve(roomId, rule, options);
        PropagationDirection direction = effective.getDirection();
        int depth = effective.getDepth();

        Set<String> visited = new HashSet<>(effective.getSkipRooms());
        List<String> delivered = new ArrayList<>();
        RoomEventEnvelope.RoomEventEnvelopeBuilder envelope = newEnvelope(eventType)
                .excludedConnectionIds(effective.getExcludedConnectionIds());
        ObjectNode payload = toObjectNode(data);

        if (!visited.add(roomId)) {
            log.debug("Room {} is in skipRooms, nothing to emit for {}", roomId, eventType.wireName());
            return delivered;
        }
        if (!isTargeted(rule, roomId)) {
            log.debug("Room {} is not a target of {}", roomId, eventType.wireName());
            return delivered;
        }
        addDelivery(envelope, delivered, roomId, payload);

        if (direction.goesUp()) {
            String sourceRoom = roomId;
            for (int hop = 0; hop < depth; hop++) {
                String parent = roomRegistry.getParent(sourceRoom);
                if (parent == null || !visited.add(parent)) {
                    break;
                }
                if (isTargeted(rule, parent)) {
                    addDelivery(envelope, delivered, parent, annotate(payload, PropagationDirection.UP, sourceRoom));
                }
                sourceRoom = parent;
            }
        }

        if (direction.goesDown()) {
            List<String> frontier = List.of(roomId);
            for (int hop = 0; hop < depth && !frontier.isEmpty(); hop++) {
                List<String> next = new ArrayList<>();
                for (String sourceRoom : frontier) {
                    for (String child : roomRegistry.getChildren(sourceRoom)) {
                        if (!visited.add(child)) {
                            continue;
                        }
                        if (isTargeted(rule, child)) {
                            addDelivery(envelope, delivered, child, annotate(payload, PropagationDirection.DOWN, sourceRoom));
                        }
                        next.add(child);
                    }
                }
                frontier = next;
            }
        }

        dispatch(envelope.build());
        if (Boolean.TRUE.equals(effective.getPersist())) {
            delivered.forEach(room -> persist(room, eventType, payload));
        }
        log.debug("Propagated {} from {} ({}, depth {}) to {}", eventType.wireName(), roomId, direction, depth, delivered);
        return delivered;
    }

    public List<RoomEventHistory.Entry> recentEvents(String roomId) {
        return store.get(StoreKeys.roomEvents(roomId), RoomEventHistory.class)
                .map(RoomEventHistory::getEntries)
                .orElse(Collections.emptyList());
    }

    /**
     * Serves the members of this pod. Used for local emissions and for envelopes relayed from other pods.
     *
     * @return the number of connections served
     */
    public int deliverLocally(RoomEventEnvelope envelope) {
        Optional<CrossTabEventType> eventType = CrossTabEventType.fromWireName(envelope.getEvent());
        if (eventType.isEmpty()) {
            log.warn("Dropping envelope with unknown event {}", envelope.getEvent());
            return 0;
        }

        if (envelope.getTargetConnectionId() != null) {
            return connectionRegistry.find(envelope.getTargetConnectionId())
                    .map(connection -> send(connection, eventType.get(), envelope.getEventId(), envelope.getDeliveries().get(0).getData()) ? 1 : 0)
                    .orElse(0);
        }

        Set<String> served = new HashSet<>(envelope.getExcludedConnectionIds());
        int count = 0;
        for (RoomEventEnvelope.Delivery delivery : envelope.getDeliveries()) {
            for (Connection connection : connectionRegistry.localMembers(delivery.getRoomId())) {
                if (served.add(connection.getConnectionId())
                        && send(connection, eventType.get(), envelope.getEventId(), delivery.getData())) {
                    count++;
                }
            }
        }
        return count;
    }

    private int dispatch(RoomEventEnvelope envelope) {
        int local = deliverLocally(envelope);
        roomEventRelay.publish(envelope);
        return local;
    }

    private boolean send(Connection connection, CrossTabEventType eventType, String eventId, String json) {
        ServerSentEvent<String> event = sseEventFactory.createRawEvent(eventType, eventId, json);
        return connectionRegistry.send(connection, eventType, event);
    }

    private RoomEventEnvelope.RoomEventEnvelopeBuilder newEnvelope(CrossTabEventType eventType) {
        return RoomEventEnvelope.builder()
                .eventId(UUID.randomUUID().toString())
                .originPodId(appProperties.getPodName())
                .event(eventType.wireName());
    }

    private void addDelivery(RoomEventEnvelope.RoomEventEnvelopeBuilder envelope, List<String> delivered, String roomId, JsonNode payload) {
        envelope.delivery(new RoomEventEnvelope.Delivery(roomId, serialize(payload)));
        delivered.add(roomId);
    }

    private void persist(String roomId, CrossTabEventType eventType, JsonNode payload) {
        RoomEventHistory.Entry entry = RoomEventHistory.Entry.builder()
                .event(eventType.wireName())
                .data(payload)
                .emittedAt(Instant.now())
                .build();
        int limit = appProperties.getPropagation().getHistorySize();
        store.update(StoreKeys.roomEvents(roomId), RoomEventHistory.class,
                current -> (current == null ? RoomEventHistory.builder().build() : current).append(entry, limit),
                appProperties.getRooms().getTtl());
    }

    /**
     * Explicit options win over the room-type override, which wins over the event rule.
     */
    private PropagationOptions resolve(String roomId, EventRule rule, PropagationOptions options) {
        PropagationOptions requested = options == null ? PropagationOptions.defaults() : options;
        RoomTypeRule typeRule = rule == null ? null : RoomType.fromRoomId(roomId)
                .map(type -> rule.getRoomTypeRules().get(type))
                .orElse(null);

        PropagationDirection direction = firstNonNull(requested.getDirection(),
                typeRule == null ? null : typeRule.getDirection(),
                rule == null ? null : rule.getDirection(),
                PropagationDirection.NONE);
        Integer depth = firstNonNull(requested.getDepth(),
                typeRule == null ? null : typeRule.getDepth(),
                rule == null ? null : rule.getDepth(),
                DEFAULT_DEPTH);
        Boolean persist = firstNonNull(requested.getPersist(),
                typeRule == null ? null : typeRule.getPersist(),
                rule == null ? null : rule.getPersist(),
                Boolean.FALSE);
        return requested.toBuilder().direction(direction).depth(depth).persist(persist).build();
    }

    private boolean isTargeted(EventRule rule, String roomId) {
        if (rule == null || rule.getTargetRoomTypes() == null || rule.getTargetRoomTypes().isEmpty()) {
            return true;
        }
        return RoomType.fromRoomId(roomId).map(rule.getTargetRoomTypes()::contains).orElse(false);
    }

    private ObjectNode annotate(ObjectNode payload, PropagationDirection direction, String sourceRoom) {
        ObjectNode copy = payload.deepCopy();
        ObjectNode propagation = copy.putObject(Constants.PROPAGATION_FIELD);
        propagation.put("direction", direction.name().toLowerCase(Locale.ROOT));
        propagation.put("sourceRoom", sourceRoom);
        return copy;
    }

    private ObjectNode toObjectNode(Object data) {
        JsonNode node = objectMapper.valueToTree(data);
        if (node instanceof ObjectNode objectNode) {
            return objectNode;
        }
        ObjectNode wrapper = objectMapper.createObjectNode();
        wrapper.set("data", node);
        return wrapper;
    }

    private String serialize(Object data) {
        try {
            return objectMapper.writeValueAsString(data);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Event payload is not serializable: " + e.getMessage(), e);
        }
    }

    @SafeVarargs
    private static <T> T firstNonNull(T... candidates) {
        for (T candidate : candidates) {
            if (candidate != null) {
                return candidate;
            }
        }
        return null;
    }
}
