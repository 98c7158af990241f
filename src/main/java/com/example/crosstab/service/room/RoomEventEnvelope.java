package com.example.crosstab.service.room;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Set;

/**
 * One emission as it travels between pods: the event, the rooms it goes to (with the payload
 * each room receives) and the connections that must not get it.
 */
@Value
@Builder
@Jacksonized
public class RoomEventEnvelope {
    String eventId;
    String originPodId;
    String event;
    /** Set when the event is addressed to a single connection rather than to rooms. */
    String targetConnectionId;
    @Singular
    List<Delivery> deliveries;
    @Singular
    Set<String> excludedConnectionIds;

    @Value
    @Builder
    @Jacksonized
    public static class Delivery {
        String roomId;
        String data;
    }
}
