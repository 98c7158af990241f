package com.example.crosstab.model;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Capped, oldest-first log of events persisted for one room.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class RoomEventHistory {
    @Singular
    List<Entry> entries;

    public RoomEventHistory append(Entry entry, int limit) {
        List<Entry> next = new ArrayList<>(entries);
        next.add(entry);
        if (next.size() > limit) {
            next = next.subList(next.size() - limit, next.size());
        }
        return RoomEventHistory.builder().entries(next).build();
    }

    @Value
    @Builder
    @Jacksonized
    public static class Entry {
        String event;
        JsonNode data;
        Instant emittedAt;
    }
}
