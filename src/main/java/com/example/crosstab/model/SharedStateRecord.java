package com.example.crosstab.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class SharedStateRecord {
    JsonNode stateData;
    long version;
    VectorClock vectorClock;
    String updatedBy;
    Instant updatedAt;
    boolean conflictResolved;

    public static SharedStateRecord initial() {
        return SharedStateRecord.builder()
                .stateData(JsonNodeFactory.instance.objectNode())
                .version(0L)
                .vectorClock(VectorClock.empty())
                .updatedAt(Instant.now())
                .build();
    }
}
