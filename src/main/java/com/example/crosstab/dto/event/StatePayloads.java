package com.example.crosstab.dto.event;

import com.example.crosstab.model.VectorClock;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Value;

public final class StatePayloads {

    private StatePayloads() {}

    @Value
    @Builder
    public static class Sync {
        JsonNode state;
        long version;
    }

    @Value
    @Builder(toBuilder = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Update {
        JsonNode state;
        long version;
        VectorClock vectorClock;
        String updatedBy;
        String sourceDevice;
        Boolean conflictResolved;
    }
}
