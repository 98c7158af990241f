package com.example.crosstab.dto.event;

import com.example.crosstab.model.VectorClock;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

public final class LeaderPayloads {

    private LeaderPayloads() {}

    @Value
    @Builder
    public static class Elected {
        String leaderId;
        String connectionId;
        long version;
        VectorClock vectorClock;
        Instant electedAt;
    }

    @Value
    @Builder
    public static class Election {
        String candidateId;
        int priority;
        VectorClock vectorClock;
    }

    @Value
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Transfer {
        String previousLeaderId;
        String newLeaderId;
        long version;
        JsonNode state;
        VectorClock vectorClock;
    }

    @Value
    @Builder
    public static class Failed {
        String previousLeaderId;
        String reason;
    }

    @Value
    @Builder
    public static class Heartbeat {
        String leaderId;
        long version;
        Instant timestamp;
    }

    @Value
    @Builder
    public static class Recovered {
        String leaderId;
        String connectionId;
        long version;
    }
}
