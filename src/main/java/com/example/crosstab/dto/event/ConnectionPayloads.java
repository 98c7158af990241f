package com.example.crosstab.dto.event;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

public final class ConnectionPayloads {

    private ConnectionPayloads() {}

    @Value
    @Builder
    public static class Connected {
        String message;
        String connectionId;
        String podId;
        Instant timestamp;
    }

    @Value
    @Builder
    public static class Recovered {
        String recoveryToken;
        String previousConnectionId;
        List<String> recoveredRooms;
    }

    @Value
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class PeerDisconnected {
        String connectionId;
        String tabId;
        String deviceId;
        String reason;
        boolean recoverable;
        String recoveryToken;
    }

    @Value
    @Builder
    public static class PeerRecovered {
        String connectionId;
        String previousConnectionId;
        String tabId;
        String deviceId;
    }

    @Value
    @Builder
    public static class VisibilityChanged {
        String tabId;
        String state;
        int priority;
    }

    @Value
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ErrorNotice {
        String code;
        String message;
        String event;
    }
}
