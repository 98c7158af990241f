package com.example.crosstab.dto.event;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

public final class TokenPayloads {

    private TokenPayloads() {}

    @Value
    @Builder
    public static class Updated {
        String token;
        String refreshToken;
        Instant updatedAt;
        String source;
    }

    @Value
    @Builder
    public static class Invalidated {
        String reason;
        String source;
    }

    /** Sent to other devices; never carries the token itself. */
    @Value
    @Builder
    public static class RefreshNotification {
        String deviceId;
        Instant updatedAt;
        String source;
    }

    @Value
    @Builder
    public static class Failure {
        String code;
        String message;
    }
}
