package com.example.crosstab.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

@Value
@Builder
@Jacksonized
public class SessionInfo {
    String sessionId;
    String userId;
    boolean active;
    Instant lastActivityAt;
}
