package com.example.crosstab.model;

import com.example.crosstab.util.Constants.Visibility;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.time.Duration;
import java.time.Instant;
import java.util.Set;

/**
 * Snapshot of a dropped connection, redeemable once with its recovery token.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class RecoveryRecord {
    String recoveryToken;
    String previousConnectionId;
    String userId;
    String sessionId;
    String deviceId;
    String tabId;
    Visibility visibility;
    @Singular
    Set<String> rooms;
    boolean wasLeader;
    @With
    int attempts;
    Instant createdAt;

    public boolean isExpired(Duration timeout, Instant now) {
        return createdAt == null || createdAt.plus(timeout).isBefore(now);
    }
}
