package com.example.crosstab.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * The single leadership claim of a user. {@code version} grows with every election and transfer.
 * <p>
 * A lost leadership leaves a vacant record behind that only carries the version, so the next
 * election continues from it. The record is deleted once the user has no connections left.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class LeaderRecord {
    String userId;
    /** Tab id of the leading connection. */
    String leaderId;
    String connectionId;
    String deviceId;
    int priority;
    VectorClock vectorClock;
    long version;
    Instant electedAt;
    boolean acknowledged;

    @JsonIgnore
    public boolean isVacant() {
        return connectionId == null;
    }

    public LeaderRecord vacated() {
        return LeaderRecord.builder()
                .userId(userId)
                .vectorClock(vectorClock)
                .version(version)
                .build();
    }
}
