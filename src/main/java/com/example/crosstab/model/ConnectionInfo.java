package com.example.crosstab.model;

import com.example.crosstab.util.Constants.Visibility;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.Comparator;

/**
 * Store-side projection of an attached connection, readable from every pod.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class ConnectionInfo {

    /** Higher priority first, then the lexicographically larger tab id. */
    public static final Comparator<ConnectionInfo> RANKING = Comparator
            .comparingInt(ConnectionInfo::getPriority)
            .thenComparing(ConnectionInfo::getTabId);

    String connectionId;
    String userId;
    String deviceId;
    String sessionId;
    String tabId;
    Visibility visibility;
    int priority;
    String podId;
    Instant connectedAt;
}
