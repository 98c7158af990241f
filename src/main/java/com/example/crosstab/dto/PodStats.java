package com.example.crosstab.dto;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class PodStats {
    String podId;
    int activeConnections;
    int connectedUsers;
    int localLeaders;
    long pendingTasks;
    long recoveryCacheSize;
}
