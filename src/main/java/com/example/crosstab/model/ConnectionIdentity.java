package com.example.crosstab.model;

import lombok.Value;

@Value
public class ConnectionIdentity {
    String userId;
    String deviceId;
    String sessionId;
    String tabId;
}
