package com.example.crosstab.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

@Value
@Builder
@Jacksonized
public class TokenPair {
    String token;
    String refreshToken;
    Instant issuedAt;
}
