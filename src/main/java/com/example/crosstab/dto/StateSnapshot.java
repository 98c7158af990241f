package com.example.crosstab.dto;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Value;

@Value
public class StateSnapshot {
    JsonNode stateData;
    long version;
}
