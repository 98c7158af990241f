package com.example.crosstab.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DispatchResult {

    public enum Status {
        HANDLED,
        DROPPED
    }

    String event;
    Status status;
    String outcome;
    Long version;

    public static DispatchResult handled(String event) {
        return DispatchResult.builder().event(event).status(Status.HANDLED).build();
    }

    public static DispatchResult dropped(String event, String reason) {
        return DispatchResult.builder().event(event).status(Status.DROPPED).outcome(reason).build();
    }
}
