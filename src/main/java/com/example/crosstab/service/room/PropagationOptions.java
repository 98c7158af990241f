package com.example.crosstab.service.room;

import com.example.crosstab.util.Constants.PropagationDirection;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Set;

/**
 * Per-call propagation settings. Null fields fall back to the configured rule for the event.
 */
@Value
@Builder(toBuilder = true)
public class PropagationOptions {
    PropagationDirection direction;
    Integer depth;
    Boolean persist;
    @Singular
    Set<String> skipRooms;
    @Singular
    Set<String> excludedConnectionIds;

    public static PropagationOptions defaults() {
        return PropagationOptions.builder().build();
    }
}
