package com.example.crosstab.service.state;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class StateUpdateOptions {
    /** Lets a non-leader write. */
    boolean force;
    /** Also fans the update out to the user's other devices. */
    boolean syncAcrossDevices;

    public static StateUpdateOptions defaults() {
        return StateUpdateOptions.builder().build();
    }
}
