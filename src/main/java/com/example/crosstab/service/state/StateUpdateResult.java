package com.example.crosstab.service.state;

import com.example.crosstab.model.SharedStateRecord;
import lombok.Value;

@Value
public class StateUpdateResult {

    public enum Outcome {
        ACCEPTED,
        MERGED,
        REJECTED
    }

    Outcome outcome;
    /** The record as stored after the update; for a rejection, the record that was kept. */
    SharedStateRecord record;

    public boolean isApplied() {
        return outcome != Outcome.REJECTED;
    }
}
