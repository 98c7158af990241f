package com.example.crosstab.service.room;

import lombok.extern.slf4j.Slf4j;

/**
 * Relay for the single-pod memory mode: there is nobody else to tell.
 */
@Slf4j
public class LocalRoomEventRelay implements RoomEventRelay {

    @Override
    public void publish(RoomEventEnvelope envelope) {
        log.trace("Single-pod mode, not relaying {}", envelope.getEvent());
    }
}
