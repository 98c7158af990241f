package com.example.crosstab.service.room;

/**
 * Carries emissions to the other pods. Local members are served before {@link #publish} is called.
 */
public interface RoomEventRelay {

    void publish(RoomEventEnvelope envelope);
}
