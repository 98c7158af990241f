package com.example.crosstab.model;

import lombok.Value;

import java.util.List;

/**
 * The four rooms a connection lives in, root first.
 */
@Value
public class RoomChain {
    String userRoom;
    String deviceRoom;
    String sessionRoom;
    String tabRoom;

    public List<String> all() {
        return List.of(userRoom, deviceRoom, sessionRoom, tabRoom);
    }
}
