package com.example.crosstab.store;

import com.example.crosstab.util.Constants.RoomType;

import java.util.Locale;

public final class StoreKeys {

    private StoreKeys() {}

    public static String leader(String userId) {
        return "leader:" + userId;
    }

    public static String state(String userId) {
        return "state:" + userId;
    }

    public static String recovery(String token) {
        return "recovery:" + token;
    }

    public static String connection(String connectionId) {
        return "conn:" + connectionId;
    }

    public static String room(String roomId) {
        return "room:" + roomId;
    }

    public static String roomChildren(String roomId) {
        return "room-children:" + roomId;
    }

    public static String roomMembers(String roomId) {
        return "room-members:" + roomId;
    }

    public static String roomRegistry(RoomType type) {
        return "room-registry:" + type.name().toLowerCase(Locale.ROOT);
    }

    public static String roomEvents(String roomId) {
        return "room-events:" + roomId;
    }

    public static String token(String userId, String deviceId) {
        return "token:" + userId + ":" + deviceId;
    }
}
