package com.example.crosstab.util;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

public final class Constants {

    private Constants() {}

    public static final String ROOM_EVENTS_CHANNEL = "crosstab:room-events";
    public static final String PROPAGATION_FIELD = "_propagation";

    public enum RoomType {
        USER(0),
        DEVICE(1),
        SESSION(2),
        TAB(3);

        private final int level;

        RoomType(int level) {
            this.level = level;
        }

        public String prefix() {
            return name().toLowerCase(Locale.ROOT) + ":";
        }

        public String roomId(String key) {
            return prefix() + key;
        }

        public boolean isDirectParentOf(RoomType child) {
            return child.level == level + 1;
        }

        /**
         * Resolves the room type from the prefix of a room id such as {@code tab:abc}.
         */
        public static Optional<RoomType> fromRoomId(String roomId) {
            if (roomId == null) {
                return Optional.empty();
            }
            return Arrays.stream(values())
                    .filter(type -> roomId.startsWith(type.prefix()))
                    .findFirst();
        }
    }

    public enum Visibility {
        VISIBLE,
        HIDDEN;

        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }

        public static Visibility fromWireName(String value) {
            if (value == null || value.isBlank()) {
                return VISIBLE;
            }
            return Visibility.valueOf(value.trim().toUpperCase(Locale.ROOT));
        }
    }

    public enum PropagationDirection {
        UP,
        DOWN,
        BOTH,
        NONE;

        public boolean goesUp() {
            return this == UP || this == BOTH;
        }

        public boolean goesDown() {
            return this == DOWN || this == BOTH;
        }
    }

    /**
     * Events pushed down the SSE stream. The wire name is what the client sees as the SSE event field.
     */
    public enum CrossTabEventType {
        CONNECTED("connection:connected"),
        HEARTBEAT("heartbeat"),
        SERVER_SHUTDOWN("server:shutdown"),
        ERROR("error"),
        LEADER_ELECTED("leader:elected"),
        LEADER_ELECTION("leader:election"),
        LEADER_HEARTBEAT("leader:heartbeat"),
        LEADER_TRANSFER("leader:transfer"),
        LEADER_FAILED("leader:failed"),
        LEADER_RECOVERED("leader:recovered"),
        STATE_SYNC("state:sync"),
        STATE_UPDATE("state:update"),
        TOKEN_UPDATED("auth:token:updated"),
        TOKEN_INVALIDATED("auth:token:invalidated"),
        TOKEN_REFRESH_NOTIFICATION("auth:token:refresh:notification"),
        TOKEN_ERROR("auth:token:error"),
        CONNECTION_RECOVERED("connection:recovered"),
        PEER_DISCONNECTED("connection:peer-disconnected"),
        PEER_RECOVERED("connection:peer-recovered"),
        TAB_VISIBILITY_CHANGED("tab:visibility-changed");

        private final String wireName;

        CrossTabEventType(String wireName) {
            this.wireName = wireName;
        }

        public String wireName() {
            return wireName;
        }

        public boolean closesConnection() {
            return this == TOKEN_INVALIDATED;
        }

        public boolean isLeadershipEvent() {
            return this == LEADER_ELECTED
                    || this == LEADER_TRANSFER
                    || this == LEADER_FAILED
                    || this == LEADER_RECOVERED;
        }

        public static Optional<CrossTabEventType> fromWireName(String wireName) {
            return Arrays.stream(values())
                    .filter(type -> type.wireName.equals(wireName))
                    .findFirst();
        }
    }

    /**
     * Events a client posts to {@code /connections/{id}/messages}.
     */
    public enum InboundEventType {
        LEADER_ELECTION("leader:election"),
        LEADER_TRANSFER("leader:transfer"),
        LEADER_TRANSFER_ACK("leader:transfer-ack"),
        LEADER_FORCE("leader:force"),
        CONNECTION_CLOSING("connection:closing"),
        STATE_UPDATE("state:update"),
        STATE_SYNC("state:sync"),
        TOKEN_REFRESH("token:refresh"),
        TOKEN_INVALIDATE("token:invalidate"),
        TOKEN_SYNC_REQUEST("token:sync-request"),
        TAB_VISIBILITY_CHANGED("tab:visibility-changed");

        private final String wireName;

        InboundEventType(String wireName) {
            this.wireName = wireName;
        }

        public String wireName() {
            return wireName;
        }

        public static Optional<InboundEventType> fromWireName(String wireName) {
            return Arrays.stream(values())
                    .filter(type -> type.wireName.equals(wireName))
                    .findFirst();
        }
    }

    public enum DisconnectReason {
        TRANSPORT_CLOSE("transport close", true),
        TRANSPORT_ERROR("transport error", true),
        PING_TIMEOUT("ping timeout", true),
        CLIENT_NAMESPACE_DISCONNECT("client namespace disconnect", true),
        SERVER_NAMESPACE_DISCONNECT("server namespace disconnect", true),
        SERVER_SHUTDOWN("server shutdown", false),
        CLIENT_CLOSING("client closing", false),
        LOGOUT("logout", false),
        TOKEN_INVALIDATED("token invalidated", false),
        RECOVERY_FAILED("recovery failed", false),
        UNKNOWN("unknown", false);

        private final String wireName;
        private final boolean recoverable;

        DisconnectReason(String wireName, boolean recoverable) {
            this.wireName = wireName;
            this.recoverable = recoverable;
        }

        public String wireName() {
            return wireName;
        }

        public boolean isRecoverable() {
            return recoverable;
        }

        public static DisconnectReason fromWireName(String wireName) {
            if (wireName == null) {
                return UNKNOWN;
            }
            String normalized = wireName.trim().toLowerCase(Locale.ROOT);
            return Arrays.stream(values())
                    .filter(reason -> reason.wireName.equals(normalized))
                    .findFirst()
                    .orElse(UNKNOWN);
        }
    }

    public enum ErrorCode {
        UNKNOWN_EVENT,
        MALFORMED_PAYLOAD,
        NOT_LEADER,
        NOT_TRANSFER_TARGET,
        UNKNOWN_TAB,
        MISSING_REFRESH_TOKEN,
        REFRESH_FAILED,
        INVALIDATE_FAILED,
        RECOVERY_EXHAUSTED
    }
}
