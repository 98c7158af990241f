package com.example.crosstab.config;

import com.example.crosstab.util.Constants.PropagationDirection;
import com.example.crosstab.util.Constants.RoomType;
import com.example.crosstab.util.Constants.Visibility;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

@Data
@Validated
public class AppProperties {

    private String podName;

    @Valid
    private final Sse sse = new Sse();
    @Valid
    private final Store store = new Store();
    @Valid
    private final LeaderElection leaderElection = new LeaderElection();
    @Valid
    private final StateSync stateSync = new StateSync();
    @Valid
    private final Recovery recovery = new Recovery();
    @Valid
    private final Rooms rooms = new Rooms();
    @Valid
    private final Propagation propagation = new Propagation();
    @Valid
    private final Token token = new Token();
    @Valid
    private final Identity identity = new Identity();
    @Valid
    private final Dispatch dispatch = new Dispatch();

    @Data
    public static class Sse {
        @Positive
        private long heartbeatInterval = 30000L;
        private Duration connectionTtl = Duration.ofMinutes(30);
    }

    @Data
    public static class Store {
        public enum Type { MEMORY, REDIS }

        private Type type = Type.MEMORY;
        @Positive
        private int maxCasAttempts = 5;
        @Positive
        private long maximumSize = 100_000L;
    }

    @Data
    public static class LeaderElection {
        private Duration candidateDelay = Duration.ofMillis(500);
        private Duration heartbeatInterval = Duration.ofMillis(2000);
        @Positive
        private int missedHeartbeatsThreshold = 3;
        private Duration transferGrace = Duration.ofSeconds(3);
        private Duration recoveryGrace = Duration.ofSeconds(5);
        private final Priority priority = new Priority();

        public Duration leaderTtl() {
            return heartbeatInterval.multipliedBy(missedHeartbeatsThreshold);
        }

        @Data
        public static class Priority {
            private int visible = 100;
            private int hidden = 50;

            public int of(Visibility visibility) {
                return visibility == Visibility.HIDDEN ? hidden : visible;
            }
        }
    }

    @Data
    public static class StateSync {
        private boolean autoSync = false;
        private Duration syncInterval = Duration.ofSeconds(10);
        private boolean crossDeviceEnabled = true;
        private Duration stateTtl = Duration.ofHours(24);
    }

    @Data
    public static class Recovery {
        private Duration timeout = Duration.ofSeconds(60);
        private Duration storeGrace = Duration.ofSeconds(10);
        @Positive
        private int maxAttempts = 5;
        @Positive
        private long localCacheMaximumSize = 10_000L;
        private Duration cleanupInterval = Duration.ofMinutes(1);
    }

    @Data
    public static class Rooms {
        private Duration ttl = Duration.ofHours(24);
        @Positive
        private int maxHierarchyHops = 10;
    }

    @Data
    public static class Propagation {
        @Positive
        private int historySize = 50;
        /** Keyed by the outbound event wire name, e.g. {@code auth:token:updated}. */
        private Map<String, EventRule> events = new LinkedHashMap<>();

        @Data
        public static class EventRule {
            private PropagationDirection direction = PropagationDirection.NONE;
            private Integer depth;
            private Boolean persist;
            private Set<RoomType> targetRoomTypes = EnumSet.noneOf(RoomType.class);
            private Map<RoomType, RoomTypeRule> roomTypeRules = new EnumMap<>(RoomType.class);
        }

        @Data
        public static class RoomTypeRule {
            private PropagationDirection direction;
            private Integer depth;
            private Boolean persist;
        }
    }

    @Data
    public static class Token {
        private boolean crossTabsEnabled = true;
        private boolean crossDevicesEnabled = true;
        private Duration syncTtl = Duration.ofMinutes(15);
    }

    @Data
    public static class Identity {
        @NotBlank
        private String baseUrl = "http://localhost:8081";
        private Duration timeout = Duration.ofSeconds(5);
    }

    @Data
    public static class Dispatch {
        @Positive
        private int threads = 16;
        @Positive
        private int queuedTaskCap = 10_000;
    }
}
