package com.example.crosstab.service.connection;

import com.example.crosstab.config.AppProperties;
import com.example.crosstab.model.ConnectionInfo;
import com.example.crosstab.service.room.RoomRegistryService;
import com.example.crosstab.store.CoordinationStore;
import com.example.crosstab.store.StoreKeys;
import com.example.crosstab.util.Constants.Visibility;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Cross-pod view of attached connections. Election reads candidates from here, never from the
 * pod-local registry.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ConnectionDirectory {

    private final CoordinationStore store;
    private final RoomRegistryService roomRegistry;
    private final LocalConnectionRegistry connectionRegistry;
    private final AppProperties appProperties;

    public ConnectionInfo register(Connection connection) {
        ConnectionInfo info = ConnectionInfo.builder()
                .connectionId(connection.getConnectionId())
                .userId(connection.getUserId())
                .deviceId(connection.getDeviceId())
                .sessionId(connection.getSessionId())
                .tabId(connection.getTabId())
                .visibility(connection.getVisibility())
                .priority(appProperties.getLeaderElection().getPriority().of(connection.getVisibility()))
                .podId(appProperties.getPodName())
                .connectedAt(connection.getConnectedAt())
                .build();
        store.put(StoreKeys.connection(info.getConnectionId()), info, appProperties.getSse().getConnectionTtl());
        return info;
    }

    public ConnectionInfo updateVisibility(Connection connection, Visibility visibility) {
        int priority = appProperties.getLeaderElection().getPriority().of(visibility);
        ConnectionInfo updated = store.update(StoreKeys.connection(connection.getConnectionId()), ConnectionInfo.class,
                current -> current == null ? null : current.toBuilder().visibility(visibility).priority(priority).build(),
                appProperties.getSse().getConnectionTtl());
        return updated != null ? updated : register(connection);
    }

    public void unregister(String connectionId) {
        store.delete(StoreKeys.connection(connectionId));
    }

    public Optional<ConnectionInfo> find(String connectionId) {
        return store.get(StoreKeys.connection(connectionId), ConnectionInfo.class);
    }

    /**
     * Connections currently in the user's room, across all pods.
     */
    public List<ConnectionInfo> connectionsForUser(String userId) {
        List<ConnectionInfo> infos = new ArrayList<>();
        for (String connectionId : roomRegistry.members(RoomRegistryService.userRoom(userId))) {
            find(connectionId).ifPresent(infos::add);
        }
        return infos;
    }

    @Scheduled(fixedRateString = "#{@appProperties.sse.heartbeatInterval}")
    public void refreshLocalConnections() {
        try {
            for (Connection connection : connectionRegistry.allConnections()) {
                store.expire(StoreKeys.connection(connection.getConnectionId()), appProperties.getSse().getConnectionTtl());
            }
        } catch (Exception e) {
            log.error("Error refreshing connection records: {}", e.getMessage());
        }
    }
}
