package com.example.crosstab.service.connection;

import com.example.crosstab.config.AppProperties;
import com.example.crosstab.dto.PodStats;
import com.example.crosstab.exception.RecoveryExhaustedException;
import com.example.crosstab.model.ConnectionIdentity;
import com.example.crosstab.model.RoomChain;
import com.example.crosstab.service.leader.CoordinationTimers;
import com.example.crosstab.service.leader.LeaderElectionService;
import com.example.crosstab.service.recovery.ConnectionRecoveryService;
import com.example.crosstab.service.room.RoomRegistryService;
import com.example.crosstab.util.Constants.DisconnectReason;
import com.example.crosstab.util.Constants.Visibility;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;

import java.util.Optional;

/**
 * Attach and detach of connections: the glue between the SSE transport and the coordination
 * services.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ConnectionService {

    private final LocalConnectionRegistry connectionRegistry;
    private final ConnectionDirectory connectionDirectory;
    private final RoomRegistryService roomRegistry;
    private final LeaderElectionService leaderElectionService;
    private final ConnectionRecoveryService recoveryService;
    private final CoordinationTimers timers;
    private final AppProperties appProperties;

    /**
     * Opens a connection and returns its event stream. With a recovery token the connection
     * resumes the dropped one; otherwise it joins its room chain and runs an election.
     *
     * @throws RecoveryExhaustedException when the token cannot be redeemed
     */
    public Attachment attach(ConnectionIdentity identity, Visibility visibility, String recoveryToken) {
        Connection connection = connectionRegistry.open(identity, visibility);
        Flux<ServerSentEvent<String>> stream = connectionRegistry.createEventStream(connection,
                reason -> detach(connection.getConnectionId(), reason));

        if (recoveryToken != null && !recoveryToken.isBlank()) {
            if (!recoveryService.resume(connection, recoveryToken)) {
                connectionRegistry.remove(connection.getConnectionId());
                throw new RecoveryExhaustedException("Recovery token cannot be redeemed for tab " + identity.getTabId());
            }
            log.info("[ATTACH] user={}, tab={}, connection={}, recovered=true", identity.getUserId(), identity.getTabId(), connection.getConnectionId());
            return new Attachment(connection, stream);
        }

        RoomChain chain = roomRegistry.createHierarchy(identity);
        for (String roomId : chain.all()) {
            roomRegistry.join(roomId, connection.getConnectionId());
            connectionRegistry.joinRoom(connection, roomId);
        }
        connectionDirectory.register(connection);
        LeaderElectionService.ElectionOutcome outcome = leaderElectionService.elect(connection);
        log.info("[ATTACH] user={}, device={}, tab={}, connection={}, visibility={}, election={}",
                identity.getUserId(), identity.getDeviceId(), identity.getTabId(), connection.getConnectionId(),
                visibility.wireName(), outcome);
        return new Attachment(connection, stream);
    }

    /**
     * Tears a connection down. Safe to call more than once; only the first call does the work.
     */
    public void detach(String connectionId, DisconnectReason reason) {
        Optional<Connection> found = connectionRegistry.find(connectionId);
        if (found.isEmpty() || !found.get().markDetached()) {
            return;
        }
        Connection connection = found.get();
        // the recovery snapshot needs the rooms and the leader record as they are now
        recoveryService.handleDisconnection(connection, reason);

        connectionRegistry.remove(connectionId);
        for (String roomId : connection.getRooms()) {
            roomRegistry.leave(roomId, connectionId);
        }
        connectionDirectory.unregister(connectionId);
        leaderElectionService.onDisconnect(connection, reason);
        log.info("[DETACH] user={}, tab={}, connection={}, reason='{}', recoverable={}",
                connection.getUserId(), connection.getTabId(), connectionId, reason.wireName(), reason.isRecoverable());
    }

    /**
     * Client-initiated disconnect; the stream's close callback runs {@link #detach}.
     */
    public void disconnect(String connectionId, DisconnectReason reason) {
        Connection connection = connectionRegistry.require(connectionId);
        if (reason == DisconnectReason.CLIENT_CLOSING) {
            leaderElectionService.onClosing(connection);
        }
        connectionRegistry.close(connection, reason);
        detach(connectionId, reason);
    }

    public PodStats stats() {
        return PodStats.builder()
                .podId(appProperties.getPodName())
                .activeConnections(connectionRegistry.getConnectionCount())
                .connectedUsers(connectionRegistry.getLocalUserIds().size())
                .localLeaders(connectionRegistry.getLocalLeaderCount())
                .pendingTasks(timers.pendingCount())
                .recoveryCacheSize(recoveryService.getLocalCacheSize())
                .build();
    }

    public record Attachment(Connection connection, Flux<ServerSentEvent<String>> stream) {
    }
}
