package com.example.crosstab.service.connection;

import com.example.crosstab.config.AppProperties;
import com.example.crosstab.exception.ConnectionNotFoundException;
import com.example.crosstab.model.ConnectionIdentity;
import com.example.crosstab.util.Constants.CrossTabEventType;
import com.example.crosstab.util.Constants.DisconnectReason;
import com.example.crosstab.util.Constants.Visibility;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.stereotype.Service;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * The connections held by this pod, indexed by id, by user and by joined room.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class LocalConnectionRegistry {

    private static final int MAX_CONSECUTIVE_EMIT_FAILURES = 3;

    private final Map<String, Connection> connections = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> userToConnectionIds = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> roomToConnectionIds = new ConcurrentHashMap<>();
    private final Map<String, Integer> failedEmitCounts = new ConcurrentHashMap<>();

    private final AppProperties appProperties;
    private final SseEventFactory sseEventFactory;

    private Disposable serverHeartbeatSubscription;

    @PostConstruct
    public void init() {
        startServerHeartbeat();
    }

    @PreDestroy
    public void cleanup() {
        log.info("Commencing LocalConnectionRegistry graceful shutdown...");

        if (!connections.isEmpty()) {
            try {
                log.info("Sending graceful shutdown notice to {} connected clients...", connections.size());
                ServerSentEvent<String> shutdownEvent = sseEventFactory.createShutdownEvent();
                connections.values().forEach(connection -> connection.emit(shutdownEvent));

                Thread.sleep(500);
                log.info("Shutdown notice sent to clients.");
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while sending shutdown notice to clients");
            }
        }

        if (serverHeartbeatSubscription != null && !serverHeartbeatSubscription.isDisposed()) {
            serverHeartbeatSubscription.dispose();
            log.info("Server heartbeat task stopped.");
        }

        // completing the streams runs the normal detach path, so leaders held here are released
        new ArrayList<>(connections.values()).forEach(connection -> close(connection, DisconnectReason.SERVER_SHUTDOWN));
        log.info("LocalConnectionRegistry cleanup complete.");
    }

    public Connection open(ConnectionIdentity identity, Visibility visibility) {
        String connectionId = UUID.randomUUID().toString();
        Connection connection = new Connection(connectionId, identity, visibility);

        connections.put(connectionId, connection);
        userToConnectionIds.computeIfAbsent(identity.getUserId(), k -> ConcurrentHashMap.newKeySet()).add(connectionId);

        ServerSentEvent<String> connectedEvent = sseEventFactory.createConnectedEvent(connectionId, appProperties.getPodName());
        if (connectedEvent != null) {
            connection.emit(connectedEvent);
            log.debug("Sent initial CONNECTED event for connection {}", connectionId);
        }
        return connection;
    }

    /**
     * The SSE stream of a connection. {@code onClose} is told why the stream ended; it may run more than once.
     */
    public Flux<ServerSentEvent<String>> createEventStream(Connection connection, Consumer<DisconnectReason> onClose) {
        return connection.asFlux()
                .doOnCancel(() -> onClose.accept(reasonOr(connection, DisconnectReason.TRANSPORT_CLOSE)))
                .doOnError(throwable -> onClose.accept(DisconnectReason.TRANSPORT_ERROR))
                .doOnComplete(() -> onClose.accept(reasonOr(connection, DisconnectReason.TRANSPORT_CLOSE)));
    }

    /**
     * Drops the connection from every index and completes its stream.
     *
     * @return the removed connection, or empty if it was already gone
     */
    public Optional<Connection> remove(String connectionId) {
        Connection connection = connections.remove(connectionId);
        if (connection == null) {
            return Optional.empty();
        }
        Set<String> userConnections = userToConnectionIds.get(connection.getUserId());
        if (userConnections != null) {
            userConnections.remove(connectionId);
            if (userConnections.isEmpty()) {
                userToConnectionIds.remove(connection.getUserId());
            }
        }
        for (String roomId : connection.getRooms()) {
            removeFromRoomIndex(roomId, connectionId);
        }
        failedEmitCounts.remove(connectionId);
        connection.complete();
        return Optional.of(connection);
    }

    /**
     * Completes the stream; the stream's close callback then runs the detach path with {@code reason}.
     */
    public void close(Connection connection, DisconnectReason reason) {
        connection.setCloseReason(reason);
        connection.complete();
    }

    public Optional<Connection> find(String connectionId) {
        return Optional.ofNullable(connections.get(connectionId));
    }

    public Connection require(String connectionId) {
        return find(connectionId).orElseThrow(() -> new ConnectionNotFoundException(connectionId));
    }

    public void joinRoom(Connection connection, String roomId) {
        if (connection.addRoom(roomId)) {
            roomToConnectionIds.computeIfAbsent(roomId, k -> ConcurrentHashMap.newKeySet()).add(connection.getConnectionId());
        }
    }

    public void leaveRoom(Connection connection, String roomId) {
        if (connection.removeRoom(roomId)) {
            removeFromRoomIndex(roomId, connection.getConnectionId());
        }
    }

    public List<Connection> localMembers(String roomId) {
        return resolve(roomToConnectionIds.getOrDefault(roomId, Collections.emptySet()));
    }

    public List<Connection> localConnectionsForUser(String userId) {
        return resolve(userToConnectionIds.getOrDefault(userId, Collections.emptySet()));
    }

    /**
     * Emits to one local connection. Events that end the session close the stream right after.
     */
    public boolean send(Connection connection, CrossTabEventType eventType, ServerSentEvent<String> event) {
        if (event == null) {
            return false;
        }
        Sinks.EmitResult result = connection.emit(event);
        String connectionId = connection.getConnectionId();
        if (result.isFailure()) {
            int failCount = failedEmitCounts.compute(connectionId, (k, v) -> v == null ? 1 : v + 1);
            log.warn("Failed to emit SSE event {} to connection {}. Result: {}. Fail count: {}",
                    eventType.wireName(), connectionId, result, failCount);
            if (failCount >= MAX_CONSECUTIVE_EMIT_FAILURES) {
                log.warn("Connection {} has failed {} consecutive emits. Proactively cleaning up stale connection.",
                        connectionId, failCount);
                Schedulers.boundedElastic().schedule(() -> close(connection, DisconnectReason.TRANSPORT_ERROR));
            }
            return false;
        }
        failedEmitCounts.remove(connectionId);
        if (eventType.closesConnection()) {
            log.info("Closing connection {} after {}", connectionId, eventType.wireName());
            close(connection, DisconnectReason.TOKEN_INVALIDATED);
        }
        return true;
    }

    public Collection<Connection> allConnections() {
        return List.copyOf(connections.values());
    }

    public int getConnectionCount() {
        return connections.size();
    }

    public int getLocalLeaderCount() {
        return (int) connections.values().stream().filter(Connection::isLeader).count();
    }

    public Set<String> getLocalUserIds() {
        return new HashSet<>(userToConnectionIds.keySet());
    }

    private List<Connection> resolve(Set<String> connectionIds) {
        List<Connection> resolved = new ArrayList<>();
        for (String connectionId : Set.copyOf(connectionIds)) {
            Connection connection = connections.get(connectionId);
            if (connection != null) {
                resolved.add(connection);
            }
        }
        return resolved;
    }

    private void removeFromRoomIndex(String roomId, String connectionId) {
        roomToConnectionIds.computeIfPresent(roomId, (k, members) -> {
            members.remove(connectionId);
            return members.isEmpty() ? null : members;
        });
    }

    private static DisconnectReason reasonOr(Connection connection, DisconnectReason fallback) {
        DisconnectReason reason = connection.getCloseReason();
        return reason != null ? reason : fallback;
    }

    private void startServerHeartbeat() {
        serverHeartbeatSubscription = Flux.interval(Duration.ofMillis(appProperties.getSse().getHeartbeatInterval()), Schedulers.parallel())
                .doOnNext(tick -> {
                    try {
                        if (connections.isEmpty()) return;
                        ServerSentEvent<String> heartbeatEvent = sseEventFactory.createHeartbeatEvent();
                        for (Connection connection : connections.values()) {
                            send(connection, CrossTabEventType.HEARTBEAT, heartbeatEvent);
                        }
                    } catch (Exception e) {
                        log.error("Error in server heartbeat task: {}", e.getMessage());
                    }
                })
                .subscribe();
    }
}
