package com.example.crosstab.service.recovery;

import com.example.crosstab.aspect.Monitored;
import com.example.crosstab.config.AppProperties;
import com.example.crosstab.dto.event.ConnectionPayloads;
import com.example.crosstab.exception.CollaboratorFailureException;
import com.example.crosstab.model.RecoveryRecord;
import com.example.crosstab.model.RoomChain;
import com.example.crosstab.service.connection.Connection;
import com.example.crosstab.service.connection.ConnectionDirectory;
import com.example.crosstab.service.connection.LocalConnectionRegistry;
import com.example.crosstab.service.identity.IdentityProvider;
import com.example.crosstab.service.leader.LeaderElectionService;
import com.example.crosstab.service.room.EventPropagationService;
import com.example.crosstab.service.room.RoomRegistryService;
import com.example.crosstab.store.CoordinationStore;
import com.example.crosstab.store.StoreKeys;
import com.example.crosstab.util.Constants.CrossTabEventType;
import com.example.crosstab.util.Constants.DisconnectReason;
import com.example.crosstab.util.Constants.RoomType;
import com.github.benmanes.caffeine.cache.Cache;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.security.SecureRandom;
import java.time.Duration;
import java.time.Instant;
import java.util.HexFormat;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Issues single-use recovery tokens when a connection drops for a transport reason and lets a
 * new connection take over the dropped one's rooms and leadership.
 */
@Service
@Slf4j
@RequiredArgsConstructor
@Monitored("recovery")
public class ConnectionRecoveryService {

    private static final int TOKEN_BYTES = 16;

    private final SecureRandom random = new SecureRandom();

    private final CoordinationStore store;
    private final Cache<String, RecoveryRecord> recoveryRecordCache;
    private final RoomRegistryService roomRegistry;
    private final LocalConnectionRegistry connectionRegistry;
    private final ConnectionDirectory connectionDirectory;
    private final EventPropagationService eventPropagationService;
    private final LeaderElectionService leaderElectionService;
    private final IdentityProvider identityProvider;
    private final AppProperties appProperties;

    public boolean isRecoverable(DisconnectReason reason) {
        return reason != null && reason.isRecoverable();
    }

    /**
     * Snapshots a connection that is about to go away.
     *
     * @return the token, or empty when the record could not be stored
     */
    public Optional<String> issue(Connection connection) {
        String token = HexFormat.of().formatHex(nextBytes());
        try {
            RecoveryRecord record = RecoveryRecord.builder()
                    .recoveryToken(token)
                    .previousConnectionId(connection.getConnectionId())
                    .userId(connection.getUserId())
                    .sessionId(connection.getSessionId())
                    .deviceId(connection.getDeviceId())
                    .tabId(connection.getTabId())
                    .visibility(connection.getVisibility())
                    .rooms(connection.getRooms())
                    .wasLeader(leaderElectionService.isLeader(connection))
                    .attempts(0)
                    .createdAt(Instant.now())
                    .build();
            store.put(StoreKeys.recovery(token), record, recordTtl());
            recoveryRecordCache.put(token, record);
            log.debug("[RECOVERY_ISSUED] connection={}, tab={}, leader={}", connection.getConnectionId(), connection.getTabId(), record.isWasLeader());
            return Optional.of(token);
        } catch (DataAccessException | CollaboratorFailureException e) {
            log.warn("Could not store recovery record for connection {}, it will not be recoverable: {}",
                    connection.getConnectionId(), e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Runs while the dropped connection is still in its rooms. Tells the user's other
     * connections about the drop, with the token when one was issued.
     */
    public Optional<String> handleDisconnection(Connection connection, DisconnectReason reason) {
        Optional<String> token = isRecoverable(reason) ? issue(connection) : Optional.empty();
        eventPropagationService.emitExcept(RoomRegistryService.userRoom(connection.getUserId()), CrossTabEventType.PEER_DISCONNECTED,
                ConnectionPayloads.PeerDisconnected.builder()
                        .connectionId(connection.getConnectionId())
                        .tabId(connection.getTabId())
                        .deviceId(connection.getDeviceId())
                        .reason(reason.wireName())
                        .recoverable(token.isPresent())
                        .recoveryToken(token.orElse(null))
                        .build(),
                Set.of(connection.getConnectionId()));
        return token;
    }

    /**
     * Redeems a token for a freshly opened connection. Nothing is joined or elected unless the
     * token is valid, unexpired, within its attempt budget and issued to the same user.
     */
    public boolean resume(Connection connection, String token) {
        if (token == null || token.isBlank()) {
            return false;
        }
        String key = StoreKeys.recovery(token);
        Optional<RecoveryRecord> found = lookup(token);
        if (found.isEmpty()) {
            log.warn("[RECOVERY_FAILED] connection={}: unknown recovery token", connection.getConnectionId());
            return false;
        }
        if (found.get().isExpired(appProperties.getRecovery().getTimeout(), Instant.now())) {
            discard(token);
            log.warn("[RECOVERY_FAILED] connection={}: token expired", connection.getConnectionId());
            return false;
        }

        RecoveryRecord counted = store.update(key, RecoveryRecord.class,
                current -> current == null ? null : current.withAttempts(current.getAttempts() + 1), recordTtl());
        if (counted == null) {
            recoveryRecordCache.invalidate(token);
            log.warn("[RECOVERY_FAILED] connection={}: token already consumed", connection.getConnectionId());
            return false;
        }
        if (counted.getAttempts() > appProperties.getRecovery().getMaxAttempts()) {
            discard(token);
            log.warn("[RECOVERY_FAILED] connection={}: token exceeded {} attempts",
                    connection.getConnectionId(), appProperties.getRecovery().getMaxAttempts());
            return false;
        }
        if (!counted.getUserId().equals(connection.getUserId())) {
            recoveryRecordCache.put(token, counted);
            log.warn("[RECOVERY_FAILED] connection={}: token belongs to another user", connection.getConnectionId());
            return false;
        }

        Optional<RecoveryRecord> consumed = store.remove(key, RecoveryRecord.class);
        recoveryRecordCache.invalidate(token);
        if (consumed.isEmpty()) {
            log.warn("[RECOVERY_FAILED] connection={}: token consumed concurrently", connection.getConnectionId());
            return false;
        }
        RecoveryRecord record = consumed.get();

        List<String> recoveredRooms = rejoin(connection, record);
        touchSession(connection);

        eventPropagationService.emitToConnection(connection.getConnectionId(), CrossTabEventType.CONNECTION_RECOVERED,
                ConnectionPayloads.Recovered.builder()
                        .recoveryToken(token)
                        .previousConnectionId(record.getPreviousConnectionId())
                        .recoveredRooms(recoveredRooms)
                        .build());
        eventPropagationService.emitExcept(RoomRegistryService.userRoom(connection.getUserId()), CrossTabEventType.PEER_RECOVERED,
                ConnectionPayloads.PeerRecovered.builder()
                        .connectionId(connection.getConnectionId())
                        .previousConnectionId(record.getPreviousConnectionId())
                        .tabId(connection.getTabId())
                        .deviceId(connection.getDeviceId())
                        .build(),
                Set.of(connection.getConnectionId()));

        restoreLeadership(connection, record);
        log.info("[RECOVERED] user={}, tab={}, connection={}, previous={}, rooms={}, wasLeader={}",
                connection.getUserId(), connection.getTabId(), connection.getConnectionId(),
                record.getPreviousConnectionId(), recoveredRooms.size(), record.isWasLeader());
        return true;
    }

    @Scheduled(fixedRateString = "#{@appProperties.recovery.cleanupInterval.toMillis()}")
    public void cleanupExpired() {
        try {
            Duration timeout = appProperties.getRecovery().getTimeout();
            Instant now = Instant.now();
            long before = recoveryRecordCache.estimatedSize();
            recoveryRecordCache.asMap().values().removeIf(record -> record.isExpired(timeout, now));
            recoveryRecordCache.cleanUp();
            long removed = Math.max(0, before - recoveryRecordCache.estimatedSize());
            if (removed > 0) {
                log.info("Cleaned up {} expired recovery records", removed);
            }
        } catch (Exception e) {
            log.error("Error cleaning up recovery records: {}", e.getMessage());
        }
    }

    public long getLocalCacheSize() {
        return recoveryRecordCache.estimatedSize();
    }

    private Optional<RecoveryRecord> lookup(String token) {
        RecoveryRecord cached = recoveryRecordCache.getIfPresent(token);
        if (cached != null) {
            return Optional.of(cached);
        }
        return store.get(StoreKeys.recovery(token), RecoveryRecord.class);
    }

    private List<String> rejoin(Connection connection, RecoveryRecord record) {
        RoomChain chain = roomRegistry.createHierarchy(connection.getIdentity());
        Set<String> rooms = new LinkedHashSet<>(chain.all());
        for (String roomId : record.getRooms()) {
            if (!isSelfReferential(roomId, record, connection)) {
                rooms.add(roomId);
            }
        }
        for (String roomId : rooms) {
            roomRegistry.join(roomId, connection.getConnectionId());
            connectionRegistry.joinRoom(connection, roomId);
        }
        connectionDirectory.register(connection);
        return List.copyOf(rooms);
    }

    /** Rooms that named the dropped connection or, when the tab changed, its old tab. */
    private static boolean isSelfReferential(String roomId, RecoveryRecord record, Connection connection) {
        if (roomId.equals(record.getPreviousConnectionId())) {
            return true;
        }
        return !connection.getTabId().equals(record.getTabId()) && roomId.equals(RoomType.TAB.roomId(record.getTabId()));
    }

    private void restoreLeadership(Connection connection, RecoveryRecord record) {
        if (record.isWasLeader()) {
            if (!leaderElectionService.recoverLeadership(connection)) {
                leaderElectionService.elect(connection);
            }
            return;
        }
        if (leaderElectionService.currentLeader(connection.getUserId()).isEmpty()) {
            leaderElectionService.elect(connection);
        } else {
            leaderElectionService.shortenRecoveryHold(connection.getUserId());
            leaderElectionService.syncLocalLeadership(connection.getUserId());
        }
    }

    private void touchSession(Connection connection) {
        try {
            identityProvider.touchSession(connection.getSessionId());
        } catch (CollaboratorFailureException e) {
            log.warn("Could not touch session {} after recovery: {}", connection.getSessionId(), e.getMessage());
        }
    }

    private void discard(String token) {
        store.delete(StoreKeys.recovery(token));
        recoveryRecordCache.invalidate(token);
    }

    private byte[] nextBytes() {
        byte[] bytes = new byte[TOKEN_BYTES];
        random.nextBytes(bytes);
        return bytes;
    }

    private Duration recordTtl() {
        return appProperties.getRecovery().getTimeout().plus(appProperties.getRecovery().getStoreGrace());
    }
}
