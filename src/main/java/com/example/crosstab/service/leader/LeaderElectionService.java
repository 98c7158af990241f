package com.example.crosstab.service.leader;

import com.example.crosstab.aspect.Monitored;
import com.example.crosstab.config.AppProperties;
import com.example.crosstab.dto.event.ConnectionPayloads;
import com.example.crosstab.dto.event.LeaderPayloads;
import com.example.crosstab.exception.ProtocolException;
import com.example.crosstab.exception.StaleMessageException;
import com.example.crosstab.model.ConnectionInfo;
import com.example.crosstab.model.LeaderRecord;
import com.example.crosstab.model.SharedStateRecord;
import com.example.crosstab.model.VectorClock;
import com.example.crosstab.service.connection.Connection;
import com.example.crosstab.service.connection.ConnectionDirectory;
import com.example.crosstab.service.connection.LocalConnectionRegistry;
import com.example.crosstab.service.room.EventPropagationService;
import com.example.crosstab.service.room.RoomRegistryService;
import com.example.crosstab.service.state.SharedStateService;
import com.example.crosstab.store.CoordinationStore;
import com.example.crosstab.store.StoreKeys;
import com.example.crosstab.util.Constants.CrossTabEventType;
import com.example.crosstab.util.Constants.DisconnectReason;
import com.example.crosstab.util.Constants.ErrorCode;
import com.example.crosstab.util.Constants.RoomType;
import com.example.crosstab.util.Constants.Visibility;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Keeps exactly one leader connection per user.
 * <p>
 * The {@link LeaderRecord} in the coordination store is the only source of truth. Every change
 * to it is one atomic store update whose function re-checks the record it is given, so two pods
 * electing at the same moment end with a single winner. Local {@code leader} flags are derived
 * from the record after each change.
 */
@Service
@Slf4j
@RequiredArgsConstructor
@Monitored("election")
public class LeaderElectionService {

    public enum ElectionOutcome {
        /** Leadership was claimed (or already held) right away. */
        ELECTED,
        /** Candidacy announced; the outcome is decided when the candidate delay runs out. */
        CANDIDATE
    }

    private final CoordinationStore store;
    private final RoomRegistryService roomRegistry;
    private final ConnectionDirectory connectionDirectory;
    private final LocalConnectionRegistry connectionRegistry;
    private final EventPropagationService eventPropagationService;
    private final SharedStateService sharedStateService;
    private final CoordinationTimers timers;
    private final AppProperties appProperties;

    /**
     * Runs an election for a connection. A connection that is alone in its user room takes
     * leadership at once; otherwise it announces its candidacy and the best attached candidate
     * is chosen when the candidate delay expires.
     */
    public ElectionOutcome elect(Connection connection) {
        String userId = connection.getUserId();
        VectorClock clock = connection.tick();
        long attached = roomRegistry.memberCount(RoomRegistryService.userRoom(userId));
        shortenRecoveryHold(userId);

        if (attached <= 1 && !timers.isPending(CoordinationTimers.recoveryGraceKey(userId))) {
            LeaderRecord record = claim(userId, infoOf(connection), clock, existing -> true);
            return record != null && connection.getConnectionId().equals(record.getConnectionId())
                    ? ElectionOutcome.ELECTED
                    : ElectionOutcome.CANDIDATE;
        }

        announceCandidacy(connection);
        return ElectionOutcome.CANDIDATE;
    }

    /**
     * Takes leadership for the caller regardless of the sitting leader.
     */
    public LeaderRecord forceElection(Connection connection) {
        String userId = connection.getUserId();
        log.warn("[FORCE_ELECTION] user={}, tab={}, connection={}", userId, connection.getTabId(), connection.getConnectionId());
        timers.cancel(CoordinationTimers.transferKey(userId));
        timers.cancel(CoordinationTimers.recoveryGraceKey(userId));
        return claim(userId, infoOf(connection), connection.tick(), existing -> true);
    }

    /**
     * How a local connection reacts to another tab's candidacy: a sitting leader that ranks at
     * least as high re-asserts itself, a non-leader that ranks higher runs its own candidacy.
     */
    public void observeElection(Connection observer, LeaderPayloads.Election candidate) {
        if (observer.getTabId().equals(candidate.getCandidateId())) {
            return;
        }
        if (candidate.getVectorClock() != null) {
            observer.observe(candidate.getVectorClock());
        }
        int rank = compareRank(priorityOf(observer), observer.getTabId(), candidate.getPriority(), candidate.getCandidateId());
        Optional<LeaderRecord> current = currentLeader(observer.getUserId());

        if (current.isPresent() && observer.getConnectionId().equals(current.get().getConnectionId())) {
            if (rank >= 0) {
                reassert(current.get(), candidate.getCandidateId());
            }
            return;
        }
        if (rank > 0 && !timers.isPending(CoordinationTimers.candidateKey(observer.getConnectionId()))) {
            log.debug("Tab {} outranks candidate {} and contests the election", observer.getTabId(), candidate.getCandidateId());
            announceCandidacy(observer);
        }
    }

    /**
     * Picks the best attached connection of the user and makes it leader, unless the sitting
     * leader is still attached and ranks at least as high.
     */
    public Optional<LeaderRecord> resolveElection(String userId) {
        List<ConnectionInfo> attached = connectionDirectory.connectionsForUser(userId);
        Optional<ConnectionInfo> best = attached.stream().max(ConnectionInfo.RANKING);
        if (best.isEmpty()) {
            log.debug("No attached candidates for user {}", userId);
            return currentLeader(userId);
        }

        Map<String, ConnectionInfo> byConnectionId = attached.stream()
                .collect(Collectors.toMap(ConnectionInfo::getConnectionId, Function.identity(), (a, b) -> a));
        boolean recoveryPending = timers.isPending(CoordinationTimers.recoveryGraceKey(userId));
        ConnectionInfo winner = best.get();

        LeaderRecord record = claim(userId, winner, clockOf(winner), existing -> {
            ConnectionInfo sitting = byConnectionId.get(existing.getConnectionId());
            if (sitting == null) {
                return !recoveryPending;
            }
            return ConnectionInfo.RANKING.compare(sitting, winner) < 0;
        });
        return Optional.ofNullable(record);
    }

    /**
     * Hands leadership to another tab of the same user. Only the current leader may do this.
     */
    public LeaderRecord transfer(Connection connection, String newLeaderId, JsonNode state, Long version) {
        String userId = connection.getUserId();
        LeaderRecord current = currentLeader(userId)
                .orElseThrow(() -> new ProtocolException(ErrorCode.NOT_LEADER, "User " + userId + " has no leader"));
        rejectStale(version, current);
        if (!connection.getConnectionId().equals(current.getConnectionId())) {
            throw new ProtocolException(ErrorCode.NOT_LEADER, "Only the leader can transfer leadership");
        }

        ConnectionInfo target = connectionDirectory.connectionsForUser(userId).stream()
                .filter(info -> info.getTabId().equals(newLeaderId))
                .filter(info -> !info.getConnectionId().equals(connection.getConnectionId()))
                .findFirst()
                .orElseThrow(() -> new ProtocolException(ErrorCode.UNKNOWN_TAB, "No attached tab " + newLeaderId));
        return handOver(connection, current, target, state);
    }

    /**
     * The new leader confirms a transfer; the grace timer is cancelled.
     */
    public LeaderRecord acknowledgeTransfer(Connection connection, Long version) {
        String userId = connection.getUserId();
        LeaderRecord current = currentLeader(userId)
                .orElseThrow(() -> new StaleMessageException("No leadership to acknowledge for user " + userId));
        rejectStale(version, current);
        if (!connection.getConnectionId().equals(current.getConnectionId())) {
            throw new ProtocolException(ErrorCode.NOT_TRANSFER_TARGET, "Leadership was not transferred to this connection");
        }

        long expectedVersion = current.getVersion();
        LeaderRecord acknowledged = store.update(leaderKey(userId), LeaderRecord.class, existing ->
                existing != null && existing.getVersion() == expectedVersion
                        && connection.getConnectionId().equals(existing.getConnectionId())
                        ? existing.toBuilder().acknowledged(true).build()
                        : existing, leaderTtl());

        if (acknowledged == null || acknowledged.getVersion() != expectedVersion || !acknowledged.isAcknowledged()) {
            throw new StaleMessageException("Leadership of user " + userId + " changed before the acknowledgement");
        }
        timers.cancel(CoordinationTimers.transferKey(userId));
        log.info("[TRANSFER_ACK] user={}, leader={}, version={}", userId, acknowledged.getLeaderId(), acknowledged.getVersion());
        eventPropagationService.emit(RoomRegistryService.userRoom(userId), CrossTabEventType.LEADER_ELECTED, electedPayload(acknowledged));
        return acknowledged;
    }

    /**
     * A leader about to close hands over to the best remaining tab, carrying the current state.
     */
    public void onClosing(Connection connection) {
        String userId = connection.getUserId();
        Optional<LeaderRecord> current = currentLeader(userId);
        if (current.isEmpty() || !connection.getConnectionId().equals(current.get().getConnectionId())) {
            return;
        }

        Optional<ConnectionInfo> successor = connectionDirectory.connectionsForUser(userId).stream()
                .filter(info -> !info.getConnectionId().equals(connection.getConnectionId()))
                .max(ConnectionInfo.RANKING);
        if (successor.isPresent()) {
            JsonNode state = sharedStateService.getRecord(userId).map(SharedStateRecord::getStateData).orElse(null);
            handOver(connection, current.get(), successor.get(), state);
            return;
        }

        store.update(leaderKey(userId), LeaderRecord.class, existing ->
                existing != null && connection.getConnectionId().equals(existing.getConnectionId()) ? existing.vacated() : existing,
                leaderTtl());
        syncLocalLeadership(userId);
        log.info("[LEADER_CLOSED] user={}, tab={}: no successor, leadership cleared", userId, connection.getTabId());
    }

    /**
     * Called after a connection has left its rooms.
     */
    public void onDisconnect(Connection connection, DisconnectReason reason) {
        String userId = connection.getUserId();
        timers.cancel(CoordinationTimers.candidateKey(connection.getConnectionId()));

        Optional<LeaderRecord> current = currentLeader(userId);
        if (current.isPresent() && connection.getConnectionId().equals(current.get().getConnectionId())) {
            if (reason.isRecoverable()) {
                holdForRecovery(connection, reason);
                return;
            }
            clearLeadership(userId, connection.getConnectionId(), reason.wireName());
            return;
        }
        cleanupIfAbandoned(userId);
    }

    /**
     * Keeps a dropped leader's record while its recovery token may still be redeemed. Surviving
     * tabs need a leader soon, so they only wait for the recovery grace; a user with no tab left
     * keeps leadership and state for the whole recovery timeout.
     */
    private void holdForRecovery(Connection connection, DisconnectReason reason) {
        String userId = connection.getUserId();
        String connectionId = connection.getConnectionId();
        boolean survivors = roomRegistry.memberCount(RoomRegistryService.userRoom(userId)) > 0;
        Duration hold = survivors
                ? appProperties.getLeaderElection().getRecoveryGrace()
                : appProperties.getRecovery().getTimeout();
        if (!survivors) {
            store.expire(leaderKey(userId), hold.plus(leaderTtl()));
            sharedStateService.touch(userId);
        }
        timers.schedule(CoordinationTimers.recoveryGraceKey(userId), hold,
                () -> clearLeadership(userId, connectionId, "recovery-timeout"));
        log.info("[LEADER_DISCONNECTED] user={}, tab={}, reason='{}': holding leadership for recovery ({} ms)",
                userId, connection.getTabId(), reason.wireName(), hold.toMillis());
    }

    /**
     * A tab that attaches while an absent leader is held needs a leader within the recovery
     * grace, not the full recovery timeout.
     */
    public void shortenRecoveryHold(String userId) {
        String key = CoordinationTimers.recoveryGraceKey(userId);
        Duration grace = appProperties.getLeaderElection().getRecoveryGrace();
        Optional<Duration> remaining = timers.remaining(key);
        if (remaining.isEmpty() || remaining.get().compareTo(grace) <= 0) {
            return;
        }
        currentLeader(userId)
                .filter(record -> connectionRegistry.find(record.getConnectionId()).isEmpty())
                .ifPresent(record -> {
                    String connectionId = record.getConnectionId();
                    store.expire(leaderKey(userId), grace.plus(leaderTtl()));
                    timers.schedule(key, grace, () -> clearLeadership(userId, connectionId, "recovery-timeout"));
                    log.info("[RECOVERY_HOLD] user={}: a tab attached, held leader {} now waits {} ms",
                            userId, record.getLeaderId(), grace.toMillis());
                });
    }

    /**
     * Re-binds a recovered connection to the leadership its tab held before the drop. No new
     * election and no version change.
     *
     * @return false when the record no longer names this tab
     */
    public boolean recoverLeadership(Connection connection) {
        String userId = connection.getUserId();
        String tabId = connection.getTabId();
        int priority = priorityOf(connection);
        LeaderRecord updated = store.update(leaderKey(userId), LeaderRecord.class, existing ->
                existing != null && tabId.equals(existing.getLeaderId())
                        ? existing.toBuilder().connectionId(connection.getConnectionId()).priority(priority).build()
                        : existing, leaderTtl());

        if (updated == null || !connection.getConnectionId().equals(updated.getConnectionId())) {
            log.info("Leadership of user {} no longer names tab {}, recovery falls back to election", userId, tabId);
            return false;
        }
        timers.cancel(CoordinationTimers.recoveryGraceKey(userId));
        syncLocalLeadership(userId);
        eventPropagationService.emit(RoomRegistryService.userRoom(userId), CrossTabEventType.LEADER_RECOVERED,
                LeaderPayloads.Recovered.builder()
                        .leaderId(updated.getLeaderId())
                        .connectionId(updated.getConnectionId())
                        .version(updated.getVersion())
                        .build());
        log.info("[LEADER_RECOVERED] user={}, tab={}, connection={}, version={}",
                userId, tabId, connection.getConnectionId(), updated.getVersion());
        return true;
    }

    public void onVisibilityChange(Connection connection, Visibility visibility) {
        String userId = connection.getUserId();
        connection.setVisibility(visibility);
        ConnectionInfo info = connectionDirectory.updateVisibility(connection, visibility);
        eventPropagationService.emitExcept(RoomRegistryService.userRoom(userId), CrossTabEventType.TAB_VISIBILITY_CHANGED,
                ConnectionPayloads.VisibilityChanged.builder()
                        .tabId(connection.getTabId())
                        .state(visibility.wireName())
                        .priority(info.getPriority())
                        .build(),
                Set.of(connection.getConnectionId()));

        if (visibility != Visibility.HIDDEN) {
            return;
        }
        Optional<LeaderRecord> current = currentLeader(userId);
        if (current.isEmpty() || !connection.getConnectionId().equals(current.get().getConnectionId())) {
            return;
        }
        connectionDirectory.connectionsForUser(userId).stream()
                .filter(other -> !other.getConnectionId().equals(connection.getConnectionId()))
                .filter(other -> other.getVisibility() == Visibility.VISIBLE)
                .max(ConnectionInfo.RANKING)
                .ifPresent(successor -> {
                    log.info("Leader tab {} went hidden, handing over to visible tab {}", connection.getTabId(), successor.getTabId());
                    JsonNode state = sharedStateService.getRecord(userId).map(SharedStateRecord::getStateData).orElse(null);
                    handOver(connection, current.get(), successor, state);
                });
    }

    /**
     * Renews the records of leaders held on this pod and restarts elections for local users
     * whose record has expired.
     */
    public void heartbeat() {
        for (String userId : connectionRegistry.getLocalUserIds()) {
            Optional<LeaderRecord> current = currentLeader(userId);
            if (current.isPresent()) {
                LeaderRecord record = current.get();
                if (connectionRegistry.find(record.getConnectionId()).isPresent()) {
                    store.expire(leaderKey(userId), leaderTtl());
                    eventPropagationService.emit(RoomRegistryService.userRoom(userId), CrossTabEventType.LEADER_HEARTBEAT,
                            LeaderPayloads.Heartbeat.builder()
                                    .leaderId(record.getLeaderId())
                                    .version(record.getVersion())
                                    .timestamp(Instant.now())
                                    .build());
                }
                continue;
            }
            // keeps the vacant record, and with it the version, alive until the election
            store.expire(leaderKey(userId), leaderTtl());
            if (!timers.isPending(CoordinationTimers.recoveryGraceKey(userId))
                    && !timers.isPending(CoordinationTimers.reelectKey(userId))) {
                log.info("[LEADER_MISSING] user={}: no leader record, starting election", userId);
                timers.schedule(CoordinationTimers.reelectKey(userId),
                        appProperties.getLeaderElection().getCandidateDelay(),
                        () -> resolveElection(userId));
            }
        }
    }

    public Optional<LeaderRecord> currentLeader(String userId) {
        return store.get(leaderKey(userId), LeaderRecord.class).filter(record -> !record.isVacant());
    }

    public boolean isLeader(Connection connection) {
        return currentLeader(connection.getUserId())
                .map(record -> connection.getConnectionId().equals(record.getConnectionId()))
                .orElse(false);
    }

    /**
     * Re-derives the {@code leader} flag of every local connection of the user from the record.
     */
    public void syncLocalLeadership(String userId) {
        String leaderConnectionId = currentLeader(userId).map(LeaderRecord::getConnectionId).orElse(null);
        for (Connection connection : connectionRegistry.localConnectionsForUser(userId)) {
            connection.setLeader(connection.getConnectionId().equals(leaderConnectionId));
        }
    }

    private void announceCandidacy(Connection connection) {
        String userId = connection.getUserId();
        LeaderPayloads.Election candidacy = LeaderPayloads.Election.builder()
                .candidateId(connection.getTabId())
                .priority(priorityOf(connection))
                .vectorClock(connection.getVectorClock())
                .build();

        eventPropagationService.emitExcept(RoomRegistryService.userRoom(userId), CrossTabEventType.LEADER_ELECTION,
                candidacy, Set.of(connection.getConnectionId()));
        timers.schedule(CoordinationTimers.candidateKey(connection.getConnectionId()),
                appProperties.getLeaderElection().getCandidateDelay(),
                () -> resolveElection(userId));
        log.debug("[CANDIDATE] user={}, tab={}, priority={}", userId, candidacy.getCandidateId(), candidacy.getPriority());

        for (Connection sibling : connectionRegistry.localConnectionsForUser(userId)) {
            if (!sibling.getConnectionId().equals(connection.getConnectionId())) {
                observeElection(sibling, candidacy);
            }
        }

        // a leader held by another pod re-asserts from here, its pod does not see the local candidacy
        currentLeader(userId)
                .filter(record -> connectionRegistry.find(record.getConnectionId()).isEmpty())
                .filter(record -> compareRank(rankPriority(record), record.getLeaderId(),
                        candidacy.getPriority(), candidacy.getCandidateId()) >= 0)
                .ifPresent(record -> reassert(record, candidacy.getCandidateId()));
    }

    private void reassert(LeaderRecord record, String candidateTabId) {
        log.debug("[REASSERT] user={}, leader={} answers candidate {}", record.getUserId(), record.getLeaderId(), candidateTabId);
        eventPropagationService.emit(RoomType.TAB.roomId(candidateTabId), CrossTabEventType.LEADER_ELECTED, electedPayload(record));
    }

    private LeaderRecord handOver(Connection connection, LeaderRecord current, ConnectionInfo target, JsonNode state) {
        String userId = connection.getUserId();
        VectorClock clock = connection.tick();
        long expectedVersion = current.getVersion();

        LeaderRecord next = store.update(leaderKey(userId), LeaderRecord.class, existing -> {
            if (existing == null || existing.getVersion() != expectedVersion
                    || !connection.getConnectionId().equals(existing.getConnectionId())) {
                return existing;
            }
            return newRecord(target, existing, clock, false);
        }, leaderTtl());

        if (next == null || next.getVersion() == expectedVersion || !target.getConnectionId().equals(next.getConnectionId())) {
            throw new StaleMessageException("Leadership of user " + userId + " changed during the transfer");
        }

        JsonNode carried = state != null && state.isObject() ? state : null;
        if (carried != null) {
            sharedStateService.storeTransferredState(userId, carried, clock, connection.getTabId());
        }
        syncLocalLeadership(userId);
        eventPropagationService.emit(RoomRegistryService.userRoom(userId), CrossTabEventType.LEADER_TRANSFER,
                LeaderPayloads.Transfer.builder()
                        .previousLeaderId(connection.getTabId())
                        .newLeaderId(target.getTabId())
                        .version(next.getVersion())
                        .state(carried)
                        .vectorClock(clock)
                        .build());

        long transferVersion = next.getVersion();
        timers.schedule(CoordinationTimers.transferKey(userId),
                appProperties.getLeaderElection().getTransferGrace(),
                () -> onTransferTimeout(userId, transferVersion));
        log.info("[TRANSFER] user={}, from={}, to={}, version={}", userId, connection.getTabId(), target.getTabId(), transferVersion);
        return next;
    }

    void onTransferTimeout(String userId, long version) {
        AtomicReference<LeaderRecord> dropped = new AtomicReference<>();
        store.update(leaderKey(userId), LeaderRecord.class, existing -> {
            dropped.set(null);
            if (existing != null && !existing.isVacant() && existing.getVersion() == version && !existing.isAcknowledged()) {
                dropped.set(existing);
                return existing.vacated();
            }
            return existing;
        }, leaderTtl());

        if (dropped.get() != null) {
            log.warn("[TRANSFER_TIMEOUT] user={}, tab {} never acknowledged version {}", userId, dropped.get().getLeaderId(), version);
            afterLeaderLost(userId, dropped.get(), "transfer-timeout");
        }
    }

    private void clearLeadership(String userId, String connectionId, String reason) {
        AtomicReference<LeaderRecord> dropped = new AtomicReference<>();
        store.update(leaderKey(userId), LeaderRecord.class, existing -> {
            dropped.set(null);
            if (existing != null && connectionId.equals(existing.getConnectionId())) {
                dropped.set(existing);
                return existing.vacated();
            }
            return existing;
        }, leaderTtl());

        if (dropped.get() != null) {
            log.info("[LEADER_LOST] user={}, tab={}, reason='{}'", userId, dropped.get().getLeaderId(), reason);
            afterLeaderLost(userId, dropped.get(), reason);
        } else {
            cleanupIfAbandoned(userId);
        }
    }

    private void afterLeaderLost(String userId, LeaderRecord lost, String reason) {
        syncLocalLeadership(userId);
        eventPropagationService.emit(RoomRegistryService.userRoom(userId), CrossTabEventType.LEADER_FAILED,
                LeaderPayloads.Failed.builder().previousLeaderId(lost.getLeaderId()).reason(reason).build());

        List<ConnectionInfo> survivors = connectionDirectory.connectionsForUser(userId);
        if (survivors.isEmpty()) {
            cleanupIfAbandoned(userId);
        } else if (survivors.size() == 1) {
            resolveElection(userId);
        } else {
            timers.schedule(CoordinationTimers.reelectKey(userId),
                    appProperties.getLeaderElection().getCandidateDelay(),
                    () -> resolveElection(userId));
        }
    }

    private void cleanupIfAbandoned(String userId) {
        if (roomRegistry.memberCount(RoomRegistryService.userRoom(userId)) > 0
                || timers.isPending(CoordinationTimers.recoveryGraceKey(userId))) {
            return;
        }
        timers.cancel(CoordinationTimers.transferKey(userId));
        timers.cancel(CoordinationTimers.reelectKey(userId));
        store.delete(leaderKey(userId));
        sharedStateService.clear(userId);
        log.info("[USER_ABANDONED] user={}: no connections left, leadership and state removed", userId);
    }

    private LeaderRecord claim(String userId, ConnectionInfo winner, VectorClock clock, Predicate<LeaderRecord> mayReplace) {
        AtomicReference<LeaderRecord> previous = new AtomicReference<>();
        LeaderRecord record = store.update(leaderKey(userId), LeaderRecord.class, existing -> {
            previous.set(existing);
            if (existing == null || existing.isVacant()) {
                return newRecord(winner, existing, clock, true);
            }
            if (winner.getConnectionId().equals(existing.getConnectionId()) || !mayReplace.test(existing)) {
                return existing;
            }
            return newRecord(winner, existing, clock, true);
        }, leaderTtl());

        LeaderRecord before = previous.get();
        if (record != null && (before == null || before.getVersion() != record.getVersion())) {
            onElected(record, before);
        } else if (before != null && !winner.getConnectionId().equals(before.getConnectionId())) {
            log.debug("[ELECTION_CONFLICT] user={}: tab {} keeps leadership over {}", userId, before.getLeaderId(), winner.getTabId());
            syncLocalLeadership(userId);
        } else {
            syncLocalLeadership(userId);
        }
        return record;
    }

    private void onElected(LeaderRecord record, LeaderRecord previous) {
        String userId = record.getUserId();
        timers.cancel(CoordinationTimers.transferKey(userId));
        timers.cancel(CoordinationTimers.reelectKey(userId));
        sharedStateService.initializeIfAbsent(userId);
        syncLocalLeadership(userId);
        eventPropagationService.emit(RoomRegistryService.userRoom(userId), CrossTabEventType.LEADER_ELECTED, electedPayload(record));
        log.info("[ELECTED] user={}, leader={}, connection={}, version={}, previous={}",
                userId, record.getLeaderId(), record.getConnectionId(), record.getVersion(),
                previous == null || previous.isVacant() ? "none" : previous.getLeaderId());
    }

    private LeaderRecord newRecord(ConnectionInfo winner, LeaderRecord existing, VectorClock clock, boolean acknowledged) {
        VectorClock base = existing == null || existing.getVectorClock() == null ? VectorClock.empty() : existing.getVectorClock();
        return LeaderRecord.builder()
                .userId(winner.getUserId())
                .leaderId(winner.getTabId())
                .connectionId(winner.getConnectionId())
                .deviceId(winner.getDeviceId())
                .priority(winner.getPriority())
                .vectorClock(clock == null ? base : base.merge(clock))
                .version(existing == null ? 1L : existing.getVersion() + 1)
                .electedAt(Instant.now())
                .acknowledged(acknowledged)
                .build();
    }

    private LeaderPayloads.Elected electedPayload(LeaderRecord record) {
        return LeaderPayloads.Elected.builder()
                .leaderId(record.getLeaderId())
                .connectionId(record.getConnectionId())
                .version(record.getVersion())
                .vectorClock(record.getVectorClock())
                .electedAt(record.getElectedAt())
                .build();
    }

    private void rejectStale(Long version, LeaderRecord current) {
        if (version != null && version < current.getVersion()) {
            throw new StaleMessageException("Message version " + version + " is older than leader version " + current.getVersion());
        }
    }

    private ConnectionInfo infoOf(Connection connection) {
        return connectionDirectory.find(connection.getConnectionId())
                .orElseGet(() -> connectionDirectory.register(connection));
    }

    private VectorClock clockOf(ConnectionInfo info) {
        return connectionRegistry.find(info.getConnectionId()).map(Connection::getVectorClock).orElse(VectorClock.empty());
    }

    private int rankPriority(LeaderRecord record) {
        return connectionDirectory.find(record.getConnectionId()).map(ConnectionInfo::getPriority).orElse(record.getPriority());
    }

    private int priorityOf(Connection connection) {
        return appProperties.getLeaderElection().getPriority().of(connection.getVisibility());
    }

    private static int compareRank(int priority, String tabId, int otherPriority, String otherTabId) {
        int byPriority = Integer.compare(priority, otherPriority);
        return byPriority != 0 ? byPriority : tabId.compareTo(otherTabId);
    }

    private static String leaderKey(String userId) {
        return StoreKeys.leader(userId);
    }

    private Duration leaderTtl() {
        return appProperties.getLeaderElection().leaderTtl();
    }
}
