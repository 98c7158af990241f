package com.example.crosstab.service.state;

import com.example.crosstab.aspect.Monitored;
import com.example.crosstab.config.AppProperties;
import com.example.crosstab.dto.StateSnapshot;
import com.example.crosstab.dto.event.StatePayloads;
import com.example.crosstab.exception.ProtocolException;
import com.example.crosstab.model.LeaderRecord;
import com.example.crosstab.model.SharedStateRecord;
import com.example.crosstab.model.VectorClock;
import com.example.crosstab.service.connection.Connection;
import com.example.crosstab.service.room.EventPropagationService;
import com.example.crosstab.service.room.PropagationOptions;
import com.example.crosstab.service.room.RoomRegistryService;
import com.example.crosstab.service.state.StateUpdateResult.Outcome;
import com.example.crosstab.store.CoordinationStore;
import com.example.crosstab.store.StoreKeys;
import com.example.crosstab.util.Constants.CrossTabEventType;
import com.example.crosstab.util.Constants.ErrorCode;
import com.example.crosstab.util.Constants.PropagationDirection;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owns the per-user shared state blob. Writes are vector-clock checked and run as a single
 * atomic store update, so concurrent writers on different pods cannot lose each other's data.
 */
@Service
@Slf4j
@RequiredArgsConstructor
@Monitored("state")
public class SharedStateService {

    /** Device room, then its session rooms, then their tab rooms. */
    private static final int DEVICE_FAN_OUT_DEPTH = 2;

    private final CoordinationStore store;
    private final StateMerger stateMerger;
    private final EventPropagationService eventPropagationService;
    private final RoomRegistryService roomRegistry;
    private final AppProperties appProperties;

    public StateUpdateResult update(Connection connection, JsonNode state, VectorClock clock, StateUpdateOptions options) {
        String userId = connection.getUserId();
        if (state == null || !state.isObject()) {
            throw new ProtocolException(ErrorCode.MALFORMED_PAYLOAD, "state must be a JSON object");
        }
        if (!options.isForce() && !isLeader(connection)) {
            log.debug("Rejected state update from non-leader tab {} of user {}", connection.getTabId(), userId);
            return new StateUpdateResult(Outcome.REJECTED, getRecord(userId).orElse(null));
        }

        VectorClock proposed = clock == null ? VectorClock.empty() : clock;
        String origin = connection.getTabId();
        AtomicReference<Outcome> outcome = new AtomicReference<>();
        SharedStateRecord stored = store.update(StoreKeys.state(userId), SharedStateRecord.class, current -> {
            SharedStateRecord base = current != null ? current : SharedStateRecord.initial();
            switch (proposed.compareWith(base.getVectorClock())) {
                case AFTER -> {
                    outcome.set(Outcome.ACCEPTED);
                    return base.toBuilder()
                            .stateData(state.deepCopy())
                            .version(base.getVersion() + 1)
                            .vectorClock(proposed)
                            .updatedBy(origin)
                            .updatedAt(Instant.now())
                            .conflictResolved(false)
                            .build();
                }
                case CONCURRENT -> {
                    outcome.set(Outcome.MERGED);
                    return base.toBuilder()
                            .stateData(stateMerger.merge(base.getStateData(), base.getUpdatedBy(), state, origin))
                            .version(base.getVersion() + 1)
                            .vectorClock(base.getVectorClock().merge(proposed))
                            .updatedBy(origin)
                            .updatedAt(Instant.now())
                            .conflictResolved(true)
                            .build();
                }
                default -> {
                    outcome.set(Outcome.REJECTED);
                    return current;
                }
            }
        }, stateTtl());

        connection.observe(proposed);
        if (outcome.get() == Outcome.REJECTED) {
            log.debug("Dropped stale state update from tab {} (clock {} vs stored {})", origin, proposed,
                    stored == null ? null : stored.getVectorClock());
            return new StateUpdateResult(Outcome.REJECTED, stored);
        }

        log.info("[STATE_{}] user={}, tab={}, version={}", outcome.get(), userId, origin, stored.getVersion());
        broadcast(connection, stored, options.isSyncAcrossDevices());
        return new StateUpdateResult(outcome.get(), stored);
    }

    public Optional<StateSnapshot> getState(String userId) {
        return getRecord(userId).map(record -> new StateSnapshot(record.getStateData(), record.getVersion()));
    }

    public Optional<SharedStateRecord> getRecord(String userId) {
        return store.get(StoreKeys.state(userId), SharedStateRecord.class);
    }

    /**
     * Sends the current state to the requesting connection only.
     */
    public void sync(Connection connection) {
        SharedStateRecord record = getRecord(connection.getUserId()).orElseGet(SharedStateRecord::initial);
        eventPropagationService.emitToConnection(connection.getConnectionId(), CrossTabEventType.STATE_SYNC,
                StatePayloads.Sync.builder().state(record.getStateData()).version(record.getVersion()).build());
    }

    /**
     * Pushes the current state to every connection of the user.
     */
    public void broadcastState(String userId) {
        getRecord(userId).ifPresent(record -> eventPropagationService.emit(RoomRegistryService.userRoom(userId),
                CrossTabEventType.STATE_SYNC,
                StatePayloads.Sync.builder().state(record.getStateData()).version(record.getVersion()).build()));
    }

    public SharedStateRecord initializeIfAbsent(String userId) {
        return store.update(StoreKeys.state(userId), SharedStateRecord.class,
                current -> current != null ? current : SharedStateRecord.initial(), stateTtl());
    }

    /**
     * Stores the state a leader hands over on transfer. The carried state replaces the stored
     * one and the clocks are merged.
     */
    public SharedStateRecord storeTransferredState(String userId, JsonNode state, VectorClock clock, String origin) {
        return store.update(StoreKeys.state(userId), SharedStateRecord.class, current -> {
            SharedStateRecord base = current != null ? current : SharedStateRecord.initial();
            return base.toBuilder()
                    .stateData(state.deepCopy())
                    .version(base.getVersion() + 1)
                    .vectorClock(base.getVectorClock().merge(clock))
                    .updatedBy(origin)
                    .updatedAt(Instant.now())
                    .conflictResolved(false)
                    .build();
        }, stateTtl());
    }

    /** Renews the state's TTL without changing it. */
    public void touch(String userId) {
        store.expire(StoreKeys.state(userId), stateTtl());
    }

    public void clear(String userId) {
        if (store.delete(StoreKeys.state(userId))) {
            log.info("Cleared shared state of user {}", userId);
        }
    }

    private void broadcast(Connection connection, SharedStateRecord record, boolean syncAcrossDevices) {
        String userRoom = RoomRegistryService.userRoom(connection.getUserId());
        String deviceRoom = RoomRegistryService.deviceRoom(connection.getUserId(), connection.getDeviceId());
        StatePayloads.Update payload = StatePayloads.Update.builder()
                .state(record.getStateData())
                .version(record.getVersion())
                .vectorClock(record.getVectorClock())
                .updatedBy(record.getUpdatedBy())
                .conflictResolved(record.isConflictResolved() ? Boolean.TRUE : null)
                .build();

        eventPropagationService.emitWithPropagation(deviceRoom, CrossTabEventType.STATE_UPDATE, payload,
                PropagationOptions.builder()
                        .direction(PropagationDirection.DOWN)
                        .depth(DEVICE_FAN_OUT_DEPTH)
                        .excludedConnectionId(connection.getConnectionId())
                        .build());

        if (syncAcrossDevices && appProperties.getStateSync().isCrossDeviceEnabled()) {
            StatePayloads.Update crossDevice = payload.toBuilder().sourceDevice(connection.getDeviceId()).build();
            for (String otherDevice : roomRegistry.getChildren(userRoom)) {
                if (!otherDevice.equals(deviceRoom)) {
                    eventPropagationService.emitWithPropagation(otherDevice, CrossTabEventType.STATE_UPDATE, crossDevice,
                            PropagationOptions.builder()
                                    .direction(PropagationDirection.DOWN)
                                    .depth(DEVICE_FAN_OUT_DEPTH)
                                    .build());
                }
            }
        }
    }

    private boolean isLeader(Connection connection) {
        return store.get(StoreKeys.leader(connection.getUserId()), LeaderRecord.class)
                .map(record -> connection.getConnectionId().equals(record.getConnectionId()))
                .orElse(false);
    }

    private Duration stateTtl() {
        return appProperties.getStateSync().getStateTtl();
    }
}
