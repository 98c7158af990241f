package com.example.crosstab.service.token;

import com.example.crosstab.aspect.Monitored;
import com.example.crosstab.config.AppProperties;
import com.example.crosstab.dto.event.TokenPayloads;
import com.example.crosstab.exception.CollaboratorFailureException;
import com.example.crosstab.exception.ProtocolException;
import com.example.crosstab.model.TokenPair;
import com.example.crosstab.service.connection.Connection;
import com.example.crosstab.service.identity.IdentityProvider;
import com.example.crosstab.service.leader.LeaderElectionService;
import com.example.crosstab.service.room.EventPropagationService;
import com.example.crosstab.service.room.PropagationOptions;
import com.example.crosstab.service.room.RoomRegistryService;
import com.example.crosstab.store.CoordinationStore;
import com.example.crosstab.store.StoreKeys;
import com.example.crosstab.util.Constants.CrossTabEventType;
import com.example.crosstab.util.Constants.ErrorCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Token refresh runs once per user, in the leader tab, and the result is fanned out to the
 * other tabs of the device. Other devices only learn that a refresh happened.
 */
@Service
@Slf4j
@RequiredArgsConstructor
@Monitored("token")
public class TokenBroadcastService {

    private static final String SOURCE_LEADER = "leader";

    private final IdentityProvider identityProvider;
    private final LeaderElectionService leaderElectionService;
    private final EventPropagationService eventPropagationService;
    private final RoomRegistryService roomRegistry;
    private final CoordinationStore store;
    private final AppProperties appProperties;

    /**
     * @return the new pair, or empty when the identity service failed (the requester is told)
     */
    public Optional<TokenPair> refresh(Connection connection, String refreshToken) {
        if (!leaderElectionService.isLeader(connection)) {
            throw new ProtocolException(ErrorCode.NOT_LEADER, "Only the leader tab refreshes tokens");
        }
        if (refreshToken == null || refreshToken.isBlank()) {
            throw new ProtocolException(ErrorCode.MISSING_REFRESH_TOKEN, "refreshToken is required");
        }

        TokenPair pair;
        try {
            pair = identityProvider.refreshToken(refreshToken);
        } catch (CollaboratorFailureException e) {
            log.warn("[TOKEN_REFRESH_FAILED] user={}, tab={}: {}", connection.getUserId(), connection.getTabId(), e.getMessage());
            eventPropagationService.emitToConnection(connection.getConnectionId(), CrossTabEventType.TOKEN_ERROR,
                    TokenPayloads.Failure.builder()
                            .code(ErrorCode.REFRESH_FAILED.name())
                            .message(e.getMessage())
                            .build());
            return Optional.empty();
        }

        String userId = connection.getUserId();
        String deviceId = connection.getDeviceId();
        Instant updatedAt = pair.getIssuedAt() != null ? pair.getIssuedAt() : Instant.now();
        store.put(StoreKeys.token(userId, deviceId), pair, appProperties.getToken().getSyncTtl());

        TokenPayloads.Updated updated = TokenPayloads.Updated.builder()
                .token(pair.getToken())
                .refreshToken(pair.getRefreshToken())
                .updatedAt(updatedAt)
                .source(SOURCE_LEADER)
                .build();
        eventPropagationService.emitToConnection(connection.getConnectionId(), CrossTabEventType.TOKEN_UPDATED, updated);

        String deviceRoom = RoomRegistryService.deviceRoom(userId, deviceId);
        if (appProperties.getToken().isCrossTabsEnabled()) {
            eventPropagationService.emitExcept(deviceRoom, CrossTabEventType.TOKEN_UPDATED, updated,
                    Set.of(connection.getConnectionId()));
        }
        if (appProperties.getToken().isCrossDevicesEnabled()) {
            TokenPayloads.RefreshNotification notification = TokenPayloads.RefreshNotification.builder()
                    .deviceId(deviceId)
                    .updatedAt(updatedAt)
                    .source(SOURCE_LEADER)
                    .build();
            for (String otherDevice : roomRegistry.getChildren(RoomRegistryService.userRoom(userId))) {
                if (!otherDevice.equals(deviceRoom)) {
                    eventPropagationService.emitWithPropagation(otherDevice, CrossTabEventType.TOKEN_REFRESH_NOTIFICATION,
                            notification, PropagationOptions.defaults());
                }
            }
        }
        log.info("[TOKEN_REFRESHED] user={}, device={}, tab={}", userId, deviceId, connection.getTabId());
        return Optional.of(pair);
    }

    /**
     * Invalidates the tokens of one device or of the whole user. Every connection that gets the
     * event is closed once it is flushed.
     *
     * @throws CollaboratorFailureException when the identity service could not invalidate
     */
    public void invalidate(Connection connection, String reason, boolean allDevices) {
        String userId = connection.getUserId();
        String deviceId = connection.getDeviceId();
        identityProvider.invalidateTokens(userId, allDevices ? null : deviceId);

        store.delete(StoreKeys.token(userId, deviceId));
        String room = allDevices ? RoomRegistryService.userRoom(userId) : RoomRegistryService.deviceRoom(userId, deviceId);
        List<String> rooms = eventPropagationService.emitWithPropagation(room, CrossTabEventType.TOKEN_INVALIDATED,
                TokenPayloads.Invalidated.builder()
                        .reason(reason == null ? "invalidated" : reason)
                        .source(connection.getTabId())
                        .build(),
                PropagationOptions.defaults());
        log.info("[TOKEN_INVALIDATED] user={}, scope={}, reason='{}', rooms={}",
                userId, allDevices ? "all-devices" : deviceId, reason, rooms.size());
    }

    /**
     * Re-sends the last pair distributed for the requester's device, if one is still kept.
     */
    public boolean syncRequest(Connection connection) {
        Optional<TokenPair> pair = store.get(StoreKeys.token(connection.getUserId(), connection.getDeviceId()), TokenPair.class);
        pair.ifPresent(tokens -> eventPropagationService.emitToConnection(connection.getConnectionId(), CrossTabEventType.TOKEN_UPDATED,
                TokenPayloads.Updated.builder()
                        .token(tokens.getToken())
                        .refreshToken(tokens.getRefreshToken())
                        .updatedAt(tokens.getIssuedAt())
                        .source("sync")
                        .build()));
        if (pair.isEmpty()) {
            log.debug("No token pair kept for user {} device {}", connection.getUserId(), connection.getDeviceId());
        }
        return pair.isPresent();
    }
}
