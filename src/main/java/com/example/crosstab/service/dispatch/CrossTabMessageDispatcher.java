package com.example.crosstab.service.dispatch;

import com.example.crosstab.aspect.Monitored;
import com.example.crosstab.dto.DispatchResult;
import com.example.crosstab.dto.InboundMessage;
import com.example.crosstab.dto.event.ConnectionPayloads;
import com.example.crosstab.dto.event.TokenPayloads;
import com.example.crosstab.exception.CollaboratorFailureException;
import com.example.crosstab.exception.ProtocolException;
import com.example.crosstab.exception.StaleMessageException;
import com.example.crosstab.model.LeaderRecord;
import com.example.crosstab.model.TokenPair;
import com.example.crosstab.service.connection.Connection;
import com.example.crosstab.service.connection.LocalConnectionRegistry;
import com.example.crosstab.service.leader.LeaderElectionService;
import com.example.crosstab.service.room.EventPropagationService;
import com.example.crosstab.service.state.SharedStateService;
import com.example.crosstab.service.state.StateUpdateOptions;
import com.example.crosstab.service.state.StateUpdateResult;
import com.example.crosstab.service.token.TokenBroadcastService;
import com.example.crosstab.util.Constants.CrossTabEventType;
import com.example.crosstab.util.Constants.ErrorCode;
import com.example.crosstab.util.Constants.InboundEventType;
import com.example.crosstab.util.Constants.Visibility;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Routes inbound client messages to the coordination services. Messages of one connection are
 * handled one at a time, in arrival order.
 */
@Service
@Slf4j
@RequiredArgsConstructor
@Monitored("dispatch")
public class CrossTabMessageDispatcher {

    private final LocalConnectionRegistry connectionRegistry;
    private final LeaderElectionService leaderElectionService;
    private final SharedStateService sharedStateService;
    private final TokenBroadcastService tokenBroadcastService;
    private final EventPropagationService eventPropagationService;
    private final ObjectMapper objectMapper;

    /**
     * @throws ProtocolException after the sender has been sent an {@code error} event
     * @throws com.example.crosstab.exception.ConnectionNotFoundException for an unknown connection
     */
    public DispatchResult dispatch(String connectionId, InboundMessage message) {
        Connection connection = connectionRegistry.require(connectionId);
        String event = message.getEvent();
        try {
            InboundEventType type = InboundEventType.fromWireName(event)
                    .orElseThrow(() -> new ProtocolException(ErrorCode.UNKNOWN_EVENT, "Unknown event '" + event + "'"));
            PayloadReader payload = new PayloadReader(message.getPayload(), objectMapper);
            synchronized (connection.getInboundLock()) {
                return handle(connection, type, payload);
            }
        } catch (ProtocolException e) {
            log.debug("Rejected {} from connection {}: {} {}", event, connectionId, e.getCode(), e.getMessage());
            eventPropagationService.emitToConnection(connectionId, CrossTabEventType.ERROR,
                    ConnectionPayloads.ErrorNotice.builder()
                            .code(e.getCode().name())
                            .message(e.getMessage())
                            .event(event)
                            .build());
            throw e;
        } catch (StaleMessageException e) {
            log.debug("Dropped stale {} from connection {}: {}", event, connectionId, e.getMessage());
            return DispatchResult.dropped(event, e.getMessage());
        }
    }

    private DispatchResult handle(Connection connection, InboundEventType type, PayloadReader payload) {
        String event = type.wireName();
        return switch (type) {
            case LEADER_ELECTION -> outcome(event, leaderElectionService.elect(connection).name(), null);
            case LEADER_TRANSFER -> {
                LeaderRecord record = leaderElectionService.transfer(connection,
                        payload.requiredText("newLeaderId"),
                        payload.optionalObject("state"),
                        payload.optionalLong("version"));
                yield outcome(event, "TRANSFERRED", record.getVersion());
            }
            case LEADER_TRANSFER_ACK -> {
                LeaderRecord record = leaderElectionService.acknowledgeTransfer(connection, payload.optionalLong("version"));
                yield outcome(event, "ACKNOWLEDGED", record.getVersion());
            }
            case LEADER_FORCE -> {
                LeaderRecord record = leaderElectionService.forceElection(connection);
                yield outcome(event, "ELECTED", record == null ? null : record.getVersion());
            }
            case CONNECTION_CLOSING -> {
                leaderElectionService.onClosing(connection);
                yield DispatchResult.handled(event);
            }
            case STATE_UPDATE -> {
                StateUpdateOptions options = StateUpdateOptions.builder()
                        .force(payload.flag("force", false))
                        .syncAcrossDevices(payload.flag("syncAcrossDevices", false))
                        .build();
                StateUpdateResult result = sharedStateService.update(connection,
                        payload.optionalObject("state"), payload.optionalClock("vectorClock"), options);
                yield outcome(event, result.getOutcome().name(),
                        result.getRecord() == null ? null : result.getRecord().getVersion());
            }
            case STATE_SYNC -> {
                sharedStateService.sync(connection);
                yield DispatchResult.handled(event);
            }
            case TOKEN_REFRESH -> {
                Optional<TokenPair> pair = tokenBroadcastService.refresh(connection, payload.optionalText("refreshToken"));
                yield outcome(event, pair.isPresent() ? "REFRESHED" : "FAILED", null);
            }
            case TOKEN_INVALIDATE -> invalidate(connection, event, payload);
            case TOKEN_SYNC_REQUEST -> outcome(event, tokenBroadcastService.syncRequest(connection) ? "SENT" : "EMPTY", null);
            case TAB_VISIBILITY_CHANGED -> {
                leaderElectionService.onVisibilityChange(connection, visibility(payload.requiredText("state")));
                yield DispatchResult.handled(event);
            }
        };
    }

    private DispatchResult invalidate(Connection connection, String event, PayloadReader payload) {
        try {
            tokenBroadcastService.invalidate(connection, payload.optionalText("reason"), payload.flag("allDevices", false));
            return outcome(event, "INVALIDATED", null);
        } catch (CollaboratorFailureException e) {
            log.warn("Token invalidation for user {} failed: {}", connection.getUserId(), e.getMessage());
            eventPropagationService.emitToConnection(connection.getConnectionId(), CrossTabEventType.TOKEN_ERROR,
                    TokenPayloads.Failure.builder()
                            .code(ErrorCode.INVALIDATE_FAILED.name())
                            .message(e.getMessage())
                            .build());
            return outcome(event, "FAILED", null);
        }
    }

    private static Visibility visibility(String value) {
        try {
            return Visibility.fromWireName(value);
        } catch (IllegalArgumentException e) {
            throw new ProtocolException(ErrorCode.MALFORMED_PAYLOAD, "state must be 'visible' or 'hidden'");
        }
    }

    private static DispatchResult outcome(String event, String outcome, Long version) {
        return DispatchResult.builder()
                .event(event)
                .status(DispatchResult.Status.HANDLED)
                .outcome(outcome)
                .version(version)
                .build();
    }
}
