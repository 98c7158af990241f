package com.example.crosstab.service.connection;

import com.example.crosstab.config.AppProperties;
import com.example.crosstab.model.ConnectionIdentity;
import com.example.crosstab.util.Constants.CrossTabEventType;
import com.example.crosstab.util.Constants.DisconnectReason;
import com.example.crosstab.util.Constants.Visibility;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class LocalConnectionRegistryTest {

    private static final ConnectionIdentity IDENTITY = new ConnectionIdentity("u1", "d1", "s1", "t1");

    private final SseEventFactory eventFactory = new SseEventFactory(JsonMapper.builder().addModule(new JavaTimeModule()).build());
    private final LocalConnectionRegistry registry = new LocalConnectionRegistry(new AppProperties(), eventFactory);

    @Test
    void streamStartsWithTheConnectedEventAndEndsOnClose() {
        Connection connection = registry.open(IDENTITY, Visibility.VISIBLE);
        List<DisconnectReason> reasons = new ArrayList<>();

        StepVerifier.create(registry.createEventStream(connection, reasons::add))
                .assertNext(event -> {
                    assertThat(event.event()).isEqualTo(CrossTabEventType.CONNECTED.wireName());
                    assertThat(event.data()).contains(connection.getConnectionId());
                })
                .then(() -> registry.close(connection, DisconnectReason.LOGOUT))
                .verifyComplete();

        assertThat(reasons).containsExactly(DisconnectReason.LOGOUT);
    }

    @Test
    void cancelledStreamReportsATransportClose() {
        Connection connection = registry.open(IDENTITY, Visibility.VISIBLE);
        List<DisconnectReason> reasons = new ArrayList<>();

        StepVerifier.create(registry.createEventStream(connection, reasons::add))
                .expectNextCount(1)
                .thenCancel()
                .verify();

        assertThat(reasons).containsExactly(DisconnectReason.TRANSPORT_CLOSE);
    }

    @Test
    void sessionEndingEventsCloseTheStream() {
        Connection connection = registry.open(IDENTITY, Visibility.VISIBLE);
        List<DisconnectReason> reasons = new ArrayList<>();

        StepVerifier.create(registry.createEventStream(connection, reasons::add))
                .expectNextCount(1)
                .then(() -> registry.send(connection, CrossTabEventType.TOKEN_INVALIDATED,
                        eventFactory.createRawEvent(CrossTabEventType.TOKEN_INVALIDATED, "e1", "{}")))
                .assertNext(event -> assertThat(event.event()).isEqualTo(CrossTabEventType.TOKEN_INVALIDATED.wireName()))
                .verifyComplete();

        assertThat(reasons).containsExactly(DisconnectReason.TOKEN_INVALIDATED);
    }

    @Test
    void indexesFollowJoinsAndRemoval() {
        Connection first = registry.open(IDENTITY, Visibility.VISIBLE);
        Connection second = registry.open(new ConnectionIdentity("u1", "d1", "s1", "t2"), Visibility.HIDDEN);
        registry.joinRoom(first, "user:u1");
        registry.joinRoom(second, "user:u1");
        first.setLeader(true);

        assertThat(registry.localMembers("user:u1")).extracting(Connection::getConnectionId)
                .containsExactlyInAnyOrder(first.getConnectionId(), second.getConnectionId());
        assertThat(registry.getLocalLeaderCount()).isEqualTo(1);

        assertThat(registry.remove(first.getConnectionId())).contains(first);
        assertThat(registry.remove(first.getConnectionId())).isEmpty();

        assertThat(registry.localMembers("user:u1")).containsExactly(second);
        assertThat(registry.localConnectionsForUser("u1")).containsExactly(second);
        assertThat(registry.getConnectionCount()).isEqualTo(1);
    }

    @Test
    void leavingARoomDropsItFromTheIndex() {
        Connection connection = registry.open(IDENTITY, Visibility.VISIBLE);
        registry.joinRoom(connection, "tab:t1");
        registry.leaveRoom(connection, "tab:t1");

        assertThat(registry.localMembers("tab:t1")).isEmpty();
        assertThat(connection.getRooms()).isEmpty();
    }
}
