package com.example.crosstab.service.connection;

import com.example.crosstab.dto.PodStats;
import com.example.crosstab.exception.ConnectionNotFoundException;
import com.example.crosstab.support.CoordinationFixture;
import com.example.crosstab.support.TestClient;
import com.example.crosstab.util.Constants.CrossTabEventType;
import com.example.crosstab.util.Constants.DisconnectReason;
import com.example.crosstab.util.Constants.Visibility;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConnectionServiceTest {

    private CoordinationFixture fixture;
    private ConnectionService connections;

    @BeforeEach
    void setUp() {
        fixture = new CoordinationFixture();
        connections = fixture.connectionService;
    }

    @Test
    void attachJoinsTheRoomChainAndRegistersTheConnection() {
        TestClient tab = fixture.attach("u1", "tab-a", Visibility.VISIBLE);

        assertThat(tab.eventNames()).startsWith(CrossTabEventType.CONNECTED.wireName());
        assertThat(tab.connection().getRooms())
                .containsExactlyInAnyOrder("user:u1", "device:u1:device-1", "session:session-1", "tab:tab-a");
        assertThat(fixture.roomRegistry.members("user:u1")).containsExactly(tab.id());
        assertThat(fixture.connectionDirectory.find(tab.id())).isPresent();
    }

    @Test
    void detachIsIdempotent() {
        TestClient first = fixture.attach("u1", "tab-a", Visibility.VISIBLE);
        TestClient second = fixture.attach("u1", "tab-b", Visibility.HIDDEN);
        fixture.runScheduledTasks();
        second.clearEvents();

        connections.detach(first.id(), DisconnectReason.LOGOUT);
        connections.detach(first.id(), DisconnectReason.LOGOUT);

        assertThat(first.isCompleted()).isTrue();
        assertThat(second.count(CrossTabEventType.PEER_DISCONNECTED)).isEqualTo(1);
        assertThat(second.count(CrossTabEventType.LEADER_FAILED)).isEqualTo(1);
        assertThat(fixture.roomRegistry.members("user:u1")).containsExactly(second.id());
        assertThat(fixture.connectionDirectory.find(first.id())).isEmpty();
    }

    @Test
    void disconnectOfAnUnknownConnectionFails() {
        assertThatThrownBy(() -> connections.disconnect("missing", DisconnectReason.CLIENT_CLOSING))
                .isInstanceOf(ConnectionNotFoundException.class);
    }

    @Test
    void statsCountConnectionsUsersAndLeaders() {
        fixture.attach("u1", "tab-a", Visibility.VISIBLE);
        fixture.attach("u1", "tab-b", Visibility.HIDDEN);
        fixture.attach("u2", "tab-c", Visibility.VISIBLE);

        PodStats stats = connections.stats();

        assertThat(stats.getPodId()).isEqualTo("pod-test");
        assertThat(stats.getActiveConnections()).isEqualTo(3);
        assertThat(stats.getConnectedUsers()).isEqualTo(2);
        assertThat(stats.getLocalLeaders()).isEqualTo(2);
        assertThat(stats.getPendingTasks()).isEqualTo(1);
    }
}
