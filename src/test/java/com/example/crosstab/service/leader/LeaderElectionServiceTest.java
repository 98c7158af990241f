package com.example.crosstab.service.leader;

import com.example.crosstab.exception.ProtocolException;
import com.example.crosstab.exception.StaleMessageException;
import com.example.crosstab.model.LeaderRecord;
import com.example.crosstab.store.StoreKeys;
import com.example.crosstab.support.CoordinationFixture;
import com.example.crosstab.support.TestClient;
import com.example.crosstab.util.Constants.CrossTabEventType;
import com.example.crosstab.util.Constants.DisconnectReason;
import com.example.crosstab.util.Constants.ErrorCode;
import com.example.crosstab.util.Constants.Visibility;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LeaderElectionServiceTest {

    private CoordinationFixture fixture;
    private LeaderElectionService election;

    @BeforeEach
    void setUp() {
        fixture = new CoordinationFixture();
        election = fixture.leaderElection;
    }

    private LeaderRecord leader() {
        return election.currentLeader("u1").orElseThrow();
    }

    private static ErrorCode codeOf(Throwable e) {
        return ((ProtocolException) e).getCode();
    }

    @Test
    void soleConnectionIsElectedAtOnce() {
        TestClient tab = fixture.attach("u1", "tab-a", Visibility.VISIBLE);

        assertThat(tab.isLeader()).isTrue();
        assertThat(leader().getLeaderId()).isEqualTo("tab-a");
        assertThat(leader().getVersion()).isEqualTo(1);
        assertThat(fixture.runnableTaskCount()).isZero();

        JsonNode elected = tab.lastPayload(CrossTabEventType.LEADER_ELECTED).orElseThrow();
        assertThat(elected.path("leaderId").asText()).isEqualTo("tab-a");
        assertThat(elected.path("version").asLong()).isEqualTo(1);
        assertThat(fixture.sharedState.getRecord("u1")).isPresent();
    }

    @Test
    void lowerRankedNewcomerLeavesTheLeaderInPlace() {
        TestClient first = fixture.attach("u1", "tab-a", Visibility.VISIBLE);
        TestClient second = fixture.attach("u1", "tab-b", Visibility.HIDDEN);

        assertThat(second.payloads(CrossTabEventType.LEADER_ELECTED))
                .anySatisfy(payload -> assertThat(payload.path("leaderId").asText()).isEqualTo("tab-a"));
        assertThat(first.lastPayload(CrossTabEventType.LEADER_ELECTION).orElseThrow().path("candidateId").asText())
                .isEqualTo("tab-b");

        assertThat(fixture.runScheduledTasks()).isEqualTo(1);

        assertThat(first.isLeader()).isTrue();
        assertThat(second.isLeader()).isFalse();
        assertThat(leader().getVersion()).isEqualTo(1);
    }

    @Test
    void higherRankedNewcomerTakesOverWhenTheCandidateDelayEnds() {
        TestClient hidden = fixture.attach("u1", "tab-a", Visibility.HIDDEN);
        TestClient visible = fixture.attach("u1", "tab-b", Visibility.VISIBLE);

        assertThat(hidden.isLeader()).isTrue();

        fixture.runScheduledTasks();

        assertThat(visible.isLeader()).isTrue();
        assertThat(hidden.isLeader()).isFalse();
        assertThat(leader().getLeaderId()).isEqualTo("tab-b");
        assertThat(leader().getVersion()).isEqualTo(2);
    }

    @Test
    void equalPriorityIsBrokenByTheLargerTabId() {
        fixture.attach("u1", "tab-a", Visibility.VISIBLE);
        fixture.attach("u1", "tab-c", Visibility.VISIBLE);
        fixture.attach("u1", "tab-b", Visibility.VISIBLE);

        fixture.runScheduledTasks();

        assertThat(leader().getLeaderId()).isEqualTo("tab-c");
    }

    @Test
    void thereIsNeverMoreThanOneLocalLeader() {
        List<TestClient> tabs = List.of(
                fixture.attach("u1", "tab-a", Visibility.HIDDEN),
                fixture.attach("u1", "tab-b", Visibility.VISIBLE),
                fixture.attach("u1", "device-2", "session-2", "tab-c", Visibility.HIDDEN),
                fixture.attach("u1", "device-2", "session-2", "tab-d", Visibility.VISIBLE));

        do {
            assertThat(tabs.stream().filter(TestClient::isLeader).count()).isLessThanOrEqualTo(1);
        } while (fixture.runScheduledTasks() > 0);

        assertThat(tabs.stream().filter(TestClient::isLeader).map(tab -> tab.connection().getTabId()))
                .containsExactly("tab-d");
        assertThat(fixture.connectionRegistry.getLocalLeaderCount()).isEqualTo(1);
    }

    @Test
    void forcedElectionReplacesTheSittingLeader() {
        TestClient first = fixture.attach("u1", "tab-a", Visibility.VISIBLE);
        TestClient second = fixture.attach("u1", "tab-b", Visibility.HIDDEN);
        fixture.runScheduledTasks();

        LeaderRecord record = election.forceElection(second.connection());

        assertThat(record.getLeaderId()).isEqualTo("tab-b");
        assertThat(record.getVersion()).isEqualTo(2);
        assertThat(second.isLeader()).isTrue();
        assertThat(first.isLeader()).isFalse();
    }

    @Nested
    class Transfer {

        private TestClient first;
        private TestClient second;

        @BeforeEach
        void attachTwoTabs() {
            first = fixture.attach("u1", "tab-a", Visibility.VISIBLE);
            second = fixture.attach("u1", "tab-b", Visibility.HIDDEN);
            fixture.runScheduledTasks();
            first.clearEvents();
            second.clearEvents();
        }

        @Test
        void leaderHandsOverWithItsState() {
            ObjectNode state = fixture.objectMapper.createObjectNode().put("count", 3);

            LeaderRecord record = election.transfer(first.connection(), "tab-b", state, 1L);

            assertThat(record.getLeaderId()).isEqualTo("tab-b");
            assertThat(record.getVersion()).isEqualTo(2);
            assertThat(record.isAcknowledged()).isFalse();
            assertThat(second.isLeader()).isTrue();
            assertThat(first.isLeader()).isFalse();
            assertThat(fixture.sharedState.getRecord("u1").orElseThrow().getStateData().path("count").asInt()).isEqualTo(3);

            JsonNode announced = second.lastPayload(CrossTabEventType.LEADER_TRANSFER).orElseThrow();
            assertThat(announced.path("previousLeaderId").asText()).isEqualTo("tab-a");
            assertThat(announced.path("newLeaderId").asText()).isEqualTo("tab-b");
            assertThat(announced.path("state").path("count").asInt()).isEqualTo(3);
        }

        @Test
        void acknowledgedTransferSurvivesTheGraceTimer() {
            election.transfer(first.connection(), "tab-b", null, null);

            LeaderRecord acknowledged = election.acknowledgeTransfer(second.connection(), 2L);
            fixture.runScheduledTasks();

            assertThat(acknowledged.isAcknowledged()).isTrue();
            assertThat(leader().getLeaderId()).isEqualTo("tab-b");
            assertThat(leader().getVersion()).isEqualTo(2);
            assertThat(second.isLeader()).isTrue();
        }

        @Test
        void unacknowledgedTransferFallsBackToAnElection() {
            election.transfer(first.connection(), "tab-b", null, null);

            fixture.runScheduledTasks();

            assertThat(election.currentLeader("u1")).isEmpty();
            assertThat(first.lastPayload(CrossTabEventType.LEADER_FAILED).orElseThrow().path("reason").asText())
                    .isEqualTo("transfer-timeout");

            fixture.runScheduledTasks();

            assertThat(leader().getLeaderId()).isEqualTo("tab-a");
            assertThat(first.isLeader()).isTrue();
            assertThat(second.isLeader()).isFalse();
        }

        @Test
        void electionAfterATransferTimeoutKeepsRaisingTheVersion() {
            long transferred = election.transfer(first.connection(), "tab-b", null, null).getVersion();

            fixture.runScheduledTasks();

            LeaderRecord vacant = fixture.store.get(StoreKeys.leader("u1"), LeaderRecord.class).orElseThrow();
            assertThat(vacant.isVacant()).isTrue();
            assertThat(vacant.getVersion()).isEqualTo(transferred);

            fixture.runScheduledTasks();

            assertThat(leader().getLeaderId()).isEqualTo("tab-a");
            assertThat(leader().getVersion()).isGreaterThan(transferred);
            assertThat(first.lastPayload(CrossTabEventType.LEADER_ELECTED).orElseThrow().path("version").asLong())
                    .isEqualTo(leader().getVersion());
        }

        @Test
        void onlyTheLeaderCanTransfer() {
            assertThatThrownBy(() -> election.transfer(second.connection(), "tab-a", null, null))
                    .isInstanceOf(ProtocolException.class)
                    .satisfies(e -> assertThat(codeOf(e)).isEqualTo(ErrorCode.NOT_LEADER));
        }

        @Test
        void transferToAnUnattachedTabFails() {
            assertThatThrownBy(() -> election.transfer(first.connection(), "tab-z", null, null))
                    .isInstanceOf(ProtocolException.class)
                    .satisfies(e -> assertThat(codeOf(e)).isEqualTo(ErrorCode.UNKNOWN_TAB));
            assertThat(leader().getVersion()).isEqualTo(1);
        }

        @Test
        void transferWithAnOldVersionIsStale() {
            election.transfer(first.connection(), "tab-b", null, 1L);

            assertThatThrownBy(() -> election.transfer(second.connection(), "tab-a", null, 1L))
                    .isInstanceOf(StaleMessageException.class);
            assertThat(leader().getLeaderId()).isEqualTo("tab-b");
        }

        @Test
        void onlyTheTargetCanAcknowledge() {
            election.transfer(first.connection(), "tab-b", null, null);

            assertThatThrownBy(() -> election.acknowledgeTransfer(first.connection(), null))
                    .isInstanceOf(ProtocolException.class)
                    .satisfies(e -> assertThat(codeOf(e)).isEqualTo(ErrorCode.NOT_TRANSFER_TARGET));
        }

        @Test
        void leaderGoingHiddenHandsOverToAVisibleTab() {
            election.onVisibilityChange(second.connection(), Visibility.VISIBLE);
            assertThat(first.isLeader()).isTrue();
            assertThat(first.lastPayload(CrossTabEventType.TAB_VISIBILITY_CHANGED).orElseThrow().path("state").asText())
                    .isEqualTo("visible");

            election.onVisibilityChange(first.connection(), Visibility.HIDDEN);

            assertThat(second.isLeader()).isTrue();
            assertThat(leader().getLeaderId()).isEqualTo("tab-b");
        }

        @Test
        void leaderGoingHiddenKeepsLeadershipWithoutAVisibleSuccessor() {
            election.onVisibilityChange(first.connection(), Visibility.HIDDEN);

            assertThat(first.isLeader()).isTrue();
            assertThat(leader().getVersion()).isEqualTo(1);
        }

        @Test
        void closingLeaderHandsOverBeforeItLeaves() {
            fixture.connectionService.disconnect(first.id(), DisconnectReason.CLIENT_CLOSING);

            assertThat(first.isCompleted()).isTrue();
            assertThat(second.isLeader()).isTrue();
            assertThat(leader().getLeaderId()).isEqualTo("tab-b");
            assertThat(second.count(CrossTabEventType.LEADER_TRANSFER)).isEqualTo(1);
        }

        @Test
        void leaderLostForGoodIsReplacedAtOnceByTheOnlySurvivor() {
            fixture.drop(first, DisconnectReason.LOGOUT);

            assertThat(second.isLeader()).isTrue();
            assertThat(leader().getLeaderId()).isEqualTo("tab-b");
            JsonNode failed = second.lastPayload(CrossTabEventType.LEADER_FAILED).orElseThrow();
            assertThat(failed.path("previousLeaderId").asText()).isEqualTo("tab-a");
            assertThat(failed.path("reason").asText()).isEqualTo("logout");
        }

        @Test
        void electionAfterALogoutKeepsRaisingTheVersion() {
            long before = leader().getVersion();

            fixture.drop(first, DisconnectReason.LOGOUT);

            assertThat(leader().getLeaderId()).isEqualTo("tab-b");
            assertThat(leader().getVersion()).isGreaterThan(before);
        }

        @Test
        void leaderDroppedByTheTransportIsHeldForRecovery() {
            fixture.drop(first, DisconnectReason.TRANSPORT_CLOSE);

            assertThat(leader().getLeaderId()).isEqualTo("tab-a");
            assertThat(second.isLeader()).isFalse();
            assertThat(fixture.timers.isPending(CoordinationTimers.recoveryGraceKey("u1"))).isTrue();

            fixture.runScheduledTasks();

            assertThat(second.isLeader()).isTrue();
            assertThat(second.lastPayload(CrossTabEventType.LEADER_FAILED).orElseThrow().path("reason").asText())
                    .isEqualTo("recovery-timeout");
        }
    }

    @Test
    void lastConnectionLeavingClearsLeadershipAndState() {
        TestClient tab = fixture.attach("u1", "tab-a", Visibility.VISIBLE);

        fixture.drop(tab, DisconnectReason.LOGOUT);

        assertThat(election.currentLeader("u1")).isEmpty();
        assertThat(fixture.sharedState.getRecord("u1")).isEmpty();
    }

    @Test
    void soleLeaderDroppedByTheTransportIsHeldForTheRecoveryTimeout() {
        TestClient tab = fixture.attach("u1", "tab-a", Visibility.VISIBLE);

        fixture.drop(tab, DisconnectReason.TRANSPORT_CLOSE);

        Duration remaining = fixture.timers.remaining(CoordinationTimers.recoveryGraceKey("u1")).orElseThrow();
        assertThat(remaining).isGreaterThan(fixture.properties.getLeaderElection().getRecoveryGrace());
        assertThat(leader().getLeaderId()).isEqualTo("tab-a");
    }

    @Test
    void tabAttachingDuringALongHoldWaitsOnlyTheRecoveryGrace() {
        TestClient dropped = fixture.attach("u1", "tab-a", Visibility.VISIBLE);
        fixture.drop(dropped, DisconnectReason.TRANSPORT_CLOSE);

        TestClient fresh = fixture.attach("u1", "tab-c", Visibility.VISIBLE);

        Duration remaining = fixture.timers.remaining(CoordinationTimers.recoveryGraceKey("u1")).orElseThrow();
        assertThat(remaining).isLessThanOrEqualTo(fixture.properties.getLeaderElection().getRecoveryGrace());
        assertThat(fresh.isLeader()).isFalse();

        fixture.runScheduledTasks();

        assertThat(fresh.isLeader()).isTrue();
        assertThat(leader().getLeaderId()).isEqualTo("tab-c");
        assertThat(leader().getVersion()).isEqualTo(2);
    }

    @Test
    void heartbeatRenewsLocalLeadersAndRestartsMissingElections() {
        TestClient tab = fixture.attach("u1", "tab-a", Visibility.VISIBLE);

        election.heartbeat();
        assertThat(tab.lastPayload(CrossTabEventType.LEADER_HEARTBEAT).orElseThrow().path("leaderId").asText())
                .isEqualTo("tab-a");

        fixture.store.delete(StoreKeys.leader("u1"));
        election.heartbeat();
        assertThat(fixture.timers.isPending(CoordinationTimers.reelectKey("u1"))).isTrue();

        fixture.runScheduledTasks();
        assertThat(leader().getLeaderId()).isEqualTo("tab-a");
        assertThat(tab.isLeader()).isTrue();
    }
}
