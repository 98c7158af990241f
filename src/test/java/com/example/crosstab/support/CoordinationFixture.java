package com.example.crosstab.support;

import com.example.crosstab.config.AppProperties;
import com.example.crosstab.model.ConnectionIdentity;
import com.example.crosstab.model.RecoveryRecord;
import com.example.crosstab.service.connection.ConnectionDirectory;
import com.example.crosstab.service.connection.ConnectionService;
import com.example.crosstab.service.connection.LocalConnectionRegistry;
import com.example.crosstab.service.connection.SseEventFactory;
import com.example.crosstab.service.dispatch.CrossTabMessageDispatcher;
import com.example.crosstab.service.identity.IdentityProvider;
import com.example.crosstab.service.leader.CoordinationTimers;
import com.example.crosstab.service.leader.LeaderElectionService;
import com.example.crosstab.service.recovery.ConnectionRecoveryService;
import com.example.crosstab.service.room.EventPropagationService;
import com.example.crosstab.service.room.LocalRoomEventRelay;
import com.example.crosstab.service.room.RoomRegistryService;
import com.example.crosstab.service.state.SharedStateService;
import com.example.crosstab.service.state.StateMerger;
import com.example.crosstab.service.token.TokenBroadcastService;
import com.example.crosstab.store.CaffeineCoordinationStore;
import com.example.crosstab.util.Constants.DisconnectReason;
import com.example.crosstab.util.Constants.Visibility;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * The coordination services wired by hand against the in-process store, with a TaskScheduler
 * whose tasks only run when the test says so.
 */
public class CoordinationFixture {

    public final ObjectMapper objectMapper = JsonMapper.builder().addModule(new JavaTimeModule()).build();
    public final AppProperties properties = new AppProperties();
    public final CaffeineCoordinationStore store = new CaffeineCoordinationStore(objectMapper, 10_000);
    public final TaskScheduler taskScheduler = mock(TaskScheduler.class);
    public final IdentityProvider identityProvider = mock(IdentityProvider.class);
    public final Cache<String, RecoveryRecord> recoveryCache = Caffeine.newBuilder().maximumSize(1_000).build();

    public final CoordinationTimers timers;
    public final RoomRegistryService roomRegistry;
    public final SseEventFactory sseEventFactory;
    public final LocalConnectionRegistry connectionRegistry;
    public final ConnectionDirectory connectionDirectory;
    public final EventPropagationService propagation;
    public final StateMerger stateMerger = new StateMerger();
    public final SharedStateService sharedState;
    public final LeaderElectionService leaderElection;
    public final ConnectionRecoveryService recovery;
    public final ConnectionService connectionService;
    public final TokenBroadcastService tokens;
    public final CrossTabMessageDispatcher dispatcher;

    private final List<ManualScheduledTask> scheduledTasks = new CopyOnWriteArrayList<>();

    public CoordinationFixture() {
        properties.setPodName("pod-test");
        when(taskScheduler.schedule(any(Runnable.class), any(Instant.class))).thenAnswer(invocation -> {
            ManualScheduledTask task = new ManualScheduledTask(invocation.getArgument(0), invocation.getArgument(1));
            scheduledTasks.add(task);
            return task;
        });

        timers = new CoordinationTimers(taskScheduler);
        roomRegistry = new RoomRegistryService(store, properties);
        sseEventFactory = new SseEventFactory(objectMapper);
        connectionRegistry = new LocalConnectionRegistry(properties, sseEventFactory);
        connectionDirectory = new ConnectionDirectory(store, roomRegistry, connectionRegistry, properties);
        propagation = new EventPropagationService(roomRegistry, connectionRegistry, new LocalRoomEventRelay(),
                sseEventFactory, store, objectMapper, properties);
        sharedState = new SharedStateService(store, stateMerger, propagation, roomRegistry, properties);
        leaderElection = new LeaderElectionService(store, roomRegistry, connectionDirectory, connectionRegistry,
                propagation, sharedState, timers, properties);
        recovery = new ConnectionRecoveryService(store, recoveryCache, roomRegistry, connectionRegistry,
                connectionDirectory, propagation, leaderElection, identityProvider, properties);
        connectionService = new ConnectionService(connectionRegistry, connectionDirectory, roomRegistry,
                leaderElection, recovery, timers, properties);
        tokens = new TokenBroadcastService(identityProvider, leaderElection, propagation, roomRegistry, store, properties);
        dispatcher = new CrossTabMessageDispatcher(connectionRegistry, leaderElection, sharedState, tokens,
                propagation, objectMapper);
    }

    public TestClient attach(String userId, String deviceId, String sessionId, String tabId, Visibility visibility) {
        return new TestClient(connectionService.attach(
                new ConnectionIdentity(userId, deviceId, sessionId, tabId), visibility, null), objectMapper);
    }

    public TestClient attach(String userId, String tabId, Visibility visibility) {
        return attach(userId, "device-1", "session-1", tabId, visibility);
    }

    public TestClient resume(String userId, String tabId, String recoveryToken) {
        return new TestClient(connectionService.attach(
                new ConnectionIdentity(userId, "device-1", "session-1", tabId), Visibility.VISIBLE, recoveryToken), objectMapper);
    }

    /** Ends the client's stream as the transport would; the close callback detaches it. */
    public void drop(TestClient client, DisconnectReason reason) {
        connectionRegistry.close(client.connection(), reason);
    }

    /**
     * Runs every task that is armed right now, once. Tasks armed while running wait for the next call.
     *
     * @return how many tasks ran
     */
    public int runScheduledTasks() {
        int ran = 0;
        for (ManualScheduledTask task : new ArrayList<>(scheduledTasks)) {
            if (task.isRunnable()) {
                task.run();
                ran++;
            }
        }
        return ran;
    }

    /**
     * Runs the armed tasks that would fire within the window from now, leaving later ones armed.
     *
     * @return how many tasks ran
     */
    public int runScheduledTasksDueWithin(Duration window) {
        Instant horizon = Instant.now().plus(window);
        int ran = 0;
        for (ManualScheduledTask task : new ArrayList<>(scheduledTasks)) {
            if (task.isRunnable() && !task.getRunAt().isAfter(horizon)) {
                task.run();
                ran++;
            }
        }
        return ran;
    }

    public List<ManualScheduledTask> scheduledTasks() {
        return List.copyOf(scheduledTasks);
    }

    public long runnableTaskCount() {
        return scheduledTasks.stream().filter(ManualScheduledTask::isRunnable).count();
    }
}
