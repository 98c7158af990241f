package com.example.crosstab.service.leader;

import com.example.crosstab.config.AppProperties;
import com.example.crosstab.service.connection.Connection;
import com.example.crosstab.service.connection.LocalConnectionRegistry;
import com.example.crosstab.service.state.SharedStateService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic leader duties of this pod: renewing leader records and, when enabled, pushing the
 * shared state to every tab.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class LeaderHeartbeatMonitor {

    private final LeaderElectionService leaderElectionService;
    private final SharedStateService sharedStateService;
    private final LocalConnectionRegistry connectionRegistry;
    private final AppProperties appProperties;

    @Scheduled(fixedRateString = "#{@appProperties.leaderElection.heartbeatInterval.toMillis()}")
    public void heartbeat() {
        try {
            leaderElectionService.heartbeat();
        } catch (Exception e) {
            log.error("Error in leader heartbeat: {}", e.getMessage(), e);
        }
    }

    @Scheduled(fixedRateString = "#{@appProperties.stateSync.syncInterval.toMillis()}")
    public void autoSync() {
        if (!appProperties.getStateSync().isAutoSync()) {
            return;
        }
        try {
            for (Connection connection : connectionRegistry.allConnections()) {
                if (connection.isLeader()) {
                    sharedStateService.broadcastState(connection.getUserId());
                }
            }
        } catch (Exception e) {
            log.error("Error in state auto-sync: {}", e.getMessage());
        }
    }
}
