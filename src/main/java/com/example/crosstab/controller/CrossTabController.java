package com.example.crosstab.controller;

import com.example.crosstab.dto.DispatchResult;
import com.example.crosstab.dto.InboundMessage;
import com.example.crosstab.dto.PodStats;
import com.example.crosstab.dto.StateSnapshot;
import com.example.crosstab.model.ConnectionIdentity;
import com.example.crosstab.model.LeaderRecord;
import com.example.crosstab.service.connection.ConnectionService;
import com.example.crosstab.service.dispatch.CrossTabMessageDispatcher;
import com.example.crosstab.service.leader.LeaderElectionService;
import com.example.crosstab.service.room.RoomRegistryService;
import com.example.crosstab.service.state.SharedStateService;
import com.example.crosstab.util.Constants.DisconnectReason;
import com.example.crosstab.util.Constants.Visibility;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.util.List;

@RestController
@RequestMapping("/api/crosstab")
@RequiredArgsConstructor
@Slf4j
public class CrossTabController {

    private final ConnectionService connectionService;
    private final CrossTabMessageDispatcher dispatcher;
    private final SharedStateService sharedStateService;
    private final LeaderElectionService leaderElectionService;
    private final RoomRegistryService roomRegistry;
    private final Scheduler coordinationScheduler;

    @GetMapping(value = "/connect", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<String>> connect(
            @RequestParam String userId,
            @RequestParam String deviceId,
            @RequestParam String sessionId,
            @RequestParam String tabId,
            @RequestParam(required = false) String visibility,
            @RequestParam(required = false) String recoveryToken) {

        log.info("SSE connection request from user: {}, device: {}, session: {}, tab: {}, recovering: {}",
                userId, deviceId, sessionId, tabId, recoveryToken != null);
        ConnectionIdentity identity = new ConnectionIdentity(userId, deviceId, sessionId, tabId);
        Visibility initialVisibility = parseVisibility(visibility);

        return Mono.fromCallable(() -> connectionService.attach(identity, initialVisibility, recoveryToken))
                .subscribeOn(coordinationScheduler)
                .flatMapMany(ConnectionService.Attachment::stream);
    }

    @PostMapping("/connections/{connectionId}/messages")
    public Mono<ResponseEntity<DispatchResult>> message(
            @PathVariable String connectionId,
            @Valid @RequestBody InboundMessage message) {
        return Mono.fromCallable(() -> dispatcher.dispatch(connectionId, message))
                .subscribeOn(coordinationScheduler)
                .map(ResponseEntity::ok);
    }

    @PostMapping("/connections/{connectionId}/disconnect")
    public Mono<ResponseEntity<String>> disconnect(
            @PathVariable String connectionId,
            @RequestParam(required = false) String reason) {
        DisconnectReason disconnectReason = reason == null ? DisconnectReason.CLIENT_CLOSING : DisconnectReason.fromWireName(reason);
        log.info("Disconnect request for connection: {}, reason: {}", connectionId, disconnectReason.wireName());
        return Mono.fromRunnable(() -> connectionService.disconnect(connectionId, disconnectReason))
                .subscribeOn(coordinationScheduler)
                .then(Mono.just(ResponseEntity.ok("Disconnected successfully")));
    }

    @GetMapping("/users/{userId}/state")
    public Mono<ResponseEntity<StateSnapshot>> getState(@PathVariable String userId) {
        return Mono.fromCallable(() -> sharedStateService.getState(userId)
                        .map(ResponseEntity::ok)
                        .orElseGet(() -> ResponseEntity.notFound().build()))
                .subscribeOn(coordinationScheduler);
    }

    @GetMapping("/users/{userId}/leader")
    public Mono<ResponseEntity<LeaderRecord>> getLeader(@PathVariable String userId) {
        return Mono.fromCallable(() -> leaderElectionService.currentLeader(userId)
                        .map(ResponseEntity::ok)
                        .orElseGet(() -> ResponseEntity.notFound().build()))
                .subscribeOn(coordinationScheduler);
    }

    @GetMapping("/rooms/{roomId}/path")
    public Mono<ResponseEntity<List<String>>> getHierarchyPath(@PathVariable String roomId) {
        return Mono.fromCallable(() -> ResponseEntity.ok(roomRegistry.hierarchyPath(roomId)))
                .subscribeOn(coordinationScheduler);
    }

    @GetMapping("/stats")
    public ResponseEntity<PodStats> getStats() {
        return ResponseEntity.ok(connectionService.stats());
    }

    private static Visibility parseVisibility(String value) {
        try {
            return Visibility.fromWireName(value);
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "visibility must be 'visible' or 'hidden'");
        }
    }
}
