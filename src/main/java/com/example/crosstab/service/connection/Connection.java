package com.example.crosstab.service.connection;

import com.example.crosstab.model.ConnectionIdentity;
import com.example.crosstab.model.VectorClock;
import com.example.crosstab.util.Constants.DisconnectReason;
import com.example.crosstab.util.Constants.Visibility;
import lombok.Getter;
import lombok.Setter;
import org.springframework.http.codec.ServerSentEvent;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.time.Instant;
import java.util.Collections;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One attached client on this pod: its identity, its SSE sink and the coordination state
 * (visibility, leader flag, vector clock, joined rooms) that only this pod mutates.
 */
@Getter
public class Connection {

    private final String connectionId;
    private final ConnectionIdentity identity;
    private final Instant connectedAt;

    @Getter(lombok.AccessLevel.NONE)
    private final Sinks.Many<ServerSentEvent<String>> sink = Sinks.many().multicast().onBackpressureBuffer();
    @Getter(lombok.AccessLevel.NONE)
    private final Set<String> rooms = ConcurrentHashMap.newKeySet();
    @Getter(lombok.AccessLevel.NONE)
    private final Object emitLock = new Object();
    @Getter(lombok.AccessLevel.NONE)
    private final AtomicBoolean detached = new AtomicBoolean();

    /** Inbound messages of one connection are handled one at a time. */
    private final Object inboundLock = new Object();

    @Setter
    private volatile Visibility visibility;
    @Setter
    private volatile boolean leader;
    @Setter
    private volatile DisconnectReason closeReason;
    private volatile VectorClock vectorClock = VectorClock.empty();

    public Connection(String connectionId, ConnectionIdentity identity, Visibility visibility) {
        this.connectionId = connectionId;
        this.identity = identity;
        this.visibility = visibility;
        this.connectedAt = Instant.now();
    }

    public String getUserId() {
        return identity.getUserId();
    }

    public String getDeviceId() {
        return identity.getDeviceId();
    }

    public String getSessionId() {
        return identity.getSessionId();
    }

    public String getTabId() {
        return identity.getTabId();
    }

    public Set<String> getRooms() {
        return Collections.unmodifiableSet(rooms);
    }

    public synchronized VectorClock tick() {
        vectorClock = vectorClock.tick(getTabId());
        return vectorClock;
    }

    /**
     * Folds a clock seen from another tab into this one and ticks, as for a receive event.
     */
    public synchronized VectorClock observe(VectorClock remote) {
        vectorClock = vectorClock.merge(remote).tick(getTabId());
        return vectorClock;
    }

    /** True for the first caller only. */
    boolean markDetached() {
        return detached.compareAndSet(false, true);
    }

    boolean addRoom(String roomId) {
        return rooms.add(roomId);
    }

    boolean removeRoom(String roomId) {
        return rooms.remove(roomId);
    }

    Sinks.EmitResult emit(ServerSentEvent<String> event) {
        synchronized (emitLock) {
            return sink.tryEmitNext(event);
        }
    }

    void complete() {
        synchronized (emitLock) {
            sink.tryEmitComplete();
        }
    }

    Flux<ServerSentEvent<String>> asFlux() {
        return sink.asFlux();
    }
}
