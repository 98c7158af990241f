package com.example.crosstab.service.room;

import com.example.crosstab.aspect.Monitored;
import com.example.crosstab.config.AppProperties;
import com.example.crosstab.model.ConnectionIdentity;
import com.example.crosstab.model.RoomChain;
import com.example.crosstab.model.RoomNode;
import com.example.crosstab.store.CoordinationStore;
import com.example.crosstab.store.StoreKeys;
import com.example.crosstab.util.Constants.RoomType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Keeps the {@code user -> device -> session -> tab} room tree in the coordination store.
 * <p>
 * Each room has a node record (type, parent, metadata), a children set that mirrors the
 * parent pointers, and a member set of connection ids. All three share the room TTL, which
 * is renewed on registration and on every join.
 */
@Service
@Slf4j
@RequiredArgsConstructor
@Monitored("rooms")
public class RoomRegistryService {

    private final CoordinationStore store;
    private final AppProperties appProperties;

    public RoomNode register(String roomId, RoomType type, String parentId, Map<String, String> metadata) {
        validate(roomId, type, parentId);
        Duration ttl = roomTtl();
        Map<String, String> extra = metadata == null ? Collections.emptyMap() : metadata;

        RoomNode node = store.update(StoreKeys.room(roomId), RoomNode.class, current -> {
            if (current == null) {
                return RoomNode.builder()
                        .id(roomId)
                        .type(type)
                        .metadata(extra)
                        .createdAt(Instant.now())
                        .build();
            }
            Map<String, String> merged = new HashMap<>(current.getMetadata());
            merged.putAll(extra);
            return current.toBuilder().clearMetadata().metadata(merged).build();
        }, ttl);

        store.addMember(StoreKeys.roomRegistry(type), roomId, ttl);
        store.expire(StoreKeys.roomChildren(roomId), ttl);
        store.expire(StoreKeys.roomMembers(roomId), ttl);

        if (parentId != null) {
            node = setParent(roomId, parentId);
        }
        log.debug("Registered room {} (type={}, parent={})", roomId, type, parentId);
        return node;
    }

    /**
     * Points {@code childId} at {@code parentId}, moving it out of its previous parent's children set.
     */
    public RoomNode setParent(String childId, String parentId) {
        String[] previousParent = new String[1];
        RoomNode node = store.update(StoreKeys.room(childId), RoomNode.class, current -> {
            if (current == null) {
                return null;
            }
            previousParent[0] = current.getParentId();
            return current.toBuilder().parentId(parentId).build();
        }, roomTtl());
        if (node == null) {
            throw new IllegalArgumentException("Room " + childId + " is not registered");
        }

        if (previousParent[0] != null && !previousParent[0].equals(parentId)) {
            store.removeMember(StoreKeys.roomChildren(previousParent[0]), childId);
            log.debug("Moved room {} from parent {} to {}", childId, previousParent[0], parentId);
        }
        store.addMember(StoreKeys.roomChildren(parentId), childId, roomTtl());
        return node;
    }

    public void unregister(String roomId, RoomType type) {
        Optional<RoomNode> removed = store.remove(StoreKeys.room(roomId), RoomNode.class);
        store.removeMember(StoreKeys.roomRegistry(type), roomId);

        removed.map(RoomNode::getParentId)
                .ifPresent(parentId -> store.removeMember(StoreKeys.roomChildren(parentId), roomId));

        for (String childId : store.members(StoreKeys.roomChildren(roomId))) {
            store.update(StoreKeys.room(childId), RoomNode.class,
                    child -> child == null ? null : child.toBuilder().parentId(null).build(), roomTtl());
        }
        store.delete(StoreKeys.roomChildren(roomId));
        store.delete(StoreKeys.roomMembers(roomId));
        store.delete(StoreKeys.roomEvents(roomId));
        log.info("Unregistered room {} (type={})", roomId, type);
    }

    public Optional<RoomNode> getRoom(String roomId) {
        return store.get(StoreKeys.room(roomId), RoomNode.class);
    }

    public String getParent(String roomId) {
        return getRoom(roomId).map(RoomNode::getParentId).orElse(null);
    }

    /** Children in a stable, sorted order. */
    public List<String> getChildren(String roomId) {
        return new ArrayList<>(new TreeSet<>(store.members(StoreKeys.roomChildren(roomId))));
    }

    public Map<String, String> getMetadata(String roomId) {
        return getRoom(roomId).map(RoomNode::getMetadata).orElse(Collections.emptyMap());
    }

    public Set<String> getRoomsByType(RoomType type) {
        return new TreeSet<>(store.members(StoreKeys.roomRegistry(type)));
    }

    /**
     * Walks parent pointers from {@code roomId} to the root, leaf first.
     */
    public List<String> hierarchyPath(String roomId) {
        int maxHops = appProperties.getRooms().getMaxHierarchyHops();
        List<String> path = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        String current = roomId;
        while (current != null && path.size() < maxHops && visited.add(current)) {
            path.add(current);
            current = getParent(current);
        }
        if (current != null && path.size() >= maxHops) {
            log.warn("Hierarchy walk from {} stopped after {} hops", roomId, maxHops);
        }
        return path;
    }

    /**
     * Registers the four-level chain for a connection identity. Idempotent.
     */
    public RoomChain createHierarchy(ConnectionIdentity identity) {
        RoomChain chain = chainFor(identity);
        register(chain.getUserRoom(), RoomType.USER, null, Map.of("userId", identity.getUserId()));
        register(chain.getDeviceRoom(), RoomType.DEVICE, chain.getUserRoom(), Map.of("deviceId", identity.getDeviceId()));
        register(chain.getSessionRoom(), RoomType.SESSION, chain.getDeviceRoom(), Map.of("sessionId", identity.getSessionId()));
        register(chain.getTabRoom(), RoomType.TAB, chain.getSessionRoom(), Map.of("tabId", identity.getTabId()));
        return chain;
    }

    public void join(String roomId, String connectionId) {
        Duration ttl = roomTtl();
        store.addMember(StoreKeys.roomMembers(roomId), connectionId, ttl);
        store.expire(StoreKeys.room(roomId), ttl);
        store.expire(StoreKeys.roomChildren(roomId), ttl);
    }

    public void leave(String roomId, String connectionId) {
        store.removeMember(StoreKeys.roomMembers(roomId), connectionId);
    }

    public Set<String> members(String roomId) {
        return store.members(StoreKeys.roomMembers(roomId));
    }

    public long memberCount(String roomId) {
        return store.memberCount(StoreKeys.roomMembers(roomId));
    }

    public static RoomChain chainFor(ConnectionIdentity identity) {
        return new RoomChain(
                userRoom(identity.getUserId()),
                deviceRoom(identity.getUserId(), identity.getDeviceId()),
                RoomType.SESSION.roomId(identity.getSessionId()),
                RoomType.TAB.roomId(identity.getTabId()));
    }

    public static String userRoom(String userId) {
        return RoomType.USER.roomId(userId);
    }

    public static String deviceRoom(String userId, String deviceId) {
        return RoomType.DEVICE.roomId(userId + ":" + deviceId);
    }

    private void validate(String roomId, RoomType type, String parentId) {
        if (roomId == null || roomId.isBlank()) {
            throw new IllegalArgumentException("Room id must not be blank");
        }
        if (!roomId.startsWith(type.prefix())) {
            throw new IllegalArgumentException("Room " + roomId + " does not carry the " + type + " prefix");
        }
        if (parentId != null) {
            RoomType parentType = RoomType.fromRoomId(parentId)
                    .orElseThrow(() -> new IllegalArgumentException("Unknown room type for parent " + parentId));
            if (!parentType.isDirectParentOf(type)) {
                throw new IllegalArgumentException("A " + parentType + " room cannot parent a " + type + " room");
            }
        }
    }

    private Duration roomTtl() {
        return appProperties.getRooms().getTtl();
    }
}
