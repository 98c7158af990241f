package com.example.crosstab.store;

import java.time.Duration;
import java.util.Optional;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Keyed, TTL'd store shared by every pod. It is the source of truth for leader, state, recovery
 * and room records; values are stored as JSON.
 */
public interface CoordinationStore {

    <T> Optional<T> get(String key, Class<T> type);

    <T> void put(String key, T value, Duration ttl);

    /**
     * Atomically replaces the value under {@code key} with {@code remapping.apply(current)}.
     * The function receives {@code null} when the key is absent and may return {@code null} to delete it.
     * It can be invoked more than once under contention, so it must be free of side effects.
     *
     * @return the value now stored, or {@code null} if the key was deleted or stays absent
     */
    <T> T update(String key, Class<T> type, UnaryOperator<T> remapping, Duration ttl);

    /**
     * Reads and deletes the value in one atomic step.
     */
    <T> Optional<T> remove(String key, Class<T> type);

    boolean delete(String key);

    boolean expire(String key, Duration ttl);

    /**
     * Adds a member to the set under {@code key} and renews the set's TTL.
     */
    boolean addMember(String key, String member, Duration ttl);

    boolean removeMember(String key, String member);

    Set<String> members(String key);

    long memberCount(String key);
}
