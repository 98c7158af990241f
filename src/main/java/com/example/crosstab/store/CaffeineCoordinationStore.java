package com.example.crosstab.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Collections;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * Single-pod store on a Caffeine cache with a per-entry deadline. Atomic updates go through
 * {@code asMap().compute}.
 */
@Slf4j
public class CaffeineCoordinationStore extends JsonCoordinationStore {

    private final Cache<String, Entry> cache;
    private final Ticker ticker;

    public CaffeineCoordinationStore(ObjectMapper objectMapper, long maximumSize) {
        this(objectMapper, maximumSize, Ticker.systemTicker());
    }

    CaffeineCoordinationStore(ObjectMapper objectMapper, long maximumSize, Ticker ticker) {
        super(objectMapper);
        this.ticker = ticker;
        this.cache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .ticker(ticker)
                .expireAfter(new DeadlineExpiry())
                .recordStats()
                .build();
        log.info("Coordination store: in-process Caffeine (maximumSize={})", maximumSize);
    }

    @Override
    public <T> Optional<T> get(String key, Class<T> type) {
        Entry entry = cache.getIfPresent(key);
        return Optional.ofNullable(entry == null ? null : read(key, entry.json(), type));
    }

    @Override
    public <T> void put(String key, T value, Duration ttl) {
        cache.put(key, Entry.value(write(key, value), deadline(ttl)));
    }

    @Override
    public <T> T update(String key, Class<T> type, UnaryOperator<T> remapping, Duration ttl) {
        AtomicReference<T> result = new AtomicReference<>();
        cache.asMap().compute(key, (k, current) -> {
            T currentValue = current == null ? null : read(k, current.json(), type);
            T next = remapping.apply(currentValue);
            result.set(next);
            return next == null ? null : Entry.value(write(k, next), deadline(ttl));
        });
        return result.get();
    }

    @Override
    public <T> Optional<T> remove(String key, Class<T> type) {
        Entry removed = cache.asMap().remove(key);
        return Optional.ofNullable(removed == null ? null : read(key, removed.json(), type));
    }

    @Override
    public boolean delete(String key) {
        return cache.asMap().remove(key) != null;
    }

    @Override
    public boolean expire(String key, Duration ttl) {
        return cache.asMap().computeIfPresent(key, (k, current) -> current.withDeadline(deadline(ttl))) != null;
    }

    @Override
    public boolean addMember(String key, String member, Duration ttl) {
        AtomicBoolean added = new AtomicBoolean();
        cache.asMap().compute(key, (k, current) -> {
            Set<String> next = current == null || current.members() == null ? new HashSet<>() : new HashSet<>(current.members());
            added.set(next.add(member));
            return Entry.set(next, deadline(ttl));
        });
        return added.get();
    }

    @Override
    public boolean removeMember(String key, String member) {
        AtomicBoolean removed = new AtomicBoolean();
        cache.asMap().computeIfPresent(key, (k, current) -> {
            if (current.members() == null) {
                return current;
            }
            Set<String> next = new HashSet<>(current.members());
            removed.set(next.remove(member));
            return next.isEmpty() ? null : Entry.set(next, current.deadlineNanos());
        });
        return removed.get();
    }

    @Override
    public Set<String> members(String key) {
        Entry entry = cache.getIfPresent(key);
        if (entry == null || entry.members() == null) {
            return Collections.emptySet();
        }
        return Set.copyOf(entry.members());
    }

    @Override
    public long memberCount(String key) {
        return members(key).size();
    }

    private long deadline(Duration ttl) {
        return ticker.read() + ttl.toNanos();
    }

    private record Entry(String json, Set<String> members, long deadlineNanos) {

        static Entry value(String json, long deadlineNanos) {
            return new Entry(json, null, deadlineNanos);
        }

        static Entry set(Set<String> members, long deadlineNanos) {
            return new Entry(null, Collections.unmodifiableSet(members), deadlineNanos);
        }

        Entry withDeadline(long deadline) {
            return new Entry(json, members, deadline);
        }

        long remainingNanos(long currentTime) {
            return Math.max(0L, deadlineNanos - currentTime);
        }
    }

    private static final class DeadlineExpiry implements Expiry<String, Entry> {
        @Override
        public long expireAfterCreate(String key, Entry value, long currentTime) {
            return value.remainingNanos(currentTime);
        }

        @Override
        public long expireAfterUpdate(String key, Entry value, long currentTime, long currentDuration) {
            return value.remainingNanos(currentTime);
        }

        @Override
        public long expireAfterRead(String key, Entry value, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
