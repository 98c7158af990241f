package com.example.crosstab.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisOperations;
import org.springframework.data.redis.core.SessionCallback;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * Multi-pod store on Redis strings and sets. {@link #update} is an optimistic
 * WATCH/MULTI/EXEC loop that re-reads and re-applies the function after a conflict.
 */
@Slf4j
public class RedisCoordinationStore extends JsonCoordinationStore {

    private final StringRedisTemplate redisTemplate;
    private final int maxCasAttempts;

    public RedisCoordinationStore(StringRedisTemplate redisTemplate, ObjectMapper objectMapper, int maxCasAttempts) {
        super(objectMapper);
        this.redisTemplate = redisTemplate;
        this.maxCasAttempts = maxCasAttempts;
        log.info("Coordination store: Redis (maxCasAttempts={})", maxCasAttempts);
    }

    @Override
    public <T> Optional<T> get(String key, Class<T> type) {
        return Optional.ofNullable(read(key, redisTemplate.opsForValue().get(key), type));
    }

    @Override
    public <T> void put(String key, T value, Duration ttl) {
        redisTemplate.opsForValue().set(key, write(key, value), ttl);
    }

    @Override
    public <T> T update(String key, Class<T> type, UnaryOperator<T> remapping, Duration ttl) {
        for (int attempt = 1; attempt <= maxCasAttempts; attempt++) {
            AtomicReference<T> next = new AtomicReference<>();
            List<Object> results = redisTemplate.execute(new SessionCallback<List<Object>>() {
                @Override
                public <K, V> List<Object> execute(RedisOperations<K, V> operations) throws DataAccessException {
                    // the template is bound to the session connection while the callback runs
                    redisTemplate.watch(key);
                    T current = read(key, redisTemplate.opsForValue().get(key), type);
                    T value = remapping.apply(current);
                    next.set(value);
                    redisTemplate.multi();
                    if (value == null) {
                        redisTemplate.delete(key);
                    } else {
                        redisTemplate.opsForValue().set(key, write(key, value), ttl);
                    }
                    return redisTemplate.exec();
                }
            });

            if (results != null && !results.isEmpty()) {
                return next.get();
            }
            log.warn("Optimistic locking conflict on key {}. Retrying... (Attempt {}/{})", key, attempt, maxCasAttempts);
        }
        throw new IllegalStateException("Could not update key " + key + " after " + maxCasAttempts + " attempts");
    }

    @Override
    public <T> Optional<T> remove(String key, Class<T> type) {
        return Optional.ofNullable(read(key, redisTemplate.opsForValue().getAndDelete(key), type));
    }

    @Override
    public boolean delete(String key) {
        return Boolean.TRUE.equals(redisTemplate.delete(key));
    }

    @Override
    public boolean expire(String key, Duration ttl) {
        return Boolean.TRUE.equals(redisTemplate.expire(key, ttl));
    }

    @Override
    public boolean addMember(String key, String member, Duration ttl) {
        Long added = redisTemplate.opsForSet().add(key, member);
        redisTemplate.expire(key, ttl);
        return added != null && added > 0;
    }

    @Override
    public boolean removeMember(String key, String member) {
        Long removed = redisTemplate.opsForSet().remove(key, member);
        return removed != null && removed > 0;
    }

    @Override
    public Set<String> members(String key) {
        Set<String> members = redisTemplate.opsForSet().members(key);
        return members == null ? Collections.emptySet() : members;
    }

    @Override
    public long memberCount(String key) {
        Long size = redisTemplate.opsForSet().size(key);
        return size == null ? 0L : size;
    }
}
