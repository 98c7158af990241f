package com.example.crosstab.store;

import com.example.crosstab.model.LeaderRecord;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.core.SessionCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RedisCoordinationStoreTest {

    private static final Duration TTL = Duration.ofSeconds(6);

    private final ObjectMapper objectMapper = JsonMapper.builder().addModule(new JavaTimeModule()).build();
    private StringRedisTemplate redisTemplate;
    private ValueOperations<String, String> valueOperations;
    private RedisCoordinationStore store;

    @BeforeEach
    void setUp() {
        redisTemplate = mock(StringRedisTemplate.class);
        valueOperations = mock(ValueOperations.class);
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(redisTemplate.execute(any(SessionCallback.class)))
                .thenAnswer(invocation -> ((SessionCallback<?>) invocation.getArgument(0)).execute(redisTemplate));
        store = new RedisCoordinationStore(redisTemplate, objectMapper, 3);
    }

    @Test
    void updateWritesTheNewValueInsideTheTransaction() throws Exception {
        when(valueOperations.get("leader:u1")).thenReturn(objectMapper.writeValueAsString(record(1)));
        when(redisTemplate.exec()).thenReturn(List.of(true));

        LeaderRecord updated = store.update("leader:u1", LeaderRecord.class,
                current -> current.toBuilder().version(current.getVersion() + 1).build(), TTL);

        assertThat(updated.getVersion()).isEqualTo(2);
        verify(redisTemplate).watch("leader:u1");
        verify(redisTemplate).multi();
        verify(valueOperations).set(eq("leader:u1"), anyString(), eq(TTL));
    }

    @Test
    void conflictingTransactionsAreRetried() throws Exception {
        when(valueOperations.get("leader:u1")).thenReturn(objectMapper.writeValueAsString(record(1)));
        when(redisTemplate.exec()).thenReturn(List.of()).thenReturn(List.of(true));

        LeaderRecord updated = store.update("leader:u1", LeaderRecord.class,
                current -> current.toBuilder().version(current.getVersion() + 1).build(), TTL);

        assertThat(updated.getVersion()).isEqualTo(2);
        verify(redisTemplate, times(2)).watch("leader:u1");
    }

    @Test
    void updateGivesUpAfterTheConfiguredAttempts() {
        when(redisTemplate.exec()).thenReturn(List.of());

        assertThatThrownBy(() -> store.update("leader:u1", LeaderRecord.class, current -> record(1), TTL))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("3 attempts");
        verify(redisTemplate, times(3)).multi();
    }

    @Test
    void nullFromTheFunctionDeletesTheKey() throws Exception {
        when(valueOperations.get("leader:u1")).thenReturn(objectMapper.writeValueAsString(record(1)));
        when(redisTemplate.exec()).thenReturn(List.of(1L));

        LeaderRecord updated = store.update("leader:u1", LeaderRecord.class, current -> null, TTL);

        assertThat(updated).isNull();
        verify(redisTemplate).delete("leader:u1");
        verify(valueOperations, never()).set(anyString(), anyString(), any(Duration.class));
    }

    private static LeaderRecord record(long version) {
        return LeaderRecord.builder()
                .userId("u1")
                .leaderId("tab-a")
                .connectionId("c1")
                .version(version)
                .build();
    }
}
