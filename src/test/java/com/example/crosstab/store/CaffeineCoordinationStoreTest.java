package com.example.crosstab.store;

import com.example.crosstab.model.TokenPair;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;

class CaffeineCoordinationStoreTest {

    private final ObjectMapper objectMapper = JsonMapper.builder().addModule(new JavaTimeModule()).build();
    private final AtomicLong nanos = new AtomicLong();
    private final CaffeineCoordinationStore store = new CaffeineCoordinationStore(objectMapper, 1_000, nanos::get);

    @Test
    void storesValuesAsJsonCopies() {
        TokenPair pair = TokenPair.builder().token("t1").refreshToken("r1").issuedAt(Instant.parse("2024-01-01T00:00:00Z")).build();

        store.put("token:u1:d1", pair, Duration.ofMinutes(1));

        assertThat(store.get("token:u1:d1", TokenPair.class)).contains(pair);
        assertThat(store.get("token:u1:d1", TokenPair.class).get()).isNotSameAs(pair);
        assertThat(store.get("token:missing", TokenPair.class)).isEmpty();
    }

    @Test
    void valuesExpireAfterTheirTtl() {
        store.put("key", TokenPair.builder().token("t").build(), Duration.ofSeconds(10));

        nanos.addAndGet(Duration.ofSeconds(9).toNanos());
        assertThat(store.get("key", TokenPair.class)).isPresent();

        nanos.addAndGet(Duration.ofSeconds(2).toNanos());
        assertThat(store.get("key", TokenPair.class)).isEmpty();
    }

    @Test
    void expireRenewsTheDeadline() {
        store.put("key", TokenPair.builder().token("t").build(), Duration.ofSeconds(10));
        nanos.addAndGet(Duration.ofSeconds(8).toNanos());

        assertThat(store.expire("key", Duration.ofSeconds(10))).isTrue();
        nanos.addAndGet(Duration.ofSeconds(8).toNanos());

        assertThat(store.get("key", TokenPair.class)).isPresent();
        assertThat(store.expire("absent", Duration.ofSeconds(10))).isFalse();
    }

    @Test
    void updateSeesNullForAbsentKeysAndDeletesOnNull() {
        TokenPair created = store.update("key", TokenPair.class,
                current -> current == null ? TokenPair.builder().token("first").build() : current, Duration.ofMinutes(1));
        TokenPair kept = store.update("key", TokenPair.class,
                current -> current == null ? TokenPair.builder().token("second").build() : current, Duration.ofMinutes(1));

        assertThat(created.getToken()).isEqualTo("first");
        assertThat(kept.getToken()).isEqualTo("first");

        assertThat(store.update("key", TokenPair.class, current -> null, Duration.ofMinutes(1))).isNull();
        assertThat(store.get("key", TokenPair.class)).isEmpty();
    }

    @Test
    void removeReturnsTheValueOnce() {
        store.put("key", TokenPair.builder().token("t").build(), Duration.ofMinutes(1));

        assertThat(store.remove("key", TokenPair.class)).map(TokenPair::getToken).contains("t");
        assertThat(store.remove("key", TokenPair.class)).isEmpty();
        assertThat(store.delete("key")).isFalse();
    }

    @Test
    void memberSetsAddRemoveAndDisappearWhenEmpty() {
        assertThat(store.addMember("members", "c1", Duration.ofMinutes(1))).isTrue();
        assertThat(store.addMember("members", "c1", Duration.ofMinutes(1))).isFalse();
        assertThat(store.addMember("members", "c2", Duration.ofMinutes(1))).isTrue();

        assertThat(store.members("members")).containsExactlyInAnyOrder("c1", "c2");
        assertThat(store.memberCount("members")).isEqualTo(2);

        assertThat(store.removeMember("members", "c1")).isTrue();
        assertThat(store.removeMember("members", "c1")).isFalse();
        assertThat(store.removeMember("members", "c2")).isTrue();
        assertThat(store.members("members")).isEmpty();
        assertThat(store.memberCount("absent")).isZero();
    }
}
