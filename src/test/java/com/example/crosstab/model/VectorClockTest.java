package com.example.crosstab.model;

import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class VectorClockTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void strictlyDominatingClockIsAfter() {
        VectorClock older = VectorClock.of(Map.of("tab-a", 1L, "tab-b", 2L));
        VectorClock newer = VectorClock.of(Map.of("tab-a", 2L, "tab-b", 2L));

        assertThat(newer.compareWith(older)).isEqualTo(VectorClock.Ordering.AFTER);
        assertThat(older.compareWith(newer)).isEqualTo(VectorClock.Ordering.BEFORE);
        assertThat(newer.isNewerThan(older)).isTrue();
    }

    @Test
    void missingKeysCountAsZero() {
        VectorClock clock = VectorClock.of(Map.of("tab-a", 1L));

        assertThat(clock.compareWith(VectorClock.empty())).isEqualTo(VectorClock.Ordering.AFTER);
        assertThat(VectorClock.of(Map.of("tab-a", 0L)).compareWith(VectorClock.empty())).isEqualTo(VectorClock.Ordering.EQUAL);
    }

    @Test
    void divergentClocksAreConcurrent() {
        VectorClock left = VectorClock.of(Map.of("tab-a", 1L));
        VectorClock right = VectorClock.of(Map.of("tab-b", 1L));

        assertThat(left.compareWith(right)).isEqualTo(VectorClock.Ordering.CONCURRENT);
        assertThat(right.compareWith(left)).isEqualTo(VectorClock.Ordering.CONCURRENT);
    }

    @Test
    void mergeTakesPerKeyMaximum() {
        VectorClock left = VectorClock.of(Map.of("tab-a", 3L, "tab-b", 1L));
        VectorClock right = VectorClock.of(Map.of("tab-b", 4L, "tab-c", 2L));

        assertThat(left.merge(right).getCounters())
                .containsExactlyInAnyOrderEntriesOf(Map.of("tab-a", 3L, "tab-b", 4L, "tab-c", 2L));
    }

    @Test
    void tickIncrementsOnlyTheGivenTab() {
        VectorClock clock = VectorClock.empty().tick("tab-a").tick("tab-a").tick("tab-b");

        assertThat(clock.get("tab-a")).isEqualTo(2L);
        assertThat(clock.get("tab-b")).isEqualTo(1L);
        assertThat(clock.get("tab-c")).isZero();
    }

    @Test
    void timestampIsIgnoredForOrderingAndEquality() throws Exception {
        VectorClock early = objectMapper.readValue("{\"tab-a\":1,\"timestamp\":1000}", VectorClock.class);
        VectorClock late = objectMapper.readValue("{\"tab-a\":1,\"timestamp\":9000}", VectorClock.class);

        assertThat(early.compareWith(late)).isEqualTo(VectorClock.Ordering.EQUAL);
        assertThat(early).isEqualTo(late);
        assertThat(early.getCounters()).containsOnlyKeys("tab-a");
        assertThat(late.getTimestamp()).isEqualTo(9000L);
    }

    @Test
    void serializesAsFlatCounterObject() throws Exception {
        VectorClock clock = VectorClock.fromJson(Map.<String, Object>of("tab-b", 2, "tab-a", 1));

        assertThat(objectMapper.writeValueAsString(clock)).isEqualTo("{\"tab-a\":1,\"tab-b\":2}");
    }

    @Test
    void rejectsNonNumericCounters() {
        assertThatThrownBy(() -> objectMapper.readValue("{\"tab-a\":\"one\"}", VectorClock.class))
                .isInstanceOf(JsonMappingException.class);
    }
}
