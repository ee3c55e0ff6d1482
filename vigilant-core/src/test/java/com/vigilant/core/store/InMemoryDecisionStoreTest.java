package com.vigilant.core.store;

import com.vigilant.core.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("InMemoryDecisionStore")
class InMemoryDecisionStoreTest {

    private MutableClock clock;
    private InMemoryDecisionStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-03-01T00:00:00Z"));
        store = new InMemoryDecisionStore(clock);
    }

    @Nested
    @DisplayName("Blocks")
    class Blocks {

        @Test
        @DisplayName("Should expire a block after its duration")
        void shouldExpireBlock() {
            store.block("ip:203.0.113.7", "brute force", Duration.ofMinutes(10));
            assertThat(store.isBlocked("ip:203.0.113.7")).isTrue();

            clock.advance(Duration.ofMinutes(11));

            assertThat(store.isBlocked("ip:203.0.113.7")).isFalse();
            assertThat(store.getAllBlocked()).isEmpty();
        }

        @Test
        @DisplayName("Should keep a block without duration until unblocked")
        void shouldKeepPermanentBlock() {
            store.block("account:42", "locked", null);
            clock.advance(Duration.ofDays(365));

            assertThat(store.getAllBlocked()).containsEntry("account:42", "locked");

            store.unblock("account:42");
            assertThat(store.isBlocked("account:42")).isFalse();
        }
    }

    @Nested
    @DisplayName("Restrictions")
    class Restrictions {

        @Test
        @DisplayName("Should return null for an expired value")
        void shouldExpireValue() {
            store.put("restrict:permissions:alice", "read-only", Duration.ofMinutes(1));
            assertThat(store.get("restrict:permissions:alice")).isEqualTo("read-only");

            clock.advance(Duration.ofMinutes(2));

            assertThat(store.get("restrict:permissions:alice")).isNull();
        }
    }
}
