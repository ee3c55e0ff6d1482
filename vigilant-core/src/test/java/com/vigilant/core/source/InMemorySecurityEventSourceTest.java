package com.vigilant.core.source;

import com.vigilant.core.MutableClock;
import com.vigilant.core.model.SecurityEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("InMemorySecurityEventSource")
class InMemorySecurityEventSourceTest {

    private static final Instant T0 = Instant.parse("2024-03-01T12:00:00Z");

    private MutableClock clock;
    private InMemorySecurityEventSource source;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        source = new InMemorySecurityEventSource(clock);
        for (int i = 0; i < 5; i++) {
            source.append(SecurityEvent.builder().action("FAILED_LOGIN").actorId("alice").build());
            clock.advance(Duration.ofMinutes(1));
        }
    }

    @Nested
    @DisplayName("Cursor reads")
    class CursorReads {

        @Test
        @DisplayName("Should return the oldest events after the cursor")
        void shouldReadOldestAfterCursor() {
            assertThat(source.readEvents(1, 2)).extracting(SecurityEvent::getId).containsExactly(2L, 3L);
        }

        @Test
        @DisplayName("Should stamp ids and clock time on append")
        void shouldStampEvents() {
            assertThat(source.latestEventId()).isEqualTo(5);
            assertThat(source.readEvents(0, 1).get(0).getTimestamp()).isEqualTo(T0);
        }
    }

    @Nested
    @DisplayName("Window reads")
    class WindowReads {

        @Test
        @DisplayName("Should keep the newest events when the window holds more than the limit")
        void shouldKeepNewestInWindow() {
            assertThat(source.readRecent(Duration.ofHours(1), 2))
                    .extracting(SecurityEvent::getId)
                    .containsExactly(4L, 5L);
        }

        @Test
        @DisplayName("Should only return events inside the window")
        void shouldRespectWindow() {
            assertThat(source.readSince(T0.plus(Duration.ofMinutes(3)), 10))
                    .extracting(SecurityEvent::getId)
                    .containsExactly(4L, 5L);
        }
    }
}
