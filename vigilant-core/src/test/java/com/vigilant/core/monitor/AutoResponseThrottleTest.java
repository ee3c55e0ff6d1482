package com.vigilant.core.monitor;

import com.vigilant.core.MutableClock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("AutoResponseThrottle")
class AutoResponseThrottleTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-03-01T00:00:00Z"));

    @Test
    @DisplayName("Should grant up to the limit within one hour")
    void shouldCapPermits() {
        AutoResponseThrottle throttle = new AutoResponseThrottle(3, clock);

        assertThat(throttle.tryAcquire()).isTrue();
        assertThat(throttle.tryAcquire()).isTrue();
        assertThat(throttle.tryAcquire()).isTrue();
        assertThat(throttle.tryAcquire()).isFalse();
        assertThat(throttle.used()).isEqualTo(3);
    }

    @Test
    @DisplayName("Should release permits as they leave the rolling window")
    void shouldRollWindow() {
        AutoResponseThrottle throttle = new AutoResponseThrottle(2, clock);
        throttle.tryAcquire();
        clock.advance(Duration.ofMinutes(30));
        throttle.tryAcquire();

        clock.advance(Duration.ofMinutes(31));

        assertThat(throttle.used()).isEqualTo(1);
        assertThat(throttle.tryAcquire()).isTrue();
        assertThat(throttle.tryAcquire()).isFalse();
    }

    @Test
    @DisplayName("Should deny everything with a zero limit")
    void shouldHonorZeroLimit() {
        AutoResponseThrottle throttle = new AutoResponseThrottle(5, clock);
        throttle.setLimit(0);

        assertThat(throttle.tryAcquire()).isFalse();
    }
}
