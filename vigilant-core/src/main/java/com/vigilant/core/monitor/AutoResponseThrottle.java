package com.vigilant.core.monitor;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Caps automated responses per rolling hour. Every granted permit counts,
 * whatever the response's outcome.
 */
public class AutoResponseThrottle {

    static final Duration WINDOW = Duration.ofHours(1);

    private final Clock clock;
    private final Deque<Instant> permits = new ArrayDeque<>();
    private int limit;

    public AutoResponseThrottle(int limit, Clock clock) {
        this.limit = limit;
        this.clock = clock;
    }

    public synchronized boolean tryAcquire() {
        Instant now = clock.instant();
        evictBefore(now.minus(WINDOW));
        if (permits.size() >= limit) {
            return false;
        }
        permits.addLast(now);
        return true;
    }

    /** Permits granted in the current window. */
    public synchronized int used() {
        evictBefore(clock.instant().minus(WINDOW));
        return permits.size();
    }

    public synchronized void setLimit(int limit) {
        this.limit = limit;
    }

    public synchronized int getLimit() {
        return limit;
    }

    private void evictBefore(Instant cutoff) {
        while (!permits.isEmpty() && !permits.peekFirst().isAfter(cutoff)) {
            permits.pollFirst();
        }
    }
}
