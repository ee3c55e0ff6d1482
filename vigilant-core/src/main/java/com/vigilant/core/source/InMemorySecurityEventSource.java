package com.vigilant.core.source;

import com.vigilant.core.model.SecurityEvent;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Predicate;

/**
 * Event source backed by a list. Used for tests and for embedding the monitor in
 * applications that publish events in-process.
 */
public class InMemorySecurityEventSource implements SecurityEventSource {

    private final Clock clock;
    private final List<SecurityEvent> events = new ArrayList<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private long lastId;

    public InMemorySecurityEventSource(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Stores the event under the next id. Any id already on the event is ignored,
     * and an event without a timestamp is stamped with the current time.
     *
     * @return the stored event
     */
    public SecurityEvent append(SecurityEvent event) {
        lock.writeLock().lock();
        try {
            lastId++;
            SecurityEvent stored = event.toBuilder()
                    .id(lastId)
                    .timestamp(Instant.EPOCH.equals(event.getTimestamp()) ? clock.instant() : event.getTimestamp())
                    .build();
            events.add(stored);
            return stored;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<SecurityEvent> readEvents(long sinceId, int limit) {
        return select(e -> e.getId() > sinceId, limit, false);
    }

    @Override
    public List<SecurityEvent> readSince(Instant since, int limit) {
        return select(e -> !e.getTimestamp().isBefore(since), limit, true);
    }

    @Override
    public List<SecurityEvent> readRecent(Duration window, int limit) {
        return readSince(clock.instant().minus(window), limit);
    }

    @Override
    public long latestEventId() {
        lock.readLock().lock();
        try {
            return lastId;
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return events.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Matching events in ascending id order, capped at {@code limit}: the oldest
     * matches for cursor reads, the newest for window reads.
     */
    private List<SecurityEvent> select(Predicate<SecurityEvent> filter, int limit, boolean newest) {
        lock.readLock().lock();
        try {
            List<SecurityEvent> selected = new ArrayList<>();
            for (SecurityEvent event : events) {
                if (!newest && selected.size() >= limit) {
                    break;
                }
                if (filter.test(event)) {
                    selected.add(event);
                }
            }
            if (newest && selected.size() > limit) {
                return new ArrayList<>(selected.subList(selected.size() - limit, selected.size()));
            }
            return selected;
        } finally {
            lock.readLock().unlock();
        }
    }
}
