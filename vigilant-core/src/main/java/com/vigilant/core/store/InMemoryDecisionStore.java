package com.vigilant.core.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Single-node {@link DecisionStore}. Entries expire lazily on read against the
 * injected clock.
 */
public class InMemoryDecisionStore implements DecisionStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryDecisionStore.class);

    private final Clock clock;
    private final Map<String, Expiring<String>> blocks = new ConcurrentHashMap<>();
    private final Map<String, Expiring<String>> values = new ConcurrentHashMap<>();

    public InMemoryDecisionStore() {
        this(Clock.systemUTC());
    }

    public InMemoryDecisionStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public boolean isBlocked(String target) {
        Expiring<String> entry = blocks.get(target);
        if (entry == null) {
            return false;
        }
        if (entry.isExpired(clock.instant())) {
            blocks.remove(target, entry);
            return false;
        }
        return true;
    }

    @Override
    public void block(String target, String reason, Duration duration) {
        blocks.put(target, new Expiring<>(reason, expiryFor(duration)));
        log.info("[Vigilant] BLOCKED '{}' ({}) for {}", target, reason,
                duration != null ? duration : "ever");
    }

    @Override
    public void unblock(String target) {
        if (blocks.remove(target) != null) {
            log.info("[Vigilant] UNBLOCKED '{}'", target);
        }
    }

    @Override
    public void put(String key, String value, Duration ttl) {
        values.put(key, new Expiring<>(value, expiryFor(ttl)));
    }

    @Override
    public String get(String key) {
        Expiring<String> entry = values.get(key);
        if (entry == null || entry.isExpired(clock.instant())) {
            return null;
        }
        return entry.value;
    }

    @Override
    public Map<String, String> getAllBlocked() {
        Instant now = clock.instant();
        return blocks.entrySet().stream()
                .filter(e -> !e.getValue().isExpired(now))
                .collect(Collectors.toMap(Map.Entry::getKey, e -> e.getValue().value));
    }

    private Instant expiryFor(Duration duration) {
        return duration != null ? clock.instant().plus(duration) : Instant.MAX;
    }

    private static final class Expiring<V> {
        final V value;
        final Instant expiry;

        Expiring(V value, Instant expiry) {
            this.value = value;
            this.expiry = expiry;
        }

        boolean isExpired(Instant now) {
            return now.isAfter(expiry);
        }
    }
}
