package com.vigilant.core.store;

import java.time.Duration;
import java.util.Map;

/**
 * Enforcement state written by response handlers: blocked targets, locked
 * accounts and restrictions. Whatever serves traffic (a servlet filter,
 * an API gateway) reads it.
 *
 * <p>
 * Keys are namespaced by the handler, for example {@code ip:203.0.113.7},
 * {@code account:42} or {@code restrict:permissions:42}.
 * </p>
 */
public interface DecisionStore {

    /**
     * Whether a target is currently blocked.
     */
    boolean isBlocked(String target);

    /**
     * Block a target.
     *
     * @param target   namespaced target key
     * @param reason   why it was blocked, kept for operators
     * @param duration how long to block. null = permanent.
     */
    void block(String target, String reason, Duration duration);

    void unblock(String target);

    /**
     * Store a value with an optional TTL (null = no expiry).
     */
    void put(String key, String value, Duration ttl);

    /**
     * @return the value, or null if absent or expired
     */
    String get(String key);

    /**
     * All live blocks, target to reason.
     */
    Map<String, String> getAllBlocked();
}
