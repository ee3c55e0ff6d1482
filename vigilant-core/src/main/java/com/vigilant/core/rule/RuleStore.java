package com.vigilant.core.rule;

import com.vigilant.core.config.InvalidConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Id-keyed rule set owned by whoever injects it into the engines.
 * Reads are frequent (every tick), writes rare (operator action), so access goes
 * through a read-write lock. Every write is validated first; a rejected rule
 * leaves the store unchanged.
 *
 * @param <R> rule type
 */
public abstract class RuleStore<R> {

    private static final Logger log = LoggerFactory.getLogger(RuleStore.class);

    private final Map<String, R> rules = new LinkedHashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final String kind;

    protected RuleStore(String kind, List<R> initialRules) {
        this.kind = kind;
        for (R rule : initialRules) {
            validate(rule);
            if (rules.putIfAbsent(idOf(rule), rule) != null) {
                throw new InvalidConfigurationException("Duplicate " + kind + " rule id '" + idOf(rule) + "'");
            }
        }
        log.info("[Vigilant] Loaded {} {} rules: {}", rules.size(), kind, rules.keySet());
    }

    protected abstract String idOf(R rule);

    protected abstract void validate(R rule);

    /** Snapshot of all rules in insertion order. */
    public List<R> list() {
        lock.readLock().lock();
        try {
            return List.copyOf(rules.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<R> get(String id) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(rules.get(id));
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return rules.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @throws InvalidConfigurationException if the rule is invalid or the id is taken
     */
    public void add(R rule) {
        validate(rule);
        String id = idOf(rule);
        lock.writeLock().lock();
        try {
            if (rules.containsKey(id)) {
                throw new InvalidConfigurationException("A " + kind + " rule with id '" + id + "' already exists");
            }
            rules.put(id, rule);
        } finally {
            lock.writeLock().unlock();
        }
        log.info("[Vigilant] Added {} rule '{}'", kind, id);
    }

    /**
     * Replaces the rule with the same id.
     *
     * @throws RuleNotFoundException if no rule has that id
     */
    public void update(R rule) {
        validate(rule);
        String id = idOf(rule);
        lock.writeLock().lock();
        try {
            if (!rules.containsKey(id)) {
                throw new RuleNotFoundException(id);
            }
            rules.put(id, rule);
        } finally {
            lock.writeLock().unlock();
        }
        log.info("[Vigilant] Updated {} rule '{}'", kind, id);
    }

    /**
     * @throws RuleNotFoundException if no rule has that id
     */
    public R delete(String id) {
        R removed;
        lock.writeLock().lock();
        try {
            removed = rules.remove(id);
        } finally {
            lock.writeLock().unlock();
        }
        if (removed == null) {
            throw new RuleNotFoundException(id);
        }
        log.info("[Vigilant] Deleted {} rule '{}'", kind, id);
        return removed;
    }
}
