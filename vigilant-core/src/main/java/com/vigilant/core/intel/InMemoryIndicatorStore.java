package com.vigilant.core.intel;

import com.vigilant.core.model.IndicatorType;
import com.vigilant.core.model.ThreatIndicator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Indicator store kept in memory, fed by operators or a feed importer.
 * Lookups run on every classified event; updates are rare.
 */
public class InMemoryIndicatorStore implements ThreatIntelProvider {

    private static final Logger log = LoggerFactory.getLogger(InMemoryIndicatorStore.class);

    private final Map<String, ThreatIndicator> indicators = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    @Override
    public Optional<ThreatIndicator> lookup(IndicatorType type, String value) {
        if (value == null) {
            return Optional.empty();
        }
        lock.readLock().lock();
        try {
            return Optional.ofNullable(indicators.get(key(type, value)));
        } finally {
            lock.readLock().unlock();
        }
    }

    public void add(ThreatIndicator indicator) {
        lock.writeLock().lock();
        try {
            indicators.put(key(indicator.getType(), indicator.getValue()), indicator);
        } finally {
            lock.writeLock().unlock();
        }
        log.info("[Vigilant] Indicator added: {}", indicator);
    }

    public boolean remove(IndicatorType type, String value) {
        lock.writeLock().lock();
        try {
            return indicators.remove(key(type, value)) != null;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public List<ThreatIndicator> list() {
        lock.readLock().lock();
        try {
            return List.copyOf(indicators.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return indicators.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    private static String key(IndicatorType type, String value) {
        return type.wireName() + ":" + value;
    }
}
