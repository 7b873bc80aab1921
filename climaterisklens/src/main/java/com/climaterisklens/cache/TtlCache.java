package com.climaterisklens.cache;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-process key/value cache with a fixed time-to-live per instance.
 *
 * <p>
 * Expired entries are dropped lazily on read and by {@link #purgeExpired()}.
 * A disabled cache never stores anything and every read is a miss.
 * </p>
 */
public final class TtlCache<V> {
    private final String name;
    private final long ttlMillis;
    private final boolean enabled;
    private final Clock clock;
    private final Map<String, Entry<V>> entries = new ConcurrentHashMap<>();
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();

    public TtlCache(String name, int ttlSeconds, boolean enabled) {
        this(name, ttlSeconds, enabled, Clock.systemUTC());
    }

    public TtlCache(String name, int ttlSeconds, boolean enabled, Clock clock) {
        this.name = name;
        this.ttlMillis = ttlSeconds * 1000L;
        this.enabled = enabled;
        this.clock = clock;
    }

    public String name() {
        return name;
    }

    public int ttlSeconds() {
        return (int) (ttlMillis / 1000L);
    }

    /**
     * Returns the live value for a key, or null.
     */
    public V get(String key) {
        if (!enabled) {
            misses.incrementAndGet();
            return null;
        }
        Entry<V> e = entries.get(key);
        if (e == null) {
            misses.incrementAndGet();
            return null;
        }
        if (e.expiresAt <= clock.millis()) {
            entries.remove(key, e);
            misses.incrementAndGet();
            return null;
        }
        hits.incrementAndGet();
        return e.value;
    }

    /**
     * Stores a value, replacing any previous one and restarting its TTL.
     */
    public void put(String key, V value) {
        if (!enabled || value == null)
            return;
        entries.put(key, new Entry<>(value, clock.millis() + ttlMillis));
    }

    public void remove(String key) {
        entries.remove(key);
    }

    /**
     * Removes the key only while it still maps to {@code expected} (compared by
     * identity). Of several callers racing with the same value, exactly one
     * gets true.
     */
    public boolean remove(String key, V expected) {
        Entry<V> e = entries.get(key);
        return e != null && e.value == expected && entries.remove(key, e);
    }

    public int purgeExpired() {
        long now = clock.millis();
        int before = entries.size();
        entries.entrySet().removeIf(e -> e.getValue().expiresAt <= now);
        return before - entries.size();
    }

    public void clear() {
        entries.clear();
    }

    public int size() {
        return entries.size();
    }

    public long hits() {
        return hits.get();
    }

    public long misses() {
        return misses.get();
    }

    /**
     * Fraction of reads that were hits; 0 before any read.
     */
    public double hitRatio() {
        long h = hits.get();
        long total = h + misses.get();
        return total == 0 ? 0.0 : (double) h / total;
    }

    private record Entry<V>(V value, long expiresAt) {
    }
}
