package org.aimux.distribution.internal;

import java.time.Duration;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Predicate;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * An in-memory cache whose entries expire a fixed duration after they were stored.
 * The amount of entries is bounded; once the bound is exceeded the entry that was stored first is evicted.
 *
 * <p>All operations are atomic with respect to each other.
 *
 * @param <K> The key type
 * @param <V> The value type
 */
public class FreshnessCache<K, V> {

    private static final class Entry<V> {
        private final long fetchTime;
        @NotNull
        private final V value;

        private Entry(long fetchTime, @NotNull V value) {
            this.fetchTime = fetchTime;
            this.value = value;
        }
    }

    @NotNull
    private final Map<K, Entry<V>> entries = new LinkedHashMap<>();
    @NotNull
    private final AtomicLong hits = new AtomicLong();
    private long updateInterval;
    private int maxEntries;

    public FreshnessCache(@NotNull Duration updateInterval, int maxEntries) {
        this.setUpdateInterval(updateInterval);
        this.setMaxEntries(maxEntries);
    }

    public synchronized void clear() {
        this.entries.clear();
        this.hits.set(0);
    }

    /**
     * Obtains a cached value, provided that it is still fresh. Stale entries are dropped on access.
     *
     * @param key The key
     * @return The value, or null if absent or stale
     */
    @Nullable
    public synchronized V get(@NotNull K key) {
        Entry<V> entry = this.entries.get(key);
        if (entry == null) {
            return null;
        }
        if ((entry.fetchTime + this.updateInterval) > System.currentTimeMillis()) {
            this.hits.incrementAndGet();
            return entry.value;
        }
        this.entries.remove(key);
        return null;
    }

    @Contract(pure = true)
    public long getHits() {
        return this.hits.get();
    }

    public synchronized void invalidate(@NotNull K key) {
        this.entries.remove(key);
    }

    /**
     * Drops every entry whose key matches a predicate.
     *
     * @param predicate The predicate
     */
    public synchronized void invalidateIf(@NotNull Predicate<? super K> predicate) {
        this.entries.keySet().removeIf(predicate);
    }

    public synchronized void put(@NotNull K key, @NotNull V value) {
        Objects.requireNonNull(value, "value may not be null");
        this.entries.remove(key);
        this.entries.put(key, new Entry<>(System.currentTimeMillis(), value));
        Iterator<K> it = this.entries.keySet().iterator();
        while (this.entries.size() > this.maxEntries && it.hasNext()) {
            it.next();
            it.remove();
        }
    }

    public synchronized void setMaxEntries(int maxEntries) {
        if (maxEntries < 1) {
            throw new IllegalArgumentException("maxEntries must be positive, got " + maxEntries);
        }
        this.maxEntries = maxEntries;
    }

    public synchronized void setUpdateInterval(@NotNull Duration updateInterval) {
        if (updateInterval.isNegative()) {
            throw new IllegalArgumentException("The update interval may not be negative");
        }
        this.updateInterval = updateInterval.toMillis();
    }

    public synchronized int size() {
        return this.entries.size();
    }
}
