package com.example.tieredcache.core;

import com.example.tieredcache.eviction.EvictionStrategy;
import com.example.tieredcache.eviction.LruEvictionStrategy;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.regex.Pattern;

/**
 * In-process tier: entry-count bounded, per-entry TTL checked lazily on read, LRU eviction by
 * access order, and a tag index for group invalidation.
 *
 * <p>Expired entries stay in the store until they are read through {@link #get}, swept by
 * {@link #cleanup()}, or evicted, so {@link #getWithMeta} can still hand them out as stale.
 */
public class BoundedMemoryCache {

    private final ConcurrentHashMap<String, CacheEntry<Object>> store = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> tagIndex = new HashMap<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final EvictionStrategy evictionStrategy;
    private final int maxEntries;
    private final Duration defaultTtl;
    private final Clock clock;

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong evictions = new AtomicLong();
    private final AtomicLong expirations = new AtomicLong();

    public BoundedMemoryCache(int maxEntries, Duration defaultTtl, Clock clock) {
        this(new LruEvictionStrategy(), maxEntries, defaultTtl, clock);
    }

    public BoundedMemoryCache(EvictionStrategy evictionStrategy, int maxEntries, Duration defaultTtl, Clock clock) {
        if (maxEntries < 1) {
            throw new IllegalArgumentException("maxEntries must be at least 1: " + maxEntries);
        }
        this.evictionStrategy = evictionStrategy;
        this.maxEntries = maxEntries;
        this.defaultTtl = defaultTtl;
        this.clock = clock;
    }

    public void set(String key, Object value) {
        set(key, value, CacheOptions.defaults());
    }

    public void set(String key, Object value, CacheOptions options) {
        Duration ttl = options.getTtl() != null ? options.getTtl() : defaultTtl;
        long now = clock.millis();
        CacheEntry<Object> entry = new CacheEntry<>(value, now, now + ttl.toMillis(), options.getTags());

        lock.lock();
        try {
            CacheEntry<Object> previous = store.get(key);
            if (previous != null) {
                unindex(key, previous);
            } else if (store.size() >= maxEntries) {
                evictOne();
            }
            store.put(key, entry);
            index(key, entry);
            evictionStrategy.onInsert(key);
        } finally {
            lock.unlock();
        }
    }

    public <T> T get(String key, Class<T> type) {
        CacheEntry<Object> entry = store.get(key);
        if (entry == null) {
            misses.incrementAndGet();
            return null;
        }

        if (entry.isExpired(clock.millis())) {
            if (remove(key, entry)) {
                expirations.incrementAndGet();
            }
            misses.incrementAndGet();
            return null;
        }

        evictionStrategy.onHit(key);
        hits.incrementAndGet();
        return type.cast(entry.value);
    }

    public Object get(String key) {
        return get(key, Object.class);
    }

    /**
     * Like {@link #get} but reports an expired entry as stale instead of purging it.
     */
    public <T> MemoryLookup<T> getWithMeta(String key, Class<T> type) {
        return getWithMeta(key, type, null);
    }

    /**
     * Like {@link #getWithMeta(String, Class)}, but an expired entry older than {@code maxStaleAge}
     * is purged and reported as absent.
     */
    public <T> MemoryLookup<T> getWithMeta(String key, Class<T> type, Duration maxStaleAge) {
        CacheEntry<Object> entry = store.get(key);
        if (entry == null) {
            misses.incrementAndGet();
            return MemoryLookup.absent();
        }

        long now = clock.millis();
        long age = entry.age(now);
        if (entry.isExpired(now)) {
            expirations.incrementAndGet();
            if (maxStaleAge != null && age > maxStaleAge.toMillis()) {
                remove(key, entry);
                misses.incrementAndGet();
                return MemoryLookup.absent();
            }
            return MemoryLookup.stale(type.cast(entry.value), age);
        }

        evictionStrategy.onHit(key);
        hits.incrementAndGet();
        return MemoryLookup.fresh(type.cast(entry.value), age);
    }

    public boolean has(String key) {
        CacheEntry<Object> entry = store.get(key);
        if (entry == null) {
            return false;
        }
        if (entry.isExpired(clock.millis())) {
            if (remove(key, entry)) {
                expirations.incrementAndGet();
            }
            return false;
        }
        return true;
    }

    /** Remaining TTL in whole seconds, or -1 when the key is absent or expired. */
    public long ttl(String key) {
        CacheEntry<Object> entry = store.get(key);
        long now = clock.millis();
        if (entry == null || entry.isExpired(now)) {
            return -1;
        }
        return (entry.expiresAt - now) / 1000;
    }

    public boolean delete(String key) {
        lock.lock();
        try {
            CacheEntry<Object> entry = store.remove(key);
            if (entry == null) {
                return false;
            }
            unindex(key, entry);
            evictionStrategy.onRemove(key);
            return true;
        } finally {
            lock.unlock();
        }
    }

    public int invalidateByTag(String tag) {
        lock.lock();
        try {
            Set<String> keys = tagIndex.remove(tag);
            if (keys == null) {
                return 0;
            }
            int count = 0;
            for (String key : new ArrayList<>(keys)) {
                CacheEntry<Object> entry = store.remove(key);
                if (entry != null) {
                    unindex(key, entry);
                    evictionStrategy.onRemove(key);
                    count++;
                }
            }
            return count;
        } finally {
            lock.unlock();
        }
    }

    /** Removes every key in which {@code pattern} finds a match. */
    public int invalidateByPattern(Pattern pattern) {
        lock.lock();
        try {
            int count = 0;
            Iterator<Map.Entry<String, CacheEntry<Object>>> it = store.entrySet().iterator();
            while (it.hasNext()) {
                Map.Entry<String, CacheEntry<Object>> e = it.next();
                if (pattern.matcher(e.getKey()).find()) {
                    it.remove();
                    unindex(e.getKey(), e.getValue());
                    evictionStrategy.onRemove(e.getKey());
                    count++;
                }
            }
            return count;
        } finally {
            lock.unlock();
        }
    }

    public int invalidateByPattern(String regex) {
        return invalidateByPattern(Pattern.compile(regex));
    }

    /** Drops every entry, the tag index and the counters. */
    public void clear() {
        lock.lock();
        try {
            store.clear();
            tagIndex.clear();
            evictionStrategy.clear();
            hits.set(0);
            misses.set(0);
            evictions.set(0);
            expirations.set(0);
        } finally {
            lock.unlock();
        }
    }

    /** Purges TTL-expired entries, returns how many were removed. */
    public int cleanup() {
        long now = clock.millis();
        int count = 0;
        for (Map.Entry<String, CacheEntry<Object>> e : store.entrySet()) {
            if (e.getValue().isExpired(now) && remove(e.getKey(), e.getValue())) {
                expirations.incrementAndGet();
                count++;
            }
        }
        return count;
    }

    public List<String> keys() {
        return new ArrayList<>(store.keySet());
    }

    public int size() {
        return store.size();
    }

    public MemoryCacheStats getStats() {
        return new MemoryCacheStats(
            store.size(), maxEntries, hits.get(), misses.get(), evictions.get(), expirations.get());
    }

    // Removes only if the key still maps to this exact entry, a concurrent overwrite wins.
    private boolean remove(String key, CacheEntry<Object> entry) {
        lock.lock();
        try {
            if (!store.remove(key, entry)) {
                return false;
            }
            unindex(key, entry);
            evictionStrategy.onRemove(key);
            return true;
        } finally {
            lock.unlock();
        }
    }

    private void evictOne() {
        evictionStrategy.selectVictim(store).ifPresent(victimKey -> {
            CacheEntry<Object> victim = store.remove(victimKey);
            if (victim != null) {
                unindex(victimKey, victim);
                evictions.incrementAndGet();
            }
        });
    }

    private void index(String key, CacheEntry<Object> entry) {
        for (String tag : entry.tags) {
            tagIndex.computeIfAbsent(tag, t -> new HashSet<>()).add(key);
        }
    }

    private void unindex(String key, CacheEntry<Object> entry) {
        for (String tag : entry.tags) {
            Set<String> keys = tagIndex.get(tag);
            if (keys != null) {
                keys.remove(key);
                if (keys.isEmpty()) {
                    tagIndex.remove(tag);
                }
            }
        }
    }
}
