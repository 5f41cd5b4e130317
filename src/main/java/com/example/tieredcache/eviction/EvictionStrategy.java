package com.example.tieredcache.eviction;

import com.example.tieredcache.core.CacheEntry;
import java.util.Map;
import java.util.Optional;

/**
 * Tracks recency for a bounded store. The store calls back on every touch and removal, and asks
 * for exactly one victim when an insertion would exceed its budget.
 */
public interface EvictionStrategy {
    void onHit(String key);
    void onInsert(String key);
    void onRemove(String key);
    Optional<String> selectVictim(Map<String, ? extends CacheEntry<?>> store);
    void clear();
}
