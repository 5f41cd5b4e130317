package com.example.tieredcache.core;

import java.util.List;

public class CacheEntry<V> {
    public final V value;
    public final long createdAt;  // millis, age and staleness are measured from here
    public final long expiresAt;  // absolute timestamp in millis when TTL expires
    public final List<String> tags;

    public CacheEntry(V value, long createdAt, long expiresAt, List<String> tags) {
        this.value = value;
        this.createdAt = createdAt;
        this.expiresAt = expiresAt;
        this.tags = List.copyOf(tags);
    }

    public boolean isExpired(long now) {
        return now > expiresAt;
    }

    public long age(long now) {
        return now - createdAt;
    }
}
