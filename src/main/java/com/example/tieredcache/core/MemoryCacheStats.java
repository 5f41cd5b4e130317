package com.example.tieredcache.core;

public final class MemoryCacheStats {

    private final int size;
    private final int maxEntries;
    private final long hits;
    private final long misses;
    private final long evictions;
    private final long expirations;

    public MemoryCacheStats(int size, int maxEntries, long hits, long misses, long evictions, long expirations) {
        this.size = size;
        this.maxEntries = maxEntries;
        this.hits = hits;
        this.misses = misses;
        this.evictions = evictions;
        this.expirations = expirations;
    }

    public int getSize() {
        return size;
    }

    public int getMaxEntries() {
        return maxEntries;
    }

    public long getHits() {
        return hits;
    }

    public long getMisses() {
        return misses;
    }

    public double getHitRate() {
        long total = hits + misses;
        return total > 0 ? (double) hits / total : 0;
    }

    public long getEvictions() {
        return evictions;
    }

    public long getExpirations() {
        return expirations;
    }
}
