package com.example.tieredcache.tiered;

import com.example.tieredcache.core.MemoryCacheStats;
import com.example.tieredcache.remote.RemoteCacheStats;

public final class TieredCacheStats {

    private final MemoryCacheStats memory;
    private final RemoteCacheStats remote;

    public TieredCacheStats(MemoryCacheStats memory, RemoteCacheStats remote) {
        this.memory = memory;
        this.remote = remote;
    }

    public MemoryCacheStats getMemory() {
        return memory;
    }

    /** {@code null} when no remote tier is configured. */
    public RemoteCacheStats getRemote() {
        return remote;
    }

    public long getTotalHits() {
        return memory.getHits() + (remote != null ? remote.getHits() : 0);
    }

    public long getTotalMisses() {
        return memory.getMisses() + (remote != null ? remote.getMisses() : 0);
    }

    public double getHitRate() {
        long total = getTotalHits() + getTotalMisses();
        return total > 0 ? (double) getTotalHits() / total : 0;
    }
}
