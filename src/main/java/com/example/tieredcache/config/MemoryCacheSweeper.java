package com.example.tieredcache.config;

import com.example.tieredcache.tiered.TieredCache;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Periodically drops expired memory entries so they do not wait for a read to be purged. */
@Component
@ConditionalOnProperty(prefix = "tiered-cache.memory", name = "auto-cleanup", havingValue = "true", matchIfMissing = true)
public class MemoryCacheSweeper {

    private final TieredCache tieredCache;

    public MemoryCacheSweeper(TieredCache tieredCache) {
        this.tieredCache = tieredCache;
    }

    @Scheduled(fixedDelayString = "${tiered-cache.memory.cleanup-interval:PT1M}",
               initialDelayString = "${tiered-cache.memory.cleanup-interval:PT1M}")
    public void sweep() {
        tieredCache.sweepExpired();
    }
}
