package com.example.tieredcache.tiered;

import java.time.Duration;

public final class TieredCacheSettings {

    private final boolean staleWhileRevalidate;
    private final Duration maxStaleAge;

    public TieredCacheSettings(boolean staleWhileRevalidate, Duration maxStaleAge) {
        this.staleWhileRevalidate = staleWhileRevalidate;
        this.maxStaleAge = maxStaleAge;
    }

    public static TieredCacheSettings defaults() {
        return new TieredCacheSettings(true, Duration.ofMinutes(5));
    }

    public boolean isStaleWhileRevalidate() {
        return staleWhileRevalidate;
    }

    /** Upper bound on entry age (not time past expiry) for serving a stale value. */
    public Duration getMaxStaleAge() {
        return maxStaleAge;
    }
}
