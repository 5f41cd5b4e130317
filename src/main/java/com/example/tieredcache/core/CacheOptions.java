package com.example.tieredcache.core;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;

/**
 * Per-call options for {@code set} and {@code getOrFetch}.
 * A {@code null} ttl means "use the tier's default".
 */
public final class CacheOptions {

    private static final CacheOptions DEFAULTS = new CacheOptions(null, List.of(), false);

    private final Duration ttl;
    private final List<String> tags;
    private final boolean forceRefresh;

    private CacheOptions(Duration ttl, List<String> tags, boolean forceRefresh) {
        if (ttl != null && (ttl.isNegative() || ttl.isZero())) {
            throw new IllegalArgumentException("ttl must be positive: " + ttl);
        }
        this.ttl = ttl;
        this.tags = List.copyOf(tags);
        this.forceRefresh = forceRefresh;
    }

    public static CacheOptions defaults() {
        return DEFAULTS;
    }

    public static CacheOptions ttl(Duration ttl) {
        return new CacheOptions(ttl, List.of(), false);
    }

    public static CacheOptions tags(String... tags) {
        return new CacheOptions(null, Arrays.asList(tags), false);
    }

    public CacheOptions withTtl(Duration ttl) {
        return new CacheOptions(ttl, tags, forceRefresh);
    }

    public CacheOptions withTags(List<String> tags) {
        return new CacheOptions(ttl, tags, forceRefresh);
    }

    public CacheOptions withTags(String... tags) {
        return withTags(Arrays.asList(tags));
    }

    public CacheOptions forceRefresh() {
        return new CacheOptions(ttl, tags, true);
    }

    public Duration getTtl() {
        return ttl;
    }

    public List<String> getTags() {
        return tags;
    }

    public boolean isForceRefresh() {
        return forceRefresh;
    }
}
