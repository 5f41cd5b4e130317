package com.example.tieredcache.tiered;

/**
 * Outcome of {@link TieredCache#getOrFetch}: {@code cached} is false when the fetcher ran on the
 * caller's thread, {@code stale} is true when an expired value was served while a background
 * refresh runs.
 */
public final class FetchResult<T> {

    private final T value;
    private final boolean cached;
    private final boolean stale;

    public FetchResult(T value, boolean cached, boolean stale) {
        this.value = value;
        this.cached = cached;
        this.stale = stale;
    }

    static <T> FetchResult<T> fresh(T value) {
        return new FetchResult<>(value, true, false);
    }

    static <T> FetchResult<T> stale(T value) {
        return new FetchResult<>(value, true, true);
    }

    static <T> FetchResult<T> fetched(T value) {
        return new FetchResult<>(value, false, false);
    }

    public T getValue() {
        return value;
    }

    public boolean isCached() {
        return cached;
    }

    public boolean isStale() {
        return stale;
    }
}
