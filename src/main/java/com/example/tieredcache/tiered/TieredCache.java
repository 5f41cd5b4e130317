package com.example.tieredcache.tiered;

import com.example.tieredcache.core.BoundedMemoryCache;
import com.example.tieredcache.core.CacheOptions;
import com.example.tieredcache.core.MemoryLookup;
import com.example.tieredcache.refresh.BackgroundRevalidator;
import com.example.tieredcache.refresh.FetchStrategy;
import com.example.tieredcache.remote.RemoteCommandCache;
import com.example.tieredcache.remote.RemoteLookup;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Read-through cache over a bounded memory tier and an optional remote tier.
 *
 * <p>Reads go memory, then remote; a remote hit is copied back into memory with the memory tier's
 * default TTL. Writes go to memory synchronously and to the remote tier in the background.
 * {@link #getOrFetch} adds stale-while-revalidate on top: an expired memory entry younger than
 * {@code maxStaleAge} is served immediately while the fetcher refreshes it in the background.
 *
 * <p>No failure of the remote tier reaches callers. The only exception that crosses this API is a
 * fetcher failure on the synchronous miss path.
 */
public class TieredCache implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TieredCache.class);

    private final BoundedMemoryCache memory;
    private final RemoteCommandCache remote;
    private final TieredCacheSettings settings;
    private final FetchStrategy fetchStrategy;
    private final BackgroundRevalidator background;
    private CompletableFuture<Void> initialization;

    /**
     * @param remote remote tier, or {@code null} for memory-only
     */
    public TieredCache(BoundedMemoryCache memory, RemoteCommandCache remote, TieredCacheSettings settings,
                       FetchStrategy fetchStrategy, BackgroundRevalidator background) {
        this.memory = memory;
        this.remote = remote;
        this.settings = settings;
        this.fetchStrategy = fetchStrategy;
        this.background = background;
    }

    /** Connects the remote tier once; later calls return the same future. */
    public synchronized CompletableFuture<Void> initialize() {
        if (initialization == null) {
            if (remote == null) {
                initialization = CompletableFuture.completedFuture(null);
            } else {
                initialization = remote.connect().thenAccept(connected ->
                    log.info("Tiered cache initialized (remote={})", connected ? "connected" : remote.getState()));
            }
        }
        return initialization;
    }

    public <T> T get(String key, Class<T> type) {
        ensureInitialized();

        T value = memory.get(key, type);
        if (value != null) {
            return value;
        }

        if (isRemoteAvailable()) {
            RemoteLookup<T> lookup = remote.getWithMeta(key, type).join();
            if (lookup.isHit() && lookup.getValue() != null) {
                backfill(key, lookup);
                return lookup.getValue();
            }
        }
        return null;
    }

    public <T> CacheResult<T> getWithMeta(String key, Class<T> type) {
        ensureInitialized();

        // with revalidation off an expired entry is purged like any other miss
        Duration staleBudget = settings.isStaleWhileRevalidate() ? settings.getMaxStaleAge() : Duration.ZERO;
        MemoryLookup<T> local = memory.getWithMeta(key, type, staleBudget);
        if (local.isHit()) {
            return new CacheResult<>(local.getValue(), true, CacheSource.MEMORY, false, local.getAge());
        }
        if (local.isStale()) {
            return new CacheResult<>(local.getValue(), false, CacheSource.STALE, true, local.getAge());
        }

        if (isRemoteAvailable()) {
            RemoteLookup<T> lookup = remote.getWithMeta(key, type).join();
            if (lookup.isHit() && lookup.getValue() != null) {
                backfill(key, lookup);
                return new CacheResult<>(lookup.getValue(), true, CacheSource.REMOTE, false, lookup.getAge());
            }
        }
        return CacheResult.origin();
    }

    public CompletableFuture<Boolean> set(String key, Object value) {
        return set(key, value, CacheOptions.defaults());
    }

    /**
     * Writes memory now and the remote tier in the background.
     *
     * @return completes with the outcome of the remote write, never exceptionally; callers may ignore it
     */
    public CompletableFuture<Boolean> set(String key, Object value, CacheOptions options) {
        Objects.requireNonNull(value, "value");
        ensureInitialized();

        memory.set(key, value, options);

        if (!isRemoteAvailable()) {
            return CompletableFuture.completedFuture(false);
        }
        return remote.set(key, value, options.getTtl(), options.getTags())
            .whenComplete((written, error) -> {
                if (!Boolean.TRUE.equals(written)) {
                    log.warn("Remote write-behind failed for key {}", key);
                }
            });
    }

    public <T> FetchResult<T> getOrFetch(String key, Class<T> type, Callable<T> fetcher) {
        return getOrFetch(key, type, fetcher, CacheOptions.defaults());
    }

    /**
     * Cache-aside read. A fresh hit never calls the fetcher; a stale hit returns at once and
     * refreshes in the background; a miss calls the fetcher on this thread and caches the result.
     * A {@code null} from the fetcher is returned but not cached.
     *
     * @throws CacheFetchException if the fetcher throws a checked exception on the miss path;
     *                             unchecked fetcher exceptions propagate as they are
     */
    public <T> FetchResult<T> getOrFetch(String key, Class<T> type, Callable<T> fetcher, CacheOptions options) {
        ensureInitialized();

        if (options.isForceRefresh()) {
            T value = fetchNow(key, fetcher);
            store(key, value, options);
            return FetchResult.fetched(value);
        }

        CacheResult<T> cached = getWithMeta(key, type);
        if (cached.isHit() && cached.getValue() != null) {
            return FetchResult.fresh(cached.getValue());
        }

        if (cached.isStale() && cached.getValue() != null) {
            revalidate(key, fetcher, options);
            return FetchResult.stale(cached.getValue());
        }

        T value = fetchNow(key, fetcher);
        store(key, value, options);
        return FetchResult.fetched(value);
    }

    public boolean delete(String key) {
        ensureInitialized();
        boolean removed = memory.delete(key);
        if (isRemoteAvailable()) {
            removed |= remote.delete(key).join();
        }
        return removed;
    }

    /** Returns the memory count plus the remote count. */
    public int invalidateByTag(String tag) {
        ensureInitialized();
        int count = memory.invalidateByTag(tag);
        if (isRemoteAvailable()) {
            count += remote.invalidateByTag(tag).join();
        }
        return count;
    }

    /**
     * Removes keys in which {@code pattern} finds a match from both tiers. The remote tier gets a
     * {@code KEYS} glob when the regex has an exact glob form, and is scanned and filtered otherwise.
     */
    public int invalidateByPattern(Pattern pattern) {
        ensureInitialized();
        int count = memory.invalidateByPattern(pattern);
        if (isRemoteAvailable()) {
            String glob = pattern.flags() == 0 ? GlobPatterns.fromRegex(pattern.pattern()) : null;
            count += glob != null
                ? remote.deleteByPattern(glob).join()
                : remote.deleteMatching(pattern).join();
        }
        return count;
    }

    public int invalidateByPattern(String regex) {
        return invalidateByPattern(Pattern.compile(regex));
    }

    public void clear() {
        ensureInitialized();
        memory.clear();
        if (isRemoteAvailable()) {
            remote.clear().join();
        }
    }

    public boolean isRemoteAvailable() {
        return remote != null && remote.isAvailable();
    }

    public TieredCacheStats getStats() {
        boolean remoteConfigured = remote != null && remote.isConfigured();
        return new TieredCacheStats(memory.getStats(), remoteConfigured ? remote.getStats() : null);
    }

    /** Purges expired memory entries; the scheduled sweep calls this. */
    public int sweepExpired() {
        int purged = memory.cleanup();
        if (purged > 0) {
            log.debug("Swept {} expired entries", purged);
        }
        return purged;
    }

    @Override
    public void close() {
        background.close();
    }

    private <T> void revalidate(String key, Callable<T> fetcher, CacheOptions options) {
        background.submit("revalidate " + key, () -> {
            T value = fetchStrategy.fetch(key, fetcher);
            store(key, value, options);
        });
    }

    private <T> T fetchNow(String key, Callable<T> fetcher) {
        try {
            return fetchStrategy.fetch(key, fetcher);
        } catch (RuntimeException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CacheFetchException(key, e);
        } catch (Exception e) {
            throw new CacheFetchException(key, e);
        }
    }

    private void store(String key, Object value, CacheOptions options) {
        if (value != null) {
            set(key, value, options);
        }
    }

    private <T> void backfill(String key, RemoteLookup<T> lookup) {
        memory.set(key, lookup.getValue(), CacheOptions.defaults().withTags(lookup.getTags()));
    }

    private void ensureInitialized() {
        initialize().join();
    }
}
