package com.example.tieredcache.tiered;

import com.example.tieredcache.core.CacheOptions;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Hands out the one {@link TieredCache} of the process. The first caller builds and initializes it;
 * callers arriving meanwhile wait on the same future, so the remote tier is probed once. A failed
 * build is forgotten and retried by the next caller.
 */
public class TieredCacheProvider implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TieredCacheProvider.class);

    private final Supplier<TieredCache> factory;
    private final AtomicReference<CompletableFuture<TieredCache>> instance = new AtomicReference<>();

    public TieredCacheProvider(Supplier<TieredCache> factory) {
        this.factory = factory;
    }

    public CompletableFuture<TieredCache> obtain() {
        CompletableFuture<TieredCache> existing = instance.get();
        if (existing != null) {
            return existing;
        }

        CompletableFuture<TieredCache> created = new CompletableFuture<>();
        if (!instance.compareAndSet(null, created)) {
            return instance.get();
        }

        try {
            TieredCache cache = factory.get();
            cache.initialize().whenComplete((ignored, error) -> {
                if (error != null) {
                    fail(created, error);
                } else {
                    created.complete(cache);
                }
            });
        } catch (RuntimeException e) {
            fail(created, e);
        }
        return created;
    }

    public TieredCache get() {
        return obtain().join();
    }

    /** {@link TieredCache#getOrFetch} on the shared instance, returning only the value. */
    public <T> T cached(String key, Class<T> type, Callable<T> fetcher, CacheOptions options) {
        return get().getOrFetch(key, type, fetcher, options).getValue();
    }

    @Override
    public void close() {
        CompletableFuture<TieredCache> current = instance.getAndSet(null);
        if (current != null && current.isDone() && !current.isCompletedExceptionally()) {
            current.join().close();
        }
    }

    private void fail(CompletableFuture<TieredCache> created, Throwable error) {
        log.warn("Tiered cache initialization failed", error);
        instance.compareAndSet(created, null);
        created.completeExceptionally(error);
    }
}
