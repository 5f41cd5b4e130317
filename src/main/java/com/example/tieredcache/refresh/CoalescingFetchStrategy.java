package com.example.tieredcache.refresh;

import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;

/**
 * Concurrent misses for the same key wait on the first caller's fetch instead of calling their
 * own fetcher. The first caller runs the fetch on its own thread.
 */
public class CoalescingFetchStrategy implements FetchStrategy {

    private final ConcurrentHashMap<String, CompletableFuture<Object>> inFlight = new ConcurrentHashMap<>();

    @Override
    @SuppressWarnings("unchecked")
    public <T> T fetch(String key, Callable<T> fetcher) throws Exception {
        CompletableFuture<Object> mine = new CompletableFuture<>();
        CompletableFuture<Object> existing = inFlight.putIfAbsent(key, mine);

        if (existing != null) {
            try {
                return (T) existing.get();
            } catch (ExecutionException e) {
                throw rethrowable(e.getCause());
            }
        }

        try {
            T value = fetcher.call();
            mine.complete(value);
            return value;
        } catch (Exception e) {
            mine.completeExceptionally(e);
            throw e;
        } finally {
            inFlight.remove(key, mine);
        }
    }

    public int inFlightCount() {
        return inFlight.size();
    }

    private static Exception rethrowable(Throwable cause) {
        if (cause instanceof Exception) {
            return (Exception) cause;
        }
        if (cause instanceof Error) {
            throw (Error) cause;
        }
        return new CompletionException(cause);
    }
}
