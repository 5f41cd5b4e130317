package com.example.tieredcache.refresh;

import java.util.concurrent.Callable;

/**
 * How a cache miss reaches the origin. Implementations decide whether concurrent misses for the
 * same key share a fetch.
 */
public interface FetchStrategy {
    <T> T fetch(String key, Callable<T> fetcher) throws Exception;
}
