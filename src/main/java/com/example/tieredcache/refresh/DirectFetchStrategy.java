package com.example.tieredcache.refresh;

import java.util.concurrent.Callable;

/** Every miss calls its own fetcher, concurrent misses for one key are not coalesced. */
public class DirectFetchStrategy implements FetchStrategy {

    @Override
    public <T> T fetch(String key, Callable<T> fetcher) throws Exception {
        return fetcher.call();
    }
}
