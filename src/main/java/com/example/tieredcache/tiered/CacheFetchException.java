package com.example.tieredcache.tiered;

/** A fetcher failed with a checked exception while no cached value could be served. */
public class CacheFetchException extends RuntimeException {

    private final String key;

    public CacheFetchException(String key, Throwable cause) {
        super("Fetch failed for key " + key + ": " + cause.getMessage(), cause);
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
