package com.example.tieredcache.tiered;

import com.fasterxml.jackson.annotation.JsonValue;

/** Where a {@link CacheResult} came from. */
public enum CacheSource {
    MEMORY("memory"),
    REMOTE("remote"),
    /** Expired in memory but within the stale budget. */
    STALE("stale"),
    /** Nothing cached, the caller has to go to the origin. */
    ORIGIN("origin");

    private final String label;

    CacheSource(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }
}
