package com.example.tieredcache.remote;

import java.time.Instant;

public final class RemoteCacheStats {

    private final RemoteState state;
    private final long hits;
    private final long misses;
    private final long errors;
    private final String lastError;
    private final Instant lastConnectedAt;

    public RemoteCacheStats(RemoteState state, long hits, long misses, long errors, String lastError, Instant lastConnectedAt) {
        this.state = state;
        this.hits = hits;
        this.misses = misses;
        this.errors = errors;
        this.lastError = lastError;
        this.lastConnectedAt = lastConnectedAt;
    }

    public RemoteState getState() {
        return state;
    }

    public boolean isConnected() {
        return state == RemoteState.CONNECTED;
    }

    public long getHits() {
        return hits;
    }

    public long getMisses() {
        return misses;
    }

    public long getErrors() {
        return errors;
    }

    public String getLastError() {
        return lastError;
    }

    public Instant getLastConnectedAt() {
        return lastConnectedAt;
    }
}
