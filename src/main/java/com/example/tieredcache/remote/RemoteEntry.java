package com.example.tieredcache.remote;

import java.util.List;

/** A decoded remote entry: the value plus the metadata the memory tier keeps. */
public final class RemoteEntry<T> {

    private final T value;
    private final long createdAt;
    private final List<String> tags;

    public RemoteEntry(T value, long createdAt, List<String> tags) {
        this.value = value;
        this.createdAt = createdAt;
        this.tags = List.copyOf(tags);
    }

    public T getValue() {
        return value;
    }

    public long getCreatedAt() {
        return createdAt;
    }

    public List<String> getTags() {
        return tags;
    }
}
