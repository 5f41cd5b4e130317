package com.example.tieredcache.remote;

import java.util.List;

public final class RemoteLookup<T> {

    private static final RemoteLookup<Object> MISS = new RemoteLookup<>(null, false, 0, List.of());

    private final T value;
    private final boolean hit;
    private final long age;
    private final List<String> tags;

    private RemoteLookup(T value, boolean hit, long age, List<String> tags) {
        this.value = value;
        this.hit = hit;
        this.age = age;
        this.tags = tags;
    }

    static <T> RemoteLookup<T> hit(T value, long age, List<String> tags) {
        return new RemoteLookup<>(value, true, age, tags);
    }

    @SuppressWarnings("unchecked")
    static <T> RemoteLookup<T> miss() {
        return (RemoteLookup<T>) MISS;
    }

    public T getValue() {
        return value;
    }

    public boolean isHit() {
        return hit;
    }

    public long getAge() {
        return age;
    }

    public List<String> getTags() {
        return tags;
    }
}
