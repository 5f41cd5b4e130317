package com.example.tieredcache.core;

/**
 * Result of {@link BoundedMemoryCache#getWithMeta}. A stale lookup carries the expired value,
 * an absent one carries {@code null}.
 */
public final class MemoryLookup<T> {

    private static final MemoryLookup<Object> ABSENT = new MemoryLookup<>(null, false, false, 0);

    private final T value;
    private final boolean hit;
    private final boolean stale;
    private final long age;

    private MemoryLookup(T value, boolean hit, boolean stale, long age) {
        this.value = value;
        this.hit = hit;
        this.stale = stale;
        this.age = age;
    }

    static <T> MemoryLookup<T> fresh(T value, long age) {
        return new MemoryLookup<>(value, true, false, age);
    }

    static <T> MemoryLookup<T> stale(T value, long age) {
        return new MemoryLookup<>(value, false, true, age);
    }

    @SuppressWarnings("unchecked")
    static <T> MemoryLookup<T> absent() {
        return (MemoryLookup<T>) ABSENT;
    }

    public T getValue() {
        return value;
    }

    public boolean isHit() {
        return hit;
    }

    public boolean isStale() {
        return stale;
    }

    /** Entry age in millis at lookup time, 0 when absent. */
    public long getAge() {
        return age;
    }
}
