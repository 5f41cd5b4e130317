package com.example.tieredcache.tiered;

public final class CacheResult<T> {

    private final T value;
    private final boolean hit;
    private final CacheSource source;
    private final boolean stale;
    private final long age;

    CacheResult(T value, boolean hit, CacheSource source, boolean stale, long age) {
        this.value = value;
        this.hit = hit;
        this.source = source;
        this.stale = stale;
        this.age = age;
    }

    static <T> CacheResult<T> origin() {
        return new CacheResult<>(null, false, CacheSource.ORIGIN, false, 0);
    }

    public T getValue() {
        return value;
    }

    public boolean isHit() {
        return hit;
    }

    public CacheSource getSource() {
        return source;
    }

    public boolean isStale() {
        return stale;
    }

    public long getAge() {
        return age;
    }
}
