package com.example.tieredcache.backend;

import java.time.Clock;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/** Slow origin standing in for an upstream API behind the cache. */
@Component
public class MockBackend {

    private final AtomicLong requestCount = new AtomicLong();
    private final AtomicInteger pendingFailures = new AtomicInteger();
    private final Clock clock;
    private volatile long latencyMillis;

    public MockBackend(Clock clock, @Value("${origin.latency-ms:50}") long latencyMillis) {
        this.clock = clock;
        this.latencyMillis = latencyMillis;
    }

    public OriginRecord fetch(String key) throws OriginUnavailableException {
        long version = requestCount.incrementAndGet();
        try {
            if (latencyMillis > 0) {
                Thread.sleep(latencyMillis);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OriginUnavailableException("Interrupted while fetching " + key);
        }

        if (pendingFailures.getAndUpdate(n -> n > 0 ? n - 1 : 0) > 0) {
            throw new OriginUnavailableException("Origin unavailable for " + key);
        }
        return new OriginRecord(key, "value-for-" + key, version, clock.instant());
    }

    /** Makes the next {@code count} fetches fail. */
    public void failNext(int count) {
        pendingFailures.set(count);
    }

    public void setLatencyMillis(long ms) {
        this.latencyMillis = ms;
    }

    public long getRequestCount() {
        return requestCount.get();
    }

    public void resetCount() {
        requestCount.set(0);
        pendingFailures.set(0);
    }
}
