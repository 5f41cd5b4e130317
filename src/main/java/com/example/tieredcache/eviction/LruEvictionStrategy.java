package com.example.tieredcache.eviction;

import com.example.tieredcache.core.CacheEntry;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

public class LruEvictionStrategy implements EvictionStrategy {

    private final ReentrantLock lock = new ReentrantLock();

    // LinkedHashMap in access-order mode: accessOrder = true
    private final LinkedHashMap<String, Boolean> order =
        new LinkedHashMap<>(16, 0.75f, true);

    @Override
    public void onHit(String key) {
        lock.lock();
        try {
            // access-order LinkedHashMap moves key to end on get/put
            order.get(key);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void onInsert(String key) {
        lock.lock();
        try {
            order.put(key, Boolean.TRUE);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void onRemove(String key) {
        lock.lock();
        try {
            order.remove(key);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<String> selectVictim(Map<String, ? extends CacheEntry<?>> store) {
        lock.lock();
        try {
            Iterator<Map.Entry<String, Boolean>> it = order.entrySet().iterator();
            while (it.hasNext()) {
                String candidateKey = it.next().getKey();
                it.remove();
                // candidate may already be gone from the store
                if (store.containsKey(candidateKey)) {
                    return Optional.of(candidateKey);
                }
            }
            return Optional.empty();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void clear() {
        lock.lock();
        try {
            order.clear();
        } finally {
            lock.unlock();
        }
    }
}
