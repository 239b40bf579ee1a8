package com.berrys.resilience.support;

import com.berrys.resilience.store.SharedStore;
import com.berrys.resilience.store.SharedStoreException;
import com.berrys.resilience.store.SlidingWindowSnapshot;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Shared store kept in memory with the same sliding-window semantics as the Redis script.
 * Expiry is recorded but not enforced. Can be switched to fail every call.
 */
public class InMemorySharedStore implements SharedStore {
    
    private final Map<String, String> values = new ConcurrentHashMap<>();
    private final Map<String, Duration> ttls = new ConcurrentHashMap<>();
    private final Map<String, Map<String, Long>> windows = new ConcurrentHashMap<>();
    private volatile boolean failing;
    
    public void setFailing(boolean failing) {
        this.failing = failing;
    }
    
    public Duration ttlOf(String key) {
        return ttls.get(key);
    }
    
    public String rawValue(String key) {
        return values.get(key);
    }
    
    @Override
    public Optional<String> get(String key) {
        failIfRequested("get");
        return Optional.ofNullable(values.get(key));
    }
    
    @Override
    public void setWithTtl(String key, String value, Duration ttl) {
        failIfRequested("setex");
        values.put(key, value);
        ttls.put(key, ttl);
    }
    
    @Override
    public synchronized SlidingWindowSnapshot slidingWindow(String key, long nowMillis, String member,
                                                            long windowMillis, Duration expiry) {
        failIfRequested("slidingWindow");
        Map<String, Long> window = windows.computeIfAbsent(key, k -> new ConcurrentHashMap<>());
        window.put(member, nowMillis);
        window.values().removeIf(score -> score <= nowMillis - windowMillis);
        ttls.put(key, expiry);
        
        OptionalLong oldest = window.values().stream().mapToLong(Long::longValue).min();
        return new SlidingWindowSnapshot(window.size(), oldest);
    }
    
    private void failIfRequested(String operation) {
        if (failing) {
            throw new SharedStoreException(operation, "store unavailable", null);
        }
    }
}
