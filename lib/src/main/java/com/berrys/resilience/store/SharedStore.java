package com.berrys.resilience.store;

import java.time.Duration;
import java.util.Optional;

/**
 * Cross-process key/value store shared by rate limiters and cache fallbacks.
 * Implementations signal failures with {@link SharedStoreException}; callers degrade to
 * in-process state when that happens.
 */
public interface SharedStore {
    
    /**
     * @return the value stored under the key, or empty when absent or expired
     */
    Optional<String> get(String key);
    
    /**
     * Stores a value that the store drops after the given time to live.
     */
    void setWithTtl(String key, String value, Duration ttl);
    
    /**
     * Records one request in the sorted-set window stored under the key and returns the
     * window's state. Executes atomically: insert {@code member} scored {@code nowMillis},
     * drop entries scored at or below {@code nowMillis - windowMillis}, count, refresh the
     * key expiry and read the oldest remaining score.
     */
    SlidingWindowSnapshot slidingWindow(String key, long nowMillis, String member, long windowMillis, Duration expiry);
}
