package com.berrys.resilience.ratelimit;

import com.berrys.resilience.config.RateLimitConfig;
import com.berrys.resilience.model.RateLimitInfo;
import com.berrys.resilience.store.SharedStore;
import com.berrys.resilience.store.SlidingWindowSnapshot;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Sliding window kept in the shared store as a sorted set of request timestamps.
 * Every request is recorded, denied ones included.
 */
class SharedStoreRateLimitBackend implements RateLimitBackend {
    
    private static final int EXPIRY_BUFFER_SECONDS = 10;
    
    private final SharedStore store;
    
    SharedStoreRateLimitBackend(SharedStore store) {
        this.store = store;
    }
    
    @Override
    public RateLimitInfo record(String key, RateLimitConfig config, Instant now) {
        long nowMillis = now.toEpochMilli();
        long windowMillis = config.getWindowSeconds() * 1000L;
        String member = nowMillis + "-" + UUID.randomUUID();
        
        SlidingWindowSnapshot snapshot = store.slidingWindow(key, nowMillis, member, windowMillis,
            Duration.ofSeconds(config.getWindowSeconds() + EXPIRY_BUFFER_SECONDS));
        
        long count = snapshot.getCount();
        int limit = config.getRequests();
        long remaining = Math.max(0, limit - count);
        
        long resetSeconds = config.getWindowSeconds();
        if (count >= limit && snapshot.getOldestMillis().isPresent()) {
            long untilFree = snapshot.getOldestMillis().getAsLong() + windowMillis - nowMillis;
            resetSeconds = Math.max(0, (untilFree + 999) / 1000);
        }
        
        return new RateLimitInfo(count <= limit, config.getTier(), limit, remaining,
            resetSeconds, config.getWindowSeconds(), false);
    }
}
