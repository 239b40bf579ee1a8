package com.berrys.resilience.store;

import java.util.OptionalLong;

/**
 * Number of requests in a sliding window after the latest insert, and the score of the oldest one.
 */
public final class SlidingWindowSnapshot {
    
    private final long count;
    private final OptionalLong oldestMillis;
    
    public SlidingWindowSnapshot(long count, OptionalLong oldestMillis) {
        this.count = count;
        this.oldestMillis = oldestMillis;
    }
    
    public long getCount() {
        return count;
    }
    
    public OptionalLong getOldestMillis() {
        return oldestMillis;
    }
    
    @Override
    public String toString() {
        return "SlidingWindowSnapshot{count=" + count + ", oldestMillis=" + oldestMillis + "}";
    }
}
