package com.berrys.resilience.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * A cached value with the time it was stored and how long it stays fresh.
 * Freshness is evaluated against a caller-supplied instant and never changes the entry.
 */
public final class CacheEntry<V> {
    
    private final V value;
    private final Instant timestamp;
    private final Duration ttl;
    
    public CacheEntry(V value, Instant timestamp, Duration ttl) {
        this.value = Objects.requireNonNull(value, "value");
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
        this.ttl = Objects.requireNonNull(ttl, "ttl");
    }
    
    public V getValue() {
        return value;
    }
    
    public Instant getTimestamp() {
        return timestamp;
    }
    
    public Duration getTtl() {
        return ttl;
    }
    
    public boolean isFresh(Instant now) {
        return age(now).compareTo(ttl) < 0;
    }
    
    public Duration age(Instant now) {
        return Duration.between(timestamp, now);
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CacheEntry<?> that = (CacheEntry<?>) o;
        return value.equals(that.value) && timestamp.equals(that.timestamp) && ttl.equals(that.ttl);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(value, timestamp, ttl);
    }
    
    @Override
    public String toString() {
        return String.format("CacheEntry{timestamp=%s, ttl=%s}", timestamp, ttl);
    }
}
