package com.berrys.resilience.model;

/**
 * Outcome of a get-or-fetch: the value and whether it was served from the cache.
 */
public final class CacheResult<V> {
    
    private final V value;
    private final boolean fromCache;
    
    private CacheResult(V value, boolean fromCache) {
        this.value = value;
        this.fromCache = fromCache;
    }
    
    public static <V> CacheResult<V> cached(V value) {
        return new CacheResult<>(value, true);
    }
    
    public static <V> CacheResult<V> fetched(V value) {
        return new CacheResult<>(value, false);
    }
    
    public V getValue() {
        return value;
    }
    
    public boolean isFromCache() {
        return fromCache;
    }
    
    @Override
    public String toString() {
        return "CacheResult{fromCache=" + fromCache + "}";
    }
}
