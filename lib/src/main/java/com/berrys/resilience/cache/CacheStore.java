package com.berrys.resilience.cache;

import com.berrys.resilience.model.CacheEntry;

import java.util.Optional;

/**
 * Storage behind a cache fallback. Reads return stale entries as well; freshness is
 * decided by the caller.
 */
public interface CacheStore<V> {
    
    Optional<CacheEntry<V>> read(String key);
    
    void write(String key, CacheEntry<V> entry);
}
