package com.berrys.resilience.cache;

import com.berrys.resilience.model.CacheEntry;
import com.berrys.resilience.store.SharedStore;

import java.time.Duration;
import java.util.Optional;

/**
 * Cache entries kept as JSON in the shared store. The store expiry is the entry's ttl
 * plus the stale retention, so stale values stay readable for fallback.
 */
class SharedCacheStore<V> implements CacheStore<V> {
    
    private final SharedStore store;
    private final CacheEntryCodec<V> codec;
    private final Duration staleRetention;
    
    SharedCacheStore(SharedStore store, CacheEntryCodec<V> codec, Duration staleRetention) {
        this.store = store;
        this.codec = codec;
        this.staleRetention = staleRetention;
    }
    
    @Override
    public Optional<CacheEntry<V>> read(String key) {
        return store.get(key).map(codec::decode);
    }
    
    @Override
    public void write(String key, CacheEntry<V> entry) {
        store.setWithTtl(key, codec.encode(entry), entry.getTtl().plus(staleRetention));
    }
}
