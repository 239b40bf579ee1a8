package com.berrys.resilience.cache;

import com.berrys.resilience.model.CacheEntry;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * In-process store that is always written, so caching keeps working without a shared store.
 * Entries are dropped once they are older than their ttl plus the stale retention: on read,
 * and by a sweep of the whole store that a write triggers at most once a minute.
 */
public class LocalCacheStore<V> implements CacheStore<V> {
    
    private final ConcurrentMap<String, CacheEntry<V>> entries = new ConcurrentHashMap<>();
    private final Duration staleRetention;
    private final Clock clock;
    private final AtomicReference<Instant> nextSweep;
    
    static final Duration SWEEP_INTERVAL = Duration.ofMinutes(1);
    
    public LocalCacheStore(Duration staleRetention, Clock clock) {
        this.staleRetention = staleRetention;
        this.clock = clock;
        this.nextSweep = new AtomicReference<>(clock.instant().plus(SWEEP_INTERVAL));
    }
    
    @Override
    public Optional<CacheEntry<V>> read(String key) {
        CacheEntry<V> entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (isExpired(entry, clock.instant())) {
            entries.remove(key, entry);
            return Optional.empty();
        }
        return Optional.of(entry);
    }
    
    @Override
    public void write(String key, CacheEntry<V> entry) {
        entries.put(key, entry);
        sweepIfDue(clock.instant());
    }
    
    private void sweepIfDue(Instant now) {
        Instant due = nextSweep.get();
        if (now.isBefore(due) || !nextSweep.compareAndSet(due, now.plus(SWEEP_INTERVAL))) {
            return;
        }
        entries.entrySet().removeIf(e -> isExpired(e.getValue(), now));
    }
    
    public int size() {
        return entries.size();
    }
    
    private boolean isExpired(CacheEntry<V> entry, Instant now) {
        return entry.age(now).compareTo(entry.getTtl().plus(staleRetention)) >= 0;
    }
}
