package com.berrys.resilience.cache;

import com.berrys.resilience.RemoteCall;
import com.berrys.resilience.config.CacheConfig;
import com.berrys.resilience.config.CacheStrategy;
import com.berrys.resilience.model.CacheEntry;
import com.berrys.resilience.model.CacheResult;
import com.berrys.resilience.observability.RequestIdScope;
import com.berrys.resilience.observability.ResilienceEvent;
import com.berrys.resilience.observability.ResilienceEventListener;
import com.berrys.resilience.store.SharedStore;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Function;

/**
 * Get-or-fetch cache that serves cached values when the data source fails.
 *
 * <p>Entries live in an optional shared store and in an always-written local store.
 * Reads prefer the shared store and fall back to the local one when the shared store
 * has nothing or fails. Staleness never removes an entry; it only selects the strategy branch:
 * <ul>
 *   <li>{@link CacheStrategy#CACHE_FIRST}: fresh cached value, otherwise fetch.</li>
 *   <li>{@link CacheStrategy#SERVICE_FIRST}: fetch, and on failure serve any cached value.</li>
 *   <li>{@link CacheStrategy#STALE_WHILE_REVALIDATE}: serve any cached value at once and
 *       refresh it in the background, otherwise fetch.</li>
 * </ul>
 *
 * <p>Background refreshes are not deduplicated; two concurrent stale reads of a key may
 * trigger two refreshes.
 */
public class CacheFallback<V> {
    
    private static final Logger logger = LoggerFactory.getLogger(CacheFallback.class);
    
    private final String prefix;
    private final CacheConfig config;
    private final CacheStore<V> sharedStore;
    private final CacheStore<V> localStore;
    private final Executor revalidationExecutor;
    private final Clock clock;
    private final ResilienceEventListener listener;
    
    private CacheFallback(Builder<V> builder, JavaType valueType) {
        this.prefix = builder.prefix;
        this.config = builder.config;
        this.clock = builder.clock;
        this.listener = builder.listener;
        this.revalidationExecutor = builder.executor != null ? builder.executor : ForkJoinPool.commonPool();
        this.localStore = new LocalCacheStore<>(config.getStaleRetention(), clock);
        this.sharedStore = builder.sharedStore != null
            ? new SharedCacheStore<>(builder.sharedStore, new CacheEntryCodec<>(builder.objectMapper, valueType),
                config.getStaleRetention())
            : null;
    }
    
    public CacheResult<V> getOrFetch(String key, RemoteCall<V> fetch) throws Exception {
        return getOrFetch(key, fetch, null, null, null);
    }
    
    public CacheResult<V> getOrFetch(String key, RemoteCall<V> fetch, CacheStrategy strategy) throws Exception {
        return getOrFetch(key, fetch, null, strategy, null);
    }
    
    /**
     * Returns the value for the key according to the strategy.
     *
     * @param ttl freshness of a newly stored value, or {@code null} for the configured default
     * @param strategy strategy for this call, or {@code null} for the configured default
     * @param requestId correlation id placed in the MDC for this call, may be {@code null}
     * @throws Exception the fetch's own failure when no cached value can stand in for it
     */
    public CacheResult<V> getOrFetch(String key, RemoteCall<V> fetch, Duration ttl,
                                     CacheStrategy strategy, String requestId) throws Exception {
        Duration effectiveTtl = ttl != null ? ttl : config.getTtl();
        CacheStrategy effectiveStrategy = strategy != null ? strategy : config.getStrategy();
        String fullKey = fullKey(key);
        
        try (RequestIdScope ignored = RequestIdScope.open(requestId)) {
            return switch (effectiveStrategy) {
                case CACHE_FIRST -> cacheFirst(fullKey, fetch, effectiveTtl);
                case SERVICE_FIRST -> serviceFirst(fullKey, fetch, effectiveTtl);
                case STALE_WHILE_REVALIDATE -> staleWhileRevalidate(fullKey, fetch, effectiveTtl);
            };
        }
    }
    
    /**
     * @return the cached value if present and fresh
     */
    public Optional<V> get(String key) {
        return read(fullKey(key))
            .filter(entry -> entry.isFresh(clock.instant()))
            .map(CacheEntry::getValue);
    }
    
    public void set(String key, V value) {
        set(key, value, null);
    }
    
    public void set(String key, V value, Duration ttl) {
        store(fullKey(key), value, ttl != null ? ttl : config.getTtl());
    }
    
    /**
     * Reads the stored entry for the key whether it is fresh or stale.
     */
    public Optional<CacheEntry<V>> peek(String key) {
        return read(fullKey(key));
    }
    
    private CacheResult<V> cacheFirst(String fullKey, RemoteCall<V> fetch, Duration ttl) throws Exception {
        Optional<CacheEntry<V>> cached = read(fullKey);
        if (cached.isPresent() && cached.get().isFresh(clock.instant())) {
            record(ResilienceEvent.Type.CACHE_HIT, CacheStrategy.CACHE_FIRST);
            return CacheResult.cached(cached.get().getValue());
        }
        
        record(ResilienceEvent.Type.CACHE_MISS, CacheStrategy.CACHE_FIRST);
        return fetchAndStore(fullKey, fetch, ttl);
    }
    
    private CacheResult<V> serviceFirst(String fullKey, RemoteCall<V> fetch, Duration ttl) throws Exception {
        try {
            CacheResult<V> result = fetchAndStore(fullKey, fetch, ttl);
            record(ResilienceEvent.Type.CACHE_MISS, CacheStrategy.SERVICE_FIRST);
            return result;
        } catch (Exception e) {
            Optional<CacheEntry<V>> cached = read(fullKey);
            if (cached.isEmpty()) {
                throw e;
            }
            logger.warn("Fetch for {} failed, serving cached value aged {}: {}",
                fullKey, cached.get().age(clock.instant()), e.getMessage());
            listener.onEvent(ResilienceEvent.of(ResilienceEvent.Type.CACHE_FALLBACK, prefix,
                e.getClass().getSimpleName(), clock.instant()));
            record(ResilienceEvent.Type.CACHE_HIT, CacheStrategy.SERVICE_FIRST);
            return CacheResult.cached(cached.get().getValue());
        }
    }
    
    private CacheResult<V> staleWhileRevalidate(String fullKey, RemoteCall<V> fetch, Duration ttl) throws Exception {
        Optional<CacheEntry<V>> cached = read(fullKey);
        if (cached.isEmpty()) {
            record(ResilienceEvent.Type.CACHE_MISS, CacheStrategy.STALE_WHILE_REVALIDATE);
            return fetchAndStore(fullKey, fetch, ttl);
        }
        
        record(ResilienceEvent.Type.CACHE_HIT, CacheStrategy.STALE_WHILE_REVALIDATE);
        revalidate(fullKey, fetch, ttl);
        return CacheResult.cached(cached.get().getValue());
    }
    
    private void revalidate(String fullKey, RemoteCall<V> fetch, Duration ttl) {
        Map<String, String> mdc = MDC.getCopyOfContextMap();
        try {
            revalidationExecutor.execute(() -> {
                Map<String, String> previous = MDC.getCopyOfContextMap();
                if (mdc != null) {
                    MDC.setContextMap(mdc);
                }
                try {
                    fetchAndStore(fullKey, fetch, ttl);
                    logger.debug("Revalidated cache entry {}", fullKey);
                } catch (Exception e) {
                    logger.warn("Background refresh of {} failed: {}", fullKey, e.getMessage());
                    listener.onEvent(ResilienceEvent.of(ResilienceEvent.Type.CACHE_REVALIDATION_FAILED, prefix,
                        e.getClass().getSimpleName(), clock.instant()));
                } finally {
                    if (previous != null) {
                        MDC.setContextMap(previous);
                    } else {
                        MDC.clear();
                    }
                }
            });
        } catch (RejectedExecutionException e) {
            logger.warn("Background refresh of {} was rejected: {}", fullKey, e.getMessage());
            listener.onEvent(ResilienceEvent.of(ResilienceEvent.Type.CACHE_REVALIDATION_FAILED, prefix,
                "rejected", clock.instant()));
        }
    }
    
    private CacheResult<V> fetchAndStore(String fullKey, RemoteCall<V> fetch, Duration ttl) throws Exception {
        V value = fetch.call();
        if (value == null) {
            logger.debug("Fetch for {} returned no value, nothing cached", fullKey);
            return CacheResult.fetched(null);
        }
        store(fullKey, value, ttl);
        return CacheResult.fetched(value);
    }
    
    private Optional<CacheEntry<V>> read(String fullKey) {
        if (sharedStore != null) {
            try {
                Optional<CacheEntry<V>> shared = sharedStore.read(fullKey);
                if (shared.isPresent()) {
                    return shared;
                }
            } catch (RuntimeException e) {
                logger.warn("Shared cache read failed for {}, using local cache: {}", fullKey, e.getMessage());
            }
        }
        return localStore.read(fullKey);
    }
    
    private void store(String fullKey, V value, Duration ttl) {
        CacheEntry<V> entry = new CacheEntry<>(value, clock.instant(), ttl);
        if (sharedStore != null) {
            try {
                sharedStore.write(fullKey, entry);
            } catch (RuntimeException e) {
                logger.warn("Shared cache write failed for {}, kept locally only: {}", fullKey, e.getMessage());
            }
        }
        localStore.write(fullKey, entry);
    }
    
    private void record(ResilienceEvent.Type type, CacheStrategy strategy) {
        listener.onEvent(ResilienceEvent.of(type, prefix, strategy.name(), clock.instant()));
    }
    
    private String fullKey(String key) {
        return prefix + ":" + key;
    }
    
    public String getPrefix() {
        return prefix;
    }
    
    public CacheConfig getConfig() {
        return config;
    }
    
    public boolean isShared() {
        return sharedStore != null;
    }
    
    public static <V> Builder<V> builder(String prefix, Class<V> valueType) {
        return new Builder<>(prefix, mapper -> mapper.constructType(valueType));
    }
    
    public static <V> Builder<V> builder(String prefix, TypeReference<V> valueType) {
        return new Builder<>(prefix, mapper -> mapper.getTypeFactory().constructType(valueType));
    }
    
    public static class Builder<V> {
        private final String prefix;
        private final Function<ObjectMapper, JavaType> typeResolver;
        private CacheConfig config = CacheConfig.defaultConfig();
        private SharedStore sharedStore;
        private ObjectMapper objectMapper;
        private Executor executor;
        private Clock clock = Clock.systemUTC();
        private ResilienceEventListener listener = ResilienceEventListener.NO_OP;
        
        private Builder(String prefix, Function<ObjectMapper, JavaType> typeResolver) {
            this.prefix = prefix;
            this.typeResolver = typeResolver;
        }
        
        public Builder<V> config(CacheConfig config) {
            this.config = config;
            return this;
        }
        
        /**
         * Shared store for entries; without one the cache is process-local.
         */
        public Builder<V> sharedStore(SharedStore sharedStore) {
            this.sharedStore = sharedStore;
            return this;
        }
        
        public Builder<V> objectMapper(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
            return this;
        }
        
        /**
         * Executor for background refreshes. Defaults to the common fork-join pool.
         */
        public Builder<V> executor(Executor executor) {
            this.executor = executor;
            return this;
        }
        
        public Builder<V> clock(Clock clock) {
            this.clock = clock;
            return this;
        }
        
        public Builder<V> listener(ResilienceEventListener listener) {
            this.listener = listener;
            return this;
        }
        
        public CacheFallback<V> build() {
            if (prefix == null || prefix.isBlank()) {
                throw new IllegalArgumentException("Cache prefix must not be blank");
            }
            if (config == null) {
                throw new IllegalArgumentException("Cache configuration must be provided");
            }
            if (objectMapper == null) {
                objectMapper = new ObjectMapper();
            }
            return new CacheFallback<>(this, typeResolver.apply(objectMapper));
        }
    }
}
