package com.berrys.resilience;

import com.berrys.resilience.cache.CacheFallback;
import com.berrys.resilience.circuitbreaker.CircuitBreaker;
import com.berrys.resilience.circuitbreaker.CircuitBreakerRegistry;
import com.berrys.resilience.config.CacheConfig;
import com.berrys.resilience.config.ResilienceConfig;
import com.berrys.resilience.config.RetryPolicy;
import com.berrys.resilience.connection.RedisStoreFactory;
import com.berrys.resilience.model.RateLimitInfo;
import com.berrys.resilience.observability.ResilienceEventListener;
import com.berrys.resilience.observability.ResilienceEventPublisher;
import com.berrys.resilience.observability.ResilienceMetrics;
import com.berrys.resilience.ratelimit.RateLimitTiers;
import com.berrys.resilience.ratelimit.RateLimiter;
import com.berrys.resilience.retry.RetryExecutor;
import com.berrys.resilience.store.SharedStore;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Entry point that owns the resilience guards shared by an application's service clients:
 * the circuit breaker registry, the rate limiter with its tiers, the retry executor and the
 * event and metrics plumbing. Create one at start-up with {@link #builder()} and pass it to
 * the clients that need it.
 */
public class ResilienceToolkit implements AutoCloseable {
    
    private static final Logger logger = LoggerFactory.getLogger(ResilienceToolkit.class);
    
    private final ResilienceConfig config;
    private final SharedStore sharedStore;
    private final Clock clock;
    private final ObjectMapper objectMapper;
    private final ResilienceEventPublisher eventPublisher;
    private final ResilienceMetrics metrics;
    private final ResilienceEventListener listener;
    private final CircuitBreakerRegistry circuitBreakers;
    private final RateLimiter rateLimiter;
    private final RetryExecutor retryExecutor;
    private final ExecutorService revalidationExecutor;
    private final boolean ownsRevalidationExecutor;
    private final RedisStoreFactory storeFactory;
    private final AtomicBoolean closed = new AtomicBoolean(false);
    
    ResilienceToolkit(ResilienceConfig config, SharedStore sharedStore, Clock clock, ObjectMapper objectMapper,
                      ResilienceMetrics metrics, ResilienceEventListener extraListener,
                      ExecutorService revalidationExecutor, boolean ownsRevalidationExecutor,
                      RedisStoreFactory storeFactory) {
        this.config = config;
        this.sharedStore = sharedStore;
        this.clock = clock;
        this.objectMapper = objectMapper;
        this.eventPublisher = new ResilienceEventPublisher();
        this.metrics = metrics;
        this.listener = extraListener != null
            ? ResilienceEventListener.composite(metrics, eventPublisher, extraListener)
            : ResilienceEventListener.composite(metrics, eventPublisher);
        this.circuitBreakers = new CircuitBreakerRegistry(config.getCircuitBreakerConfig(), clock, listener);
        this.rateLimiter = new RateLimiter(new RateLimitTiers(config.getRateLimitTiers()), sharedStore, clock, listener);
        this.retryExecutor = new RetryExecutor(listener, clock);
        this.revalidationExecutor = revalidationExecutor;
        this.ownsRevalidationExecutor = ownsRevalidationExecutor;
        this.storeFactory = storeFactory;
        
        logger.info("Resilience toolkit initialized ({} shared store, {} rate-limit tiers)",
            sharedStore != null ? "with" : "without", config.getRateLimitTiers().size());
    }
    
    public static ResilienceToolkitBuilder builder() {
        return new ResilienceToolkitBuilder();
    }
    
    public CircuitBreaker circuitBreaker(String dependency) {
        checkNotClosed();
        return circuitBreakers.getOrCreate(dependency);
    }
    
    /**
     * Calls a dependency with the configured retry policy inside the dependency's circuit breaker.
     * Retries happen within a single breaker call, so an exhausted retry budget counts as one failure.
     */
    public <T> T protect(String dependency, RemoteCall<T> operation) throws Exception {
        return protect(dependency, operation, config.getRetryPolicy());
    }
    
    public <T> T protect(String dependency, RemoteCall<T> operation, RetryPolicy policy) throws Exception {
        return protect(dependency, operation, policy, null);
    }
    
    /**
     * @param requestId correlation identifier for the retry logs, may be null
     */
    public <T> T protect(String dependency, RemoteCall<T> operation, RetryPolicy policy,
                         String requestId) throws Exception {
        checkNotClosed();
        return circuitBreakers.getOrCreate(dependency)
            .execute(() -> retryExecutor.run(operation, policy, dependency, requestId), dependency);
    }
    
    /**
     * Non-blocking variant of {@link #protect(String, RemoteCall)}.
     */
    public <T> Mono<T> protectReactive(String dependency, Supplier<? extends Mono<T>> operation) {
        return protectReactive(dependency, operation, null);
    }
    
    public <T> Mono<T> protectReactive(String dependency, Supplier<? extends Mono<T>> operation, String requestId) {
        checkNotClosed();
        return circuitBreakers.getOrCreate(dependency)
            .executeReactive(() -> retryExecutor.runReactive(operation, config.getRetryPolicy(), dependency, requestId),
                dependency);
    }
    
    public RateLimitInfo checkRateLimit(String key, String tier) {
        checkNotClosed();
        return rateLimiter.check(key, tier);
    }
    
    public <V> CacheFallback<V> cacheFallback(String prefix, Class<V> valueType) {
        return cacheFallback(CacheFallback.builder(prefix, valueType), config.getCacheConfig());
    }
    
    public <V> CacheFallback<V> cacheFallback(String prefix, Class<V> valueType, CacheConfig cacheConfig) {
        return cacheFallback(CacheFallback.builder(prefix, valueType), cacheConfig);
    }
    
    public <V> CacheFallback<V> cacheFallback(String prefix, TypeReference<V> valueType) {
        return cacheFallback(CacheFallback.builder(prefix, valueType), config.getCacheConfig());
    }
    
    private <V> CacheFallback<V> cacheFallback(CacheFallback.Builder<V> builder, CacheConfig cacheConfig) {
        checkNotClosed();
        return builder
            .config(cacheConfig)
            .sharedStore(sharedStore)
            .objectMapper(objectMapper)
            .executor(revalidationExecutor)
            .clock(clock)
            .listener(listener)
            .build();
    }
    
    public ResilienceConfig getConfig() {
        return config;
    }
    
    public CircuitBreakerRegistry getCircuitBreakers() {
        return circuitBreakers;
    }
    
    public RateLimiter getRateLimiter() {
        return rateLimiter;
    }
    
    public RetryExecutor getRetryExecutor() {
        return retryExecutor;
    }
    
    public ResilienceEventPublisher getEventPublisher() {
        return eventPublisher;
    }
    
    public ResilienceMetrics getMetrics() {
        return metrics;
    }
    
    public Optional<SharedStore> getSharedStore() {
        return Optional.ofNullable(sharedStore);
    }
    
    public boolean isClosed() {
        return closed.get();
    }
    
    private void checkNotClosed() {
        if (closed.get()) {
            throw new IllegalStateException("Resilience toolkit is closed");
        }
    }
    
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        logger.info("Closing resilience toolkit...");
        
        if (ownsRevalidationExecutor) {
            revalidationExecutor.shutdown();
            try {
                if (!revalidationExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                    revalidationExecutor.shutdownNow();
                }
            } catch (InterruptedException e) {
                revalidationExecutor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        
        retryExecutor.close();
        
        if (storeFactory != null) {
            if (sharedStore instanceof AutoCloseable) {
                try {
                    ((AutoCloseable) sharedStore).close();
                } catch (Exception e) {
                    logger.warn("Error closing shared store", e);
                }
            }
            storeFactory.close();
        }
        
        eventPublisher.close();
        logger.info("Resilience toolkit closed");
    }
}
