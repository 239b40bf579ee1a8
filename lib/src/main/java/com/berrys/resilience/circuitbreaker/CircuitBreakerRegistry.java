package com.berrys.resilience.circuitbreaker;

import com.berrys.resilience.config.CircuitBreakerConfig;
import com.berrys.resilience.observability.ResilienceEventListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Holds one circuit breaker per dependency name so every caller of a dependency
 * observes the same state. Owned by application start-up and passed to clients.
 */
public class CircuitBreakerRegistry {
    
    private static final Logger logger = LoggerFactory.getLogger(CircuitBreakerRegistry.class);
    
    private final ConcurrentMap<String, CircuitBreaker> circuitBreakers;
    private final CircuitBreakerConfig defaultConfig;
    private final Clock clock;
    private final ResilienceEventListener listener;
    
    public CircuitBreakerRegistry() {
        this(CircuitBreakerConfig.defaultConfig(), Clock.systemUTC(), ResilienceEventListener.NO_OP);
    }
    
    public CircuitBreakerRegistry(CircuitBreakerConfig defaultConfig, Clock clock, ResilienceEventListener listener) {
        this.circuitBreakers = new ConcurrentHashMap<>();
        this.defaultConfig = defaultConfig;
        this.clock = clock;
        this.listener = listener;
    }
    
    /**
     * Get or create a circuit breaker with the registry's default configuration.
     */
    public CircuitBreaker getOrCreate(String name) {
        return getOrCreate(name, null);
    }
    
    /**
     * Get or create a circuit breaker. The configuration is only used when the breaker
     * does not exist yet.
     */
    public CircuitBreaker getOrCreate(String name, CircuitBreakerConfig config) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Circuit breaker name must not be blank");
        }
        return circuitBreakers.computeIfAbsent(name, key -> {
            CircuitBreakerConfig effective = config != null ? config : defaultConfig;
            logger.debug("Created circuit breaker '{}' with {}", key, effective);
            return new CircuitBreaker(key, effective, clock, listener);
        });
    }
    
    public Optional<CircuitBreaker> find(String name) {
        return Optional.ofNullable(circuitBreakers.get(name));
    }
    
    /**
     * Snapshot of all registered circuit breakers.
     */
    public Map<String, CircuitBreaker> getAll() {
        return Map.copyOf(circuitBreakers);
    }
    
    public void resetAll() {
        circuitBreakers.values().forEach(CircuitBreaker::reset);
    }
    
    public int size() {
        return circuitBreakers.size();
    }
}
