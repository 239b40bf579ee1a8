package com.berrys.resilience.config;

import java.time.Duration;

/**
 * Defaults applied by a cache fallback when a call does not override them.
 */
public class CacheConfig {
    
    private final Duration ttl;
    private final CacheStrategy strategy;
    private final Duration staleRetention;
    
    private CacheConfig(Builder builder) {
        this.ttl = builder.ttl;
        this.strategy = builder.strategy;
        this.staleRetention = builder.staleRetention;
    }
    
    public Duration getTtl() {
        return ttl;
    }
    
    public CacheStrategy getStrategy() {
        return strategy;
    }
    
    /**
     * How long the shared store keeps an entry after it went stale, so stale values
     * remain available to SERVICE_FIRST and STALE_WHILE_REVALIDATE.
     */
    public Duration getStaleRetention() {
        return staleRetention;
    }
    
    public static CacheConfig defaultConfig() {
        return builder().build();
    }
    
    public static Builder builder() {
        return new Builder();
    }
    
    @Override
    public String toString() {
        return String.format("CacheConfig{ttl=%s, strategy=%s, staleRetention=%s}", ttl, strategy, staleRetention);
    }
    
    public static class Builder {
        private Duration ttl = Duration.ofHours(1);
        private CacheStrategy strategy = CacheStrategy.SERVICE_FIRST;
        private Duration staleRetention = Duration.ofHours(24);
        
        public Builder ttl(Duration ttl) {
            this.ttl = ttl;
            return this;
        }
        
        public Builder strategy(CacheStrategy strategy) {
            this.strategy = strategy;
            return this;
        }
        
        public Builder staleRetention(Duration staleRetention) {
            this.staleRetention = staleRetention;
            return this;
        }
        
        public CacheConfig build() {
            if (ttl == null || ttl.isNegative() || ttl.isZero()) {
                throw new IllegalArgumentException("Cache ttl must be positive");
            }
            if (strategy == null) {
                throw new IllegalArgumentException("Cache strategy must be provided");
            }
            if (staleRetention == null || staleRetention.isNegative()) {
                throw new IllegalArgumentException("staleRetention must be a non-negative duration");
            }
            return new CacheConfig(this);
        }
    }
}
