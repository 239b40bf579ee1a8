package com.berrys.resilience.ratelimit;

import com.berrys.resilience.config.RateLimitConfig;
import com.berrys.resilience.config.ResilienceConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Named rate-limit tiers. Lookups of unknown tiers resolve to the {@code default} tier.
 */
public class RateLimitTiers {
    
    private static final Logger logger = LoggerFactory.getLogger(RateLimitTiers.class);
    
    private final Map<String, RateLimitConfig> tiers;
    
    public RateLimitTiers() {
        this(ResilienceConfig.defaultTiers());
    }
    
    public RateLimitTiers(Map<String, RateLimitConfig> initialTiers) {
        if (!initialTiers.containsKey(ResilienceConfig.DEFAULT_TIER)) {
            throw new IllegalArgumentException("A '" + ResilienceConfig.DEFAULT_TIER + "' rate-limit tier is required");
        }
        this.tiers = new ConcurrentHashMap<>(initialTiers);
    }
    
    public RateLimitConfig resolve(String tier) {
        RateLimitConfig config = tier != null ? tiers.get(tier) : null;
        if (config == null) {
            logger.debug("Unknown rate-limit tier '{}', using '{}'", tier, ResilienceConfig.DEFAULT_TIER);
            return tiers.get(ResilienceConfig.DEFAULT_TIER);
        }
        return config;
    }
    
    /**
     * Adds a tier or replaces the tier with the same name.
     */
    public void addTier(String name, int requests, int windowSeconds) {
        addTier(RateLimitConfig.of(name, requests, windowSeconds));
    }
    
    public void addTier(RateLimitConfig config) {
        tiers.put(config.getTier(), config);
        logger.info("Rate-limit tier '{}' set to {} requests per {}s",
            config.getTier(), config.getRequests(), config.getWindowSeconds());
    }
    
    public Map<String, RateLimitConfig> getTiers() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(tiers));
    }
}
