package com.berrys.resilience.config;

import java.time.Duration;

/**
 * A named rate-limit tier: how many requests a key may make per sliding window.
 */
public class RateLimitConfig {
    
    private final String tier;
    private final int requests;
    private final int windowSeconds;
    
    public RateLimitConfig(String tier, int requests, int windowSeconds) {
        if (tier == null || tier.isBlank()) {
            throw new IllegalArgumentException("Tier name must not be blank");
        }
        if (requests < 1) {
            throw new IllegalArgumentException("requests must be positive: " + requests);
        }
        if (windowSeconds < 1) {
            throw new IllegalArgumentException("windowSeconds must be positive: " + windowSeconds);
        }
        this.tier = tier;
        this.requests = requests;
        this.windowSeconds = windowSeconds;
    }
    
    public static RateLimitConfig of(String tier, int requests, int windowSeconds) {
        return new RateLimitConfig(tier, requests, windowSeconds);
    }
    
    public String getTier() {
        return tier;
    }
    
    public int getRequests() {
        return requests;
    }
    
    public int getWindowSeconds() {
        return windowSeconds;
    }
    
    public Duration getWindow() {
        return Duration.ofSeconds(windowSeconds);
    }
    
    @Override
    public String toString() {
        return String.format("RateLimitConfig{tier='%s', requests=%d, window=%ds}", tier, requests, windowSeconds);
    }
}
