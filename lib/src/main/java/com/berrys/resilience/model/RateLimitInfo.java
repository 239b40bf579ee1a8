package com.berrys.resilience.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of a rate-limit check for one key.
 */
public final class RateLimitInfo {
    
    private final boolean allowed;
    private final String tier;
    private final int limit;
    private final long remaining;
    private final long resetSeconds;
    private final int windowSeconds;
    private final boolean degraded;
    
    public RateLimitInfo(boolean allowed, String tier, int limit, long remaining,
                         long resetSeconds, int windowSeconds, boolean degraded) {
        this.allowed = allowed;
        this.tier = tier;
        this.limit = limit;
        this.remaining = remaining;
        this.resetSeconds = resetSeconds;
        this.windowSeconds = windowSeconds;
        this.degraded = degraded;
    }
    
    public boolean isAllowed() {
        return allowed;
    }
    
    public String getTier() {
        return tier;
    }
    
    public int getLimit() {
        return limit;
    }
    
    public long getRemaining() {
        return remaining;
    }
    
    /**
     * Seconds until the window frees capacity again.
     */
    public long getResetSeconds() {
        return resetSeconds;
    }
    
    public int getWindowSeconds() {
        return windowSeconds;
    }
    
    /**
     * True when the decision came from per-process counters instead of the shared store.
     */
    public boolean isDegraded() {
        return degraded;
    }
    
    /**
     * Standard rate-limit response headers for boundary code.
     * {@code Retry-After} is only present on denied checks.
     */
    public Map<String, String> toHeaders() {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("X-RateLimit-Limit", String.valueOf(limit));
        headers.put("X-RateLimit-Remaining", String.valueOf(remaining));
        headers.put("X-RateLimit-Reset", String.valueOf(resetSeconds));
        if (!allowed) {
            headers.put("Retry-After", String.valueOf(resetSeconds));
        }
        return Collections.unmodifiableMap(headers);
    }
    
    @Override
    public String toString() {
        return String.format("RateLimitInfo{allowed=%s, tier='%s', limit=%d, remaining=%d, reset=%ds, window=%ds, degraded=%s}",
            allowed, tier, limit, remaining, resetSeconds, windowSeconds, degraded);
    }
}
