package com.berrys.resilience.ratelimit;

import com.berrys.resilience.config.RateLimitConfig;
import com.berrys.resilience.model.RateLimitInfo;

import java.time.Instant;

/**
 * Records one request for a key and decides whether it is within the tier's limit.
 */
interface RateLimitBackend {
    
    RateLimitInfo record(String key, RateLimitConfig config, Instant now);
}
