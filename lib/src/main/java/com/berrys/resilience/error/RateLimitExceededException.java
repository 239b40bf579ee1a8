package com.berrys.resilience.error;

import com.berrys.resilience.model.RateLimitInfo;

/**
 * Signals a denied rate-limit check. Callers translate it into a user-visible response.
 */
public class RateLimitExceededException extends ServiceException {

    private final String key;
    private final RateLimitInfo info;

    public RateLimitExceededException(String key, RateLimitInfo info) {
        super(key, ErrorKind.RATE_LIMITED, String.format(
                "Rate limit exceeded for '%s' (tier %s: %d requests per %ds, retry in %ds)",
                key, info.getTier(), info.getLimit(), info.getWindowSeconds(), info.getResetSeconds()));
        this.key = key;
        this.info = info;
    }

    public String getKey() {
        return key;
    }

    public RateLimitInfo getInfo() {
        return info;
    }
}
