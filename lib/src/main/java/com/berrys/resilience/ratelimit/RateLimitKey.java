package com.berrys.resilience.ratelimit;

/**
 * Builds rate-limit keys.
 */
public final class RateLimitKey {
    
    private RateLimitKey() {
    }
    
    /**
     * Key for a client calling a resource under a tier: {@code ratelimit:<tier>:<client>:<resource>}.
     */
    public static String forClient(String clientId, String resource, String tier) {
        if (clientId == null || clientId.isBlank()) {
            throw new IllegalArgumentException("clientId must not be blank");
        }
        String effectiveTier = tier != null ? tier : "default";
        String effectiveResource = resource != null ? resource : "*";
        return "ratelimit:" + effectiveTier + ":" + clientId + ":" + effectiveResource;
    }
}
