package com.berrys.resilience.config;

/**
 * Consistency strategy used by a cache fallback when answering a get-or-fetch.
 */
public enum CacheStrategy {
    
    /**
     * Serve a fresh cached value when there is one; otherwise fetch and cache.
     */
    CACHE_FIRST,
    
    /**
     * Fetch first; if the fetch fails, serve any cached value, fresh or stale.
     */
    SERVICE_FIRST,
    
    /**
     * Serve any cached value immediately and refresh it in the background.
     * Fetches synchronously only when nothing is cached.
     */
    STALE_WHILE_REVALIDATE
}
