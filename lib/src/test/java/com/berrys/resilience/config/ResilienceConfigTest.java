package com.berrys.resilience.config;

import com.berrys.resilience.error.ErrorKind;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.EnumSet;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ResilienceConfig defaults, builders and property loading.
 */
class ResilienceConfigTest {
    
    @Test
    void testDefaultConfiguration() {
        ResilienceConfig config = ResilienceConfig.defaultConfig();
        
        RetryPolicy retry = config.getRetryPolicy();
        assertEquals(3, retry.getMaxRetries());
        assertEquals(Duration.ofMillis(500), retry.getBaseDelay());
        assertEquals(Duration.ofSeconds(30), retry.getMaxDelay());
        assertEquals(0.1, retry.getJitterFactor());
        assertTrue(retry.getRetryOn().isEmpty());
        
        CircuitBreakerConfig breaker = config.getCircuitBreakerConfig();
        assertEquals(5, breaker.getFailureThreshold());
        assertEquals(Duration.ofSeconds(60), breaker.getRecoveryTimeout());
        assertEquals(Duration.ofSeconds(300), breaker.getResetTimeout());
        
        assertEquals(Duration.ofHours(1), config.getCacheConfig().getTtl());
        assertEquals(CacheStrategy.SERVICE_FIRST, config.getCacheConfig().getStrategy());
    }
    
    @Test
    void testDefaultTiers() {
        var tiers = ResilienceConfig.defaultConfig().getRateLimitTiers();
        
        assertEquals(50, tiers.get("low").getRequests());
        assertEquals(100, tiers.get("default").getRequests());
        assertEquals(200, tiers.get("high").getRequests());
        assertEquals(500, tiers.get("critical").getRequests());
        assertEquals(100000, tiers.get("unlimited").getRequests());
        tiers.values().forEach(tier -> assertEquals(60, tier.getWindowSeconds()));
    }
    
    @Test
    void testFromProperties() {
        Properties properties = new Properties();
        properties.setProperty("retry.max-retries", "1");
        properties.setProperty("retry.jitter-factor", "0.25");
        properties.setProperty("breaker.recovery-timeout-seconds", "15");
        properties.setProperty("rate-limit.tiers.batch.requests", "5");
        properties.setProperty("cache.strategy", "CACHE_FIRST");
        
        ResilienceConfig config = ResilienceConfig.fromProperties(properties);
        
        assertEquals(1, config.getRetryPolicy().getMaxRetries());
        assertEquals(0.25, config.getRetryPolicy().getJitterFactor());
        assertEquals(Duration.ofSeconds(15), config.getCircuitBreakerConfig().getRecoveryTimeout());
        assertEquals(5, config.getRateLimitTiers().get("batch").getRequests());
        assertEquals(60, config.getRateLimitTiers().get("batch").getWindowSeconds());
        assertEquals(CacheStrategy.CACHE_FIRST, config.getCacheConfig().getStrategy());
    }
    
    @Test
    void testFromPropertiesRejectsBadValues() {
        Properties badNumber = new Properties();
        badNumber.setProperty("retry.max-retries", "three");
        assertThrows(IllegalArgumentException.class, () -> ResilienceConfig.fromProperties(badNumber));
        
        Properties badKind = new Properties();
        badKind.setProperty("retry.retry-on", "unavailable,flaky");
        assertThrows(IllegalArgumentException.class, () -> ResilienceConfig.fromProperties(badKind));
        
        Properties badJitter = new Properties();
        badJitter.setProperty("retry.jitter-factor", "1.5");
        assertThrows(IllegalArgumentException.class, () -> ResilienceConfig.fromProperties(badJitter));
    }
    
    @Test
    void testLoadFromClasspath() {
        ResilienceConfig config = ResilienceConfig.load();
        
        assertEquals(5, config.getRetryPolicy().getMaxRetries());
        assertEquals(Duration.ofMillis(200), config.getRetryPolicy().getBaseDelay());
        assertEquals(EnumSet.of(ErrorKind.UNAVAILABLE, ErrorKind.TIMEOUT), config.getRetryPolicy().getRetryOn());
        assertEquals(3, config.getCircuitBreakerConfig().getFailureThreshold());
        assertEquals(20, config.getRateLimitTiers().get("partner").getRequests());
        assertEquals(30, config.getRateLimitTiers().get("partner").getWindowSeconds());
        assertEquals(250, config.getRateLimitTiers().get("high").getRequests());
        assertEquals(100, config.getRateLimitTiers().get("default").getRequests());
        assertEquals(Duration.ofMinutes(2), config.getCacheConfig().getTtl());
        assertEquals(CacheStrategy.STALE_WHILE_REVALIDATE, config.getCacheConfig().getStrategy());
    }
    
    @Test
    void testLoadMissingResourceUsesDefaults() {
        ResilienceConfig config = ResilienceConfig.load("does-not-exist.properties");
        
        assertEquals(3, config.getRetryPolicy().getMaxRetries());
    }
    
    @Test
    void testBuilderValidation() {
        assertThrows(IllegalArgumentException.class, () -> RetryPolicy.builder().maxRetries(-1).build());
        assertThrows(IllegalArgumentException.class, () -> CircuitBreakerConfig.builder().failureThreshold(0).build());
        assertThrows(IllegalArgumentException.class, () -> RateLimitConfig.of("x", 0, 60));
        assertThrows(IllegalArgumentException.class, () -> CacheConfig.builder().ttl(Duration.ZERO).build());
        assertThrows(IllegalArgumentException.class, () -> StoreEndpoint.builder().port(0).build());
    }
    
    @Test
    void testRetryPolicyRetryability() {
        RetryPolicy everything = RetryPolicy.defaultPolicy();
        RetryPolicy onlyTimeouts = RetryPolicy.builder().retryOn(ErrorKind.TIMEOUT).build();
        
        assertTrue(everything.isRetryable(new IllegalStateException()));
        assertTrue(onlyTimeouts.isRetryable(new java.util.concurrent.TimeoutException()));
        assertFalse(onlyTimeouts.isRetryable(new java.io.IOException()));
    }
    
    @Test
    void testStoreEndpointId() {
        StoreEndpoint endpoint = StoreEndpoint.builder().host("redis.internal").port(6380).database(2).build();
        
        assertEquals("redis.internal:6380/2", endpoint.getId());
    }
}
