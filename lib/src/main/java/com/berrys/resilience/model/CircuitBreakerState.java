package com.berrys.resilience.model;

/**
 * Circuit breaker state for a remote dependency.
 */
public enum CircuitBreakerState {
    
    /**
     * Circuit breaker is closed - requests are allowed through and failures are counted.
     */
    CLOSED,
    
    /**
     * Circuit breaker is open - requests are rejected without calling the dependency.
     */
    OPEN,
    
    /**
     * Circuit breaker is half-open - trial requests are allowed to test recovery.
     */
    HALF_OPEN
}
