package com.berrys.resilience.config;

import java.time.Duration;

/**
 * Circuit breaker configuration for a remote dependency.
 */
public class CircuitBreakerConfig {
    
    private final int failureThreshold;
    private final Duration recoveryTimeout;
    private final Duration resetTimeout;
    
    private CircuitBreakerConfig(Builder builder) {
        this.failureThreshold = builder.failureThreshold;
        this.recoveryTimeout = builder.recoveryTimeout;
        this.resetTimeout = builder.resetTimeout;
    }
    
    /**
     * Number of counted failures that opens the circuit.
     */
    public int getFailureThreshold() {
        return failureThreshold;
    }
    
    /**
     * Time the circuit stays open before a trial request is let through.
     */
    public Duration getRecoveryTimeout() {
        return recoveryTimeout;
    }
    
    /**
     * Quiet period after which a success clears the failure count of a closed circuit.
     */
    public Duration getResetTimeout() {
        return resetTimeout;
    }
    
    public static CircuitBreakerConfig defaultConfig() {
        return builder().build();
    }
    
    public static Builder builder() {
        return new Builder();
    }
    
    @Override
    public String toString() {
        return String.format("CircuitBreakerConfig{failureThreshold=%d, recoveryTimeout=%s, resetTimeout=%s}",
            failureThreshold, recoveryTimeout, resetTimeout);
    }
    
    public static class Builder {
        private int failureThreshold = 5;
        private Duration recoveryTimeout = Duration.ofSeconds(60);
        private Duration resetTimeout = Duration.ofSeconds(300);
        
        public Builder failureThreshold(int threshold) {
            this.failureThreshold = threshold;
            return this;
        }
        
        public Builder recoveryTimeout(Duration timeout) {
            this.recoveryTimeout = timeout;
            return this;
        }
        
        public Builder resetTimeout(Duration timeout) {
            this.resetTimeout = timeout;
            return this;
        }
        
        public CircuitBreakerConfig build() {
            if (failureThreshold < 1) {
                throw new IllegalArgumentException("failureThreshold must be at least 1: " + failureThreshold);
            }
            if (recoveryTimeout == null || recoveryTimeout.isNegative()) {
                throw new IllegalArgumentException("recoveryTimeout must be a non-negative duration");
            }
            if (resetTimeout == null || resetTimeout.isNegative()) {
                throw new IllegalArgumentException("resetTimeout must be a non-negative duration");
            }
            return new CircuitBreakerConfig(this);
        }
    }
}
