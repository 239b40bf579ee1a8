package com.berrys.resilience.config;

import com.berrys.resilience.error.ErrorKind;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.RetryConfig;

import java.time.Duration;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Retry behavior for a single call: attempt budget, exponential backoff bounds,
 * jitter and the error kinds that are worth retrying.
 */
public class RetryPolicy {
    
    private final int maxRetries;
    private final Duration baseDelay;
    private final Duration maxDelay;
    private final double jitterFactor;
    private final Set<ErrorKind> retryOn;
    
    private RetryPolicy(Builder builder) {
        this.maxRetries = builder.maxRetries;
        this.baseDelay = builder.baseDelay;
        this.maxDelay = builder.maxDelay;
        this.jitterFactor = builder.jitterFactor;
        this.retryOn = builder.retryOn.isEmpty()
            ? Collections.emptySet()
            : Collections.unmodifiableSet(EnumSet.copyOf(builder.retryOn));
    }
    
    public int getMaxRetries() {
        return maxRetries;
    }
    
    public Duration getBaseDelay() {
        return baseDelay;
    }
    
    public Duration getMaxDelay() {
        return maxDelay;
    }
    
    public double getJitterFactor() {
        return jitterFactor;
    }
    
    /**
     * Error kinds that trigger a retry. Empty means every failure is retried.
     */
    public Set<ErrorKind> getRetryOn() {
        return retryOn;
    }
    
    public boolean isRetryable(Throwable error) {
        return retryOn.isEmpty() || retryOn.contains(ErrorKind.of(error));
    }
    
    /**
     * Exponential backoff doubling from the base delay, capped at the maximum delay, then
     * randomized by the jitter factor. Takes the 1-indexed retry number, returns milliseconds.
     */
    public IntervalFunction intervalFunction() {
        long base = baseDelay.toMillis();
        long max = maxDelay.toMillis();
        if (jitterFactor == 0.0) {
            return IntervalFunction.ofExponentialBackoff(base, 2.0, max);
        }
        return IntervalFunction.ofExponentialRandomBackoff(base, 2.0, jitterFactor, max);
    }
    
    /**
     * Resilience4j configuration equivalent to this policy: {@code maxRetries + 1} attempts.
     */
    public RetryConfig toRetryConfig() {
        return RetryConfig.custom()
            .maxAttempts(maxRetries + 1)
            .intervalFunction(intervalFunction())
            .retryOnException(this::isRetryable)
            .build();
    }
    
    public static RetryPolicy defaultPolicy() {
        return builder().build();
    }
    
    public static Builder builder() {
        return new Builder();
    }
    
    /**
     * Starts a builder pre-filled with this policy's values.
     */
    public Builder toBuilder() {
        return new Builder()
            .maxRetries(maxRetries)
            .baseDelay(baseDelay)
            .maxDelay(maxDelay)
            .jitterFactor(jitterFactor)
            .retryOn(retryOn);
    }
    
    @Override
    public String toString() {
        return String.format("RetryPolicy{maxRetries=%d, baseDelay=%s, maxDelay=%s, jitterFactor=%.2f, retryOn=%s}",
            maxRetries, baseDelay, maxDelay, jitterFactor, retryOn);
    }
    
    public static class Builder {
        private int maxRetries = 3;
        private Duration baseDelay = Duration.ofMillis(500);
        private Duration maxDelay = Duration.ofSeconds(30);
        private double jitterFactor = 0.1;
        private Set<ErrorKind> retryOn = EnumSet.noneOf(ErrorKind.class);
        
        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }
        
        public Builder baseDelay(Duration baseDelay) {
            this.baseDelay = baseDelay;
            return this;
        }
        
        public Builder maxDelay(Duration maxDelay) {
            this.maxDelay = maxDelay;
            return this;
        }
        
        public Builder jitterFactor(double jitterFactor) {
            this.jitterFactor = jitterFactor;
            return this;
        }
        
        public Builder retryOn(ErrorKind... kinds) {
            this.retryOn = EnumSet.noneOf(ErrorKind.class);
            Collections.addAll(this.retryOn, kinds);
            return this;
        }
        
        public Builder retryOn(Collection<ErrorKind> kinds) {
            this.retryOn = EnumSet.noneOf(ErrorKind.class);
            this.retryOn.addAll(kinds);
            return this;
        }
        
        public RetryPolicy build() {
            if (maxRetries < 0) {
                throw new IllegalArgumentException("maxRetries must not be negative: " + maxRetries);
            }
            if (baseDelay == null || baseDelay.toMillis() < 1) {
                throw new IllegalArgumentException("baseDelay must be at least 1 ms");
            }
            if (maxDelay == null || maxDelay.toMillis() < 1) {
                throw new IllegalArgumentException("maxDelay must be at least 1 ms");
            }
            if (jitterFactor < 0.0 || jitterFactor >= 1.0) {
                throw new IllegalArgumentException("jitterFactor must be at least 0.0 and below 1.0: " + jitterFactor);
            }
            return new RetryPolicy(this);
        }
    }
}
