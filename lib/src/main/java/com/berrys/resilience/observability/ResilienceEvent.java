package com.berrys.resilience.observability;

import com.berrys.resilience.model.CircuitBreakerState;

import java.time.Instant;

/**
 * Notification emitted by the resilience guards for alerting and metrics.
 * The source is the operation, circuit, rate-limit key or cache prefix the event concerns.
 */
public class ResilienceEvent {
    
    public enum Type {
        RETRY_SCHEDULED,
        RETRIES_EXHAUSTED,
        CIRCUIT_STATE_CHANGED,
        CIRCUIT_CALL_REJECTED,
        RATE_LIMIT_EXCEEDED,
        RATE_LIMIT_DEGRADED,
        CACHE_HIT,
        CACHE_MISS,
        CACHE_FALLBACK,
        CACHE_REVALIDATION_FAILED
    }
    
    private final Type type;
    private final String source;
    private final String detail;
    private final CircuitBreakerState fromState;
    private final CircuitBreakerState toState;
    private final Instant timestamp;
    
    private ResilienceEvent(Type type, String source, String detail,
                            CircuitBreakerState fromState, CircuitBreakerState toState, Instant timestamp) {
        this.type = type;
        this.source = source;
        this.detail = detail;
        this.fromState = fromState;
        this.toState = toState;
        this.timestamp = timestamp;
    }
    
    public static ResilienceEvent of(Type type, String source, String detail, Instant timestamp) {
        return new ResilienceEvent(type, source, detail, null, null, timestamp);
    }
    
    public static ResilienceEvent stateChange(String circuitName, CircuitBreakerState from,
                                              CircuitBreakerState to, Instant timestamp) {
        return new ResilienceEvent(Type.CIRCUIT_STATE_CHANGED, circuitName, from + " -> " + to, from, to, timestamp);
    }
    
    public Type getType() {
        return type;
    }
    
    public String getSource() {
        return source;
    }
    
    public String getDetail() {
        return detail;
    }
    
    /**
     * Previous state, only set on {@link Type#CIRCUIT_STATE_CHANGED}.
     */
    public CircuitBreakerState getFromState() {
        return fromState;
    }
    
    /**
     * New state, only set on {@link Type#CIRCUIT_STATE_CHANGED}.
     */
    public CircuitBreakerState getToState() {
        return toState;
    }
    
    public Instant getTimestamp() {
        return timestamp;
    }
    
    @Override
    public String toString() {
        return String.format("ResilienceEvent{type=%s, source='%s', detail='%s', timestamp=%s}",
            type, source, detail, timestamp);
    }
}
