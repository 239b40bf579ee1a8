package com.berrys.resilience.circuitbreaker;

import com.berrys.resilience.RemoteCall;
import com.berrys.resilience.config.CircuitBreakerConfig;
import com.berrys.resilience.error.CircuitOpenException;
import com.berrys.resilience.model.CircuitBreakerState;
import com.berrys.resilience.observability.ResilienceEvent;
import com.berrys.resilience.observability.ResilienceEventListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.function.Supplier;

/**
 * Per-dependency circuit breaker.
 *
 * <ul>
 *   <li>CLOSED: requests pass, failures are counted; reaching the failure threshold opens the circuit.</li>
 *   <li>OPEN: requests are rejected; once the recovery timeout has elapsed the next
 *       {@link #allowRequest()} moves the circuit to HALF_OPEN and lets the request through.</li>
 *   <li>HALF_OPEN: requests pass as trial calls; a success closes the circuit, a failure reopens it.</li>
 * </ul>
 *
 * <p>HALF_OPEN admits every concurrent trial call rather than exactly one.
 * State is guarded by the instance monitor. The monitor is never held while an operation runs
 * or while listeners are notified of a transition, so concurrent transitions may reach
 * listeners out of order.
 */
public class CircuitBreaker {
    
    private static final Logger logger = LoggerFactory.getLogger(CircuitBreaker.class);
    
    private final String name;
    private final CircuitBreakerConfig config;
    private final Clock clock;
    private final ResilienceEventListener listener;
    
    private CircuitBreakerState state = CircuitBreakerState.CLOSED;
    private int failureCount;
    private Instant lastFailureTime;
    private Instant lastSuccessTime;
    private Instant lastStateChangeTime;
    
    public CircuitBreaker(String name, CircuitBreakerConfig config) {
        this(name, config, Clock.systemUTC(), ResilienceEventListener.NO_OP);
    }
    
    public CircuitBreaker(String name, CircuitBreakerConfig config, Clock clock, ResilienceEventListener listener) {
        this.name = name;
        this.config = config != null ? config : CircuitBreakerConfig.defaultConfig();
        this.clock = clock;
        this.listener = listener;
        this.lastStateChangeTime = clock.instant();
    }
    
    public void recordSuccess() {
        publish(onSuccess());
    }
    
    public void recordFailure() {
        publish(onFailure());
    }
    
    /**
     * Whether a request may proceed. In OPEN this also performs the transition to
     * HALF_OPEN once the recovery timeout has elapsed.
     */
    public boolean allowRequest() {
        Transition transition;
        boolean allowed;
        synchronized (this) {
            if (state != CircuitBreakerState.OPEN) {
                transition = null;
                allowed = true;
            } else {
                Instant now = clock.instant();
                allowed = Duration.between(lastStateChangeTime, now).compareTo(config.getRecoveryTimeout()) > 0;
                transition = allowed ? changeState(CircuitBreakerState.HALF_OPEN, now) : null;
            }
        }
        publish(transition);
        return allowed;
    }
    
    private synchronized Transition onSuccess() {
        Instant now = clock.instant();
        lastSuccessTime = now;
        
        if (state == CircuitBreakerState.HALF_OPEN) {
            return changeState(CircuitBreakerState.CLOSED, now);
        }
        if (state == CircuitBreakerState.CLOSED
                && lastFailureTime != null
                && Duration.between(lastFailureTime, now).compareTo(config.getResetTimeout()) > 0) {
            failureCount = 0;
        }
        return null;
    }
    
    private synchronized Transition onFailure() {
        Instant now = clock.instant();
        lastFailureTime = now;
        
        if (state == CircuitBreakerState.CLOSED) {
            failureCount++;
            if (failureCount >= config.getFailureThreshold()) {
                return changeState(CircuitBreakerState.OPEN, now);
            }
        } else if (state == CircuitBreakerState.HALF_OPEN) {
            return changeState(CircuitBreakerState.OPEN, now);
        }
        return null;
    }
    
    public <T> T execute(RemoteCall<T> operation) throws Exception {
        return execute(operation, null);
    }
    
    /**
     * Runs the operation under circuit protection.
     *
     * @throws CircuitOpenException if the circuit rejects the request; the operation is not invoked
     * @throws Exception the operation's own failure, unchanged, after it has been recorded
     */
    public <T> T execute(RemoteCall<T> operation, String operationName) throws Exception {
        String operationDesc = operationName != null ? operationName : "operation";
        
        if (!allowRequest()) {
            throw reject(operationDesc);
        }
        
        T result;
        try {
            result = operation.call();
        } catch (Exception e) {
            logger.error("Operation {} failed with circuit breaker '{}': {}", operationDesc, name, e.getMessage());
            recordFailure();
            throw e;
        }
        recordSuccess();
        return result;
    }
    
    /**
     * Non-blocking variant of {@link #execute(RemoteCall, String)}. The permission check
     * happens on subscription.
     */
    public <T> Mono<T> executeReactive(Supplier<? extends Mono<T>> operation, String operationName) {
        String operationDesc = operationName != null ? operationName : "operation";
        
        return Mono.defer(() -> {
            if (!allowRequest()) {
                return Mono.<T>error(reject(operationDesc));
            }
            return Mono.<T>defer(operation)
                .doOnSuccess(result -> recordSuccess())
                .doOnError(error -> {
                    logger.error("Operation {} failed with circuit breaker '{}': {}",
                        operationDesc, name, error.getMessage());
                    recordFailure();
                });
        });
    }
    
    /**
     * Forces the circuit back to CLOSED with a cleared failure count.
     */
    public void reset() {
        Transition transition;
        synchronized (this) {
            transition = changeState(CircuitBreakerState.CLOSED, clock.instant());
            failureCount = 0;
        }
        publish(transition);
        logger.info("Circuit breaker '{}' has been reset", name);
    }
    
    private CircuitOpenException reject(String operationDesc) {
        logger.warn("Circuit breaker '{}' is open, rejecting {}", name, operationDesc);
        listener.onEvent(ResilienceEvent.of(ResilienceEvent.Type.CIRCUIT_CALL_REJECTED, name, operationDesc,
            clock.instant()));
        return new CircuitOpenException(name);
    }
    
    /**
     * Applies a state change under the monitor. Returns the transition to report once the
     * monitor is released, or null when the state is unchanged.
     */
    private Transition changeState(CircuitBreakerState newState, Instant now) {
        if (state == newState) {
            return null;
        }
        CircuitBreakerState previous = state;
        state = newState;
        lastStateChangeTime = now;
        if (newState == CircuitBreakerState.CLOSED) {
            failureCount = 0;
        }
        return new Transition(previous, newState, now);
    }
    
    // Listeners may call back into this or other breakers, so never under the monitor.
    private void publish(Transition transition) {
        if (transition == null) {
            return;
        }
        logger.info("Circuit breaker '{}' state changed from {} to {}", name, transition.from, transition.to);
        listener.onEvent(ResilienceEvent.stateChange(name, transition.from, transition.to, transition.at));
    }
    
    private static final class Transition {
        private final CircuitBreakerState from;
        private final CircuitBreakerState to;
        private final Instant at;
        
        private Transition(CircuitBreakerState from, CircuitBreakerState to, Instant at) {
            this.from = from;
            this.to = to;
            this.at = at;
        }
    }
    
    public String getName() {
        return name;
    }
    
    public CircuitBreakerConfig getConfig() {
        return config;
    }
    
    public synchronized CircuitBreakerState getState() {
        return state;
    }
    
    public synchronized int getFailureCount() {
        return failureCount;
    }
    
    public synchronized Instant getLastFailureTime() {
        return lastFailureTime;
    }
    
    public synchronized Instant getLastSuccessTime() {
        return lastSuccessTime;
    }
    
    public synchronized Instant getLastStateChangeTime() {
        return lastStateChangeTime;
    }
    
    @Override
    public String toString() {
        return String.format("CircuitBreaker{name='%s', state=%s, failureCount=%d}", name, getState(), getFailureCount());
    }
}
