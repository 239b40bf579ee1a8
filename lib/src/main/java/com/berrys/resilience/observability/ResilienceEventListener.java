package com.berrys.resilience.observability;

import java.util.List;

/**
 * Callback for resilience events: circuit transitions, retry exhaustion,
 * rate-limit denials and cache fallbacks.
 */
@FunctionalInterface
public interface ResilienceEventListener {
    
    ResilienceEventListener NO_OP = event -> { };
    
    /**
     * Called synchronously by the guard that produced the event; implementations must not block.
     */
    void onEvent(ResilienceEvent event);
    
    /**
     * Fans an event out to several listeners in order.
     */
    static ResilienceEventListener composite(ResilienceEventListener... listeners) {
        List<ResilienceEventListener> targets = List.of(listeners);
        return event -> targets.forEach(listener -> listener.onEvent(event));
    }
}
