package com.berrys.resilience.observability;

import com.berrys.resilience.model.CircuitBreakerState;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class ResilienceMetricsTest {
    
    private MeterRegistry meterRegistry;
    private ResilienceMetrics metrics;
    
    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        metrics = new ResilienceMetrics(meterRegistry);
    }
    
    @Test
    void testRetryCounters() {
        metrics.onEvent(event(ResilienceEvent.Type.RETRY_SCHEDULED, "tools.invoke", "attempt=1"));
        metrics.onEvent(event(ResilienceEvent.Type.RETRY_SCHEDULED, "tools.invoke", "attempt=2"));
        metrics.onEvent(event(ResilienceEvent.Type.RETRIES_EXHAUSTED, "tools.invoke", "attempts=3"));
        
        assertEquals(2.0, meterRegistry.get("resilience.retry.attempts").tag("operation", "tools.invoke").counter().count());
        assertEquals(1.0, meterRegistry.get("resilience.retry.exhausted").tag("operation", "tools.invoke").counter().count());
    }
    
    @Test
    void testCircuitTransitionsAndStateGauge() {
        metrics.onEvent(ResilienceEvent.stateChange("memory", CircuitBreakerState.CLOSED, CircuitBreakerState.OPEN, Instant.now()));
        assertEquals(2.0, meterRegistry.get("resilience.circuit.state").tag("name", "memory").gauge().value());
        
        metrics.onEvent(ResilienceEvent.stateChange("memory", CircuitBreakerState.OPEN, CircuitBreakerState.HALF_OPEN, Instant.now()));
        assertEquals(1.0, meterRegistry.get("resilience.circuit.state").tag("name", "memory").gauge().value());
        
        assertEquals(1.0, meterRegistry.get("resilience.circuit.transitions")
            .tag("name", "memory").tag("to", "OPEN").counter().count());
    }
    
    @Test
    void testRateLimitAndCacheCounters() {
        metrics.onEvent(event(ResilienceEvent.Type.RATE_LIMIT_EXCEEDED, "client-a", "high"));
        metrics.onEvent(event(ResilienceEvent.Type.RATE_LIMIT_DEGRADED, "client-a", "SharedStoreException"));
        metrics.onEvent(event(ResilienceEvent.Type.CACHE_HIT, "agents", "CACHE_FIRST"));
        metrics.onEvent(event(ResilienceEvent.Type.CACHE_MISS, "agents", "CACHE_FIRST"));
        metrics.onEvent(event(ResilienceEvent.Type.CACHE_MISS, "agents", "CACHE_FIRST"));
        
        assertEquals(1.0, meterRegistry.get("resilience.ratelimit.denied").tag("tier", "high").counter().count());
        assertEquals(1.0, meterRegistry.get("resilience.ratelimit.degraded").counter().count());
        assertEquals(1.0, meterRegistry.get("resilience.cache.requests")
            .tags("cache", "agents", "strategy", "CACHE_FIRST", "hit", "true").counter().count());
        assertEquals(2.0, meterRegistry.get("resilience.cache.requests")
            .tags("cache", "agents", "strategy", "CACHE_FIRST", "hit", "false").counter().count());
    }
    
    private static ResilienceEvent event(ResilienceEvent.Type type, String source, String detail) {
        return ResilienceEvent.of(type, source, detail, Instant.now());
    }
}
