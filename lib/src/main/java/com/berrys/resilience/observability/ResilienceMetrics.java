package com.berrys.resilience.observability;

import com.berrys.resilience.model.CircuitBreakerState;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Turns resilience events into Micrometer meters.
 */
public class ResilienceMetrics implements ResilienceEventListener {

    private static final Logger logger = LoggerFactory.getLogger(ResilienceMetrics.class);

    private final MeterRegistry meterRegistry;
    private final ConcurrentHashMap<String, AtomicInteger> circuitStates;

    private final Counter degradedChecks;

    public ResilienceMetrics() {
        this(new SimpleMeterRegistry());
    }

    public ResilienceMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.circuitStates = new ConcurrentHashMap<>();

        this.degradedChecks = Counter.builder("resilience.ratelimit.degraded")
            .description("Rate-limit checks answered by local counters because the shared store failed")
            .register(meterRegistry);

        logger.info("Resilience metrics initialized");
    }

    @Override
    public void onEvent(ResilienceEvent event) {
        switch (event.getType()) {
            case RETRY_SCHEDULED -> counter("resilience.retry.attempts", "Retries scheduled", "operation", event.getSource());
            case RETRIES_EXHAUSTED -> counter("resilience.retry.exhausted", "Operations that spent their retry budget",
                "operation", event.getSource());
            case CIRCUIT_STATE_CHANGED -> recordTransition(event);
            case CIRCUIT_CALL_REJECTED -> counter("resilience.circuit.rejected", "Calls rejected by an open circuit",
                "name", event.getSource());
            case RATE_LIMIT_EXCEEDED -> counter("resilience.ratelimit.denied", "Denied rate-limit checks",
                "tier", event.getDetail());
            case RATE_LIMIT_DEGRADED -> degradedChecks.increment();
            case CACHE_HIT -> cacheRequest(event, true);
            case CACHE_MISS -> cacheRequest(event, false);
            case CACHE_FALLBACK -> counter("resilience.cache.fallbacks", "Cached values served after a failed fetch",
                "cache", event.getSource());
            case CACHE_REVALIDATION_FAILED -> counter("resilience.cache.revalidation.failures",
                "Failed background cache refreshes", "cache", event.getSource());
        }
    }

    private void recordTransition(ResilienceEvent event) {
        String name = event.getSource();
        CircuitBreakerState to = event.getToState();

        Counter.builder("resilience.circuit.transitions")
            .tag("name", name)
            .tag("to", String.valueOf(to))
            .description("Circuit breaker state transitions")
            .register(meterRegistry)
            .increment();

        AtomicInteger state = circuitStates.computeIfAbsent(name, key -> {
            AtomicInteger holder = new AtomicInteger();
            Gauge.builder("resilience.circuit.state", holder, AtomicInteger::doubleValue)
                .tag("name", key)
                .description("Circuit breaker state (0 closed, 1 half-open, 2 open)")
                .register(meterRegistry);
            return holder;
        });
        state.set(stateCode(to));
    }

    private void cacheRequest(ResilienceEvent event, boolean hit) {
        Counter.builder("resilience.cache.requests")
            .tag("cache", event.getSource())
            .tag("strategy", String.valueOf(event.getDetail()))
            .tag("hit", String.valueOf(hit))
            .description("Cache lookups by outcome")
            .register(meterRegistry)
            .increment();
    }

    private void counter(String name, String description, String tagKey, String tagValue) {
        Counter.builder(name)
            .tag(tagKey, String.valueOf(tagValue))
            .description(description)
            .register(meterRegistry)
            .increment();
    }

    private static int stateCode(CircuitBreakerState state) {
        if (state == null) {
            return 0;
        }
        return switch (state) {
            case CLOSED -> 0;
            case HALF_OPEN -> 1;
            case OPEN -> 2;
        };
    }

    public MeterRegistry getMeterRegistry() {
        return meterRegistry;
    }
}
