package com.berrys.resilience.cache;

import com.berrys.resilience.config.CacheConfig;
import com.berrys.resilience.config.CacheStrategy;
import com.berrys.resilience.model.CacheEntry;
import com.berrys.resilience.model.CacheResult;
import com.berrys.resilience.observability.ResilienceEvent;
import com.berrys.resilience.support.InMemorySharedStore;
import com.berrys.resilience.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class CacheFallbackTest {
    
    private MutableClock clock;
    private InMemorySharedStore store;
    private List<Runnable> backgroundTasks;
    private List<ResilienceEvent> events;
    private CacheFallback<String> cache;
    
    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt(1_700_000_000L);
        store = new InMemorySharedStore();
        backgroundTasks = new ArrayList<>();
        events = new ArrayList<>();
        cache = newCache(CacheStrategy.CACHE_FIRST);
    }
    
    private CacheFallback<String> newCache(CacheStrategy strategy) {
        return CacheFallback.builder("agents", String.class)
            .config(CacheConfig.builder().strategy(strategy).build())
            .sharedStore(store)
            .executor(backgroundTasks::add)
            .clock(clock)
            .listener(events::add)
            .build();
    }
    
    @Test
    void testSetThenGetReturnsValue() {
        cache.set("agent-1", "planner", Duration.ofSeconds(10));
        
        assertEquals(Optional.of("planner"), cache.get("agent-1"));
    }
    
    @Test
    void testStaleEntryIsMissForCacheFirstButStillReadable() throws Exception {
        cache.set("agent-1", "planner", Duration.ofSeconds(10));
        clock.advance(Duration.ofSeconds(10));
        
        assertTrue(cache.get("agent-1").isEmpty());
        Optional<CacheEntry<String>> stale = cache.peek("agent-1");
        assertTrue(stale.isPresent());
        assertEquals("planner", stale.get().getValue());
        
        CacheResult<String> result = cache.getOrFetch("agent-1", () -> "planner-v2");
        assertFalse(result.isFromCache());
        assertEquals("planner-v2", result.getValue());
        assertEquals(Optional.of("planner-v2"), cache.get("agent-1"));
    }
    
    @Test
    void testCacheFirstServesFreshValueWithoutFetching() throws Exception {
        cache.set("agent-1", "planner");
        AtomicInteger fetches = new AtomicInteger();
        
        CacheResult<String> result = cache.getOrFetch("agent-1", () -> {
            fetches.incrementAndGet();
            return "other";
        });
        
        assertTrue(result.isFromCache());
        assertEquals("planner", result.getValue());
        assertEquals(0, fetches.get());
    }
    
    @Test
    void testCacheFirstPropagatesFetchErrorWhenNothingFresh() {
        IOException failure = new IOException("registry down");
        
        IOException thrown = assertThrows(IOException.class, () -> cache.getOrFetch("agent-1", () -> {
            throw failure;
        }));
        
        assertSame(failure, thrown);
    }
    
    @Test
    void testServiceFirstPrefersFetchAndFallsBackToStaleValue() throws Exception {
        CacheFallback<String> serviceFirst = newCache(CacheStrategy.SERVICE_FIRST);
        serviceFirst.set("agent-1", "planner", Duration.ofSeconds(10));
        
        CacheResult<String> fetched = serviceFirst.getOrFetch("agent-1", () -> "planner-v2");
        assertFalse(fetched.isFromCache());
        assertEquals("planner-v2", fetched.getValue());
        
        clock.advance(Duration.ofHours(2));
        CacheResult<String> fallback = serviceFirst.getOrFetch("agent-1", () -> {
            throw new IOException("registry down");
        });
        
        assertTrue(fallback.isFromCache());
        assertEquals("planner-v2", fallback.getValue());
        assertTrue(events.stream().anyMatch(e -> e.getType() == ResilienceEvent.Type.CACHE_FALLBACK));
    }
    
    @Test
    void testServiceFirstWithoutEntryPropagatesFetchErrorType() {
        CacheFallback<String> serviceFirst = newCache(CacheStrategy.SERVICE_FIRST);
        
        assertThrows(IllegalStateException.class, () -> serviceFirst.getOrFetch("missing", () -> {
            throw new IllegalStateException("boom");
        }));
    }
    
    @Test
    void testStaleWhileRevalidateReturnsStaleAndSchedulesOneRefresh() throws Exception {
        CacheFallback<String> swr = newCache(CacheStrategy.STALE_WHILE_REVALIDATE);
        swr.set("agent-1", "planner", Duration.ofSeconds(10));
        clock.advance(Duration.ofSeconds(30));
        AtomicInteger fetches = new AtomicInteger();
        
        CacheResult<String> result = swr.getOrFetch("agent-1", () -> {
            fetches.incrementAndGet();
            return "planner-v2";
        });
        
        assertTrue(result.isFromCache());
        assertEquals("planner", result.getValue());
        assertEquals(0, fetches.get());
        assertEquals(1, backgroundTasks.size());
        
        backgroundTasks.get(0).run();
        
        assertEquals(1, fetches.get());
        assertEquals(Optional.of("planner-v2"), swr.get("agent-1"));
    }
    
    @Test
    void testStaleWhileRevalidateFetchesSynchronouslyWhenEmpty() throws Exception {
        CacheFallback<String> swr = newCache(CacheStrategy.STALE_WHILE_REVALIDATE);
        
        CacheResult<String> result = swr.getOrFetch("agent-1", () -> "planner");
        
        assertFalse(result.isFromCache());
        assertEquals("planner", result.getValue());
        assertTrue(backgroundTasks.isEmpty());
    }
    
    @Test
    void testFailedRevalidationKeepsEntryAndPublishesEvent() throws Exception {
        CacheFallback<String> swr = newCache(CacheStrategy.STALE_WHILE_REVALIDATE);
        swr.set("agent-1", "planner", Duration.ofSeconds(10));
        clock.advance(Duration.ofSeconds(30));
        
        swr.getOrFetch("agent-1", () -> {
            throw new IOException("still down");
        });
        backgroundTasks.get(0).run();
        
        assertEquals("planner", swr.peek("agent-1").orElseThrow().getValue());
        assertTrue(events.stream().anyMatch(e -> e.getType() == ResilienceEvent.Type.CACHE_REVALIDATION_FAILED));
    }
    
    @Test
    void testPerCallStrategyOverridesDefault() throws Exception {
        cache.set("agent-1", "planner");
        
        CacheResult<String> result = cache.getOrFetch("agent-1", () -> "fresh", CacheStrategy.SERVICE_FIRST);
        
        assertFalse(result.isFromCache());
        assertEquals("fresh", result.getValue());
    }
    
    @Test
    void testSharedStoreEntryCarriesStaleRetention() {
        cache.set("agent-1", "planner", Duration.ofSeconds(10));
        
        assertEquals(Duration.ofSeconds(10).plus(Duration.ofHours(24)), store.ttlOf("agents:agent-1"));
        assertTrue(store.rawValue("agents:agent-1").contains("\"data\":\"planner\""));
    }
    
    @Test
    void testSharedStoreFailureFallsBackToLocal() throws Exception {
        cache.set("agent-1", "planner");
        store.setFailing(true);
        
        assertEquals(Optional.of("planner"), cache.get("agent-1"));
        
        cache.set("agent-2", "critic");
        assertEquals(Optional.of("critic"), cache.get("agent-2"));
    }
    
    @Test
    void testNullFetchResultIsNotCached() throws Exception {
        CacheResult<String> result = cache.getOrFetch("agent-1", () -> null);
        
        assertNull(result.getValue());
        assertFalse(result.isFromCache());
        assertTrue(cache.peek("agent-1").isEmpty());
    }
    
    @Test
    void testWorksWithoutSharedStore() throws Exception {
        CacheFallback<String> local = CacheFallback.builder("agents", String.class)
            .clock(clock)
            .build();
        
        assertFalse(local.isShared());
        local.getOrFetch("agent-1", () -> "planner");
        assertEquals(Optional.of("planner"), local.get("agent-1"));
    }
    
    @Test
    void testHitAndMissEventsCarryStrategy() throws Exception {
        cache.getOrFetch("agent-1", () -> "planner");
        cache.getOrFetch("agent-1", () -> "planner");
        
        assertEquals(ResilienceEvent.Type.CACHE_MISS, events.get(0).getType());
        assertEquals(ResilienceEvent.Type.CACHE_HIT, events.get(1).getType());
        assertEquals("CACHE_FIRST", events.get(1).getDetail());
        assertEquals("agents", events.get(1).getSource());
    }
    
    @Test
    void testRequestIdScopedToCallAndCallersIdRestored() throws Exception {
        AtomicReference<String> seen = new AtomicReference<>();
        MDC.put("requestId", "http-request-1");
        try {
            cache.getOrFetch("agent-1", () -> {
                seen.set(MDC.get("requestId"));
                return "planner";
            }, null, null, "fetch-agent-1");
            
            assertEquals("fetch-agent-1", seen.get());
            assertEquals("http-request-1", MDC.get("requestId"));
        } finally {
            MDC.remove("requestId");
        }
    }
}
