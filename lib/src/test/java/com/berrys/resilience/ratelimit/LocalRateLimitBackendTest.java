package com.berrys.resilience.ratelimit;

import com.berrys.resilience.config.RateLimitConfig;
import com.berrys.resilience.model.RateLimitInfo;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

class LocalRateLimitBackendTest {
    
    private final LocalRateLimitBackend backend = new LocalRateLimitBackend();
    
    @Test
    void testRecord_CountsAcrossTrailingMinuteBuckets() {
        RateLimitConfig config = RateLimitConfig.of("tiny", 3, 60);
        // 1_700_000_000 is 20 seconds into a minute
        Instant start = Instant.ofEpochSecond(1_700_000_000L);
        
        backend.record("k", config, start);
        backend.record("k", config, start.plusSeconds(30));
        RateLimitInfo third = backend.record("k", config, start.plusSeconds(45));
        assertTrue(third.isAllowed());
        assertEquals(0, third.getRemaining());
        
        RateLimitInfo fourth = backend.record("k", config, start.plusSeconds(50));
        assertFalse(fourth.isAllowed());
        assertTrue(fourth.isDegraded());
        assertEquals(60 - (1_700_000_050L % 60), fourth.getResetSeconds());
    }
    
    @Test
    void testRecord_OldBucketsDropOutOfWindow() {
        RateLimitConfig config = RateLimitConfig.of("tiny", 2, 60);
        Instant start = Instant.ofEpochSecond(1_700_000_000L);
        
        backend.record("k", config, start);
        backend.record("k", config, start);
        assertFalse(backend.record("k", config, start).isAllowed());
        
        assertTrue(backend.record("k", config, start.plusSeconds(180)).isAllowed());
    }
    
    @Test
    void testRecord_IdleKeysAreDroppedOnceTheirWindowPasses() {
        RateLimitConfig config = RateLimitConfig.of("default", 100, 60);
        Instant start = Instant.ofEpochSecond(1_700_000_000L);

        for (int client = 0; client < 50; client++) {
            backend.record(RateLimitKey.forClient("client-" + client, "search", "default"), config, start);
        }
        assertEquals(50, backend.trackedKeys());

        backend.record(RateLimitKey.forClient("client-0", "search", "default"), config, start.plusSeconds(30));
        assertEquals(50, backend.trackedKeys());

        backend.record(RateLimitKey.forClient("late-client", "search", "default"), config, start.plusSeconds(180));

        assertEquals(1, backend.trackedKeys());
    }

    @Test
    void testRecord_SweepKeepsKeysStillInsideTheirWindow() {
        RateLimitConfig shortWindow = RateLimitConfig.of("short", 10, 60);
        RateLimitConfig longWindow = RateLimitConfig.of("long", 10, 600);
        Instant start = Instant.ofEpochSecond(1_700_000_000L);

        backend.record("short-key", shortWindow, start);
        backend.record("long-key", longWindow, start);

        RateLimitInfo next = backend.record("other", shortWindow, start.plusSeconds(180));

        assertTrue(next.isAllowed());
        assertEquals(2, backend.trackedKeys());
        assertEquals(8, backend.record("long-key", longWindow, start.plusSeconds(200)).getRemaining());
    }

    @Test
    void testRecord_SafeUnderConcurrentIncrements() throws Exception {
        RateLimitConfig config = RateLimitConfig.of("bulk", 1000, 60);
        Instant now = Instant.ofEpochSecond(1_700_000_000L);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Callable<RateLimitInfo>> tasks = new ArrayList<>();
            for (int i = 0; i < 800; i++) {
                tasks.add(() -> backend.record("shared", config, now));
            }
            for (Future<RateLimitInfo> future : pool.invokeAll(tasks)) {
                assertTrue(future.get().isAllowed());
            }
        } finally {
            pool.shutdownNow();
        }
        
        assertEquals(199, backend.record("shared", config, now).getRemaining());
    }
}
