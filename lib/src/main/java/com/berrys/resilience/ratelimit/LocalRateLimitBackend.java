package com.berrys.resilience.ratelimit;

import com.berrys.resilience.config.RateLimitConfig;
import com.berrys.resilience.model.RateLimitInfo;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Per-process approximation of the sliding window using one counter per minute.
 * Only used while the shared store is unavailable, so limits apply per process.
 *
 * <p>Once per minute every key is swept and keys with no request left in their window
 * are dropped, so per-client keys do not accumulate during a long outage.
 */
class LocalRateLimitBackend implements RateLimitBackend {

    private final ConcurrentMap<String, MinuteBuckets> counters = new ConcurrentHashMap<>();
    private final AtomicLong lastSweepMinute = new AtomicLong(Long.MIN_VALUE);

    @Override
    public RateLimitInfo record(String key, RateLimitConfig config, Instant now) {
        long nowSeconds = now.getEpochSecond();
        long currentMinute = Math.floorDiv(nowSeconds, 60);

        sweepIfDue(currentMinute, nowSeconds);

        long[] count = new long[1];
        // compute serializes updates to one key against each other and against the sweep
        counters.compute(key, (k, existing) -> {
            MinuteBuckets buckets = existing != null ? existing : new MinuteBuckets();
            buckets.windowSeconds = config.getWindowSeconds();
            buckets.prune(nowSeconds);
            buckets.increment(currentMinute);
            count[0] = buckets.total();
            return buckets;
        });

        int limit = config.getRequests();
        return new RateLimitInfo(count[0] <= limit, config.getTier(), limit, Math.max(0, limit - count[0]),
            60 - nowSeconds % 60, config.getWindowSeconds(), true);
    }

    private void sweepIfDue(long currentMinute, long nowSeconds) {
        long last = lastSweepMinute.get();
        if (last >= currentMinute || !lastSweepMinute.compareAndSet(last, currentMinute)) {
            return;
        }
        for (String key : counters.keySet()) {
            counters.computeIfPresent(key, (k, buckets) -> {
                buckets.prune(nowSeconds);
                return buckets.isEmpty() ? null : buckets;
            });
        }
    }

    int trackedKeys() {
        return counters.size();
    }

    /**
     * Minute counters of one key. Only touched inside the owning map's compute functions.
     */
    private static final class MinuteBuckets {
        private final Map<Long, Long> counts = new HashMap<>();
        private int windowSeconds;

        void prune(long nowSeconds) {
            long oldestMinute = Math.floorDiv(nowSeconds - windowSeconds, 60);
            counts.keySet().removeIf(minute -> minute < oldestMinute);
        }

        void increment(long minute) {
            counts.merge(minute, 1L, Long::sum);
        }

        long total() {
            long total = 0;
            for (long count : counts.values()) {
                total += count;
            }
            return total;
        }

        boolean isEmpty() {
            return counts.isEmpty();
        }
    }
}
