package com.berrys.resilience.ratelimit;

import com.berrys.resilience.config.RateLimitConfig;
import com.berrys.resilience.error.RateLimitExceededException;
import com.berrys.resilience.model.RateLimitInfo;
import com.berrys.resilience.observability.ResilienceEvent;
import com.berrys.resilience.observability.ResilienceEventListener;
import com.berrys.resilience.store.SharedStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;

/**
 * Tiered sliding-window rate limiter.
 *
 * <p>With a shared store, counts are kept there and apply across processes. Without one, or
 * whenever the store fails, the check is answered from per-process minute counters and the
 * result is flagged as degraded. A check never fails because of the store.
 */
public class RateLimiter {
    
    private static final Logger logger = LoggerFactory.getLogger(RateLimiter.class);
    
    public static final String KEY_PREFIX = "resilience:";
    
    private final RateLimitTiers tiers;
    private final RateLimitBackend shared;
    private final LocalRateLimitBackend local;
    private final Clock clock;
    private final ResilienceEventListener listener;
    
    public RateLimiter(RateLimitTiers tiers) {
        this(tiers, null, Clock.systemUTC(), ResilienceEventListener.NO_OP);
    }
    
    /**
     * @param sharedStore store holding the windows; {@code null} runs on local counters only
     */
    public RateLimiter(RateLimitTiers tiers, SharedStore sharedStore, Clock clock, ResilienceEventListener listener) {
        this.tiers = tiers;
        this.shared = sharedStore != null ? new SharedStoreRateLimitBackend(sharedStore) : null;
        this.local = new LocalRateLimitBackend();
        this.clock = clock;
        this.listener = listener;
    }
    
    /**
     * Records a request for the key and reports whether it is allowed under the tier.
     * Unknown tiers use the default tier.
     */
    public RateLimitInfo check(String key, String tier) {
        RateLimitConfig config = tiers.resolve(tier);
        Instant now = clock.instant();
        String fullKey = KEY_PREFIX + key;
        
        RateLimitInfo info = null;
        if (shared != null) {
            try {
                info = shared.record(fullKey, config, now);
            } catch (RuntimeException e) {
                logger.warn("Rate limit check against shared store failed for {}, using local counters: {}",
                    key, e.getMessage());
                listener.onEvent(ResilienceEvent.of(ResilienceEvent.Type.RATE_LIMIT_DEGRADED, key,
                    e.getClass().getSimpleName(), now));
            }
        }
        if (info == null) {
            info = local.record(fullKey, config, now);
        }
        
        if (!info.isAllowed()) {
            logger.debug("Rate limit exceeded for {} (tier {}, limit {})", key, config.getTier(), config.getRequests());
            listener.onEvent(ResilienceEvent.of(ResilienceEvent.Type.RATE_LIMIT_EXCEEDED, key, config.getTier(), now));
        }
        return info;
    }
    
    /**
     * Same as {@link #check} but signals a denial with an exception.
     *
     * @throws RateLimitExceededException if the request is over the limit
     */
    public RateLimitInfo checkOrThrow(String key, String tier) {
        RateLimitInfo info = check(key, tier);
        if (!info.isAllowed()) {
            throw new RateLimitExceededException(key, info);
        }
        return info;
    }
    
    public RateLimitTiers getTiers() {
        return tiers;
    }
    
    public boolean isDistributed() {
        return shared != null;
    }
}
