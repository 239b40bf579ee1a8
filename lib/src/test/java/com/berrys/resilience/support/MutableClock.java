package com.berrys.resilience.support;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * Clock that only moves when a test advances it.
 */
public class MutableClock extends Clock {
    
    private volatile Instant now;
    
    public MutableClock(Instant start) {
        this.now = start;
    }
    
    public static MutableClock startingAt(long epochSeconds) {
        return new MutableClock(Instant.ofEpochSecond(epochSeconds));
    }
    
    public void advance(Duration duration) {
        now = now.plus(duration);
    }
    
    public void set(Instant instant) {
        now = instant;
    }
    
    @Override
    public ZoneId getZone() {
        return ZoneOffset.UTC;
    }
    
    @Override
    public Clock withZone(ZoneId zone) {
        return this;
    }
    
    @Override
    public Instant instant() {
        return now;
    }
}
