package com.berrys.resilience.store;

import io.lettuce.core.RedisException;
import io.lettuce.core.ScriptOutputType;
import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.api.sync.RedisCommands;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * {@link SharedStore} backed by a Lettuce connection to Redis.
 * The sliding window runs as a single Lua script so concurrent processes never observe
 * a half-applied update.
 */
public class LettuceSharedStore implements SharedStore, AutoCloseable {
    
    private static final Logger logger = LoggerFactory.getLogger(LettuceSharedStore.class);
    
    static final String SLIDING_WINDOW_SCRIPT =
        "redis.call('ZADD', KEYS[1], ARGV[1], ARGV[2]) " +
        "redis.call('ZREMRANGEBYSCORE', KEYS[1], '-inf', tonumber(ARGV[1]) - tonumber(ARGV[3])) " +
        "local count = redis.call('ZCARD', KEYS[1]) " +
        "redis.call('EXPIRE', KEYS[1], ARGV[4]) " +
        "local oldest = redis.call('ZRANGE', KEYS[1], 0, 0, 'WITHSCORES') " +
        "if oldest[2] then return {count, oldest[2]} end " +
        "return {count}";
    
    private final StatefulRedisConnection<String, String> connection;
    private final RedisCommands<String, String> commands;
    
    public LettuceSharedStore(StatefulRedisConnection<String, String> connection) {
        this.connection = connection;
        this.commands = connection.sync();
    }
    
    @Override
    public Optional<String> get(String key) {
        try {
            return Optional.ofNullable(commands.get(key));
        } catch (RedisException e) {
            throw new SharedStoreException("get", "Failed to read key " + key, e);
        }
    }
    
    @Override
    public void setWithTtl(String key, String value, Duration ttl) {
        // SETEX takes whole seconds and rejects zero
        long seconds = Math.max(1, ttl.getSeconds());
        try {
            commands.setex(key, seconds, value);
        } catch (RedisException e) {
            throw new SharedStoreException("setex", "Failed to write key " + key, e);
        }
    }
    
    @Override
    public SlidingWindowSnapshot slidingWindow(String key, long nowMillis, String member,
                                               long windowMillis, Duration expiry) {
        try {
            List<Object> result = commands.eval(SLIDING_WINDOW_SCRIPT, ScriptOutputType.MULTI,
                new String[]{key},
                String.valueOf(nowMillis), member, String.valueOf(windowMillis),
                String.valueOf(Math.max(1, expiry.getSeconds())));
            
            long count = ((Number) result.get(0)).longValue();
            OptionalLong oldest = result.size() > 1
                ? OptionalLong.of(parseScore(result.get(1)))
                : OptionalLong.empty();
            
            logger.trace("Sliding window {} holds {} entries", key, count);
            return new SlidingWindowSnapshot(count, oldest);
        } catch (RedisException | ClassCastException | NumberFormatException e) {
            throw new SharedStoreException("slidingWindow", "Sliding window update failed for key " + key, e);
        }
    }
    
    private static long parseScore(Object score) {
        if (score instanceof Number) {
            return ((Number) score).longValue();
        }
        // Lua returns sorted-set scores as bulk strings
        return (long) Double.parseDouble(score.toString());
    }
    
    @Override
    public void close() {
        if (connection.isOpen()) {
            connection.close();
            logger.debug("Shared store connection closed");
        }
    }
}
